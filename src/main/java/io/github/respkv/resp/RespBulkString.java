package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;

import com.google.common.primitives.Bytes;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 二进制安全字符串，content为null时表示null bulk string（$-1）。
 */
@EqualsAndHashCode
@ToString
public class RespBulkString implements RespData {
    static final char firstChar = '$';

    private static final RespBulkString NULL = new RespBulkString(null);
    @Getter
    private final int    length;
    @Getter
    private final byte[] content;

    public static RespBulkString with(byte[] content) {
        return new RespBulkString(content);
    }

    public static RespBulkString withUTF8(String content) {
        return new RespBulkString(content.getBytes(StandardCharsets.UTF_8));
    }

    public static RespBulkString nullBulkString() {
        return NULL;
    }

    private RespBulkString(byte[] content) {
        this.content = content;
        this.length = content == null ? -1 : content.length;
    }

    public boolean isNull() {
        return content == null;
    }

    public String toUTF8() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public byte[] toBytes() {
        byte[] header = (firstChar + String.valueOf(length) + "\r\n").getBytes(StandardCharsets.US_ASCII);
        if (content == null) {
            return header;
        }
        return Bytes.concat(header, content, "\r\n".getBytes(StandardCharsets.US_ASCII));
    }
}
