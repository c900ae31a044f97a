package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.primitives.Bytes;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * RESP3 map类型：<code>%pairs\r\n</code>之后依次是每对的key和value。
 * 只有握手回复会用到。
 * @author zy
 */
@EqualsAndHashCode
@ToString
public class RespMap implements RespData {
    static final char firstChar = '%';

    private final Map<RespData, RespData> entries;

    /**
     * 字符串到字符串的map，key和value都编码为bulk string，保持插入顺序。
     */
    public static RespMap ofStrings(Map<String, String> map) {
        Map<RespData, RespData> entries = new LinkedHashMap<>();
        map.forEach((k, v) -> entries.put(RespBulkString.withUTF8(k), RespBulkString.withUTF8(v)));
        return new RespMap(entries);
    }

    static RespMap with(Map<RespData, RespData> entries) {
        return new RespMap(new LinkedHashMap<>(entries));
    }

    private RespMap(Map<RespData, RespData> entries) {
        this.entries = entries;
    }

    public int size() {
        return entries.size();
    }

    public Map<RespData, RespData> getEntries() {
        return Collections.unmodifiableMap(entries);
    }

    /**
     * 按UTF-8字符串查找值，key和value都需要是bulk或者simple string。
     */
    public String getString(String key) {
        for (Map.Entry<RespData, RespData> e : entries.entrySet()) {
            if (key.equals(text(e.getKey()))) {
                return text(e.getValue());
            }
        }
        return null;
    }

    private static String text(RespData data) {
        if (data instanceof RespBulkString) {
            return ((RespBulkString) data).toUTF8();
        }
        if (data instanceof RespString) {
            return ((RespString) data).getContent();
        }
        return null;
    }

    @Override
    public byte[] toBytes() {
        byte[] bytes = (firstChar + String.valueOf(entries.size()) + "\r\n").getBytes(StandardCharsets.US_ASCII);
        for (Map.Entry<RespData, RespData> e : entries.entrySet()) {
            bytes = Bytes.concat(bytes, e.getKey().toBytes(), e.getValue().toBytes());
        }
        return bytes;
    }
}
