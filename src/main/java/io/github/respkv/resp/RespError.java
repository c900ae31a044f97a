package io.github.respkv.resp;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 服务端不会返回错误帧，解码时仍然识别该类型。
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RespError extends RespString {
    static final char firstChar = '-';

    public static RespError withUTF8(String msg) {
        return new RespError(msg, StandardCharsets.UTF_8);
    }

    public RespError(String content, Charset charset) {
        super(content, charset);
    }

    @Override
    char getFirstChar() {
        return firstChar;
    }
}
