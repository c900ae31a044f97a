package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RespInteger extends RespString {
    static final char firstChar = ':';
    @Getter
    private final long n;

    public static RespInteger with(long n) {
        return new RespInteger(n);
    }

    /**
     * @throws NumberFormatException 内容不是整数
     */
    public static RespInteger with(String n) {
        return new RespInteger(Long.parseLong(n));
    }

    private RespInteger(long n) {
        super(String.valueOf(n), StandardCharsets.UTF_8);
        this.n = n;
    }

    @Override
    char getFirstChar() {
        return firstChar;
    }
}
