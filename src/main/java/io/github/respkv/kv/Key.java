package io.github.respkv.kv;

import java.nio.charset.StandardCharsets;

import lombok.EqualsAndHashCode;

/**
 * byte数组不能直接作为map的key，按内容比较。
 */
@EqualsAndHashCode
final class Key {
    private final byte[] bytes;

    static Key of(byte[] bytes) {
        return new Key(bytes.clone());
    }

    private Key(byte[] bytes) {
        this.bytes = bytes;
    }

    @Override
    public String toString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
