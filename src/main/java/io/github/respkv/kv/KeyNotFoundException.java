package io.github.respkv.kv;

import java.nio.charset.StandardCharsets;

/**
 * key不存在或者已经过期。
 */
public class KeyNotFoundException extends Exception {
    private static final long serialVersionUID = -6409157734561839121L;

    public KeyNotFoundException(byte[] key) {
        super("key not found or expired: " + new String(key, StandardCharsets.UTF_8));
    }
}
