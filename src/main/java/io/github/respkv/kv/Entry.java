package io.github.respkv.kv;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 值和可选的绝对过期时间（{@link com.google.common.base.Ticker}纳秒）。
 * 每次set都生成新的Entry，不做原地修改。
 */
@Getter(AccessLevel.PACKAGE)
@AllArgsConstructor(access = AccessLevel.PACKAGE)
final class Entry {
    static final long NO_EXPIRE = Long.MAX_VALUE;

    private final byte[] value;
    private final long   expireAtNanos;

    boolean hasExpire() {
        return expireAtNanos != NO_EXPIRE;
    }

    boolean isExpired(long nowNanos) {
        return hasExpire() && expireAtNanos - nowNanos <= 0;
    }
}
