package io.github.respkv.kv;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.math.LongMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * 内存kv存储，key和value都是字节数组，每个key可以设置过期时间。
 * 过期的key对读请求表现为不存在，两种方式删除：
 * <ul>
 * <li>读到过期的key时顺便删除。</li>
 * <li>定时{@link #sweepExpired() 扫描}删除，没有读请求的过期key也不会一直占用内存。</li>
 * </ul>
 * 写操作和扫描持有写锁，读操作持有读锁，删除过期key时换成写锁并再次确认。
 * </p>
 *
 * @author zy
 */
public class KeyValueStore {
    private static final Logger logger = LoggerFactory.getLogger(KeyValueStore.class);

    private final Map<Key, Entry> data = new HashMap<>();
    private final ReadWriteLock   lock = new ReentrantReadWriteLock();
    private final Ticker          ticker;

    public KeyValueStore() {
        this(Ticker.systemTicker());
    }

    public KeyValueStore(Ticker ticker) {
        this.ticker = Preconditions.checkNotNull(ticker);
    }

    static final Duration MAX_TTL = Duration.ofNanos(Long.MAX_VALUE);

    /**
     * 覆盖写入。ttl为null或0时清除之前的过期时间，超出纳秒时钟范围的ttl视为永不过期。
     */
    public void set(byte[] key, byte[] value, Duration ttl) {
        Preconditions.checkNotNull(key);
        Preconditions.checkNotNull(value);
        Preconditions.checkArgument(ttl == null || !ttl.isNegative(), "negative ttl: %s", ttl);

        long expireAt = Entry.NO_EXPIRE;
        if (ttl != null && !ttl.isZero()) {
            long ttlNanos = ttl.compareTo(MAX_TTL) >= 0 ? Long.MAX_VALUE : ttl.toNanos();
            expireAt = LongMath.saturatedAdd(ticker.read(), ttlNanos);
        }
        Entry entry = new Entry(value.clone(), expireAt);

        lock.writeLock().lock();
        try {
            data.put(Key.of(key), entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void set(byte[] key, byte[] value) {
        set(key, value, null);
    }

    public Optional<byte[]> get(byte[] key) {
        Key k = Key.of(key);
        Entry entry;
        lock.readLock().lock();
        try {
            entry = data.get(k);
        } finally {
            lock.readLock().unlock();
        }

        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isExpired(ticker.read())) {
            return Optional.of(entry.getValue().clone());
        }

        lock.writeLock().lock();
        try {
            // 只删除读到的这个entry，期间被重新set或者已被其他线程删除时什么也不做
            data.remove(k, entry);
        } finally {
            lock.writeLock().unlock();
        }
        return Optional.empty();
    }

    /**
     * @return key是否存在（包括已过期但还没删除的）
     */
    public boolean delete(byte[] key) {
        lock.writeLock().lock();
        try {
            return data.remove(Key.of(key)) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return 删除的过期key数量
     */
    public int sweepExpired() {
        int removed = 0;
        lock.writeLock().lock();
        try {
            long now = ticker.read();
            Iterator<Entry> it = data.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) {
            logger.debug("swept {} expired keys.", removed);
        }
        return removed;
    }

    /**
     * @return 实际保存的key数量，包括还没被删除的过期key
     */
    public int size() {
        lock.readLock().lock();
        try {
            return data.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
