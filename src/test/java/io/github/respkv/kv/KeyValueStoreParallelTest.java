package io.github.respkv.kv;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import com.google.common.base.Ticker;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author zy
 **/
class KeyValueStoreParallelTest {

    @RepeatedTest(5)
    void disjointKeys() {
        KeyValueStore store = new KeyValueStore();
        Stream.iterate(1, (i) -> i + 1).limit(200).parallel()
                .map(i -> {
                    store.set(("key" + i).getBytes(), ("value" + i).getBytes());
                    return i;
                })
                .forEach(i -> assertArrayEquals(("value" + i).getBytes(), store.get(("key" + i).getBytes()).get()));
        assertEquals(200, store.size());
    }

    @RepeatedTest(5)
    void concurrentReadersOfExpiredKey() throws Exception {
        FakeTicker ticker = new FakeTicker();
        KeyValueStore store = new KeyValueStore(ticker);
        for (int i = 0; i < 100; i++) {
            store.set(("k" + i).getBytes(), "v".getBytes(), Duration.ofSeconds(1));
        }
        ticker.advance(Duration.ofSeconds(1));

        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 100; i++) {
                    assertFalse(store.get(("k" + i).getBytes()).isPresent());
                }
                store.sweepExpired();
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(0, store.size());
    }

    /**
     * 读线程拿到过期entry之后、删除之前，另一个线程写入了新值，新值不能被删掉。
     */
    @Test
    void lazyDeleteKeepsValueWrittenInBetween() {
        FakeTicker clock = new FakeTicker();
        KeyValueStore[] holder = new KeyValueStore[1];
        boolean[] armed = {false};
        Ticker ticker = new Ticker() {
            @Override
            public long read() {
                if (armed[0]) {
                    armed[0] = false;
                    holder[0].set("k".getBytes(), "fresh".getBytes());
                }
                return clock.read();
            }
        };
        KeyValueStore store = new KeyValueStore(ticker);
        holder[0] = store;
        store.set("k".getBytes(), "stale".getBytes(), Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        armed[0] = true;
        assertFalse(store.get("k".getBytes()).isPresent());

        assertArrayEquals("fresh".getBytes(), store.get("k".getBytes()).get());
        assertEquals(1, store.size());
    }

    @RepeatedTest(20)
    void concurrentSetSurvivesExpiredReads() throws Exception {
        FakeTicker ticker = new FakeTicker();
        KeyValueStore store = new KeyValueStore(ticker);
        store.set("k".getBytes(), "stale".getBytes(), Duration.ofSeconds(1));
        ticker.advance(Duration.ofSeconds(2));

        ExecutorService executor = Executors.newFixedThreadPool(5);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 1000; i++) {
                    store.get("k".getBytes());
                }
                return null;
            }));
        }
        futures.add(executor.submit(() -> {
            start.await();
            store.set("k".getBytes(), "fresh".getBytes());
            return null;
        }));
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertArrayEquals("fresh".getBytes(), store.get("k".getBytes()).get());
    }
}
