package io.github.respkv.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.respkv.kv.KeyValueStore;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 监听指定地址，每个连接由一个{@link Peer}读线程和一个写线程处理，命令统一交给{@link Dispatcher}线程执行。
 * 另有一个定时线程驱动过期key的扫描。
 *
 * @author zy
 */
public class KeyValueServer {
    private static final Logger logger = LoggerFactory.getLogger(KeyValueServer.class);

    private final    ServerConfig             config;
    @Getter(AccessLevel.PACKAGE)
    private final    KeyValueStore            store;
    @Getter(AccessLevel.PACKAGE)
    private          Dispatcher               dispatcher;
    // 实际监听地址，配置端口为0时由系统分配
    @Getter
    private volatile InetSocketAddress        socketAddress;
    private volatile boolean                  started = false;
    private          ServerSocketChannel      serverSocketChannel;
    private          ExecutorService          peerExecutor;
    private          ScheduledExecutorService sweepTimer;
    private          Thread                   dispatcherThread;
    private          Thread                   acceptThread;

    @Builder
    public KeyValueServer(@NonNull ServerConfig config, KeyValueStore store) {
        this.config = config;
        this.store = store == null ? new KeyValueStore() : store;
    }

    /**
     * @throws IOException 无法监听指定地址
     */
    public synchronized void start() throws IOException {
        if (started) {
            throw new IllegalStateException("already started");
        }
        serverSocketChannel = ServerSocketChannel.open();
        serverSocketChannel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
        serverSocketChannel.configureBlocking(true);
        try {
            serverSocketChannel.bind(config.getListenAddress());
        } catch (IOException e) {
            serverSocketChannel.close();
            throw e;
        }
        socketAddress = (InetSocketAddress) serverSocketChannel.getLocalAddress();

        dispatcher = Dispatcher.builder()
                .store(store)
                .inboxCapacity(config.getInboxCapacity())
                .replyNullOnMiss(config.isReplyNullOnMiss())
                .build();
        dispatcherThread = new Thread(dispatcher, "respkv-dispatcher");
        dispatcherThread.start();

        sweepTimer = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("respkv-sweep").setDaemon(true).build());
        sweepTimer.scheduleAtFixedRate(dispatcher::tick,
                config.getSweepIntervalMs(), config.getSweepIntervalMs(), TimeUnit.MILLISECONDS);

        peerExecutor = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder().setNameFormat("respkv-peer-%d").setDaemon(true).build());

        started = true;
        acceptThread = new Thread(this::acceptLoop, "respkv-accept");
        acceptThread.start();
        logger.info("respkv server running, listenAddr: {}.", socketAddress);
    }

    private void acceptLoop() {
        while (started) {
            SocketChannel channel;
            try {
                channel = serverSocketChannel.accept();
            } catch (ClosedChannelException e) {
                logger.info("server socket closed, accept loop exit.");
                return;
            } catch (IOException e) {
                logger.error("accept error.", e);
                continue;
            }

            try {
                peerExecutor.execute(new Peer(channel, channel.getRemoteAddress(), dispatcher, peerExecutor,
                        config.getMaxOutputBytes()));
            } catch (RejectedExecutionException | IOException e) {
                logger.error("can't handle new connection.", e);
                try {
                    channel.close();
                } catch (IOException ce) {
                    logger.warn("close rejected connection failed.", ce);
                }
            }
        }
    }

    /**
     * 停止监听和事件循环。已建立的连接不会被强制关闭。
     */
    public synchronized void shutdown() throws IOException {
        if (!started) {
            return;
        }
        started = false;
        serverSocketChannel.close();
        dispatcher.stop();
        sweepTimer.shutdownNow();
        peerExecutor.shutdown();
        try {
            acceptThread.join(TimeUnit.SECONDS.toMillis(5));
            dispatcherThread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("respkv server stopped, listenAddr: {}.", socketAddress);
    }
}
