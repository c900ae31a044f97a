package io.github.respkv.server;

import java.io.IOException;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import io.github.respkv.kv.Command;
import io.github.respkv.kv.CommandCodec;
import io.github.respkv.kv.GetCommand;
import io.github.respkv.kv.KeyNotFoundException;
import io.github.respkv.kv.KeyValueStore;
import io.github.respkv.kv.SetCommand;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * 服务端共享状态的唯一执行线程。所有命令，连接建立和断开，定时扫描都作为事件放进同一个队列，
 * 按出队顺序逐个处理完成，连接集合只在该线程内访问，不需要加锁。
 * </p>
 * 命令执行失败（如GET的key不存在，连接已断开）只记录日志，不影响后续事件。
 * 回复通过{@link Peer#send}放进连接自己的发送队列，不会因为某个客户端不读数据而阻塞。
 *
 * @author zy
 */
public class Dispatcher implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

    interface Event {
    }

    @Value
    static class CommandReceived implements Event {
        Peer    peer;
        Command command;
    }

    @Value
    static class PeerConnected implements Event {
        Peer peer;
    }

    @Value
    static class PeerDisconnected implements Event {
        Peer peer;
    }

    private static final Event TICK = new Event() {
        @Override
        public String toString() {
            return "Tick";
        }
    };
    private static final Event STOP = new Event() {
        @Override
        public String toString() {
            return "Stop";
        }
    };

    private final BlockingQueue<Event> inbox;
    private final Set<Peer>            peers = new HashSet<>();
    private final KeyValueStore        store;
    private final CommandCodec         codec = new CommandCodec();
    private final boolean              replyNullOnMiss;
    private volatile int               peerCount;
    private volatile boolean           stopped = false;

    @Builder
    Dispatcher(@NonNull KeyValueStore store, int inboxCapacity, boolean replyNullOnMiss) {
        Preconditions.checkArgument(inboxCapacity > 0, "inbox capacity must be positive");
        this.store = store;
        this.inbox = new ArrayBlockingQueue<>(inboxCapacity);
        this.replyNullOnMiss = replyNullOnMiss;
    }

    void commandReceived(Peer peer, Command command) throws InterruptedException {
        inbox.put(new CommandReceived(peer, command));
    }

    void connected(Peer peer) throws InterruptedException {
        inbox.put(new PeerConnected(peer));
    }

    void disconnected(Peer peer) throws InterruptedException {
        inbox.put(new PeerDisconnected(peer));
    }

    /**
     * 定时器调用，队列满时丢弃本次扫描。
     */
    void tick() {
        if (!inbox.offer(TICK)) {
            logger.debug("dispatcher inbox is full, skip sweep.");
        }
    }

    /**
     * 处理完已入队的事件后退出事件循环，不会关闭已有的连接。队列已满时直接退出。
     */
    void stop() {
        if (!inbox.offer(STOP)) {
            stopped = true;
        }
    }

    /**
     * @return 当前连接数
     */
    int peers() {
        return peerCount;
    }

    @Override
    public void run() {
        logger.info("dispatcher started.");
        while (!stopped) {
            Event event;
            try {
                event = inbox.poll(1, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                logger.info("dispatcher thread interrupted, exit.");
                Thread.currentThread().interrupt();
                return;
            }
            if (event == null) {
                continue;
            }
            if (event == STOP) {
                break;
            }
            handle(event);
        }
        logger.info("dispatcher stopped.");
    }

    private void handle(Event event) {
        try {
            if (event instanceof CommandReceived) {
                CommandReceived msg = (CommandReceived) event;
                execute(msg.getPeer(), msg.getCommand());
            } else if (event instanceof PeerConnected) {
                Peer peer = ((PeerConnected) event).getPeer();
                peers.add(peer);
                peerCount = peers.size();
                logger.info("peer connected, id: {}, remoteAddr: {}.", peer.getId(), peer.getRemoteAddress());
            } else if (event instanceof PeerDisconnected) {
                Peer peer = ((PeerDisconnected) event).getPeer();
                peers.remove(peer);
                peerCount = peers.size();
                logger.info("peer disconnected, id: {}, remoteAddr: {}.", peer.getId(), peer.getRemoteAddress());
            } else if (event == TICK) {
                store.sweepExpired();
            } else {
                logger.error("unknown dispatcher event: {}", event);
            }
        } catch (KeyNotFoundException e) {
            logger.warn("raw message error: {}", e.getMessage());
        } catch (IOException e) {
            logger.warn("reply failed: {}", e.toString());
        } catch (Exception e) {
            logger.error("raw message error.", e);
        }
    }

    private void execute(Peer peer, Command command) throws IOException, KeyNotFoundException {
        switch (command.getType()) {
            case SET:
                SetCommand set = (SetCommand) command;
                store.set(set.getKey(), set.getValue(), set.getTtl());
                peer.send(codec.encodeOk());
                break;
            case GET:
                GetCommand get = (GetCommand) command;
                Optional<byte[]> value = store.get(get.getKey());
                if (value.isPresent()) {
                    peer.send(codec.encodeValue(value.get()));
                } else if (replyNullOnMiss) {
                    peer.send(codec.encodeNil());
                } else {
                    throw new KeyNotFoundException(get.getKey());
                }
                break;
            case HELLO:
                peer.send(codec.encodeHello());
                break;
            case CLIENT:
                peer.send(codec.encodeOk());
                break;
            default:
                throw new IllegalStateException("unknown command type: " + command.getType());
        }
    }
}
