package io.github.respkv.server;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ByteChannel;
import java.nio.channels.ClosedChannelException;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Preconditions;
import io.github.respkv.kv.Command;
import io.github.respkv.kv.CommandCodec;
import io.github.respkv.kv.MalformedCommandException;
import io.github.respkv.kv.UnknownCommandException;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespDecodeException;
import io.github.respkv.resp.RespReader;
import io.github.respkv.resp.RespWriter;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * 一个客户端连接。在自己的线程里逐个解码命令交给{@link Dispatcher}。
 * 回复先放进本连接的发送队列，由本连接的写线程按顺序写出，{@link #send(RespData)}不会阻塞调用方。
 * 客户端不读回复时，未写出的字节数超过上限就断开该连接。
 * </p>
 * 无论读循环以何种方式结束，都会关闭channel并通知一次{@link Dispatcher#disconnected(Peer)}。
 *
 * @author zy
 */
public class Peer implements Runnable {
    private static final Logger     logger = LoggerFactory.getLogger(Peer.class);
    private static final AtomicLong ids    = new AtomicLong();
    // 写线程的退出标记
    private static final ByteBuffer CLOSED = ByteBuffer.allocate(0);

    @Getter
    private final long                      id;
    @Getter
    private final SocketAddress             remoteAddress;
    private final ByteChannel               channel;
    private final Dispatcher                dispatcher;
    private final Executor                  writerExecutor;
    private final long                      maxOutputBytes;
    private final RespReader                reader;
    private final RespWriter                writer;
    private final CommandCodec              codec        = new CommandCodec();
    private final BlockingQueue<ByteBuffer> outbox       = new LinkedBlockingQueue<>();
    private final AtomicLong                pendingBytes = new AtomicLong();
    private final AtomicBoolean             closed       = new AtomicBoolean(false);

    Peer(ByteChannel channel, SocketAddress remoteAddress, Dispatcher dispatcher, Executor writerExecutor,
         long maxOutputBytes) {
        Preconditions.checkArgument(maxOutputBytes > 0, "max output bytes must be positive");
        this.id = ids.incrementAndGet();
        this.channel = channel;
        this.remoteAddress = remoteAddress;
        this.dispatcher = dispatcher;
        this.writerExecutor = writerExecutor;
        this.maxOutputBytes = maxOutputBytes;
        this.reader = RespReader.with(channel);
        this.writer = RespWriter.with(channel);
    }

    @Override
    public void run() {
        try {
            dispatcher.connected(this);
            writerExecutor.execute(this::writeLoop);
            readLoop();
        } catch (RejectedExecutionException e) {
            logger.error("can't start writer for peer {}.", this, e);
        } catch (InterruptedException e) {
            logger.info("peer {} interrupted, exit.", this);
            Thread.currentThread().interrupt();
        } finally {
            close();
            try {
                dispatcher.disconnected(this);
            } catch (InterruptedException e) {
                logger.warn("peer {} interrupted before disconnect notification.", this);
                Thread.currentThread().interrupt();
            }
        }
    }

    private void readLoop() throws InterruptedException {
        for (; ; ) {
            try {
                Optional<RespData> frame = reader.read();
                if (!frame.isPresent()) {
                    return;
                }
                Command cmd = codec.decode(frame.get());
                dispatcher.commandReceived(this, cmd);
            } catch (UnknownCommandException e) {
                logger.warn("got unhandled command {} from {}.", e.getCommand(), this);
            } catch (RespDecodeException | MalformedCommandException e) {
                logger.error("peer read error, peer: {}.", this, e);
                return;
            } catch (IOException e) {
                if (closed.get()) {
                    logger.info("peer {} closed.", this);
                } else {
                    logger.error("peer connection failed, peer: {}.", this, e);
                }
                return;
            }
        }
    }

    private void writeLoop() {
        try {
            for (; ; ) {
                ByteBuffer buf = outbox.take();
                if (buf == CLOSED) {
                    return;
                }
                int n = buf.remaining();
                writer.append(buf);
                pendingBytes.addAndGet(-n);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
        } catch (IOException e) {
            if (!closed.get()) {
                logger.error("peer write error, peer: {}.", this, e);
            }
            close();
        }
    }

    /**
     * 回复放入发送队列后立即返回。
     *
     * @throws ClosedChannelException 连接已关闭
     * @throws IOException            未写出的回复超过上限，连接已被关闭
     */
    public void send(RespData data) throws IOException {
        if (closed.get()) {
            throw new ClosedChannelException();
        }
        ByteBuffer buf = data.toByteBuffer();
        long pending = pendingBytes.addAndGet(buf.remaining());
        if (pending > maxOutputBytes) {
            logger.warn("peer {} has {} bytes of unsent replies, limit {}, disconnect.", this, pending, maxOutputBytes);
            close();
            throw new IOException("output backlog exceeded: " + this);
        }
        outbox.add(buf);
    }

    /**
     * @return 已放入发送队列但还没写出的字节数
     */
    long pendingBytes() {
        return pendingBytes.get();
    }

    private void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        outbox.clear();
        outbox.add(CLOSED);
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("close peer {} failed.", this, e);
        }
    }

    @Override
    public String toString() {
        return "Peer(" + id + ", " + remoteAddress + ")";
    }
}
