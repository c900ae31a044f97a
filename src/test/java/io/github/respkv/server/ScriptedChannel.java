package io.github.respkv.server;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousCloseException;
import java.nio.channels.ByteChannel;
import java.nio.channels.ClosedChannelException;

/**
 * 读到预设的字节后返回end of stream，写入的数据保存下来。
 * holdOpen为true时读完预设字节后一直阻塞，直到channel被关闭，模拟不再发命令的客户端。
 */
class ScriptedChannel implements ByteChannel {
    private final ByteBuffer            input;
    private final boolean               holdOpen;
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private volatile boolean            open   = true;

    ScriptedChannel(byte[] input) {
        this(input, false);
    }

    ScriptedChannel(byte[] input, boolean holdOpen) {
        this.input = ByteBuffer.wrap(input);
        this.holdOpen = holdOpen;
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        if (!open) {
            throw new ClosedChannelException();
        }
        if (!input.hasRemaining()) {
            if (!holdOpen) {
                return -1;
            }
            synchronized (this) {
                while (open) {
                    try {
                        wait();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new AsynchronousCloseException();
                    }
                }
            }
            throw new AsynchronousCloseException();
        }
        int n = Math.min(dst.remaining(), input.remaining());
        for (int i = 0; i < n; i++) {
            dst.put(input.get());
        }
        return n;
    }

    @Override
    public synchronized int write(ByteBuffer src) throws IOException {
        if (!open) {
            throw new ClosedChannelException();
        }
        int n = src.remaining();
        while (src.hasRemaining()) {
            output.write(src.get());
        }
        return n;
    }

    synchronized byte[] written() {
        return output.toByteArray();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public synchronized void close() {
        open = false;
        notifyAll();
    }
}
