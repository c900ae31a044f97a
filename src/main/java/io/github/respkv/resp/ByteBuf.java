package io.github.respkv.resp;

import java.nio.ByteBuffer;
import java.util.Arrays;

import com.google.common.base.Preconditions;
import lombok.Getter;

/**
 * 读写位置独立的字节缓冲，不用考虑flip和rewind。
 * 长连接上会不断写入数据，已读部分通过{@link #discardReadBytes()}回收。
 * @author zy
 */
class ByteBuf {
    private byte[] buf;
    @Getter
    private int    readerIndex;
    @Getter
    private int    writerIndex;

    private ByteBuf(int capacity) {
        buf = new byte[capacity];
    }

    static ByteBuf allocate(int capacity) {
        return new ByteBuf(capacity);
    }

    int writableBytes() {
        return buf.length - writerIndex;
    }

    ByteBuf writeBytes(ByteBuffer bb) {
        int n = bb.remaining();
        ensureWritable(n);
        bb.get(buf, writerIndex, n);
        writerIndex += n;
        return this;
    }

    ByteBuf writeBytes(byte[] bytes) {
        ensureWritable(bytes.length);
        System.arraycopy(bytes, 0, buf, writerIndex, bytes.length);
        writerIndex += bytes.length;
        return this;
    }

    boolean isReadable() {
        return readerIndex < writerIndex;
    }

    int readableBytes() {
        return writerIndex - readerIndex;
    }

    /**
     * @throws IllegalStateException 没有可读数据
     */
    byte readByte() {
        Preconditions.checkState(readerIndex < writerIndex, "no readable bytes");
        return buf[readerIndex++];
    }

    /**
     * @throws IndexOutOfBoundsException 没有足够数据填充数组
     */
    ByteBuf readBytes(byte[] bytes) {
        if (bytes.length > readableBytes()) {
            throw new IndexOutOfBoundsException();
        }
        System.arraycopy(buf, readerIndex, bytes, 0, bytes.length);
        readerIndex += bytes.length;
        return this;
    }

    byte getByte(int index) {
        return buf[index];
    }

    /**
     * @return 从fromIndex到toIndex之间第一个value的索引，没有返回-1
     */
    int indexOf(int fromIndex, int toIndex, byte value) {
        for (int i = fromIndex; i < toIndex; i++) {
            if (buf[i] == value) {
                return i;
            }
        }
        return -1;
    }

    int capacity() {
        return buf.length;
    }

    /**
     * 丢弃已读数据，未读数据移动到缓冲区头部。
     */
    void discardReadBytes() {
        if (readerIndex == 0) {
            return;
        }
        int readable = readableBytes();
        System.arraycopy(buf, readerIndex, buf, 0, readable);
        readerIndex = 0;
        writerIndex = readable;
    }

    private void ensureWritable(int n) {
        if (writableBytes() < n) {
            buf = Arrays.copyOf(buf, buf.length * 2 + n);
        }
    }
}
