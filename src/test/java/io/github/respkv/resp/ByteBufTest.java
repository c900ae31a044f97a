package io.github.respkv.resp;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ByteBufTest {

    @Test
    void growsWhenFull() {
        ByteBuf buf = ByteBuf.allocate(2);
        buf.writeBytes("hello".getBytes());

        assertTrue(buf.capacity() >= 5);
        assertEquals(5, buf.readableBytes());
        byte[] dst = new byte[5];
        buf.readBytes(dst);
        assertArrayEquals("hello".getBytes(), dst);
        assertFalse(buf.isReadable());
    }

    @Test
    void discardReadBytesKeepsUnread() {
        ByteBuf buf = ByteBuf.allocate(8);
        buf.writeBytes("abcdef".getBytes());
        buf.readByte();
        buf.readByte();

        buf.discardReadBytes();

        assertEquals(0, buf.getReaderIndex());
        assertEquals(4, buf.getWriterIndex());
        assertEquals('c', buf.readByte());
        assertEquals(2, buf.indexOf(buf.getReaderIndex(), buf.getWriterIndex(), (byte) 'e'));
    }

    @Test
    void readBeyondWriterIndexFails() {
        ByteBuf buf = ByteBuf.allocate(4);
        assertThrows(IllegalStateException.class, buf::readByte);
        assertThrows(IndexOutOfBoundsException.class, () -> buf.readBytes(new byte[1]));
    }
}
