package io.github.respkv.resp;

import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RespReaderTest {
    private Path path = Paths.get("./resp_reader_file");

    @BeforeEach
    void setUp() throws IOException {
        Files.deleteIfExists(path);
        Files.createFile(path);
    }

    @AfterEach
    void tearDown() throws IOException {
        Files.deleteIfExists(path);
    }

    private void write(RespData... datas) throws IOException {
        try (SeekableByteChannel channel = Files.newByteChannel(path, StandardOpenOption.WRITE)) {
            RespWriter writer = RespWriter.with(channel);
            for (RespData data : datas) {
                writer.append(data);
            }
        }
    }

    @Test
    void readFramesUntilEndOfStream() throws IOException {
        RespArray set = RespArray.with(RespBulkString.withUTF8("SET"), RespBulkString.withUTF8("foo"),
                RespBulkString.withUTF8("bar"));
        RespArray get = RespArray.with(RespBulkString.withUTF8("GET"), RespBulkString.withUTF8("foo"));
        write(set, get);

        try (SeekableByteChannel channel = Files.newByteChannel(path)) {
            RespReader reader = RespReader.with(channel);
            assertEquals(Optional.of(set), reader.read());
            assertEquals(Optional.of(get), reader.read());
            assertEquals(Optional.empty(), reader.read());
        }
    }

    @Test
    void readLargeBulkString() throws IOException {
        byte[] big = new byte[20000];
        for (int i = 0; i < big.length; i++) {
            big[i] = (byte) i;
        }
        write(RespBulkString.with(big));

        try (SeekableByteChannel channel = Files.newByteChannel(path)) {
            RespBulkString bs = (RespBulkString) RespReader.with(channel).read().get();
            assertArrayEquals(big, bs.getContent());
        }
    }

    @Test
    void emptyStreamIsOrderlyClose() throws IOException {
        try (SeekableByteChannel channel = Files.newByteChannel(path)) {
            assertFalse(RespReader.with(channel).read().isPresent());
        }
    }

    @Test
    void truncatedFrameFails() throws IOException {
        Files.write(path, "*2\r\n$3\r\nGET\r\n$3\r\nfo".getBytes());

        try (SeekableByteChannel channel = Files.newByteChannel(path)) {
            assertThrows(RespDecodeException.class, () -> RespReader.with(channel).read());
        }
    }
}
