package io.github.respkv.resp;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.util.Optional;

/**
 * 阻塞读取：从channel读取数据直到解码出一个完整的数据帧。
 * 一次读到的多个数据帧保存在{@link RespDecoder}中，下次调用直接返回。
 * @author zy
 */
public class RespReader {
    private final ReadableByteChannel channel;
    private final ByteBuffer          bb;
    private final RespDecoder         decoder = RespDecoder.create();

    public static RespReader with(ReadableByteChannel channel) {
        return new RespReader(channel, 4096);
    }

    private RespReader(ReadableByteChannel channel, int bufferSize) {
        this.channel = channel;
        this.bb = ByteBuffer.allocate(bufferSize);
    }

    /**
     * @return 下一个数据帧，对端在两个数据帧之间关闭连接时返回empty
     * @throws RespDecodeException 数据不合法，或者连接在数据帧中间关闭
     * @throws IOException         读取失败
     */
    public Optional<RespData> read() throws IOException {
        for (; ; ) {
            RespData data = decoder.get();
            if (data != null) {
                return Optional.of(data);
            }

            bb.clear();
            int n = channel.read(bb);
            if (n == -1) {
                if (decoder.hasPartialFrame()) {
                    throw new RespDecodeException("end of stream inside a frame");
                }
                return Optional.empty();
            }
            bb.flip();
            decoder.decode(bb);
        }
    }
}
