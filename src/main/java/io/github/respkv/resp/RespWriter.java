package io.github.respkv.resp;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;

public class RespWriter {
    private final WritableByteChannel byteChannel;

    public static RespWriter with(WritableByteChannel byteChannel) {
        return new RespWriter(byteChannel);
    }

    private RespWriter(WritableByteChannel byteChannel) {
        this.byteChannel = byteChannel;
    }

    public void append(RespData respData) throws IOException {
        append(respData.toByteBuffer());
    }

    /**
     * 写入已编码的数据帧，阻塞到全部写完。
     */
    public void append(ByteBuffer src) throws IOException {
        while (src.hasRemaining()) {
            byteChannel.write(src);
        }
    }
}
