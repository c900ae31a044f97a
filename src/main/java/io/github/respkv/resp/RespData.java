package io.github.respkv.resp;

import java.nio.ByteBuffer;

/**
 * 一个完整的RESP数据帧。
 * @author zy
 */
public interface RespData {

    byte[] toBytes();

    default ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(toBytes());
    }
}
