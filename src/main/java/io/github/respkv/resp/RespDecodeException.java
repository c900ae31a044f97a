package io.github.respkv.resp;

import java.io.IOException;

/**
 * 收到的字节流不是合法的RESP数据，或者数据帧被截断。
 * @author zy
 */
public class RespDecodeException extends IOException {
    private static final long serialVersionUID = 3190477026345120513L;

    public RespDecodeException(String message) {
        super(message);
    }

    public RespDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
