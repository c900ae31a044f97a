package io.github.respkv.kv;

import lombok.NonNull;
import lombok.Value;

/**
 * 握手命令，value一般是客户端请求的协议版本。
 */
@Value
public class HelloCommand implements Command {
    @NonNull
    String value;

    @Override
    public Type getType() {
        return Type.HELLO;
    }
}
