package io.github.respkv.kv;

/**
 * 解码后的客户端命令，不可变，不包含连接信息。
 * @author zy
 */
public interface Command {

    enum Type {
        SET,
        GET,
        HELLO,
        CLIENT
    }

    Type getType();
}
