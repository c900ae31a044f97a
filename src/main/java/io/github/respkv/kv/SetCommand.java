package io.github.respkv.kv;

import java.time.Duration;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * SET key value [EX seconds | PX milliseconds]，ttl为null表示不过期。
 */
@Value
@Builder
public class SetCommand implements Command {
    @NonNull
    byte[]   key;
    @NonNull
    byte[]   value;
    Duration ttl;

    @Override
    public Type getType() {
        return Type.SET;
    }
}
