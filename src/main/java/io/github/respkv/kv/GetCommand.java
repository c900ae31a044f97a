package io.github.respkv.kv;

import lombok.NonNull;
import lombok.Value;

@Value
public class GetCommand implements Command {
    @NonNull
    byte[] key;

    @Override
    public Type getType() {
        return Type.GET;
    }
}
