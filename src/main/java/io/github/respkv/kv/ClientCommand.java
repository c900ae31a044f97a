package io.github.respkv.kv;

import lombok.NonNull;
import lombok.Value;

@Value
public class ClientCommand implements Command {
    @NonNull
    String value;

    @Override
    public Type getType() {
        return Type.CLIENT;
    }
}
