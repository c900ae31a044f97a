package io.github.respkv.kv;

import lombok.Getter;

public class UnknownCommandException extends Exception {
    private static final long serialVersionUID = 5712398450137726091L;
    @Getter
    private final String command;

    public UnknownCommandException(String command) {
        super("unknown command: " + command);
        this.command = command;
    }
}
