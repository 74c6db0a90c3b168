package io.limitgraph.error;

public final class InvalidConfigException extends LimitGraphException {
    public InvalidConfigException(String message) {
        super(message);
    }

    public InvalidConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
