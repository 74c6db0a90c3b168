package io.limitgraph.error;

public final class StorageException extends LimitGraphException {
    private final String operation;

    public StorageException(String operation, Throwable cause) {
        super("Storage operation failed: " + operation, cause);
        this.operation = operation;
    }

    public StorageException(String operation, String message) {
        super("Storage operation failed: " + operation + ": " + message);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
