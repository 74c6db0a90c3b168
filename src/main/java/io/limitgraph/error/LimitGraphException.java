package io.limitgraph.error;

/**
 * Base type for every per-operation failure raised by the governance and RD core.
 *
 * <p>None of these are fatal to the process; callers decide whether to surface, retry or
 * record them.
 */
public abstract class LimitGraphException extends RuntimeException {
    protected LimitGraphException(String message) {
        super(message);
    }

    protected LimitGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
