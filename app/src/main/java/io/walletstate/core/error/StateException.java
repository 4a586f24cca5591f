package io.walletstate.core.error;

/**
 * Base of every error raised by the state stores.
 * Unchecked: callers decide which conditions they retry.
 */
public class StateException extends RuntimeException {

    public StateException(String message) {
        super(message);
    }

    public StateException(String message, Throwable cause) {
        super(message, cause);
    }
}
