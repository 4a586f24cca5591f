package io.walletstate.core.error;

/** Pagination token that is corrupt, truncated or issued for another listing. */
public class MalformedCursorException extends StateException {

    public MalformedCursorException(String message) {
        super(message);
    }

    public MalformedCursorException(String message, Throwable cause) {
        super(message, cause);
    }
}
