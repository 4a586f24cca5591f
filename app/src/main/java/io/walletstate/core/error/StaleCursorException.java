package io.walletstate.core.error;

/** Pagination token older than the store's horizon; restart from the first page. */
public class StaleCursorException extends StateException {

    public StaleCursorException(String message) {
        super(message);
    }
}
