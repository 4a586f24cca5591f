package io.walletstate.core.error;

/** Failure reported by the underlying key-value engine. */
public class StorageException extends StateException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
