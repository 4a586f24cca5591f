package io.walletstate.core.error;

public class MalformedValueException extends StateException {

    public MalformedValueException(String message) {
        super(message);
    }

    public MalformedValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
