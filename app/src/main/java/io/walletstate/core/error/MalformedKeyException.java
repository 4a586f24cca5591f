package io.walletstate.core.error;

public class MalformedKeyException extends StateException {

    public MalformedKeyException(String message) {
        super(message);
    }
}
