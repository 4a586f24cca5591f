package io.walletstate.core.error;

/** Key absent where the operation needs an existing record. */
public class NotFoundException extends StateException {

    public NotFoundException(String message) {
        super(message);
    }
}
