package io.walletstate.core.error;

import io.walletstate.core.protocol.State;

public class InvalidTransitionException extends StateException {
    private final State from;
    private final State to;

    public InvalidTransitionException(State from, State to, String reason) {
        super("Illegal transition " + from + " -> " + to + ": " + reason);
        this.from = from;
        this.to = to;
    }

    public State from() { return from; }
    public State to() { return to; }
}
