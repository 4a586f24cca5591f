package io.walletstate.core.protocol;

/**
 * Transaction lifecycle. A code written by a newer schema reads as {@link #UNKNOWN}; such a
 * transaction can be read but the state machine never moves it.
 */
public enum State {
    UNKNOWN(-1),
    PREPARED(0),
    SUBMITTED(10),
    REPLACED(11),
    CONFIRMED(12),
    DROPPED(20);

    private final int code;

    State(int code) {
        this.code = code;
    }

    public int code() { return code; }

    public boolean isTerminal() {
        return this == REPLACED || this == DROPPED;
    }

    public static State fromCode(int code) {
        for (State s : values()) {
            if (s.code == code) return s;
        }
        return UNKNOWN;
    }
}
