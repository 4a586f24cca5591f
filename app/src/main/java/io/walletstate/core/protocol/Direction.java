package io.walletstate.core.protocol;

public enum Direction {
    RECEIVE(0),
    SEND(1);

    private final int code;

    Direction(int code) {
        this.code = code;
    }

    public int code() { return code; }

    public static Direction fromCode(int code) {
        return code == SEND.code ? SEND : RECEIVE;
    }
}
