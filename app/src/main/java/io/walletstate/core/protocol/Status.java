package io.walletstate.core.protocol;

/** Execution result reported by the chain. */
public enum Status {
    UNKNOWN(0),
    OK(1),
    FAILED(2);

    private final int code;

    Status(int code) {
        this.code = code;
    }

    public int code() { return code; }

    public static Status fromCode(int code) {
        for (Status s : values()) {
            if (s.code == code) return s;
        }
        return UNKNOWN;
    }
}
