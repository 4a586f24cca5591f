package io.walletstate.core.protocol;

public enum ChangeType {
    UNSPECIFIED(0),
    TRANSFER(1),
    FEE(2);

    private final int code;

    ChangeType(int code) {
        this.code = code;
    }

    public int code() { return code; }

    public static ChangeType fromCode(int code) {
        for (ChangeType t : values()) {
            if (t.code == code) return t;
        }
        return UNSPECIFIED;
    }
}
