package io.walletstate.core.protocol;

/**
 * Supported chains. Codes are persisted and must never be reused.
 */
public enum Blockchain {
    UNSPECIFIED(0),
    BITCOIN(1),
    ETHEREUM(100),
    ETHEREUM_CLASSIC(101),
    MORDEN(10001),
    KOVAN(10002),
    TESTNET_BITCOIN(10003),
    GOERLI(10005),
    ROPSTEN(10006),
    RINKEBY(10007),
    HOLESKY(10008),
    SEPOLIA(10009);

    private final int code;

    Blockchain(int code) {
        this.code = code;
    }

    public int code() { return code; }

    /** Unknown codes (written by a newer schema) read as UNSPECIFIED. */
    public static Blockchain fromCode(int code) {
        for (Blockchain b : values()) {
            if (b.code == code) return b;
        }
        return UNSPECIFIED;
    }
}
