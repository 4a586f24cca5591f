package io.walletstate.core.protocol;

import java.util.Objects;

/**
 * One movement of value inside a transaction, attributed to a wallet entry when known.
 * The amount is always non-negative; {@link #direction()} carries the sign.
 * <p>
 * Entry ids are unsigned 32-bit on the wire but held in an {@code int}: ids from 0 to
 * {@link Integer#MAX_VALUE} are accepted, negative ones are rejected.
 */
public final class Change {

    private final String walletId;
    private final int entryId;
    private final String address;
    private final String hdPath;
    private final String asset;
    private final String amount;
    private final ChangeType changeType;
    private final Direction direction;

    private Change(Builder b) {
        this.walletId = b.walletId == null ? "" : b.walletId;
        this.entryId = b.entryId;
        this.address = b.address == null ? "" : b.address;
        this.hdPath = b.hdPath == null ? "" : b.hdPath;
        this.asset = b.asset == null ? "" : b.asset;
        this.amount = Amounts.normalize(b.amount == null ? "0" : b.amount);
        this.changeType = b.changeType == null ? ChangeType.UNSPECIFIED : b.changeType;
        this.direction = b.direction == null ? Direction.RECEIVE : b.direction;
        if (entryId < 0) throw new IllegalArgumentException("entryId must be >= 0");
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .walletId(walletId)
                .entryId(entryId)
                .address(address)
                .hdPath(hdPath)
                .asset(asset)
                .amount(amount)
                .changeType(changeType)
                .direction(direction);
    }

    public static final class Builder {
        private String walletId;
        private int entryId;
        private String address;
        private String hdPath;
        private String asset;
        private String amount;
        private ChangeType changeType;
        private Direction direction;

        public Builder walletId(String v) { this.walletId = v; return this; }
        public Builder entryId(int v) { this.entryId = v; return this; }
        public Builder address(String v) { this.address = v; return this; }
        public Builder hdPath(String v) { this.hdPath = v; return this; }
        public Builder asset(String v) { this.asset = v; return this; }
        public Builder amount(String v) { this.amount = v; return this; }
        public Builder changeType(ChangeType v) { this.changeType = v; return this; }
        public Builder direction(Direction v) { this.direction = v; return this; }

        public Change build() { return new Change(this); }
    }

    public String walletId() { return walletId; }
    public int entryId() { return entryId; }
    public String address() { return address; }
    public String hdPath() { return hdPath; }
    public String asset() { return asset; }
    public String amount() { return amount; }
    public ChangeType changeType() { return changeType; }
    public Direction direction() { return direction; }

    public boolean hasWallet() {
        return !walletId.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Change)) return false;
        Change c = (Change) o;
        return entryId == c.entryId
                && walletId.equals(c.walletId)
                && address.equals(c.address)
                && hdPath.equals(c.hdPath)
                && asset.equals(c.asset)
                && amount.equals(c.amount)
                && changeType == c.changeType
                && direction == c.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(walletId, entryId, address, hdPath, asset, amount, changeType, direction);
    }

    @Override
    public String toString() {
        return "Change{" + changeType + " " + direction + " " + amount + " " + asset
                + " address=" + address + " wallet=" + walletId + "/" + entryId + "}";
    }
}
