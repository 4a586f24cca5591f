package io.walletstate.core.protocol;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Latest known balance of one asset on one address. UTXO detail is optional and only used
 * for bitcoin-like chains.
 */
public final class Balance {
    private final String address;
    private final long timestamp;
    private final Blockchain blockchain;
    private final String asset;
    private final BigInteger amount;
    private final List<Utxo> utxo;

    public Balance(String address, long timestamp, Blockchain blockchain, String asset,
                   BigInteger amount, List<Utxo> utxo) {
        this.address = Objects.requireNonNull(address, "address");
        this.timestamp = timestamp;
        this.blockchain = Objects.requireNonNull(blockchain, "blockchain");
        this.asset = Objects.requireNonNull(asset, "asset");
        this.amount = Objects.requireNonNull(amount, "amount");
        this.utxo = utxo == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(utxo));
        if (amount.signum() < 0) throw new IllegalArgumentException("amount must be >= 0");
        if (timestamp < 0) throw new IllegalArgumentException("timestamp must be >= 0");
    }

    public Balance(String address, long timestamp, Blockchain blockchain, String asset, BigInteger amount) {
        this(address, timestamp, blockchain, asset, amount, null);
    }

    public String address() { return address; }
    public long timestamp() { return timestamp; }
    public Blockchain blockchain() { return blockchain; }
    public String asset() { return asset; }
    public BigInteger amount() { return amount; }
    public List<Utxo> utxo() { return utxo; }

    public boolean hasUtxo() {
        return !utxo.isEmpty();
    }

    public BigInteger utxoTotal() {
        BigInteger sum = BigInteger.ZERO;
        for (Utxo u : utxo) {
            sum = sum.add(BigInteger.valueOf(u.amount()));
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Balance)) return false;
        Balance b = (Balance) o;
        return timestamp == b.timestamp
                && address.equals(b.address)
                && blockchain == b.blockchain
                && asset.equals(b.asset)
                && amount.equals(b.amount)
                && utxo.equals(b.utxo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, timestamp, blockchain, asset, amount, utxo);
    }

    @Override
    public String toString() {
        return "Balance{" + address + " " + blockchain + " " + asset + "=" + amount + " @" + timestamp + "}";
    }
}
