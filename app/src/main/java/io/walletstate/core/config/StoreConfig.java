package io.walletstate.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/** Tunables for the wallet state stores. */
public final class StoreConfig {
    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Cursors older than this are rejected as stale. */
    public final Duration cursorMaxAge;
    /** TTL applied to allowances stored with ttl = 0. */
    public final Duration defaultAllowanceTtl;
    /** Upper bound for any allowance TTL. */
    public final Duration maxAllowanceTtl;
    /** Largest page a listing returns; larger requests are clamped. */
    public final int maxPageSize;
    /** Number of lock stripes guarding read-check-write of one record. */
    public final int lockStripes;
    /** fsync every committed batch (RocksDB only). */
    public final boolean syncWrites;

    public StoreConfig(Duration cursorMaxAge, Duration defaultAllowanceTtl, Duration maxAllowanceTtl,
                       int maxPageSize, int lockStripes, boolean syncWrites) {
        if (cursorMaxAge == null || cursorMaxAge.isNegative() || cursorMaxAge.isZero()) {
            throw new IllegalArgumentException("cursorMaxAge must be positive");
        }
        if (defaultAllowanceTtl == null || defaultAllowanceTtl.isNegative() || defaultAllowanceTtl.isZero()) {
            throw new IllegalArgumentException("defaultAllowanceTtl must be positive");
        }
        if (maxAllowanceTtl == null || maxAllowanceTtl.compareTo(defaultAllowanceTtl) < 0) {
            throw new IllegalArgumentException("maxAllowanceTtl must be >= defaultAllowanceTtl");
        }
        if (maxPageSize < 1) throw new IllegalArgumentException("maxPageSize must be >= 1");
        if (lockStripes < 1) throw new IllegalArgumentException("lockStripes must be >= 1");
        this.cursorMaxAge = cursorMaxAge;
        this.defaultAllowanceTtl = defaultAllowanceTtl;
        this.maxAllowanceTtl = maxAllowanceTtl;
        this.maxPageSize = maxPageSize;
        this.lockStripes = lockStripes;
        this.syncWrites = syncWrites;
    }

    public static StoreConfig defaults() {
        return new StoreConfig(
                Duration.ofDays(7),     // cursor max age
                Duration.ofHours(24),   // allowance default ttl
                Duration.ofDays(30),    // allowance ttl cap
                1000,
                64,
                false
        );
    }

    public StoreConfig withCursorMaxAge(Duration maxAge) {
        return new StoreConfig(maxAge, defaultAllowanceTtl, maxAllowanceTtl, maxPageSize, lockStripes, syncWrites);
    }

    public StoreConfig withAllowanceTtl(Duration defaultTtl, Duration maxTtl) {
        return new StoreConfig(cursorMaxAge, defaultTtl, maxTtl, maxPageSize, lockStripes, syncWrites);
    }

    public StoreConfig withMaxPageSize(int size) {
        return new StoreConfig(cursorMaxAge, defaultAllowanceTtl, maxAllowanceTtl, size, lockStripes, syncWrites);
    }

    public StoreConfig withSyncWrites(boolean sync) {
        return new StoreConfig(cursorMaxAge, defaultAllowanceTtl, maxAllowanceTtl, maxPageSize, lockStripes, sync);
    }

    /**
     * Reads a JSON file; properties it leaves out keep their {@link #defaults()} value.
     * A missing file yields the defaults.
     */
    public static StoreConfig load(Path path) {
        if (!Files.exists(path)) {
            return defaults();
        }
        try {
            return defaults().merge(JSON.readValue(path.toFile(), ConfigFile.class));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read store config from " + path, e);
        }
    }

    /** Same as {@link #load(Path)} for a classpath resource. */
    public static StoreConfig loadResource(String name) {
        try (InputStream in = StoreConfig.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalStateException("Config resource not found: " + name);
            }
            return defaults().merge(JSON.readValue(in, ConfigFile.class));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read store config resource " + name, e);
        }
    }

    private StoreConfig merge(ConfigFile f) {
        return new StoreConfig(
                f.cursorMaxAgeMillis != null ? Duration.ofMillis(f.cursorMaxAgeMillis) : cursorMaxAge,
                f.defaultAllowanceTtlMillis != null ? Duration.ofMillis(f.defaultAllowanceTtlMillis) : defaultAllowanceTtl,
                f.maxAllowanceTtlMillis != null ? Duration.ofMillis(f.maxAllowanceTtlMillis) : maxAllowanceTtl,
                f.maxPageSize != null ? f.maxPageSize : maxPageSize,
                f.lockStripes != null ? f.lockStripes : lockStripes,
                f.syncWrites != null ? f.syncWrites : syncWrites
        );
    }

    @Override
    public String toString() {
        return "StoreConfig{cursorMaxAge=" + cursorMaxAge + ", defaultAllowanceTtl=" + defaultAllowanceTtl
                + ", maxAllowanceTtl=" + maxAllowanceTtl + ", maxPageSize=" + maxPageSize
                + ", lockStripes=" + lockStripes + ", syncWrites=" + syncWrites + "}";
    }

    private static class ConfigFile {
        public Long cursorMaxAgeMillis;
        public Long defaultAllowanceTtlMillis;
        public Long maxAllowanceTtlMillis;
        public Integer maxPageSize;
        public Integer lockStripes;
        public Boolean syncWrites;
    }
}
