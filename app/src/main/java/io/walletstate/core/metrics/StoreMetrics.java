package io.walletstate.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

/** Counters and timers for store activity, tagged by store name. */
public final class StoreMetrics {
    private final MeterRegistry registry;

    public StoreMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /** Metrics kept in a private in-process registry. */
    public static StoreMetrics simple() {
        return new StoreMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void write(String store) {
        counter("walletstate.writes", store, "Committed write batches").increment();
    }

    public void noop(String store) {
        counter("walletstate.writes.skipped", store, "Writes ignored as stale or expired").increment();
    }

    public void versionConflict(String store) {
        counter("walletstate.version.conflicts", store, "Optimistic writes rejected on version").increment();
    }

    public void rejectedTransition(String store) {
        counter("walletstate.transitions.rejected", store, "Illegal lifecycle transitions").increment();
    }

    public void purged(String store, long count) {
        if (count > 0) {
            counter("walletstate.purged", store, "Records physically removed by housekeeping").increment(count);
        }
    }

    public <T> T recordScan(String store, String index, Supplier<T> scan) {
        Timer timer = Timer.builder("walletstate.scan")
                .description("Index scan duration")
                .tag("store", store)
                .tag("index", index)
                .register(registry);
        return timer.record(scan);
    }

    public double count(String name, String store) {
        Counter c = registry.find(name).tag("store", store).counter();
        return c == null ? 0.0 : c.count();
    }

    /** Plain-text dump of every meter, one statistic per line. */
    public String scrape() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{store=")
                  .append(m.getId().getTag("store"))
                  .append(",stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    private Counter counter(String name, String store, String description) {
        return Counter.builder(name)
                .description(description)
                .tag("store", store)
                .register(registry);
    }
}
