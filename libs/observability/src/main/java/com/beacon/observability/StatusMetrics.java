package com.beacon.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer meters for status collection and querying.
 *
 * <p>Every meter carries a {@code service} tag with the logical name of the reporting service, so
 * several monitors can share one Prometheus scrape target.
 *
 * <ul>
 *   <li>{@code beacon.status.appended} - records appended, tagged by {@code status}
 *   <li>{@code beacon.probe.outcomes} - probe results, tagged by {@code outcome}
 *   <li>{@code beacon.store.failures} - store errors, tagged by {@code operation}
 *   <li>{@code beacon.check.cycle} - check-cycle duration, tagged by {@code result}
 *   <li>{@code beacon.application.status} - last computed application status as a level
 * </ul>
 */
public final class StatusMetrics {

    public static final String TAG_SERVICE = "service";

    public static final String APPENDED = "beacon.status.appended";
    public static final String PROBE_OUTCOMES = "beacon.probe.outcomes";
    public static final String STORE_FAILURES = "beacon.store.failures";
    public static final String CHECK_CYCLE = "beacon.check.cycle";
    public static final String APPLICATION_STATUS = "beacon.application.status";

    /** Gauge level reported before the first check cycle completes. */
    public static final int LEVEL_NOT_YET_COMPUTED = -1;

    private final MeterRegistry registry;
    private final String serviceName;
    private final AtomicInteger applicationLevel = new AtomicInteger(LEVEL_NOT_YET_COMPUTED);

    /**
     * Creates metrics bound to the given registry and service name.
     *
     * @param registry the Micrometer meter registry
     * @param serviceName logical service name included as a tag on every meter
     */
    public StatusMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
        Gauge.builder(APPLICATION_STATUS, applicationLevel, AtomicInteger::doubleValue)
                .description("Last computed application status (0 down, 1 degraded, 2 up)")
                .tags(baseTags())
                .register(registry);
    }

    /** Counts one appended record with the given status. */
    public void recordAppended(String status) {
        counter(APPENDED, "Status records appended", "status", status).increment();
    }

    /** Counts one probe outcome (e.g. "up", "down", "unknown", "timeout", "error"). */
    public void recordProbe(String outcome) {
        counter(PROBE_OUTCOMES, "Service probe outcomes", "outcome", outcome).increment();
    }

    /** Counts one failed store operation ("append" or "read"). */
    public void recordStoreFailure(String operation) {
        counter(STORE_FAILURES, "Status store failures", "operation", operation).increment();
    }

    /**
     * Timer for check cycles that ended with the given result ("completed", "timeout", "failed").
     */
    public Timer checkCycleTimer(String result) {
        return Timer.builder(CHECK_CYCLE)
                .description("Duration of a full check cycle")
                .tags(baseTags().and("result", result))
                .register(registry);
    }

    /** Publishes the level of the most recent application status. */
    public void recordApplicationLevel(int level) {
        applicationLevel.set(level);
    }

    /** The level currently published by the application status gauge. */
    public int applicationLevel() {
        return applicationLevel.get();
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags().and(tagKey, tagValue))
                .register(registry);
    }

    private Tags baseTags() {
        return Tags.of(TAG_SERVICE, serviceName);
    }
}
