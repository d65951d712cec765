package com.beacon.observability;

import java.util.UUID;

/**
 * Immutable correlation context for one unit of work: an HTTP request, a check cycle, or a single
 * probe inside a check cycle.
 *
 * <p>The values are copied into SLF4J MDC by {@link CorrelationContextHolder}, so every log line
 * written while the context is active carries them.
 *
 * @param correlationId identifier of the unit of work, never blank
 * @param cycleId check-cycle identifier (null outside a check cycle)
 * @param serviceName service currently being probed or queried (nullable)
 */
public record CorrelationContext(String correlationId, String cycleId, String serviceName) {

    public static final String MDC_CORRELATION_ID = "correlationId";

    public static final String MDC_CYCLE_ID = "cycleId";

    public static final String MDC_SERVICE_NAME = "serviceName";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Context for an inbound request carrying the given correlation ID. */
    public static CorrelationContext forRequest(String correlationId) {
        return new CorrelationContext(correlationId, null, null);
    }

    /**
     * Context for a check cycle. The cycle ID doubles as correlation ID so scheduled work can be
     * traced without an inbound request.
     */
    public static CorrelationContext forCheckCycle(String cycleId) {
        return new CorrelationContext(cycleId, cycleId, null);
    }

    /** Context for a freshly generated correlation ID. */
    public static CorrelationContext generate() {
        return forRequest(UUID.randomUUID().toString());
    }

    /** Copy of this context that keeps the correlation ID and joins the given check cycle. */
    public CorrelationContext withCycle(String cycleId) {
        return new CorrelationContext(correlationId, cycleId, null);
    }

    /** Copy of this context narrowed to one service. */
    public CorrelationContext withService(String name) {
        return new CorrelationContext(correlationId, cycleId, name);
    }
}
