package com.beacon.statusservice.infrastructure.scheduling;

import com.beacon.observability.CorrelationContext;
import com.beacon.observability.CorrelationContextHolder;
import com.beacon.statusservice.domain.CheckCycleResult;
import com.beacon.statusservice.domain.StatusQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Triggers a check cycle at a fixed delay. Each run gets a fresh correlation ID. Registered only
 * when {@code beacon.monitor.schedule-enabled} is true.
 */
public class CheckCycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(CheckCycleScheduler.class);

    private final StatusQueryService statusQueryService;

    public CheckCycleScheduler(StatusQueryService statusQueryService) {
        this.statusQueryService = statusQueryService;
    }

    @Scheduled(
            fixedDelayString = "${beacon.monitor.check-interval}",
            initialDelayString = "${beacon.monitor.initial-delay}")
    public void runScheduledCycle() {
        CorrelationContextHolder.runWithContext(CorrelationContext.generate(), this::runCycle);
    }

    private void runCycle() {
        try {
            CheckCycleResult result = statusQueryService.runCheckCycle();
            log.debug("Scheduled check cycle {} finished with {}", result.cycleId(), result.applicationStatus());
        } catch (Exception e) {
            log.error("Scheduled check cycle failed: {}", e.getMessage(), e);
        }
    }
}
