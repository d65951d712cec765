package com.beacon.statusservice.domain;

import com.beacon.observability.CorrelationContext;
import com.beacon.observability.CorrelationContextHolder;
import com.beacon.observability.StatusMetrics;
import com.beacon.statusmodel.ServiceStatus;
import com.beacon.statusmodel.StatusRecord;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one {@link ServiceStateProvider} call into one {@link StatusRecord}.
 *
 * <p>A probe never raises: a provider exception, a timeout, a rejected task or an ambiguous answer
 * all produce a record with status {@link ServiceStatus#UNKNOWN}. The provider is called exactly
 * once per check, on the probe executor, and cancelled with interruption when it overruns its
 * timeout. The checker does not store the record.
 */
public class ServiceChecker {

    private static final Logger log = LoggerFactory.getLogger(ServiceChecker.class);

    private final ServiceStateProvider provider;
    private final ExecutorService probeExecutor;
    private final Clock clock;
    private final Duration defaultTimeout;
    private final StatusMetrics metrics;

    public ServiceChecker(
            ServiceStateProvider provider,
            ExecutorService probeExecutor,
            Clock clock,
            Duration defaultTimeout,
            StatusMetrics metrics) {
        this.provider = provider;
        this.probeExecutor = probeExecutor;
        this.clock = clock;
        this.defaultTimeout = defaultTimeout;
        this.metrics = metrics;
    }

    /** Probes a service with the configured probe timeout. */
    public StatusRecord check(String serviceName, String hostName) {
        return check(serviceName, hostName, defaultTimeout);
    }

    /**
     * Probes a service and records the outcome.
     *
     * @param serviceName service to probe
     * @param hostName host the service runs on
     * @param timeout how long to wait for the provider
     * @return a record stamped with the time the probe finished
     */
    public StatusRecord check(String serviceName, String hostName, Duration timeout) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        ServiceStatus status = probe(serviceName, hostName, timeout);
        return new StatusRecord(serviceName, status, hostName, clock.instant());
    }

    /** Provider call carrying the caller's correlation context, narrowed to the probed service. */
    private Callable<ServiceState> probeTask(String serviceName, String hostName) {
        Callable<ServiceState> call = () -> provider.stateOf(serviceName, hostName);
        Optional<CorrelationContext> context = CorrelationContextHolder.get();
        if (context.isEmpty()) {
            return call;
        }
        CorrelationContext probeContext = context.get().withService(serviceName);
        return () -> CorrelationContextHolder.callWithContext(probeContext, call);
    }

    private ServiceStatus probe(String serviceName, String hostName, Duration timeout) {
        Future<ServiceState> future;
        try {
            future = probeExecutor.submit(probeTask(serviceName, hostName));
        } catch (RejectedExecutionException e) {
            log.warn("Probe of {} on {} rejected by executor", serviceName, hostName);
            metrics.recordProbe("error");
            return ServiceStatus.UNKNOWN;
        }

        try {
            ServiceState state = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            ServiceStatus status = state == null ? ServiceStatus.UNKNOWN : state.toStatus();
            if (status == ServiceStatus.UP) {
                log.info("Service {} on {} is {}", serviceName, hostName, status);
            } else {
                log.warn("Service {} on {} is {}", serviceName, hostName, status);
            }
            metrics.recordProbe(status.value().toLowerCase(Locale.ROOT));
            return status;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Probe of {} on {} timed out after {}", serviceName, hostName, timeout);
            metrics.recordProbe("timeout");
            return ServiceStatus.UNKNOWN;
        } catch (ExecutionException e) {
            log.warn("Probe of {} on {} failed: {}", serviceName, hostName, e.getCause().toString());
            metrics.recordProbe("error");
            return ServiceStatus.UNKNOWN;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted while probing {} on {}", serviceName, hostName);
            metrics.recordProbe("error");
            return ServiceStatus.UNKNOWN;
        }
    }
}
