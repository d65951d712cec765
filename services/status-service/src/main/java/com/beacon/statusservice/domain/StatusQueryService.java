package com.beacon.statusservice.domain;

import com.beacon.observability.CorrelationContext;
import com.beacon.observability.CorrelationContextHolder;
import com.beacon.observability.StatusMetrics;
import com.beacon.statusmodel.ServiceStatus;
import com.beacon.statusmodel.StatusRecord;
import com.beacon.statusmodel.StatusRecordValidator;
import com.beacon.statusmodel.StatusSubmission;
import com.beacon.statusmodel.ValidationResult;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for everything that writes or reads status records.
 *
 * <ul>
 *   <li><b>Ingest</b> ({@link #recordStatus}): validate, then append. No aggregation on write.
 *   <li><b>Refresh</b> ({@link #runCheckCycle}): probe every dependency, append each record, then
 *       aggregate the fresh records and append the application record last.
 *   <li><b>Read</b> ({@link #getAll}, {@link #getOne}, {@link #overview}): answer from the store.
 *       The stored application record is the answer; nothing is recomputed at read time.
 * </ul>
 *
 * <p>The service keeps no mutable state of its own, so concurrent callers need no locking. A reader
 * running alongside a check cycle may see some of the cycle's dependency records before the
 * application record; it never sees the application record before the records it was derived
 * from. Store failures are propagated and never retried here.
 */
public class StatusQueryService {

    private static final Logger log = LoggerFactory.getLogger(StatusQueryService.class);

    private final MonitorSettings settings;
    private final ServiceChecker checker;
    private final StatusAggregator aggregator;
    private final StatusRepository repository;
    private final ExecutorService readExecutor;
    private final Clock clock;
    private final StatusMetrics metrics;

    public StatusQueryService(
            MonitorSettings settings,
            ServiceChecker checker,
            StatusAggregator aggregator,
            StatusRepository repository,
            ExecutorService readExecutor,
            Clock clock,
            StatusMetrics metrics) {
        this.settings = settings;
        this.checker = checker;
        this.aggregator = aggregator;
        this.repository = repository;
        this.readExecutor = readExecutor;
        this.clock = clock;
        this.metrics = metrics;
    }

    // ---- Ingest ----

    /**
     * Validates an externally reported status and appends it.
     *
     * @throws StatusValidationException if the submission is invalid or names the application
     * @throws StoreUnavailableException if the store cannot be reached
     */
    public RecordedStatus recordStatus(StatusSubmission submission) {
        ValidationResult result = StatusRecordValidator.validate(submission);
        if (!result.valid()) {
            throw new StatusValidationException(result.errors());
        }
        if (settings.applicationName().equals(submission.serviceName().trim())) {
            throw new StatusValidationException(
                    "service_name '"
                            + settings.applicationName()
                            + "' is reserved for the computed application status");
        }
        StatusRecord record = submission.toRecord(clock);
        RecordId id = append(record);
        log.info(
                "Recorded {} for {} on {} as {}",
                record.status(),
                record.serviceName(),
                record.hostName(),
                id);
        return new RecordedStatus(id, record);
    }

    // ---- Refresh ----

    /** Runs a check cycle bounded by the configured cycle timeout. */
    public CheckCycleResult runCheckCycle() {
        return runCheckCycle(settings.cycleTimeout());
    }

    /**
     * Probes every dependency in order, appending each record as soon as it is produced, then
     * appends the application record derived from those fresh records.
     *
     * <p>A probe that fails for any reason yields an UNKNOWN record and the cycle carries on. If the
     * deadline passes, the cycle stops before its next step: dependency records already appended
     * stay, and the application record is not appended.
     *
     * @param timeout deadline for the whole cycle, measured from the call
     * @throws DeadlineExceededException if the deadline passes before the application record is
     *     appended
     * @throws StoreUnavailableException if an append fails; the cycle is abandoned
     */
    public CheckCycleResult runCheckCycle(Duration timeout) {
        String cycleId = UUID.randomUUID().toString();
        Optional<CorrelationContext> previous = CorrelationContextHolder.get();
        CorrelationContextHolder.set(
                previous.map(ctx -> ctx.withCycle(cycleId))
                        .orElseGet(() -> CorrelationContext.forCheckCycle(cycleId)));

        Timer.Sample sample = Timer.start(metrics.registry());
        String outcome = "failed";
        try {
            CheckCycleResult result = checkAll(cycleId, timeout);
            outcome = "completed";
            return result;
        } catch (DeadlineExceededException e) {
            outcome = "timeout";
            log.warn("Check cycle {} abandoned: {}", cycleId, e.getMessage());
            throw e;
        } finally {
            sample.stop(metrics.checkCycleTimer(outcome));
            previous.ifPresentOrElse(
                    CorrelationContextHolder::set, CorrelationContextHolder::clear);
        }
    }

    private CheckCycleResult checkAll(String cycleId, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        log.info(
                "Check cycle {} started for {} dependencies of {}",
                cycleId,
                settings.dependencies().size(),
                settings.applicationName());

        Map<String, StatusRecord> fresh = new LinkedHashMap<>();
        List<StatusRecord> dependencyRecords = new ArrayList<>();
        for (String name : settings.dependencies().names()) {
            Duration remaining = remaining(deadline, "check cycle " + cycleId, timeout);
            Duration probeTimeout =
                    remaining.compareTo(settings.probeTimeout()) < 0
                            ? remaining
                            : settings.probeTimeout();
            StatusRecord record = probe(name, probeTimeout);
            append(record);
            fresh.put(name, record);
            dependencyRecords.add(record);
        }
        remaining(deadline, "check cycle " + cycleId, timeout);

        ApplicationStatus status = aggregator.aggregate(fresh);
        StatusRecord applicationRecord =
                aggregator.applicationRecord(
                        settings.applicationName(),
                        fresh,
                        settings.hostName(),
                        notBefore(clock.instant(), dependencyRecords));
        append(applicationRecord);
        metrics.recordApplicationLevel(status.level());

        log.info("Check cycle {} completed: {} is {}", cycleId, settings.applicationName(), status);
        return new CheckCycleResult(cycleId, dependencyRecords, status, applicationRecord);
    }

    private StatusRecord probe(String serviceName, Duration timeout) {
        try {
            return checker.check(serviceName, settings.hostName(), timeout);
        } catch (RuntimeException e) {
            log.error("Unexpected failure probing {}, recording UNKNOWN", serviceName, e);
            return new StatusRecord(
                    serviceName, ServiceStatus.UNKNOWN, settings.hostName(), clock.instant());
        }
    }

    /** The application record must never be older than the records it was derived from. */
    private static Instant notBefore(Instant now, List<StatusRecord> records) {
        Instant result = now;
        for (StatusRecord record : records) {
            if (record.timestamp().isAfter(result)) {
                result = record.timestamp();
            }
        }
        return result;
    }

    private static Duration remaining(long deadlineNanos, String operation, Duration timeout) {
        long left = deadlineNanos - System.nanoTime();
        if (left <= 0) {
            throw new DeadlineExceededException(operation, timeout);
        }
        return Duration.ofNanos(left);
    }

    // ---- Read ----

    /**
     * Latest record of every known service, the application record included.
     *
     * @throws StoreUnavailableException if the store cannot be reached
     * @throws DeadlineExceededException if the store does not answer within the read timeout
     */
    public Map<String, StatusRecord> getAll() {
        return getAll(settings.readTimeout());
    }

    /**
     * Latest record of every known service, waiting at most {@code readTimeout} for the store.
     *
     * @throws IllegalArgumentException if the timeout is null or not positive
     * @throws DeadlineExceededException if the store does not answer in time
     */
    public Map<String, StatusRecord> getAll(Duration readTimeout) {
        return read("latestAll", readTimeout, repository::latestAll);
    }

    /**
     * Latest record for one service.
     *
     * @throws StatusValidationException if the name is blank
     * @throws StatusNotFoundException if no record was ever appended for the name
     * @throws StoreUnavailableException if the store cannot be reached
     * @throws DeadlineExceededException if the store does not answer within the read timeout
     */
    public StatusRecord getOne(String serviceName) {
        return getOne(serviceName, settings.readTimeout());
    }

    /** Like {@link #getOne(String)}, waiting at most {@code readTimeout} for the store. */
    public StatusRecord getOne(String serviceName, Duration readTimeout) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new StatusValidationException("Service name cannot be empty");
        }
        String name = serviceName.trim();
        return read("latestByName", readTimeout, () -> repository.latestByName(name))
                .orElseThrow(() -> new StatusNotFoundException(name));
    }

    /** Up/down counts and the services requiring attention, derived from {@link #getAll()}. */
    public StatusOverview overview() {
        return StatusOverview.of(getAll());
    }

    private <T> T read(String operation, Duration timeout, Callable<T> query) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("read timeout must be positive");
        }
        Future<T> future = readExecutor.submit(CorrelationContextHolder.wrap(query));
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.recordStoreFailure("read");
            throw new DeadlineExceededException(operation, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StoreUnavailableException unavailable) {
                metrics.recordStoreFailure("read");
                log.warn("Status store unavailable during {}: {}", operation, unavailable.getMessage());
                throw unavailable;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(operation + " failed", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during " + operation, e);
        }
    }

    private RecordId append(StatusRecord record) {
        try {
            RecordId id = repository.append(record);
            metrics.recordAppended(record.status().value());
            return id;
        } catch (StoreUnavailableException e) {
            metrics.recordStoreFailure("append");
            log.error("Status store unavailable appending {}: {}", record.serviceName(), e.getMessage());
            throw e;
        }
    }
}
