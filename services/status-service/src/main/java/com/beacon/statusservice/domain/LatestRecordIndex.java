package com.beacon.statusservice.domain;

import com.beacon.statusmodel.StatusRecord;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tracks the latest record per service name under the repository ordering: greatest timestamp
 * first, then greatest insertion sequence.
 *
 * <p>Not thread-safe; store adapters guard it with their own lock.
 */
public final class LatestRecordIndex {

    private record Entry(StatusRecord record, long sequence) {}

    private final Map<String, Entry> latest = new LinkedHashMap<>();
    private long nextSequence;

    /**
     * Registers a record as the next insertion.
     *
     * @return the insertion sequence assigned to the record
     */
    public long offer(StatusRecord record) {
        long sequence = nextSequence++;
        latest.merge(
                record.serviceName(),
                new Entry(record, sequence),
                (current, candidate) -> supersedes(candidate, current) ? candidate : current);
        return sequence;
    }

    public Optional<StatusRecord> latest(String serviceName) {
        return Optional.ofNullable(latest.get(serviceName)).map(Entry::record);
    }

    /** Unmodifiable copy of the latest record per name, in first-appearance order. */
    public Map<String, StatusRecord> snapshot() {
        Map<String, StatusRecord> copy = new LinkedHashMap<>();
        latest.forEach((name, entry) -> copy.put(name, entry.record()));
        return Collections.unmodifiableMap(copy);
    }

    /** Number of records offered so far. */
    public long appendedCount() {
        return nextSequence;
    }

    private static boolean supersedes(Entry candidate, Entry current) {
        int byTime = candidate.record().timestamp().compareTo(current.record().timestamp());
        return byTime > 0 || (byTime == 0 && candidate.sequence() > current.sequence());
    }
}
