package com.beacon.statusservice.infrastructure.store;

import com.beacon.statusmodel.StatusRecord;
import com.beacon.statusservice.domain.LatestRecordIndex;
import com.beacon.statusservice.domain.RecordId;
import com.beacon.statusservice.domain.StatusRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local append-only status store. Keeps the full history in insertion order; reads are
 * answered from a {@link LatestRecordIndex}.
 */
public class InMemoryStatusRepository implements StatusRepository {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final LatestRecordIndex index = new LatestRecordIndex();
    private final List<StatusRecord> history = new ArrayList<>();

    @Override
    public RecordId append(StatusRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        lock.writeLock().lock();
        try {
            index.offer(record);
            history.add(record);
        } finally {
            lock.writeLock().unlock();
        }
        return new RecordId(UUID.randomUUID().toString());
    }

    @Override
    public Optional<StatusRecord> latestByName(String serviceName) {
        lock.readLock().lock();
        try {
            return index.latest(serviceName);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<String, StatusRecord> latestAll() {
        lock.readLock().lock();
        try {
            return index.snapshot();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Every record appended so far, oldest insertion first. */
    public List<StatusRecord> history() {
        lock.readLock().lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.readLock().unlock();
        }
    }
}
