package com.beacon.statusservice.domain;

import com.beacon.statusmodel.StatusRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/** Repository double that records every call and can be switched into failure modes. */
class RecordingStatusRepository implements StatusRepository {

    private final LatestRecordIndex index = new LatestRecordIndex();
    private final List<StatusRecord> appended = new ArrayList<>();
    private final AtomicInteger reads = new AtomicInteger();

    private volatile boolean readsUnavailable;
    private volatile String failAppendFor;
    private volatile CountDownLatch readGate;

    @Override
    public synchronized RecordId append(StatusRecord record) {
        if (record.serviceName().equals(failAppendFor)) {
            throw new StoreUnavailableException("store rejected " + record.serviceName());
        }
        index.offer(record);
        appended.add(record);
        return new RecordId("rec-" + appended.size());
    }

    @Override
    public Optional<StatusRecord> latestByName(String serviceName) {
        beforeRead();
        synchronized (this) {
            return index.latest(serviceName);
        }
    }

    @Override
    public Map<String, StatusRecord> latestAll() {
        beforeRead();
        synchronized (this) {
            return index.snapshot();
        }
    }

    private void beforeRead() {
        reads.incrementAndGet();
        if (readsUnavailable) {
            throw new StoreUnavailableException("connection refused");
        }
        CountDownLatch gate = readGate;
        if (gate != null) {
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    synchronized List<StatusRecord> appended() {
        return List.copyOf(appended);
    }

    synchronized List<String> appendedNames() {
        return appended.stream().map(StatusRecord::serviceName).toList();
    }

    int reads() {
        return reads.get();
    }

    void makeReadsUnavailable() {
        readsUnavailable = true;
    }

    void failAppendFor(String serviceName) {
        failAppendFor = serviceName;
    }

    void blockReadsUntil(CountDownLatch gate) {
        readGate = gate;
    }
}
