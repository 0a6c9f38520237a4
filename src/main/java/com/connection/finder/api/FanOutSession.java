package com.connection.finder.api;

import com.connection.finder.aggregate.PeopleAggregator;
import com.connection.finder.core.model.PersonRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.IntFunction;

/**
 * Per-search state shared by the provider calls of one fan-out: the aggregator and one
 * report slot per source. Once closed, deliveries are refused, so a result is either
 * merged completely before the close or not at all.
 */
final class FanOutSession {

    private final PeopleAggregator aggregator;
    private final AtomicReferenceArray<ProviderReport> reports;
    private final ReentrantLock lock = new ReentrantLock();
    private boolean closed;

    FanOutSession(PeopleAggregator aggregator, int slots) {
        this.aggregator = aggregator;
        this.reports = new AtomicReferenceArray<>(slots);
    }

    /**
     * Merges a provider's records and files its report in one step.
     *
     * @return false if the session was already closed and the records were discarded
     */
    boolean deliver(int slot, List<PersonRecord> records, ProviderReport report) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            aggregator.ingestBatch(records);
            reports.compareAndSet(slot, null, report);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Files a report for a slot. Ignored once the session is closed.
     */
    void report(int slot, ProviderReport report) {
        lock.lock();
        try {
            if (!closed) {
                reports.compareAndSet(slot, null, report);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refuses further deliveries and fills every slot still open.
     */
    void close(IntFunction<ProviderReport> unfinished) {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            for (int i = 0; i < reports.length(); i++) {
                if (reports.get(i) == null) {
                    reports.set(i, unfinished.apply(i));
                }
            }
        } finally {
            lock.unlock();
        }
    }

    boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        return aggregator.size();
    }

    PeopleAggregator aggregator() {
        return aggregator;
    }

    List<ProviderReport> reports() {
        List<ProviderReport> result = new ArrayList<>(reports.length());
        for (int i = 0; i < reports.length(); i++) {
            ProviderReport report = reports.get(i);
            if (report != null) {
                result.add(report);
            }
        }
        return result;
    }
}
