package com.connection.finder.aggregate;

import com.connection.finder.core.model.CanonicalPerson;
import com.connection.finder.core.model.IdentityKey;
import com.connection.finder.core.model.PersonRecord;
import com.connection.finder.identity.IdentityKeyBuilder;
import com.connection.finder.merge.MergeRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Aggregates person records from any number of providers into deduplicated canonical
 * identities, tracking which sources contributed to each one.
 *
 * <p>Every mutation happens under a single lock, so concurrent providers can hand their
 * results to the same instance without racing on a key's read-modify-write.</p>
 */
public class PeopleAggregator {
    private static final Logger log = LoggerFactory.getLogger(PeopleAggregator.class);

    private final IdentityKeyBuilder keyBuilder;
    private final MergeRules mergeRules;
    private final Map<IdentityKey, CanonicalPerson> people = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private int droppedRecords;
    private int mergedRecords;

    public PeopleAggregator() {
        this(new IdentityKeyBuilder(), MergeRules.defaults());
    }

    public PeopleAggregator(IdentityKeyBuilder keyBuilder, MergeRules mergeRules) {
        this.keyBuilder = Objects.requireNonNull(keyBuilder, "keyBuilder is required");
        this.mergeRules = Objects.requireNonNull(mergeRules, "mergeRules is required");
    }

    /**
     * Adds one record, creating a new identity or merging into the existing one.
     * Malformed records are dropped and counted, never thrown.
     */
    public IngestOutcome ingest(PersonRecord record) {
        lock.lock();
        try {
            return ingestLocked(record);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds records in input order. The batch is applied atomically with respect to
     * other callers.
     */
    public int ingestBatch(List<PersonRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        lock.lock();
        try {
            int accepted = 0;
            for (PersonRecord record : records) {
                if (ingestLocked(record) != IngestOutcome.DROPPED) {
                    accepted++;
                }
            }
            return accepted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns copies of all canonical identities, in no particular order.
     */
    public List<CanonicalPerson> all() {
        lock.lock();
        try {
            List<CanonicalPerson> copies = new ArrayList<>(people.size());
            for (CanonicalPerson person : people.values()) {
                copies.add(person.copy());
            }
            return copies;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return people.size();
        } finally {
            lock.unlock();
        }
    }

    public AggregationStats stats() {
        lock.lock();
        try {
            Map<String, Integer> bySource = new LinkedHashMap<>();
            int multiSource = 0;
            for (CanonicalPerson person : people.values()) {
                for (String source : person.getSources()) {
                    bySource.merge(source, 1, Integer::sum);
                }
                if (person.isMultiSource()) {
                    multiSource++;
                }
            }
            return new AggregationStats(people.size(), bySource, multiSource, droppedRecords, mergedRecords);
        } finally {
            lock.unlock();
        }
    }

    private IngestOutcome ingestLocked(PersonRecord record) {
        if (record == null || !record.isWellFormed()) {
            droppedRecords++;
            log.debug("Dropping malformed record: {}", record);
            return IngestOutcome.DROPPED;
        }

        IdentityKey key = keyBuilder.keyOf(record);
        CanonicalPerson existing = people.get(key);
        if (existing == null) {
            people.put(key, CanonicalPerson.from(key, record));
            log.debug("New identity {} from source '{}'", key, record.getSource());
            return IngestOutcome.CREATED;
        }

        boolean newSource = mergeRules.apply(existing, record);
        mergedRecords++;
        log.debug("Merged record from '{}' into {} (newSource={}, confidence={})",
                record.getSource(), key, newSource, existing.getConfidence());
        return IngestOutcome.MERGED;
    }
}
