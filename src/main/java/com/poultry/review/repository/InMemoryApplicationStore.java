package com.poultry.review.repository;

import com.poultry.review.model.ApplicationRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Records are kept serialized so callers never share
 * mutable state with the store; version checks run inside
 * {@link ConcurrentHashMap#compute}, which makes each write atomic per key.
 */
@Repository
@ConditionalOnProperty(name = "workflow.store-type", havingValue = "memory", matchIfMissing = true)
public class InMemoryApplicationStore implements ApplicationStore {

    private final ApplicationRecordCodec codec;
    private final Map<String, StoredRecord> records = new ConcurrentHashMap<>();

    public InMemoryApplicationStore(ApplicationRecordCodec codec) {
        this.codec = codec;
    }

    @Override
    public ApplicationRecord findById(String applicationId) {
        StoredRecord stored = records.get(applicationId);
        return stored == null ? null : decode(stored);
    }

    @Override
    public void create(ApplicationRecord record) {
        String id = record.getApplication().getApplicationId();
        StoredRecord encoded = encode(record, 1);
        if (records.putIfAbsent(id, encoded) != null) {
            throw new StaleRecordException("Application " + id + " already exists");
        }
        record.setVersion(1);
    }

    @Override
    public void update(ApplicationRecord record) {
        String id = record.getApplication().getApplicationId();
        long expected = record.getVersion();
        StoredRecord written = records.compute(id, (key, current) -> {
            if (current == null) {
                throw new StaleRecordException("Application " + id + " does not exist");
            }
            if (current.version != expected) {
                throw new StaleRecordException(String.format(
                        "Application %s is at version %d, write expected %d", id, current.version, expected));
            }
            return encode(record, expected + 1);
        });
        record.setVersion(written.version);
    }

    @Override
    public List<ApplicationRecord> findAll() {
        List<ApplicationRecord> results = new ArrayList<>();
        for (StoredRecord stored : records.values()) {
            results.add(decode(stored));
        }
        return results;
    }

    private StoredRecord encode(ApplicationRecord record, long version) {
        return new StoredRecord(
                codec.writeApplication(record.getApplication()),
                codec.writeQueue(record.getQueueEntries()),
                codec.writeAudit(record.getAuditTrail()),
                version);
    }

    private ApplicationRecord decode(StoredRecord stored) {
        return codec.read(stored.application, stored.queue, stored.audit, stored.version);
    }

    private static final class StoredRecord {
        private final String application;
        private final String queue;
        private final String audit;
        private final long version;

        private StoredRecord(String application, String queue, String audit, long version) {
            this.application = application;
            this.queue = queue;
            this.audit = audit;
            this.version = version;
        }
    }
}
