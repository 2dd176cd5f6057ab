package com.poultry.review.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.poultry.review.config.AerospikeConfig;
import com.poultry.review.model.ApplicationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * One Aerospike record per application. The record generation is the version:
 * updates are written with {@link GenerationPolicy#EXPECT_GEN_EQUAL}, so a
 * write based on a stale read fails with GENERATION_ERROR instead of
 * overwriting the newer state.
 */
@Repository
@ConditionalOnProperty(name = "workflow.store-type", havingValue = "aerospike")
public class AerospikeApplicationStore implements ApplicationStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeApplicationStore.class);

    static final String BIN_ID = "appId";
    static final String BIN_STATUS = "status";
    static final String BIN_APPLICATION = "application";
    static final String BIN_QUEUE = "queue";
    static final String BIN_AUDIT = "audit";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ApplicationRecordCodec codec;

    public AerospikeApplicationStore(AerospikeClient client,
                                     @Qualifier("aerospikeNamespace") String namespace,
                                     @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                     @Qualifier("defaultReadPolicy") Policy readPolicy,
                                     ApplicationRecordCodec codec) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.codec = codec;
    }

    @Override
    public ApplicationRecord findById(String applicationId) {
        Record record = client.get(readPolicy, key(applicationId));
        if (record == null) return null;
        return mapRecord(record);
    }

    @Override
    public void create(ApplicationRecord record) {
        String id = record.getApplication().getApplicationId();
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;

        try {
            client.put(policy, key(id), bins(record));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                throw new StaleRecordException("Application " + id + " already exists", e);
            }
            throw e;
        }
        record.setVersion(1);
    }

    @Override
    public void update(ApplicationRecord record) {
        String id = record.getApplication().getApplicationId();
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = (int) record.getVersion();

        try {
            client.put(policy, key(id), bins(record));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR
                    || e.getResultCode() == ResultCode.KEY_NOT_FOUND_ERROR) {
                throw new StaleRecordException("Application " + id + " changed since generation "
                        + record.getVersion(), e);
            }
            throw e;
        }
        record.setVersion(record.getVersion() + 1);
    }

    @Override
    public List<ApplicationRecord> findAll() {
        List<ApplicationRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_APPLICATIONS,
                (key, record) -> {
                    try {
                        ApplicationRecord mapped = mapRecord(record);
                        synchronized (results) {
                            results.add(mapped);
                        }
                    } catch (IllegalStateException e) {
                        log.warn("Skipping unreadable application record {}: {}", key.userKey, e.getMessage());
                    }
                });
        return results;
    }

    private Key key(String applicationId) {
        return new Key(namespace, AerospikeConfig.SET_APPLICATIONS, applicationId);
    }

    private Bin[] bins(ApplicationRecord record) {
        return new Bin[] {
                new Bin(BIN_ID, record.getApplication().getApplicationId()),
                new Bin(BIN_STATUS, record.getApplication().getStatus().name()),
                new Bin(BIN_APPLICATION, codec.writeApplication(record.getApplication())),
                new Bin(BIN_QUEUE, codec.writeQueue(record.getQueueEntries())),
                new Bin(BIN_AUDIT, codec.writeAudit(record.getAuditTrail()))
        };
    }

    private ApplicationRecord mapRecord(Record record) {
        return codec.read(
                record.getString(BIN_APPLICATION),
                record.getString(BIN_QUEUE),
                record.getString(BIN_AUDIT),
                record.generation);
    }
}
