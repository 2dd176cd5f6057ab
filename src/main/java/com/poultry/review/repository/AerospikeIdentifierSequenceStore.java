package com.poultry.review.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.poultry.review.config.AerospikeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * Series counters are single-bin records incremented server side with
 * {@link Operation#add}, so concurrent issuers on any number of nodes never
 * see the same value. Issued identifiers are create-only records keyed by
 * application id.
 */
@Repository
@ConditionalOnProperty(name = "workflow.store-type", havingValue = "aerospike")
public class AerospikeIdentifierSequenceStore implements IdentifierSequenceStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeIdentifierSequenceStore.class);

    static final String BIN_VALUE = "value";
    static final String BIN_IDENTIFIER = "identifier";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeIdentifierSequenceStore(AerospikeClient client,
                                            @Qualifier("aerospikeNamespace") String namespace,
                                            @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                            @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public long nextValue(String series) {
        Key key = new Key(namespace, AerospikeConfig.SET_SEQUENCES, series);
        Record record = client.operate(writePolicy, key,
                Operation.add(new Bin(BIN_VALUE, 1L)),
                Operation.get(BIN_VALUE));
        return record.getLong(BIN_VALUE);
    }

    @Override
    public String findIssued(String applicationId) {
        Record record = client.get(readPolicy, issuedKey(applicationId));
        return record == null ? null : record.getString(BIN_IDENTIFIER);
    }

    @Override
    public String bindIfAbsent(String applicationId, String identifier) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        try {
            client.put(policy, issuedKey(applicationId), new Bin(BIN_IDENTIFIER, identifier));
            return identifier;
        } catch (AerospikeException e) {
            if (e.getResultCode() != ResultCode.KEY_EXISTS_ERROR) {
                throw e;
            }
            String existing = findIssued(applicationId);
            log.info("Application {} already holds identifier {}; {} left unused", applicationId, existing, identifier);
            return existing;
        }
    }

    private Key issuedKey(String applicationId) {
        return new Key(namespace, AerospikeConfig.SET_ISSUED_IDENTIFIERS, applicationId);
    }
}
