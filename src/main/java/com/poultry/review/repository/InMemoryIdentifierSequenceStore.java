package com.poultry.review.repository;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counterpart of {@link InMemoryApplicationStore}: lives exactly as long as
 * the applications it numbers.
 */
@Repository
@ConditionalOnProperty(name = "workflow.store-type", havingValue = "memory", matchIfMissing = true)
public class InMemoryIdentifierSequenceStore implements IdentifierSequenceStore {

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final Map<String, String> issued = new ConcurrentHashMap<>();

    @Override
    public long nextValue(String series) {
        return counters.computeIfAbsent(series, s -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public String findIssued(String applicationId) {
        return issued.get(applicationId);
    }

    @Override
    public String bindIfAbsent(String applicationId, String identifier) {
        String existing = issued.putIfAbsent(applicationId, identifier);
        return existing != null ? existing : identifier;
    }
}
