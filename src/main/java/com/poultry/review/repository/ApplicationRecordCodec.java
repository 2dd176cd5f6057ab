package com.poultry.review.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poultry.review.model.Application;
import com.poultry.review.model.ApplicationRecord;
import com.poultry.review.model.QueueEntry;
import com.poultry.review.model.ReviewAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON encoding of application records, shared by the store implementations.
 */
@Component
public class ApplicationRecordCodec {

    private static final TypeReference<List<QueueEntry>> QUEUE_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<ReviewAction>> AUDIT_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ApplicationRecordCodec() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String writeApplication(Application application) {
        return write(application);
    }

    public String writeQueue(List<QueueEntry> entries) {
        return write(entries);
    }

    public String writeAudit(List<ReviewAction> actions) {
        return write(actions);
    }

    public ApplicationRecord read(String applicationJson, String queueJson, String auditJson, long version) {
        try {
            Application application = objectMapper.readValue(applicationJson, Application.class);
            List<QueueEntry> queue = queueJson == null ? new ArrayList<>()
                    : new ArrayList<>(objectMapper.readValue(queueJson, QUEUE_TYPE));
            List<ReviewAction> audit = auditJson == null ? new ArrayList<>()
                    : new ArrayList<>(objectMapper.readValue(auditJson, AUDIT_TYPE));
            return ApplicationRecord.builder()
                    .application(application)
                    .queueEntries(queue)
                    .auditTrail(audit)
                    .version(version)
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt application record", e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
