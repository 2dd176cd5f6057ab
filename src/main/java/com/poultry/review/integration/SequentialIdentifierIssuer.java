package com.poultry.review.integration;

import com.poultry.review.model.Application;
import com.poultry.review.repository.IdentifierSequenceStore;
import com.poultry.review.service.ProgramRulesProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Issues identifiers of the form {@code PREFIX-REGN-CONS-0001}: the program
 * prefix, the first four letters of region and constituency, and a running
 * number per prefix and jurisdiction. Counters and issued identifiers are kept
 * in the {@link IdentifierSequenceStore}, so numbering continues across restarts
 * and a retried issue returns the identifier given the first time.
 */
@Component
public class SequentialIdentifierIssuer implements IdentifierIssuer {

    private static final Logger log = LoggerFactory.getLogger(SequentialIdentifierIssuer.class);

    private final ProgramRulesProvider rulesProvider;
    private final IdentifierSequenceStore sequenceStore;

    public SequentialIdentifierIssuer(ProgramRulesProvider rulesProvider, IdentifierSequenceStore sequenceStore) {
        this.rulesProvider = rulesProvider;
        this.sequenceStore = sequenceStore;
    }

    @Override
    public String issueIdentifier(Application application) {
        if (application.getIssuedIdentifier() != null) {
            return application.getIssuedIdentifier();
        }
        String applicationId = application.getApplicationId();
        String existing = sequenceStore.findIssued(applicationId);
        if (existing != null) {
            log.debug("Application {} already holds identifier {}", applicationId, existing);
            return existing;
        }

        String prefix = rulesProvider.definition(application.getKind()).getIdentifierPrefix();
        String series = String.join("-", prefix, code(application.getRegion()), code(application.getConstituency()));
        String identifier = String.format("%s-%04d", series, sequenceStore.nextValue(series));

        String bound = sequenceStore.bindIfAbsent(applicationId, identifier);
        if (bound.equals(identifier)) {
            log.info("Issued identifier {} for application {}", identifier, applicationId);
        }
        return bound;
    }

    static String code(String name) {
        String letters = name == null ? "" : name.replaceAll("[^A-Za-z0-9]", "").toUpperCase(Locale.ROOT);
        if (letters.length() >= 4) {
            return letters.substring(0, 4);
        }
        return (letters + "XXXX").substring(0, 4);
    }
}
