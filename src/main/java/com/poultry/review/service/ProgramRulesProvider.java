package com.poultry.review.service;

import com.poultry.review.config.EligibilityConfig;
import com.poultry.review.config.WorkflowConfig;
import com.poultry.review.exception.ValidationException;
import com.poultry.review.model.ApplicationKind;
import com.poultry.review.model.JurisdictionScope;
import com.poultry.review.model.ProgramDefinition;
import com.poultry.review.model.ProgramRules;
import com.poultry.review.model.ReviewLevelDefinition;
import com.poultry.review.model.ReviewerRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the program definition of every application kind: eligibility rules,
 * review levels with SLA days, and terminal actions.
 *
 * <p>Definitions are read from {@code workflow.programs} and {@code eligibility.rules}
 * at startup, falling back to built-in defaults. {@link #reload} swaps a
 * definition at runtime; callers that already read the old one keep using it.
 */
@Service
public class ProgramRulesProvider {

    private static final Logger log = LoggerFactory.getLogger(ProgramRulesProvider.class);

    private final AtomicReference<Map<ApplicationKind, ProgramDefinition>> definitions;

    public ProgramRulesProvider(WorkflowConfig workflowConfig, EligibilityConfig eligibilityConfig) {
        Map<ApplicationKind, ProgramDefinition> initial = new EnumMap<>(ApplicationKind.class);
        for (ApplicationKind kind : ApplicationKind.values()) {
            ProgramDefinition configured = workflowConfig.getPrograms().get(kind);
            ProgramDefinition definition = configured != null && !configured.getLevels().isEmpty()
                    ? configured.toBuilder().build()
                    : defaultDefinition(kind);

            ProgramRules rules = eligibilityConfig.getRules().get(kind);
            if (rules != null) {
                definition.setRules(rules);
            } else if (definition.getRules() == null) {
                definition.setRules(new ProgramRules());
            }

            validate(kind, definition);
            initial.put(kind, definition);
            log.info("Program {}: {} review levels, activateAccount={}, prefix={}",
                    kind, definition.levelCount(), definition.isActivateAccount(), definition.getIdentifierPrefix());
        }
        this.definitions = new AtomicReference<>(initial);
    }

    public ProgramDefinition definition(ApplicationKind kind) {
        return definitions.get().get(kind);
    }

    public ProgramRules rules(ApplicationKind kind) {
        return definition(kind).getRules();
    }

    public Map<ApplicationKind, ProgramDefinition> definitions() {
        return new EnumMap<>(definitions.get());
    }

    /**
     * Replace the definition of one kind. Rules left null keep the current rule table.
     */
    public ProgramDefinition reload(ApplicationKind kind, ProgramDefinition definition) {
        if (kind == null) {
            throw new ValidationException("kind is required");
        }
        ProgramDefinition replacement = definition.toBuilder().build();
        if (replacement.getRules() == null) {
            replacement.setRules(rules(kind));
        }
        validate(kind, replacement);

        definitions.updateAndGet(current -> {
            Map<ApplicationKind, ProgramDefinition> next = new EnumMap<>(current);
            next.put(kind, replacement);
            return next;
        });
        log.info("Reloaded program definition for {}: {} levels", kind, replacement.levelCount());
        return replacement;
    }

    private void validate(ApplicationKind kind, ProgramDefinition definition) {
        if (definition.getLevels() == null || definition.getLevels().isEmpty()) {
            throw new ValidationException("Program " + kind + " must define at least one review level");
        }
        for (ReviewLevelDefinition level : definition.getLevels()) {
            if (level.getSlaDays() <= 0) {
                throw new ValidationException("Level " + level.getName() + " of " + kind + " must have slaDays > 0");
            }
            if (level.getScope() == null) {
                throw new ValidationException("Level " + level.getName() + " of " + kind + " must have a scope");
            }
        }
        if (definition.getIdentifierPrefix() == null || definition.getIdentifierPrefix().isBlank()) {
            throw new ValidationException("Program " + kind + " must have an identifierPrefix");
        }
        ProgramRules rules = definition.getRules();
        if (rules.getPassThreshold() < 0 || rules.getPassThreshold() > 100) {
            throw new ValidationException("passThreshold of " + kind + " must be within 0-100");
        }
    }

    static ProgramDefinition defaultDefinition(ApplicationKind kind) {
        ReviewLevelDefinition constituency = level("constituency", 7,
                ReviewerRole.CONSTITUENCY_OFFICER, JurisdictionScope.CONSTITUENCY);
        ReviewLevelDefinition regional = level("regional", 5,
                ReviewerRole.REGIONAL_OFFICER, JurisdictionScope.REGION);
        ReviewLevelDefinition national = level("national", 3,
                ReviewerRole.NATIONAL_OFFICER, JurisdictionScope.NATIONAL);

        return switch (kind) {
            case FARMER_REGISTRATION -> ProgramDefinition.builder()
                    .levels(List.of(constituency, regional, national))
                    .activateAccount(false)
                    .identifierPrefix("FRM")
                    .build();
            case PROGRAM_ENROLLMENT -> ProgramDefinition.builder()
                    .levels(List.of(constituency, regional, national))
                    .activateAccount(true)
                    .identifierPrefix("ENR")
                    .build();
            case STAFF_INVITATION -> ProgramDefinition.builder()
                    .levels(List.of(regional, national))
                    .activateAccount(true)
                    .identifierPrefix("STF")
                    .build();
        };
    }

    private static ReviewLevelDefinition level(String name, int slaDays, ReviewerRole role, JurisdictionScope scope) {
        return ReviewLevelDefinition.builder()
                .name(name)
                .slaDays(slaDays)
                .requiredRoles(List.of(role))
                .scope(scope)
                .build();
    }
}
