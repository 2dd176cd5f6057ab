package com.poultry.review.controller;

import com.poultry.review.config.WorkflowConfig;
import com.poultry.review.integration.ConfiguredReviewerDirectory;
import com.poultry.review.model.ApplicationKind;
import com.poultry.review.model.ExpiryPolicy;
import com.poultry.review.model.ProgramDefinition;
import com.poultry.review.model.ReviewerProfile;
import com.poultry.review.service.ProgramRulesProvider;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime configuration (program definitions, workflow settings, reviewers)")
public class ConfigController {

    private final ProgramRulesProvider rulesProvider;
    private final WorkflowConfig workflowConfig;
    private final ConfiguredReviewerDirectory reviewerDirectory;

    public ConfigController(ProgramRulesProvider rulesProvider,
                            WorkflowConfig workflowConfig,
                            ConfiguredReviewerDirectory reviewerDirectory) {
        this.rulesProvider = rulesProvider;
        this.workflowConfig = workflowConfig;
        this.reviewerDirectory = reviewerDirectory;
    }

    // ── Program definitions ──

    @Operation(summary = "Get the program definition of every application kind")
    @GetMapping("/program-definitions")
    public ResponseEntity<Map<ApplicationKind, ProgramDefinition>> getProgramDefinitions() {
        return ResponseEntity.ok(rulesProvider.definitions());
    }

    @Operation(summary = "Get one program definition")
    @GetMapping("/program-definitions/{kind}")
    public ResponseEntity<ProgramDefinition> getProgramDefinition(@PathVariable ApplicationKind kind) {
        return ResponseEntity.ok(rulesProvider.definition(kind));
    }

    @Operation(summary = "Replace one program definition",
            description = "Eligibility rules, review levels and SLA days. Applies to the next operation on "
                    + "every application of the kind; resets on restart.")
    @PutMapping("/program-definitions/{kind}")
    public ResponseEntity<ProgramDefinition> updateProgramDefinition(@PathVariable ApplicationKind kind,
                                                                     @RequestBody ProgramDefinition definition) {
        return ResponseEntity.ok(rulesProvider.reload(kind, definition));
    }

    // ── Workflow settings ──

    @Operation(summary = "Get workflow settings")
    @GetMapping("/workflow")
    public ResponseEntity<Map<String, Object>> getWorkflowSettings() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("changesDeadlineDays", workflowConfig.getChangesDeadlineDays());
        settings.put("expiryPolicy", workflowConfig.getExpiryPolicy());
        settings.put("maxConflictRetries", workflowConfig.getMaxConflictRetries());
        settings.put("deadlineCheckIntervalSeconds", workflowConfig.getDeadlineCheckIntervalSeconds());
        settings.put("storeType", workflowConfig.getStoreType());
        return ResponseEntity.ok(settings);
    }

    @Operation(summary = "Update workflow settings",
            description = "changesDeadlineDays, expiryPolicy (AUTO_REJECT or ESCALATE), maxConflictRetries. "
                    + "Changes apply immediately but reset on restart.")
    @PutMapping("/workflow")
    public ResponseEntity<?> updateWorkflowSettings(@RequestBody Map<String, Object> body) {
        int deadlineDays = toInt(body, "changesDeadlineDays", workflowConfig.getChangesDeadlineDays());
        int retries = toInt(body, "maxConflictRetries", workflowConfig.getMaxConflictRetries());
        ExpiryPolicy policy = workflowConfig.getExpiryPolicy();

        Object rawPolicy = body.get("expiryPolicy");
        if (rawPolicy != null) {
            try {
                policy = ExpiryPolicy.valueOf(rawPolicy.toString().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return badRequest("expiryPolicy must be AUTO_REJECT or ESCALATE", "expiryPolicy");
            }
        }
        if (deadlineDays <= 0) return badRequest("changesDeadlineDays must be > 0", "changesDeadlineDays");
        if (retries <= 0) return badRequest("maxConflictRetries must be > 0", "maxConflictRetries");

        workflowConfig.setChangesDeadlineDays(deadlineDays);
        workflowConfig.setMaxConflictRetries(retries);
        workflowConfig.setExpiryPolicy(policy);

        return getWorkflowSettings();
    }

    // ── Reviewers ──

    @Operation(summary = "Look up a reviewer's role and jurisdiction")
    @GetMapping("/reviewers/{userId}")
    public ResponseEntity<ReviewerProfile> getReviewer(@PathVariable String userId) {
        ReviewerProfile profile = reviewerDirectory.resolve(userId);
        if (profile == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(profile);
    }

    @Operation(summary = "Register or update a reviewer", description = "Applies immediately; resets on restart.")
    @PutMapping("/reviewers/{userId}")
    public ResponseEntity<ReviewerProfile> registerReviewer(@PathVariable String userId,
                                                            @RequestBody ReviewerProfile profile) {
        profile.setUserId(userId);
        return ResponseEntity.ok(reviewerDirectory.register(profile));
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }
}
