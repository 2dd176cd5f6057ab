package com.poultry.review.controller;

import com.poultry.review.model.Application;
import com.poultry.review.model.ApplicationDraft;
import com.poultry.review.model.ResubmissionRequest;
import com.poultry.review.model.ReviewAction;
import com.poultry.review.service.ReviewWorkflowService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

import static com.poultry.review.controller.RequestBodies.*;

@RestController
@RequestMapping("/api/v1/applications")
@Tag(name = "Applications", description = "Application lifecycle: drafts, submission, reviewer decisions, resubmission and withdrawal")
public class ApplicationController {

    private final ReviewWorkflowService workflowService;

    public ApplicationController(ReviewWorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @PostMapping
    @Operation(summary = "Create a draft application")
    public ResponseEntity<Application> createDraft(@RequestBody ApplicationDraft draft) {
        return ResponseEntity.status(HttpStatus.CREATED).body(workflowService.createDraft(draft));
    }

    @PostMapping("/{applicationId}/submit")
    @Operation(summary = "Submit a draft",
               description = "Validates required fields and screens eligibility. Passing applications enter the "
                       + "level-1 queue; failing ones are rejected with status REJECTED and reason eligibility_failed.")
    public ResponseEntity<Application> submit(@PathVariable String applicationId) {
        return ResponseEntity.ok(workflowService.submit(applicationId));
    }

    @PostMapping("/{applicationId}/approve")
    @Operation(summary = "Approve at a review level",
               description = "Body: reviewerId, level, notes (optional). Advances to the next level, or approves "
                       + "the application and issues its identifier at the last level.")
    public ResponseEntity<Application> approve(@PathVariable String applicationId,
                                               @RequestBody Map<String, Object> body) {
        return ResponseEntity.ok(workflowService.approve(applicationId,
                requireString(body, "reviewerId"), requireInt(body, "level"), optionalString(body, "notes")));
    }

    @PostMapping("/{applicationId}/reject")
    @Operation(summary = "Reject at a review level", description = "Body: reviewerId, level, reason.")
    public ResponseEntity<Application> reject(@PathVariable String applicationId,
                                              @RequestBody Map<String, Object> body) {
        return ResponseEntity.ok(workflowService.reject(applicationId,
                requireString(body, "reviewerId"), requireInt(body, "level"), requireString(body, "reason")));
    }

    @PostMapping("/{applicationId}/request-changes")
    @Operation(summary = "Ask the applicant for changes",
               description = "Body: reviewerId, level, changes, deadlineDays (optional, default 14).")
    public ResponseEntity<Application> requestChanges(@PathVariable String applicationId,
                                                      @RequestBody Map<String, Object> body) {
        return ResponseEntity.ok(workflowService.requestChanges(applicationId,
                requireString(body, "reviewerId"), requireInt(body, "level"),
                requireString(body, "changes"), optionalInt(body, "deadlineDays")));
    }

    @PostMapping("/{applicationId}/resubmit")
    @Operation(summary = "Resubmit with requested changes",
               description = "Returns the application to review at the same level. After the deadline, with "
                       + "expiry policy AUTO_REJECT, the application is rejected instead and returned with status "
                       + "REJECTED; with ESCALATE the late resubmission is accepted.")
    public ResponseEntity<Application> resubmit(@PathVariable String applicationId,
                                                @RequestBody ResubmissionRequest request) {
        return ResponseEntity.ok(workflowService.resubmit(applicationId, request.getApplicantId(), request.getSnapshot()));
    }

    @PostMapping("/{applicationId}/extend-deadline")
    @Operation(summary = "Extend a change request deadline",
               description = "Supervisors only. Body: supervisorId, extraDays. The new deadline counts from now.")
    public ResponseEntity<Application> extendDeadline(@PathVariable String applicationId,
                                                      @RequestBody Map<String, Object> body) {
        return ResponseEntity.ok(workflowService.extendChangesDeadline(applicationId,
                requireString(body, "supervisorId"), requireInt(body, "extraDays")));
    }

    @PostMapping("/{applicationId}/withdraw")
    @Operation(summary = "Withdraw an application", description = "Body: applicantId.")
    public ResponseEntity<Application> withdraw(@PathVariable String applicationId,
                                                @RequestBody Map<String, Object> body) {
        return ResponseEntity.ok(workflowService.withdraw(applicationId, requireString(body, "applicantId")));
    }

    @GetMapping("/{applicationId}")
    @Operation(summary = "Get an application")
    public ResponseEntity<Application> getApplication(@PathVariable String applicationId) {
        return ResponseEntity.ok(workflowService.getApplication(applicationId));
    }

    @GetMapping("/{applicationId}/audit")
    @Operation(summary = "Get the audit trail", description = "Every recorded action on the application, oldest first")
    public ResponseEntity<List<ReviewAction>> getAuditTrail(@PathVariable String applicationId) {
        return ResponseEntity.ok(workflowService.getAuditTrail(applicationId));
    }
}
