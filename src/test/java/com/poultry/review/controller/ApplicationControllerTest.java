package com.poultry.review.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poultry.review.exception.ApplicationNotFoundException;
import com.poultry.review.exception.InvalidStateException;
import com.poultry.review.exception.LevelMismatchException;
import com.poultry.review.exception.UnauthorizedActionException;
import com.poultry.review.exception.ValidationException;
import com.poultry.review.model.*;
import com.poultry.review.service.ReviewWorkflowService;
import com.poultry.review.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ApplicationController.class)
class ApplicationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ReviewWorkflowService workflowService;

    @Test
    void createDraft_returns201() throws Exception {
        Application draft = TestDataFactory.createApplication("APP-1").toBuilder()
                .status(ApplicationStatus.DRAFT)
                .currentReviewLevel(null)
                .build();
        when(workflowService.createDraft(any(ApplicationDraft.class))).thenReturn(draft);

        mockMvc.perform(post("/api/v1/applications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                TestDataFactory.createDraft(ApplicationKind.FARMER_REGISTRATION))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.applicationId").value("APP-1"))
                .andExpect(jsonPath("$.status").value("DRAFT"));
    }

    @Test
    void submit_success() throws Exception {
        when(workflowService.submit("APP-1")).thenReturn(TestDataFactory.createApplication("APP-1"));

        mockMvc.perform(post("/api/v1/applications/APP-1/submit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UNDER_REVIEW"))
                .andExpect(jsonPath("$.currentReviewLevel").value(1));
    }

    @Test
    void submit_validationFailure_returns400() throws Exception {
        when(workflowService.submit("APP-1"))
                .thenThrow(new ValidationException("Missing required fields: region"));

        mockMvc.perform(post("/api/v1/applications/APP-1/submit"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("Missing required fields: region"));
    }

    @Test
    void approve_passesReviewerLevelAndNotes() throws Exception {
        Application advanced = TestDataFactory.createApplication("APP-1");
        advanced.setCurrentReviewLevel(2);
        when(workflowService.approve("APP-1", "officer-ayawaso", 1, "ok")).thenReturn(advanced);

        mockMvc.perform(post("/api/v1/applications/APP-1/approve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                Map.of("reviewerId", "officer-ayawaso", "level", 1, "notes", "ok"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentReviewLevel").value(2));
    }

    @Test
    void approve_missingLevel_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/applications/APP-1/approve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewerId\":\"officer-ayawaso\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("level is required"));

        verifyNoInteractions(workflowService);
    }

    @Test
    void approve_levelMismatch_returns409() throws Exception {
        when(workflowService.approve("APP-1", "officer-ayawaso", 2, null))
                .thenThrow(new LevelMismatchException("APP-1", 2, 1));

        mockMvc.perform(post("/api/v1/applications/APP-1/approve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewerId\":\"officer-ayawaso\",\"level\":2}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("LEVEL_MISMATCH"));
    }

    @Test
    void reject_unauthorized_returns403() throws Exception {
        when(workflowService.reject("APP-1", "officer-tema", 1, "no"))
                .thenThrow(new UnauthorizedActionException("officer-tema may not decide"));

        mockMvc.perform(post("/api/v1/applications/APP-1/reject")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewerId\":\"officer-tema\",\"level\":1,\"reason\":\"no\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("UNAUTHORIZED"));
    }

    @Test
    void requestChanges_optionalDeadlineDays() throws Exception {
        Application paused = TestDataFactory.createApplication("APP-1");
        paused.setStatus(ApplicationStatus.CHANGES_REQUESTED);
        when(workflowService.requestChanges("APP-1", "officer-ayawaso", 1, "Add photos", 7)).thenReturn(paused);

        mockMvc.perform(post("/api/v1/applications/APP-1/request-changes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewerId\":\"officer-ayawaso\",\"level\":1,"
                                + "\"changes\":\"Add photos\",\"deadlineDays\":7}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CHANGES_REQUESTED"));
    }

    @Test
    void resubmit_passesApplicantAndSnapshot() throws Exception {
        when(workflowService.resubmit(eq("APP-1"), eq("farmer-1001"), any(ApplicantSnapshot.class)))
                .thenReturn(TestDataFactory.createApplication("APP-1"));
        ResubmissionRequest request = ResubmissionRequest.builder()
                .applicantId("farmer-1001")
                .snapshot(TestDataFactory.createSnapshot())
                .build();

        mockMvc.perform(post("/api/v1/applications/APP-1/resubmit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UNDER_REVIEW"));
    }

    @Test
    void withdraw_terminal_returns409() throws Exception {
        when(workflowService.withdraw("APP-1", "farmer-1001"))
                .thenThrow(new InvalidStateException("Application APP-1 is already APPROVED"));

        mockMvc.perform(post("/api/v1/applications/APP-1/withdraw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"applicantId\":\"farmer-1001\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("INVALID_STATE"));
    }

    @Test
    void extendDeadline_passesSupervisorAndDays() throws Exception {
        Application app = TestDataFactory.createApplication("APP-1").toBuilder()
                .status(ApplicationStatus.CHANGES_REQUESTED)
                .changesDeadline(5_000L)
                .build();
        when(workflowService.extendChangesDeadline("APP-1", "supervisor-1", 7)).thenReturn(app);

        mockMvc.perform(post("/api/v1/applications/APP-1/extend-deadline")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"supervisorId\":\"supervisor-1\",\"extraDays\":7}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CHANGES_REQUESTED"))
                .andExpect(jsonPath("$.changesDeadline").value(5000));
    }

    @Test
    void extendDeadline_nonSupervisor_returns403() throws Exception {
        when(workflowService.extendChangesDeadline("APP-1", "officer-ayawaso", 7))
                .thenThrow(new UnauthorizedActionException("officer-ayawaso is not a supervisor"));

        mockMvc.perform(post("/api/v1/applications/APP-1/extend-deadline")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"supervisorId\":\"officer-ayawaso\",\"extraDays\":7}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("UNAUTHORIZED"));
    }

    @Test
    void getApplication_notFound_returns404() throws Exception {
        when(workflowService.getApplication("MISSING")).thenThrow(new ApplicationNotFoundException("MISSING"));

        mockMvc.perform(get("/api/v1/applications/MISSING"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"))
                .andExpect(jsonPath("$.path").value("/api/v1/applications/MISSING"));
    }

    @Test
    void getAuditTrail_returnsActionsInOrder() throws Exception {
        when(workflowService.getAuditTrail("APP-1")).thenReturn(List.of(
                ReviewAction.builder().actionId("APP-1-A001").applicationId("APP-1")
                        .action(ReviewActionType.SUBMITTED).reviewLevel(1).createdAt(1L).build(),
                ReviewAction.builder().actionId("APP-1-A002").applicationId("APP-1").reviewerId("officer-ayawaso")
                        .action(ReviewActionType.APPROVED).reviewLevel(1).createdAt(2L).build()));

        mockMvc.perform(get("/api/v1/applications/APP-1/audit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].action").value("SUBMITTED"))
                .andExpect(jsonPath("$[1].reviewerId").value("officer-ayawaso"));
    }

    @Test
    void malformedBody_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/applications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }
}
