package com.poultry.review.controller;

import com.poultry.review.exception.AlreadyClaimedException;
import com.poultry.review.exception.ConcurrentUpdateException;
import com.poultry.review.exception.NotClaimedByCallerException;
import com.poultry.review.exception.QueueEntryNotFoundException;
import com.poultry.review.model.*;
import com.poultry.review.service.ReviewQueueService;
import com.poultry.review.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ReviewQueueController.class)
class ReviewQueueControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReviewQueueService reviewQueueService;

    @Test
    void getQueue_passesFilters() throws Exception {
        QueueEntry entry = TestDataFactory.createQueueEntry("APP-1", 1, QueueEntryStatus.PENDING);
        when(reviewQueueService.list(eq(1), any(QueueFilter.class))).thenReturn(List.of(entry));

        mockMvc.perform(get("/api/v1/review/queue")
                        .param("level", "1")
                        .param("constituency", "Ayawaso West")
                        .param("kind", "FARMER_REGISTRATION")
                        .param("escalatedOnly", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].entryId").value("APP-1-L1"))
                .andExpect(jsonPath("$[0].status").value("PENDING"));

        ArgumentCaptor<QueueFilter> filter = ArgumentCaptor.forClass(QueueFilter.class);
        verify(reviewQueueService).list(eq(1), filter.capture());
        assertThat(filter.getValue().getConstituency()).isEqualTo("Ayawaso West");
        assertThat(filter.getValue().getKind()).isEqualTo(ApplicationKind.FARMER_REGISTRATION);
        assertThat(filter.getValue().isEscalatedOnly()).isTrue();
        assertThat(filter.getValue().getRegion()).isNull();
    }

    @Test
    void getQueue_invalidKind_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/review/queue").param("level", "1").param("kind", "POULTRY"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    void claim_success() throws Exception {
        QueueEntry claimed = TestDataFactory.createQueueEntry("APP-1", 1, QueueEntryStatus.CLAIMED);
        claimed.setAssignedTo("officer-ayawaso");
        when(reviewQueueService.claim("APP-1-L1", "officer-ayawaso")).thenReturn(claimed);

        mockMvc.perform(post("/api/v1/review/queue/APP-1-L1/claim")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewerId\":\"officer-ayawaso\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assignedTo").value("officer-ayawaso"))
                .andExpect(jsonPath("$.status").value("CLAIMED"));
    }

    @Test
    void claim_alreadyClaimed_returns409() throws Exception {
        when(reviewQueueService.claim("APP-1-L1", "officer-ayawaso-2"))
                .thenThrow(new AlreadyClaimedException("APP-1-L1", "officer-ayawaso"));

        mockMvc.perform(post("/api/v1/review/queue/APP-1-L1/claim")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewerId\":\"officer-ayawaso-2\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("ALREADY_CLAIMED"));
    }

    @Test
    void claim_conflictRetriesExhausted_returns409() throws Exception {
        when(reviewQueueService.claim("APP-1-L1", "officer-ayawaso"))
                .thenThrow(new ConcurrentUpdateException("APP-1", 5));

        mockMvc.perform(post("/api/v1/review/queue/APP-1-L1/claim")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewerId\":\"officer-ayawaso\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("CONCURRENT_UPDATE"));
    }

    @Test
    void claim_missingReviewer_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/review/queue/APP-1-L1/claim")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(reviewQueueService);
    }

    @Test
    void release_notHolder_returns409() throws Exception {
        when(reviewQueueService.release("APP-1-L1", "officer-ayawaso-2"))
                .thenThrow(new NotClaimedByCallerException("APP-1-L1", "officer-ayawaso-2"));

        mockMvc.perform(post("/api/v1/review/queue/APP-1-L1/release")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewerId\":\"officer-ayawaso-2\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("NOT_CLAIMED_BY_CALLER"));
    }

    @Test
    void reassign_passesSupervisorAndReviewer() throws Exception {
        QueueEntry entry = TestDataFactory.createQueueEntry("APP-1", 1, QueueEntryStatus.CLAIMED);
        entry.setAssignedTo("officer-ayawaso-2");
        when(reviewQueueService.reassign("APP-1-L1", "supervisor-1", "officer-ayawaso-2")).thenReturn(entry);

        mockMvc.perform(post("/api/v1/review/queue/APP-1-L1/reassign")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"supervisorId\":\"supervisor-1\",\"reviewerId\":\"officer-ayawaso-2\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assignedTo").value("officer-ayawaso-2"));
    }

    @Test
    void reassign_unknownEntry_returns404() throws Exception {
        when(reviewQueueService.reassign("APP-9-L1", "supervisor-1", "officer-ayawaso"))
                .thenThrow(new QueueEntryNotFoundException("APP-9-L1"));

        mockMvc.perform(post("/api/v1/review/queue/APP-9-L1/reassign")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"supervisorId\":\"supervisor-1\",\"reviewerId\":\"officer-ayawaso\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getStats_success() throws Exception {
        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("pending", 3);
        stats.put("claimed", 1);
        stats.put("overdue", 2);
        when(reviewQueueService.stats(1)).thenReturn(stats);

        mockMvc.perform(get("/api/v1/review/stats").param("level", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pending").value(3))
                .andExpect(jsonPath("$.overdue").value(2));
    }
}
