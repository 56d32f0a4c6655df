package com.flavorsnap.backend.common.web;

import com.flavorsnap.backend.category.controller.CategoryController;
import com.flavorsnap.backend.category.model.ModerationAction;
import com.flavorsnap.backend.category.model.VoteType;
import com.flavorsnap.backend.category.service.CategorySubmissionService;
import com.flavorsnap.backend.category.service.ModerationService;
import com.flavorsnap.backend.category.service.TrainingQueueCoordinator;
import com.flavorsnap.backend.category.service.VoteLedger;
import com.flavorsnap.backend.common.error.InvalidTransitionException;
import com.flavorsnap.backend.common.error.NotFoundException;
import com.flavorsnap.backend.common.error.StorageUnavailableException;
import com.flavorsnap.backend.common.error.VotingClosedException;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ActiveProfiles("test")
@WebMvcTest(controllers = CategoryController.class)
@Import({ApiExceptionHandler.class, RequestIdFilter.class})
class ApiExceptionHandlerTest {

    @Autowired MockMvc mvc;

    @MockitoBean CategorySubmissionService submissionService;
    @MockitoBean VoteLedger voteLedger;
    @MockitoBean ModerationService moderationService;
    @MockitoBean TrainingQueueCoordinator trainingQueue;

    @Test
    void not_found_should_404_with_requestId() throws Exception {
        Mockito.when(submissionService.get(eq("nope")))
                .thenThrow(new NotFoundException("CATEGORY_NOT_FOUND", "nope"));

        mvc.perform(get("/api/v1/categories/nope").header("X-Request-Id", "RID-404"))
                .andExpect(status().isNotFound())
                .andExpect(header().string("X-Request-Id", "RID-404"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.errorCode").value("CATEGORY_NOT_FOUND"))
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"))
                .andExpect(jsonPath("$.requestId").value("RID-404"));
    }

    @Test
    void vote_on_closed_category_should_409() throws Exception {
        Mockito.when(voteLedger.castVote(eq("c1"), eq("B"), eq(VoteType.UPVOTE)))
                .thenThrow(new VotingClosedException("c1", "APPROVED"));

        mvc.perform(post("/api/v1/categories/c1/vote")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"voterId\":\"B\",\"voteType\":\"upvote\"}")
                        .header("X-Request-Id", "RID-409"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("VOTING_CLOSED"))
                .andExpect(jsonPath("$.kind").value("VOTING_CLOSED"))
                .andExpect(jsonPath("$.requestId").value("RID-409"))
                .andExpect(header().doesNotExist("Retry-After"));
    }

    @Test
    void second_moderation_should_409_invalid_transition() throws Exception {
        Mockito.when(moderationService.moderate(eq("c1"), eq("m1"), eq(ModerationAction.REJECT), any()))
                .thenThrow(new InvalidTransitionException("INVALID_TRANSITION", "APPROVED", "REJECTED"));

        mvc.perform(post("/api/v1/categories/c1/moderate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"moderatorId\":\"m1\",\"action\":\"reject\"}"))
                .andExpect(status().isConflict())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.kind").value("INVALID_TRANSITION"));
    }

    @Test
    void unknown_vote_type_should_400_without_calling_ledger() throws Exception {
        mvc.perform(post("/api/v1/categories/c1/vote")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"voterId\":\"A\",\"voteType\":\"meh\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_VOTE_TYPE"))
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));

        Mockito.verifyNoInteractions(voteLedger);
    }

    @Test
    void malformed_body_should_400() throws Exception {
        mvc.perform(post("/api/v1/categories/c1/vote")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));
    }

    @Test
    void storage_failure_should_503_with_retry_after_and_fixed_message() throws Exception {
        Mockito.when(submissionService.get(eq("c1")))
                .thenThrow(new StorageUnavailableException("LOCK_TIMEOUT",
                        new IllegalStateException("Deadlock found when trying to get lock")));

        mvc.perform(get("/api/v1/categories/c1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "1"))
                .andExpect(jsonPath("$.errorCode").value("LOCK_TIMEOUT"))
                .andExpect(jsonPath("$.kind").value("STORAGE_UNAVAILABLE"))
                .andExpect(jsonPath("$.message").value(StorageUnavailableException.MESSAGE))
                .andExpect(jsonPath("$.retryAfterSec").value(1));
    }

    @Test
    void raw_data_access_exception_is_also_storage_unavailable() throws Exception {
        Mockito.when(submissionService.stats()).thenThrow(new QueryTimeoutException("mysql said no"));

        mvc.perform(get("/api/v1/categories/stats"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value(StorageUnavailableException.MESSAGE));
    }

    @Test
    void unexpected_error_should_500_generic() throws Exception {
        Mockito.when(trainingQueue.listQueued()).thenThrow(new IllegalStateException("secret internals"));

        mvc.perform(get("/api/v1/categories/training/queue"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorCode").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("Internal server error"));
    }
}
