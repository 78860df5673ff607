package com.peakrank.controller;

import com.peakrank.config.ClockConfig;
import com.peakrank.controller.dto.SubmissionRequests;
import com.peakrank.controller.dto.SubmissionResponses;
import com.peakrank.model.ActorRole;
import com.peakrank.model.ProofType;
import com.peakrank.model.SubmissionStatus;
import com.peakrank.model.Tier;
import com.peakrank.service.EngineContext;
import com.peakrank.service.SubmissionLifecycleService;
import com.peakrank.web.GradingException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SubmissionController.class)
@Import(ClockConfig.class)
class SubmissionControllerTest {

    private static final UUID ACTOR_ID = UUID.fromString("00000000-0000-0000-0000-00000000f001");
    private static final UUID ATHLETE_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");
    private static final UUID CHALLENGE_ID = UUID.fromString("00000000-0000-0000-0000-00000000c001");
    private static final UUID SUBMISSION_ID = UUID.fromString("00000000-0000-0000-0000-00000000b001");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SubmissionLifecycleService submissionLifecycleService;

    @Test
    void submitReturnsCreatedPayloadAndPassesActor() throws Exception {
        when(submissionLifecycleService.submit(any(), any())).thenReturn(detail(SubmissionStatus.PENDING, null));

        mockMvc.perform(post("/api/submissions")
                        .header("X-Actor-Id", ACTOR_ID.toString())
                        .header("X-Actor-Role", "ATHLETE")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "athleteId": "00000000-0000-0000-0000-00000000a001",
                                  "challengeId": "00000000-0000-0000-0000-00000000c001",
                                  "proofType": "STRAVA",
                                  "stravaActivityId": "1234567890",
                                  "achievedValue": 1350
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.submissionId").value(SUBMISSION_ID.toString()))
                .andExpect(jsonPath("$.status").value("PENDING"));

        ArgumentCaptor<SubmissionRequests.SubmitRequest> request =
                ArgumentCaptor.forClass(SubmissionRequests.SubmitRequest.class);
        ArgumentCaptor<EngineContext> context = ArgumentCaptor.forClass(EngineContext.class);
        verify(submissionLifecycleService).submit(request.capture(), context.capture());
        assertEquals(ProofType.STRAVA, request.getValue().proofType());
        assertEquals(0, new BigDecimal("1350").compareTo(request.getValue().achievedValue()));
        assertEquals(ACTOR_ID, context.getValue().actor().userId());
        assertEquals(ActorRole.ATHLETE, context.getValue().actor().role());
    }

    @Test
    void submitValidationFailureReturnsFieldErrors() throws Exception {
        mockMvc.perform(post("/api/submissions")
                        .header("X-Actor-Id", ACTOR_ID.toString())
                        .header("X-Actor-Role", "ATHLETE")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "challengeId": "00000000-0000-0000-0000-00000000c001",
                                  "proofType": "VIDEO",
                                  "videoUrl": "https://video.example/run.mp4"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.athleteId").value("athleteId is required"));

        verify(submissionLifecycleService, never()).submit(any(), any());
    }

    @Test
    void submitWithoutActorHeadersIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/submissions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "athleteId": "00000000-0000-0000-0000-00000000a001",
                                  "challengeId": "00000000-0000-0000-0000-00000000c001",
                                  "proofType": "VIDEO",
                                  "videoUrl": "https://video.example/run.mp4"
                                }
                                """))
                .andExpect(status().isBadRequest());

        verify(submissionLifecycleService, never()).submit(any(), any());
    }

    @Test
    void engineValidationErrorNamesTheField() throws Exception {
        when(submissionLifecycleService.submit(any(), any()))
                .thenThrow(GradingException.validation("supervisorId", "MANUAL proof requires a supervisorId"));

        mockMvc.perform(post("/api/submissions")
                        .header("X-Actor-Id", ACTOR_ID.toString())
                        .header("X-Actor-Role", "ATHLETE")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "athleteId": "00000000-0000-0000-0000-00000000a001",
                                  "challengeId": "00000000-0000-0000-0000-00000000c001",
                                  "proofType": "MANUAL"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_supervisor_id"))
                .andExpect(jsonPath("$.field").value("supervisorId"));
    }

    @Test
    void reviewConflictReturnsConflictCode() throws Exception {
        when(submissionLifecycleService.review(eq(SUBMISSION_ID), any(), any()))
                .thenThrow(GradingException.conflict("submission_already_reviewed", "already approved"));

        mockMvc.perform(post("/api/submissions/{submissionId}/review", SUBMISSION_ID)
                        .header("X-Actor-Id", ACTOR_ID.toString())
                        .header("X-Actor-Role", "COACH")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "decision": "APPROVED",
                                  "achievedValue": 1200
                                }
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("submission_already_reviewed"));
    }

    @Test
    void reviewApproveReturnsResolvedTiers() throws Exception {
        when(submissionLifecycleService.review(eq(SUBMISSION_ID), any(), any()))
                .thenReturn(detail(SubmissionStatus.APPROVED, Tier.E));

        mockMvc.perform(post("/api/submissions/{submissionId}/review", SUBMISSION_ID)
                        .header("X-Actor-Id", ACTOR_ID.toString())
                        .header("X-Actor-Role", "COACH")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "decision": "APPROVED"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andExpect(jsonPath("$.achievedTier").value("E"))
                .andExpect(jsonPath("$.claimedTiers[0]").value("F"))
                .andExpect(jsonPath("$.claimedTiers[1]").value("E"));
    }

    @Test
    void deleteReturnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/submissions/{submissionId}", SUBMISSION_ID)
                        .header("X-Actor-Id", ACTOR_ID.toString())
                        .header("X-Actor-Role", "ATHLETE"))
                .andExpect(status().isNoContent());

        verify(submissionLifecycleService).delete(eq(SUBMISSION_ID), any(EngineContext.class));
    }

    @Test
    void unknownSubmissionReturnsNotFound() throws Exception {
        when(submissionLifecycleService.getSubmission(eq(SUBMISSION_ID), any()))
                .thenThrow(GradingException.notFound("Submission", SUBMISSION_ID));

        mockMvc.perform(get("/api/submissions/{submissionId}", SUBMISSION_ID)
                        .header("X-Actor-Id", ACTOR_ID.toString())
                        .header("X-Actor-Role", "ATHLETE"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("submission_not_found"));
    }

    private static SubmissionResponses.SubmissionDetail detail(SubmissionStatus status, Tier tier) {
        OffsetDateTime now = OffsetDateTime.parse("2026-06-15T12:00:00Z");
        return new SubmissionResponses.SubmissionDetail(
                SUBMISSION_ID,
                ATHLETE_ID,
                CHALLENGE_ID,
                ProofType.STRAVA,
                null,
                null,
                "1234567890",
                null,
                null,
                null,
                null,
                new BigDecimal("1350"),
                false,
                tier,
                tier == null ? List.of() : List.of(Tier.F, Tier.E),
                null,
                status,
                null,
                null,
                null,
                tier == null ? 0 : 75,
                false,
                true,
                false,
                now,
                now
        );
    }
}
