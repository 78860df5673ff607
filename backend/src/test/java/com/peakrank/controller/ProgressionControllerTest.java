package com.peakrank.controller;

import com.peakrank.config.ClockConfig;
import com.peakrank.controller.dto.ProgressionResponses;
import com.peakrank.mapper.GradingResponseMapper;
import com.peakrank.model.Tier;
import com.peakrank.service.ProgressionChange;
import com.peakrank.service.ProgressionLedgerService;
import com.peakrank.service.RankChange;
import com.peakrank.web.GradingException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ProgressionController.class)
@Import({ClockConfig.class, GradingResponseMapper.class})
class ProgressionControllerTest {

    private static final UUID ATHLETE_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");
    private static final UUID DOMAIN_ID = UUID.fromString("00000000-0000-0000-0000-00000000d001");
    private static final UUID REQUIREMENT_ID = UUID.fromString("00000000-0000-0000-0000-00000000e001");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProgressionLedgerService progressionLedgerService;

    @Test
    void getProgressionReturnsDomainsAndRanks() throws Exception {
        OffsetDateTime now = OffsetDateTime.parse("2026-06-15T12:00:00Z");
        when(progressionLedgerService.getProgression(ATHLETE_ID)).thenReturn(new ProgressionResponses.AthleteProgression(
                ATHLETE_ID,
                List.of(new ProgressionResponses.DomainProgressView(DOMAIN_ID, 7450L, 30, Tier.C, 0, "C0", 350L, now)),
                List.of(new ProgressionResponses.UnlockedRank(REQUIREMENT_ID, DOMAIN_ID, "Iron", now))
        ));

        mockMvc.perform(get("/api/athletes/{athleteId}/progression", ATHLETE_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.domains[0].currentXp").value(7450))
                .andExpect(jsonPath("$.domains[0].levelLabel").value("C0"))
                .andExpect(jsonPath("$.domains[0].xpToNextLevel").value(350))
                .andExpect(jsonPath("$.ranks[0].rankName").value("Iron"));
    }

    @Test
    void adjustReturnsProgressionUpdate() throws Exception {
        when(progressionLedgerService.adjust(eq(ATHLETE_ID), any(), any())).thenReturn(new ProgressionChange(
                ATHLETE_ID, DOMAIN_ID, 950L, 1200L, 9, 11,
                List.of(new RankChange(REQUIREMENT_ID, DOMAIN_ID, "Iron", true))
        ));

        mockMvc.perform(post("/api/athletes/{athleteId}/progression/adjustments", ATHLETE_ID)
                        .header("X-Actor-Id", UUID.randomUUID().toString())
                        .header("X-Actor-Role", "SYSTEM_ADMIN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "domainId": "00000000-0000-0000-0000-00000000d001",
                                  "amount": 250,
                                  "note": "Event bonus"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.newXp").value(1200))
                .andExpect(jsonPath("$.newLevel").value(11))
                .andExpect(jsonPath("$.rankChanges[0].unlocked").value(true));
    }

    @Test
    void adjustWithoutNoteIsRejectedBeforeTheLedger() throws Exception {
        mockMvc.perform(post("/api/athletes/{athleteId}/progression/adjustments", ATHLETE_ID)
                        .header("X-Actor-Id", UUID.randomUUID().toString())
                        .header("X-Actor-Role", "SYSTEM_ADMIN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "domainId": "00000000-0000-0000-0000-00000000d001",
                                  "amount": 250
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.note").value("note is required"));

        verify(progressionLedgerService, never()).adjust(any(), any(), any());
    }

    @Test
    void reconcileByCoachIsForbidden() throws Exception {
        when(progressionLedgerService.reconcile(eq(ATHLETE_ID), any()))
                .thenThrow(GradingException.forbidden("Only gym or system admins may reconcile XP"));

        mockMvc.perform(post("/api/athletes/{athleteId}/progression/reconcile", ATHLETE_ID)
                        .header("X-Actor-Id", UUID.randomUUID().toString())
                        .header("X-Actor-Role", "COACH"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("forbidden"));
    }
}
