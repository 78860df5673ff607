package com.peakrank.controller;

import com.peakrank.controller.dto.ProgressionResponses;
import com.peakrank.controller.dto.SubmissionRequests;
import com.peakrank.mapper.GradingResponseMapper;
import com.peakrank.model.ActorRole;
import com.peakrank.service.Actor;
import com.peakrank.service.EngineContext;
import com.peakrank.service.ProgressionLedgerService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/athletes/{athleteId}/progression")
public class ProgressionController {

    private final ProgressionLedgerService progressionLedgerService;
    private final GradingResponseMapper gradingResponseMapper;
    private final Clock clock;

    public ProgressionController(
            ProgressionLedgerService progressionLedgerService,
            GradingResponseMapper gradingResponseMapper,
            Clock clock
    ) {
        this.progressionLedgerService = progressionLedgerService;
        this.gradingResponseMapper = gradingResponseMapper;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<ProgressionResponses.AthleteProgression> getProgression(@PathVariable UUID athleteId) {
        return ResponseEntity.ok(progressionLedgerService.getProgression(athleteId));
    }

    @PostMapping("/adjustments")
    public ResponseEntity<ProgressionResponses.ProgressionUpdate> adjust(
            @RequestHeader(ActorHeaders.ACTOR_ID) UUID actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable UUID athleteId,
            @Valid @RequestBody SubmissionRequests.AdjustXpRequest request
    ) {
        EngineContext context = EngineContext.of(new Actor(actorId, actorRole), clock);
        return ResponseEntity.ok(
                gradingResponseMapper.toProgressionUpdate(progressionLedgerService.adjust(athleteId, request, context)));
    }

    @PostMapping("/reconcile")
    public ResponseEntity<List<ProgressionResponses.ProgressionUpdate>> reconcile(
            @RequestHeader(ActorHeaders.ACTOR_ID) UUID actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable UUID athleteId
    ) {
        EngineContext context = EngineContext.of(new Actor(actorId, actorRole), clock);
        List<ProgressionResponses.ProgressionUpdate> updates = progressionLedgerService.reconcile(athleteId, context)
                .stream()
                .map(gradingResponseMapper::toProgressionUpdate)
                .toList();
        return ResponseEntity.ok(updates);
    }
}
