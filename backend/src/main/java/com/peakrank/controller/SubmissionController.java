package com.peakrank.controller;

import com.peakrank.controller.dto.SubmissionRequests;
import com.peakrank.controller.dto.SubmissionResponses;
import com.peakrank.model.ActorRole;
import com.peakrank.service.Actor;
import com.peakrank.service.EngineContext;
import com.peakrank.service.SubmissionLifecycleService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
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
@RequestMapping("/api/submissions")
public class SubmissionController {

    private final SubmissionLifecycleService submissionLifecycleService;
    private final Clock clock;

    public SubmissionController(SubmissionLifecycleService submissionLifecycleService, Clock clock) {
        this.submissionLifecycleService = submissionLifecycleService;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<SubmissionResponses.SubmissionDetail> submit(
            @RequestHeader(ActorHeaders.ACTOR_ID) UUID actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @Valid @RequestBody SubmissionRequests.SubmitRequest request
    ) {
        SubmissionResponses.SubmissionDetail submission =
                submissionLifecycleService.submit(request, context(actorId, actorRole));
        return ResponseEntity.status(HttpStatus.CREATED).body(submission);
    }

    @GetMapping("/{submissionId}")
    public ResponseEntity<SubmissionResponses.SubmissionDetail> getSubmission(
            @RequestHeader(ActorHeaders.ACTOR_ID) UUID actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable UUID submissionId
    ) {
        return ResponseEntity.ok(submissionLifecycleService.getSubmission(submissionId, context(actorId, actorRole)));
    }

    @GetMapping("/{submissionId}/history")
    public ResponseEntity<List<SubmissionResponses.SubmissionHistoryEntry>> getHistory(@PathVariable UUID submissionId) {
        return ResponseEntity.ok(submissionLifecycleService.getHistory(submissionId));
    }

    @PostMapping("/{submissionId}/review")
    public ResponseEntity<SubmissionResponses.SubmissionDetail> review(
            @RequestHeader(ActorHeaders.ACTOR_ID) UUID actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable UUID submissionId,
            @Valid @RequestBody SubmissionRequests.ReviewRequest request
    ) {
        return ResponseEntity.ok(
                submissionLifecycleService.review(submissionId, request, context(actorId, actorRole)));
    }

    @PostMapping("/{submissionId}/reopen")
    public ResponseEntity<SubmissionResponses.SubmissionDetail> reopen(
            @RequestHeader(ActorHeaders.ACTOR_ID) UUID actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable UUID submissionId
    ) {
        return ResponseEntity.ok(submissionLifecycleService.reopen(submissionId, context(actorId, actorRole)));
    }

    @DeleteMapping("/{submissionId}")
    public ResponseEntity<Void> delete(
            @RequestHeader(ActorHeaders.ACTOR_ID) UUID actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable UUID submissionId
    ) {
        submissionLifecycleService.delete(submissionId, context(actorId, actorRole));
        return ResponseEntity.noContent().build();
    }

    private EngineContext context(UUID actorId, ActorRole actorRole) {
        return EngineContext.of(new Actor(actorId, actorRole), clock);
    }
}
