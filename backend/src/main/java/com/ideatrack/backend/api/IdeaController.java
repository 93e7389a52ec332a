package com.ideatrack.backend.api;

import com.ideatrack.backend.api.dto.OutcomeRequest;
import com.ideatrack.backend.api.dto.SubmitIdeaRequest;
import com.ideatrack.backend.domain.*;
import com.ideatrack.backend.service.LineageService;
import com.ideatrack.backend.service.OutcomeService;
import com.ideatrack.backend.service.SubmissionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/ideas")
public class IdeaController {

    private final SubmissionService submissions;
    private final LineageService lineage;
    private final OutcomeService outcomes;

    public IdeaController(SubmissionService submissions, LineageService lineage, OutcomeService outcomes) {
        this.submissions = submissions;
        this.lineage = lineage;
        this.outcomes = outcomes;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> submit(@Valid @RequestBody SubmitIdeaRequest req) {
        IdeaSubmission s = submissions.create(req.ownerId, req.text, req.confidence, req.classification);
        return ResponseEntity.status(201).body(Map.of("trackingId", s.id(), "submission", s));
    }

    @GetMapping("/{trackingId}")
    public IdeaSubmission get(@PathVariable String trackingId) {
        return submissions.get(trackingId);
    }

    @GetMapping("/{trackingId}/ancestors")
    public List<AncestorStep> ancestors(@PathVariable String trackingId) {
        return lineage.ancestors(trackingId).toList();
    }

    @GetMapping("/{trackingId}/children")
    public List<IdeaSubmission> children(@PathVariable String trackingId) {
        return lineage.descendants(trackingId);
    }

    @GetMapping("/{trackingId}/lineage")
    public LineageView lineageView(@PathVariable String trackingId) {
        return lineage.lineage(trackingId);
    }

    @PostMapping("/{trackingId}/outcome")
    public Map<String, Object> recordOutcome(@PathVariable String trackingId,
                                             @Valid @RequestBody OutcomeRequest req) {
        Instant validatedAt;
        // ✅ ts 파싱 실패 방어
        try {
            validatedAt = (req.validatedAt != null && !req.validatedAt.isBlank())
                    ? Instant.parse(req.validatedAt.trim())
                    : null;
        } catch (DateTimeParseException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "invalid_validatedAt");
        }

        OutcomeRecording rec = outcomes.recordOutcome(new OutcomeService.OutcomeCommand(
                trackingId,
                req.result,
                req.validationSource,
                validatedAt,
                req.validationUrl,
                req.validationNotes
        ));
        return Map.of(
                "outcomeId", rec.outcome().id(),
                "outcome", rec.outcome(),
                "credits", rec.credits(),
                "warnings", rec.warnings()
        );
    }

    @GetMapping("/{trackingId}/outcome")
    public Outcome outcome(@PathVariable String trackingId) {
        return outcomes.getOutcome(trackingId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "outcome_not_recorded"));
    }
}
