package com.ideatrack.backend.api;

import com.ideatrack.backend.domain.HistoryEvent;
import com.ideatrack.backend.domain.TimeCapsuleEntry;
import com.ideatrack.backend.domain.UserAccuracyProfile;
import com.ideatrack.backend.service.HistoryService;
import com.ideatrack.backend.service.ReputationService;
import com.ideatrack.backend.service.TimeCapsuleService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-owner read models: profile, time capsule and history.
 */
@RestController
@RequestMapping("/api/v1/owners/{ownerId}")
public class OwnerController {

    private final ReputationService reputation;
    private final TimeCapsuleService timeCapsule;
    private final HistoryService history;

    public OwnerController(ReputationService reputation, TimeCapsuleService timeCapsule, HistoryService history) {
        this.reputation = reputation;
        this.timeCapsule = timeCapsule;
        this.history = history;
    }

    @GetMapping("/profile")
    public UserAccuracyProfile profile(@PathVariable String ownerId) {
        return reputation.getProfile(ownerId);
    }

    @PostMapping("/profile/recompute")
    public UserAccuracyProfile recompute(@PathVariable String ownerId) {
        return reputation.recompute(ownerId);
    }

    @GetMapping("/time-capsule")
    public List<TimeCapsuleEntry> timeCapsule(@PathVariable String ownerId,
                                              @RequestParam(required = false)
                                              @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since) {
        List<TimeCapsuleEntry> out = new ArrayList<>();
        timeCapsule.get(ownerId, since).forEach(out::add);
        return out;
    }

    @GetMapping("/history")
    public List<HistoryEvent> history(@PathVariable String ownerId,
                                      @RequestParam(required = false) String scope,
                                      @RequestParam(required = false) String entityId,
                                      @RequestParam(required = false) String type,
                                      @RequestParam(defaultValue = "50") int limit) {
        return history.query(ownerId, scope, entityId, type, limit);
    }
}
