package com.ideatrack.backend.api;

import com.ideatrack.backend.domain.UserAccuracyProfile;
import com.ideatrack.backend.service.ReputationService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final ReputationService reputation;

    public AdminController(ReputationService reputation) {
        this.reputation = reputation;
    }

    /**
     * Rebuilds the credit ledger and every profile from outcomes and lineage.
     */
    @PostMapping("/rebuild")
    public Map<String, Object> rebuild() {
        List<UserAccuracyProfile> profiles = reputation.rebuildAll();
        return Map.of("ok", true, "profiles", profiles.size());
    }
}
