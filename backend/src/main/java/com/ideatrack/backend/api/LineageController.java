package com.ideatrack.backend.api;

import com.ideatrack.backend.api.dto.LinkRequest;
import com.ideatrack.backend.domain.LineageEdge;
import com.ideatrack.backend.domain.RefinementType;
import com.ideatrack.backend.service.LineageService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/lineage")
public class LineageController {

    private final LineageService lineage;

    public LineageController(LineageService lineage) {
        this.lineage = lineage;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> link(@Valid @RequestBody LinkRequest req) {
        LineageEdge edge = lineage.link(
                req.parentTrackingId,
                req.childTrackingId,
                RefinementType.from(req.refinementType),
                req.depthIncrease,
                req.question
        );
        return ResponseEntity.status(201).body(Map.of("edgeId", edge.id(), "edge", edge));
    }
}
