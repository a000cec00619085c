package com.heist.backend.controller;

import com.heist.backend.dto.StatusResponse;
import com.heist.backend.model.PipelineDecision;
import com.heist.backend.service.pipeline.PipelineStats;
import com.heist.backend.service.pipeline.StatusReporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class StatusController {

    private final StatusReporter statusReporter;
    private final PipelineStats pipelineStats;

    @GetMapping("/status")
    public ResponseEntity<StatusResponse> getStatus() {
        log.debug("Fetching engine status");
        return ResponseEntity.ok(statusReporter.status());
    }

    @GetMapping("/pipeline/decisions")
    public ResponseEntity<List<PipelineDecision>> getDecisions(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(pipelineStats.recentDecisions(Math.min(Math.max(limit, 1), 500)));
    }
}
