package com.heist.backend.controller;

import com.heist.backend.exception.BadRequestException;
import com.heist.backend.exception.NotFoundException;
import com.heist.backend.model.Signal;
import com.heist.backend.model.TokenMetrics;
import com.heist.backend.service.signal.SignalDetector;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/signals")
@RequiredArgsConstructor
public class SignalsController {

    private final SignalDetector signalDetector;

    @GetMapping
    public ResponseEntity<List<Signal>> topSignals(@RequestParam(defaultValue = "10") int limit) {
        if (limit < 1 || limit > 500) {
            throw new BadRequestException("limit must be between 1 and 500");
        }
        return ResponseEntity.ok(signalDetector.topSignals(limit));
    }

    @GetMapping("/metrics/{address}")
    public ResponseEntity<TokenMetrics> metrics(@PathVariable String address) {
        return signalDetector.metrics(address)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("No metrics for " + address));
    }
}
