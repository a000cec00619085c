package com.heist.backend.controller;

import com.heist.backend.exception.NotFoundException;
import com.heist.backend.model.PositionSnapshot;
import com.heist.backend.service.execution.ExecutionEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/positions")
@RequiredArgsConstructor
public class PositionsController {

    private final ExecutionEngine executionEngine;

    @GetMapping("/open")
    public ResponseEntity<List<PositionSnapshot>> openPositions() {
        return ResponseEntity.ok(executionEngine.openPositions());
    }

    @GetMapping("/closed")
    public ResponseEntity<List<PositionSnapshot>> closedPositions() {
        return ResponseEntity.ok(executionEngine.closedPositions());
    }

    @GetMapping("/{id}")
    public ResponseEntity<PositionSnapshot> position(@PathVariable String id) {
        return executionEngine.position(id)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("Position " + id + " not found"));
    }
}
