package com.heist.backend.controller;

import com.heist.backend.dto.IngestMessageRequest;
import com.heist.backend.dto.IngestResponse;
import com.heist.backend.model.IngestedMessage;
import com.heist.backend.model.Signal;
import com.heist.backend.service.signal.SignalDetector;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Webhook for ingestion collaborators (chat bridges, scrapers) to push raw messages.
 */
@Slf4j
@RestController
@RequestMapping("/api/ingest")
@RequiredArgsConstructor
public class IngestController {

    private final SignalDetector signalDetector;

    @PostMapping("/messages")
    public ResponseEntity<IngestResponse> ingest(@Valid @RequestBody IngestMessageRequest request) {
        Optional<Signal> signal = signalDetector.ingest(new IngestedMessage(
                request.getText(), request.getPlatform(), request.getChannel(), request.getMessageId()));
        IngestResponse response = IngestResponse.builder()
                .signalEmitted(signal.isPresent())
                .signal(signal.orElse(null))
                .build();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
}
