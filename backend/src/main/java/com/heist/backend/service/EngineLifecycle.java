package com.heist.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run flag checked at the top of every loop iteration. Clearing it lets in-flight
 * work finish while no new iteration starts.
 */
@Service
@Slf4j
public class EngineLifecycle {

    private final AtomicBoolean running = new AtomicBoolean(false);

    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("▶️ Engine loops started");
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("⏹️ Engine loops stopping");
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
