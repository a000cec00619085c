package com.heist.backend.config;

import com.heist.backend.service.EngineLifecycle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationFailedEvent;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class StartupLifecycleListener implements ApplicationListener<ApplicationFailedEvent> {

    @Override
    public void onApplicationEvent(ApplicationFailedEvent event) {
        Throwable exception = event.getException();
        Throwable root = rootCause(exception);
        log.error("FATAL Startup failure. Root cause: {}", root.getMessage(), exception);
    }

    @Component
    @Slf4j
    @RequiredArgsConstructor
    public static class StartupReadyListener implements ApplicationListener<ApplicationReadyEvent> {

        private final EngineLifecycle engineLifecycle;

        @Override
        public void onApplicationEvent(ApplicationReadyEvent event) {
            engineLifecycle.start();
            log.info("🚀 Heist engine ready, loops armed");
        }
    }

    private Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
