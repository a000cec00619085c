package com.heist.backend.service.notification;

import com.heist.backend.config.NotificationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget fan-out to every enabled sender. Nothing here ever reaches the caller
 * as an exception; a failed or rejected send is logged and dropped.
 */
@Slf4j
@Service
public class NotificationService {

    private final List<NotificationSender> senders;
    private final NotificationProperties properties;
    private final Executor executor;

    public NotificationService(List<NotificationSender> senders,
                               NotificationProperties properties,
                               @Qualifier("notificationExecutor") Executor executor) {
        this.senders = senders;
        this.properties = properties;
        this.executor = executor;
    }

    public void notify(String message) {
        if (!properties.isEnabled() || message == null || message.isBlank()) {
            return;
        }
        try {
            executor.execute(() -> deliver(message));
        } catch (RejectedExecutionException e) {
            log.warn("Notification dropped, executor saturated: {}", e.getMessage());
        }
    }

    void deliver(String message) {
        for (NotificationSender sender : senders) {
            if (!sender.isEnabled()) {
                continue;
            }
            try {
                sender.send(message);
            } catch (RuntimeException e) {
                log.warn("Notification via {} failed: {}", sender.name(), e.getMessage());
            }
        }
    }
}
