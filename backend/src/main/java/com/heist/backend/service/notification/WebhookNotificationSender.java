package com.heist.backend.service.notification;

import com.heist.backend.config.NotificationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Posts {@code {"text": ...}} to a chat webhook (Slack and Discord compatible).
 */
@Slf4j
@Component
public class WebhookNotificationSender implements NotificationSender {

    private final RestTemplate restTemplate;
    private final NotificationProperties properties;

    public WebhookNotificationSender(RestTemplate collaboratorRestTemplate, NotificationProperties properties) {
        this.restTemplate = collaboratorRestTemplate;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public boolean isEnabled() {
        NotificationProperties.Webhook webhook = properties.getWebhook();
        return webhook.isEnabled() && webhook.getUrl() != null && !webhook.getUrl().isBlank();
    }

    @Override
    public void send(String message) {
        restTemplate.postForEntity(properties.getWebhook().getUrl(), Map.of("text", message), String.class);
        log.debug("Webhook notification sent");
    }
}
