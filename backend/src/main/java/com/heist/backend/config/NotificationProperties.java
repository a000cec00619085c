package com.heist.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "notification")
@Data
@Validated
public class NotificationProperties {

    private boolean enabled = true;

    private Webhook webhook = new Webhook();

    @Data
    public static class Webhook {
        private boolean enabled = false;
        private String url = "";
    }
}
