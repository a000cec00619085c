package com.heist.backend.service.notification;

public interface NotificationSender {

    String name();

    boolean isEnabled();

    void send(String message);
}
