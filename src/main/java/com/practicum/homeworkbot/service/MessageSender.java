package com.practicum.homeworkbot.service;

/**
 * Delivers a text message to the configured recipient. Implementations may throw on delivery failure;
 * {@link NotificationService} contains it.
 */
public interface MessageSender {

    /** Channel name used in logs and metric tags. */
    String channel();

    void send(String text);
}
