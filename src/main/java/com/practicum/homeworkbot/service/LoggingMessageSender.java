package com.practicum.homeworkbot.service;

import com.practicum.homeworkbot.config.NotificationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

// Local runs and tests: messages only go to the log.
@Component
@ConditionalOnProperty(name = "notification.channel", havingValue = NotificationConfig.CHANNEL_LOG)
public class LoggingMessageSender implements MessageSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingMessageSender.class);

    private final NotificationConfig config;

    public LoggingMessageSender(NotificationConfig config) {
        this.config = config;
    }

    @Override
    public String channel() {
        return NotificationConfig.CHANNEL_LOG;
    }

    @Override
    public void send(String text) {
        log.info("Message to {}: {}", config.getChatId(), text);
    }
}
