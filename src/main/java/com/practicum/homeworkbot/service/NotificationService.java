package com.practicum.homeworkbot.service;

import com.practicum.homeworkbot.config.MetricsConfig;
import com.practicum.homeworkbot.model.ErrorSignature;
import com.practicum.homeworkbot.model.StatusChange;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Formats bot messages and hands them to the active {@link MessageSender}.
 *
 * <p>Delivery failures never propagate: every method reports success as a boolean and the caller
 * decides what a lost message means.
 */
@Service
@Observed(name = "notification.send", contextualName = "send-notification")
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private static final DateTimeFormatter STARTED_AT = DateTimeFormatter.ofPattern("dd-MM-yyyy HH:mm")
            .withZone(ZoneId.systemDefault());

    private final MessageSender sender;
    private final MetricsConfig metricsConfig;

    public NotificationService(MessageSender sender, MetricsConfig metricsConfig) {
        this.sender = sender;
        this.metricsConfig = metricsConfig;
    }

    public boolean announceStartup(Instant startedAt) {
        return send("Homework bot started: " + STARTED_AT.format(startedAt));
    }

    public boolean notifyStatusChange(StatusChange change) {
        String body = String.format("Review status of homework \"%s\" changed: %s. %s",
                change.name(), change.verdict().code(), change.verdictText());
        return send(body);
    }

    public boolean alertFailure(ErrorSignature signature) {
        return send(String.format("Homework bot failure [%s]: %s", signature.kind(), signature.message()));
    }

    private boolean send(String body) {
        try {
            sender.send(body);
            metricsConfig.recordNotification(sender.channel(), "success");
            log.info("Message sent via {}: {}", sender.channel(), body);
            return true;
        } catch (Exception e) {
            metricsConfig.recordNotification(sender.channel(), "error");
            log.error("Failed to send message via {}: {}", sender.channel(), e.getMessage(), e);
            return false;
        }
    }
}
