package com.practicum.homeworkbot.service;

import com.practicum.homeworkbot.config.NotificationConfig;
import com.practicum.homeworkbot.exception.NotificationDeliveryException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Sends messages through the Telegram Bot API {@code sendMessage} method.
 *
 * <p>The bot token is part of the request path, so client errors are rethrown as
 * {@link NotificationDeliveryException} with the token masked.
 */
@Component
@ConditionalOnProperty(name = "notification.channel", havingValue = NotificationConfig.CHANNEL_TELEGRAM,
        matchIfMissing = true)
public class TelegramMessageSender implements MessageSender {

    static final String MASK = "***";

    private final RestClient restClient;
    private final NotificationConfig config;

    public TelegramMessageSender(@Qualifier("telegramRestClient") RestClient restClient,
                                 NotificationConfig config) {
        this.restClient = restClient;
        this.config = config;
    }

    @Override
    public String channel() {
        return NotificationConfig.CHANNEL_TELEGRAM;
    }

    @Override
    public void send(String text) {
        String token = config.getTelegram().getBotToken();
        try {
            // Appended as a literal path; a URI variable would encode the ':' inside the token.
            restClient.post()
                    .uri(uriBuilder -> uriBuilder.path("/bot" + token + "/sendMessage").build())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("chat_id", config.getChatId(), "text", text))
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            Throwable cause = e.getMostSpecificCause();
            String message = "Telegram sendMessage failed: " + mask(e.getMessage(), token);
            if (cause == e) {
                throw new NotificationDeliveryException(message);
            }
            // The root cause is an I/O error from below the URL layer and does not echo the request line.
            throw new NotificationDeliveryException(message, cause);
        }
    }

    static String mask(String text, String token) {
        if (text == null || token == null || token.isEmpty()) {
            return text;
        }
        return text.replace(token, MASK)
                .replace(URLEncoder.encode(token, StandardCharsets.UTF_8), MASK);
    }
}
