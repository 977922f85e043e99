package com.practicum.homeworkbot.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "notification")
public class NotificationConfig {

    public static final String CHANNEL_TWILIO = "twilio";
    public static final String CHANNEL_TELEGRAM = "telegram";
    public static final String CHANNEL_LOG = "log";

    @Pattern(regexp = "twilio|telegram|log", message = "notification.channel must be twilio, telegram or log")
    private String channel = CHANNEL_TELEGRAM;

    // Recipient on the selected channel: Telegram chat id or phone number.
    @NotBlank(message = "notification.chat-id (TELEGRAM_CHAT_ID) must be set")
    private String chatId;

    @Valid
    private Telegram telegram = new Telegram();

    @Valid
    private Twilio twilio = new Twilio();

    @AssertTrue(message = "notification.telegram.bot-token (TELEGRAM_TOKEN) must be set for the telegram channel")
    public boolean isTelegramConfigured() {
        return !CHANNEL_TELEGRAM.equals(channel) || StringUtils.hasText(telegram.getBotToken());
    }

    @AssertTrue(message = "notification.twilio account-sid, auth-token and from-number must be set for the twilio channel")
    public boolean isTwilioConfigured() {
        return !CHANNEL_TWILIO.equals(channel)
                || (StringUtils.hasText(twilio.getAccountSid())
                    && StringUtils.hasText(twilio.getAuthToken())
                    && StringUtils.hasText(twilio.getFromNumber()));
    }

    @Data
    public static class Telegram {
        private String botToken;
        private String apiUrl = "https://api.telegram.org";
    }

    @Data
    public static class Twilio {
        private String accountSid;
        private String authToken;
        private String fromNumber;
        private String mode = "sms";  // "sms" or "whatsapp"
    }
}
