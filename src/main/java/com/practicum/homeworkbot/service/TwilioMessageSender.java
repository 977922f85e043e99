package com.practicum.homeworkbot.service;

import com.practicum.homeworkbot.config.NotificationConfig;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "notification.channel", havingValue = NotificationConfig.CHANNEL_TWILIO)
public class TwilioMessageSender implements MessageSender {

    private static final Logger log = LoggerFactory.getLogger(TwilioMessageSender.class);

    private final NotificationConfig config;

    public TwilioMessageSender(NotificationConfig config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        NotificationConfig.Twilio twilio = config.getTwilio();
        Twilio.init(twilio.getAccountSid(), twilio.getAuthToken());
        log.info("Twilio sender initialized. Mode: {}", twilio.getMode());
    }

    @Override
    public String channel() {
        return NotificationConfig.CHANNEL_TWILIO;
    }

    @Override
    public void send(String text) {
        Message message = Message.creator(
                new PhoneNumber(resolveNumber(config.getChatId())),
                new PhoneNumber(resolveNumber(config.getTwilio().getFromNumber())),
                text
        ).create();
        log.debug("Twilio message accepted, sid={}", message.getSid());
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getTwilio().getMode())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
