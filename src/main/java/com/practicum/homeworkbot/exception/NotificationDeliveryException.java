package com.practicum.homeworkbot.exception;

import com.practicum.homeworkbot.model.ErrorKind;

/**
 * A channel rejected or never received a message. The message carries no credentials.
 */
public class NotificationDeliveryException extends HomeworkBotException {

    public NotificationDeliveryException(String message) {
        super(ErrorKind.NOTIFICATION_FAILURE, message);
    }

    public NotificationDeliveryException(String message, Throwable cause) {
        super(ErrorKind.NOTIFICATION_FAILURE, message, cause);
    }
}
