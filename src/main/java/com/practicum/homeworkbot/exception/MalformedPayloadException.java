package com.practicum.homeworkbot.exception;

import com.practicum.homeworkbot.model.ErrorKind;

public class MalformedPayloadException extends HomeworkBotException {

    public MalformedPayloadException(String message) {
        super(ErrorKind.MALFORMED_PAYLOAD, message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_PAYLOAD, message, cause);
    }
}
