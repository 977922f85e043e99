package com.practicum.homeworkbot.exception;

import com.practicum.homeworkbot.model.ErrorKind;

public class TransportException extends HomeworkBotException {

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT_ERROR, message, cause);
    }
}
