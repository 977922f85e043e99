package com.practicum.homeworkbot.exception;

import com.practicum.homeworkbot.model.ErrorKind;

/**
 * Base of every failure a poll cycle can end with. The poller classifies by {@link #getKind()}.
 */
public abstract class HomeworkBotException extends RuntimeException {

    private final ErrorKind kind;

    protected HomeworkBotException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected HomeworkBotException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
