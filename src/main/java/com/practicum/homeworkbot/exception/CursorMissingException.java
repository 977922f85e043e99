package com.practicum.homeworkbot.exception;

import com.practicum.homeworkbot.model.ErrorKind;

public class CursorMissingException extends HomeworkBotException {

    public CursorMissingException(String message) {
        super(ErrorKind.CURSOR_MISSING, message);
    }
}
