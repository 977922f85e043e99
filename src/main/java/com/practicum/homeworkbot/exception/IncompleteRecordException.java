package com.practicum.homeworkbot.exception;

import com.practicum.homeworkbot.model.ErrorKind;

public class IncompleteRecordException extends HomeworkBotException {

    public IncompleteRecordException(String message) {
        super(ErrorKind.INCOMPLETE_RECORD, message);
    }
}
