package com.practicum.homeworkbot.exception;

import com.practicum.homeworkbot.model.ErrorKind;

/**
 * Raw status outside the known verdicts. Usually means the API contract changed.
 */
public class UnknownStatusException extends HomeworkBotException {

    private final String rawStatus;

    public UnknownStatusException(String rawStatus) {
        super(ErrorKind.UNKNOWN_STATUS, "Undocumented homework status: " + rawStatus);
        this.rawStatus = rawStatus;
    }

    public String getRawStatus() {
        return rawStatus;
    }
}
