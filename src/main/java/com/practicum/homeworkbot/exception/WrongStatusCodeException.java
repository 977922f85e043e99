package com.practicum.homeworkbot.exception;

import com.practicum.homeworkbot.model.ErrorKind;

/**
 * Non-200 answer from the review API. The body is kept for diagnostics but left out of the message.
 */
public class WrongStatusCodeException extends HomeworkBotException {

    private final int statusCode;
    private final String reason;
    private final String body;

    public WrongStatusCodeException(String endpoint, int statusCode, String reason, String body) {
        super(ErrorKind.WRONG_STATUS_CODE,
                String.format("Endpoint %s returned HTTP %d %s", endpoint, statusCode, reason).trim());
        this.statusCode = statusCode;
        this.reason = reason;
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getReason() {
        return reason;
    }

    public String getBody() {
        return body;
    }
}
