package com.practicum.homeworkbot.model;

import com.practicum.homeworkbot.exception.HomeworkBotException;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Identity of a failure for alert deduplication. Two failures are the same when kind and message match.
 */
@Schema(description = "Kind and message of a poll failure")
public record ErrorSignature(
        @Schema(description = "Failure classification", example = "WRONG_STATUS_CODE") ErrorKind kind,
        @Schema(description = "Failure message", example = "Endpoint returned HTTP 503 Service Unavailable") String message) {

    public static ErrorSignature of(RuntimeException e) {
        if (e instanceof HomeworkBotException hbe) {
            return new ErrorSignature(hbe.getKind(), hbe.getMessage());
        }
        return new ErrorSignature(ErrorKind.UNEXPECTED, e.getClass().getSimpleName() + ": " + e.getMessage());
    }
}
