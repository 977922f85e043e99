package com.practicum.homeworkbot.model;

public enum ErrorKind {
    TRANSPORT_ERROR,
    WRONG_STATUS_CODE,
    MALFORMED_PAYLOAD,
    CURSOR_MISSING,
    UNKNOWN_STATUS,
    INCOMPLETE_RECORD,
    NOTIFICATION_FAILURE,
    UNEXPECTED
}
