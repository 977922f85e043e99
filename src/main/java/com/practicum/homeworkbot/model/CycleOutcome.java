package com.practicum.homeworkbot.model;

public enum CycleOutcome {
    NOT_STARTED,
    // a changed verdict was delivered
    NOTIFIED,
    NO_CHANGE,
    NO_RECORDS,
    // a changed verdict was found but the message was lost; retried next cycle
    NOTIFY_FAILED,
    FAILED
}
