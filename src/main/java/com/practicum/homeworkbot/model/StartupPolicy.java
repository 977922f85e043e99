package com.practicum.homeworkbot.model;

/**
 * Decides what the poller treats as the observed verdict before anything has been reported.
 */
public enum StartupPolicy {

    /** Nothing is known at startup; the first fetched status is always reported. */
    NOTIFY_FIRST,

    /** Start as if the homework is pending; a first pending status stays quiet. */
    ASSUME_PENDING;

    public Verdict initialVerdict() {
        return this == ASSUME_PENDING ? Verdict.PENDING : null;
    }
}
