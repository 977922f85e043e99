package com.practicum.homeworkbot.model;

/**
 * A verdict that differs from the last reported one. {@code previous} is null when nothing was known.
 */
public record StatusChange(StatusRecord record, Verdict previous) {

    public String name() {
        return record.name();
    }

    public Verdict verdict() {
        return record.verdict();
    }

    public String verdictText() {
        return record.verdict().getText();
    }
}
