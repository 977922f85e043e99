package com.practicum.homeworkbot.model;

/**
 * The newest homework entry of a poll, with its raw status mapped to a {@link Verdict}.
 */
public record StatusRecord(String id, String name, Verdict verdict, String rawStatus) {}
