package com.practicum.homeworkbot.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.OptionalLong;

/**
 * A structurally valid poll response: homework entries newest first, and the server's cursor.
 * The cursor may be absent only when there are no entries.
 */
public record ValidatedResponse(List<JsonNode> homeworks, OptionalLong currentDate) {

    public ValidatedResponse {
        homeworks = List.copyOf(homeworks);
    }

    public ValidatedResponse(List<JsonNode> homeworks, long currentDate) {
        this(homeworks, OptionalLong.of(currentDate));
    }

    public static ValidatedResponse emptyWithoutCursor() {
        return new ValidatedResponse(List.of(), OptionalLong.empty());
    }

    public boolean isEmpty() {
        return homeworks.isEmpty();
    }
}
