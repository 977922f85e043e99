package com.practicum.homeworkbot.testutil;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.practicum.homeworkbot.model.StatusChange;
import com.practicum.homeworkbot.model.StatusRecord;
import com.practicum.homeworkbot.model.Verdict;

/**
 * Shared builders for review API payloads so tests don't hand-write JSON.
 */
public final class TestDataFactory {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private TestDataFactory() {}

    public static ObjectNode homework(String name, String status) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", "id-" + name);
        node.put("homework_name", name);
        node.put("status", status);
        node.put("reviewer_comment", "ok");
        return node;
    }

    public static ObjectNode payload(long currentDate, JsonNode... homeworks) {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode list = root.putArray("homeworks");
        for (JsonNode hw : homeworks) {
            list.add(hw);
        }
        root.put("current_date", currentDate);
        return root;
    }

    public static JsonNode json(String raw) {
        try {
            return MAPPER.readTree(raw);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    public static StatusChange change(String name, Verdict verdict, Verdict previous) {
        return new StatusChange(new StatusRecord("id-" + name, name, verdict, verdict.code()), previous);
    }
}
