package com.practicum.homeworkbot.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.practicum.homeworkbot.exception.CursorMissingException;
import com.practicum.homeworkbot.exception.MalformedPayloadException;
import com.practicum.homeworkbot.model.ValidatedResponse;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks on a poll response. Says nothing about statuses; that is {@link ChangeDetector}'s part.
 */
@Component
public class ResponseValidator {

    static final String HOMEWORKS_FIELD = "homeworks";
    static final String CURRENT_DATE_FIELD = "current_date";

    public ValidatedResponse validate(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new MalformedPayloadException("Response is not a JSON object: "
                    + (payload == null ? "null" : payload.getNodeType()));
        }

        JsonNode homeworks = payload.get(HOMEWORKS_FIELD);
        if (homeworks == null || !homeworks.isArray()) {
            throw new MalformedPayloadException("Response field '" + HOMEWORKS_FIELD + "' is missing or not a list");
        }

        JsonNode currentDate = payload.get(CURRENT_DATE_FIELD);
        if (currentDate == null || currentDate.isNull()) {
            // Nothing new and nothing to advance to: not a failure.
            if (homeworks.isEmpty()) {
                return ValidatedResponse.emptyWithoutCursor();
            }
            throw new CursorMissingException("Response has no '" + CURRENT_DATE_FIELD + "'");
        }
        if (!currentDate.isIntegralNumber() || !currentDate.canConvertToLong()) {
            throw new MalformedPayloadException("Response field '" + CURRENT_DATE_FIELD + "' is not an integer: " + currentDate);
        }

        List<JsonNode> entries = new ArrayList<>(homeworks.size());
        for (JsonNode entry : homeworks) {
            if (!entry.isObject()) {
                throw new MalformedPayloadException("Homework entry is not a JSON object: " + entry.getNodeType());
            }
            entries.add(entry);
        }

        return new ValidatedResponse(entries, currentDate.asLong());
    }
}
