package com.practicum.homeworkbot.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.practicum.homeworkbot.exception.IncompleteRecordException;
import com.practicum.homeworkbot.exception.UnknownStatusException;
import com.practicum.homeworkbot.model.StatusChange;
import com.practicum.homeworkbot.model.StatusRecord;
import com.practicum.homeworkbot.model.ValidatedResponse;
import com.practicum.homeworkbot.model.Verdict;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Compares the newest homework with the last reported verdict.
 *
 * <p>Only the first entry is looked at. Earlier changes that were never reported are not replayed;
 * the bot reports where a review stands now, not how it got there.
 */
@Component
public class ChangeDetector {

    static final String ID_FIELD = "id";
    static final String NAME_FIELD = "homework_name";
    static final String STATUS_FIELD = "status";

    public Optional<StatusChange> detect(ValidatedResponse response, Verdict observed) {
        if (response.isEmpty()) {
            return Optional.empty();
        }

        StatusRecord record = toRecord(response.homeworks().get(0));
        if (record.verdict() == observed) {
            return Optional.empty();
        }
        return Optional.of(new StatusChange(record, observed));
    }

    StatusRecord toRecord(JsonNode entry) {
        String rawStatus = text(entry, STATUS_FIELD);
        Verdict verdict = Verdict.fromRaw(rawStatus)
                .orElseThrow(() -> new UnknownStatusException(rawStatus));

        String name = text(entry, NAME_FIELD);
        if (name == null || name.isBlank()) {
            throw new IncompleteRecordException("Homework entry has no '" + NAME_FIELD + "'");
        }

        return new StatusRecord(text(entry, ID_FIELD), name, verdict, rawStatus);
    }

    private static String text(JsonNode entry, String field) {
        JsonNode value = entry.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
