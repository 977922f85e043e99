package com.practicum.homeworkbot.engine;

import com.practicum.homeworkbot.exception.CursorMissingException;
import com.practicum.homeworkbot.exception.MalformedPayloadException;
import com.practicum.homeworkbot.model.ValidatedResponse;
import org.junit.jupiter.api.Test;

import static com.practicum.homeworkbot.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseValidatorTest {

    private final ResponseValidator validator = new ResponseValidator();

    @Test
    void validate_wellFormed_returnsRecordsAndCursor() {
        ValidatedResponse response = validator.validate(
                payload(1000, homework("hw2", "reviewing"), homework("hw1", "approved")));

        assertThat(response.currentDate()).hasValue(1000L);
        assertThat(response.homeworks()).hasSize(2);
        assertThat(response.homeworks().get(0).get("homework_name").asText()).isEqualTo("hw2");
    }

    @Test
    void validate_emptyHomeworks_isNotAnError() {
        ValidatedResponse response = validator.validate(payload(1500));

        assertThat(response.isEmpty()).isTrue();
        assertThat(response.currentDate()).hasValue(1500L);
    }

    @Test
    void validate_topLevelList_malformed() {
        assertThatThrownBy(() -> validator.validate(json("[{\"homeworks\": []}]")))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("not a JSON object");
    }

    @Test
    void validate_missingHomeworks_malformed() {
        assertThatThrownBy(() -> validator.validate(json("{\"current_date\": 1}")))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("homeworks");
    }

    @Test
    void validate_homeworksNotList_malformed() {
        assertThatThrownBy(() -> validator.validate(json("{\"homeworks\": {\"a\": 1}, \"current_date\": 1}")))
                .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    void validate_emptyHomeworksWithoutCurrentDate_emptyWithoutCursor() {
        ValidatedResponse response = validator.validate(json("{\"homeworks\": []}"));

        assertThat(response.isEmpty()).isTrue();
        assertThat(response.currentDate()).isEmpty();
    }

    @Test
    void validate_emptyHomeworksWithNullCurrentDate_emptyWithoutCursor() {
        ValidatedResponse response = validator.validate(json("{\"homeworks\": [], \"current_date\": null}"));

        assertThat(response.isEmpty()).isTrue();
        assertThat(response.currentDate()).isEmpty();
    }

    @Test
    void validate_recordsWithoutCurrentDate_cursorMissing() {
        assertThatThrownBy(() -> validator.validate(json("{\"homeworks\": [" + homework("hw1", "approved") + "]}")))
                .isInstanceOf(CursorMissingException.class)
                .hasMessageContaining("current_date");
    }

    @Test
    void validate_recordsWithNullCurrentDate_cursorMissing() {
        assertThatThrownBy(() -> validator.validate(
                json("{\"homeworks\": [" + homework("hw1", "approved") + "], \"current_date\": null}")))
                .isInstanceOf(CursorMissingException.class);
    }

    @Test
    void validate_textCurrentDate_malformed() {
        assertThatThrownBy(() -> validator.validate(json("{\"homeworks\": [], \"current_date\": \"yesterday\"}")))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("not an integer");
    }

    @Test
    void validate_nonObjectEntry_malformed() {
        assertThatThrownBy(() -> validator.validate(json("{\"homeworks\": [\"hw1\"], \"current_date\": 1}")))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("Homework entry");
    }
}
