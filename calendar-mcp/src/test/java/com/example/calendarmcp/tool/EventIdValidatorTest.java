package com.example.calendarmcp.tool;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventIdValidatorTest {

    @ParameterizedTest
    @ValueSource(strings = {"abcde", "meeting2024v", "0123456789abcdefghijklmnopqrstuv"})
    void acceptsBase32HexIds(String id) {
        assertThat(EventIdValidator.isValid(id)).isTrue();
        assertThatCode(() -> EventIdValidator.validate(id)).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(strings = {"abcd", "Meeting", "team-sync", "wxyz1", "event_2024"})
    void rejectsOtherIds(String id) {
        assertThat(EventIdValidator.isValid(id)).isFalse();
    }

    @Test
    void rejectsOverlongIds() {
        assertThat(EventIdValidator.isValid("a".repeat(1024))).isTrue();
        assertThatThrownBy(() -> EventIdValidator.validate("a".repeat(1025)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid event ID: must not exceed 1024 characters");
    }

    @Test
    void listsEveryProblem() {
        assertThatThrownBy(() -> EventIdValidator.validate("ab-"))
                .hasMessage("Invalid event ID: must be at least 5 characters long, "
                        + "can only contain lowercase letters a-v and digits 0-9 (base32hex encoding)");
    }
}
