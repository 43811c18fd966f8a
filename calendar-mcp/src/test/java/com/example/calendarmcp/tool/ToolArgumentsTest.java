package com.example.calendarmcp.tool;

import com.example.calendarmcp.protocol.McpErrorCodes;
import com.example.calendarmcp.protocol.McpException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolArgumentsTest {

    @Test
    void blankStringsCountAsMissing() {
        ToolArguments args = new ToolArguments(Map.of("summary", "  "));

        assertThat(args.string("summary")).isEmpty();
        assertThat(args.stringOrDefault("summary", "Untitled")).isEqualTo("Untitled");
        assertThatThrownBy(() -> args.requireString("summary")).hasMessage("summary is required");
    }

    @Test
    void singleStringBecomesList() {
        ToolArguments args = new ToolArguments(Map.of("calendarId", "primary", "calendars", List.of("a", "b")));

        assertThat(args.requireStringList("calendarId")).containsExactly("primary");
        assertThat(args.requireStringList("calendars")).containsExactly("a", "b");
    }

    @Test
    void rejectsWrongTypes() {
        ToolArguments args = new ToolArguments(Map.of(
                "summary", 42,
                "allowDuplicates", "yes",
                "duplicateSimilarityThreshold", "high",
                "calendars", List.of("a", 1)));

        assertInvalid(() -> args.string("summary"), "summary must be string");
        assertInvalid(() -> args.bool("allowDuplicates"), "allowDuplicates must be boolean");
        assertInvalid(() -> args.number("duplicateSimilarityThreshold"), "duplicateSimilarityThreshold must be number");
        assertInvalid(() -> args.stringList("calendars"), "calendars must contain only strings");
    }

    @Test
    void numbersWidenToDouble() {
        ToolArguments args = new ToolArguments(Map.of("duplicateSimilarityThreshold", 1));

        assertThat(args.number("duplicateSimilarityThreshold")).contains(1.0);
    }

    @Test
    void nullArgumentsAreEmpty() {
        ToolArguments args = new ToolArguments(null);

        assertThat(args.has("eventId")).isFalse();
        assertThat(args.bool("checkConflicts")).isEmpty();
    }

    private static void assertInvalid(Runnable call, String message) {
        assertThatThrownBy(call::run)
                .isInstanceOfSatisfying(McpException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(McpErrorCodes.INVALID_PARAMS))
                .hasMessage(message);
    }
}
