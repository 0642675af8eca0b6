package io.reloop.server.validation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void shouldReturnNullStringForNullInput() {
        assertThat(LogSanitizer.sanitize(null)).isEqualTo("null");
    }

    @Test
    void shouldLeaveCleanTaskIdUnchanged() {
        assertThat(LogSanitizer.sanitize("jira:PROJ-12")).isEqualTo("jira:PROJ-12");
    }

    @Test
    void shouldReplaceLineBreaksInNotes() {
        assertThat(LogSanitizer.sanitize("fixed tests\r\nINFO forged entry"))
                .isEqualTo("fixed tests__INFO forged entry");
    }

    @Test
    void shouldReplaceOtherControlAndSeparatorCharacters() {
        assertThat(LogSanitizer.sanitize("a\tb\u001bc d e")).isEqualTo("a_b_c_d_e");
    }

    @Test
    void shouldCutOverlongSummaries() {
        String summary = "x".repeat(LogSanitizer.MAX_LENGTH + 50);

        String logged = LogSanitizer.sanitize(summary);

        assertThat(logged)
                .hasSize(LogSanitizer.MAX_LENGTH + 3)
                .endsWith("x...");
    }

    @Test
    void shouldKeepValueOfExactlyMaxLength() {
        String summary = "y".repeat(LogSanitizer.MAX_LENGTH);

        assertThat(LogSanitizer.sanitize(summary)).isEqualTo(summary);
    }
}
