package com.phillippitts.ambient.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello", 5)).isEqualTo("hello");
    }

    @Test
    void shouldCollapseWhitespaceInPreview() {
        assertThat(LogSanitizer.preview("  open\n the   calendar \t")).isEqualTo("open the calendar");
    }

    @Test
    void shouldCutLongPreviewWithEllipsis() {
        String transcript = "remind me to call the dentist tomorrow morning before the meeting starts";

        String preview = LogSanitizer.preview(transcript);

        assertThat(preview).endsWith("...");
        assertThat(preview).hasSize(43);
        assertThat(transcript).startsWith(preview.substring(0, 40));
    }

    @Test
    void shouldReturnEmptyPreviewForNull() {
        assertThat(LogSanitizer.preview(null)).isEmpty();
    }
}
