package com.phillippitts.callrelay.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview(null)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldKeepStringsWithinLimit() {
        assertThat(LogSanitizer.truncate("hello", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
    }

    @Test
    void shouldTruncateLongStrings() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
    }

    @Test
    void previewShouldCapAtFortyCharacters() {
        String transcript = "a".repeat(100);

        assertThat(LogSanitizer.preview(transcript)).hasSize(LogSanitizer.PREVIEW_LENGTH);
    }

    @Test
    void shouldMaskAllButLastFourDigits() {
        assertThat(LogSanitizer.maskPhoneNumber("+15551234567")).isEqualTo("********4567");
    }

    @Test
    void shouldLeaveShortNumbersVisible() {
        assertThat(LogSanitizer.maskPhoneNumber("911")).isEqualTo("911");
        assertThat(LogSanitizer.maskPhoneNumber(null)).isEmpty();
    }
}
