package com.phillippitts.saleshud.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldTruncateLongTextWithEllipsis() {
        assertThat(LogSanitizer.truncate("we have budget approved", 6)).isEqualTo("we hav...");
    }

    @Test
    void shouldKeepShortTextIntact() {
        assertThat(LogSanitizer.truncate("hello", 5)).isEqualTo("hello");
    }

    @Test
    void shouldReturnEmptyForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("hello", 0)).isEmpty();
    }
}
