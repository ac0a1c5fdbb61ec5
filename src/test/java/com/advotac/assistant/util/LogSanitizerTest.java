package com.advotac.assistant.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Nested
    @DisplayName("querySummary()")
    class QuerySummaryTest {
        @Test
        @DisplayName("Should return len=0 and id=none for null query")
        void shouldHandleNull() {
            assertThat(LogSanitizer.querySummary(null)).isEqualTo("[len=0,id=none]");
        }

        @Test
        @DisplayName("Should never contain the query text")
        void shouldHideQueryText() {
            String result = LogSanitizer.querySummary("Section 302 IPC murder punishment");
            assertThat(result).startsWith("[len=33,id=").endsWith("]");
            assertThat(result).doesNotContain("IPC");
        }

        @Test
        @DisplayName("Should return consistent id for same input")
        void shouldBeConsistent() {
            assertThat(LogSanitizer.querySummary("bail conditions"))
                    .isEqualTo(LogSanitizer.querySummary("bail conditions"));
        }
    }

    @Nested
    @DisplayName("sanitize()")
    class SanitizeTest {
        @Test
        void shouldHandleNull() {
            assertThat(LogSanitizer.sanitize(null)).isEmpty();
        }

        @Test
        void shouldFoldNewlinesAndDropControlChars() {
            assertThat(LogSanitizer.sanitize("Verified\r\nforged\u0007 line")).isEqualTo("Verified forged line");
        }

        @Test
        void shouldTruncateLongValues() {
            String result = LogSanitizer.sanitize("x".repeat(500));
            assertThat(result).hasSize(203).endsWith("...");
        }
    }
}
