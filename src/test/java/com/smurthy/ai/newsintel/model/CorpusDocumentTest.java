package com.smurthy.ai.newsintel.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorpusDocumentTest {

    @Test
    @DisplayName("Should require an id and default missing text to empty")
    void testValidation() {
        assertThatThrownBy(() -> new CorpusDocument(" ", "text")).isInstanceOf(IllegalArgumentException.class);
        assertThat(new CorpusDocument("a", null).text()).isEmpty();
    }

    @Test
    @DisplayName("Should convert records and skip those without an id")
    void testFromRecords() {
        // Given
        Map<String, Object> missingText = new HashMap<>();
        missingText.put("uid", 42);
        List<Map<String, Object>> records = List.of(
                Map.of("uid", "x", "body", "first"),
                Map.of("body", "no id"),
                missingText);

        // When
        List<CorpusDocument> documents = CorpusDocument.fromRecords(records, "uid", "body");

        // Then
        assertThat(documents).containsExactly(new CorpusDocument("x", "first"), new CorpusDocument("42", ""));
    }
}
