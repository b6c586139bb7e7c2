package com.purchasingpower.contextgraph.service.compression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Text Truncation Tests")
class TextTruncatorTest {

    @Test
    @DisplayName("Should keep head and tail around an omission marker")
    void extractKeyPoints() {
        String text = "a".repeat(50) + "b".repeat(50);

        String result = TextTruncator.extractKeyPoints(text, 20);

        assertThat(result).isEqualTo("a".repeat(10) + "...[80 chars omitted]..." + "b".repeat(10));
    }

    @Test
    @DisplayName("Should leave short text and null alone")
    void shortText() {
        assertThat(TextTruncator.extractKeyPoints("short", 20)).isEqualTo("short");
        assertThat(TextTruncator.extractKeyPoints(null, 20)).isNull();
    }

    @Test
    @DisplayName("Should not lengthen text whose marker outweighs the saving")
    void shortenNeverGrows() {
        String text = "abcdefghijklmnopqrstuvwxyz";

        assertThat(TextTruncator.extractKeyPoints(text, 20)).hasSizeGreaterThan(text.length());
        assertThat(TextTruncator.shorten(text, 20)).isSameAs(text);
    }
}
