package com.example.chunker.application.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextSplitterTest {

    @Test
    void consecutivePiecesShareOverlap() {
        List<String> pieces = TextSplitter.split("abcdefghij", 4, 1);

        assertThat(pieces).containsExactly("abcd", "defg", "ghij");
    }

    @Test
    void shortTextIsOnePiece() {
        assertThat(TextSplitter.split("abc", 1000, 200)).containsExactly("abc");
        assertThat(TextSplitter.split("", 1000, 200)).isEmpty();
    }

    @Test
    void overlapMustBeSmallerThanWindow() {
        assertThatThrownBy(() -> TextSplitter.split("abc", 2, 2)).isInstanceOf(IllegalArgumentException.class);
    }
}
