package com.example.chunker.application.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-size character windows over free text.
 */
final class TextSplitter {

    private TextSplitter() {
    }

    /**
     * @param text    text to split
     * @param window  characters per piece, at least 1
     * @param overlap characters shared by consecutive pieces, smaller than {@code window}
     * @return pieces in order; empty for empty text
     */
    static List<String> split(String text, int window, int overlap) {
        if (window < 1 || overlap < 0 || overlap >= window) {
            throw new IllegalArgumentException("window must be >= 1 and 0 <= overlap < window");
        }
        List<String> pieces = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(start + window, text.length());
            pieces.add(text.substring(start, end));
            start = end < text.length() ? end - overlap : end;
        }
        return pieces;
    }
}
