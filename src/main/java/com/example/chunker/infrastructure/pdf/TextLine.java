package com.example.chunker.infrastructure.pdf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tokens sharing the same baseline on a page, ordered left to right.
 */
final class TextLine {
    private final float y;
    private final List<PositionedToken> tokens = new ArrayList<>();

    TextLine(float y) {
        this.y = y;
    }

    void addToken(PositionedToken token) {
        if (token == null) {
            return;
        }
        int index = tokens.size();
        while (index > 0 && tokens.get(index - 1).x() > token.x()) {
            index--;
        }
        tokens.add(index, token);
    }

    List<PositionedToken> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    float y() {
        return y;
    }

    /**
     * @return non-blank token texts in reading order
     */
    List<String> words() {
        return tokens().stream()
                .map(PositionedToken::text)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toList());
    }

    String text() {
        return String.join(" ", words());
    }

    /**
     * Joins neighbouring tokens closer than {@code maxGap} into phrases, so multi-word column labels
     * such as "Value Dt" count as a single label.
     *
     * @param maxGap largest horizontal gap that still joins two tokens
     * @return merged tokens, left to right
     */
    List<PositionedToken> phrases(float maxGap) {
        List<PositionedToken> merged = new ArrayList<>();
        for (PositionedToken token : tokens()) {
            if (token.text().isBlank()) {
                continue;
            }
            int last = merged.size() - 1;
            if (last >= 0 && merged.get(last).gapTo(token) < maxGap) {
                merged.set(last, merged.get(last).mergeWith(token));
            } else {
                merged.add(token);
            }
        }
        return merged;
    }
}
