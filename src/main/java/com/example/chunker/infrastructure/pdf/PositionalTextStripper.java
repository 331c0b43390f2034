package com.example.chunker.infrastructure.pdf;

import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects the words of a page together with their positions and groups them into lines by
 * vertical position.
 */
final class PositionalTextStripper extends PDFTextStripper {
    private static final float Y_TOLERANCE = 1.5f;
    private final List<TextLine> lines = new ArrayList<>();

    PositionalTextStripper() {
        setSortByPosition(true);
        setShouldSeparateByBeads(true);
        setSuppressDuplicateOverlappingText(false);
        setLineSeparator("\n");
        setWordSeparator(" ");
        setAverageCharTolerance(0.12f);
        setSpacingTolerance(0.2f);
    }

    /**
     * @return lines collected so far, top to bottom
     */
    List<TextLine> getLines() {
        lines.sort(Comparator.comparing(TextLine::y));
        return new ArrayList<>(lines);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (!textPositions.isEmpty()) {
            StringBuilder builder = new StringBuilder();
            for (TextPosition position : textPositions) {
                builder.append(position.getUnicode());
            }
            String tokenText = builder.toString();
            if (!tokenText.isBlank()) {
                float tokenX = textPositions.stream()
                        .map(TextPosition::getXDirAdj)
                        .min(Float::compareTo)
                        .orElse(0f);
                TextPosition last = textPositions.get(textPositions.size() - 1);
                float tokenEnd = Math.max(last.getXDirAdj() + last.getWidthDirAdj(), tokenX + 0.5f);
                float tokenY = textPositions.stream()
                        .map(TextPosition::getYDirAdj)
                        .min(Float::compareTo)
                        .orElse(0f);
                resolveLine(tokenY).addToken(new PositionedToken(tokenX, tokenEnd, tokenText.strip()));
            }
        }
        super.writeString(text, textPositions);
    }

    private TextLine resolveLine(float y) {
        for (TextLine line : lines) {
            if (Math.abs(line.y() - y) < Y_TOLERANCE) {
                return line;
            }
        }
        TextLine line = new TextLine(y);
        lines.add(line);
        return line;
    }
}
