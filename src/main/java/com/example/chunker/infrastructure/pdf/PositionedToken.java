package com.example.chunker.infrastructure.pdf;

/**
 * Word extracted from a PDF page with its horizontal extent.
 */
final class PositionedToken {
    private final float x;
    private final float endX;
    private final String text;

    PositionedToken(float x, float endX, String text) {
        this.x = x;
        this.endX = Math.max(endX, x);
        this.text = text == null ? "" : text;
    }

    float x() {
        return x;
    }

    float center() {
        return x + ((endX - x) / 2f);
    }

    String text() {
        return text;
    }

    /**
     * @param other token to the right of this one
     * @return horizontal distance between this token's end and the other token's start
     */
    float gapTo(PositionedToken other) {
        return other.x - endX;
    }

    PositionedToken mergeWith(PositionedToken other) {
        return new PositionedToken(Math.min(x, other.x), Math.max(endX, other.endX), text + " " + other.text);
    }
}
