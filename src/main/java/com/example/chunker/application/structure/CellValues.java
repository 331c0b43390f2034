package com.example.chunker.application.structure;

/**
 * Cell-level helpers shared by the classifiers and the chunk serializer.
 */
public final class CellValues {

    private CellValues() {
    }

    /**
     * Normalizes a cell for output: {@code null}, empty and whitespace-only values become {@code null},
     * everything else is trimmed.
     *
     * @param value raw cell value
     * @return trimmed value or {@code null}
     */
    public static String clean(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static boolean hasText(String value) {
        return !isBlank(value);
    }
}
