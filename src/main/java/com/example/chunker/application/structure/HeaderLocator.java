package com.example.chunker.application.structure;

import com.example.chunker.domain.model.ColumnRole;
import com.example.chunker.domain.model.RawGrid;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds the header row of a statement table.
 */
public final class HeaderLocator {

    static final int SCAN_ROWS = 10;
    static final int FALLBACK_SCAN_ROWS = 5;
    static final int MIN_HEADER_CELLS = 3;
    static final int MIN_INDICATOR_MATCHES = 3;
    static final double MIN_RECOGNISED_SHARE = 0.4;
    private static final List<String> HEADER_INDICATORS =
            List.of("date", "narration", "withdrawal", "deposit", "balance");

    private HeaderLocator() {
    }

    /**
     * Result of {@link #locate(RawGrid)}.
     *
     * @param index   zero-based row index of the header inside the grid
     * @param headers header cells, blanks replaced by {@code Column_<index>}
     */
    public record HeaderLocation(int index, List<String> headers) {
        public HeaderLocation {
            headers = List.copyOf(headers);
        }
    }

    /**
     * Scans the first rows of {@code grid} for a header.
     * Rows with fewer than three non-blank cells are never headers. When no row qualifies, the row
     * with the most non-blank cells among the first five is used.
     *
     * @param grid raw table grid
     * @return header position and cleaned header cells
     */
    public static HeaderLocation locate(RawGrid grid) {
        if (grid == null || grid.isEmpty()) {
            return new HeaderLocation(0, List.of());
        }
        int limit = Math.min(SCAN_ROWS, grid.size());
        for (int i = 0; i < limit; i++) {
            List<String> row = grid.row(i);
            if (countNonBlank(row) < MIN_HEADER_CELLS) {
                continue;
            }
            if (isHeaderRow(row)) {
                return new HeaderLocation(i, headerCells(row));
            }
        }

        int bestIndex = 0;
        int bestCount = 0;
        int fallbackLimit = Math.min(FALLBACK_SCAN_ROWS, grid.size());
        for (int i = 0; i < fallbackLimit; i++) {
            int count = countNonBlank(grid.row(i));
            if (count > bestCount) {
                bestCount = count;
                bestIndex = i;
            }
        }
        return new HeaderLocation(bestIndex, headerCells(grid.row(bestIndex)));
    }

    /**
     * Checks a delimited text line for the header signature: at least three of
     * date/narration/withdrawal/deposit/balance.
     *
     * @param line raw text line
     * @return {@code true} when the line looks like a header
     */
    public static boolean isHeaderLine(String line) {
        if (line == null) {
            return false;
        }
        String lower = line.toLowerCase(Locale.ROOT);
        int matches = 0;
        for (String indicator : HEADER_INDICATORS) {
            if (lower.contains(indicator)) {
                matches++;
            }
        }
        return matches >= MIN_INDICATOR_MATCHES;
    }

    /**
     * Checks a cell list for the header signature: at least 40% of the non-empty cells map to a
     * known column role.
     *
     * @param cells row cells
     * @return {@code true} when the row looks like a header
     */
    public static boolean isHeaderRow(List<String> cells) {
        if (cells == null || cells.isEmpty()) {
            return false;
        }
        int recognised = 0;
        int nonEmpty = 0;
        for (String cell : cells) {
            if (cell != null && !cell.isEmpty()) {
                nonEmpty++;
            }
            if (ColumnClassifier.classify(cell) != ColumnRole.UNKNOWN) {
                recognised++;
            }
        }
        return nonEmpty > 0 && recognised >= nonEmpty * MIN_RECOGNISED_SHARE;
    }

    /**
     * @param row header row cells
     * @return trimmed cells, blanks replaced by {@code Column_<index>}
     */
    public static List<String> headerCells(List<String> row) {
        List<String> headers = new ArrayList<>(row.size());
        for (int i = 0; i < row.size(); i++) {
            String cell = row.get(i);
            headers.add(CellValues.isBlank(cell) ? "Column_" + i : cell.trim());
        }
        return headers;
    }

    private static int countNonBlank(List<String> row) {
        int count = 0;
        for (String cell : row) {
            if (CellValues.hasText(cell)) {
                count++;
            }
        }
        return count;
    }
}
