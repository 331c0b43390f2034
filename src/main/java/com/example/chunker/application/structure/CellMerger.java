package com.example.chunker.application.structure;

import com.example.chunker.domain.model.ColumnMap;
import com.example.chunker.domain.model.TransactionRow;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rebuilds logical rows from cells that span several physical lines.
 */
public final class CellMerger {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n|\\r");

    private CellMerger() {
    }

    /**
     * Splits rows whose cells contain line breaks into one row per line.
     * Shorter cells are padded with empty strings; reconstructed rows that are entirely blank are
     * dropped. Rows without line breaks are returned untouched.
     *
     * @param rows table rows
     * @return expanded rows
     */
    public static List<TransactionRow> splitMultilineCells(List<TransactionRow> rows) {
        List<TransactionRow> expanded = new ArrayList<>(rows.size());
        for (TransactionRow row : rows) {
            if (!hasLineBreak(row)) {
                expanded.add(row);
                continue;
            }
            List<List<String>> splitCells = new ArrayList<>(row.size());
            int maxLines = 0;
            for (String cell : row.cells()) {
                List<String> parts = splitCell(cell);
                splitCells.add(parts);
                if (CellValues.hasText(cell)) {
                    maxLines = Math.max(maxLines, parts.size());
                }
            }
            for (int line = 0; line < maxLines; line++) {
                List<String> cells = new ArrayList<>(splitCells.size());
                boolean blank = true;
                for (List<String> parts : splitCells) {
                    String value = line < parts.size() ? parts.get(line) : "";
                    cells.add(value);
                    if (!value.isBlank()) {
                        blank = false;
                    }
                }
                if (!blank) {
                    expanded.add(TransactionRow.of(cells));
                }
            }
        }
        return expanded;
    }

    /**
     * Folds continuation rows into the transaction above them.
     * The narration of each continuation row is appended to the last emitted row, so a chain of
     * continuation lines accumulates on the same transaction. A continuation row at the very top
     * of the table is kept as is.
     *
     * @param rows      table rows
     * @param columnMap role lookup of the table
     * @return rows with continuation lines merged
     */
    public static List<TransactionRow> mergeContinuationRows(List<TransactionRow> rows, ColumnMap columnMap) {
        int narrationIndex = RowClassifier.narrationIndex(columnMap);
        List<TransactionRow> merged = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            TransactionRow row = rows.get(i);
            if (i > 0 && !merged.isEmpty() && RowClassifier.isContinuationRow(row, columnMap)) {
                String continuation = row.get(narrationIndex).trim();
                int last = merged.size() - 1;
                TransactionRow parent = merged.get(last);
                if (narrationIndex < parent.size()) {
                    String existing = parent.get(narrationIndex);
                    String combined = CellValues.isBlank(existing)
                            ? continuation
                            : existing.trim() + " " + continuation;
                    merged.set(last, parent.with(narrationIndex, combined));
                }
                continue;
            }
            merged.add(row);
        }
        return merged;
    }

    private static boolean hasLineBreak(TransactionRow row) {
        for (String cell : row.cells()) {
            if (cell != null && LINE_BREAK.matcher(cell).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<String> splitCell(String cell) {
        List<String> parts = new ArrayList<>();
        if (CellValues.isBlank(cell)) {
            parts.add("");
            return parts;
        }
        for (String part : LINE_BREAK.split(cell)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        if (parts.isEmpty()) {
            parts.add("");
        }
        return parts;
    }
}
