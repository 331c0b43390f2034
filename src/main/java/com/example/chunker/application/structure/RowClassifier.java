package com.example.chunker.application.structure;

import com.example.chunker.domain.model.ColumnMap;
import com.example.chunker.domain.model.ColumnRole;
import com.example.chunker.domain.model.TransactionRow;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Labels statement rows as transactions, continuation lines or footer/summary boilerplate.
 * Date and narration fall back to columns 0 and 1 when the header did not reveal them.
 */
public final class RowClassifier {

    static final int DEFAULT_DATE_INDEX = 0;
    static final int DEFAULT_NARRATION_INDEX = 1;
    private static final List<ColumnRole> AMOUNT_ROLES =
            List.of(ColumnRole.DEBIT, ColumnRole.CREDIT, ColumnRole.BALANCE);
    private static final List<String> FOOTER_KEYWORDS = List.of(
            "total", "closing balance", "opening balance", "registered office", "page no",
            "generated on", "statement of", "legends", "branch address", "charge breakup",
            "contents of this statement", "unless the constituent", "deposit insurance",
            "transaction total", "end of statement"
    );

    private RowClassifier() {
    }

    /**
     * A transaction row has a date and at least one amount: a non-zero debit or credit, or any
     * balance value.
     *
     * @param row       row to inspect
     * @param columnMap role lookup of the table
     * @return {@code true} for transaction rows
     */
    public static boolean isTransactionRow(TransactionRow row, ColumnMap columnMap) {
        if (row == null || row.isEmpty()) {
            return false;
        }
        if (CellValues.isBlank(dateCell(row, columnMap))) {
            return false;
        }
        for (ColumnRole role : AMOUNT_ROLES) {
            String value = row.valueOf(role, columnMap);
            if (CellValues.isBlank(value)) {
                continue;
            }
            if (role == ColumnRole.BALANCE || Amounts.isNonZero(value)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isTransactionRow(List<String> cells, ColumnMap columnMap) {
        return cells != null && isTransactionRow(TransactionRow.of(cells), columnMap);
    }

    /**
     * A continuation row carries only overflow narration: no date, some narration and no amounts.
     *
     * @param row       row to inspect
     * @param columnMap role lookup of the table
     * @return {@code true} when the row belongs to the preceding transaction
     */
    public static boolean isContinuationRow(TransactionRow row, ColumnMap columnMap) {
        if (row == null || row.isEmpty()) {
            return false;
        }
        if (CellValues.hasText(dateCell(row, columnMap))) {
            return false;
        }
        if (CellValues.isBlank(narrationCell(row, columnMap))) {
            return false;
        }
        for (ColumnRole role : AMOUNT_ROLES) {
            if (CellValues.hasText(row.valueOf(role, columnMap))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isContinuationRow(List<String> cells, ColumnMap columnMap) {
        return cells != null && isContinuationRow(TransactionRow.of(cells), columnMap);
    }

    /**
     * Detects totals, balances carried forward, legal text and page markers.
     *
     * @param cells row cells
     * @return {@code true} when the row is boilerplate
     */
    public static boolean isFooterRow(List<String> cells) {
        if (cells == null || cells.isEmpty()) {
            return false;
        }
        String text = cells.stream()
                .filter(cell -> cell != null && !cell.isEmpty())
                .map(cell -> cell.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
        for (String keyword : FOOTER_KEYWORDS) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isFooterRow(TransactionRow row) {
        return row != null && isFooterRow(row.cells());
    }

    static int narrationIndex(ColumnMap columnMap) {
        return columnMap.indexOrDefault(ColumnRole.NARRATION, DEFAULT_NARRATION_INDEX);
    }

    private static String dateCell(TransactionRow row, ColumnMap columnMap) {
        return row.get(columnMap.indexOrDefault(ColumnRole.DATE, DEFAULT_DATE_INDEX));
    }

    private static String narrationCell(TransactionRow row, ColumnMap columnMap) {
        return row.get(narrationIndex(columnMap));
    }
}
