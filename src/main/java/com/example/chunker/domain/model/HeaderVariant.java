package com.example.chunker.domain.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Label tables used when renaming recognised columns.
 * PDF statements use Debit/Credit, spreadsheet exports use Withdrawal/Deposit.
 */
public enum HeaderVariant {
    PDF("Debit", "Credit"),
    TABULAR("Withdrawal", "Deposit");

    private final Map<ColumnRole, String> labels = new EnumMap<>(ColumnRole.class);

    HeaderVariant(String debitLabel, String creditLabel) {
        labels.put(ColumnRole.DATE, "Date");
        labels.put(ColumnRole.NARRATION, "Narration");
        labels.put(ColumnRole.REFERENCE, "Chq/Ref");
        labels.put(ColumnRole.DEBIT, debitLabel);
        labels.put(ColumnRole.CREDIT, creditLabel);
        labels.put(ColumnRole.BALANCE, "Balance");
        labels.put(ColumnRole.INIT, "Init/Br");
        labels.put(ColumnRole.VALUE_DATE, "ValueDt");
    }

    /**
     * @param role recognised role
     * @return canonical label, or {@code null} for {@link ColumnRole#UNKNOWN}
     */
    public String labelFor(ColumnRole role) {
        return labels.get(role);
    }
}
