package com.example.chunker.domain.model;

/**
 * Canonical meaning of a bank statement column.
 * {@link #UNKNOWN} marks headers that none of the keyword tables recognise; such columns keep their
 * original text and are never mapped in a {@link ColumnMap}.
 */
public enum ColumnRole {
    DATE,
    NARRATION,
    REFERENCE,
    DEBIT,
    CREDIT,
    BALANCE,
    INIT,
    VALUE_DATE,
    UNKNOWN;

    /**
     * @return {@code true} for every role other than {@link #UNKNOWN}
     */
    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
