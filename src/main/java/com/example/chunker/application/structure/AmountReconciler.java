package com.example.chunker.application.structure;

import com.example.chunker.domain.model.ColumnMap;
import com.example.chunker.domain.model.ColumnRole;
import com.example.chunker.domain.model.TransactionRow;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves rows where both the debit and the credit column carry an amount.
 */
public final class AmountReconciler {

    private AmountReconciler() {
    }

    /**
     * Keeps the larger of two non-zero debit/credit amounts and clears the other.
     * A credit strictly larger than the debit clears the debit; otherwise the credit is cleared.
     *
     * @param rows      table rows
     * @param columnMap role lookup of the table
     * @return reconciled rows, or the input when debit or credit is unmapped
     */
    public static List<TransactionRow> reconcileDebitCredit(List<TransactionRow> rows, ColumnMap columnMap) {
        if (rows.isEmpty() || !columnMap.contains(ColumnRole.DEBIT) || !columnMap.contains(ColumnRole.CREDIT)) {
            return rows;
        }
        int debitIndex = columnMap.indexOrDefault(ColumnRole.DEBIT, -1);
        int creditIndex = columnMap.indexOrDefault(ColumnRole.CREDIT, -1);

        List<TransactionRow> reconciled = new ArrayList<>(rows.size());
        for (TransactionRow row : rows) {
            Optional<BigDecimal> debit = nonZero(row.get(debitIndex));
            Optional<BigDecimal> credit = nonZero(row.get(creditIndex));
            if (debit.isPresent() && credit.isPresent()) {
                if (credit.get().compareTo(debit.get()) > 0) {
                    row = row.with(debitIndex, null);
                } else {
                    row = row.with(creditIndex, null);
                }
            }
            reconciled.add(row);
        }
        return reconciled;
    }

    private static Optional<BigDecimal> nonZero(String value) {
        return Amounts.parse(value).filter(amount -> amount.signum() != 0);
    }
}
