package com.example.chunker.application.structure;

import com.example.chunker.domain.model.ColumnRole;

import java.util.List;
import java.util.Locale;

/**
 * Maps raw statement header text to a {@link ColumnRole} using keyword substrings.
 * Definitions are tested in declaration order and the first match wins, so "Value Dt" is a date
 * column and only spellings such as "ValueDt" fall through to {@link ColumnRole#VALUE_DATE}.
 */
public final class ColumnClassifier {

    private static final List<ColumnDefinition> DEFINITIONS = List.of(
            new ColumnDefinition(ColumnRole.DATE,
                    List.of("date", "tran date", "value dt", "txn date", "transaction date", "value date")),
            new ColumnDefinition(ColumnRole.NARRATION,
                    List.of("narration", "particulars", "description", "details", "transaction details")),
            new ColumnDefinition(ColumnRole.REFERENCE,
                    List.of("chq", "cheque", "ref", "chq no", "chq/ref", "reference", "chq./ref.no.")),
            new ColumnDefinition(ColumnRole.DEBIT,
                    List.of("debit", "withdrawal", "dr", "withdrawal amt", "amount debited", "withdrawal amt.")),
            new ColumnDefinition(ColumnRole.CREDIT,
                    List.of("credit", "deposit", "cr", "deposit amt", "amount credited", "deposit amt.")),
            new ColumnDefinition(ColumnRole.BALANCE,
                    List.of("balance", "closing", "closing balance", "available balance")),
            new ColumnDefinition(ColumnRole.INIT,
                    List.of("init", "br", "branch")),
            new ColumnDefinition(ColumnRole.VALUE_DATE,
                    List.of("value dt", "value date", "valuedt"))
    );

    private ColumnClassifier() {
    }

    /**
     * Classifies a header cell.
     *
     * @param headerText raw header text, may be {@code null}
     * @return first matching role or {@link ColumnRole#UNKNOWN}
     */
    public static ColumnRole classify(String headerText) {
        String normalized = normalize(headerText);
        if (normalized.isEmpty()) {
            return ColumnRole.UNKNOWN;
        }
        for (ColumnDefinition definition : DEFINITIONS) {
            if (definition.matches(normalized)) {
                return definition.role;
            }
        }
        return ColumnRole.UNKNOWN;
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT).trim();
    }

    /**
     * One role together with the keywords that identify it.
     */
    private static final class ColumnDefinition {
        private final ColumnRole role;
        private final List<String> keywords;

        ColumnDefinition(ColumnRole role, List<String> keywords) {
            this.role = role;
            this.keywords = keywords;
        }

        boolean matches(String normalizedHeader) {
            for (String keyword : keywords) {
                if (normalizedHeader.contains(keyword)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public String toString() {
            return role.name();
        }
    }
}
