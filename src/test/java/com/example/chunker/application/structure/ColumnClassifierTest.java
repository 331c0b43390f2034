package com.example.chunker.application.structure;

import com.example.chunker.domain.model.ColumnRole;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnClassifierTest {

    @ParameterizedTest
    @CsvSource({
            "Date, DATE",
            "Txn Date, DATE",
            "Narration, NARRATION",
            "Transaction Details, NARRATION",
            "Chq./Ref.No., REFERENCE",
            "Withdrawal Amt., DEBIT",
            "Debit, DEBIT",
            "Deposit Amt., CREDIT",
            "Credit, CREDIT",
            "Closing Balance, BALANCE",
            "Init. Br, INIT"
    })
    void classifiesCommonBankHeaders(String header, ColumnRole expected) {
        assertThat(ColumnClassifier.classify(header)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "Amount", "Remarks"})
    void unknownOrBlankHeadersAreUnknown(String header) {
        assertThat(ColumnClassifier.classify(header)).isEqualTo(ColumnRole.UNKNOWN);
    }

    /**
     * "Value Dt" also matches the date keywords, and the date role is checked first.
     */
    @Test
    void firstMatchingRoleWins() {
        assertThat(ColumnClassifier.classify("Value Dt")).isEqualTo(ColumnRole.DATE);
    }

    @Test
    void matchingIgnoresCaseAndSurroundingWhitespace() {
        assertThat(ColumnClassifier.classify("  NARRATION ")).isEqualTo(ColumnRole.NARRATION);
    }
}
