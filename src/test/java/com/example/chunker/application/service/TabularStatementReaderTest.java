package com.example.chunker.application.service;

import com.example.chunker.domain.model.RawGrid;
import com.example.chunker.domain.model.TransactionRow;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class TabularStatementReaderTest {

    private final TabularStatementReader reader = new TabularStatementReader();

    @Test
    void splitsMetadataHeaderAndRows() {
        List<String> lines = List.of(
                "Account Name: Jane Doe",
                "Account No : 1234",
                "",
                "Date,Narration,Chq./Ref.No.,Withdrawal Amt.,Deposit Amt.,Closing Balance",
                "01/04/24,UPI-SWIGGY,0000123,250.00,,9750.00",
                "02/04/24,SALARY APRIL,0000124,,50000.00,59750.00");

        TabularReadResult result = reader.parseMixedLines(lines).orElseThrow();

        assertThat(result.metadata().asMap()).containsExactly(
                entry("Account Name", "Jane Doe"),
                entry("Account No", "1234"));
        assertThat(result.headers()).hasSize(6).startsWith("Date", "Narration");
        assertThat(result.rows()).hasSize(2);
        assertThat(result.rows().get(1).get(4)).isEqualTo("50000.00");
    }

    /**
     * A narration containing commas produces extra fields; they are folded back into the second column.
     */
    @Test
    void extraFieldsAreMergedIntoNarration() {
        List<String> lines = List.of(
                "Date,Narration,Withdrawal,Deposit,Balance",
                "01/04/24,Payment to X, Y and Z,100.00,,900.00");

        TransactionRow row = reader.parseMixedLines(lines).orElseThrow().rows().get(0);

        assertThat(row.cells()).containsExactly("01/04/24", "Payment to X, Y and Z", "100.00", "", "900.00");
    }

    @Test
    void shortLinesAreDropped() {
        List<String> lines = List.of(
                "Date,Narration,Withdrawal,Deposit,Balance",
                "Generated by NetBanking",
                "01/04/24,ATM,100.00,,900.00");

        assertThat(reader.parseMixedLines(lines).orElseThrow().rows()).hasSize(1);
    }

    @Test
    void withoutHeaderLineNothingIsParsed() {
        Optional<TabularReadResult> result = reader.parseMixedLines(List.of("a,b,c", "1,2,3"));

        assertThat(result).isEmpty();
    }

    @Test
    void genericReadCarvesLeadingMetadataBlock() {
        RawGrid grid = new RawGrid(List.of(
                List.of("Customer: Jane Doe", "", ""),
                List.of("", "", ""),
                List.of("Period: April 2024", "", ""),
                List.of("Txn Date", "Details", "Amount"),
                List.of("01/04/24", "ATM", "100.00"),
                List.of("02/04/24", "POS")));

        TabularReadResult result = reader.readGeneric(grid).orElseThrow();

        assertThat(result.metadata().get("Customer")).isEqualTo("Jane Doe");
        assertThat(result.metadata().get("Period")).isEqualTo("April 2024");
        assertThat(result.headers()).containsExactly("Txn Date", "Details", "Amount");
        assertThat(result.rows()).hasSize(2);
        assertThat(result.rows().get(1).cells()).containsExactly("02/04/24", "POS", null);
    }

    @Test
    void genericReadStopsScanningAtTransactionKeyword() {
        RawGrid grid = new RawGrid(List.of(
                List.of("Date", "Narration", "Balance"),
                List.of("Note: see branch", "", ""),
                List.of("01/04/24", "ATM", "900.00")));

        TabularReadResult result = reader.readGeneric(grid).orElseThrow();

        assertThat(result.metadata().isEmpty()).isTrue();
        assertThat(result.headers()).containsExactly("Date", "Narration", "Balance");
        assertThat(result.rows()).hasSize(2);
    }

    @Test
    void genericReadOfHeaderOnlyGridIsEmpty() {
        assertThat(reader.readGeneric(new RawGrid(List.of(List.of("Date", "Narration"))))).isEmpty();
        assertThat(reader.readGeneric(RawGrid.empty())).isEmpty();
    }

    @Test
    void gridSplitKeepsCellsAndPadsShortRows() {
        RawGrid grid = new RawGrid(List.of(
                List.of("ACME BANK"),
                List.of("Account No:", "42"),
                List.of(),
                List.of("Date", "Narration", "Balance", "Withdrawal", "Deposit", ""),
                List.of("01/04/24", "NEFT, ACME", "1,250.00", "100.00"),
                List.of("02/04/24", "Salary", "6,250.00", "", "5,000.00", "", "extra")));

        TabularReadResult result = reader.parseMixedGrid(grid).orElseThrow();

        assertThat(result.metadata().asMap()).containsExactly(entry("Account No", "42"));
        assertThat(result.headers()).containsExactly("Date", "Narration", "Balance", "Withdrawal", "Deposit");
        assertThat(result.rows()).containsExactly(
                TransactionRow.of("01/04/24", "NEFT, ACME", "1,250.00", "100.00", null),
                TransactionRow.of("02/04/24", "Salary", "6,250.00", "", "5,000.00"));
    }

    @Test
    void gridSplitWithoutHeaderIsEmpty() {
        RawGrid grid = new RawGrid(List.of(List.of("Ref", "Item", "Qty"), List.of("A1", "Widget", "3")));

        assertThat(reader.parseMixedGrid(grid)).isEmpty();
    }
}
