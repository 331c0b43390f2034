package com.example.chunker.application.service;

import com.example.chunker.domain.model.ChunkingOptions;
import com.example.chunker.domain.model.ColumnMap;
import com.example.chunker.domain.model.ColumnRole;
import com.example.chunker.domain.model.HeaderSchema;
import com.example.chunker.domain.model.StatementMetadata;
import com.example.chunker.domain.model.TransactionRow;
import com.example.chunker.domain.model.TransactionTable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the chunk layouts.
 */
class TransactionChunkerTest {

    private final TransactionChunker chunker = new TransactionChunker();

    private final StatementMetadata metadata = StatementMetadata.builder()
            .put("Account No", "1234")
            .put("Name", "Jane Doe")
            .build();

    @Test
    void structuredModeStartsWithMetadataChunk() {
        List<String> chunks = chunker.chunkStructured(metadata, table(5), new ChunkingOptions(2, 0));

        assertThat(chunks).hasSize(4);
        assertThat(chunks.get(0)).isEqualTo("Account No: 1234\nName: Jane Doe");
        assertThat(chunks.get(1)).contains("row_indices[2]: 0,1");
        assertThat(chunks.get(2)).contains("row_indices[2]: 2,3");
        assertThat(chunks.get(3)).contains("row_indices[2]: 4,4").contains("num_transactions: 1");
    }

    @Test
    void structuredModeHonoursOverlap() {
        List<String> chunks = chunker.chunkStructured(metadata, table(5), new ChunkingOptions(3, 1));

        assertThat(chunks).hasSize(3);
        assertThat(chunks.get(1)).contains("row_indices[2]: 0,2");
        assertThat(chunks.get(2)).contains("row_indices[2]: 2,4");
    }

    /**
     * Verifies the full block layout, including quoting and the null marker for blank cells.
     */
    @Test
    void structuredChunkLayout() {
        HeaderSchema schema = new HeaderSchema(List.of("Date", "Narration", "Debit"), ColumnMap.builder(3)
                .map(ColumnRole.DATE, 0).map(ColumnRole.NARRATION, 1).map(ColumnRole.DEBIT, 2).build());
        TransactionTable table = new TransactionTable(schema,
                List.of(TransactionRow.of(" 01/04/2024 ", "Coffee", "  ")));

        List<String> chunks = chunker.chunkStructured(StatementMetadata.of("Account No", "1234"), table,
                ChunkingOptions.defaults());

        assertThat(chunks.get(1)).isEqualTo(String.join("\n",
                "    metadata:",
                "      \"Account No\": \"1234\"",
                "    headers[3]: Date,Narration,Debit",
                "    rows[1]:",
                "      - [3,]: \"01/04/2024\",\"Coffee\",\"null\"",
                "    row_indices[2]: 0,0",
                "    num_transactions: 1"));
    }

    @Test
    void emptyTableStillYieldsMetadataChunk() {
        List<String> chunks = chunker.chunkStructured(metadata, table(0), ChunkingOptions.defaults());

        assertThat(chunks).containsExactly("Account No: 1234\nName: Jane Doe");
    }

    @Test
    void fallbackModeIgnoresOverlapAndSkipsMetadataChunk() {
        List<TransactionRow> rows = table(5).rows();

        List<String> chunks = chunker.chunkFallback(metadata, List.of("Date", "Narration", "Balance"), rows,
                new ChunkingOptions(2, 1));

        assertThat(chunks).hasSize(3);
        assertThat(chunks.get(0)).startsWith("Account No: 1234\nName: Jane Doe\nStatement of account\nDate Narration Balance\n");
        assertThat(chunks.get(2)).endsWith("05/04/2024 Txn 5 105.00");
    }

    @Test
    void fallbackChunkRendersNullCellsAsEmpty() {
        String chunk = chunker.formatFallbackChunk(StatementMetadata.empty(), List.of("A", "B", "C"),
                List.of(Arrays.asList("x", null, "z")));

        assertThat(chunk).isEqualTo("Statement of account\nA B C\nx  z");
    }

    @Test
    void fallbackChunkWithoutRowsIsMetadataOnly() {
        assertThat(chunker.formatFallbackChunk(metadata, List.of("A"), List.of()))
                .isEqualTo("Account No: 1234\nName: Jane Doe");
    }

    private TransactionTable table(int rows) {
        HeaderSchema schema = new HeaderSchema(List.of("Date", "Narration", "Balance"), ColumnMap.builder(3)
                .map(ColumnRole.DATE, 0).map(ColumnRole.NARRATION, 1).map(ColumnRole.BALANCE, 2).build());
        List<TransactionRow> data = new ArrayList<>();
        for (int i = 1; i <= rows; i++) {
            data.add(TransactionRow.of("0" + i + "/04/2024", "Txn " + i, (100 + i) + ".00"));
        }
        return new TransactionTable(schema, data);
    }
}
