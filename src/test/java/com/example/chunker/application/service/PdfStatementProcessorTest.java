package com.example.chunker.application.service;

import com.example.chunker.config.ChunkingProperties;
import com.example.chunker.domain.model.ChunkingOptions;
import com.example.chunker.domain.model.PdfPageContent;
import com.example.chunker.domain.model.ProcessingResult;
import com.example.chunker.domain.model.RawGrid;
import com.example.chunker.infrastructure.exception.StatementReadException;
import com.example.chunker.infrastructure.pdf.PdfBoxPageExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PdfStatementProcessorTest {

    private static final Path FILE = Path.of("statement.pdf");

    @Mock
    private PdfBoxPageExtractor pageExtractor;

    private PdfStatementProcessor processor;

    @BeforeEach
    void setUp() {
        ChunkingProperties properties = new ChunkingProperties();
        properties.getTextFallback().setWindow(10);
        properties.getTextFallback().setOverlap(2);
        processor = new PdfStatementProcessor(pageExtractor, new PdfTableAssembler(), new TransactionChunker(), properties);
    }

    @Test
    void tableIsChunkedWithTextOutsideItAsMetadata() {
        RawGrid table = new RawGrid(List.of(
                List.of("Date", "Narration", "Withdrawal", "Deposit", "Balance"),
                List.of("01/04/24", "ATM", "500.00", "", "9500.00"),
                List.of("02/04/24", "Salary", "", "1000.00", "10500.00")));
        when(pageExtractor.extractPages(FILE)).thenReturn(List.of(
                new PdfPageContent(1, List.of(table), RawGrid.empty(), List.of("ACME BANK", "Account No: 1234"))));

        ProcessingResult result = processor.process(FILE, ChunkingOptions.defaults());

        assertThat(result.fallbackUsed()).isFalse();
        assertThat(result.metadata().asMap()).containsExactly(Map.entry("page_1", "ACME BANK | Account No: 1234"));
        assertThat(result.chunks()).hasSize(2);
        assertThat(result.chunks().get(0)).isEqualTo("page_1: ACME BANK | Account No: 1234");
        assertThat(result.chunks().get(1))
                .contains("\"page_1\": \"ACME BANK | Account No: 1234\"")
                .contains("headers[5]: Date,Narration,Debit,Credit,Balance")
                .contains("\"02/04/24\",\"Salary\",\"null\",\"1000.00\",\"10500.00\"")
                .endsWith("num_transactions: 2");
        verify(pageExtractor, never()).extractText(FILE);
    }

    @Test
    void documentWithoutTablesFallsBackToTextWindows() {
        when(pageExtractor.extractPages(FILE)).thenReturn(List.of(
                new PdfPageContent(1, List.of(), RawGrid.empty(), List.of("Dear customer"))));
        when(pageExtractor.extractText(FILE)).thenReturn("0123456789abcdefghij");

        ProcessingResult result = processor.process(FILE, ChunkingOptions.defaults());

        assertThat(result.fallbackUsed()).isTrue();
        assertThat(result.metadata().asMap()).containsEntry("source", "text_fallback").hasSize(1);
        assertThat(result.chunks()).containsExactly(
                "source: text_fallback\nStatement of account\nContent\n0123456789",
                "source: text_fallback\nStatement of account\nContent\n89abcdefgh",
                "source: text_fallback\nStatement of account\nContent\nghij");
    }

    @Test
    void extractionFailureFallsBackToText() {
        when(pageExtractor.extractPages(FILE))
                .thenThrow(new StatementReadException("Failed to open " + FILE, new IOException("bad xref")));
        when(pageExtractor.extractText(FILE)).thenReturn("short text");

        ProcessingResult result = processor.process(FILE, ChunkingOptions.defaults());

        assertThat(result.fallbackUsed()).isTrue();
        assertThat(result.chunks()).containsExactly("source: text_fallback\nStatement of account\nContent\nshort text");
    }

    @Test
    void documentWithoutTextYieldsEmptyFallback() {
        when(pageExtractor.extractPages(FILE)).thenReturn(List.of());
        when(pageExtractor.extractText(FILE)).thenReturn("   ");

        assertThat(processor.process(FILE, ChunkingOptions.defaults())).isEqualTo(ProcessingResult.emptyFallback());
    }
}
