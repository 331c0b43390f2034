package com.example.chunker.infrastructure.pdf;

import com.example.chunker.domain.model.PdfDocumentInfo;
import com.example.chunker.domain.model.PdfPageContent;
import com.example.chunker.infrastructure.exception.StatementReadException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Runs the PDFBox readers against small statements generated on the fly.
 */
class PdfBoxPageExtractorTest {

    private static final float[] COLUMNS = {50f, 120f, 260f, 340f, 420f};

    private final PdfBoxPageExtractor extractor = new PdfBoxPageExtractor();
    private final PdfBoxDocumentInfoReader documentInfoReader = new PdfBoxDocumentInfoReader();

    @TempDir
    Path tempDir;

    /**
     * The header line fixes the columns; the lines above it are loose text.
     *
     * @throws IOException when the sample PDF cannot be written
     */
    @Test
    void extractPagesSplitsTableBelowHeader() throws IOException {
        Path pdf = tempDir.resolve("statement.pdf");
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                writeAt(content, 50f, 780f, "ACME BANK");
                writeAt(content, 50f, 765f, "Account No: 1234");
                writeRow(content, 700f, "Date", "Narration", "Withdrawal", "Deposit", "Balance");
                writeRow(content, 685f, "01/04/24", "ATM", "500.00", null, "9500.00");
                writeRow(content, 670f, "02/04/24", "Salary", null, "1000.00", "10500.00");
            }
            document.save(pdf.toFile());
        }

        List<PdfPageContent> pages = extractor.extractPages(pdf);

        assertThat(pages).hasSize(1);
        PdfPageContent page = pages.get(0);
        assertThat(page.pageNumber()).isEqualTo(1);
        assertThat(page.nonTableLines()).containsExactly("ACME BANK", "Account No: 1234");
        assertThat(page.tables()).hasSize(1);
        assertThat(page.tables().get(0).rows()).containsExactly(
                List.of("Date", "Narration", "Withdrawal", "Deposit", "Balance"),
                List.of("01/04/24", "ATM", "500.00", "", "9500.00"),
                List.of("02/04/24", "Salary", "", "1000.00", "10500.00"));
        assertThat(page.wordRows().size()).isEqualTo(5);
    }

    /**
     * A continuation page without its own header is split with the columns of the previous page.
     *
     * @throws IOException when the sample PDF cannot be written
     */
    @Test
    void extractPagesReusesLayoutOnContinuationPages() throws IOException {
        Path pdf = tempDir.resolve("two-pages.pdf");
        try (PDDocument document = new PDDocument()) {
            PDPage first = new PDPage(PDRectangle.A4);
            PDPage second = new PDPage(PDRectangle.A4);
            document.addPage(first);
            document.addPage(second);
            try (PDPageContentStream content = new PDPageContentStream(document, first)) {
                writeRow(content, 700f, "Date", "Narration", "Withdrawal", "Deposit", "Balance");
                writeRow(content, 685f, "01/04/24", "ATM", "500.00", null, "9500.00");
            }
            try (PDPageContentStream content = new PDPageContentStream(document, second)) {
                writeRow(content, 760f, "03/04/24", "Rent", "4000.00", null, "5500.00");
            }
            document.save(pdf.toFile());
        }

        List<PdfPageContent> pages = extractor.extractPages(pdf);

        assertThat(pages).hasSize(2);
        assertThat(pages.get(1).nonTableLines()).isEmpty();
        assertThat(pages.get(1).tables()).singleElement()
                .satisfies(grid -> assertThat(grid.rows()).containsExactly(
                        List.of("03/04/24", "Rent", "4000.00", "", "5500.00")));
    }

    /**
     * Without a header line nothing is read as a table.
     *
     * @throws IOException when the sample PDF cannot be written
     */
    @Test
    void pageWithoutHeaderHasNoTables() throws IOException {
        Path pdf = createTextPdf("Dear customer, your statement is attached.");

        List<PdfPageContent> pages = extractor.extractPages(pdf);

        assertThat(pages).singleElement().satisfies(page -> {
            assertThat(page.tables()).isEmpty();
            assertThat(page.nonTableLines()).containsExactly("Dear customer, your statement is attached.");
        });
    }

    @Test
    void extractTextReturnsDocumentText() throws IOException {
        Path pdf = createTextPdf("Hello statement");

        assertThat(extractor.extractText(pdf)).isEqualTo("Hello statement");
    }

    @Test
    void documentInfoIsRead() throws IOException {
        Path pdf = tempDir.resolve("info.pdf");
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage(PDRectangle.A4));
            document.addPage(new PDPage(PDRectangle.A4));
            PDDocumentInformation info = new PDDocumentInformation();
            info.setTitle("April statement");
            info.setAuthor("ACME Bank");
            document.setDocumentInformation(info);
            document.save(pdf.toFile());
        }

        PdfDocumentInfo documentInfo = documentInfoReader.read(pdf);

        assertThat(documentInfo.title()).isEqualTo("April statement");
        assertThat(documentInfo.author()).isEqualTo("ACME Bank");
        assertThat(documentInfo.creatorTool()).isNull();
        assertThat(documentInfo.pageCount()).isEqualTo(2);
        assertThat(documentInfo.encrypted()).isFalse();
    }

    @Test
    void corruptFileRaisesReadException() throws IOException {
        Path broken = Files.writeString(tempDir.resolve("broken.pdf"), "not a pdf");

        assertThrows(StatementReadException.class, () -> extractor.extractPages(broken));
        assertThrows(StatementReadException.class, () -> extractor.extractText(broken));
        assertThrows(StatementReadException.class, () -> documentInfoReader.read(broken));
    }

    private Path createTextPdf(String text) throws IOException {
        Path pdf = tempDir.resolve("text.pdf");
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                writeAt(content, 50f, 700f, text);
            }
            document.save(pdf.toFile());
        }
        return pdf;
    }

    private static void writeRow(PDPageContentStream content, float y, String... cells) throws IOException {
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] != null) {
                writeAt(content, COLUMNS[i], y, cells[i]);
            }
        }
    }

    private static void writeAt(PDPageContentStream content, float x, float y, String text) throws IOException {
        content.beginText();
        content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 10);
        content.newLineAtOffset(x, y);
        content.showText(text);
        content.endText();
    }
}
