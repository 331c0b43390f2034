package com.example.chunker.infrastructure.pdf;

import com.example.chunker.application.structure.HeaderLocator;
import com.example.chunker.domain.model.PdfPageContent;
import com.example.chunker.domain.model.RawGrid;
import com.example.chunker.infrastructure.exception.StatementReadException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads PDF statements page by page with PDFBox and turns positioned words into table grids.
 * <p>
 * A table starts at a header line (a line whose labels name at least three statement columns).
 * Column boundaries are placed halfway between the header labels and reused on the following
 * pages, so continuation pages without a repeated header are still split into the same columns.
 * Lines above the header are reported as non-table text.
 */
@Service
public class PdfBoxPageExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxPageExtractor.class);
    static final float LABEL_GAP = 6f;
    private static final int MIN_HEADER_LABELS = 3;

    /**
     * Extracts the tables, word rows and loose text lines of every page.
     *
     * @param file PDF statement on disk
     * @return one entry per page, in page order
     * @throws StatementReadException when PDFBox cannot open or parse the file
     */
    public List<PdfPageContent> extractPages(Path file) {
        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            List<PdfPageContent> pages = new ArrayList<>(document.getNumberOfPages());
            ColumnLayout layout = null;
            for (int pageNumber = 1; pageNumber <= document.getNumberOfPages(); pageNumber++) {
                List<TextLine> lines = stripLines(document, pageNumber);
                int headerIndex = findHeaderLine(lines);
                if (headerIndex >= 0) {
                    layout = ColumnLayout.fromLabels(lines.get(headerIndex).phrases(LABEL_GAP));
                    log.debug("Page {}: header at line {} with layout {}", pageNumber, headerIndex, layout);
                }
                pages.add(toPageContent(pageNumber, lines, headerIndex, layout));
            }
            log.info("Extracted {} pages from {}", pages.size(), file.getFileName());
            return pages;
        } catch (IOException ex) {
            throw new StatementReadException("Failed to read PDF: " + file, ex);
        }
    }

    /**
     * Extracts the plain text of the whole document in reading order.
     *
     * @param file PDF statement on disk
     * @return stripped text
     * @throws StatementReadException when PDFBox cannot open or parse the file
     */
    public String extractText(Path file) {
        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setLineSeparator("\n");
            return stripper.getText(document).strip();
        } catch (IOException ex) {
            throw new StatementReadException("Failed to read PDF text: " + file, ex);
        }
    }

    static PdfPageContent toPageContent(int pageNumber, List<TextLine> lines, int headerIndex, ColumnLayout layout) {
        List<List<String>> wordRows = new ArrayList<>(lines.size());
        for (TextLine line : lines) {
            wordRows.add(line.words());
        }

        if (layout == null) {
            return new PdfPageContent(pageNumber, List.of(), new RawGrid(wordRows), texts(lines));
        }

        int tableStart = Math.max(headerIndex, 0);
        List<List<String>> grid = new ArrayList<>();
        for (TextLine line : lines.subList(tableStart, lines.size())) {
            grid.add(layout.extractColumns(line));
        }
        List<RawGrid> tables = grid.isEmpty() ? List.of() : List.of(new RawGrid(grid));
        return new PdfPageContent(pageNumber, tables, new RawGrid(wordRows), texts(lines.subList(0, tableStart)));
    }

    static int findHeaderLine(List<TextLine> lines) {
        for (int i = 0; i < lines.size(); i++) {
            TextLine line = lines.get(i);
            List<PositionedToken> labels = line.phrases(LABEL_GAP);
            if (labels.size() < MIN_HEADER_LABELS) {
                continue;
            }
            List<String> labelTexts = labels.stream().map(PositionedToken::text).toList();
            if (HeaderLocator.isHeaderLine(line.text()) || HeaderLocator.isHeaderRow(labelTexts)) {
                return i;
            }
        }
        return -1;
    }

    private List<TextLine> stripLines(PDDocument document, int pageNumber) throws IOException {
        PositionalTextStripper stripper = new PositionalTextStripper();
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        stripper.getText(document);
        return stripper.getLines();
    }

    private static List<String> texts(List<TextLine> lines) {
        List<String> texts = new ArrayList<>(lines.size());
        for (TextLine line : lines) {
            String text = line.text();
            if (!text.isEmpty()) {
                texts.add(text);
            }
        }
        return texts;
    }
}
