package com.example.chunker.application.service;

import com.example.chunker.application.structure.AmountReconciler;
import com.example.chunker.application.structure.CellMerger;
import com.example.chunker.application.structure.HeaderLocator;
import com.example.chunker.application.structure.HeaderNormalizer;
import com.example.chunker.application.structure.RowClassifier;
import com.example.chunker.domain.model.ColumnMap;
import com.example.chunker.domain.model.HeaderSchema;
import com.example.chunker.domain.model.HeaderVariant;
import com.example.chunker.domain.model.PdfPageContent;
import com.example.chunker.domain.model.RawGrid;
import com.example.chunker.domain.model.TransactionRow;
import com.example.chunker.domain.model.TransactionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges the tables found on every page of a PDF statement into one transaction table.
 * <p>
 * The header of the first usable table defines the schema for the whole document. Later tables
 * are read as data under that schema, skipping a repeated header row. Once all pages are read,
 * tables whose width disagrees with the majority are discarded before the remaining ones are
 * cleaned and concatenated in page order.
 */
@Component
public class PdfTableAssembler {

    private static final Logger log = LoggerFactory.getLogger(PdfTableAssembler.class);

    /**
     * Assembles the transaction table of a document.
     *
     * @param pages page contents in page order
     * @return combined table, or empty when no page yielded a transaction row
     */
    public Optional<TransactionTable> assemble(List<PdfPageContent> pages) {
        List<ExtractedTable> extracted = extractTables(pages);
        if (extracted.isEmpty()) {
            log.warn("No tables with transaction rows were found");
            return Optional.empty();
        }

        List<ExtractedTable> consistent = keepMajorityWidth(extracted);
        if (consistent.isEmpty()) {
            return Optional.empty();
        }

        List<ExtractedTable> processed = new ArrayList<>();
        for (ExtractedTable table : consistent) {
            ColumnMap columnMap = table.schema().columnMap();
            List<TransactionRow> rows = CellMerger.splitMultilineCells(table.rows());
            rows = CellMerger.mergeContinuationRows(rows, columnMap);
            rows = AmountReconciler.reconcileDebitCredit(rows, columnMap);
            if (!rows.isEmpty()) {
                processed.add(new ExtractedTable(table.pageNumber(), table.tableIndex(), table.columnCount(), table.schema(), rows));
                log.debug("Page {}, table {}: {} rows after cleaning", table.pageNumber(), table.tableIndex(), rows.size());
            }
        }
        if (processed.isEmpty()) {
            log.warn("No rows remained after merging and reconciling the extracted tables");
            return Optional.empty();
        }

        HeaderSchema schema = processed.get(0).schema();
        List<TransactionRow> combined = new ArrayList<>();
        for (ExtractedTable table : processed) {
            combined.addAll(alignRows(table, schema));
        }
        log.info("Combined dataset: {} rows x {} columns from {} tables",
                combined.size(), schema.width(), processed.size());
        return Optional.of(new TransactionTable(schema, combined));
    }

    /**
     * Reads every table of every page under the document schema and keeps the transaction and
     * continuation rows.
     *
     * @param pages page contents in page order
     * @return tables with at least one retained row
     */
    List<ExtractedTable> extractTables(List<PdfPageContent> pages) {
        List<ExtractedTable> extracted = new ArrayList<>();
        HeaderSchema schema = null;

        for (PdfPageContent page : pages) {
            List<RawGrid> grids = page.tables();
            log.info("Found {} tables on page {}", grids.size(), page.pageNumber());
            if (grids.isEmpty() && schema != null) {
                RawGrid reconstructed = wordRowsWithoutFooters(page.wordRows());
                if (!reconstructed.isEmpty()) {
                    log.info("Reconstructed {} rows from words on page {}", reconstructed.size(), page.pageNumber());
                    grids = List.of(reconstructed);
                }
            }

            for (int tableIndex = 0; tableIndex < grids.size(); tableIndex++) {
                RawGrid grid = grids.get(tableIndex);
                if (grid.isEmpty()) {
                    continue;
                }
                List<List<String>> dataRows;
                if (schema == null) {
                    HeaderLocator.HeaderLocation header = HeaderLocator.locate(grid);
                    log.info("Found header at row {}: {}", header.index(), header.headers());
                    dataRows = grid.rows().subList(header.index() + 1, grid.size());
                    if (dataRows.isEmpty()) {
                        log.warn("No data rows after header on page {}", page.pageNumber());
                        continue;
                    }
                    schema = HeaderNormalizer.normalize(header.headers(), HeaderVariant.PDF);
                    log.info("Normalized to {} columns: {}", schema.width(), schema.headers());
                    log.info("Column mapping: {}", schema.columnMap());
                } else {
                    int start = HeaderLocator.isHeaderRow(grid.row(0)) ? 1 : 0;
                    dataRows = grid.rows().subList(start, grid.size());
                }

                List<TransactionRow> retained = retainStatementRows(dataRows, schema);
                if (retained.isEmpty()) {
                    log.warn("Page {}, table {}: no valid rows", page.pageNumber(), tableIndex);
                    continue;
                }
                log.info("Page {}, table {}: {} valid rows", page.pageNumber(), tableIndex, retained.size());
                extracted.add(new ExtractedTable(page.pageNumber(), tableIndex, columnCount(grid), schema, retained));
            }
        }
        log.info("Total tables extracted: {}", extracted.size());
        return extracted;
    }

    /**
     * Keeps the tables whose column count equals the most common count. On a tie the count seen
     * first wins.
     *
     * @param tables extracted tables
     * @return tables matching the majority width, in their original order
     */
    static List<ExtractedTable> keepMajorityWidth(List<ExtractedTable> tables) {
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (ExtractedTable table : tables) {
            counts.merge(table.columnCount(), 1, Integer::sum);
        }
        int targetWidth = -1;
        int best = 0;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                targetWidth = entry.getKey();
            }
        }
        List<ExtractedTable> kept = new ArrayList<>();
        for (ExtractedTable table : tables) {
            if (table.columnCount() == targetWidth) {
                kept.add(table);
            } else {
                log.warn("Discarding table {} on page {}: {} columns instead of {}",
                        table.tableIndex(), table.pageNumber(), table.columnCount(), targetWidth);
            }
        }
        log.info("Target column count: {} ({} of {} tables match)", targetWidth, kept.size(), tables.size());
        return kept;
    }

    private List<TransactionRow> retainStatementRows(List<List<String>> dataRows, HeaderSchema schema) {
        ColumnMap columnMap = schema.columnMap();
        List<TransactionRow> retained = new ArrayList<>();
        for (List<String> cells : dataRows) {
            TransactionRow row = blankToNull(TransactionRow.of(cells).resize(schema.width()));
            if (RowClassifier.isFooterRow(row)) {
                continue;
            }
            if (RowClassifier.isTransactionRow(row, columnMap) || RowClassifier.isContinuationRow(row, columnMap)) {
                retained.add(row);
            }
        }
        return retained;
    }

    private static int columnCount(RawGrid grid) {
        int width = 0;
        for (List<String> row : grid.rows()) {
            width = Math.max(width, row.size());
        }
        return width;
    }

    private RawGrid wordRowsWithoutFooters(RawGrid wordRows) {
        List<List<String>> rows = new ArrayList<>();
        for (List<String> row : wordRows.rows()) {
            if (!RowClassifier.isFooterRow(row)) {
                rows.add(row);
            }
        }
        return new RawGrid(rows);
    }

    private List<TransactionRow> alignRows(ExtractedTable table, HeaderSchema target) {
        if (table.schema().headers().equals(target.headers())) {
            return table.rows();
        }
        int[] sourceIndex = new int[target.width()];
        for (int i = 0; i < target.width(); i++) {
            sourceIndex[i] = table.schema().indexOfHeader(target.headers().get(i));
        }
        List<TransactionRow> aligned = new ArrayList<>(table.rows().size());
        for (TransactionRow row : table.rows()) {
            List<String> cells = new ArrayList<>(target.width());
            for (int index : sourceIndex) {
                cells.add(index < 0 ? null : row.get(index));
            }
            aligned.add(TransactionRow.of(cells));
        }
        return aligned;
    }

    private TransactionRow blankToNull(TransactionRow row) {
        List<String> cells = new ArrayList<>(row.size());
        for (String cell : row.cells()) {
            cells.add(cell == null || cell.isEmpty() ? null : cell);
        }
        return TransactionRow.of(cells);
    }

    /**
     * Rows retained from one table together with the schema they were read under.
     *
     * @param columnCount width of the widest row of the table as extracted, before resizing
     */
    record ExtractedTable(int pageNumber,
                          int tableIndex,
                          int columnCount,
                          HeaderSchema schema,
                          List<TransactionRow> rows) {
    }
}
