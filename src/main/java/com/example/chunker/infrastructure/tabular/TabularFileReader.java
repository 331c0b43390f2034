package com.example.chunker.infrastructure.tabular;

import com.example.chunker.domain.model.RawGrid;
import com.example.chunker.domain.model.SourceFormat;
import com.example.chunker.infrastructure.exception.StatementReadException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads CSV and Excel statements from disk, either as text lines or as a cell grid.
 * <p>
 * CSV files are decoded as UTF-8 with undecodable bytes dropped and a leading byte order mark
 * removed. Workbooks are only read as a grid, with Apache POI; only the first sheet is used and
 * every cell is rendered the way Excel displays it, with locale-neutral number symbols.
 */
@Service
public class TabularFileReader {

    private static final Logger log = LoggerFactory.getLogger(TabularFileReader.class);
    private static final char BOM = '\uFEFF';

    /**
     * Reads a CSV statement as text lines.
     *
     * @param file CSV statement on disk
     * @return lines in file order
     * @throws StatementReadException when the file cannot be read
     */
    public List<String> readLines(Path file) {
        try (BufferedReader reader = new BufferedReader(openLenientUtf8(file))) {
            List<String> lines = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(lines.isEmpty() ? stripBom(line) : line);
            }
            log.debug("Read {} lines from {}", lines.size(), file.getFileName());
            return lines;
        } catch (IOException ex) {
            throw new StatementReadException("Failed to read lines from " + file, ex);
        }
    }

    /**
     * Reads the statement as a grid of cells, one list per record or sheet row.
     *
     * @param file   statement on disk
     * @param format CSV or workbook format
     * @return cell grid, blank cells as empty strings
     * @throws StatementReadException when the file cannot be read or parsed
     */
    public RawGrid readTable(Path file, SourceFormat format) {
        if (format.isWorkbook()) {
            return readWorkbook(file);
        }
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();
        try (Reader reader = openLenientUtf8(file);
             CSVParser parser = csvFormat.parse(reader)) {
            List<List<String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                List<String> cells = new ArrayList<>(record.size());
                for (String value : record) {
                    cells.add(rows.isEmpty() && cells.isEmpty() ? stripBom(value) : value);
                }
                rows.add(cells);
            }
            log.debug("Parsed {} CSV records from {}", rows.size(), file.getFileName());
            return new RawGrid(rows);
        } catch (IOException | IllegalStateException | UncheckedIOException ex) {
            throw new StatementReadException("Failed to parse CSV " + file, ex);
        }
    }

    private RawGrid readWorkbook(Path file) {
        try (InputStream inputStream = Files.newInputStream(file);
             Workbook workbook = WorkbookFactory.create(inputStream)) {
            if (workbook.getNumberOfSheets() == 0) {
                return RawGrid.empty();
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter(Locale.ROOT);
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            List<List<String>> rows = new ArrayList<>();
            for (int rowIndex = sheet.getFirstRowNum(); rowIndex <= sheet.getLastRowNum(); rowIndex++) {
                Row row = sheet.getRow(rowIndex);
                List<String> cells = new ArrayList<>();
                if (row != null) {
                    int lastCell = Math.max(row.getLastCellNum(), 0);
                    for (int cellIndex = 0; cellIndex < lastCell; cellIndex++) {
                        Cell cell = row.getCell(cellIndex, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
                        cells.add(cell == null ? "" : formatter.formatCellValue(cell, evaluator).trim());
                    }
                }
                rows.add(cells);
            }
            log.debug("Read {} rows from sheet '{}' of {}", rows.size(), sheet.getSheetName(), file.getFileName());
            return new RawGrid(rows);
        } catch (IOException | RuntimeException ex) {
            throw new StatementReadException("Failed to read workbook " + file, ex);
        }
    }

    private Reader openLenientUtf8(Path file) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        return new InputStreamReader(Files.newInputStream(file), decoder);
    }

    private static String stripBom(String value) {
        if (value != null && !value.isEmpty() && value.charAt(0) == BOM) {
            return value.substring(1);
        }
        return value;
    }
}
