package com.graphload.core.service.csv;

import com.graphload.core.service.config.IngestionConfig;
import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Reads a validated CSV file into typed rows and infers column types.
 */
@Slf4j
@Component
public class CsvFileParser {

    private final CsvParserFactory parserFactory;
    private final ColumnTypeDetector typeDetector;

    @Autowired
    public CsvFileParser(CsvParserFactory parserFactory, IngestionConfig config) {
        this(parserFactory, new ColumnTypeDetector(config.getSampling().getTypeDetectionSize()));
    }

    public CsvFileParser(CsvParserFactory parserFactory, ColumnTypeDetector typeDetector) {
        this.parserFactory = parserFactory;
        this.typeDetector = typeDetector;
    }

    public ParsedCsv parse(Path file) {
        try (InputStream input = Files.newInputStream(file)) {
            return parse(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read CSV file " + file.getFileName(), e);
        }
    }

    /**
     * @throws IllegalStateException if the file has no header row or cannot be parsed
     */
    public ParsedCsv parse(InputStream input) {
        CsvParser parser = parserFactory.newParser(false);
        parser.beginParsing(CsvParserFactory.utf8Reader(input));
        try {
            String[] first = parser.parseNext();
            if (first == null) {
                throw new IllegalStateException("CSV file has no header row");
            }
            var header = CsvHeader.of(Arrays.asList(first));
            var rows = readRows(parser, header);
            var columns = detectColumns(header, rows);

            log.info("Parsed CSV file: {} rows, {} columns", rows.size(), header.size());
            return new ParsedCsv(header, rows, columns);
        } catch (TextParsingException e) {
            throw new IllegalStateException("Failed to parse CSV file: " + e.getMessage(), e);
        } finally {
            parser.stopParsing();
        }
    }

    private List<TypedRow> readRows(CsvParser parser, CsvHeader header) {
        var rows = new ArrayList<TypedRow>();
        var columns = header.columns();
        int rowNumber = 1;

        String[] cells;
        while ((cells = parser.parseNext()) != null) {
            rowNumber++;
            var values = new LinkedHashMap<String, String>();
            boolean blank = true;
            for (int i = 0; i < columns.size(); i++) {
                String value = i < cells.length ? normalize(cells[i]) : null;
                values.put(columns.get(i), value);
                blank &= value == null;
            }
            if (!blank) {
                rows.add(new TypedRow(rowNumber, values));
            }
        }
        return rows;
    }

    private LinkedHashMap<String, ColumnMetadata> detectColumns(CsvHeader header, List<TypedRow> rows) {
        var columns = new LinkedHashMap<String, ColumnMetadata>();
        for (String column : header.columns()) {
            var values = rows.stream()
                    .map(row -> row.get(column))
                    .filter(value -> value != null)
                    .toList();
            columns.put(column, typeDetector.detect(values));
        }
        return columns;
    }

    private static String normalize(String cell) {
        if (cell == null) {
            return null;
        }
        String trimmed = cell.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
