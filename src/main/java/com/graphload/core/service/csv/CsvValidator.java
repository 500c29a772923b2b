package com.graphload.core.service.csv;

import com.graphload.core.service.config.IngestionConfig;
import com.graphload.core.service.task.FileKind;
import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural and content validation of uploaded CSV files.
 *
 * Errors make a file unusable; warnings are reported but do not stop
 * ingestion. Only the first {@code maxValidatedRows} non-blank data rows are
 * content-checked.
 */
@Slf4j
@Component
public class CsvValidator {

    static final String EMPTY_FILE = "Empty file";
    static final String MISSING_HEADER = "First row MUST contain column headers (property names)";
    static final String NO_DATA_ROWS = "No data rows found";

    private static final String ESCAPING_HINT = "Proper CSV escaping for special characters required";
    private static final String PARSING_ERROR = "CSV parsing error: ";
    private static final char QUOTE = '"';

    private final CsvParserFactory parserFactory;
    private final int maxValidatedRows;

    @Autowired
    public CsvValidator(CsvParserFactory parserFactory, IngestionConfig config) {
        this(parserFactory, config.getValidation().getMaxValidatedRows());
    }

    public CsvValidator(CsvParserFactory parserFactory, int maxValidatedRows) {
        this.parserFactory = parserFactory;
        this.maxValidatedRows = maxValidatedRows;
    }

    public ValidationResult validate(Path file) throws IOException {
        try (InputStream input = Files.newInputStream(file)) {
            return validate(input);
        }
    }

    /**
     * @throws CsvValidationException when the file has at least one error
     */
    public ValidationResult requireValid(Path file) throws IOException {
        var result = validate(file);
        if (!result.valid()) {
            throw new CsvValidationException(result);
        }
        return result;
    }

    public ValidationResult validate(InputStream input) {
        var scan = new Scan();
        var buffered = new BufferedInputStream(input);

        try {
            if (isEmpty(buffered)) {
                scan.errors.add(EMPTY_FILE);
                return scan.result();
            }

            CsvParser parser = parserFactory.newParser(true);
            parser.beginParsing(CsvParserFactory.utf8Reader(buffered));
            try {
                scanFile(parser, scan);
            } finally {
                parser.stopParsing();
            }
        } catch (IOException e) {
            scan.errors.add(PARSING_ERROR + e.getMessage());
        } catch (TextParsingException | IllegalStateException e) {
            scan.errors.add(PARSING_ERROR + describe(e));
        }

        var result = scan.result();
        log.debug("CSV validated: kind={}, valid={}, {} errors, {} warnings",
                result.kind(), result.valid(), result.errors().size(), result.warnings().size());
        return result;
    }

    // ==================== Header ====================

    private void scanFile(CsvParser parser, Scan scan) {
        String[] first = parser.parseNext();
        if (first == null) {
            scan.errors.add(MISSING_HEADER);
            return;
        }

        var header = CsvHeader.of(unquoteAll(first));
        if (header.hasBlankColumn()) {
            scan.errors.add(MISSING_HEADER);
            return;
        }
        scan.header = header;

        var missing = header.missingRequiredColumns();
        if (!missing.isEmpty()) {
            scan.errors.add(requiredColumnsMessage(header.kind(), missing));
        }

        var duplicates = header.duplicateColumns();
        if (!duplicates.isEmpty()) {
            scan.errors.add("Duplicate columns: " + String.join(", ", duplicates));
        }

        scanRows(parser, scan);
    }

    private static String requiredColumnsMessage(FileKind kind, List<String> missing) {
        if (kind == FileKind.RELATIONSHIP) {
            return "For relationship files required fields: " + String.join(" and ", missing);
        }
        return "For node files required fields: " + String.join(" and ", missing);
    }

    // ==================== Rows ====================

    private void scanRows(CsvParser parser, Scan scan) {
        var header = scan.header;
        int rowNumber = 1;
        int counted = 0;

        String[] row;
        while ((row = parser.parseNext()) != null) {
            rowNumber++;
            if (isBlank(row)) {
                continue;
            }

            counted++;
            if (counted > maxValidatedRows) {
                scan.warnings.add("File has more than %d rows. Validation limited to first %d rows."
                        .formatted(maxValidatedRows, maxValidatedRows));
                break;
            }

            if (row.length != header.size()) {
                scan.errors.add("Row %d: All rows must have the same number of columns (%d vs %d)"
                        .formatted(rowNumber, row.length, header.size()));
                continue;
            }

            checkEscaping(row, rowNumber, scan.warnings);
            checkContent(header, unquoteAll(row), rowNumber, scan.warnings);
        }

        if (counted == 0) {
            scan.warnings.add(NO_DATA_ROWS);
        }
    }

    private void checkEscaping(String[] row, int rowNumber, List<String> warnings) {
        for (int i = 0; i < row.length; i++) {
            String cell = row[i];
            if (cell == null || cell.isEmpty()) {
                continue;
            }
            int column = i + 1;
            if (!isQuoteWrapped(cell) && countQuotes(cell) % 2 != 0) {
                warnings.add("Row %d, Column %d: Possible unescaped quote - %s"
                        .formatted(rowNumber, column, ESCAPING_HINT));
            }
            // line breaks are judged on the value, enclosing quotes removed
            String value = unquote(cell);
            if ((value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) && !isQuoteWrapped(value)) {
                warnings.add("Row %d, Column %d: Newline detected - %s"
                        .formatted(rowNumber, column, ESCAPING_HINT));
            }
        }
    }

    private void checkContent(CsvHeader header, List<String> cells, int rowNumber, List<String> warnings) {
        if (header.kind() == FileKind.NODE) {
            if (header.idColumn() != null && valueOf(header, cells, header.idColumn()).isEmpty()) {
                warnings.add("Row %d: Empty 'id' value".formatted(rowNumber));
            }
            return;
        }

        String source = header.sourceColumn() == null ? null : valueOf(header, cells, header.sourceColumn());
        String target = header.targetColumn() == null ? null : valueOf(header, cells, header.targetColumn());

        if (source != null && source.isEmpty()) {
            warnings.add("Row %d: Empty 'source_id'".formatted(rowNumber));
        }
        if (target != null && target.isEmpty()) {
            warnings.add("Row %d: Empty 'target_id'".formatted(rowNumber));
        }
        if (source != null && !source.isEmpty() && source.equals(target)) {
            warnings.add(("Row %d: The source and target IDs are the same. "
                    + "This creates a self-referencing relationship.").formatted(rowNumber));
        }
    }

    // ==================== Helpers ====================

    private static boolean isEmpty(BufferedInputStream input) throws IOException {
        input.mark(1);
        int first = input.read();
        input.reset();
        return first < 0;
    }

    private static String valueOf(CsvHeader header, List<String> cells, String column) {
        return cells.get(header.columns().indexOf(column)).trim();
    }

    private static boolean isBlank(String[] row) {
        return Arrays.stream(row).allMatch(cell -> cell == null || unquote(cell).isBlank());
    }

    private static boolean isQuoteWrapped(String cell) {
        return cell.length() >= 2 && cell.charAt(0) == QUOTE && cell.charAt(cell.length() - 1) == QUOTE;
    }

    private static int countQuotes(String cell) {
        int count = 0;
        for (int i = 0; i < cell.length(); i++) {
            if (cell.charAt(i) == QUOTE) {
                count++;
            }
        }
        return count;
    }

    static String unquote(String cell) {
        if (cell == null) {
            return "";
        }
        return isQuoteWrapped(cell) ? cell.substring(1, cell.length() - 1) : cell;
    }

    private static List<String> unquoteAll(String[] cells) {
        var values = new ArrayList<String>(cells.length);
        for (String cell : cells) {
            values.add(unquote(cell));
        }
        return values;
    }

    private static String describe(RuntimeException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof CharacterCodingException) {
                return "file is not valid UTF-8 text";
            }
        }
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        int lineBreak = message.indexOf('\n');
        return lineBreak < 0 ? message : message.substring(0, lineBreak);
    }

    /**
     * Accumulates findings; error order is kept and repeats are dropped.
     */
    private static final class Scan {
        private final Set<String> errors = new LinkedHashSet<>();
        private final List<String> warnings = new ArrayList<>();
        private CsvHeader header;

        private ValidationResult result() {
            return ValidationResult.of(new ArrayList<>(errors), warnings, header == null ? null : header.kind());
        }
    }
}
