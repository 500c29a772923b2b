package com.graphload.core.service.csv;

import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Creates univocity parsers configured for uploaded CSV files.
 *
 * Rows are returned raw: no header extraction, no whitespace trimming, blank
 * lines kept and comments disabled, so row numbers match the file's records.
 */
@Slf4j
@Component
public class CsvParserFactory {

    private static final int MAX_COLUMNS = 2048;

    /**
     * @param keepQuotes keep enclosing quotes in values, used by the validator's escaping checks
     */
    public CsvParser newParser(boolean keepQuotes) {
        var settings = new CsvParserSettings();
        settings.setHeaderExtractionEnabled(false);
        settings.setSkipEmptyLines(false);
        settings.setIgnoreLeadingWhitespaces(false);
        settings.setIgnoreTrailingWhitespaces(false);
        settings.setNullValue("");
        settings.setEmptyValue("");
        settings.setKeepQuotes(keepQuotes);
        settings.setMaxCharsPerColumn(-1);
        settings.setMaxColumns(MAX_COLUMNS);
        settings.setLineSeparatorDetectionEnabled(true);
        settings.getFormat().setComment('\0');
        log.debug("Created CsvParser keepQuotes={}", keepQuotes);
        return new CsvParser(settings);
    }

    /**
     * UTF-8 reader that fails on malformed input instead of substituting characters.
     */
    public static Reader utf8Reader(InputStream input) {
        var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return new InputStreamReader(input, decoder);
    }
}
