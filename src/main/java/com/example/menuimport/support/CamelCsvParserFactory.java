package com.example.menuimport.support;

import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.dataformat.univocity.UniVocityCsvDataFormat;
import org.springframework.stereotype.Component;

/**
 * Builds univocity parsers for menu CSV uploads from Camel's CSV data format defaults. Headers are
 * read as an ordinary first row. Rows wider than the column limit fail to parse.
 */
@Slf4j
@Component
public class CamelCsvParserFactory extends UniVocityCsvDataFormat {

    /** Unbounded; menu notes and descriptions have no fixed length. */
    private static final int MAX_CHARS_PER_COLUMN = -1;
    private static final int MAX_COLUMNS = 512;

    public CamelCsvParserFactory() {
        setHeaderExtractionEnabled(false);
        setSkipEmptyLines(true);
        setIgnoreLeadingWhitespaces(true);
        setIgnoreTrailingWhitespaces(true);
        setLineSeparator("\n");
        setLazyLoad(false);
        setAsMap(false);
    }

    public CsvParser newParser(char delimiter) {
        CsvParserSettings settings = createParserSettings();
        configureParserSettings(settings);
        settings.setColumnReorderingEnabled(false);
        settings.setMaxCharsPerColumn(MAX_CHARS_PER_COLUMN);
        settings.setMaxColumns(MAX_COLUMNS);
        settings.setNullValue("");
        settings.setEmptyValue("");
        settings.getFormat().setDelimiter(delimiter);
        settings.getFormat().setLineSeparator("\n");
        settings.getFormat().setComment('\0');
        log.debug("Created CsvParser delimiter='{}' maxColumns={}",
                delimiter == '\t' ? "\\t" : String.valueOf(delimiter), settings.getMaxColumns());
        return createParser(settings);
    }
}
