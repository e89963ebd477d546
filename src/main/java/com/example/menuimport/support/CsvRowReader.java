package com.example.menuimport.support;

import com.example.menuimport.model.CsvTable;
import com.example.menuimport.model.CsvUpload;
import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.csv.CsvParser;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decodes an uploaded CSV file into header-keyed rows for the import pipeline.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CsvRowReader {

    static final char[] CANDIDATE_DELIMITERS = { ',', ';', '\t', '|' };

    private static final String BYTE_ORDER_MARK = "\uFEFF";
    private static final String FIRST_COLUMN_FALLBACK = "Category";

    private final CamelCsvParserFactory parserFactory;
    private final UploadDecoder uploadDecoder;

    public CsvUpload read(InputStream upload, String filename) {
        UploadDecoder.Decoded decoded = uploadDecoder.decode(upload, filename);
        CsvTable table = parse(decoded.text());
        log.info("Decoded CSV file={} encoding={} columns={} rows={}",
                filename, decoded.encoding().wireName(), table.headers().size(), table.rows().size());
        return new CsvUpload(filename, decoded.encoding(), table);
    }

    public CsvTable parse(String content) {
        if (content == null) {
            return CsvTable.EMPTY;
        }
        String normalized = content.replace("\r\n", "\n").replace('\r', '\n');
        if (normalized.startsWith(BYTE_ORDER_MARK)) {
            normalized = normalized.substring(1);
        }
        String headerLine = firstNonBlankLine(normalized);
        if (headerLine == null) {
            return CsvTable.EMPTY;
        }

        CsvParser parser = parserFactory.newParser(detectDelimiter(headerLine));
        List<String[]> parsed;
        try {
            parsed = parser.parseAll(new StringReader(normalized));
        } catch (TextParsingException ex) {
            throw new ImportProcessingException(
                    "Malformed CSV at line %d: %s".formatted(ex.getLineIndex() + 1, firstLine(ex.getMessage())), ex);
        }
        if (parsed.isEmpty()) {
            return CsvTable.EMPTY;
        }

        List<String> headers = resolveHeaders(parsed.get(0));
        List<Map<String, String>> rows = new ArrayList<>(parsed.size() - 1);
        for (int i = 1; i < parsed.size(); i++) {
            rows.add(toRow(headers, parsed.get(i)));
        }
        return new CsvTable(List.copyOf(headers), Collections.unmodifiableList(rows));
    }

    /**
     * The candidate that splits the header line into the most columns; ties keep the earlier one.
     */
    static char detectDelimiter(String headerLine) {
        char best = CANDIDATE_DELIMITERS[0];
        int bestColumns = 0;
        for (char candidate : CANDIDATE_DELIMITERS) {
            int columns = countOccurrences(headerLine, candidate) + 1;
            if (columns > bestColumns) {
                bestColumns = columns;
                best = candidate;
            }
        }
        return best;
    }

    private static List<String> resolveHeaders(String[] rawHeaders) {
        List<String> headers = new ArrayList<>(rawHeaders.length);
        for (int i = 0; i < rawHeaders.length; i++) {
            String header = rawHeaders[i] == null ? "" : rawHeaders[i].trim();
            if (header.isEmpty()) {
                header = i == 0 ? FIRST_COLUMN_FALLBACK : "Column" + (i + 1);
            }
            headers.add(header);
        }
        return headers;
    }

    private static Map<String, String> toRow(List<String> headers, String[] cells) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String cell = cells != null && i < cells.length ? cells[i] : null;
            row.put(headers.get(i), cell == null ? "" : cell);
        }
        return row;
    }

    private static String firstNonBlankLine(String content) {
        for (String line : content.split("\n")) {
            if (!line.isBlank()) {
                return line;
            }
        }
        return null;
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unreadable content";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    private static int countOccurrences(String value, char target) {
        int count = 0;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == target) {
                count++;
            }
        }
        return count;
    }
}
