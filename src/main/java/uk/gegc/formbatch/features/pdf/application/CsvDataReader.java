package uk.gegc.formbatch.features.pdf.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.formbatch.features.pdf.domain.exception.CsvFormatException;
import uk.gegc.formbatch.features.pdf.domain.model.CsvData;
import uk.gegc.formbatch.features.pdf.domain.model.CsvRow;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a UTF-8 CSV with a header line into rows keyed by column name.
 *
 * <p>Quoted fields may contain commas, line breaks and doubled quotes. A leading byte order
 * mark is dropped from the header. Blank lines are skipped; short rows are padded with empty
 * values and cells past the last header are ignored.
 */
@Component
@Slf4j
public class CsvDataReader {

    private static final char BOM = '\uFEFF';

    public CsvData read(byte[] content) {
        if (content == null || content.length == 0) {
            throw new CsvFormatException("CSV file is empty");
        }
        String text = new String(content, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }

        List<List<String>> records = parseRecords(text);
        if (records.isEmpty()) {
            throw new CsvFormatException("CSV file has no header row");
        }

        List<String> headers = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String raw : records.get(0)) {
            String header = raw.replace(String.valueOf(BOM), "").trim();
            if (!header.isEmpty() && !seen.add(header)) {
                throw new CsvFormatException("Duplicate column in CSV header: " + header);
            }
            headers.add(header);
        }
        if (headers.stream().allMatch(String::isEmpty)) {
            throw new CsvFormatException("CSV header has no column names");
        }

        List<CsvRow> rows = new ArrayList<>();
        for (int i = 1; i < records.size(); i++) {
            List<String> cells = records.get(i);
            if (cells.size() > headers.size()) {
                log.debug("CSV data row {} has {} cells for {} columns; extra cells ignored",
                        rows.size(), cells.size(), headers.size());
            }
            Map<String, String> values = new LinkedHashMap<>();
            for (int c = 0; c < headers.size(); c++) {
                String header = headers.get(c);
                if (header.isEmpty()) {
                    continue;
                }
                values.put(header, c < cells.size() ? cells.get(c) : "");
            }
            rows.add(new CsvRow(rows.size(), values));
        }
        return new CsvData(headers.stream().filter(h -> !h.isEmpty()).toList(), rows);
    }

    private List<List<String>> parseRecords(String text) {
        List<List<String>> records = new ArrayList<>();
        List<String> current = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean fieldStarted = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    field.append(c);
                }
                continue;
            }
            switch (c) {
                case '"' -> {
                    inQuotes = true;
                    fieldStarted = true;
                }
                case ',' -> {
                    current.add(field.toString());
                    field.setLength(0);
                    fieldStarted = true;
                }
                case '\r' -> {
                    // handled with the following \n, or as a bare line end
                    if (i + 1 >= text.length() || text.charAt(i + 1) != '\n') {
                        endRecord(records, current, field, fieldStarted);
                        current = new ArrayList<>();
                        fieldStarted = false;
                    }
                }
                case '\n' -> {
                    endRecord(records, current, field, fieldStarted);
                    current = new ArrayList<>();
                    fieldStarted = false;
                }
                default -> {
                    field.append(c);
                    fieldStarted = true;
                }
            }
        }
        if (inQuotes) {
            throw new CsvFormatException("Unterminated quoted field at end of CSV");
        }
        endRecord(records, current, field, fieldStarted);
        return records;
    }

    private static void endRecord(List<List<String>> records, List<String> current,
                                  StringBuilder field, boolean fieldStarted) {
        if (!fieldStarted && current.isEmpty() && field.length() == 0) {
            return;
        }
        current.add(field.toString());
        field.setLength(0);
        if (current.stream().allMatch(String::isBlank)) {
            return;
        }
        records.add(current);
    }
}
