package uk.gegc.formbatch.features.pdf.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One CSV data row keyed by header, in header order.
 *
 * @param rowIndex 0-based position among data rows (the header is not counted)
 */
public record CsvRow(int rowIndex, Map<String, String> values) {

    public CsvRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String get(String column) {
        return values.get(column);
    }
}
