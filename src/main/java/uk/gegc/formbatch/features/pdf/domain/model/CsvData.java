package uk.gegc.formbatch.features.pdf.domain.model;

import java.util.List;

public record CsvData(List<String> headers, List<CsvRow> rows) {

    public CsvData {
        headers = List.copyOf(headers);
        rows = List.copyOf(rows);
    }

    public int rowCount() {
        return rows.size();
    }
}
