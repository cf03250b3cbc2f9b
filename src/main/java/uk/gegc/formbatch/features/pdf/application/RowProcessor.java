package uk.gegc.formbatch.features.pdf.application;

import uk.gegc.formbatch.features.pdf.domain.model.CsvRow;
import uk.gegc.formbatch.features.pdf.domain.model.RowResult;
import uk.gegc.formbatch.features.pdf.domain.model.TemplateSource;

/**
 * Turns one CSV row into one filled PDF in the file store. Failures are reported in the
 * result, never thrown.
 */
public interface RowProcessor {

    RowResult process(TemplateSource template, CsvRow row);
}
