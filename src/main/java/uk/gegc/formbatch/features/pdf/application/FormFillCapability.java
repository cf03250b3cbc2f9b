package uk.gegc.formbatch.features.pdf.application;

import uk.gegc.formbatch.features.pdf.domain.exception.FormFillException;

import java.util.Map;

/**
 * Fills a PDF form template. Implementations must not modify {@code template}.
 */
public interface FormFillCapability {

    /**
     * @param values field name to cleaned value; only names that exist in the template are filled
     * @return the filled document
     * @throws FormFillException when the template cannot be read or none of the names matches a field
     */
    byte[] fill(byte[] template, Map<String, String> values) throws FormFillException;
}
