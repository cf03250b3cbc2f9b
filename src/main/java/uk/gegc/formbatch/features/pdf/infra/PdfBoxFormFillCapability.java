package uk.gegc.formbatch.features.pdf.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.springframework.stereotype.Component;
import uk.gegc.formbatch.features.pdf.application.FormFillCapability;
import uk.gegc.formbatch.features.pdf.domain.exception.FormFillException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * AcroForm filler using Apache PDFBox. Each call loads its own copy of the template.
 */
@Component
@Slf4j
public class PdfBoxFormFillCapability implements FormFillCapability {

    @Override
    public byte[] fill(byte[] template, Map<String, String> values) throws FormFillException {
        try (PDDocument document = PDDocument.load(template)) {
            PDAcroForm form = document.getDocumentCatalog().getAcroForm();
            if (form == null) {
                throw new FormFillException("Template has no fillable form fields");
            }

            int filled = 0;
            List<String> missing = new ArrayList<>();
            for (Map.Entry<String, String> entry : values.entrySet()) {
                PDField field = form.getField(entry.getKey());
                if (field == null) {
                    missing.add(entry.getKey());
                    continue;
                }
                try {
                    field.setValue(entry.getValue());
                } catch (IllegalArgumentException | UnsupportedOperationException e) {
                    throw new FormFillException("Could not set field " + entry.getKey() + ": " + e.getMessage(), e);
                }
                filled++;
            }

            if (filled == 0) {
                throw new FormFillException("No matching fields were found in the PDF");
            }
            if (!missing.isEmpty()) {
                log.debug("Could not find these fields in the template: {}", missing);
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            log.debug("Filled {} of {} fields ({} bytes)", filled, values.size(), out.size());
            return out.toByteArray();
        } catch (IOException e) {
            throw new FormFillException("Failed to fill PDF template: " + e.getMessage(), e);
        }
    }
}
