package uk.gegc.formbatch.features.pdf.infra;

import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationWidget;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDTextField;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.formbatch.features.pdf.domain.exception.FormFillException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PdfBoxFormFillCapability")
class PdfBoxFormFillCapabilityTest {

    private static byte[] formTemplate;
    private static byte[] plainTemplate;

    private final PdfBoxFormFillCapability capability = new PdfBoxFormFillCapability();

    @BeforeAll
    static void createTemplates() throws IOException {
        formTemplate = createForm("Name", "City");
        plainTemplate = createPlainPdf();
    }

    private static byte[] createForm(String... fieldNames) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);

            PDAcroForm form = new PDAcroForm(document);
            document.getDocumentCatalog().setAcroForm(form);

            PDResources resources = new PDResources();
            resources.put(COSName.getPDFName("Helv"), PDType1Font.HELVETICA);
            form.setDefaultResources(resources);
            form.setDefaultAppearance("/Helv 0 Tf 0 g");

            float y = 700;
            for (String fieldName : fieldNames) {
                PDTextField field = new PDTextField(form);
                field.setPartialName(fieldName);
                field.setDefaultAppearance("/Helv 12 Tf 0 g");
                form.getFields().add(field);

                PDAnnotationWidget widget = field.getWidgets().get(0);
                widget.setRectangle(new PDRectangle(50, y, 200, 20));
                widget.setPage(page);
                page.getAnnotations().add(widget);
                y -= 40;
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }

    private static byte[] createPlainPdf() throws IOException {
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage());
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }

    @Test
    @DisplayName("sets matching fields and ignores unknown columns")
    void fillsMatchingFields() throws Exception {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("Name", "Alice Smith");
        values.put("Unknown", "ignored");

        byte[] filled = capability.fill(formTemplate, values);

        try (PDDocument document = PDDocument.load(filled)) {
            PDAcroForm form = document.getDocumentCatalog().getAcroForm();
            assertThat(form.getField("Name").getValueAsString()).isEqualTo("Alice Smith");
            assertThat(form.getField("City").getValueAsString()).isEmpty();
        }
    }

    @Test
    @DisplayName("leaves the shared template bytes untouched")
    void templateUnchanged() throws Exception {
        byte[] copy = formTemplate.clone();

        capability.fill(formTemplate, Map.of("City", "Leeds"));

        assertThat(formTemplate).isEqualTo(copy);
    }

    @Test
    @DisplayName("fails when no column matches a field")
    void noMatchingFields() {
        assertThatThrownBy(() -> capability.fill(formTemplate, Map.of("Other", "x")))
                .isInstanceOf(FormFillException.class)
                .hasMessage("No matching fields were found in the PDF");
    }

    @Test
    @DisplayName("fails when the template has no form")
    void noAcroForm() {
        assertThatThrownBy(() -> capability.fill(plainTemplate, Map.of("Name", "x")))
                .isInstanceOf(FormFillException.class)
                .hasMessage("Template has no fillable form fields");
    }

    @Test
    @DisplayName("fails on bytes that are not a PDF")
    void notAPdf() {
        assertThatThrownBy(() -> capability.fill("not a pdf".getBytes(), Map.of("Name", "x")))
                .isInstanceOf(FormFillException.class)
                .hasMessageStartingWith("Failed to fill PDF template");
    }
}
