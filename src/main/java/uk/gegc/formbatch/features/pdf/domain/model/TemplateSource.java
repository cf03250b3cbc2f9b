package uk.gegc.formbatch.features.pdf.domain.model;

/**
 * The template PDF a batch fills, loaded once per job and shared read-only across rows.
 */
public record TemplateSource(String ref, String fileName, byte[] content) {
}
