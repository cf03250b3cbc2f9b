package uk.gegc.formbatch.features.packaging.domain.model;

/**
 * A stored per-row artifact to put into the output archive under {@code fileName}.
 */
public record PackageItem(String fileName, String ref) {
}
