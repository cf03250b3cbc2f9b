package uk.gegc.formbatch.features.packaging.domain.model;

public record ZipArtifact(String ref, String fileName, long sizeBytes, int entryCount) {
}
