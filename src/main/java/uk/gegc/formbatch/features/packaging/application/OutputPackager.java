package uk.gegc.formbatch.features.packaging.application;

import uk.gegc.formbatch.features.packaging.domain.model.PackageItem;
import uk.gegc.formbatch.features.packaging.domain.model.ZipArtifact;

import java.util.List;
import java.util.UUID;

public interface OutputPackager {

    /**
     * Zips the items in the given order into one stored archive and deletes the items.
     *
     * @throws uk.gegc.formbatch.features.packaging.domain.exception.PackagingException
     *         when the archive cannot be built or stored; the items are left in place
     */
    ZipArtifact pack(UUID jobId, String templateFileName, List<PackageItem> items);

    /**
     * Archive name for a template, e.g. {@code Invoice_PDFs_27092025_143022.zip}.
     */
    String archiveName(String templateFileName);
}
