package uk.gegc.formbatch.features.packaging.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import uk.gegc.formbatch.features.packaging.application.OutputPackager;
import uk.gegc.formbatch.features.packaging.domain.exception.PackagingException;
import uk.gegc.formbatch.features.packaging.domain.model.PackageItem;
import uk.gegc.formbatch.features.packaging.domain.model.ZipArtifact;
import uk.gegc.formbatch.features.storage.application.FileStore;
import uk.gegc.formbatch.shared.util.FileSizeFormatter;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

@Service
@RequiredArgsConstructor
@Slf4j
public class ZipOutputPackager implements OutputPackager {

    private static final DateTimeFormatter DATE_PART = DateTimeFormatter.ofPattern("ddMMyyyy");
    private static final DateTimeFormatter TIME_PART = DateTimeFormatter.ofPattern("HHmmss");
    private static final int MAX_STEM_LENGTH = 20;

    private final FileStore fileStore;
    private final Clock clock;

    @Override
    public ZipArtifact pack(UUID jobId, String templateFileName, List<PackageItem> items) {
        if (items == null || items.isEmpty()) {
            throw new PackagingException("Nothing to package for job " + jobId);
        }

        String archiveName = archiveName(templateFileName);
        String ref;
        long sizeBytes;
        try {
            // Entries are streamed into the store one item at a time
            ref = fileStore.storeFrom(archiveName, out -> {
                try (var zos = new ZipOutputStream(out)) {
                    Set<String> usedNames = new HashSet<>();
                    for (PackageItem item : items) {
                        zos.putNextEntry(new ZipEntry(uniqueEntryName(item.fileName(), usedNames)));
                        zos.write(fileStore.read(item.ref()));
                        zos.closeEntry();
                    }
                }
            });
            sizeBytes = fileStore.size(ref);
        } catch (RuntimeException e) {
            throw new PackagingException("Failed to build archive for job " + jobId + ": " + e.getMessage(), e);
        }

        for (PackageItem item : items) {
            try {
                fileStore.delete(item.ref());
            } catch (RuntimeException e) {
                log.warn("Could not remove packaged artifact {} for job {}: {}", item.ref(), jobId, e.getMessage());
            }
        }

        log.info("Packaged {} files for job {} into {} ({})",
                items.size(), jobId, archiveName, FileSizeFormatter.format(sizeBytes));
        return new ZipArtifact(ref, archiveName, sizeBytes, items.size());
    }

    @Override
    public String archiveName(String templateFileName) {
        LocalDateTime now = LocalDateTime.now(clock);
        String suffix = "PDFs_" + now.format(DATE_PART) + "_" + now.format(TIME_PART) + ".zip";
        String stem = cleanStem(templateFileName);
        return stem.isEmpty() ? suffix : stem + "_" + suffix;
    }

    private static String cleanStem(String templateFileName) {
        if (templateFileName == null) {
            return "";
        }
        String baseName = FilenameUtils.getBaseName(templateFileName);
        StringBuilder clean = new StringBuilder();
        for (char c : baseName.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == '_' || c == '-') {
                clean.append(c);
            }
        }
        return clean.length() > MAX_STEM_LENGTH ? clean.substring(0, MAX_STEM_LENGTH) : clean.toString();
    }

    private static String uniqueEntryName(String fileName, Set<String> usedNames) {
        String candidate = fileName;
        int counter = 2;
        while (!usedNames.add(candidate.toLowerCase(Locale.ROOT))) {
            String extension = FilenameUtils.getExtension(fileName);
            candidate = FilenameUtils.getBaseName(fileName) + "_" + counter++
                    + (extension.isEmpty() ? "" : "." + extension);
        }
        return candidate;
    }
}
