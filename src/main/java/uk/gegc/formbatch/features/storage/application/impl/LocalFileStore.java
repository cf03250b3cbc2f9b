package uk.gegc.formbatch.features.storage.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import uk.gegc.formbatch.features.storage.application.FileStore;
import uk.gegc.formbatch.features.storage.application.StorageProperties;
import uk.gegc.formbatch.features.storage.domain.exception.StorageException;
import uk.gegc.formbatch.shared.exception.ResourceNotFoundException;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * {@link FileStore} on the local filesystem. References are generated file names inside the
 * configured root directory; anything that would resolve outside it is rejected.
 */
@Service
@Slf4j
public class LocalFileStore implements FileStore {

    private static final Pattern REF_PATTERN = Pattern.compile("[0-9a-f\\-]{36}(\\.[a-z0-9]{1,10})?");

    private final Path rootDir;

    public LocalFileStore(StorageProperties storageProperties) {
        this.rootDir = Paths.get(storageProperties.getRootDir()).toAbsolutePath().normalize();
    }

    @Override
    public String store(byte[] content, String fileName) {
        if (content == null) {
            throw new IllegalArgumentException("content is required");
        }
        return storeFrom(fileName, out -> out.write(content));
    }

    @Override
    public String storeFrom(String fileName, ContentWriter writer) {
        String extension = fileName != null ? FilenameUtils.getExtension(fileName).toLowerCase(Locale.ROOT) : "";
        String ref = UUID.randomUUID() + (extension.matches("[a-z0-9]{1,10}") ? "." + extension : "");
        Path tmp = rootDir.resolve(ref + ".tmp");
        Path target = rootDir.resolve(ref);
        try {
            Files.createDirectories(rootDir);
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp, StandardOpenOption.CREATE_NEW))) {
                writer.writeTo(out);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            safeDelete(tmp);
            throw new StorageException("Failed to store " + fileName + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            safeDelete(tmp);
            throw e;
        }
        log.debug("Stored {} as {}", fileName, ref);
        return ref;
    }

    @Override
    public byte[] read(String ref) {
        Path path = resolve(ref);
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new ResourceNotFoundException("Stored file not found: " + ref);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + ref + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String ref) {
        Path path = resolve(ref);
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new StorageException("Failed to delete " + ref + ": " + e.getMessage(), e);
        }
    }

    @Override
    public long size(String ref) {
        Path path = resolve(ref);
        try {
            return Files.size(path);
        } catch (NoSuchFileException e) {
            throw new ResourceNotFoundException("Stored file not found: " + ref);
        } catch (IOException e) {
            throw new StorageException("Failed to stat " + ref + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(String ref) {
        return Files.isRegularFile(resolve(ref));
    }

    private Path resolve(String ref) {
        if (ref == null || !REF_PATTERN.matcher(ref).matches()) {
            throw new IllegalArgumentException("Invalid file reference: " + ref);
        }
        Path path = rootDir.resolve(ref).normalize();
        if (!path.startsWith(rootDir)) {
            throw new IllegalArgumentException("Invalid file reference: " + ref);
        }
        return path;
    }

    private void safeDelete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", path, e.getMessage());
        }
    }
}
