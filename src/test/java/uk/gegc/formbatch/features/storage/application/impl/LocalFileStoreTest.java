package uk.gegc.formbatch.features.storage.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.formbatch.features.storage.application.StorageProperties;
import uk.gegc.formbatch.features.storage.domain.exception.StorageException;
import uk.gegc.formbatch.shared.exception.ResourceNotFoundException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LocalFileStore")
class LocalFileStoreTest {

    @TempDir
    Path root;

    private LocalFileStore store;

    @BeforeEach
    void setUp() {
        StorageProperties properties = new StorageProperties();
        properties.setRootDir(root.toString());
        store = new LocalFileStore(properties);
    }

    @Test
    @DisplayName("stores bytes under a generated reference keeping the extension")
    void storesAndReads() {
        String ref = store.store(new byte[]{1, 2, 3}, "Invoice.PDF");

        assertThat(ref).endsWith(".pdf");
        assertThat(store.read(ref)).containsExactly(1, 2, 3);
        assertThat(store.size(ref)).isEqualTo(3);
        assertThat(store.exists(ref)).isTrue();
        assertThat(Files.exists(root.resolve(ref))).isTrue();
    }

    @Test
    @DisplayName("two stores of the same name get different references")
    void uniqueRefs() {
        assertThat(store.store(new byte[]{1}, "a.pdf")).isNotEqualTo(store.store(new byte[]{1}, "a.pdf"));
    }

    @Test
    @DisplayName("leaves no temporary files behind")
    void noTempFiles() throws Exception {
        store.store(new byte[]{9}, "x.csv");

        try (var files = Files.list(root)) {
            assertThat(files.map(p -> p.getFileName().toString())).noneMatch(name -> name.endsWith(".tmp"));
        }
    }

    @Test
    @DisplayName("streams writer output into a new blob")
    void storesFromWriter() {
        String ref = store.storeFrom("Out.ZIP", out -> {
            for (int i = 0; i < 4; i++) {
                out.write(new byte[]{(byte) i, (byte) i});
            }
        });

        assertThat(ref).endsWith(".zip");
        assertThat(store.read(ref)).containsExactly(0, 0, 1, 1, 2, 2, 3, 3);
        assertThat(store.size(ref)).isEqualTo(8);
    }

    @Test
    @DisplayName("a failing writer leaves nothing in the store")
    void failedWriterLeavesNothing() throws Exception {
        assertThatThrownBy(() -> store.storeFrom("broken.zip", out -> {
            out.write(new byte[]{1, 2, 3});
            throw new IOException("source vanished");
        }))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("source vanished");
        assertThatThrownBy(() -> store.storeFrom("broken.zip", out -> {
            throw new IllegalStateException("bad item");
        }))
                .isInstanceOf(IllegalStateException.class);

        try (var files = Files.list(root)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    @DisplayName("delete removes the blob and ignores unknown references")
    void delete() {
        String ref = store.store(new byte[]{1}, "a.zip");

        store.delete(ref);

        assertThat(store.exists(ref)).isFalse();
        assertThatCode(() -> store.delete(ref)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("reading a missing blob is a not-found error")
    void missing() {
        assertThatThrownBy(() -> store.read("00000000-0000-0000-0000-000000000000.pdf"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("rejects references that could escape the root")
    void rejectsTraversal() {
        assertThatThrownBy(() -> store.read("../secret.txt")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.read("/etc/passwd")).isInstanceOf(IllegalArgumentException.class);
    }
}
