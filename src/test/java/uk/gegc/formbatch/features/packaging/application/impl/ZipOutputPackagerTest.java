package uk.gegc.formbatch.features.packaging.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.formbatch.features.packaging.domain.exception.PackagingException;
import uk.gegc.formbatch.features.packaging.domain.model.PackageItem;
import uk.gegc.formbatch.features.packaging.domain.model.ZipArtifact;
import uk.gegc.formbatch.features.storage.application.StorageProperties;
import uk.gegc.formbatch.features.storage.application.impl.LocalFileStore;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ZipOutputPackager")
class ZipOutputPackagerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-15T09:05:07Z"), ZoneId.of("UTC"));

    @TempDir
    Path root;

    private LocalFileStore fileStore;
    private ZipOutputPackager packager;

    @BeforeEach
    void setUp() {
        StorageProperties properties = new StorageProperties();
        properties.setRootDir(root.toString());
        fileStore = new LocalFileStore(properties);
        packager = new ZipOutputPackager(fileStore, CLOCK);
    }

    private static Map<String, byte[]> unzip(byte[] zip) throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip))) {
            ZipEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                entries.put(entry.getName(), in.readAllBytes());
            }
        }
        return entries;
    }

    @Test
    @DisplayName("archive name uses the cleaned template stem and the timestamp")
    void archiveName() {
        assertThat(packager.archiveName("Invoice Template (v2).pdf")).isEqualTo("InvoiceTemplatev2_PDFs_15012024_090507.zip");
        assertThat(packager.archiveName("a-very-long-template-name-for-testing.pdf"))
                .isEqualTo("a-very-long-template_PDFs_15012024_090507.zip");
        assertThat(packager.archiveName("().pdf")).isEqualTo("PDFs_15012024_090507.zip");
        assertThat(packager.archiveName(null)).isEqualTo("PDFs_15012024_090507.zip");
    }

    @Test
    @DisplayName("packs every item in order and removes the per-row files")
    void packsItems() throws IOException {
        List<PackageItem> items = new ArrayList<>();
        List<String> refs = new ArrayList<>();
        for (int i = 1; i <= 3; i++) {
            String ref = fileStore.store(("pdf-" + i).getBytes(), "doc" + i + ".pdf");
            refs.add(ref);
            items.add(new PackageItem("doc" + i + ".pdf", ref));
        }

        ZipArtifact artifact = packager.pack(UUID.randomUUID(), "Invoice.pdf", items);

        assertThat(artifact.fileName()).isEqualTo("Invoice_PDFs_15012024_090507.zip");
        assertThat(artifact.entryCount()).isEqualTo(3);
        byte[] zip = fileStore.read(artifact.ref());
        assertThat(artifact.sizeBytes()).isEqualTo(zip.length);
        Map<String, byte[]> entries = unzip(zip);
        assertThat(entries.keySet()).containsExactly("doc1.pdf", "doc2.pdf", "doc3.pdf");
        assertThat(entries.get("doc2.pdf")).isEqualTo("pdf-2".getBytes());
        assertThat(refs).noneMatch(fileStore::exists);
    }

    @Test
    @DisplayName("duplicate names are disambiguated case-insensitively")
    void deduplicatesNames() throws IOException {
        List<PackageItem> items = List.of(
                new PackageItem("report.pdf", fileStore.store(new byte[]{1}, "report.pdf")),
                new PackageItem("REPORT.pdf", fileStore.store(new byte[]{2}, "report.pdf")),
                new PackageItem("report.pdf", fileStore.store(new byte[]{3}, "report.pdf")));

        ZipArtifact artifact = packager.pack(UUID.randomUUID(), "t.pdf", items);

        assertThat(unzip(fileStore.read(artifact.ref())).keySet())
                .containsExactly("report.pdf", "REPORT_2.pdf", "report_3.pdf");
    }

    @Test
    @DisplayName("an unreadable item fails packaging")
    void missingItem() {
        List<PackageItem> items = List.of(new PackageItem("a.pdf", "00000000-0000-0000-0000-000000000000.pdf"));

        assertThatThrownBy(() -> packager.pack(UUID.randomUUID(), "t.pdf", items))
                .isInstanceOf(PackagingException.class);
    }

    @Test
    @DisplayName("a failure partway through keeps the items and stores no partial archive")
    void failureMidArchive() throws IOException {
        String first = fileStore.store(new byte[]{1}, "a.pdf");
        String second = fileStore.store(new byte[]{2}, "b.pdf");
        List<PackageItem> items = List.of(
                new PackageItem("a.pdf", first),
                new PackageItem("b.pdf", second),
                new PackageItem("c.pdf", "00000000-0000-0000-0000-000000000000.pdf"));

        assertThatThrownBy(() -> packager.pack(UUID.randomUUID(), "t.pdf", items))
                .isInstanceOf(PackagingException.class)
                .hasMessageContaining("Failed to build archive");

        try (var files = Files.list(root)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactlyInAnyOrder(first, second);
        }
    }

    @Test
    @DisplayName("nothing to pack is an error")
    void emptyItems() {
        assertThatThrownBy(() -> packager.pack(UUID.randomUUID(), "t.pdf", List.of()))
                .isInstanceOf(PackagingException.class);
    }
}
