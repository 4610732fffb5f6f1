package com.jreinhal.annotator.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.jreinhal.annotator.TestFixtures;
import com.jreinhal.annotator.model.AnnotationRecord;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InterchangeExporterTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-02T13:14:15Z"), ZoneOffset.UTC);

    private final InterchangeCodec codec = new InterchangeCodec(TestFixtures.objectMapper(), TestFixtures.schema());

    @TempDir
    Path tempDir;

    @Test
    void writesTimestampedFileWithFilteredRecords() throws IOException {
        InterchangeExporter exporter = new InterchangeExporter(codec, tempDir.resolve("exports"), CLOCK);
        AnnotationRecord done = new AnnotationRecord("a", "alice", true, 1, Map.of(), Map.of(), TestFixtures.T0, TestFixtures.T0);
        AnnotationRecord open = TestFixtures.record("b", "alice");
        AnnotationRecord other = new AnnotationRecord("c", "bob", true, 1, Map.of(), Map.of(), TestFixtures.T0, TestFixtures.T0);

        Path file = exporter.export(List.of(done, open, other), new ExportFilter("alice", true));

        assertThat(file.getFileName().toString()).isEqualTo("export_20240602_131415.jsonl");
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(1);
        assertThat(lines.get(0)).startsWith("{\"a\":");
    }

    @Test
    void exportDirectoryBlockedByFileIsAnIoError() throws IOException {
        Path blocker = tempDir.resolve("blocked");
        Files.writeString(blocker, "not a directory");
        InterchangeExporter exporter = new InterchangeExporter(codec, blocker.resolve("exports"), CLOCK);

        assertThatThrownBy(() -> exporter.export(List.of(), ExportFilter.all()))
            .isInstanceOf(ExportFailedException.class)
            .satisfies(e -> assertThat(((ExportFailedException) e).getReason()).isEqualTo(ExportFailedException.Reason.IO_ERROR));
    }

    @Test
    void readOnlyExportDirectoryIsPermissionDenied() throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path readOnly = Files.createDirectory(tempDir.resolve("read-only"));
        Files.setPosixFilePermissions(readOnly, PosixFilePermissions.fromString("r-xr-xr-x"));
        try {
            // root ignores directory permissions
            assumeFalse(Files.isWritable(readOnly));
            InterchangeExporter exporter = new InterchangeExporter(codec, readOnly, CLOCK);

            assertThatThrownBy(() -> exporter.export(List.of(TestFixtures.record("a")), ExportFilter.all()))
                .isInstanceOf(ExportFailedException.class)
                .satisfies(e -> assertThat(((ExportFailedException) e).getReason())
                    .isEqualTo(ExportFailedException.Reason.PERMISSION_DENIED));
            assertThat(readOnly).isEmptyDirectory();
        } finally {
            Files.setPosixFilePermissions(readOnly, PosixFilePermissions.fromString("rwxr-xr-x"));
        }
    }
}
