package com.jreinhal.annotator.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.jreinhal.annotator.TestFixtures;
import com.jreinhal.annotator.model.AnnotationRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecordImporterTest {

    @TempDir
    Path tempDir;

    private final InterchangeCodec codec = new InterchangeCodec(TestFixtures.objectMapper(), TestFixtures.schema());

    @Test
    void exportThenImportReproducesRecords() {
        InterchangeExporter exporter = new InterchangeExporter(codec, tempDir.resolve("exports").toString());
        JsonlRecordStore source = new JsonlRecordStore(tempDir.resolve("source.jsonl"), codec, exporter);
        source.importRecords(List.of(TestFixtures.record("a"), TestFixtures.record("b"), TestFixtures.record("c", "carol")), false);
        source.claim("a", "alice");
        source.save("a", Map.of("material", List.of("oak")), Map.of("material", true), 0, "alice");
        Path exported = source.export(ExportFilter.all());

        JsonlRecordStore target = new JsonlRecordStore(tempDir.resolve("target.jsonl"), codec, exporter);
        ImportSummary summary = new RecordImporter(codec, target).importFile(exported, false);

        assertEquals(new ImportSummary(3, 3), summary);
        Map<String, AnnotationRecord> before = source.loadAll();
        Map<String, AnnotationRecord> after = target.loadAll();
        assertThat(after.keySet()).containsExactlyElementsOf(before.keySet());
        for (AnnotationRecord original : before.values()) {
            AnnotationRecord copy = after.get(original.id());
            assertThat(copy.owner()).isEqualTo(original.owner());
            assertThat(copy.completed()).isEqualTo(original.completed());
            assertThat(copy.qualityScore()).isEqualTo(original.qualityScore());
            assertThat(copy.fields()).isEqualTo(original.fields());
            assertThat(copy.flags()).isEqualTo(original.flags());
        }
    }

    @Test
    void malformedFileWritesNothing() throws IOException {
        Path bad = tempDir.resolve("bad.jsonl");
        Files.writeString(bad, "{\"a\": {}}\n[1, 2]\n");
        RecordStore store = mock(RecordStore.class);

        assertThatThrownBy(() -> new RecordImporter(codec, store).importFile(bad, false))
            .isInstanceOf(InterchangeFormatException.class);
        verify(store, never()).importRecords(anyCollection(), anyBoolean());
    }

    @Test
    void missingFileIsRejected() {
        RecordStore store = mock(RecordStore.class);

        assertThatThrownBy(() -> new RecordImporter(codec, store).importFile(tempDir.resolve("none.jsonl"), true))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
