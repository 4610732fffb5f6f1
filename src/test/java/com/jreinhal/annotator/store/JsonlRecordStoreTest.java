package com.jreinhal.annotator.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jreinhal.annotator.TestFixtures;
import com.jreinhal.annotator.model.AnnotationRecord;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonlRecordStoreTest {

    @TempDir
    Path tempDir;

    private InterchangeCodec codec;
    private Path file;
    private JsonlRecordStore store;

    @BeforeEach
    void setUp() throws IOException {
        codec = new InterchangeCodec(TestFixtures.objectMapper(), TestFixtures.schema());
        file = tempDir.resolve("records.jsonl");
        Files.writeString(file, String.join("\n",
            "{\"r1\": {\"category\": \"chair\", \"mass\": \"4\"}}",
            "{\"r2\": {\"uid\": \"bob\", \"category\": \"lamp\"}}",
            "{\"r3\": {\"category\": \"desk\"}}"), StandardCharsets.UTF_8);
        InterchangeExporter exporter = new InterchangeExporter(codec, tempDir.resolve("exports").toString());
        store = new JsonlRecordStore(file, codec, exporter,
            Clock.fixed(Instant.parse("2024-06-02T13:14:15.123Z"), ZoneOffset.UTC));
    }

    @Test
    void loadsFileInOrder() {
        assertThat(store.loadAll().keySet()).containsExactly("r1", "r2", "r3");
        assertThat(store.get("r2")).map(AnnotationRecord::owner).contains("bob");
    }

    @Test
    void missingFileIsCreatedEmpty() {
        Path fresh = tempDir.resolve("nested/new.jsonl");
        JsonlRecordStore empty = new JsonlRecordStore(fresh, codec, null);

        assertThat(empty.loadAll()).isEmpty();
        assertTrue(Files.exists(fresh));
    }

    @Test
    void claimRewritesFileAndKeepsBackup() throws IOException {
        assertTrue(store.claim("r1", "alice"));

        assertThat(Files.readString(file)).contains("\"uid\":\"alice\"");
        Path backup = tempDir.resolve("backups/backup_20240602_131415_123.jsonl");
        assertTrue(Files.exists(backup));
        assertThat(Files.readString(backup)).doesNotContain("alice");
    }

    @Test
    void claimHonoursExistingOwner() {
        assertFalse(store.claim("r2", "alice"));
        assertTrue(store.claim("r2", "bob"));
        assertFalse(store.claim("missing", "alice"));
    }

    @Test
    void saveMergesFieldsAndSurvivesReload() {
        store.claim("r1", "alice");

        SaveResult result = store.save("r1", Map.of("mass", "5"), Map.of("mass", true), 0, "alice");
        store.reload();

        assertTrue(result.isSuccess());
        AnnotationRecord saved = store.get("r1").orElseThrow();
        assertTrue(saved.completed());
        assertEquals(0, saved.qualityScore());
        assertThat(saved.fields()).containsEntry("mass", "5").containsEntry("category", "chair");
    }

    @Test
    void saveConflictsForOtherOwnerAndMissesDeletedRecord() {
        assertEquals(SaveResult.Status.CONFLICT, store.save("r2", Map.of(), Map.of(), 1, "alice").status());

        assertTrue(store.delete("r3"));
        assertEquals(SaveResult.Status.NOT_FOUND, store.save("r3", Map.of(), Map.of(), 1, "alice").status());
    }

    @Test
    void failedWriteLeavesMemoryUntouched() throws IOException {
        store.loadAll();
        Path blocked = tempDir.resolve("backups");
        Files.writeString(blocked, "a file where the backup directory should be");

        SaveResult result = store.save("r1", Map.of("mass", "9"), Map.of(), 1, "alice");

        assertEquals(SaveResult.Status.IO_ERROR, result.status());
        assertThat(store.get("r1").orElseThrow().fields()).containsEntry("mass", "4");
        assertFalse(store.get("r1").orElseThrow().completed());
    }

    @Test
    void statisticsAndPaging() {
        store.save("r1", Map.of(), Map.of(), 1, "");

        assertEquals(1, store.statistics().annotated());
        assertEquals(2, store.statistics().pending());
        RecordPage page = store.loadPage(2, 2);
        assertThat(page.records()).extracting(AnnotationRecord::id).containsExactly("r3");
        assertFalse(page.hasMore());
    }

    @Test
    void noTempFilesAreLeftBehind() throws IOException {
        store.claim("r1", "alice");
        store.claim("r3", "alice");

        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString()).filter(n -> n.endsWith(".tmp"))).isEmpty();
        }
        assertThat(codec.read(file)).extracting(AnnotationRecord::owner).containsExactly("alice", "bob", "alice");
    }

    @Test
    void importAppendsNewRecords() {
        int written = store.importRecords(List.of(TestFixtures.record("r4"), TestFixtures.record("r1", "zed")), false);

        assertEquals(1, written);
        assertThat(store.loadAll().keySet()).containsExactly("r1", "r2", "r3", "r4");
    }

    @Test
    void sameMillisecondRewritesKeepEveryBackup() throws IOException {
        store.claim("r1", "alice");
        store.claim("r3", "alice");

        Path first = tempDir.resolve("backups/backup_20240602_131415_123.jsonl");
        Path second = tempDir.resolve("backups/backup_20240602_131415_123_1.jsonl");
        assertThat(Files.readString(first)).doesNotContain("alice");
        assertThat(codec.read(second)).extracting(AnnotationRecord::owner).containsExactly("alice", "bob", "");
    }

    @Test
    void malformedFileIsReportedAsUnavailable() throws IOException {
        Path broken = tempDir.resolve("broken.jsonl");
        Files.writeString(broken, "{\"r1\": {}}\nnot json", StandardCharsets.UTF_8);
        JsonlRecordStore brokenStore = new JsonlRecordStore(broken, codec, null);

        assertThatThrownBy(brokenStore::loadAll)
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessageContaining("Line 2");

        SaveResult result = brokenStore.save("r1", Map.of("mass", "5"), Map.of(), 1, "alice");
        assertEquals(SaveResult.Status.IO_ERROR, result.status());
        assertThat(result.message()).contains("malformed");
    }

    @Test
    void concurrentClaimsHaveExactlyOneWinner() throws Exception {
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < contenders; i++) {
            String user = "user" + i;
            results.add(pool.submit(() -> {
                start.await();
                return store.claim("r1", user);
            }));
        }
        start.countDown();
        List<String> winners = new ArrayList<>();
        for (int i = 0; i < contenders; i++) {
            if (results.get(i).get(30, TimeUnit.SECONDS)) {
                winners.add("user" + i);
            }
        }
        pool.shutdownNow();

        assertThat(winners).hasSize(1);
        assertThat(store.get("r1").orElseThrow().owner()).isEqualTo(winners.get(0));
        store.reload();
        assertThat(store.get("r1").orElseThrow().owner()).isEqualTo(winners.get(0));
    }
}
