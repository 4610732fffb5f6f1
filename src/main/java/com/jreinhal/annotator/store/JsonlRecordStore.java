package com.jreinhal.annotator.store;

import com.jreinhal.annotator.model.AnnotationRecord;
import com.jreinhal.annotator.model.RecordStatistics;
import com.jreinhal.annotator.util.LogSanitizer;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-backed store for development and small task sets.
 *
 * <p>The whole file is held in memory after the first load. Every mutation copies the current
 * file to {@code backups/backup_<stamp>.jsonl}, writes the new content to a temp file and moves
 * it over the original. One {@link ReentrantLock} serializes all reads of mutable state and all
 * writes; nothing outside this process may write the file.</p>
 */
public class JsonlRecordStore implements RecordStore {
    private static final Logger log = LoggerFactory.getLogger(JsonlRecordStore.class);
    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    static final String BACKUP_DIRECTORY = "backups";

    private final Path file;
    private final InterchangeCodec codec;
    private final InterchangeExporter exporter;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private Map<String, AnnotationRecord> records;

    public JsonlRecordStore(Path file, InterchangeCodec codec, InterchangeExporter exporter) {
        this(file, codec, exporter, Clock.systemDefaultZone());
    }

    JsonlRecordStore(Path file, InterchangeCodec codec, InterchangeExporter exporter, Clock clock) {
        this.file = file;
        this.codec = codec;
        this.exporter = exporter;
        this.clock = clock;
    }

    @Override
    public Map<String, AnnotationRecord> loadAll() {
        lock.lock();
        try {
            return new LinkedHashMap<>(records());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<AnnotationRecord> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(records().get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SaveResult save(String id, Map<String, Object> fields, Map<String, Boolean> flags, int score, String owner) {
        if (id == null || id.isBlank()) {
            return SaveResult.notFound(String.valueOf(id));
        }
        lock.lock();
        try {
            Map<String, AnnotationRecord> current;
            try {
                current = records();
            } catch (StoreUnavailableException e) {
                log.error("Save of {} could not read {}", LogSanitizer.sanitize(id), file, e);
                return SaveResult.ioError(id, e.getMessage());
            }
            AnnotationRecord existing = current.get(id);
            if (existing == null) {
                return SaveResult.notFound(id);
            }
            String requested = owner == null || owner.isBlank() ? null : owner.trim();
            if (requested != null && existing.isClaimed() && !existing.isOwnedBy(requested)) {
                return SaveResult.conflict(id, "Record " + id + " is owned by another annotator");
            }
            Map<String, Object> mergedFields = new LinkedHashMap<>(existing.fields());
            if (fields != null) {
                mergedFields.putAll(fields);
            }
            Map<String, Boolean> mergedFlags = new LinkedHashMap<>(existing.flags());
            if (flags != null) {
                mergedFlags.putAll(flags);
            }
            int effectiveScore = AnnotationRecord.scoreFor(mergedFlags);
            if (effectiveScore != score) {
                log.warn("Score {} for {} disagrees with its flags; storing {}", score, LogSanitizer.sanitize(id), effectiveScore);
            }
            AnnotationRecord updated = new AnnotationRecord(id, requested != null ? requested : existing.owner(), true,
                effectiveScore, mergedFields, mergedFlags, existing.createdAt(), Instant.now(clock));
            try {
                persistWith(current, updated);
            } catch (IOException | RecordStoreException e) {
                log.error("Save of {} could not rewrite {}", LogSanitizer.sanitize(id), file, e);
                return SaveResult.ioError(id, "Could not write " + file.getFileName() + ": " + e.getMessage());
            }
            return SaveResult.saved(id);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean claim(String id, String user) {
        if (id == null || id.isBlank() || user == null || user.isBlank()) {
            return false;
        }
        lock.lock();
        try {
            Map<String, AnnotationRecord> current = records();
            AnnotationRecord existing = current.get(id);
            if (existing == null) {
                return false;
            }
            if (existing.isOwnedBy(user)) {
                return true;
            }
            if (existing.isClaimed()) {
                return false;
            }
            try {
                persistWith(current, existing.withOwner(user, Instant.now(clock)));
            } catch (IOException e) {
                throw new StoreUnavailableException("Claim of record " + id + " could not be written", e);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Path export(ExportFilter filter) {
        return exporter.export(loadAll().values(), filter == null ? ExportFilter.all() : filter);
    }

    @Override
    public RecordStatistics statistics() {
        lock.lock();
        try {
            Collection<AnnotationRecord> all = records().values();
            long annotated = all.stream().filter(AnnotationRecord::completed).count();
            return RecordStatistics.of(all.size(), annotated);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RecordPage loadPage(int page, int size) {
        if (page < 1 || size < 1) {
            throw new IllegalArgumentException("Page and size must be positive");
        }
        lock.lock();
        try {
            List<AnnotationRecord> all = new ArrayList<>(records().values());
            int from = (int) Math.min((long) (page - 1) * size, all.size());
            int to = Math.min(from + size, all.size());
            return new RecordPage(List.copyOf(all.subList(from, to)), page, size, all.size(), to < all.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int importRecords(Collection<AnnotationRecord> incoming, boolean replaceExisting) {
        lock.lock();
        try {
            Map<String, AnnotationRecord> next = new LinkedHashMap<>(records());
            int count = 0;
            for (AnnotationRecord record : incoming) {
                if (next.containsKey(record.id()) && !replaceExisting) {
                    continue;
                }
                next.put(record.id(), record);
                count++;
            }
            if (count > 0) {
                try {
                    rewrite(next);
                } catch (IOException e) {
                    throw new StoreUnavailableException("Import into " + file + " failed", e);
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String id) {
        lock.lock();
        try {
            if (id == null || !records().containsKey(id)) {
                return false;
            }
            Map<String, AnnotationRecord> next = new LinkedHashMap<>(records());
            next.remove(id);
            try {
                rewrite(next);
            } catch (IOException e) {
                throw new StoreUnavailableException("Delete of record " + id + " could not be written", e);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the in-memory copy so the next access re-reads the file.
     */
    public void reload() {
        lock.lock();
        try {
            records = null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String describe() {
        return "jsonl:" + file;
    }

    private Map<String, AnnotationRecord> records() {
        if (records == null) {
            records = readFile();
        }
        return records;
    }

    private Map<String, AnnotationRecord> readFile() {
        try {
            if (Files.notExists(file)) {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.createFile(file);
                log.info("Created empty record file {}", file);
            }
            Map<String, AnnotationRecord> loaded = new LinkedHashMap<>();
            for (AnnotationRecord record : codec.read(file)) {
                loaded.put(record.id(), record);
            }
            if (log.isInfoEnabled()) {
                log.info("Loaded {} records from {}", loaded.size(), file);
            }
            return loaded;
        } catch (IOException e) {
            throw new StoreUnavailableException("Record file " + file + " could not be read", e);
        } catch (InterchangeFormatException e) {
            throw new StoreUnavailableException("Record file " + file + " is malformed: " + e.getMessage(), e);
        }
    }

    private void persistWith(Map<String, AnnotationRecord> current, AnnotationRecord updated) throws IOException {
        Map<String, AnnotationRecord> next = new LinkedHashMap<>(current);
        next.put(updated.id(), updated);
        rewrite(next);
    }

    // memory only changes once the new file is in place
    private void rewrite(Map<String, AnnotationRecord> next) throws IOException {
        Path directory = file.toAbsolutePath().getParent();
        backup(directory);
        Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
        try {
            codec.write(temp, next.values(), false);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        records = next;
    }

    private void backup(Path directory) throws IOException {
        if (Files.notExists(file) || Files.size(file) == 0) {
            return;
        }
        Path backups = directory.resolve(BACKUP_DIRECTORY);
        Files.createDirectories(backups);
        String stamp = "backup_" + LocalDateTime.now(clock).format(BACKUP_STAMP);
        Path target = backups.resolve(stamp + ".jsonl");
        // same-millisecond rewrites get a numeric suffix
        for (int suffix = 1; ; suffix++) {
            try {
                Files.copy(file, target);
                break;
            } catch (FileAlreadyExistsException e) {
                target = backups.resolve(stamp + "_" + suffix + ".jsonl");
            }
        }
        log.debug("Backed up {} to {}", file, target);
    }
}
