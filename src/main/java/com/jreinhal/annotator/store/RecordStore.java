package com.jreinhal.annotator.store;

import com.jreinhal.annotator.model.AnnotationRecord;
import com.jreinhal.annotator.model.RecordStatistics;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence contract over the record table.
 *
 * <p>{@link #claim} and {@link #save} are linearizable per record id: implementations hold an
 * exclusive lock on the record for the duration of their check-and-set. The database backend
 * uses a row lock ({@code SELECT ... FOR UPDATE}); the file backend has no external writers
 * and serializes mutations with one in-process lock.</p>
 */
public interface RecordStore {

    /**
     * Full snapshot in the store's stable order.
     *
     * @throws StoreUnavailableException if the backing medium cannot be read
     */
    Map<String, AnnotationRecord> loadAll();

    Optional<AnnotationRecord> get(String id);

    /**
     * Persists fields, flags and score, stamps {@code updatedAt} and marks the record completed.
     * A non-blank {@code owner} is written only when the record is unclaimed or already theirs.
     */
    SaveResult save(String id, Map<String, Object> fields, Map<String, Boolean> flags, int score, String owner);

    /**
     * Atomic check-and-set of the owner. True iff the owner was empty or already {@code user}.
     */
    boolean claim(String id, String user);

    /**
     * Writes the filtered record set as an interchange file and returns its path.
     *
     * @throws ExportFailedException when the export target cannot be written
     */
    Path export(ExportFilter filter);

    RecordStatistics statistics();

    RecordPage loadPage(int page, int size);

    /**
     * Bulk load. Existing ids are skipped unless {@code replaceExisting} is set.
     *
     * @return number of records written
     */
    int importRecords(Collection<AnnotationRecord> records, boolean replaceExisting);

    boolean delete(String id);

    String describe();
}
