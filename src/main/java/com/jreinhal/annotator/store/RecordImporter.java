package com.jreinhal.annotator.store;

import com.jreinhal.annotator.model.AnnotationRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Bulk-loads an interchange file into the active store.
 */
@Service
public class RecordImporter {
    private static final Logger log = LoggerFactory.getLogger(RecordImporter.class);

    private final InterchangeCodec codec;
    private final RecordStore recordStore;

    public RecordImporter(InterchangeCodec codec, RecordStore recordStore) {
        this.codec = codec;
        this.recordStore = recordStore;
    }

    /**
     * @throws InterchangeFormatException on the first malformed line; nothing is written then
     * @throws StoreUnavailableException  if the file cannot be read or the store rejects the batch
     */
    public ImportSummary importFile(Path source, boolean replaceExisting) {
        if (source == null || !Files.isRegularFile(source)) {
            throw new IllegalArgumentException("Import file not found: " + source);
        }
        List<AnnotationRecord> records;
        try {
            records = codec.read(source);
        } catch (IOException e) {
            throw new StoreUnavailableException("Import file " + source + " could not be read", e);
        }
        int imported = recordStore.importRecords(records, replaceExisting);
        if (log.isInfoEnabled()) {
            log.info("Imported {} of {} records from {} into {}", imported, records.size(), source, recordStore.describe());
        }
        return new ImportSummary(records.size(), imported);
    }
}
