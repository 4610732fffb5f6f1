package com.jreinhal.annotator.store;

import com.jreinhal.annotator.model.AnnotationRecord;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Writes {@code export_<yyyyMMdd_HHmmss>.jsonl} files. Shared by both store backends;
 * best effort, errors are surfaced and never retried.
 */
@Component
public class InterchangeExporter {
    private static final Logger log = LoggerFactory.getLogger(InterchangeExporter.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final InterchangeCodec codec;
    private final Path exportDirectory;
    private final Clock clock;

    @Autowired
    public InterchangeExporter(InterchangeCodec codec, @Value("${annotator.export.directory:exports}") String exportDirectory) {
        this(codec, Paths.get(exportDirectory), Clock.systemDefaultZone());
    }

    InterchangeExporter(InterchangeCodec codec, Path exportDirectory, Clock clock) {
        this.codec = codec;
        this.exportDirectory = exportDirectory;
        this.clock = clock;
    }

    public Path export(Collection<AnnotationRecord> records, ExportFilter filter) {
        try {
            Files.createDirectories(exportDirectory);
        } catch (AccessDeniedException e) {
            throw new ExportFailedException(ExportFailedException.Reason.PERMISSION_DENIED,
                "Cannot create export directory " + exportDirectory + ": permission denied", e);
        } catch (IOException e) {
            throw new ExportFailedException(ExportFailedException.Reason.IO_ERROR,
                "Cannot create export directory " + exportDirectory + ": " + e.getMessage(), e);
        }
        if (!Files.isWritable(exportDirectory)) {
            throw new ExportFailedException(ExportFailedException.Reason.PERMISSION_DENIED,
                "Export directory " + exportDirectory + " is not writable", null);
        }
        Path target = exportDirectory.resolve("export_" + LocalDateTime.now(clock).format(FILE_STAMP) + ".jsonl");
        List<AnnotationRecord> selected = records.stream().filter(filter::matches).toList();
        try {
            codec.write(target, selected, true);
        } catch (AccessDeniedException e) {
            throw new ExportFailedException(ExportFailedException.Reason.PERMISSION_DENIED,
                "Writing " + target + " was denied", e);
        } catch (IOException e) {
            throw new ExportFailedException(ExportFailedException.Reason.IO_ERROR,
                "Export to " + target + " failed: " + e.getMessage(), e);
        }
        if (log.isInfoEnabled()) {
            log.info("Exported {} of {} records to {}", selected.size(), records.size(), target);
        }
        return target;
    }

    public Path getExportDirectory() {
        return this.exportDirectory;
    }
}
