package com.jreinhal.annotator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.annotator.model.AnnotationRecord;
import com.jreinhal.annotator.model.RecordStatistics;
import com.jreinhal.annotator.util.LogSanitizer;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Durable store over the {@code annotation_record} table.
 *
 * <p>{@link #claim} and {@link #save} each run in their own transaction and lock the row with
 * {@code SELECT ... FOR UPDATE} before the check-and-set, so two annotators racing for the
 * same unclaimed record are serialized by the database and exactly one of them wins.</p>
 */
public class JdbcRecordStore implements RecordStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcRecordStore.class);
    static final String TABLE = "annotation_record";
    private static final String COLUMNS =
        "record_id, owner_id, completed, quality_score, fields_json, flags_json, created_at, updated_at";
    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS_TYPE = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, Boolean>> FLAGS_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final InterchangeExporter exporter;

    public JdbcRecordStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
                           ObjectMapper objectMapper, InterchangeExporter exporter) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.objectMapper = objectMapper;
        this.exporter = exporter;
    }

    @Override
    public Map<String, AnnotationRecord> loadAll() {
        try {
            List<AnnotationRecord> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM " + TABLE + " ORDER BY record_id", this::mapRow);
            Map<String, AnnotationRecord> records = new LinkedHashMap<>();
            for (AnnotationRecord row : rows) {
                records.put(row.id(), row);
            }
            return records;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Record table could not be read", e);
        }
    }

    @Override
    public Optional<AnnotationRecord> get(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        try {
            return jdbcTemplate.query(
                    "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE record_id = ?", this::mapRow, id)
                .stream()
                .findFirst();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Record " + id + " could not be read", e);
        }
    }

    @Override
    public SaveResult save(String id, Map<String, Object> fields, Map<String, Boolean> flags, int score, String owner) {
        if (id == null || id.isBlank()) {
            return SaveResult.notFound(String.valueOf(id));
        }
        try {
            SaveResult result = transactionTemplate.execute(status -> saveLocked(id, fields, flags, score, owner));
            return result != null ? result : SaveResult.ioError(id, "Save returned no result");
        } catch (DataIntegrityViolationException e) {
            log.warn("Save of {} rejected by constraint: {}", LogSanitizer.sanitize(id), e.getMostSpecificCause().getMessage());
            return SaveResult.conflict(id, "The store rejected the write (constraint violation); reload and retry");
        } catch (PessimisticLockingFailureException e) {
            log.warn("Save of {} could not lock the row: {}", LogSanitizer.sanitize(id), e.getMessage());
            return SaveResult.conflict(id, "Record is locked by another operation; retry");
        } catch (IllegalArgumentException e) {
            return SaveResult.conflict(id, e.getMessage());
        } catch (DataAccessException e) {
            log.error("Save of {} failed", LogSanitizer.sanitize(id), e);
            return SaveResult.ioError(id, "Store unavailable: " + e.getMostSpecificCause().getMessage());
        }
    }

    private SaveResult saveLocked(String id, Map<String, Object> fields, Map<String, Boolean> flags, int score, String owner) {
        List<LockedRow> locked = jdbcTemplate.query(
            "SELECT owner_id, fields_json, flags_json FROM " + TABLE + " WHERE record_id = ? FOR UPDATE",
            (rs, rowNum) -> new LockedRow(rs.getString("owner_id"), rs.getString("fields_json"), rs.getString("flags_json")),
            id);
        if (locked.isEmpty()) {
            return SaveResult.notFound(id);
        }
        LockedRow row = locked.get(0);
        String current = row.owner() == null ? "" : row.owner();
        String requested = owner == null || owner.isBlank() ? null : owner.trim();
        if (requested != null && !current.isEmpty() && !current.equals(requested)) {
            return SaveResult.conflict(id, "Record " + id + " is owned by another annotator");
        }
        Map<String, Object> mergedFields = readFields(row.fieldsJson());
        if (fields != null) {
            mergedFields.putAll(fields);
        }
        Map<String, Boolean> mergedFlags = readFlags(row.flagsJson());
        if (flags != null) {
            mergedFlags.putAll(flags);
        }
        int effectiveScore = AnnotationRecord.scoreFor(mergedFlags);
        if (effectiveScore != score) {
            log.warn("Score {} for {} disagrees with its flags; storing {}", score, LogSanitizer.sanitize(id), effectiveScore);
        }
        jdbcTemplate.update(
            "UPDATE " + TABLE + " SET owner_id = ?, completed = TRUE, quality_score = ?, fields_json = ?, flags_json = ?, updated_at = ? WHERE record_id = ?",
            requested != null ? requested : current,
            effectiveScore,
            toJson(mergedFields),
            toJson(mergedFlags),
            Timestamp.from(Instant.now()),
            id);
        return SaveResult.saved(id);
    }

    @Override
    public boolean claim(String id, String user) {
        if (id == null || id.isBlank() || user == null || user.isBlank()) {
            return false;
        }
        try {
            Boolean claimed = transactionTemplate.execute(status -> {
                List<String> owners = jdbcTemplate.query(
                    "SELECT owner_id FROM " + TABLE + " WHERE record_id = ? FOR UPDATE",
                    (rs, rowNum) -> rs.getString("owner_id"),
                    id);
                if (owners.isEmpty()) {
                    return false;
                }
                String current = owners.get(0) == null ? "" : owners.get(0);
                if (current.equals(user)) {
                    return true;
                }
                if (!current.isEmpty()) {
                    return false;
                }
                int updated = jdbcTemplate.update(
                    "UPDATE " + TABLE + " SET owner_id = ?, updated_at = ? WHERE record_id = ? AND owner_id = ''",
                    user, Timestamp.from(Instant.now()), id);
                return updated == 1;
            });
            return Boolean.TRUE.equals(claimed);
        } catch (PessimisticLockingFailureException e) {
            log.warn("Claim of {} by {} lost the row lock: {}", LogSanitizer.sanitize(id), LogSanitizer.sanitize(user), e.getMessage());
            return false;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Claim of record " + id + " failed", e);
        }
    }

    @Override
    public Path export(ExportFilter filter) {
        return exporter.export(loadAll().values(), filter == null ? ExportFilter.all() : filter);
    }

    @Override
    public RecordStatistics statistics() {
        try {
            RecordStatistics stats = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) AS total, COALESCE(SUM(CASE WHEN completed THEN 1 ELSE 0 END), 0) AS annotated FROM " + TABLE,
                (rs, rowNum) -> RecordStatistics.of(rs.getLong("total"), rs.getLong("annotated")));
            return stats != null ? stats : RecordStatistics.of(0L, 0L);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Record statistics could not be read", e);
        }
    }

    @Override
    public RecordPage loadPage(int page, int size) {
        if (page < 1 || size < 1) {
            throw new IllegalArgumentException("Page and size must be positive");
        }
        try {
            Long total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + TABLE, Long.class);
            List<AnnotationRecord> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM " + TABLE + " ORDER BY record_id LIMIT ? OFFSET ?",
                this::mapRow, size, (long) (page - 1) * size);
            long count = total != null ? total : 0L;
            return new RecordPage(rows, page, size, count, (long) page * size < count);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Record page " + page + " could not be read", e);
        }
    }

    @Override
    public int importRecords(Collection<AnnotationRecord> records, boolean replaceExisting) {
        try {
            Integer written = transactionTemplate.execute(status -> {
                int count = 0;
                for (AnnotationRecord record : records) {
                    Integer existing = jdbcTemplate.queryForObject(
                        "SELECT COUNT(*) FROM " + TABLE + " WHERE record_id = ?", Integer.class, record.id());
                    if (existing != null && existing > 0) {
                        if (!replaceExisting) {
                            continue;
                        }
                        jdbcTemplate.update(
                            "UPDATE " + TABLE + " SET owner_id = ?, completed = ?, quality_score = ?, fields_json = ?, flags_json = ?, updated_at = ? WHERE record_id = ?",
                            record.owner(), record.completed(), record.qualityScore(),
                            toJson(record.fields()), toJson(record.flags()),
                            Timestamp.from(record.updatedAt() != null ? record.updatedAt() : Instant.now()),
                            record.id());
                    } else {
                        Instant created = record.createdAt() != null ? record.createdAt() : Instant.now();
                        jdbcTemplate.update(
                            "INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                            record.id(), record.owner(), record.completed(), record.qualityScore(),
                            toJson(record.fields()), toJson(record.flags()),
                            Timestamp.from(created),
                            Timestamp.from(record.updatedAt() != null ? record.updatedAt() : created));
                    }
                    count++;
                }
                return count;
            });
            return written != null ? written : 0;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Import into " + TABLE + " failed", e);
        }
    }

    @Override
    public boolean delete(String id) {
        try {
            return jdbcTemplate.update("DELETE FROM " + TABLE + " WHERE record_id = ?", id) > 0;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Delete of record " + id + " failed", e);
        }
    }

    @Override
    public String describe() {
        return "jdbc:" + TABLE;
    }

    private AnnotationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        String id = rs.getString("record_id");
        return new AnnotationRecord(
            id,
            rs.getString("owner_id"),
            rs.getBoolean("completed"),
            rs.getInt("quality_score"),
            readFields(rs.getString("fields_json")),
            readFlags(rs.getString("flags_json")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at")));
    }

    private Map<String, Object> readFields(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, FIELDS_TYPE);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Corrupt fields_json column", e);
        }
    }

    private Map<String, Boolean> readFlags(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, FLAGS_TYPE);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Corrupt flags_json column", e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Field values cannot be stored as JSON", e);
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private record LockedRow(String owner, String fieldsJson, String flagsJson) {
    }
}
