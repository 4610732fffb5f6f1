package com.jreinhal.annotator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.jreinhal.annotator.model.AnnotationRecord;
import com.jreinhal.annotator.schema.FieldDescriptor;
import com.jreinhal.annotator.schema.TaskSchema;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Line-delimited JSON interchange format:
 * {@code {"<id>": {"annotated": bool, "uid": "<owner>", "score": 0|1, "chk_<field>": bool, "<field>": value}}}.
 */
@Component
public class InterchangeCodec {
    static final String ANNOTATED = "annotated";
    static final String UID = "uid";
    static final String SCORE = "score";
    private static final TypeReference<LinkedHashMap<String, Object>> LINE_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final ObjectWriter lineWriter;
    private final TaskSchema schema;

    public InterchangeCodec(ObjectMapper objectMapper, TaskSchema schema) {
        this.objectMapper = objectMapper;
        this.lineWriter = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
        this.schema = schema;
    }

    public List<AnnotationRecord> decodeLine(String line, int lineNumber, Instant now) {
        Map<String, Object> parsed;
        try {
            parsed = objectMapper.readValue(line, LINE_TYPE);
        } catch (JsonProcessingException e) {
            throw new InterchangeFormatException(lineNumber, "not a JSON object", e);
        }
        if (parsed == null) {
            throw new InterchangeFormatException(lineNumber, "null line", null);
        }
        List<AnnotationRecord> records = new ArrayList<>(parsed.size());
        for (Map.Entry<String, Object> entry : parsed.entrySet()) {
            if (!(entry.getValue() instanceof Map<?, ?> attrs)) {
                throw new InterchangeFormatException(lineNumber, "attributes of " + entry.getKey() + " are not an object", null);
            }
            records.add(decodeRecord(entry.getKey(), attrs, now));
        }
        return records;
    }

    private AnnotationRecord decodeRecord(String id, Map<?, ?> attrs, Instant now) {
        boolean annotated = asBoolean(attrs.get(ANNOTATED));
        String owner = attrs.get(UID) == null ? "" : String.valueOf(attrs.get(UID));
        int score = asScore(attrs.get(SCORE));
        Map<String, Object> fields = new LinkedHashMap<>();
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (Map.Entry<?, ?> attr : attrs.entrySet()) {
            String key = String.valueOf(attr.getKey());
            if (ANNOTATED.equals(key) || UID.equals(key) || SCORE.equals(key)) {
                continue;
            }
            if (FieldDescriptor.isFlagKey(key)) {
                flags.put(FieldDescriptor.fieldForFlagKey(key), asBoolean(attr.getValue()));
            } else {
                fields.put(key, attr.getValue());
            }
        }
        return new AnnotationRecord(id, owner, annotated, score, fields, flags, now, now);
    }

    /**
     * Reads a whole file. A later line with the same id replaces the earlier one but keeps
     * its position.
     */
    public List<AnnotationRecord> read(Path source) throws IOException {
        Map<String, AnnotationRecord> records = new LinkedHashMap<>();
        Instant now = Instant.now();
        try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                for (AnnotationRecord record : decodeLine(trimmed, lineNumber, now)) {
                    records.put(record.id(), record);
                }
            }
        }
        return new ArrayList<>(records.values());
    }

    /**
     * @param exportForm convert list-joining fields still held as display text back to arrays
     */
    public String encode(AnnotationRecord record, boolean exportForm) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put(ANNOTATED, record.completed());
        attrs.put(UID, record.owner());
        attrs.put(SCORE, record.qualityScore());
        for (Map.Entry<String, Object> field : record.fields().entrySet()) {
            attrs.put(field.getKey(), exportForm ? toExportValue(field.getKey(), field.getValue()) : field.getValue());
        }
        for (Map.Entry<String, Boolean> flag : record.flags().entrySet()) {
            attrs.put(FieldDescriptor.FLAG_KEY_PREFIX + flag.getKey(), Boolean.TRUE.equals(flag.getValue()));
        }
        Map<String, Object> line = new LinkedHashMap<>();
        line.put(record.id(), attrs);
        try {
            return lineWriter.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            throw new RecordStoreException("Record " + record.id() + " cannot be serialized", e);
        }
    }

    public void write(Path target, Collection<AnnotationRecord> records, boolean exportForm) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (AnnotationRecord record : records) {
                writer.write(encode(record, exportForm));
                writer.newLine();
            }
        }
    }

    private Object toExportValue(String fieldName, Object value) {
        Optional<FieldDescriptor> descriptor = schema.field(fieldName);
        if (descriptor.isPresent() && descriptor.get().transform().joinsLists() && value instanceof String) {
            return descriptor.get().transform().save(value);
        }
        return value;
    }

    private static boolean asBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        return value != null && Boolean.parseBoolean(String.valueOf(value).trim());
    }

    private static int asScore(Object value) {
        if (value instanceof Number number) {
            return number.intValue() == 0 ? AnnotationRecord.SCORE_FLAGGED : AnnotationRecord.SCORE_CLEAN;
        }
        if (value == null) {
            return AnnotationRecord.SCORE_CLEAN;
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim()) == 0 ? AnnotationRecord.SCORE_FLAGGED : AnnotationRecord.SCORE_CLEAN;
        } catch (NumberFormatException e) {
            return AnnotationRecord.SCORE_CLEAN;
        }
    }
}
