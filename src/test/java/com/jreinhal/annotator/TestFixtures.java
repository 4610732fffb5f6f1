package com.jreinhal.annotator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.annotator.model.AnnotationRecord;
import com.jreinhal.annotator.schema.DisplayTransform;
import com.jreinhal.annotator.schema.FieldDescriptor;
import com.jreinhal.annotator.schema.TaskSchema;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class TestFixtures {
    public static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private TestFixtures() {
    }

    /**
     * image_url (computed), category, material (comma list), dimension + dimension_scale,
     * mass, overall_description (newline list), physical_properties (json).
     */
    public static TaskSchema schema() {
        return new TaskSchema("whole-object", List.of(
            FieldDescriptor.readOnly("image_url"),
            FieldDescriptor.reviewable("category", DisplayTransform.IDENTITY),
            FieldDescriptor.reviewable("material", DisplayTransform.JOIN_WITH_COMMA),
            FieldDescriptor.reviewable("dimension", DisplayTransform.IDENTITY),
            FieldDescriptor.scale("dimension_scale", "dimension"),
            FieldDescriptor.reviewable("mass", DisplayTransform.IDENTITY),
            FieldDescriptor.text("overall_description"),
            new FieldDescriptor("physical_properties", DisplayTransform.JSON, false, false, null)));
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    public static AnnotationRecord record(String id) {
        return record(id, "");
    }

    public static AnnotationRecord record(String id, String owner) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("image_url", "https://img.example/" + id + ".png");
        fields.put("category", "chair");
        fields.put("material", List.of("wood", "steel"));
        fields.put("dimension", "0.78*0.41*0.54");
        fields.put("mass", "4.2");
        return new AnnotationRecord(id, owner, false, AnnotationRecord.SCORE_CLEAN, fields, Map.of(), T0, T0);
    }
}
