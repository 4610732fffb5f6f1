package com.jreinhal.annotator.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.jreinhal.annotator.TestFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class TaskSchemaTest {

    @Test
    void keepsDeclarationOrder() {
        TaskSchema schema = TestFixtures.schema();

        assertThat(schema.fields()).extracting(FieldDescriptor::name)
            .startsWith("image_url", "category", "material");
    }

    @Test
    void findsScaleFieldForBase() {
        TaskSchema schema = TestFixtures.schema();

        assertThat(schema.scaleFor("dimension")).map(FieldDescriptor::name).contains("dimension_scale");
        assertThat(schema.scaleFor("mass")).isEmpty();
    }

    @Test
    void rejectsDuplicateFields() {
        assertThatThrownBy(() -> new TaskSchema("t", List.of(FieldDescriptor.text("a"), FieldDescriptor.text("a"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate");
    }

    @Test
    void rejectsScaleOfUnknownOrScaleField() {
        assertThatThrownBy(() -> new TaskSchema("t", List.of(FieldDescriptor.scale("s", "missing"))))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TaskSchema("t", List.of(
                FieldDescriptor.text("a"), FieldDescriptor.scale("s1", "a"), FieldDescriptor.scale("s2", "s1"))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void requireRejectsUnknownField() {
        assertThatThrownBy(() -> TestFixtures.schema().require("nope"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown field: nope");
    }

    @Test
    void propertiesBuildSchema() {
        TaskSchemaProperties properties = new TaskSchemaProperties();
        TaskSchemaProperties.Field material = new TaskSchemaProperties.Field();
        material.setName("material");
        material.setTransform("array_to_string");
        material.setReviewFlag(true);
        properties.setFields(List.of(material));

        TaskSchema schema = properties.toSchema();

        assertThat(schema.taskName()).isEqualTo("annotation");
        assertThat(schema.require("material").transform()).isEqualTo(DisplayTransform.JOIN_WITH_COMMA);
        assertThat(schema.require("material").flagKey()).isEqualTo("chk_material");
    }
}
