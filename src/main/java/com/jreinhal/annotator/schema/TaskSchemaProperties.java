package com.jreinhal.annotator.schema;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "annotator.task")
public class TaskSchemaProperties {
    /**
     * Task identifier, used in log lines and export metadata.
     */
    private String name = "annotation";

    /**
     * Ordered field declarations.
     *
     * Example:
     * annotator.task.fields[0].name=material
     * annotator.task.fields[0].review-flag=true
     * annotator.task.fields[1].transform=JOIN_WITH_COMMA
     */
    private List<Field> fields = new ArrayList<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<Field> getFields() {
        return fields;
    }

    public void setFields(List<Field> fields) {
        this.fields = fields;
    }

    public TaskSchema toSchema() {
        List<FieldDescriptor> descriptors = new ArrayList<>();
        for (Field field : fields) {
            descriptors.add(new FieldDescriptor(
                field.getName(),
                DisplayTransform.fromString(field.getTransform()),
                field.isReviewFlag(),
                field.isOwnerComputed(),
                field.getScaleOf()));
        }
        return new TaskSchema(name, descriptors);
    }

    public static class Field {
        private String name;
        private String transform = "IDENTITY";
        private boolean reviewFlag;
        private boolean ownerComputed;
        private String scaleOf;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getTransform() {
            return transform;
        }

        public void setTransform(String transform) {
            this.transform = transform;
        }

        public boolean isReviewFlag() {
            return reviewFlag;
        }

        public void setReviewFlag(boolean reviewFlag) {
            this.reviewFlag = reviewFlag;
        }

        public boolean isOwnerComputed() {
            return ownerComputed;
        }

        public void setOwnerComputed(boolean ownerComputed) {
            this.ownerComputed = ownerComputed;
        }

        public String getScaleOf() {
            return scaleOf;
        }

        public void setScaleOf(String scaleOf) {
            this.scaleOf = scaleOf;
        }
    }
}
