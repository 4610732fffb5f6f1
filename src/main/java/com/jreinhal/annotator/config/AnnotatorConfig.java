package com.jreinhal.annotator.config;

import com.jreinhal.annotator.schema.TaskSchema;
import com.jreinhal.annotator.schema.TaskSchemaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnnotatorConfig {
    private static final Logger log = LoggerFactory.getLogger(AnnotatorConfig.class);

    @Bean
    public TaskSchema taskSchema(TaskSchemaProperties properties) {
        TaskSchema schema = properties.toSchema();
        if (schema.isEmpty()) {
            log.warn("Task '{}' declares no fields; records can be browsed but not edited", schema.taskName());
        } else {
            log.info("Task '{}' loaded with {} fields", schema.taskName(), schema.fields().size());
        }
        return schema;
    }
}
