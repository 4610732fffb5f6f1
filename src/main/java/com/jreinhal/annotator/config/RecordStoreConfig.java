package com.jreinhal.annotator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.annotator.store.InterchangeCodec;
import com.jreinhal.annotator.store.InterchangeExporter;
import com.jreinhal.annotator.store.JdbcRecordStore;
import com.jreinhal.annotator.store.JsonlRecordStore;
import com.jreinhal.annotator.store.RecordStore;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Picks the record store backend once at startup from {@code annotator.store.backend}.
 */
@Configuration
public class RecordStoreConfig {
    private static final Logger log = LoggerFactory.getLogger(RecordStoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "annotator.store.backend", havingValue = "jdbc", matchIfMissing = true)
    public RecordStore jdbcRecordStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
                                       ObjectMapper objectMapper, InterchangeExporter exporter) {
        log.info("Using JdbcRecordStore (row-locked claims).");
        return new JdbcRecordStore(jdbcTemplate, transactionManager, objectMapper, exporter);
    }

    @Bean
    @ConditionalOnProperty(name = "annotator.store.backend", havingValue = "jsonl")
    public RecordStore jsonlRecordStore(@Value("${annotator.store.jsonl.file:data/records.jsonl}") String file,
                                        InterchangeCodec codec, InterchangeExporter exporter) {
        log.info("Using JsonlRecordStore at {}.", file);
        return new JsonlRecordStore(Paths.get(file), codec, exporter);
    }
}
