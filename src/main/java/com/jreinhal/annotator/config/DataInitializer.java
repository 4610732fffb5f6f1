package com.jreinhal.annotator.config;

import com.jreinhal.annotator.store.ImportSummary;
import com.jreinhal.annotator.store.RecordImporter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Startup wiring: the password encoder and the optional bulk import of an interchange file.
 */
@Configuration
public class DataInitializer {
    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    /**
     * Interchange file loaded on startup; empty disables the import.
     */
    @Value("${annotator.store.import-on-startup:}")
    private String importFile;

    @Value("${annotator.store.import-replace-existing:false}")
    private boolean replaceExisting;

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public CommandLineRunner importRecordsOnStartup(RecordImporter recordImporter) {
        return args -> {
            if (importFile == null || importFile.isBlank()) {
                log.debug("Startup import disabled");
                return;
            }
            Path source = Paths.get(importFile.trim());
            if (!Files.isRegularFile(source)) {
                log.warn("Startup import file {} not found; skipping", source);
                return;
            }
            ImportSummary summary = recordImporter.importFile(source, replaceExisting);
            log.info("Startup import from {}: {} read, {} imported, {} skipped",
                source, summary.read(), summary.imported(), summary.skipped());
        };
    }
}
