package com.jreinhal.annotator;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.env.Environment;

@SpringBootApplication
public class AnnotatorApplication {
    private static final Logger log = LoggerFactory.getLogger(AnnotatorApplication.class);
    private final Environment environment;

    public AnnotatorApplication(Environment environment) {
        this.environment = environment;
    }

    public static void main(String[] args) {
        SpringApplication.run(AnnotatorApplication.class, args);
    }

    @PostConstruct
    public void validateStoreConfiguration() {
        String backend = environment.getProperty("annotator.store.backend", "jdbc");
        if (!"jdbc".equalsIgnoreCase(backend) && !"jsonl".equalsIgnoreCase(backend)) {
            throw new IllegalStateException("annotator.store.backend must be 'jdbc' or 'jsonl', was '" + backend + "'");
        }
        if ("jsonl".equalsIgnoreCase(backend)) {
            log.warn("=================================================================");
            log.warn("  FILE STORE ACTIVE: {}", environment.getProperty("annotator.store.jsonl.file", "data/records.jsonl"));
            log.warn("=================================================================");
            log.warn("  Claims are serialized inside this process only.");
            log.warn("  Do not run a second instance or edit the file while it is up.");
            log.warn("  Use annotator.store.backend=jdbc for shared deployments.");
            log.warn("=================================================================");
            return;
        }
        log.info("Store configuration validated:");
        log.info("  Backend: jdbc");
        log.info("  Datasource: {}", environment.getProperty("spring.datasource.url", "(embedded default)"));
    }
}
