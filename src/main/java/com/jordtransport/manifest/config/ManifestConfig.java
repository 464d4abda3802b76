package com.jordtransport.manifest.config;

import com.jordtransport.manifest.parser.DelimitedTextManifestParser;
import com.jordtransport.manifest.parser.ManifestParser;
import com.jordtransport.manifest.parser.SpreadsheetManifestParser;
import com.jordtransport.manifest.reference.ReferenceDirectory;
import com.jordtransport.manifest.schema.SchemaDefinition;
import com.jordtransport.manifest.service.RecordAssembler;
import com.jordtransport.manifest.validation.RowValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the import core. The schema and facility directory are created once here and shared by reference;
 * everything downstream receives them through its constructor.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ManifestProperties.class)
public class ManifestConfig {

    @Bean
    public SchemaDefinition schemaDefinition() {
        return SchemaDefinition.standard();
    }

    @Bean
    public ReferenceDirectory referenceDirectory() {
        ReferenceDirectory directory = ReferenceDirectory.standard();
        log.info("Loaded facility directory {} with {} facilities", directory.getVersion(), directory.size());
        return directory;
    }

    @Bean
    public RowValidator rowValidator(SchemaDefinition schemaDefinition, ReferenceDirectory referenceDirectory) {
        return new RowValidator(schemaDefinition, referenceDirectory);
    }

    @Bean
    public RecordAssembler recordAssembler(ReferenceDirectory referenceDirectory) {
        return new RecordAssembler(referenceDirectory);
    }

    @Bean
    public ManifestParser spreadsheetManifestParser(ManifestProperties properties) {
        return new SpreadsheetManifestParser(properties.getDataSheetName());
    }

    @Bean
    public ManifestParser delimitedTextManifestParser() {
        return new DelimitedTextManifestParser();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService validationExecutor(ManifestProperties properties) {
        int threads = properties.resolveWorkerThreads();
        log.info("Row validation pool initialized with {} threads", threads);
        return Executors.newFixedThreadPool(threads);
    }
}
