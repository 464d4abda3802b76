package com.jordtransport.manifest.service;

import com.jordtransport.manifest.config.ManifestProperties;
import com.jordtransport.manifest.dto.FatalError;
import com.jordtransport.manifest.dto.ValidationReport;
import com.jordtransport.manifest.exception.FatalErrorCode;
import com.jordtransport.manifest.exception.ManifestImportException;
import com.jordtransport.manifest.exception.SizeLimitExceededException;
import com.jordtransport.manifest.parser.ManifestParser;
import com.jordtransport.manifest.parser.ParsedManifest;
import com.jordtransport.manifest.parser.RawRow;
import com.jordtransport.manifest.parser.SourceFormat;
import com.jordtransport.manifest.schema.SchemaDefinition;
import com.jordtransport.manifest.validation.FieldError;
import com.jordtransport.manifest.validation.RowValidator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs one manifest import: size ceiling, parsing, header contract, row validation and assembly.
 * <p>
 * File-level failures come back as a report holding only a {@link FatalError}; row failures are collected per
 * row and never stop the remaining rows. Large files are validated in parallel, but the report is always
 * assembled in file order.
 */
@Slf4j
@Service
public class ManifestImportService {

    private final ManifestProperties properties;
    private final Map<SourceFormat, ManifestParser> parsers = new EnumMap<>(SourceFormat.class);
    private final SchemaDefinition schema;
    private final RowValidator rowValidator;
    private final RecordAssembler recordAssembler;
    private final ExecutorService validationExecutor;

    public ManifestImportService(ManifestProperties properties,
                                 List<ManifestParser> parsers,
                                 SchemaDefinition schema,
                                 RowValidator rowValidator,
                                 RecordAssembler recordAssembler,
                                 ExecutorService validationExecutor) {
        this.properties = properties;
        this.schema = schema;
        this.rowValidator = rowValidator;
        this.recordAssembler = recordAssembler;
        this.validationExecutor = validationExecutor;
        for (ManifestParser parser : parsers) {
            this.parsers.put(parser.getFormat(), parser);
        }
        for (SourceFormat format : SourceFormat.values()) {
            if (!this.parsers.containsKey(format)) {
                throw new IllegalStateException("No parser registered for " + format);
            }
        }
    }

    /**
     * Reads an upload stream, refusing to buffer more than the configured ceiling, and imports it. The format is
     * detected from the filename and content unless {@code declaredFormat} is given.
     */
    public ValidationReport importManifest(InputStream upload, String filename, SourceFormat declaredFormat) throws IOException {
        long limit = properties.getMaxFileSizeBytes();
        byte[] content = upload.readNBytes((int) Math.min(limit, ManifestProperties.MAX_FILE_SIZE_CEILING) + 1);
        SourceFormat format = declaredFormat != null ? declaredFormat : SourceFormat.detect(filename, content);

        if (content.length > limit) {
            log.warn("Upload '{}' rejected: larger than {} bytes", filename, limit);
            return ValidationReport.fatal(format, null, new FatalError(FatalErrorCode.SIZE_LIMIT_EXCEEDED, sizeMessage(limit)));
        }
        log.info("Importing '{}' as {} ({} bytes)", filename, format, content.length);
        return importManifest(content, format);
    }

    public ValidationReport importManifest(byte[] content, SourceFormat format) {
        String contentHash = DigestUtils.sha256Hex(content);
        try {
            if (content.length > properties.getMaxFileSizeBytes()) {
                throw new SizeLimitExceededException(sizeMessage(properties.getMaxFileSizeBytes()));
            }

            ParsedManifest parsed = parsers.get(format).parse(content);
            rowValidator.checkHeader(parsed.getHeader());

            List<RawRow> rows = parsed.getRows();
            if (rows.size() > properties.getMaxRows()) {
                throw new SizeLimitExceededException("Filen indeholder " + rows.size()
                        + " rækker; maksimum er " + properties.getMaxRows());
            }

            List<List<FieldError>> results = validateRows(rows);

            ValidationReport.Builder report = ValidationReport.builder(format, contentHash, parsed.getHeader())
                    .unknownColumns(schema.unknownColumns(parsed.getHeader()))
                    .warnings(rowValidator.headerWarnings(parsed.getHeader()))
                    .blankRowsSkipped(parsed.getBlankRowsSkipped());
            for (int i = 0; i < rows.size(); i++) {
                RawRow row = rows.get(i);
                List<FieldError> errors = results.get(i);
                report.warnings(rowValidator.warnings(row));
                if (errors.isEmpty()) {
                    report.accept(recordAssembler.assemble(row, errors));
                } else {
                    report.reject(row.getRowIndex(), errors, row.getValues());
                }
            }

            ValidationReport result = report.build();
            if (log.isDebugEnabled()) {
                log.debug("Validation report:\n{}", result.formatReport());
            }
            if (result.getRejectedCount() > 0) {
                log.warn("Import finished with {} rejected row(s) of {}: {}", result.getRejectedCount(),
                        result.getTotalRows(), result.getErrorSummary());
            } else {
                log.info("Import finished: all {} row(s) accepted", result.getTotalRows());
            }
            return result;
        } catch (ManifestImportException e) {
            log.warn("Import aborted ({}): {}", e.getCode(), e.getMessage());
            return ValidationReport.fatal(format, contentHash, new FatalError(e.getCode(), e.getMessage()));
        }
    }

    /**
     * Result i belongs to row i, whatever order the work finished in.
     */
    private List<List<FieldError>> validateRows(List<RawRow> rows) {
        if (rows.size() < properties.getParallelThreshold()) {
            List<List<FieldError>> results = new ArrayList<>(rows.size());
            for (RawRow row : rows) {
                results.add(rowValidator.validate(row));
            }
            return results;
        }

        int chunks = properties.resolveWorkerThreads() * 4;
        int chunkSize = Math.max(1, (rows.size() + chunks - 1) / chunks);
        log.debug("Validating {} rows in parallel, chunk size {}", rows.size(), chunkSize);

        List<CompletableFuture<List<List<FieldError>>>> futures = new ArrayList<>();
        for (int start = 0; start < rows.size(); start += chunkSize) {
            List<RawRow> chunk = rows.subList(start, Math.min(start + chunkSize, rows.size()));
            futures.add(CompletableFuture.supplyAsync(() -> {
                List<List<FieldError>> partial = new ArrayList<>(chunk.size());
                for (RawRow row : chunk) {
                    partial.add(rowValidator.validate(row));
                }
                return partial;
            }, validationExecutor));
        }

        List<List<FieldError>> results = new ArrayList<>(rows.size());
        try {
            for (CompletableFuture<List<List<FieldError>>> future : futures) {
                results.addAll(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Row validation failed", e.getCause());
        }
        return results;
    }

    private String sizeMessage(long limit) {
        long mb = 1024 * 1024;
        String readable = limit % mb == 0 ? (limit / mb) + " MB" : limit + " bytes";
        return "Filen er større end den maksimale filstørrelse på " + readable;
    }
}
