package com.jordtransport.manifest.dto;

import com.jordtransport.manifest.parser.SourceFormat;
import com.jordtransport.manifest.validation.FieldError;
import com.jordtransport.manifest.validation.FieldWarning;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one manifest import.
 * <p>
 * Either a fatal file-level error (and nothing else), or the accepted records and rejected rows, each in the
 * order they appear in the file. The report carries nothing that depends on when or where it was produced, so
 * importing the same bytes twice gives equal reports.
 */
@Value
public class ValidationReport {

    SourceFormat format;

    /**
     * SHA-256 of the uploaded bytes, hex encoded.
     */
    String contentHash;

    List<String> header;

    List<ValidatedRecord> records;

    List<RowRejection> rejections;

    /**
     * Set only when the file itself was unusable; records and rejections are then empty.
     */
    FatalError fatalError;

    /**
     * Header columns the contract does not define. Informational; they never reject a row.
     */
    List<String> unknownColumns;

    /**
     * Advisory findings, file-level first, then per row in file order. They never affect acceptance.
     */
    List<FieldWarning> warnings;

    int blankRowsSkipped;

    public static ValidationReport fatal(SourceFormat format, String contentHash, FatalError fatalError) {
        return new ValidationReport(format, contentHash, List.of(), List.of(), List.of(), fatalError, List.of(), List.of(), 0);
    }

    public static Builder builder(SourceFormat format, String contentHash, List<String> header) {
        return new Builder(format, contentHash, header);
    }

    public boolean isFatal() {
        return fatalError != null;
    }

    public int getTotalRows() {
        return records.size() + rejections.size();
    }

    public int getAcceptedCount() {
        return records.size();
    }

    public int getRejectedCount() {
        return rejections.size();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * Number of errors per field, in the order fields first fail.
     */
    public Map<String, Integer> getErrorSummary() {
        Map<String, Integer> summary = new LinkedHashMap<>();
        for (RowRejection rejection : rejections) {
            for (FieldError error : rejection.getErrors()) {
                summary.merge(error.getField(), 1, Integer::sum);
            }
        }
        return summary;
    }

    /**
     * Plain-text summary for logs and e-mail: outcome, counts, then every error and warning on its own line.
     */
    public String formatReport() {
        List<String> lines = new ArrayList<>();
        boolean valid = !isFatal() && rejections.isEmpty();

        if (valid) {
            lines.add("✓ VALIDERING GENNEMFØRT SUCCESFULDT");
            lines.add("  Antal rækker: " + getTotalRows());
            lines.add("  Antal felter: " + header.size());
        } else {
            int errorCount = isFatal() ? 1 : rejections.stream().mapToInt(r -> r.getErrors().size()).sum();
            lines.add("✗ VALIDERING FEJLEDE");
            lines.add("  Antal fejl: " + errorCount);
            lines.add("  Antal advarsler: " + warnings.size());
        }

        if (!valid) {
            lines.add("");
            lines.add("FEJL:");
            if (isFatal()) {
                lines.add("  • " + fatalError.getMessage());
            }
            for (RowRejection rejection : rejections) {
                for (FieldError error : rejection.getErrors()) {
                    lines.add("  • " + error);
                }
            }
        }
        if (!warnings.isEmpty()) {
            lines.add("");
            lines.add("ADVARSLER:");
            for (FieldWarning warning : warnings) {
                lines.add("  • " + warning);
            }
        }
        return String.join("\n", lines);
    }

    /**
     * Collects row outcomes. Rows must be added in ascending row order.
     */
    public static final class Builder {
        private final SourceFormat format;
        private final String contentHash;
        private final List<String> header;
        private final List<ValidatedRecord> records = new ArrayList<>();
        private final List<RowRejection> rejections = new ArrayList<>();
        private List<String> unknownColumns = List.of();
        private final List<FieldWarning> warnings = new ArrayList<>();
        private int blankRowsSkipped;
        private int lastRowIndex;

        private Builder(SourceFormat format, String contentHash, List<String> header) {
            this.format = format;
            this.contentHash = contentHash;
            this.header = List.copyOf(header);
        }

        public Builder accept(ValidatedRecord record) {
            advanceTo(record.getRowIndex());
            records.add(record);
            return this;
        }

        public Builder reject(int rowIndex, List<FieldError> errors, Map<String, Object> rawValues) {
            if (errors.isEmpty()) {
                throw new IllegalArgumentException("A rejected row needs at least one error (row " + rowIndex + ")");
            }
            advanceTo(rowIndex);
            rejections.add(new RowRejection(rowIndex, List.copyOf(errors), Collections.unmodifiableMap(new LinkedHashMap<>(rawValues))));
            return this;
        }

        public Builder unknownColumns(List<String> unknownColumns) {
            this.unknownColumns = List.copyOf(unknownColumns);
            return this;
        }

        /**
         * Appends warnings; call with file-level warnings before adding rows to keep them first.
         */
        public Builder warnings(List<FieldWarning> warnings) {
            this.warnings.addAll(warnings);
            return this;
        }

        public Builder blankRowsSkipped(int blankRowsSkipped) {
            this.blankRowsSkipped = blankRowsSkipped;
            return this;
        }

        public ValidationReport build() {
            return new ValidationReport(format, contentHash, header, List.copyOf(records), List.copyOf(rejections),
                    null, unknownColumns, List.copyOf(warnings), blankRowsSkipped);
        }

        private void advanceTo(int rowIndex) {
            if (rowIndex <= lastRowIndex) {
                throw new IllegalStateException("Row " + rowIndex + " added after row " + lastRowIndex);
            }
            lastRowIndex = rowIndex;
        }
    }
}
