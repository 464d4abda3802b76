package com.jordtransport.manifest.exception;

import java.util.List;

public class MissingColumnsException extends ManifestImportException {

    private final List<String> missingColumns;

    public MissingColumnsException(List<String> missingColumns) {
        super(FatalErrorCode.MISSING_COLUMNS,
                "Manglende obligatoriske kolonner: " + String.join(", ", missingColumns));
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
