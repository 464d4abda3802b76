package com.jordtransport.manifest.exception;

/**
 * File-level defects. Any of these aborts the import before a single row is validated.
 */
public enum FatalErrorCode {
    FORMAT_ERROR,
    SIZE_LIMIT_EXCEEDED,
    MISSING_COLUMNS
}
