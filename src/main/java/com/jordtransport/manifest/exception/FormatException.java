package com.jordtransport.manifest.exception;

/**
 * The uploaded bytes could not be decoded as the declared format, or decoded to nothing usable.
 */
public class FormatException extends ManifestImportException {

    public FormatException(String message) {
        super(FatalErrorCode.FORMAT_ERROR, message);
    }

    public FormatException(String message, Throwable cause) {
        super(FatalErrorCode.FORMAT_ERROR, message, cause);
    }
}
