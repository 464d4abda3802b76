package com.jordtransport.manifest.exception;

public abstract class ManifestImportException extends RuntimeException {

    private final FatalErrorCode code;

    protected ManifestImportException(FatalErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected ManifestImportException(FatalErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public FatalErrorCode getCode() {
        return code;
    }
}
