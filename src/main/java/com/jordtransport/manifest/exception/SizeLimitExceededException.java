package com.jordtransport.manifest.exception;

public class SizeLimitExceededException extends ManifestImportException {

    public SizeLimitExceededException(String message) {
        super(FatalErrorCode.SIZE_LIMIT_EXCEEDED, message);
    }
}
