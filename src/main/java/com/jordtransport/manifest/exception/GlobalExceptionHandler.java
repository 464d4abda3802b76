package com.jordtransport.manifest.exception;

import com.jordtransport.manifest.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.io.IOException;

@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing request parameter: {}", e.getParameterName());
        return build(HttpStatus.BAD_REQUEST, "Parameteren '" + e.getParameterName() + "' mangler", "INVALID_REQ");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for '{}': {}", e.getName(), e.getValue());
        return build(HttpStatus.BAD_REQUEST, "Ugyldig værdi for '" + e.getName() + "': " + e.getValue(), "INVALID_REQ");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleBadInput(IllegalArgumentException e) {
        log.warn("Invalid Input: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e.getMessage(), "INVALID_INPUT");
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ApiResponse<Void>> handleIo(IOException e) {
        log.error("Upload could not be read", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Filen kunne ikke læses", "UPLOAD_FAIL");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneralError(Exception e) {
        log.error("Internal Server Error: ", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "IMPORT_FAIL");
    }

    private ResponseEntity<ApiResponse<Void>> build(HttpStatus status, String message, String errorCode) {
        return ResponseEntity.status(status).body(ApiResponse.error(message, errorCode));
    }
}
