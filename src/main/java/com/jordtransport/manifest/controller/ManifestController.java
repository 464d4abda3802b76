package com.jordtransport.manifest.controller;

import com.jordtransport.manifest.dto.ApiResponse;
import com.jordtransport.manifest.dto.ValidationReport;
import com.jordtransport.manifest.parser.SourceFormat;
import com.jordtransport.manifest.reference.Facility;
import com.jordtransport.manifest.reference.ReferenceDirectory;
import com.jordtransport.manifest.schema.SchemaDefinition;
import com.jordtransport.manifest.service.ManifestImportService;
import com.jordtransport.manifest.service.RejectionWorkbookWriter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/manifest")
@RequiredArgsConstructor
public class ManifestController {

    static final MediaType XLSX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final ManifestImportService importService;
    private final RejectionWorkbookWriter rejectionWorkbookWriter;
    private final SchemaDefinition schemaDefinition;
    private final ReferenceDirectory referenceDirectory;

    /**
     * Accepts the manifest as the raw request body.
     * Usage in Postman:
     * 1. Method: POST
     * 2. Body -> Binary -> Select File
     * 3. Params -> Key: filename, Value: your_file.xlsx (or .csv)
     */
    @PostMapping(value = "/import", consumes = "*/*")
    public ResponseEntity<ApiResponse<ValidationReport>> importManifest(
            HttpServletRequest request,
            @RequestParam("filename") String filename,
            @RequestParam(value = "format", required = false) SourceFormat format
    ) throws IOException {
        if (isMultipart(request)) {
            return ResponseEntity.badRequest().body(multipartError());
        }

        ValidationReport report = importService.importManifest(request.getInputStream(), filename, format);

        if (report.isFatal()) {
            return ResponseEntity.unprocessableEntity().body(ApiResponse.error(
                    report.getFatalError().getMessage(), report.getFatalError().getCode().name(), report));
        }
        String message = report.getAcceptedCount() + " række(r) godkendt, " + report.getRejectedCount() + " afvist";
        return ResponseEntity.ok(ApiResponse.success(message, report));
    }

    /**
     * Same upload as {@link #importManifest}, answered with an .xlsx of the rejected rows and their reasons.
     */
    @PostMapping(value = "/import/rejections", consumes = "*/*")
    public ResponseEntity<?> downloadRejections(
            HttpServletRequest request,
            @RequestParam("filename") String filename,
            @RequestParam(value = "format", required = false) SourceFormat format
    ) throws IOException {
        if (isMultipart(request)) {
            return ResponseEntity.badRequest().body(multipartError());
        }

        ValidationReport report = importService.importManifest(request.getInputStream(), filename, format);

        if (report.isFatal()) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(ApiResponse.error(
                    report.getFatalError().getMessage(), report.getFatalError().getCode().name(), report));
        }
        if (report.getRejectedCount() == 0) {
            return ResponseEntity.noContent().build();
        }

        byte[] workbook = rejectionWorkbookWriter.write(report);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(errorFileName(filename), StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .contentType(XLSX)
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(workbook);
    }

    @GetMapping("/schema")
    public ResponseEntity<ApiResponse<SchemaDefinition>> schema() {
        return ResponseEntity.ok(ApiResponse.success("Kolonneskema " + schemaDefinition.getVersion(), schemaDefinition));
    }

    @GetMapping("/facilities")
    public ResponseEntity<ApiResponse<List<Facility>>> facilities() {
        return ResponseEntity.ok(ApiResponse.success("Modtageranlæg " + referenceDirectory.getVersion(),
                List.copyOf(referenceDirectory.getFacilities())));
    }

    private boolean isMultipart(HttpServletRequest request) {
        String contentType = request.getContentType();
        return contentType != null && contentType.toLowerCase().contains("multipart/form-data");
    }

    private <T> ApiResponse<T> multipartError() {
        return ApiResponse.error("Incorrect Upload Method. Send the file as the raw request body, not as 'form-data'.",
                "INVALID_REQ");
    }

    static String errorFileName(String filename) {
        String base = filename == null ? "manifest" : filename.trim();
        int dot = base.lastIndexOf('.');
        if (dot > 0) base = base.substring(0, dot);
        if (base.isEmpty()) base = "manifest";
        return base + "_fejl.xlsx";
    }
}
