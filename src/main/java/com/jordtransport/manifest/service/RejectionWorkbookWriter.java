package com.jordtransport.manifest.service;

import com.jordtransport.manifest.dto.RowRejection;
import com.jordtransport.manifest.dto.ValidationReport;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Writes the rejected rows of a report back out as an .xlsx error dump: the uploaded columns as they were
 * read, followed by the reasons and the original row number, so the uploader can fix the rows and re-upload.
 */
@Slf4j
@Service
public class RejectionWorkbookWriter {

    public static final String SHEET_NAME = "Afviste rækker";
    public static final String ERROR_COLUMN = "ERROR_DETAILS";
    public static final String ROW_COLUMN = "ORIGINAL_ROW";

    public byte[] write(ValidationReport report) throws IOException {
        if (report.isFatal()) {
            throw new IllegalArgumentException("A fatal report has no rows to write: " + report.getFatalError().getMessage());
        }
        List<String> headers = report.getHeader();

        try (SXSSFWorkbook workbook = new SXSSFWorkbook(100)) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);
            CellStyle headerStyle = createHeaderStyle(workbook);
            CellStyle errorStyle = createErrorStyle(workbook);

            Row headerRow = sheet.createRow(0);
            for (int i = 0; i < headers.size(); i++) {
                createCell(headerRow, i, headers.get(i), headerStyle);
            }
            createCell(headerRow, headers.size(), ERROR_COLUMN, headerStyle);
            createCell(headerRow, headers.size() + 1, ROW_COLUMN, headerStyle);

            int rowIdx = 1;
            for (RowRejection rejection : report.getRejections()) {
                Row row = sheet.createRow(rowIdx++);
                for (int i = 0; i < headers.size(); i++) {
                    setCellValue(row.createCell(i), rejection.getRawValues().get(headers.get(i)));
                }
                createCell(row, headers.size(), rejection.getErrorMessage(), errorStyle);
                row.createCell(headers.size() + 1).setCellValue(rejection.getRowIndex());
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            workbook.dispose();
            log.debug("Wrote error dump with {} rejected row(s)", report.getRejectedCount());
            return out.toByteArray();
        }
    }

    private void createCell(Row row, int column, String value, CellStyle style) {
        Cell cell = row.createCell(column);
        cell.setCellValue(value);
        cell.setCellStyle(style);
    }

    private void setCellValue(Cell cell, Object value) {
        if (value instanceof Number) cell.setCellValue(((Number) value).doubleValue());
        else if (value != null) cell.setCellValue(value.toString());
    }

    private CellStyle createHeaderStyle(SXSSFWorkbook wb) {
        CellStyle header = wb.createCellStyle();
        Font headerFont = wb.createFont();
        headerFont.setBold(true);
        header.setFont(headerFont);
        header.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        header.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        return header;
    }

    private CellStyle createErrorStyle(SXSSFWorkbook wb) {
        CellStyle errStyle = wb.createCellStyle();
        Font font = wb.createFont();
        font.setColor(IndexedColors.RED.getIndex());
        errStyle.setFont(font);
        return errStyle;
    }
}
