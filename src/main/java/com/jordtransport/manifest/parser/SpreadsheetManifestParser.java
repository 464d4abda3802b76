package com.jordtransport.manifest.parser;

import com.jordtransport.manifest.exception.FormatException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EmptyFileException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.openxml4j.exceptions.OpenXML4JRuntimeException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.util.RecordFormatException;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads .xlsx manifests with Apache POI.
 * <p>
 * The template carries an instruction sheet and a facility reference sheet next to the data sheet; only the
 * data sheet is read. It is found by name, falling back to the first visible sheet for files that were
 * rebuilt by hand.
 */
@Slf4j
public class SpreadsheetManifestParser implements ManifestParser {

    private final String dataSheetName;

    public SpreadsheetManifestParser(String dataSheetName) {
        this.dataSheetName = dataSheetName;
    }

    @Override
    public SourceFormat getFormat() {
        return SourceFormat.SPREADSHEET;
    }

    @Override
    public ParsedManifest parse(byte[] content) {
        try (XSSFWorkbook workbook = openWorkbook(content)) {
            Sheet sheet = selectDataSheet(workbook);
            log.debug("Reading sheet '{}' ({} physical rows)", sheet.getSheetName(), sheet.getPhysicalNumberOfRows());

            int headerRowNum = sheet.getFirstRowNum();
            Row headerRow = headerRowNum < 0 ? null : sheet.getRow(headerRowNum);
            if (headerRow == null) {
                throw new FormatException("Arket '" + sheet.getSheetName() + "' er tomt");
            }

            RawRowCollector collector = new RawRowCollector(readCells(headerRow, headerRow.getLastCellNum()));
            int width = Math.max(headerRow.getLastCellNum(), 0);

            for (int i = headerRowNum + 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                List<Object> cells = row == null ? List.of() : readCells(row, width);
                collector.add(i - headerRowNum, cells);
            }
            return collector.build();
        } catch (IOException e) {
            throw unreadable(e);
        }
    }

    /**
     * POI reports a non-zip, empty or truncated package through several exception types; all of them mean the
     * upload is not a usable .xlsx file. Anything else thrown while reading is a bug and propagates.
     */
    private XSSFWorkbook openWorkbook(byte[] content) {
        try {
            return new XSSFWorkbook(new ByteArrayInputStream(content));
        } catch (IOException | POIXMLException | OpenXML4JRuntimeException | UnsupportedFileFormatException
                 | EmptyFileException | RecordFormatException e) {
            throw unreadable(e);
        }
    }

    private FormatException unreadable(Exception e) {
        return new FormatException("Filen kunne ikke læses som et Excel-regneark (.xlsx): " + e.getMessage(), e);
    }

    private Sheet selectDataSheet(Workbook workbook) {
        if (workbook.getNumberOfSheets() == 0) {
            throw new FormatException("Regnearket indeholder ingen ark");
        }
        Sheet named = dataSheetName == null ? null : workbook.getSheet(dataSheetName);
        if (named != null) return named;

        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            if (!workbook.isSheetHidden(i) && !workbook.isSheetVeryHidden(i)) {
                return workbook.getSheetAt(i);
            }
        }
        return workbook.getSheetAt(0);
    }

    private List<Object> readCells(Row row, int width) {
        List<Object> cells = new ArrayList<>(Math.max(width, 0));
        for (int j = 0; j < width; j++) {
            cells.add(getCellValue(row.getCell(j)));
        }
        return cells;
    }

    private Object getCellValue(Cell cell) {
        if (cell == null) return null;
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate().toString();
                }
                return cell.getNumericCellValue();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            case ERROR:
                byte code = cell.getErrorCellValue();
                return FormulaError.isValidCode(code) ? FormulaError.forInt(code).getString() : "#ERROR!";
            default:
                return null;
        }
    }
}
