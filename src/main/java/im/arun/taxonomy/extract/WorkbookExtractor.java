package im.arun.taxonomy.extract;

import im.arun.taxonomy.exception.InputDataException;
import im.arun.taxonomy.model.HierarchyColumns;
import im.arun.taxonomy.model.TaxonomyRow;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spreadsheet extractor using Apache POI.
 * Reads the taxonomy sheet into rows, taking the indent depth from the label cell's alignment.
 */
public class WorkbookExtractor {
    private static final Logger logger = LoggerFactory.getLogger(WorkbookExtractor.class);

    private final DataFormatter formatter = new DataFormatter();

    /**
     * Extract rows from a workbook file.
     *
     * @param workbookPath  Path to the .xlsx/.xls file
     * @param sheetName     Sheet holding the taxonomy listing
     * @param optionalCols  Descriptive columns to carry through, null where absent
     * @return Rows in sheet order
     */
    public List<TaxonomyRow> extractRows(Path workbookPath, String sheetName, List<String> optionalCols) {
        if (workbookPath == null || !Files.isRegularFile(workbookPath)) {
            throw new InputDataException("Input data file not found",
                Map.of("input_file", String.valueOf(workbookPath)));
        }
        try (InputStream in = Files.newInputStream(workbookPath);
             Workbook workbook = WorkbookFactory.create(in)) {
            List<TaxonomyRow> rows = extractRows(workbook, sheetName, optionalCols);
            logger.info("Data loaded from {} with {} rows.", workbookPath, rows.size());
            return rows;
        } catch (InputDataException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new InputDataException("Failed to read workbook",
                Map.of("input_file", workbookPath.toString()), e);
        }
    }

    /**
     * Extract rows from an already opened workbook.
     */
    public List<TaxonomyRow> extractRows(Workbook workbook, String sheetName, List<String> optionalCols) {
        Sheet sheet = workbook.getSheet(sheetName);
        if (sheet == null) {
            throw new InputDataException("Sheet not found in workbook", Map.of("sheet_name", sheetName));
        }

        Row headerRow = sheet.getRow(sheet.getFirstRowNum());
        Map<String, Integer> headers = readHeaders(headerRow);

        Integer labelIdx = headers.get(HierarchyColumns.PREFERRED_LABEL);
        if (labelIdx == null) {
            throw new InputDataException("Required column is missing",
                Map.of("sheet_name", sheetName, "column", HierarchyColumns.PREFERRED_LABEL));
        }
        Integer conceptIdx = headers.get(HierarchyColumns.CONCEPT_NAME);
        Integer typeIdx = headers.get(HierarchyColumns.TYPE);

        Map<String, Integer> optionalIdx = new LinkedHashMap<>();
        for (String col : optionalCols) {
            Integer idx = headers.get(col);
            if (idx == null) {
                logger.debug("Optional column '{}' not present in sheet '{}'", col, sheetName);
            }
            optionalIdx.put(col, idx);
        }

        List<TaxonomyRow> rows = new ArrayList<>();
        for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            Cell labelCell = row.getCell(labelIdx);

            Map<String, String> attributes = new LinkedHashMap<>();
            optionalIdx.forEach((col, idx) -> attributes.put(col, idx == null ? null : cellText(row, idx)));

            rows.add(TaxonomyRow.builder()
                .excelRow(r + 1)
                .conceptName(conceptIdx == null ? null : cellText(row, conceptIdx))
                .preferredLabel(labelCell == null ? null : cellText(row, labelIdx))
                .indent(labelCell == null ? 0 : labelCell.getCellStyle().getIndention())
                .type(typeIdx == null ? null : cellText(row, typeIdx))
                .attributes(Collections.unmodifiableMap(attributes))
                .build());
        }
        return rows;
    }

    private Map<String, Integer> readHeaders(Row headerRow) {
        Map<String, Integer> headers = new HashMap<>();
        if (headerRow == null) {
            return headers;
        }
        for (Cell cell : headerRow) {
            String name = formatter.formatCellValue(cell).trim();
            if (!name.isEmpty()) {
                headers.putIfAbsent(name, cell.getColumnIndex());
            }
        }
        return headers;
    }

    /**
     * Cell value as text, or null for missing and blank cells.
     */
    private String cellText(Row row, int idx) {
        Cell cell = row.getCell(idx);
        if (cell == null || cell.getCellType() == CellType.BLANK) {
            return null;
        }
        return formatter.formatCellValue(cell);
    }
}
