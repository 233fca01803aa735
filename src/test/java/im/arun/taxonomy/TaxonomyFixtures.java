package im.arun.taxonomy;

import im.arun.taxonomy.model.TaxonomyRow;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared rows and workbooks for tests.
 */
public final class TaxonomyFixtures {

    public static final String SHEET = "Taxonomy ITI";
    public static final String GENERAL = "General information about financial statements";
    public static final String POSITION = "Statement of financial position, current/non-current";

    private TaxonomyFixtures() {
    }

    /** A cleaned row without group information. */
    public static TaxonomyRow row(int excelRow, int indent, String conceptName, String label) {
        return TaxonomyRow.builder()
            .excelRow(excelRow)
            .conceptName(conceptName)
            .preferredLabel(label)
            .label(label)
            .indent(indent)
            .type("X")
            .build();
    }

    /** A cleaned row inside a group. */
    public static TaxonomyRow row(int excelRow, int indent, String conceptName, String label,
                                  String groupCode, String groupName) {
        return row(excelRow, indent, conceptName, label).toBuilder()
            .groupCode(groupCode)
            .groupName(groupName)
            .build();
    }

    /**
     * Sheet rows: concept name, preferred label, indent, type, standard label.
     * Mirrors the layout of the taxonomy listing: header rows carry the group in the concept name.
     */
    public static List<Object[]> sampleSheet() {
        return List.of(
            new Object[]{"[110000] " + GENERAL, GENERAL, 0, null, null},
            new Object[]{"ifrs-full:DisclosureOfGeneralInformationAbstract",
                "Disclosure of general information [abstract]", 0, null, null},
            new Object[]{"ifrs-full:NameOfReportingEntity", "Name of reporting entity", 1, "text", "Name of reporting entity"},
            new Object[]{"ifrs-full:ExplanationOfChangeInName", "Explanation of change in name", 1, "text", null},
            new Object[]{"[210000] " + POSITION, "Statement of financial position [abstract]", 0, null, null},
            new Object[]{"ifrs-full:Assets", "Assets", 1, "X instant, debit", "Assets"},
            new Object[]{"ifrs-full:NoncurrentAssets", "Non-current assets", 2, "X instant, debit", null},
            new Object[]{"ifrs-full:CurrentAssets", "  Current assets  ", 2, "X instant, debit", null}
        );
    }

    /** Sample sheet plus a second "Current assets" under Liabilities, which repeats a full path. */
    public static List<Object[]> sheetWithDuplicatePath() {
        List<Object[]> rows = new ArrayList<>(sampleSheet());
        rows.add(new Object[]{"ifrs-full:Liabilities", "Liabilities", 1, "X instant, credit", null});
        rows.add(new Object[]{"ifrs-full:CurrentAssetsHeldForSale", "Current assets", 2, "X instant, debit", null});
        return rows;
    }

    public static Workbook workbook(List<Object[]> rows) {
        Workbook workbook = new XSSFWorkbook();
        Sheet sheet = workbook.createSheet(SHEET);
        Row header = sheet.createRow(0);
        String[] headers = {"Concept name", "Preferred label", "Type", "Standard label"};
        for (int i = 0; i < headers.length; i++) {
            header.createCell(i).setCellValue(headers[i]);
        }

        Map<Integer, CellStyle> indentStyles = new HashMap<>();
        for (int r = 0; r < rows.size(); r++) {
            Object[] values = rows.get(r);
            Row row = sheet.createRow(r + 1);
            row.createCell(0).setCellValue((String) values[0]);

            int indent = (Integer) values[2];
            CellStyle style = indentStyles.computeIfAbsent(indent, level -> {
                CellStyle s = workbook.createCellStyle();
                s.setIndention(level.shortValue());
                return s;
            });
            row.createCell(1).setCellValue((String) values[1]);
            row.getCell(1).setCellStyle(style);

            if (values[3] != null) {
                row.createCell(2).setCellValue((String) values[3]);
            }
            if (values[4] != null) {
                row.createCell(3).setCellValue((String) values[4]);
            }
        }
        return workbook;
    }

    public static Path writeWorkbook(Path file, List<Object[]> rows) throws IOException {
        Files.createDirectories(file.getParent());
        try (Workbook workbook = workbook(rows);
             OutputStream out = Files.newOutputStream(file)) {
            workbook.write(out);
        }
        return file;
    }
}
