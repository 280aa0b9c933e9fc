package infra.output;

import domain.model.FormatResult;
import domain.model.FormatWarning;
import domain.output.ResultWriter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * XLSX batch report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>result: SUCCESS/SKIP/ERROR per input</li>
 *   <li>warnings: non-fatal warnings (standard codes)</li>
 * </ul>
 */
public final class XlsxResultWriter implements ResultWriter {

    static final String[] RESULT_HEADERS = {
            "status", "id", "language", "inputLines", "outputLines", "changed", "elapsedMs", "message"
    };

    static final String[] WARNING_HEADERS = {"code", "id", "message", "detail"};

    private static void writeHeader(Sheet sh, String[] headers) {
        Row header = sh.createRow(0);
        for (int i = 0; i < headers.length; i++) {
            header.createCell(i)
                    .setCellValue(headers[i]);
        }
    }

    private static void writeResultSheet(Workbook wb, List<FormatResult> results) {
        Sheet sh = wb.createSheet("result");
        writeHeader(sh, RESULT_HEADERS);

        int r = 1;
        for (FormatResult it : results) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(it.getStatus());
            row.createCell(1)
                    .setCellValue(it.getSqlId());
            row.createCell(2)
                    .setCellValue(it.getLanguage());
            row.createCell(3)
                    .setCellValue(it.getInputLines());
            row.createCell(4)
                    .setCellValue(it.getOutputLines());
            row.createCell(5)
                    .setCellValue(it.isChanged());
            row.createCell(6)
                    .setCellValue(it.getElapsedMs());
            row.createCell(7)
                    .setCellValue(it.getMessage());
        }
    }

    private static void writeWarningsSheet(Workbook wb, List<FormatWarning> warnings) {
        Sheet sh = wb.createSheet("warnings");
        writeHeader(sh, WARNING_HEADERS);

        int r = 1;
        for (FormatWarning w : warnings) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(w.getCode().name());
            row.createCell(1)
                    .setCellValue(w.getSqlId());
            row.createCell(2)
                    .setCellValue(w.getMessage());
            row.createCell(3)
                    .setCellValue(w.getDetail());
        }
    }

    @Override
    public void write(Path resultXlsx, List<FormatResult> results, List<FormatWarning> warnings) {
        if (resultXlsx == null) throw new IllegalArgumentException("resultXlsx is null");
        if (results == null) throw new IllegalArgumentException("results is null");
        if (warnings == null) throw new IllegalArgumentException("warnings is null");

        try {
            Path parent = resultXlsx.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create resultXlsx parent dir: " + resultXlsx, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeResultSheet(wb, results);
            writeWarningsSheet(wb, warnings);

            try (OutputStream os = Files.newOutputStream(resultXlsx)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + resultXlsx, e);
        }
    }
}
