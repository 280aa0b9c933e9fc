package infra.output;

import domain.model.FormatResult;
import domain.model.FormatWarning;
import domain.model.WarningCode;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class XlsxResultWriterTest {

    @TempDir
    Path tmp;

    @Test
    void should_write_result_and_warning_sheets() throws Exception {
        Path xlsx = tmp.resolve("report/result.xlsx");
        List<FormatResult> results = Arrays.asList(
                FormatResult.success("q1", "sql", "select 1", "SELECT\n  1", 4L),
                FormatResult.skip("q2", "", "empty sql"));
        List<FormatWarning> warnings = Collections.singletonList(
                new FormatWarning(WarningCode.SQL_TEXT_EMPTY, "q2", "empty sql", "row 2"));

        new XlsxResultWriter().write(xlsx, results, warnings);

        try (InputStream in = Files.newInputStream(xlsx); Workbook wb = new XSSFWorkbook(in)) {
            Sheet result = wb.getSheet("result");
            assertNotNull(result);
            assertEquals(2, result.getLastRowNum());

            Row header = result.getRow(0);
            for (int i = 0; i < XlsxResultWriter.RESULT_HEADERS.length; i++) {
                assertEquals(XlsxResultWriter.RESULT_HEADERS[i], header.getCell(i).getStringCellValue());
            }

            Row first = result.getRow(1);
            assertEquals("SUCCESS", first.getCell(0).getStringCellValue());
            assertEquals("q1", first.getCell(1).getStringCellValue());
            assertEquals(2.0, first.getCell(4).getNumericCellValue());
            assertTrue(first.getCell(5).getBooleanCellValue());

            assertEquals("empty sql", result.getRow(2).getCell(7).getStringCellValue());

            Sheet warn = wb.getSheet("warnings");
            assertEquals("SQL_TEXT_EMPTY", warn.getRow(1).getCell(0).getStringCellValue());
            assertEquals("row 2", warn.getRow(1).getCell(3).getStringCellValue());
        }
    }

    @Test
    void should_reject_null_arguments() {
        XlsxResultWriter w = new XlsxResultWriter();
        Path xlsx = tmp.resolve("r.xlsx");

        assertThrows(IllegalArgumentException.class, () -> w.write(null, Collections.emptyList(), Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> w.write(xlsx, null, Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> w.write(xlsx, Collections.emptyList(), null));
    }
}
