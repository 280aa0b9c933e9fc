package infra.text;

import domain.text.SqlSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvSqlSourceLoaderTest {

    @TempDir
    Path tmp;

    @Test
    void should_load_rows_with_header_aliases_and_bom() throws Exception {
        Path csv = tmp.resolve("in.csv");
        String body = "\uFEFFSQL_ID,Query,Dialect\n"
                + "q1,\"select a,\n b from t\",mysql\n"
                + ",,\n"
                + ",select 2,\n";
        Files.writeString(csv, body, StandardCharsets.UTF_8);

        List<SqlSource> rows = new CsvSqlSourceLoader().load(csv.toString());

        assertEquals(2, rows.size());
        assertEquals("q1", rows.get(0).getId());
        assertEquals("select a,\n b from t", rows.get(0).getSqlText());
        assertEquals("mysql", rows.get(0).getLanguageTag());
        assertTrue(rows.get(0).hasLanguageTag());

        assertEquals("row3", rows.get(1).getId());
        assertFalse(rows.get(1).hasLanguageTag());
    }

    @Test
    void should_load_from_classpath() {
        List<SqlSource> rows = new CsvSqlSourceLoader().load("classpath:fixtures/batch.csv");

        assertEquals(3, rows.size());
        assertEquals("users.find", rows.get(0).getId());
        assertTrue(rows.get(2).isBlank());
    }

    @Test
    void should_require_sql_column() throws Exception {
        Path csv = tmp.resolve("bad.csv");
        Files.writeString(csv, "id,text\nq1,select 1\n", StandardCharsets.UTF_8);

        assertThrows(IllegalArgumentException.class, () -> new CsvSqlSourceLoader().load(csv.toString()));
    }

    @Test
    void should_fail_for_missing_file() {
        assertThrows(IllegalStateException.class,
                () -> new CsvSqlSourceLoader().load(tmp.resolve("none.csv").toString()));
        assertThrows(IllegalArgumentException.class, () -> new CsvSqlSourceLoader().load(" "));
    }
}
