package app;

import domain.dialect.Language;
import domain.format.FormatConfig;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SqlFmtCliAppTest {

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        InputStream in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        PrintStream out = new PrintStream(outBuf, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBuf, true, StandardCharsets.UTF_8);
        return SqlFmtCliApp.run(args, in, out, err);
    }

    private String out() {
        return outBuf.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String err() {
        return errBuf.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String baseDir() {
        return "--baseDir=" + tmp;
    }

    @Test
    void should_format_stdin_to_stdout() {
        int code = run("select a from t", "format", baseDir(), "--noConfig", "--uppercase");

        assertEquals(SqlFmtCliApp.EXIT_OK, code);
        assertEquals("SELECT\n  a\nFROM\n  t\n", out());
    }

    @Test
    void should_apply_config_file_below_cli_options() throws Exception {
        Files.createDirectories(tmp.resolve(".git"));
        Files.writeString(tmp.resolve(".sqlfmtrc"), "indent: 4\nkeyword_case: upper\n", StandardCharsets.UTF_8);

        assertEquals(0, run("select a from t", "format", baseDir()));
        assertEquals("SELECT\n    a\nFROM\n    t\n", out());
        assertTrue(err().contains("[CONF] config"), err());

        outBuf.reset();
        assertEquals(0, run("select a from t", "format", baseDir(), "--indent=1"));
        assertEquals("SELECT\n a\nFROM\n t\n", out());
    }

    @Test
    void should_fail_check_for_unformatted_file() throws Exception {
        Files.writeString(tmp.resolve("ok.sql"), "SELECT\n  1\n", StandardCharsets.UTF_8);
        Files.writeString(tmp.resolve("bad.sql"), "SELECT 1 FROM t", StandardCharsets.UTF_8);

        assertEquals(SqlFmtCliApp.EXIT_OK, run("", "check", baseDir(), "--noConfig", "ok.sql"));

        outBuf.reset();
        int code = run("", "check", baseDir(), "--noConfig", ".");
        assertEquals(SqlFmtCliApp.EXIT_CHECK_FAILED, code);
        assertTrue(out().contains("bad.sql is not formatted"), out());
        assertTrue(out().contains("[STAT] checked=2, unformatted=1"), out());
    }

    @Test
    void should_skip_ignored_files() throws Exception {
        Files.createDirectories(tmp.resolve("gen"));
        Files.writeString(tmp.resolve("gen/raw.sql"), "select 1", StandardCharsets.UTF_8);
        Files.writeString(tmp.resolve(".sqlfmtignore"), "gen/\n", StandardCharsets.UTF_8);

        assertEquals(SqlFmtCliApp.EXIT_OK, run("", "check", baseDir(), "--noConfig", "."));
        assertTrue(err().contains("[SKIP] ignored"), err());
    }

    @Test
    void should_rewrite_changed_files_in_place() throws Exception {
        Path file = tmp.resolve("q.sql");
        Files.writeString(file, "select a from t", StandardCharsets.UTF_8);

        assertEquals(SqlFmtCliApp.EXIT_OK, run("", "format", baseDir(), "--noConfig", "--write", "q.sql"));

        assertEquals("select\n  a\nfrom\n  t\n", Files.readString(file, StandardCharsets.UTF_8));
        assertTrue(err().contains("[WRITE]"), err());
        assertEquals("", out());
    }

    @Test
    void should_list_dialects() {
        assertEquals(SqlFmtCliApp.EXIT_OK, run("", "dialects"));
        assertTrue(out().contains("postgresql"));
        assertTrue(out().contains("pl/sql"));
        assertEquals(Language.values().length, out().trim().split("\n").length);
    }

    @Test
    void should_return_usage_code_for_bad_invocations() {
        assertEquals(SqlFmtCliApp.EXIT_USAGE, run(""));
        assertEquals(SqlFmtCliApp.EXIT_USAGE, run("", "reformat"));
        assertTrue(err().contains("unknown command"));

        errBuf.reset();
        assertEquals(SqlFmtCliApp.EXIT_USAGE, run("", "format", "--noConfig", "--lang=cobol"));
        assertTrue(err().startsWith("[ERROR]"), err());

        assertEquals(SqlFmtCliApp.EXIT_USAGE, run("", "batch", "--noConfig"));
        assertEquals(SqlFmtCliApp.EXIT_OK, run("", "--help"));
    }

    @Test
    void should_format_batch_csv_and_write_report() throws Exception {
        String csv = "id,sql,lang\n"
                + "q1,select a from t,\n"
                + "q2,  ,\n"
                + "q3,select x::int from t,postgresql\n"
                + "q4,select 1,klingon\n";
        Files.writeString(tmp.resolve("in.csv"), csv, StandardCharsets.UTF_8);

        int code = run("", "batch", baseDir(), "--noConfig", "--csv=in.csv", "--out=out", "--result=report/r.xlsx",
                "--slowMs=600000");

        assertEquals(SqlFmtCliApp.EXIT_OK, code, out());
        assertEquals("select\n  a\nfrom\n  t\n", Files.readString(tmp.resolve("out/q1.sql"), StandardCharsets.UTF_8));
        assertFalse(Files.exists(tmp.resolve("out/q2.sql")));
        assertTrue(out().contains("[STAT] success=3, skip=1"), out());

        try (InputStream in = Files.newInputStream(tmp.resolve("report/r.xlsx")); Workbook wb = new XSSFWorkbook(in)) {
            Sheet result = wb.getSheet("result");
            assertEquals(4, result.getLastRowNum());
            assertEquals("SKIP", result.getRow(2).getCell(0).getStringCellValue());
            assertEquals("postgresql", result.getRow(3).getCell(2).getStringCellValue());

            Sheet warnings = wb.getSheet("warnings");
            assertEquals("SQL_TEXT_EMPTY", warnings.getRow(1).getCell(0).getStringCellValue());
            assertEquals("LANGUAGE_UNKNOWN", warnings.getRow(2).getCell(0).getStringCellValue());
        }
    }

    @Test
    void should_stop_batch_on_first_error_with_fail_fast() throws Exception {
        Files.writeString(tmp.resolve("in.csv"), "id,sql\nq1,select 1\nq2,select 2\n", StandardCharsets.UTF_8);
        Files.writeString(tmp.resolve("blocked"), "not a directory", StandardCharsets.UTF_8);

        int code = run("", "batch", baseDir(), "--noConfig", "--csv=in.csv", "--out=blocked", "--noResult", "--failFast");

        assertEquals(SqlFmtCliApp.EXIT_CHECK_FAILED, code);
        assertTrue(out().contains("[FAILFAST]"), out());
        assertTrue(out().contains("[STAT] success=0, skip=1"), out());
    }

    @Test
    void should_build_config_from_cli_options() {
        Map<String, String> argv = new HashMap<>();
        argv.put("noConfig", "");
        argv.put("lang", "mysql");
        argv.put("indent", "tab");
        argv.put("alignColumns", "");
        argv.put("linesBetween", "1");

        FormatConfig cfg = SqlFmtCliApp.buildConfig(argv, tmp, new SqlFmtComponentsFactory(),
                new PrintStream(errBuf, true, StandardCharsets.UTF_8));

        assertEquals(Language.MYSQL, cfg.getLanguage());
        assertEquals("\t", cfg.getIndent());
        assertTrue(cfg.isAlignColumnNames());
        assertEquals(1, cfg.getLinesBetweenQueries());
    }

    @Test
    void should_ignore_trailing_newline_when_comparing() {
        assertTrue(SqlFmtCliApp.isFormatted("SELECT\r\n  1\r\n", "SELECT\n  1"));
        assertFalse(SqlFmtCliApp.isFormatted("SELECT 1", "SELECT\n  1"));
        assertEquals("  ", SqlFmtCliApp.parseIndent("2"));
    }

    @Test
    void should_detect_dialect_from_file_name() {
        String sql = "select `a` from t";
        String formatted = SqlFmtCliApp.formatText(sql, tmp.resolve("q.pgsql"), FormatConfig.defaults(), true, false);
        assertEquals("select\n  `a`\nfrom\n  t", formatted);
    }
}
