package infra.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileSqlOutputWriterTest {

    @TempDir
    Path tmp;

    @Test
    void should_write_named_file_with_trailing_newline() throws Exception {
        Path outDir = tmp.resolve("out/nested");

        new FileSqlOutputWriter().write(outDir, "orders/findAll", "SELECT\n  1");

        Path written = outDir.resolve("orders_findAll.sql");
        assertTrue(Files.exists(written));
        assertEquals("SELECT\n  1\n", Files.readString(written, StandardCharsets.UTF_8));
    }

    @Test
    void should_not_double_trailing_newline() throws Exception {
        new FileSqlOutputWriter().write(tmp, "q.sql", "SELECT 1\n");
        assertEquals("SELECT 1\n", Files.readString(tmp.resolve("q.sql"), StandardCharsets.UTF_8));
    }

    @Test
    void should_reject_missing_out_dir() {
        assertThrows(IllegalArgumentException.class, () -> new FileSqlOutputWriter().write(null, "q", "x"));
    }
}
