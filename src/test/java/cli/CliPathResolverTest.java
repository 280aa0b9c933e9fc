package cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliPathResolverTest {

    @TempDir
    Path tmp;

    @Test
    void should_resolve_relative_path_against_base_dir() {
        Path base = CliPathResolver.resolveBaseDir(Map.of("baseDir", tmp.toString()));

        assertEquals(tmp.toAbsolutePath().normalize(), base);
        assertEquals(base.resolve("a/b.sql"), CliPathResolver.resolvePath(base, "a/./b.sql"));
        assertNull(CliPathResolver.resolvePath(base, " "));
    }

    @Test
    void should_expand_directories_to_sorted_sql_files() throws Exception {
        Files.createDirectories(tmp.resolve("q/sub"));
        Files.writeString(tmp.resolve("q/b.sql"), "select 1");
        Files.writeString(tmp.resolve("q/sub/a.SQL"), "select 2");
        Files.writeString(tmp.resolve("q/notes.txt"), "x");
        Files.writeString(tmp.resolve("single.sql"), "select 3");

        List<Path> files = CliPathResolver.expandSqlFiles(tmp, Arrays.asList("q", "single.sql", "q/b.sql"));

        assertEquals(Arrays.asList(tmp.resolve("q/b.sql"), tmp.resolve("q/sub/a.SQL"), tmp.resolve("single.sql")), files);
    }

    @Test
    void should_fail_for_missing_input() {
        assertThrows(IllegalArgumentException.class,
                () -> CliPathResolver.expandSqlFiles(tmp, Arrays.asList("missing.sql")));
    }

    @Test
    void should_trim_to_null() {
        assertNull(CliPathResolver.trimToNull("  "));
        assertEquals("a", CliPathResolver.trimToNull(" a "));
    }
}
