package infra.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class IgnoreFileTest {

    @TempDir
    Path tmp;

    @Test
    void should_match_directory_prefixes_and_globs() {
        IgnoreFile ignore = IgnoreFile.parse(tmp, Arrays.asList(
                "# generated",
                "",
                "build/",
                "*.gen.sql",
                "/migrations/v?.sql"));

        assertTrue(ignore.isIgnored(tmp.resolve("build/out.sql")));
        assertTrue(ignore.isIgnored(tmp.resolve("mod/build/out.sql")));
        assertTrue(ignore.isIgnored(tmp.resolve("src/q.gen.sql")));
        assertTrue(ignore.isIgnored(tmp.resolve("migrations/v1.sql")));

        assertFalse(ignore.isIgnored(tmp.resolve("migrations/v10.sql")));
        assertFalse(ignore.isIgnored(tmp.resolve("src/q.sql")));
        assertFalse(ignore.isIgnored(null));
    }

    @Test
    void should_ignore_nothing_without_file() {
        assertTrue(IgnoreFile.none().isEmpty());
        assertFalse(IgnoreFile.none().isIgnored(tmp.resolve("a.sql")));
    }

    @Test
    void should_discover_file_in_parent_directory() throws Exception {
        Files.writeString(tmp.resolve(IgnoreFile.FILE_NAME), "vendor/\n", StandardCharsets.UTF_8);
        Path nested = Files.createDirectories(tmp.resolve("src/main"));

        IgnoreFile ignore = IgnoreFile.discover(nested);

        assertFalse(ignore.isEmpty());
        assertTrue(ignore.isIgnored(tmp.resolve("vendor/lib.sql")));
        assertFalse(ignore.isIgnored(nested.resolve("q.sql")));
    }
}
