package cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** CLI path resolver (baseDir / input files). */
public final class CliPathResolver {

    private CliPathResolver() {}

    public static final String PROP_BASE_DIR = "baseDir";

    /** --baseDir, then -DbaseDir, then the working directory. */
    public static Path resolveBaseDir(Map<String, String> argv) {
        String bd = (argv == null) ? null : trimToNull(argv.get("baseDir"));
        if (bd == null) bd = trimToNull(System.getProperty(PROP_BASE_DIR));
        if (bd != null) {
            return resolveAgainstUserDir(bd).toAbsolutePath().normalize();
        }
        return Paths.get(".").toAbsolutePath().normalize();
    }

    public static Path resolvePath(Path baseDir, String input) {
        if (input == null || input.isBlank()) return null;
        Path p = Paths.get(input.trim());
        if (!p.isAbsolute()) {
            if (baseDir != null) p = baseDir.resolve(p);
            else p = resolveAgainstUserDir(input.trim());
        }
        return p.toAbsolutePath().normalize();
    }

    public static Path resolveAgainstUserDir(String raw) {
        if (raw == null || raw.isBlank()) return null;
        Path p = Paths.get(raw.trim());
        if (p.isAbsolute()) return p;
        return Paths.get(System.getProperty("user.dir")).resolve(p);
    }

    public static void validateFileExists(Path p, String label) {
        if (p == null) throw new IllegalArgumentException(label + " is null");
        if (!Files.exists(p)) throw new IllegalArgumentException(label + " not found: " + p);
    }


    /**
     * Expands CLI inputs: files are kept as given, directories are walked for
     * {@code *.sql} files (sorted). Duplicates are dropped.
     */
    public static List<Path> expandSqlFiles(Path baseDir, List<String> inputs) {
        Set<Path> out = new LinkedHashSet<>();
        if (inputs == null) return new ArrayList<>(out);

        for (String raw : inputs) {
            Path p = resolvePath(baseDir, raw);
            if (p == null) continue;
            validateFileExists(p, "input");

            if (!Files.isDirectory(p)) {
                out.add(p);
                continue;
            }
            try (Stream<Path> walk = Files.walk(p)) {
                out.addAll(walk
                        .filter(Files::isRegularFile)
                        .filter(x -> x.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".sql"))
                        .sorted()
                        .collect(Collectors.toList()));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to scan directory: " + p, e);
            }
        }
        return new ArrayList<>(out);
    }

    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
