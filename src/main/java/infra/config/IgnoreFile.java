package infra.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@code .sqlfmtignore} patterns.
 *
 * <p>One pattern per line; blank lines and {@code #} comments are skipped.
 * {@code dir/} ignores everything below that directory; other patterns are
 * globs ({@code *}, {@code ?}) matched against the path relative to the
 * ignore file's directory and against the bare file name.</p>
 */
public final class IgnoreFile {

    public static final String FILE_NAME = ".sqlfmtignore";

    private static final IgnoreFile NONE = new IgnoreFile(null, Collections.emptyList(), Collections.emptyList());

    private final Path baseDir;
    private final List<String> dirPrefixes;
    private final List<Pattern> globs;

    private IgnoreFile(Path baseDir, List<String> dirPrefixes, List<Pattern> globs) {
        this.baseDir = baseDir;
        this.dirPrefixes = dirPrefixes;
        this.globs = globs;
    }

    public static IgnoreFile none() {
        return NONE;
    }

    /** Nearest {@code .sqlfmtignore} in the start directory or a parent; none when absent. */
    public static IgnoreFile discover(Path startDir) {
        Path dir = startDir == null ? null : startDir.toAbsolutePath().normalize();
        while (dir != null) {
            Path p = dir.resolve(FILE_NAME);
            if (Files.isRegularFile(p)) return load(p);
            dir = dir.getParent();
        }
        return NONE;
    }

    public static IgnoreFile load(Path file) {
        try {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            return parse(file.toAbsolutePath().normalize().getParent(), lines);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read ignore file: " + file, e);
        }
    }

    static IgnoreFile parse(Path baseDir, List<String> lines) {
        List<String> dirs = new ArrayList<>();
        List<Pattern> globs = new ArrayList<>();
        for (String raw : lines) {
            String line = raw == null ? "" : raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            line = line.replace('\\', '/');
            if (line.startsWith("/")) line = line.substring(1);
            if (line.endsWith("/")) {
                dirs.add(line);
            } else {
                globs.add(toRegex(line));
            }
        }
        return new IgnoreFile(baseDir, dirs, globs);
    }

    public boolean isEmpty() {
        return dirPrefixes.isEmpty() && globs.isEmpty();
    }

    public boolean isIgnored(Path file) {
        if (file == null || isEmpty()) return false;

        Path abs = file.toAbsolutePath().normalize();
        String rel = (baseDir != null && abs.startsWith(baseDir))
                ? baseDir.relativize(abs).toString()
                : file.toString();
        rel = rel.replace('\\', '/');
        Path fileName = abs.getFileName();
        String name = fileName == null ? rel : fileName.toString();

        for (String d : dirPrefixes) {
            if (rel.startsWith(d) || rel.contains("/" + d)) return true;
        }
        for (Pattern g : globs) {
            if (g.matcher(rel).matches() || g.matcher(name).matches()) return true;
        }
        return false;
    }

    private static Pattern toRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                sb.append("[^/]*");
            } else if (c == '?') {
                sb.append("[^/]");
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(sb.toString());
    }
}
