package infra.config;

import domain.dialect.Language;
import domain.format.KeywordCase;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * YAML config file discovery and parsing.
 *
 * <p>Lookup order: the start directory and its parents (stopping after the
 * directory that holds {@code .git}), then the user home directory. In each
 * directory the first existing name of {@link #FILE_NAMES} wins.</p>
 */
public final class ConfigFileLoader {

    public static final List<String> FILE_NAMES = List.of(
            ".sqlfmtrc", ".sqlfmt.yaml", ".sqlfmt.yml", "sqlfmt.yaml", "sqlfmt.yml");

    private ConfigFileLoader() {
    }

    public static Optional<Path> discover(Path startDir, Path homeDir) {
        Path dir = startDir == null ? null : startDir.toAbsolutePath().normalize();
        while (dir != null) {
            Optional<Path> hit = findIn(dir);
            if (hit.isPresent()) return hit;
            if (Files.exists(dir.resolve(".git"))) break; // 저장소 루트에서 멈춤
            dir = dir.getParent();
        }
        if (homeDir != null) {
            return findIn(homeDir.toAbsolutePath().normalize());
        }
        return Optional.empty();
    }

    private static Optional<Path> findIn(Path dir) {
        for (String name : FILE_NAMES) {
            Path p = dir.resolve(name);
            if (Files.isRegularFile(p)) return Optional.of(p);
        }
        return Optional.empty();
    }

    public static ConfigFile load(Path file) {
        if (file == null) throw new IllegalArgumentException("config file is null");
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + file, e);
        }
        return parse(text, file);
    }

    /**
     * Parses YAML text. Unknown keys are ignored; a bad value fails with the
     * key and the file named in the message.
     */
    public static ConfigFile parse(String yamlText, Path source) {
        String label = source == null ? "<inline>" : source.toString();
        Object root;
        try {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(yamlText == null ? "" : yamlText);
        } catch (YAMLException e) {
            throw new IllegalStateException("Invalid YAML in config file: " + label, e);
        }

        if (root == null) return ConfigFile.empty(source);
        if (!(root instanceof Map)) {
            throw new IllegalArgumentException("Config file must be a mapping: " + label);
        }
        Map<?, ?> m = (Map<?, ?>) root;

        try {
            return new ConfigFile(
                    source,
                    language(m.get("language")),
                    indent(m.get("indent")),
                    keywordCase(m.get("keyword_case")),
                    integer(m, "lines_between_queries"),
                    bool(m, "align_column_names"),
                    bool(m, "align_assignments"),
                    bool(m, "align_values"),
                    integer(m, "max_line_length"),
                    integer(m, "comment_min_spacing")
            );
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(e.getMessage() + " (config: " + label + ")", e);
        }
    }

    private static Language language(Object v) {
        if (v == null) return null;
        return Language.fromTag(String.valueOf(v));
    }

    private static KeywordCase keywordCase(Object v) {
        if (v == null) return null;
        return KeywordCase.fromName(String.valueOf(v));
    }

    /** 숫자면 공백 개수, 문자열이면 그대로 사용. "tab" 은 탭 한 개. */
    private static String indent(Object v) {
        if (v == null) return null;
        if (v instanceof Number) {
            int n = ((Number) v).intValue();
            if (n < 0) throw new IllegalArgumentException("indent must be >= 0: " + n);
            return " ".repeat(n);
        }
        String s = String.valueOf(v);
        if ("tab".equalsIgnoreCase(s.trim())) return "\t";
        return s;
    }

    private static Integer integer(Map<?, ?> m, String key) {
        Object v = m.get(key);
        if (v == null) return null;
        if (v instanceof Number) return ((Number) v).intValue();
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: '" + v + "'", e);
        }
    }

    private static Boolean bool(Map<?, ?> m, String key) {
        Object v = m.get(key);
        if (v == null) return null;
        if (v instanceof Boolean) return (Boolean) v;
        String s = String.valueOf(v).trim().toLowerCase(Locale.ROOT);
        if (s.equals("true") || s.equals("yes") || s.equals("1")) return Boolean.TRUE;
        if (s.equals("false") || s.equals("no") || s.equals("0")) return Boolean.FALSE;
        throw new IllegalArgumentException(key + " must be a boolean: '" + v + "'");
    }
}
