package cli;

import domain.dialect.Language;
import domain.format.KeywordCase;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * CLI argument parsing helpers.
 *
 * <p>Options are {@code --key=value} or {@code --key value}; presence flags
 * ({@link #FLAGS}) never consume the next argument, so {@code --write a.sql}
 * keeps {@code a.sql} as a positional.</p>
 */
public final class CliArgParser {

    public static final Set<String> FLAGS = Set.of(
            "write", "uppercase", "alignColumns", "alignAssignments", "alignValues",
            "color", "autoDetect", "failFast", "noSqlOut", "noResult", "noConfig", "help"
    );

    private CliArgParser() {
    }

    public static int parseInt(String s, int def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    public static long parseLong(String s, long def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** Strict integer option; a bad value is a usage error. */
    public static int requireInt(Map<String, String> argv, String key) {
        String raw = argv.get(key);
        try {
            return Integer.parseInt(raw == null ? "" : raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + key + " must be an integer: '" + raw + "'", e);
        }
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim()
                .toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes");
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--write       => true</li>
     *   <li>--write=true  => true</li>
     *   <li>--write=false => false</li>
     * </ul>
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (argv == null || key == null) return false;
        if (!argv.containsKey(key)) return false;
        String raw = argv.get(key);
        if (raw == null || raw.isBlank()) return true;
        return parseBoolean(raw, true);
    }

    /**
     * 언어 태그 파싱 (사용자 친화 표기 허용).
     * <ul>
     *   <li>pg / postgres / postgresql / psql -> POSTGRESQL</li>
     *   <li>plsql / pl-sql / oracle -> PL_SQL</li>
     *   <li>mysql / mariadb -> MYSQL</li>
     *   <li>sql / standard / ansi -> STANDARD_SQL</li>
     * </ul>
     * 그 외는 {@link Language#fromTag} 로 위임 (모르는 값이면 IllegalArgumentException).
     */
    public static Language parseLanguage(String raw) {
        if (raw == null || raw.isBlank()) return Language.STANDARD_SQL;
        String v = raw.trim()
                .toLowerCase(Locale.ROOT);

        switch (v) {
            case "pg":
            case "postgres":
            case "psql":
            case "pgsql":
                return Language.POSTGRESQL;
            case "plsql":
            case "pl-sql":
            case "pl_sql":
            case "oracle":
                return Language.PL_SQL;
            case "mariadb":
                return Language.MYSQL;
            case "sqlite3":
                return Language.SQLITE;
            case "standard":
            case "standardsql":
            case "standard_sql":
            case "ansi":
                return Language.STANDARD_SQL;
            case "couchbase":
                return Language.N1QL;
            default:
                return Language.fromTag(v);
        }
    }

    /** u / upper / l / lower / preserve / dialect; 그 외는 {@link KeywordCase#fromName}. */
    public static KeywordCase parseKeywordCase(String raw) {
        String v = raw == null ? "" : raw.trim()
                .toLowerCase(Locale.ROOT);
        if (v.equals("u")) return KeywordCase.UPPERCASE;
        if (v.equals("l")) return KeywordCase.LOWERCASE;
        if (v.equals("keep") || v.equals("none")) return KeywordCase.PRESERVE;
        return KeywordCase.fromName(v);
    }

    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        scan(args, m, null);
        return m;
    }

    /** Non-option arguments in order (command first, then files). */
    public static List<String> positionals(String[] args) {
        List<String> out = new ArrayList<>();
        scan(args, null, out);
        return out;
    }

    private static void scan(String[] args, Map<String, String> options, List<String> positionals) {
        if (args == null) return;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a == null) continue;
            a = a.trim();
            if (a.isEmpty()) continue;

            if (!a.startsWith("--")) {
                if (positionals != null) positionals.add(a);
                continue;
            }

            String k;
            String v;

            int eq = a.indexOf('=');
            if (eq > 2) {
                k = a.substring(2, eq)
                        .trim();
                v = a.substring(eq + 1)
                        .trim();
            } else {
                k = a.substring(2)
                        .trim();
                v = "";
                if (!FLAGS.contains(k) && i + 1 < args.length && args[i + 1] != null
                        && !args[i + 1].startsWith("--")) {
                    v = args[i + 1].trim();
                    i++;
                }
            }

            if (!k.isEmpty() && options != null) options.put(k, v);
        }
    }
}
