package domain.output;

import java.util.Locale;

/**
 * File naming policy for formatted SQL: {@code <sqlId>.sql}.
 * <p>
 * NOTE:
 * - 파일명에 쓸 수 없는 문자는 '_'로 치환
 * - 이미 .sql 로 끝나는 id 는 확장자를 다시 붙이지 않음
 */
public final class SqlFileNamePolicy {

    private static final int MAX_NAME = 180;

    private SqlFileNamePolicy() {
    }

    public static String build(String sqlId) {
        String id = safePart(sqlId, "unknownId");
        if (id.toLowerCase(Locale.ROOT).endsWith(".sql")) {
            id = id.substring(0, id.length() - 4);
            if (id.isEmpty()) id = "unknownId";
        }
        return limit(id, MAX_NAME) + ".sql";
    }

    private static String safePart(String raw, String fallback) {
        String s = (raw == null) ? "" : raw.trim();
        if (s.isEmpty()) s = fallback;
        s = s.replace('\n', '_')
                .replace('\r', '_');

        // Keep only filename-safe characters.
        s = s.replaceAll("[^a-zA-Z0-9._-]", "_");

        // avoid hidden/odd files on Windows
        if (s.startsWith(".")) s = "_" + s.substring(1);

        String u = s.toUpperCase(Locale.ROOT);
        if (u.equals("CON") || u.equals("PRN") || u.equals("AUX") || u.equals("NUL")
                || u.matches("COM[1-9]") || u.matches("LPT[1-9]")) {
            s = "_" + s;
        }
        return s;
    }

    private static String limit(String s, int max) {
        if (s.length() <= max) return s;
        return s.substring(0, max);
    }
}
