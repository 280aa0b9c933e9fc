package domain.model;

/**
 * A single batch outcome row for reporting.
 *
 * <p>Plain value object, not tied to any external library so it can be
 * reused by CLI/API layers.</p>
 */
public final class FormatResult {

    public static final String SUCCESS = "SUCCESS";
    public static final String SKIP = "SKIP";
    public static final String ERROR = "ERROR";

    private final String status;
    private final String sqlId;
    private final String language;

    /**
     * 입력/출력 SQL 줄 수 (리포트용)
     */
    private final int inputLines;
    private final int outputLines;

    /**
     * 포맷 결과가 원문과 다른지 여부
     */
    private final boolean changed;
    private final long elapsedMs;

    /**
     * optional reason message for SKIP / ERROR
     */
    private final String message;

    public FormatResult(String status, String sqlId, String language, int inputLines, int outputLines,
                        boolean changed, long elapsedMs, String message) {
        this.status = nullToEmpty(status);
        this.sqlId = nullToEmpty(sqlId);
        this.language = nullToEmpty(language);
        this.inputLines = inputLines;
        this.outputLines = outputLines;
        this.changed = changed;
        this.elapsedMs = elapsedMs;
        this.message = nullToEmpty(message);
    }

    public static FormatResult success(String sqlId, String language, String input, String output, long elapsedMs) {
        return new FormatResult(SUCCESS, sqlId, language, countLines(input), countLines(output),
                !nullToEmpty(input).equals(output), elapsedMs, "");
    }

    public static FormatResult skip(String sqlId, String language, String message) {
        return new FormatResult(SKIP, sqlId, language, 0, 0, false, 0L, message);
    }

    public static FormatResult error(String sqlId, String language, String input, long elapsedMs, String message) {
        return new FormatResult(ERROR, sqlId, language, countLines(input), 0, false, elapsedMs, message);
    }

    static int countLines(String s) {
        if (s == null || s.isEmpty()) return 0;
        int n = 1;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\n') n++;
        }
        return n;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public String getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    public String getSqlId() {
        return sqlId;
    }

    public String getLanguage() {
        return language;
    }

    public int getInputLines() {
        return inputLines;
    }

    public int getOutputLines() {
        return outputLines;
    }

    public boolean isChanged() {
        return changed;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public String getMessage() {
        return message;
    }
}
