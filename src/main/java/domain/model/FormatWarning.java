package domain.model;

/**
 * A single warning emitted while formatting a batch.
 *
 * <p>Warnings are not fatal; they indicate a risk or missing information that
 * operators should review.</p>
 */
public final class FormatWarning {

    private final WarningCode code;
    private final String sqlId;
    private final String message;
    private final String detail;

    public FormatWarning(WarningCode code, String sqlId, String message, String detail) {
        this.code = code == null ? WarningCode.FORMAT_ERROR : code;
        this.sqlId = nullToEmpty(sqlId);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static FormatWarning of(WarningCode code, String sqlId, String message) {
        return new FormatWarning(code, sqlId, message, "");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
    }

    public String getSqlId() {
        return sqlId;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return code + " " + sqlId + ": " + message;
    }
}
