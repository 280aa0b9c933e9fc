package domain.model;

/**
 * Standard warning codes for batch formatting and reporting.
 *
 * <p>Keep the set small and stable. Add codes only when the meaning is clear
 * and actionable for operators.</p>
 */
public enum WarningCode {

    /**
     * SQL text is empty and the row is skipped.
     */
    SQL_TEXT_EMPTY,

    /**
     * The row's language tag is unknown; the run's default language was used.
     */
    LANGUAGE_UNKNOWN,

    /**
     * Formatting failed with an exception.
     */
    FORMAT_ERROR,

    /**
     * Processing time exceeded the configured slow threshold.
     */
    SLOW_SQL,

    /**
     * Config file could not be read or holds an invalid value.
     */
    CONFIG_ERROR
}
