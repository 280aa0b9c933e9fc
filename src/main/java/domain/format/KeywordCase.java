package domain.format;

import java.util.Locale;

/** How reserved words are cased in the output. */
public enum KeywordCase {
    UPPERCASE,
    LOWERCASE,
    PRESERVE,
    /** Uppercase or lowercase depending on the dialect's convention. */
    DIALECT;

    /**
     * Strict parse of a config value ({@code upper}, {@code uppercase}, {@code lower},
     * {@code lowercase}, {@code preserve}, {@code dialect}).
     *
     * @throws IllegalArgumentException for anything else
     */
    public static KeywordCase fromName(String raw) {
        String v = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        switch (v) {
            case "upper":
            case "uppercase":
                return UPPERCASE;
            case "lower":
            case "lowercase":
                return LOWERCASE;
            case "preserve":
                return PRESERVE;
            case "dialect":
                return DIALECT;
            default:
                throw new IllegalArgumentException("Unknown keyword case: '" + raw
                        + "' (expected one of: upper, lower, preserve, dialect)");
        }
    }
}
