package domain.dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Supported SQL dialects, identified by their config tag. */
public enum Language {
    STANDARD_SQL("sql", true),
    POSTGRESQL("postgresql", false),
    MYSQL("mysql", false),
    SQLITE("sqlite", false),
    PL_SQL("pl/sql", true),
    DB2("db2", true),
    N1QL("n1ql", false);

    private final String tag;
    private final boolean uppercaseKeywords;

    Language(String tag, boolean uppercaseKeywords) {
        this.tag = tag;
        this.uppercaseKeywords = uppercaseKeywords;
    }

    public String tag() {
        return tag;
    }

    /** Keyword casing used when the keyword case is DIALECT. */
    public boolean prefersUppercaseKeywords() {
        return uppercaseKeywords;
    }

    /**
     * Exact tag lookup.
     *
     * @throws IllegalArgumentException when the tag is unknown
     */
    public static Language fromTag(String tag) {
        String v = tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT);
        for (Language l : values()) {
            if (l.tag.equals(v)) return l;
        }
        throw new IllegalArgumentException("Unknown language: '" + tag + "' (expected one of: " + tags() + ")");
    }

    public static List<String> tags() {
        List<String> out = new ArrayList<>();
        for (Language l : values()) out.add(l.tag);
        return out;
    }
}
