package domain.format;

import domain.dialect.Language;
import domain.token.DialectConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Options for one formatting run. Immutable; build with {@link #builder()}.
 *
 * <p>Defaults: standard SQL, two-space indent, keywords preserved, two line
 * breaks between statements, unlimited line length, no alignment, one space
 * before trailing comments, no params, no colors.</p>
 */
public final class FormatConfig {

    public static final String DEFAULT_INDENT = "  ";
    public static final int DEFAULT_LINES_BETWEEN_QUERIES = 2;
    public static final int DEFAULT_COMMENT_MIN_SPACING = 1;

    private final Language language;
    private final String indent;
    private final KeywordCase keywordCase;
    private final int linesBetweenQueries;
    private final int maxLineLength;
    private final boolean alignColumnNames;
    private final boolean alignAssignments;
    private final boolean alignValues;
    private final int commentMinSpacing;
    private final Map<String, String> namedParams;
    private final List<String> listParams;
    private final ColorConfig colorConfig;
    private final DialectConfig dialectConfig;

    private FormatConfig(Builder b) {
        this.language = b.language;
        this.indent = b.indent;
        this.keywordCase = b.keywordCase;
        this.linesBetweenQueries = b.linesBetweenQueries;
        this.maxLineLength = b.maxLineLength;
        this.alignColumnNames = b.alignColumnNames;
        this.alignAssignments = b.alignAssignments;
        this.alignValues = b.alignValues;
        this.commentMinSpacing = b.commentMinSpacing;
        this.namedParams = Collections.unmodifiableMap(new LinkedHashMap<>(b.namedParams));
        this.listParams = Collections.unmodifiableList(new ArrayList<>(b.listParams));
        this.colorConfig = b.colorConfig;
        this.dialectConfig = b.dialectConfig;
    }

    public static FormatConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .language(language)
                .indent(indent)
                .keywordCase(keywordCase)
                .linesBetweenQueries(linesBetweenQueries)
                .maxLineLength(maxLineLength)
                .alignColumnNames(alignColumnNames)
                .alignAssignments(alignAssignments)
                .alignValues(alignValues)
                .commentMinSpacing(commentMinSpacing)
                .colorConfig(colorConfig)
                .dialectConfig(dialectConfig);
        b.namedParams.putAll(namedParams);
        b.listParams.addAll(listParams);
        return b;
    }

    public Language getLanguage() {
        return language;
    }

    public String getIndent() {
        return indent;
    }

    public KeywordCase getKeywordCase() {
        return keywordCase;
    }

    public int getLinesBetweenQueries() {
        return linesBetweenQueries;
    }

    /** {@code <= 0} means unlimited. */
    public int getMaxLineLength() {
        return maxLineLength;
    }

    public boolean isAlignColumnNames() {
        return alignColumnNames;
    }

    public boolean isAlignAssignments() {
        return alignAssignments;
    }

    public boolean isAlignValues() {
        return alignValues;
    }

    public int getCommentMinSpacing() {
        return commentMinSpacing;
    }

    public Map<String, String> getNamedParams() {
        return namedParams;
    }

    public List<String> getListParams() {
        return listParams;
    }

    public ColorConfig getColorConfig() {
        return colorConfig;
    }

    /** Custom tokenizer tables, or {@code null} for the language's built-in ones. */
    public DialectConfig getDialectConfig() {
        return dialectConfig;
    }

    public static final class Builder {
        private Language language = Language.STANDARD_SQL;
        private String indent = DEFAULT_INDENT;
        private KeywordCase keywordCase = KeywordCase.PRESERVE;
        private int linesBetweenQueries = DEFAULT_LINES_BETWEEN_QUERIES;
        private int maxLineLength;
        private boolean alignColumnNames;
        private boolean alignAssignments;
        private boolean alignValues;
        private int commentMinSpacing = DEFAULT_COMMENT_MIN_SPACING;
        private final Map<String, String> namedParams = new LinkedHashMap<>();
        private final List<String> listParams = new ArrayList<>();
        private ColorConfig colorConfig = ColorConfig.none();
        private DialectConfig dialectConfig;

        private Builder() {
        }

        public Builder language(Language v) {
            this.language = v == null ? Language.STANDARD_SQL : v;
            return this;
        }

        public Builder indent(String v) {
            this.indent = v == null ? DEFAULT_INDENT : v;
            return this;
        }

        public Builder keywordCase(KeywordCase v) {
            this.keywordCase = v == null ? KeywordCase.PRESERVE : v;
            return this;
        }

        public Builder uppercase(boolean v) {
            return keywordCase(v ? KeywordCase.UPPERCASE : KeywordCase.PRESERVE);
        }

        public Builder linesBetweenQueries(int v) {
            this.linesBetweenQueries = Math.max(0, v);
            return this;
        }

        public Builder maxLineLength(int v) {
            this.maxLineLength = v;
            return this;
        }

        public Builder alignColumnNames(boolean v) {
            this.alignColumnNames = v;
            return this;
        }

        public Builder alignAssignments(boolean v) {
            this.alignAssignments = v;
            return this;
        }

        public Builder alignValues(boolean v) {
            this.alignValues = v;
            return this;
        }

        public Builder commentMinSpacing(int v) {
            this.commentMinSpacing = v;
            return this;
        }

        public Builder namedParams(Map<String, String> v) {
            namedParams.clear();
            if (v != null) namedParams.putAll(v);
            return this;
        }

        public Builder listParams(List<String> v) {
            listParams.clear();
            if (v != null) listParams.addAll(v);
            return this;
        }

        public Builder colorConfig(ColorConfig v) {
            this.colorConfig = v == null ? ColorConfig.none() : v;
            return this;
        }

        public Builder dialectConfig(DialectConfig v) {
            this.dialectConfig = v;
            return this;
        }

        public FormatConfig build() {
            return new FormatConfig(this);
        }
    }
}
