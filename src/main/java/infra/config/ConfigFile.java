package infra.config;

import domain.dialect.Language;
import domain.format.FormatConfig;
import domain.format.KeywordCase;

import java.nio.file.Path;

/**
 * Values read from a {@code .sqlfmtrc} / {@code sqlfmt.yaml} file.
 *
 * <p>Every field is optional ({@code null} = not set); {@link #applyTo} only
 * overrides what the file sets.</p>
 */
public final class ConfigFile {

    private final Path source;
    private final Language language;
    private final String indent;
    private final KeywordCase keywordCase;
    private final Integer linesBetweenQueries;
    private final Boolean alignColumnNames;
    private final Boolean alignAssignments;
    private final Boolean alignValues;
    private final Integer maxLineLength;
    private final Integer commentMinSpacing;

    ConfigFile(Path source,
               Language language,
               String indent,
               KeywordCase keywordCase,
               Integer linesBetweenQueries,
               Boolean alignColumnNames,
               Boolean alignAssignments,
               Boolean alignValues,
               Integer maxLineLength,
               Integer commentMinSpacing) {
        this.source = source;
        this.language = language;
        this.indent = indent;
        this.keywordCase = keywordCase;
        this.linesBetweenQueries = linesBetweenQueries;
        this.alignColumnNames = alignColumnNames;
        this.alignAssignments = alignAssignments;
        this.alignValues = alignValues;
        this.maxLineLength = maxLineLength;
        this.commentMinSpacing = commentMinSpacing;
    }

    static ConfigFile empty(Path source) {
        return new ConfigFile(source, null, null, null, null, null, null, null, null, null);
    }

    public FormatConfig.Builder applyTo(FormatConfig.Builder b) {
        if (language != null) b.language(language);
        if (indent != null) b.indent(indent);
        if (keywordCase != null) b.keywordCase(keywordCase);
        if (linesBetweenQueries != null) b.linesBetweenQueries(linesBetweenQueries);
        if (alignColumnNames != null) b.alignColumnNames(alignColumnNames);
        if (alignAssignments != null) b.alignAssignments(alignAssignments);
        if (alignValues != null) b.alignValues(alignValues);
        if (maxLineLength != null) b.maxLineLength(maxLineLength);
        if (commentMinSpacing != null) b.commentMinSpacing(commentMinSpacing);
        return b;
    }

    /** File this was read from, or {@code null} for an in-memory config. */
    public Path getSource() {
        return source;
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

    public Integer getLinesBetweenQueries() {
        return linesBetweenQueries;
    }

    public Boolean getAlignColumnNames() {
        return alignColumnNames;
    }

    public Boolean getAlignAssignments() {
        return alignAssignments;
    }

    public Boolean getAlignValues() {
        return alignValues;
    }

    public Integer getMaxLineLength() {
        return maxLineLength;
    }

    public Integer getCommentMinSpacing() {
        return commentMinSpacing;
    }
}
