package domain.token;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Declarative tokenizer tables for one SQL dialect.
 *
 * <p>Word lists are matched case-insensitively; a space inside a phrase
 * (e.g. {@code GROUP BY}) matches any run of whitespace. String types are tags
 * such as {@code ''}, {@code ""}, {@code ``}, {@code []}, {@code N''},
 * {@code X''}, {@code B''} and {@code $$}.</p>
 */
public final class DialectConfig {

    private final List<String> reservedWords;
    private final List<String> reservedTopLevelWords;
    private final List<String> reservedTopLevelWordsNoIndent;
    private final List<String> reservedNewlineWords;
    private final List<String> stringTypes;
    private final List<String> openParens;
    private final List<String> closeParens;
    private final List<String> indexedPlaceholderTypes;
    private final List<String> namedPlaceholderTypes;
    private final List<String> lineCommentTypes;
    private final List<String> specialWordChars;

    private DialectConfig(Builder b) {
        this.reservedWords = freeze(b.reservedWords);
        this.reservedTopLevelWords = freeze(b.reservedTopLevelWords);
        this.reservedTopLevelWordsNoIndent = freeze(b.reservedTopLevelWordsNoIndent);
        this.reservedNewlineWords = freeze(b.reservedNewlineWords);
        this.stringTypes = freeze(b.stringTypes);
        this.openParens = freeze(b.openParens);
        this.closeParens = freeze(b.closeParens);
        this.indexedPlaceholderTypes = freeze(b.indexedPlaceholderTypes);
        this.namedPlaceholderTypes = freeze(b.namedPlaceholderTypes);
        this.lineCommentTypes = freeze(b.lineCommentTypes);
        this.specialWordChars = freeze(b.specialWordChars);
    }

    private static List<String> freeze(List<String> src) {
        return Collections.unmodifiableList(new ArrayList<>(src));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .reservedWords(reservedWords)
                .reservedTopLevelWords(reservedTopLevelWords)
                .reservedTopLevelWordsNoIndent(reservedTopLevelWordsNoIndent)
                .reservedNewlineWords(reservedNewlineWords)
                .stringTypes(stringTypes)
                .openParens(openParens)
                .closeParens(closeParens)
                .indexedPlaceholderTypes(indexedPlaceholderTypes)
                .namedPlaceholderTypes(namedPlaceholderTypes)
                .lineCommentTypes(lineCommentTypes)
                .specialWordChars(specialWordChars);
    }

    public List<String> getReservedWords() {
        return reservedWords;
    }

    public List<String> getReservedTopLevelWords() {
        return reservedTopLevelWords;
    }

    public List<String> getReservedTopLevelWordsNoIndent() {
        return reservedTopLevelWordsNoIndent;
    }

    public List<String> getReservedNewlineWords() {
        return reservedNewlineWords;
    }

    public List<String> getStringTypes() {
        return stringTypes;
    }

    public List<String> getOpenParens() {
        return openParens;
    }

    public List<String> getCloseParens() {
        return closeParens;
    }

    public List<String> getIndexedPlaceholderTypes() {
        return indexedPlaceholderTypes;
    }

    public List<String> getNamedPlaceholderTypes() {
        return namedPlaceholderTypes;
    }

    public List<String> getLineCommentTypes() {
        return lineCommentTypes;
    }

    public List<String> getSpecialWordChars() {
        return specialWordChars;
    }

    public static final class Builder {
        private final List<String> reservedWords = new ArrayList<>();
        private final List<String> reservedTopLevelWords = new ArrayList<>();
        private final List<String> reservedTopLevelWordsNoIndent = new ArrayList<>();
        private final List<String> reservedNewlineWords = new ArrayList<>();
        private final List<String> stringTypes = new ArrayList<>();
        private final List<String> openParens = new ArrayList<>();
        private final List<String> closeParens = new ArrayList<>();
        private final List<String> indexedPlaceholderTypes = new ArrayList<>();
        private final List<String> namedPlaceholderTypes = new ArrayList<>();
        private final List<String> lineCommentTypes = new ArrayList<>();
        private final List<String> specialWordChars = new ArrayList<>();

        private Builder() {
        }

        private static void replace(List<String> target, Collection<String> values) {
            target.clear();
            if (values == null) return;
            for (String v : values) {
                if (v != null && !target.contains(v)) target.add(v);
            }
        }

        public Builder reservedWords(Collection<String> v) {
            replace(reservedWords, v);
            return this;
        }

        public Builder reservedWords(String... v) {
            return reservedWords(Arrays.asList(v));
        }

        public Builder reservedTopLevelWords(Collection<String> v) {
            replace(reservedTopLevelWords, v);
            return this;
        }

        public Builder reservedTopLevelWords(String... v) {
            return reservedTopLevelWords(Arrays.asList(v));
        }

        public Builder reservedTopLevelWordsNoIndent(Collection<String> v) {
            replace(reservedTopLevelWordsNoIndent, v);
            return this;
        }

        public Builder reservedTopLevelWordsNoIndent(String... v) {
            return reservedTopLevelWordsNoIndent(Arrays.asList(v));
        }

        public Builder reservedNewlineWords(Collection<String> v) {
            replace(reservedNewlineWords, v);
            return this;
        }

        public Builder reservedNewlineWords(String... v) {
            return reservedNewlineWords(Arrays.asList(v));
        }

        public Builder stringTypes(Collection<String> v) {
            replace(stringTypes, v);
            return this;
        }

        public Builder stringTypes(String... v) {
            return stringTypes(Arrays.asList(v));
        }

        public Builder openParens(Collection<String> v) {
            replace(openParens, v);
            return this;
        }

        public Builder openParens(String... v) {
            return openParens(Arrays.asList(v));
        }

        public Builder closeParens(Collection<String> v) {
            replace(closeParens, v);
            return this;
        }

        public Builder closeParens(String... v) {
            return closeParens(Arrays.asList(v));
        }

        public Builder indexedPlaceholderTypes(Collection<String> v) {
            replace(indexedPlaceholderTypes, v);
            return this;
        }

        public Builder indexedPlaceholderTypes(String... v) {
            return indexedPlaceholderTypes(Arrays.asList(v));
        }

        public Builder namedPlaceholderTypes(Collection<String> v) {
            replace(namedPlaceholderTypes, v);
            return this;
        }

        public Builder namedPlaceholderTypes(String... v) {
            return namedPlaceholderTypes(Arrays.asList(v));
        }

        public Builder lineCommentTypes(Collection<String> v) {
            replace(lineCommentTypes, v);
            return this;
        }

        public Builder lineCommentTypes(String... v) {
            return lineCommentTypes(Arrays.asList(v));
        }

        public Builder specialWordChars(Collection<String> v) {
            replace(specialWordChars, v);
            return this;
        }

        public Builder specialWordChars(String... v) {
            return specialWordChars(Arrays.asList(v));
        }

        public DialectConfig build() {
            return new DialectConfig(this);
        }
    }
}
