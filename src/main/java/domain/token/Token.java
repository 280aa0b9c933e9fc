package domain.token;

import java.util.Objects;

/**
 * A single lexical token.
 *
 * <p>Immutable. {@code key} is only set for placeholders and holds the name or
 * index with its prefix stripped. Renderers never mutate a token; a dialect
 * override returns a replacement through {@link #withType(TokenType)}.</p>
 */
public final class Token {

    /** Stand-in for "no token" at the edges of the stream. */
    public static final Token EMPTY = new Token(null, "", null);

    private final TokenType type;
    private final String value;
    private final String key;

    public Token(TokenType type, String value) {
        this(type, value, null);
    }

    public Token(TokenType type, String value, String key) {
        this.type = type;
        this.value = value == null ? "" : value;
        this.key = key;
    }

    public TokenType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public String getKey() {
        return key;
    }

    public boolean isEmpty() {
        return type == null && value.isEmpty();
    }

    public boolean is(TokenType t) {
        return type == t;
    }

    public boolean valueIs(String v) {
        return value.equals(v);
    }

    public boolean valueIgnoreCaseIs(String v) {
        return value.equalsIgnoreCase(v);
    }

    public Token withType(TokenType newType) {
        return new Token(newType, value, key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return type == other.type && value.equals(other.value) && Objects.equals(key, other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, key);
    }

    @Override
    public String toString() {
        return type + "(" + value + (key == null ? "" : ", key=" + key) + ")";
    }
}
