package domain.dialect;

import domain.token.DialectConfig;
import domain.token.Token;
import domain.token.TokenOverride;
import domain.token.Tokenizer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Formatting strategy for one SQL dialect: tokenizer tables plus a token
 * override applied before rendering.
 *
 * <p>Subclasses only declare tables and, where needed, override
 * {@link #apply(Token, Token)}. The renderer never branches on the language
 * itself.</p>
 */
public abstract class Dialect implements TokenOverride {

    private final Language language;
    private final DialectConfig config;
    private final Tokenizer tokenizer;

    protected Dialect(Language language, DialectConfig config) {
        this.language = language;
        this.config = config;
        this.tokenizer = new Tokenizer(config);
    }

    public Language getLanguage() {
        return language;
    }

    public DialectConfig getConfig() {
        return config;
    }

    /** Tokenizer built from {@link #getConfig()}; shared, it holds no state. */
    public Tokenizer getTokenizer() {
        return tokenizer;
    }

    @Override
    public Token apply(Token token, Token previousReservedWord) {
        return token;
    }

    /** {@code base} followed by {@code extra}; duplicates are dropped by the config builder. */
    protected static List<String> extend(List<String> base, String... extra) {
        List<String> out = new ArrayList<>(base);
        out.addAll(Arrays.asList(extra));
        return out;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + language.tag() + ")";
    }
}
