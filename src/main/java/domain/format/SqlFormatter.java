package domain.format;

import domain.dialect.Dialect;
import domain.dialect.DialectRegistry;
import domain.dialect.Language;
import domain.token.DialectConfig;
import domain.token.Token;
import domain.token.TokenOverride;
import domain.token.Tokenizer;

import java.util.List;

/**
 * Entry point: formats SQL text for a dialect.
 *
 * <p>Pure and thread-safe. Every call builds its own render state; nothing is
 * shared between calls except the immutable dialect tables. Never throws for
 * any input text, including unbalanced parens and unterminated strings.</p>
 */
public final class SqlFormatter {

    private SqlFormatter() {
    }

    public static String format(String sql) {
        return format(sql, FormatConfig.defaults());
    }

    public static String format(String sql, FormatConfig cfg) {
        FormatConfig c = cfg == null ? FormatConfig.defaults() : cfg;
        Dialect dialect = DialectRegistry.get(c.getLanguage());
        return formatQuery(c, c.getDialectConfig() == null ? dialect.getConfig() : c.getDialectConfig(), dialect, sql);
    }

    /** Like {@link #format(String, FormatConfig)} but with ANSI colors, defaulting them when the config has none. */
    public static String prettyFormat(String sql, FormatConfig cfg) {
        FormatConfig c = cfg == null ? FormatConfig.defaults() : cfg;
        if (c.getColorConfig() == null || c.getColorConfig().isEmpty()) {
            c = c.toBuilder().colorConfig(ColorConfig.defaults()).build();
        }
        return format(sql, c);
    }

    public static List<Token> tokenize(String sql, FormatConfig cfg) {
        FormatConfig c = cfg == null ? FormatConfig.defaults() : cfg;
        if (c.getDialectConfig() != null) return new Tokenizer(c.getDialectConfig()).tokenize(sql);
        return DialectRegistry.get(c.getLanguage()).getTokenizer().tokenize(sql);
    }

    /**
     * Formats with explicit tokenizer tables and override, bypassing the
     * registry. Used for custom dialects.
     */
    public static String formatQuery(FormatConfig cfg, DialectConfig tables, TokenOverride override, String sql) {
        FormatConfig c = cfg == null ? FormatConfig.defaults() : cfg;
        Tokenizer tokenizer = new Tokenizer(tables);
        return render(c, tokenizer, override, sql);
    }

    private static String formatQuery(FormatConfig cfg, DialectConfig tables, Dialect dialect, String sql) {
        Tokenizer tokenizer = tables == dialect.getConfig() ? dialect.getTokenizer() : new Tokenizer(tables);
        return render(cfg, tokenizer, dialect, sql);
    }

    private static String render(FormatConfig cfg, Tokenizer tokenizer, TokenOverride override, String sql) {
        if (sql == null || sql.isEmpty()) return "";
        List<Token> tokens = tokenizer.tokenize(sql);
        Params params = new Params(cfg.getNamedParams(), cfg.getListParams(),
                cfg.getLanguage() == Language.SQLITE);
        return new SqlRenderer(cfg, tokens, override, params).render();
    }
}
