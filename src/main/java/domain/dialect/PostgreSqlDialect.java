package domain.dialect;

import domain.token.DialectConfig;
import domain.token.Token;
import domain.token.TokenType;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * PostgreSQL: standard tables plus upsert, window, PL/pgSQL and index DDL
 * words, dollar-quoted strings and {@code $1} placeholders.
 */
public final class PostgreSqlDialect extends Dialect {

    static final List<String> RESERVED_WORDS = extend(StandardSqlDialect.RESERVED_WORDS,
            "ILIKE", "SIMILAR TO", "ON CONFLICT", "DO UPDATE", "DO NOTHING",
            "WINDOW", "OVER", "PARTITION BY", "FILTER", "RANGE", "ROWS", "GROUPS",
            "UNBOUNDED", "PRECEDING", "FOLLOWING", "CURRENT ROW", "EXCLUDE", "TIES", "NO OTHERS",
            "NULLS FIRST", "NULLS LAST",
            "LATERAL", "ARRAY", "UNNEST",
            "LANGUAGE", "RETURNS", "AS", "DECLARE", "BEGIN",
            "IMMUTABLE", "STABLE", "VOLATILE", "STRICT", "CALLED ON NULL INPUT",
            "SECURITY DEFINER", "SECURITY INVOKER", "LEAKPROOF", "NOT LEAKPROOF",
            "SETOF", "TABLE", "TRIGGER", "VOID",
            "COST", "SUPPORT", "PARALLEL SAFE", "PARALLEL UNSAFE", "PARALLEL RESTRICTED",
            "CONCURRENTLY", "IF NOT EXISTS", "IF EXISTS",
            "BTREE", "HASH", "GIN", "GIST", "SPGIST", "BRIN",
            "INCLUDE", "TABLESPACE", "WITH", "FILLFACTOR", "FASTUPDATE",
            "REINDEX", "CLUSTER", "VACUUM", "ANALYZE");

    static final List<String> RESERVED_TOP_LEVEL_WORDS = extend(StandardSqlDialect.RESERVED_TOP_LEVEL_WORDS,
            "WITH", "WITH RECURSIVE", "RETURNING", "WINDOW",
            "DO", "CREATE FUNCTION", "CREATE OR REPLACE FUNCTION",
            "CREATE INDEX", "CREATE UNIQUE INDEX", "DROP INDEX", "REINDEX");

    static final List<String> RESERVED_NEWLINE_WORDS = extend(StandardSqlDialect.RESERVED_NEWLINE_WORDS,
            "LATERAL JOIN", "LEFT LATERAL JOIN", "RIGHT LATERAL JOIN", "CROSS JOIN LATERAL");

    private static final Set<String> CAST_OPERATORS = Set.of("::");
    private static final Set<String> UPSERT_CONTEXT = Set.of("ON CONFLICT", "DO", "DO UPDATE");
    private static final Set<String> UPSERT_WORDS = Set.of("DO", "UPDATE", "VALUES");

    public PostgreSqlDialect() {
        super(Language.POSTGRESQL, DialectConfig.builder()
                .reservedWords(RESERVED_WORDS)
                .reservedTopLevelWords(RESERVED_TOP_LEVEL_WORDS)
                .reservedTopLevelWordsNoIndent(StandardSqlDialect.RESERVED_TOP_LEVEL_WORDS_NO_INDENT)
                .reservedNewlineWords(RESERVED_NEWLINE_WORDS)
                .stringTypes("\"\"", "N''", "''", "``", "$$")
                .openParens("(", "CASE")
                .closeParens(")", "END")
                .indexedPlaceholderTypes("$")
                .namedPlaceholderTypes("@", ":")
                .lineCommentTypes("--")
                .build());
    }

    @Override
    public Token apply(Token token, Token previousReservedWord) {
        if (token.is(TokenType.OPERATOR) && CAST_OPERATORS.contains(token.getValue())) {
            return token.withType(TokenType.SPECIAL_OPERATOR);
        }
        // DO / UPDATE / VALUES inside ON CONFLICT ... DO UPDATE stay on the upsert line
        if (token.is(TokenType.RESERVED_TOP_LEVEL)
                && UPSERT_WORDS.contains(normalize(token.getValue()))
                && UPSERT_CONTEXT.contains(normalize(previousReservedWord.getValue()))) {
            return token.withType(TokenType.RESERVED);
        }
        return token;
    }

    static String normalize(String value) {
        return value.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }
}
