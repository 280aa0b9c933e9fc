package domain.dialect;

import domain.token.DialectConfig;
import domain.token.Token;
import domain.token.TokenType;

import java.util.List;
import java.util.Set;

/** MySQL: backtick identifiers, {@code #} comments, {@code ?} placeholders. */
public final class MySqlDialect extends Dialect {

    static final List<String> RESERVED_WORDS = extend(StandardSqlDialect.RESERVED_WORDS,
            "AUTO_INCREMENT", "BINARY", "BLOB", "BOOLEAN", "BTREE", "HASH",
            "ENGINE", "INNODB", "MYISAM", "MEMORY", "CHARACTER SET", "CHARSET",
            "COLLATION", "SIGNED", "UNSIGNED", "ZEROFILL",
            "IFNULL", "ISNULL", "CONCAT", "LENGTH", "SUBSTRING",
            "STORAGE", "DYNAMIC", "FIXED", "COMPRESSED", "REDUNDANT", "COMPACT",
            "LOCK IN SHARE MODE", "FOR UPDATE", "STRAIGHT_JOIN", "SQL_CALC_FOUND_ROWS");

    static final List<String> RESERVED_TOP_LEVEL_WORDS = extend(StandardSqlDialect.RESERVED_TOP_LEVEL_WORDS,
            "ON DUPLICATE KEY UPDATE", "INSERT IGNORE", "REPLACE INTO", "WITH", "WITH RECURSIVE");

    static final List<String> RESERVED_NEWLINE_WORDS = extend(StandardSqlDialect.RESERVED_NEWLINE_WORDS,
            "STRAIGHT_JOIN", "NATURAL JOIN", "NATURAL LEFT JOIN", "NATURAL RIGHT JOIN");

    private static final Set<String> JSON_OPERATORS = Set.of("->", "->>");

    public MySqlDialect() {
        super(Language.MYSQL, DialectConfig.builder()
                .reservedWords(RESERVED_WORDS)
                .reservedTopLevelWords(RESERVED_TOP_LEVEL_WORDS)
                .reservedTopLevelWordsNoIndent(StandardSqlDialect.RESERVED_TOP_LEVEL_WORDS_NO_INDENT)
                .reservedNewlineWords(RESERVED_NEWLINE_WORDS)
                .stringTypes("''", "\"\"", "``")
                .openParens("(", "CASE")
                .closeParens(")", "END")
                .indexedPlaceholderTypes("?")
                .lineCommentTypes("--", "#")
                .build());
    }

    @Override
    public Token apply(Token token, Token previousReservedWord) {
        if (token.is(TokenType.OPERATOR) && JSON_OPERATORS.contains(token.getValue())) {
            return token.withType(TokenType.SPECIAL_OPERATOR);
        }
        return token;
    }
}
