package domain.token;

/** Closed set of token kinds produced by {@link Tokenizer}. */
public enum TokenType {
    WHITESPACE,
    LINE_COMMENT,
    BLOCK_COMMENT,
    RESERVED,
    RESERVED_TOP_LEVEL,
    RESERVED_TOP_LEVEL_NO_INDENT,
    RESERVED_NEWLINE,
    OPEN_PAREN,
    CLOSE_PAREN,
    WORD,
    PLACEHOLDER,
    STRING,
    NUMBER,
    BOOLEAN,
    OPERATOR,
    SPECIAL_OPERATOR;

    public boolean isComment() {
        return this == LINE_COMMENT || this == BLOCK_COMMENT;
    }

    public boolean isReserved() {
        return this == RESERVED
                || this == RESERVED_TOP_LEVEL
                || this == RESERVED_TOP_LEVEL_NO_INDENT
                || this == RESERVED_NEWLINE;
    }
}
