package domain.format;

import domain.token.Token;
import domain.token.TokenType;

import java.util.List;

/**
 * Bookkeeper for parenthesised regions rendered on a single line.
 *
 * <p>A region is inline when its matching close is found within
 * {@link #MAX_LENGTH} characters of token text and no clause keyword, newline
 * keyword, comment or {@code ;} appears before it. Parens nested inside an
 * inline region are inline as well.</p>
 */
public final class InlineBlock {

    static final int MAX_LENGTH = 50;

    private int level;

    public void beginIfPossible(List<Token> tokens, int index) {
        if (level == 0 && isInlineBlock(tokens, index)) {
            level = 1;
        } else if (level > 0) {
            level++;
        } else {
            level = 0;
        }
    }

    public void end() {
        if (level > 0) level--;
    }

    public boolean isActive() {
        return level > 0;
    }

    int level() {
        return level;
    }

    static boolean isInlineBlock(List<Token> tokens, int index) {
        int length = 0;
        int depth = 0;

        for (int i = index; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            length += t.getValue().length();
            if (length > MAX_LENGTH) return false;

            if (t.is(TokenType.OPEN_PAREN)) {
                depth++;
            } else if (t.is(TokenType.CLOSE_PAREN)) {
                depth--;
                if (depth == 0) return true;
            }

            if (isForbiddenToken(t)) return false;
        }
        return false;
    }

    private static boolean isForbiddenToken(Token t) {
        TokenType type = t.getType();
        return type == TokenType.RESERVED_TOP_LEVEL
                || type == TokenType.RESERVED_NEWLINE
                || type == TokenType.LINE_COMMENT
                || type == TokenType.BLOCK_COMMENT
                || t.valueIs(";");
    }
}
