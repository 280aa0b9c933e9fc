package domain.format;

import domain.token.Token;
import domain.token.TokenType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InlineBlockTest {

    private static Token open() {
        return new Token(TokenType.OPEN_PAREN, "(");
    }

    private static Token close() {
        return new Token(TokenType.CLOSE_PAREN, ")");
    }

    private static Token word(String v) {
        return new Token(TokenType.WORD, v);
    }

    @Test
    void should_accept_short_balanced_group() {
        List<Token> tokens = Arrays.asList(open(), word("a"), new Token(TokenType.OPERATOR, ","), word("b"), close());
        assertTrue(InlineBlock.isInlineBlock(tokens, 0));
    }

    @Test
    void should_reject_group_over_length_budget() {
        String longWord = "x".repeat(InlineBlock.MAX_LENGTH);
        List<Token> tokens = Arrays.asList(open(), word(longWord), close());
        assertFalse(InlineBlock.isInlineBlock(tokens, 0));
    }

    @Test
    void should_accept_group_of_exactly_the_length_budget() {
        List<Token> fits = Arrays.asList(open(), word("x".repeat(InlineBlock.MAX_LENGTH - 2)), close());
        List<Token> oneOver = Arrays.asList(open(), word("x".repeat(InlineBlock.MAX_LENGTH - 1)), close());

        assertTrue(InlineBlock.isInlineBlock(fits, 0));
        assertFalse(InlineBlock.isInlineBlock(oneOver, 0));
    }

    @Test
    void should_reject_group_with_semicolon_or_newline_keyword() {
        List<Token> withSemicolon = Arrays.asList(open(), word("a"), new Token(TokenType.OPERATOR, ";"), word("b"), close());
        List<Token> withAnd = Arrays.asList(open(), word("a"), new Token(TokenType.RESERVED_NEWLINE, "AND"), word("b"), close());

        assertFalse(InlineBlock.isInlineBlock(withSemicolon, 0));
        assertFalse(InlineBlock.isInlineBlock(withAnd, 0));
    }

    @Test
    void should_reject_group_with_clause_keyword_or_comment() {
        List<Token> withSelect = Arrays.asList(open(), new Token(TokenType.RESERVED_TOP_LEVEL, "SELECT"), word("1"), close());
        List<Token> withComment = Arrays.asList(open(), new Token(TokenType.BLOCK_COMMENT, "/* c */"), close());

        assertFalse(InlineBlock.isInlineBlock(withSelect, 0));
        assertFalse(InlineBlock.isInlineBlock(withComment, 0));
    }

    @Test
    void should_reject_unclosed_group() {
        assertFalse(InlineBlock.isInlineBlock(Arrays.asList(open(), word("a")), 0));
    }

    @Test
    void should_count_nested_levels_once_active() {
        List<Token> tokens = Arrays.asList(open(), open(), word("a"), close(), close());
        InlineBlock block = new InlineBlock();

        block.beginIfPossible(tokens, 0);
        block.beginIfPossible(tokens, 1);
        assertEquals(2, block.level());

        block.end();
        assertTrue(block.isActive());
        block.end();
        assertFalse(block.isActive());
        block.end();
        assertEquals(0, block.level());
    }
}
