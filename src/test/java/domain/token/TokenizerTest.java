package domain.token;

import domain.dialect.Language;
import domain.dialect.DialectRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private static Tokenizer standard() {
        return DialectRegistry.get(Language.STANDARD_SQL).getTokenizer();
    }

    private static List<Token> significant(List<Token> tokens) {
        List<Token> out = new ArrayList<>();
        for (Token t : tokens) {
            if (!t.is(TokenType.WHITESPACE)) out.add(t);
        }
        return out;
    }

    private static String join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) sb.append(t.getValue());
        return sb.toString();
    }

    @Test
    void should_reproduce_input_when_token_values_are_concatenated() {
        String sql = "SELECT a.b, 'x''y', \"q\" -- c\nFROM t /* blk */ WHERE n >= 1.5 AND p = ?";
        assertEquals(sql, join(standard().tokenize(sql)));
    }

    @Test
    void should_return_empty_list_for_null_or_empty_input() {
        assertTrue(standard().tokenize(null).isEmpty());
        assertTrue(standard().tokenize("").isEmpty());
    }

    @Test
    void should_classify_reserved_word_lists() {
        List<Token> tokens = significant(standard().tokenize("select a from t left join u on x and y"));

        assertEquals(new Token(TokenType.RESERVED_TOP_LEVEL, "select"), tokens.get(0));
        assertEquals(new Token(TokenType.WORD, "a"), tokens.get(1));
        assertEquals(new Token(TokenType.RESERVED_TOP_LEVEL, "from"), tokens.get(2));
        assertEquals(new Token(TokenType.RESERVED_NEWLINE, "left join"), tokens.get(4));
        assertEquals(new Token(TokenType.RESERVED, "on"), tokens.get(6));
        assertEquals(new Token(TokenType.RESERVED_NEWLINE, "and"), tokens.get(8));
    }

    @Test
    void should_prefer_longest_reserved_phrase_across_lists() {
        DialectConfig cfg = DialectConfig.builder()
                .reservedWords("DO UPDATE", "DO NOTHING")
                .reservedTopLevelWords("DO", "SET")
                .stringTypes("''")
                .openParens("(")
                .closeParens(")")
                .lineCommentTypes("--")
                .build();

        List<Token> tokens = significant(new Tokenizer(cfg).tokenize("DO  UPDATE SET x = 1"));

        assertEquals(new Token(TokenType.RESERVED, "DO  UPDATE"), tokens.get(0));
        assertEquals(TokenType.RESERVED_TOP_LEVEL, tokens.get(1).getType());
    }

    @Test
    void should_read_postgresql_do_update_as_one_token() {
        Tokenizer pg = DialectRegistry.get(Language.POSTGRESQL).getTokenizer();
        List<Token> tokens = significant(pg.tokenize("ON CONFLICT (id) DO UPDATE SET x = 1"));

        assertEquals("DO UPDATE", tokens.get(4).getValue());
        assertEquals(TokenType.RESERVED, tokens.get(4).getType());
    }

    @Test
    void should_not_treat_word_after_dot_as_keyword() {
        List<Token> tokens = significant(standard().tokenize("SELECT t.from FROM t"));

        assertEquals(new Token(TokenType.WORD, "t"), tokens.get(1));
        assertEquals(new Token(TokenType.OPERATOR, "."), tokens.get(2));
        assertEquals(new Token(TokenType.WORD, "from"), tokens.get(3));
        assertEquals(TokenType.RESERVED_TOP_LEVEL, tokens.get(4).getType());
    }

    @Test
    void should_not_match_keyword_prefix_of_longer_word() {
        List<Token> tokens = significant(standard().tokenize("SELECT fromage"));
        assertEquals(new Token(TokenType.WORD, "fromage"), tokens.get(1));
    }

    @Test
    void should_run_unterminated_string_and_comment_to_end_of_input() {
        List<Token> str = significant(standard().tokenize("SELECT 'abc"));
        assertEquals(new Token(TokenType.STRING, "'abc"), str.get(1));

        List<Token> blk = significant(standard().tokenize("SELECT /* open"));
        assertEquals(new Token(TokenType.BLOCK_COMMENT, "/* open"), blk.get(1));
    }

    @Test
    void should_keep_line_comment_with_its_newline() {
        List<Token> tokens = standard().tokenize("-- note\nSELECT 1");
        assertEquals(new Token(TokenType.LINE_COMMENT, "-- note\n"), tokens.get(0));
    }

    @Test
    void should_keep_unicode_line_separators_inside_line_comment() {
        List<Token> tokens = standard().tokenize("SELECT a -- note\u2028drop b\u0085x\nFROM t");

        assertEquals(new Token(TokenType.LINE_COMMENT, "-- note\u2028drop b\u0085x\n"), significant(tokens).get(2));
        assertEquals(TokenType.RESERVED_TOP_LEVEL, significant(tokens).get(3).getType());
    }

    @Test
    void should_read_escaped_newline_inside_string() {
        List<Token> tokens = standard().tokenize("'a\\\nb' x");
        assertEquals(new Token(TokenType.STRING, "'a\\\nb'"), tokens.get(0));
    }

    @Test
    void should_extract_placeholder_keys() {
        List<Token> tokens = significant(standard().tokenize("a = ? AND b = ?2 AND c = :name AND d = @'full name'"));

        assertEquals(new Token(TokenType.PLACEHOLDER, "?", ""), tokens.get(2));
        assertEquals(new Token(TokenType.PLACEHOLDER, "?2", "2"), tokens.get(6));
        assertEquals(new Token(TokenType.PLACEHOLDER, ":name", "name"), tokens.get(10));
        assertEquals(new Token(TokenType.PLACEHOLDER, "@'full name'", "full name"), tokens.get(14));
    }

    @Test
    void should_not_read_json_operators_as_placeholders() {
        Tokenizer pg = DialectRegistry.get(Language.POSTGRESQL).getTokenizer();
        List<Token> tokens = significant(pg.tokenize("doc @> '{}' AND doc ?| array['a']"));

        assertEquals(new Token(TokenType.OPERATOR, "@>"), tokens.get(1));
        assertEquals(new Token(TokenType.OPERATOR, "?|"), tokens.get(5));
    }

    @Test
    void should_read_tagged_dollar_quote_as_one_string() {
        Tokenizer pg = DialectRegistry.get(Language.POSTGRESQL).getTokenizer();
        String body = "$fn$ SELECT 'a; b' $x$ $fn$";
        List<Token> tokens = significant(pg.tokenize("AS " + body + " LANGUAGE sql"));

        assertEquals(new Token(TokenType.STRING, body), tokens.get(1));
    }

    @Test
    void should_read_dollar_index_as_placeholder_in_postgresql() {
        Tokenizer pg = DialectRegistry.get(Language.POSTGRESQL).getTokenizer();
        List<Token> tokens = significant(pg.tokenize("id = $1"));

        assertEquals(new Token(TokenType.PLACEHOLDER, "$1", "1"), tokens.get(2));
    }

    @Test
    void should_read_numbers_and_booleans() {
        List<Token> tokens = significant(standard().tokenize("1.25 0x1F TRUE"));

        assertEquals(new Token(TokenType.NUMBER, "1.25"), tokens.get(0));
        assertEquals(new Token(TokenType.NUMBER, "0x1F"), tokens.get(1));
        assertEquals(new Token(TokenType.BOOLEAN, "TRUE"), tokens.get(2));
    }

    @Test
    void should_reject_null_config() {
        assertThrows(IllegalArgumentException.class, () -> new Tokenizer(null));
    }
}
