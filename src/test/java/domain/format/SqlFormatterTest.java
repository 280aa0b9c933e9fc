package domain.format;

import domain.dialect.Language;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SqlFormatterTest {

    private static FormatConfig.Builder cfg() {
        return FormatConfig.builder();
    }

    @Test
    void should_return_empty_string_for_null_or_empty_input() {
        assertEquals("", SqlFormatter.format(null));
        assertEquals("", SqlFormatter.format(""));
        assertEquals("", SqlFormatter.format("   \n\t"));
    }

    @Test
    void should_break_clauses_and_list_items() {
        assertEquals("SELECT\n  count(*),\n  Column1\nFROM\n  Table1;",
                SqlFormatter.format("SELECT count(*),Column1 FROM Table1;"));
    }

    @Test
    void should_put_connectives_on_new_line() {
        assertEquals("foo\nAND bar", SqlFormatter.format("foo AND bar"));
    }

    @Test
    void should_separate_statements_with_blank_lines() {
        assertEquals("foo;\n\nbar;", SqlFormatter.format("foo;bar;"));
        assertEquals("foo;\nbar;", SqlFormatter.format("foo;bar;", cfg().linesBetweenQueries(1).build()));
    }

    @Test
    void should_keep_short_paren_group_inline() {
        assertEquals("((foo = 'bar'))", SqlFormatter.format("((foo = 'bar'))"));
    }

    @Test
    void should_expand_paren_group_over_inline_budget() {
        String sql = "((foo = 'some long string value that goes past the budget'))";
        assertEquals("(\n  (\n    foo = 'some long string value that goes past the budget'\n  )\n)",
                SqlFormatter.format(sql));
    }

    @Test
    void should_keep_limit_arguments_on_one_line() {
        assertEquals("SELECT\n  *\nFROM\n  t\nLIMIT\n  10, 20", SqlFormatter.format("SELECT * FROM t LIMIT 10, 20"));
    }

    @Test
    void should_indent_case_branches() {
        assertEquals("SELECT\n  CASE\n    WHEN a = 1 THEN 'x'\n    ELSE 'y'\n  END\nFROM\n  t",
                SqlFormatter.format("SELECT CASE WHEN a = 1 THEN 'x' ELSE 'y' END FROM t"));
    }

    @Test
    void should_keep_trailing_line_comment_after_comma() {
        assertEquals("SELECT\n  a, -- first\n  b\nFROM\n  t", SqlFormatter.format("SELECT a, -- first\n b FROM t"));
    }

    @Test
    void should_keep_line_comment_with_unicode_separator_as_comment() {
        String out = SqlFormatter.format("SELECT a -- note\u2028drop b\nFROM t");
        assertTrue(out.contains("-- note\u2028drop b"));
        assertFalse(out.contains("- -"));
    }

    @Test
    void should_reindent_multiline_block_comment() {
        assertEquals("/* a\n b */\nSELECT\n  1", SqlFormatter.format("/* a\n   b */ SELECT 1"));
    }

    @Test
    void should_be_idempotent() {
        String once = SqlFormatter.format("select a, b from t where x = 1 and y in (1, 2) order by a;");
        assertEquals(once, SqlFormatter.format(once));
    }

    @Test
    void should_not_throw_on_broken_input() {
        assertDoesNotThrow(() -> SqlFormatter.format("SELECT ((a FROM 'open"));
        assertDoesNotThrow(() -> SqlFormatter.format(")) END END ;"));
    }

    @Test
    void should_wrap_at_max_line_length() {
        String sql = "SELECT aaaaaaaaaa + bbbbbbbbbb + cccccccccc + dddddddddd FROM t";
        assertEquals("SELECT\n  aaaaaaaaaa + bbbbbbbbbb + cccccccccc\n  + dddddddddd\nFROM\n  t",
                SqlFormatter.format(sql, cfg().maxLineLength(40).build()));
    }

    @Test
    void should_use_configured_indent() {
        assertEquals("SELECT\n\ta\nFROM\n\tt", SqlFormatter.format("SELECT a FROM t", cfg().indent("\t").build()));
    }

    @Test
    void should_pad_select_items_to_widest_column() {
        FormatConfig c = cfg().alignColumnNames(true).build();
        assertEquals("SELECT\n  a    ,\n  bbbbb,\n  c", SqlFormatter.format("SELECT a, bbbbb, c", c));
        assertEquals("SELECT\n  coalesce(a, b),\n  c\nFROM\n  t", SqlFormatter.format("SELECT coalesce(a, b), c FROM t", c));
    }

    @Test
    void should_not_widen_columns_for_multiline_subquery_item() {
        FormatConfig c = cfg().alignColumnNames(true).build();
        String out = SqlFormatter.format("SELECT a, (SELECT x, yyyy FROM u) AS z, cc FROM t", c);

        assertTrue(out.startsWith("SELECT\n  a ,\n"), out);
        assertTrue(out.contains("yyyy"));
    }

    @Test
    void should_pad_assignment_targets_before_equals() {
        FormatConfig c = cfg().alignAssignments(true).build();
        assertEquals("UPDATE\n  t\nSET\n  a   = 1,\n  bbb = 2\nWHERE\n  id = 3",
                SqlFormatter.format("UPDATE t SET a = 1, bbb = 2 WHERE id = 3", c));
    }

    @Test
    void should_keep_values_tuples_flat_when_aligned() {
        String sql = "INSERT INTO t VALUES (1, 'aaaaaaaaaa', 'bbbbbbbbbb', 'cccccccccc', 'dddddddddd')";

        String aligned = SqlFormatter.format(sql, cfg().alignValues(true).build());
        assertTrue(aligned.contains("VALUES\n  (1, 'aaaaaaaaaa', 'bbbbbbbbbb', 'cccccccccc', 'dddddddddd')"), aligned);

        String plain = SqlFormatter.format(sql);
        assertTrue(plain.contains("(\n    1,\n"), plain);
    }

    @Test
    void should_apply_keyword_case() {
        assertEquals("SELECT\n  *\nFROM\n  t",
                SqlFormatter.format("select * from t", cfg().keywordCase(KeywordCase.UPPERCASE).build()));
        assertEquals("select\n  *\nfrom\n  t",
                SqlFormatter.format("SELECT * FROM t", cfg().keywordCase(KeywordCase.LOWERCASE).build()));
        assertEquals("select\n  *\nfrom\n  t",
                SqlFormatter.format("select * from t", cfg().build()));
    }

    @Test
    void should_follow_dialect_keyword_convention() {
        FormatConfig pg = cfg().language(Language.POSTGRESQL).keywordCase(KeywordCase.DIALECT).build();
        FormatConfig std = cfg().keywordCase(KeywordCase.DIALECT).build();

        assertEquals("select\n  *\nfrom\n  t", SqlFormatter.format("SELECT * FROM t", pg));
        assertEquals("SELECT\n  *\nFROM\n  t", SqlFormatter.format("select * from t", std));
    }

    @Test
    void should_substitute_named_and_positional_params() {
        FormatConfig named = cfg().namedParams(Map.of("id", "42")).build();
        assertEquals("WHERE\n  id = 42", SqlFormatter.format("WHERE id = :id", named));

        FormatConfig listed = cfg().listParams(Arrays.asList("1", "2")).build();
        assertEquals("WHERE\n  a = 1\n  AND b = 2", SqlFormatter.format("WHERE a = ? AND b = ?", listed));

        assertEquals("WHERE\n  a = ?", SqlFormatter.format("WHERE a = ?"));
    }

    @Test
    void should_index_sqlite_params_from_one() {
        FormatConfig c = cfg().language(Language.SQLITE).listParams(Arrays.asList("x", "y")).build();
        assertEquals("SELECT\n  x,\n  y", SqlFormatter.format("SELECT ?1, ?2", c));
    }

    @Test
    void should_decorate_tokens_without_changing_layout() {
        String sql = "SELECT a, 'x' FROM t WHERE b = 1";
        String pretty = SqlFormatter.prettyFormat(sql, FormatConfig.defaults());

        assertTrue(pretty.contains("\u001b["));
        assertEquals(SqlFormatter.format(sql), ColorConfig.stripAnsi(pretty));
    }
}
