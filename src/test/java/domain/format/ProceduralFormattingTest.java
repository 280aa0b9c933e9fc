package domain.format;

import domain.dialect.Language;
import domain.token.DialectConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProceduralFormattingTest {

    private static final FormatConfig PL_SQL = FormatConfig.builder().language(Language.PL_SQL).build();

    @Test
    void should_indent_begin_body() {
        assertEquals("BEGIN\n  SELECT\n    1;\nEND;", SqlFormatter.format("BEGIN SELECT 1; END;", PL_SQL));
    }

    @Test
    void should_close_if_at_procedural_indent() {
        String out = SqlFormatter.format("BEGIN IF x THEN SELECT 1; END IF; END;", PL_SQL);

        assertTrue(out.startsWith("BEGIN\n  IF"), out);
        assertTrue(out.contains("\n    SELECT\n      1;"), out);
        assertTrue(out.endsWith("\n  END IF;\nEND;"), out);
    }

    @Test
    void should_align_sibling_blocks() {
        String sql = "BEGIN BEGIN SELECT 1; END; BEGIN SELECT 2; END; END;";
        assertEquals("BEGIN\n  BEGIN\n    SELECT\n      1;\n  END;\n  BEGIN\n    SELECT\n      2;\n  END;\nEND;",
                SqlFormatter.format(sql, PL_SQL));
    }

    @Test
    void should_use_custom_tokenizer_tables() {
        DialectConfig tables = DialectConfig.builder()
                .reservedTopLevelWords("SELECT", "FROM")
                .stringTypes("''")
                .openParens("(", "BEGIN")
                .closeParens(")", "END")
                .lineCommentTypes("--")
                .build();
        FormatConfig c = FormatConfig.builder().dialectConfig(tables).build();

        assertEquals("BEGIN\n  SELECT\n    1;\nEND;", SqlFormatter.format("BEGIN SELECT 1; END;", c));
    }

    @Test
    void should_format_same_with_explicit_tables() {
        DialectConfig tables = DialectConfig.builder()
                .reservedTopLevelWords("SELECT")
                .openParens("(")
                .closeParens(")")
                .build();

        assertEquals("select\n  f(a)", SqlFormatter.formatQuery(null, tables, null, "select f(a)"));
    }
}
