package domain.format;

import domain.token.Token;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlignmentAnalyzerTest {

    private static List<Token> tokens(String sql) {
        return SqlFormatter.tokenize(sql, FormatConfig.defaults());
    }

    @Test
    void should_measure_item_as_rendered() {
        assertEquals(14, AlignmentAnalyzer.estimateWidth(tokens("coalesce(a, b)")));
        assertEquals(5, AlignmentAnalyzer.estimateWidth(tokens("t.col")));
        assertEquals(5, AlignmentAnalyzer.estimateWidth(tokens("a  +  b")));
    }

    @Test
    void should_split_select_items_only_at_own_depth() {
        assertEquals(Arrays.asList(14), AlignmentAnalyzer.selectColumnWidths(tokens("SELECT coalesce(a, b), c FROM t")));
    }

    @Test
    void should_report_one_width_per_select() {
        List<Integer> widths = AlignmentAnalyzer.selectColumnWidths(
                tokens("SELECT a, bbbbb FROM t; SELECT cc FROM u"));
        assertEquals(Arrays.asList(5, 2), widths);
    }

    @Test
    void should_measure_assignment_targets() {
        assertEquals(Arrays.asList(3),
                AlignmentAnalyzer.updateAssignmentWidths(tokens("UPDATE t SET a = 1, bbb = f(x, y) WHERE id = 3")));
        assertEquals(Arrays.asList(-1), AlignmentAnalyzer.updateAssignmentWidths(tokens("UPDATE t")));
    }

    @Test
    void should_mark_inserts_followed_by_values() {
        List<Boolean> markers = AlignmentAnalyzer.insertValuesMarkers(
                tokens("INSERT INTO t (a) VALUES (1); INSERT INTO u SELECT * FROM t"));
        assertEquals(Arrays.asList(true, false), markers);
    }

    @Test
    void should_normalize_keyword_spacing_and_case() {
        List<Token> t = tokens("group\n  by");
        assertEquals("GROUP BY", AlignmentAnalyzer.keyword(t.get(0)));
        assertTrue(AlignmentAnalyzer.isInsertKeyword("INSERT INTO"));
        assertFalse(AlignmentAnalyzer.isInsertKeyword("INSERTED"));
    }
}
