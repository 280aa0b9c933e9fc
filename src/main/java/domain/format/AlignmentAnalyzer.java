package domain.format;

import domain.token.Token;
import domain.token.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pre-pass that measures alignment targets before rendering.
 *
 * <p>One entry is produced per SELECT, UPDATE and INSERT keyword, in document
 * order, so the renderer can advance a cursor each time it meets the same
 * keyword. A width of {@code -1} means the clause is not aligned.</p>
 *
 * <p>Widths estimate the rendered single-line text of a list item: token
 * text joined by single spaces, with no space around {@code .} and special
 * operators, after {@code (} or before {@code )} and {@code ,}. Only commas
 * at the clause's own paren depth split items. An item holding a paren region
 * that cannot stay inline renders over several lines and is left out of the
 * width.</p>
 */
final class AlignmentAnalyzer {

    static final Set<String> SELECT_TERMINATORS = Set.of(
            "FROM", "WHERE", "GROUP BY", "ORDER BY", "HAVING", "LIMIT", "UNION", "INTERSECT", "EXCEPT");
    static final Set<String> UPDATE_SET_TERMINATORS = Set.of("WHERE", "FROM", "RETURNING");
    static final Set<String> INSERT_VALUES_TERMINATORS = Set.of("WHERE", "FROM", "RETURNING", "ON");

    private AlignmentAnalyzer() {
    }

    /** Widest column per SELECT list. */
    static List<Integer> selectColumnWidths(List<Token> tokens) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (isClauseKeyword(t) && "SELECT".equals(keyword(t))) {
                out.add(measureSelect(tokens, i));
            }
        }
        return out;
    }

    /** Widest assignment target (left of {@code =}) per UPDATE ... SET list. */
    static List<Integer> updateAssignmentWidths(List<Token> tokens) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (isClauseKeyword(t) && "UPDATE".equals(keyword(t))) {
                out.add(measureUpdateSet(tokens, i));
            }
        }
        return out;
    }

    /** Per INSERT: whether a VALUES list follows in the same statement. */
    static List<Boolean> insertValuesMarkers(List<Token> tokens) {
        List<Boolean> out = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (isClauseKeyword(t) && isInsertKeyword(keyword(t))) {
                out.add(findValues(tokens, i) >= 0);
            }
        }
        return out;
    }

    // ------------------------------------------------------------------

    private static int measureSelect(List<Token> tokens, int selectIndex) {
        List<List<Token>> items = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        boolean multiline = false;
        int depth = 0;

        for (int i = selectIndex + 1; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (depth == 0 && (isClauseKeyword(t) && SELECT_TERMINATORS.contains(keyword(t)) || t.valueIs(";"))) {
                break;
            }
            if (t.is(TokenType.OPEN_PAREN)) {
                if (depth == 0 && !InlineBlock.isInlineBlock(tokens, i)) multiline = true;
                depth++;
            }
            if (t.is(TokenType.CLOSE_PAREN)) {
                if (depth == 0) break;
                depth--;
            }
            if (depth == 0 && t.valueIs(",")) {
                if (!multiline) items.add(current);
                current = new ArrayList<>();
                multiline = false;
                continue;
            }
            current.add(t);
        }
        if (!multiline) items.add(current);
        return widest(items);
    }

    private static int measureUpdateSet(List<Token> tokens, int updateIndex) {
        int setIndex = -1;
        for (int i = updateIndex + 1; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.valueIs(";") || isClauseKeyword(t) && "UPDATE".equals(keyword(t))) break;
            if (isClauseKeyword(t) && "SET".equals(keyword(t))) {
                setIndex = i;
                break;
            }
        }
        if (setIndex < 0) return -1;

        List<List<Token>> targets = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        boolean inTarget = true;
        int depth = 0;

        for (int i = setIndex + 1; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (depth == 0 && (isClauseKeyword(t) && UPDATE_SET_TERMINATORS.contains(keyword(t)) || t.valueIs(";"))) {
                break;
            }
            if (t.is(TokenType.OPEN_PAREN)) depth++;
            if (t.is(TokenType.CLOSE_PAREN)) {
                if (depth == 0) break;
                depth--;
            }
            if (depth == 0 && t.valueIs("=") && inTarget) {
                targets.add(current);
                current = new ArrayList<>();
                inTarget = false;
                continue;
            }
            if (depth == 0 && t.valueIs(",")) {
                current = new ArrayList<>();
                inTarget = true;
                continue;
            }
            if (inTarget) current.add(t);
        }
        if (targets.isEmpty()) return -1;
        return widest(targets);
    }

    private static int findValues(List<Token> tokens, int insertIndex) {
        for (int i = insertIndex + 1; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.valueIs(";")) return -1;
            if (isClauseKeyword(t)) {
                String k = keyword(t);
                if ("VALUES".equals(k)) return i;
                if (isInsertKeyword(k)) return -1;
            }
        }
        return -1;
    }

    private static int widest(List<List<Token>> items) {
        int max = -1;
        for (List<Token> item : items) {
            int w = estimateWidth(item);
            if (w > 0 && w > max) max = w;
        }
        return max;
    }

    static int estimateWidth(List<Token> item) {
        int width = 0;
        boolean first = true;
        boolean glueNext = false;
        boolean sawWhitespace = false;

        for (Token t : item) {
            if (t.is(TokenType.WHITESPACE)) {
                sawWhitespace = true;
                continue;
            }
            if (t.getType() != null && t.getType().isComment()) continue;

            boolean glueBefore = t.valueIs(".")
                    || t.valueIs(",")
                    || t.is(TokenType.SPECIAL_OPERATOR)
                    || t.is(TokenType.CLOSE_PAREN) && ")".equals(t.getValue())
                    || t.valueIs(":")
                    || t.is(TokenType.OPEN_PAREN) && "(".equals(t.getValue()) && !sawWhitespace;

            if (!first && !glueNext && !glueBefore) width++;
            width += ColorConfig.visibleLength(collapse(t.getValue()));

            glueNext = t.valueIs(".")
                    || t.is(TokenType.SPECIAL_OPERATOR)
                    || t.is(TokenType.OPEN_PAREN) && "(".equals(t.getValue());
            first = false;
            sawWhitespace = false;
        }
        return width;
    }

    static boolean isClauseKeyword(Token t) {
        return t.is(TokenType.RESERVED_TOP_LEVEL) || t.is(TokenType.RESERVED_TOP_LEVEL_NO_INDENT);
    }

    static boolean isInsertKeyword(String keyword) {
        return keyword.equals("INSERT") || keyword.startsWith("INSERT ");
    }

    /** Upper-cased value with whitespace runs collapsed. */
    static String keyword(Token t) {
        return collapse(t.getValue()).toUpperCase(Locale.ROOT);
    }

    private static String collapse(String s) {
        return s.trim().replaceAll("\\s+", " ");
    }
}
