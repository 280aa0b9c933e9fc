package domain.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Openers of keyword blocks (BEGIN, IF, CASE, WHILE, LOOP, REPEAT) in nesting
 * order. A closing keyword pops the innermost opener regardless of which
 * {@code END ...} form it is.
 */
final class ProceduralBlockStack {

    private static final Set<String> OPENERS = Set.of("BEGIN", "IF", "CASE", "WHILE", "LOOP", "REPEAT");
    private static final Set<String> STATEMENT_OPENERS = Set.of("IF", "WHILE", "LOOP", "REPEAT");

    private final List<String> blocks = new ArrayList<>();

    static boolean isProceduralOpener(String keyword) {
        return OPENERS.contains(keyword);
    }

    /** Openers that start a statement of their own inside a BEGIN body. */
    static boolean isStatementOpener(String keyword) {
        return STATEMENT_OPENERS.contains(keyword);
    }

    void push(String keyword) {
        blocks.add(keyword);
    }

    /** @return the innermost opener, or {@code ""} when empty */
    String pop() {
        if (blocks.isEmpty()) return "";
        return blocks.remove(blocks.size() - 1);
    }

    int size() {
        return blocks.size();
    }

    boolean isEmpty() {
        return blocks.isEmpty();
    }
}
