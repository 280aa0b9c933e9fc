package domain.format;

import java.util.ArrayList;
import java.util.List;

/**
 * Stack of indent markers.
 *
 * <p>The current indent is the indent unit repeated once per marker.
 * {@code TOP_LEVEL} markers come from clause keywords (SELECT, FROM ...),
 * {@code BLOCK_LEVEL} markers from parenthesised or keyword blocks and
 * {@code PROCEDURAL} markers from BEGIN bodies.</p>
 */
public final class Indentation {

    public enum Kind {
        TOP_LEVEL,
        BLOCK_LEVEL,
        PROCEDURAL
    }

    private final String unit;
    private final List<Kind> stack = new ArrayList<>();

    public Indentation(String unit) {
        this.unit = unit == null ? "" : unit;
    }

    public String getIndent() {
        return unit.repeat(stack.size());
    }

    public int depth() {
        return stack.size();
    }

    public void increaseTopLevel() {
        stack.add(Kind.TOP_LEVEL);
    }

    public void increaseBlockLevel() {
        stack.add(Kind.BLOCK_LEVEL);
    }

    /** Opens a BEGIN body. */
    public void increaseProcedural() {
        stack.add(Kind.PROCEDURAL);
    }

    /** Pops once, and only when the top marker is a top-level one. */
    public void decreaseTopLevel() {
        if (!stack.isEmpty() && top() == Kind.TOP_LEVEL) {
            stack.remove(stack.size() - 1);
        }
    }

    /**
     * Pops every top-level marker and then the first non top-level marker.
     * Collapses a block together with the clause indents it accumulated.
     */
    public void decreaseBlockLevel() {
        while (!stack.isEmpty()) {
            Kind k = stack.remove(stack.size() - 1);
            if (k != Kind.TOP_LEVEL) break;
        }
    }

    /** Removes the innermost procedural marker and everything above it. */
    public void decreaseProcedural() {
        for (int i = stack.size() - 1; i >= 0; i--) {
            if (stack.get(i) == Kind.PROCEDURAL) {
                stack.subList(i, stack.size()).clear();
                return;
            }
        }
    }

    /** Drops every non-procedural marker, leaving the BEGIN nesting as the indent. */
    public void resetToProceduralBase() {
        stack.removeIf(k -> k != Kind.PROCEDURAL);
    }

    public int getProceduralDepth() {
        int n = 0;
        for (Kind k : stack) {
            if (k == Kind.PROCEDURAL) n++;
        }
        return n;
    }

    public void reset() {
        stack.clear();
    }

    private Kind top() {
        return stack.get(stack.size() - 1);
    }
}
