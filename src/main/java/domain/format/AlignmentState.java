package domain.format;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Render-time view of the alignment pre-pass: which aligned clause, if any,
 * the renderer is currently inside, and the paren depth that clause opened at.
 *
 * <p>Every clause keyword clears the active clause; SELECT, SET and VALUES
 * then re-enter one when the pre-pass recorded a target for them.</p>
 */
final class AlignmentState {

    private final List<Integer> selectWidths;
    private final List<Integer> assignmentWidths;
    private final List<Boolean> valuesMarkers;

    private int selectCursor = -1;
    private int updateCursor = -1;
    private int insertCursor = -1;
    private final Set<Integer> usedSets = new HashSet<>();
    private final Set<Integer> usedValues = new HashSet<>();

    private boolean inSelect;
    private boolean inSet;
    private boolean inValues;
    private int clauseDepth;

    AlignmentState(List<Integer> selectWidths, List<Integer> assignmentWidths, List<Boolean> valuesMarkers) {
        this.selectWidths = selectWidths;
        this.assignmentWidths = assignmentWidths;
        this.valuesMarkers = valuesMarkers;
    }

    void onClauseKeyword(String keyword, int parenDepth) {
        reset();
        clauseDepth = parenDepth;

        if ("SELECT".equals(keyword)) {
            selectCursor++;
            inSelect = selectWidth() >= 0;
        } else if ("UPDATE".equals(keyword)) {
            updateCursor++;
        } else if (AlignmentAnalyzer.isInsertKeyword(keyword)) {
            insertCursor++;
        } else if ("SET".equals(keyword)) {
            inSet = assignmentWidth() >= 0 && usedSets.add(updateCursor);
        } else if ("VALUES".equals(keyword)) {
            inValues = insertCursor >= 0 && insertCursor < valuesMarkers.size()
                    && valuesMarkers.get(insertCursor) && usedValues.add(insertCursor);
        }
    }

    /** Leaves whatever clause is active; cursors keep their position. */
    void reset() {
        inSelect = false;
        inSet = false;
        inValues = false;
    }

    boolean isActive() {
        return inSelect || inSet || inValues;
    }

    boolean isInSelect() {
        return inSelect;
    }

    boolean isInSet() {
        return inSet;
    }

    boolean isInValues() {
        return inValues;
    }

    int selectDepth() {
        return clauseDepth;
    }

    int setDepth() {
        return clauseDepth;
    }

    int valuesDepth() {
        return clauseDepth;
    }

    int selectWidth() {
        return at(selectWidths, selectCursor);
    }

    int assignmentWidth() {
        return at(assignmentWidths, updateCursor);
    }

    private static int at(List<Integer> widths, int cursor) {
        if (cursor < 0 || cursor >= widths.size()) return -1;
        return widths.get(cursor);
    }
}
