package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with best-effort de-duplication.
 *
 * <p>Deduplicated by (code|sqlId|message|detail).</p>
 */
public final class ListFormatWarningSink implements FormatWarningSink {

    private final List<FormatWarning> target;
    private final Set<String> seen = new HashSet<>(256);

    public ListFormatWarningSink(List<FormatWarning> target) {
        this.target = target;
    }

    private static String key(FormatWarning w) {
        return w.getCode().name() + "|"
                + w.getSqlId() + "|"
                + w.getMessage() + "|"
                + w.getDetail();
    }

    @Override
    public void warn(FormatWarning warning) {
        if (warning == null || target == null) return;
        if (seen.add(key(warning))) {
            target.add(warning);
        }
    }
}
