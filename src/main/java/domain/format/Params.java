package domain.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Placeholder value lookup.
 *
 * <p>Keyed placeholders ({@code :name}, {@code ?2}, {@code $1}) look up the
 * named values first, then treat a numeric key as a position in the list
 * (0-based, or 1-based when {@code oneBasedIndex} is set). Bare placeholders
 * ({@code ?}) consume the list in order. A miss yields the fallback.</p>
 *
 * <p>Stateful: one instance per formatting run.</p>
 */
public final class Params {

    private final Map<String, String> named;
    private final List<String> positional;
    private final boolean oneBasedIndex;
    private int cursor;

    public Params(Map<String, String> named, List<String> positional, boolean oneBasedIndex) {
        this.named = named == null ? Collections.emptyMap() : new LinkedHashMap<>(named);
        this.positional = positional == null ? Collections.emptyList() : new ArrayList<>(positional);
        this.oneBasedIndex = oneBasedIndex;
    }

    public static Params none() {
        return new Params(null, null, false);
    }

    public boolean isEmpty() {
        return named.isEmpty() && positional.isEmpty();
    }

    public String get(String key, String fallback) {
        if (isEmpty()) return fallback;
        if (key != null && !key.isEmpty()) return getByKey(key, fallback);
        return next(fallback);
    }

    private String getByKey(String key, String fallback) {
        String v = named.get(key);
        if (v != null) return v;

        int idx;
        try {
            idx = Integer.parseInt(key);
        } catch (NumberFormatException e) {
            return fallback;
        }
        int pos = oneBasedIndex ? idx - 1 : idx;
        if (pos >= 0 && pos < positional.size()) return positional.get(pos);
        return fallback;
    }

    private String next(String fallback) {
        if (cursor >= positional.size()) return fallback;
        return positional.get(cursor++);
    }
}
