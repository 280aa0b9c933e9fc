package domain.dialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Built-in dialect per {@link Language}. Dialects are stateless and shared. */
public final class DialectRegistry {

    private static final Map<Language, Dialect> DIALECTS = createDialects();

    private DialectRegistry() {
    }

    private static Map<Language, Dialect> createDialects() {
        Map<Language, Dialect> m = new EnumMap<>(Language.class);
        register(m, new StandardSqlDialect());
        register(m, new PostgreSqlDialect());
        register(m, new MySqlDialect());
        register(m, new SqliteDialect());
        register(m, new PlSqlDialect());
        register(m, new Db2Dialect());
        register(m, new N1qlDialect());
        return Collections.unmodifiableMap(m);
    }

    private static void register(Map<Language, Dialect> m, Dialect d) {
        m.put(d.getLanguage(), d);
    }

    /** @return the dialect for {@code language}; standard SQL when null */
    public static Dialect get(Language language) {
        Dialect d = DIALECTS.get(language == null ? Language.STANDARD_SQL : language);
        if (d == null) throw new IllegalStateException("No dialect registered for " + language);
        return d;
    }

    public static List<Dialect> all() {
        return new ArrayList<>(DIALECTS.values());
    }
}
