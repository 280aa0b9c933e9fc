package domain.dialect;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Best-effort dialect guess from a file name and its content.
 *
 * <p>The extension wins when it names a dialect ({@code .pgsql}, {@code .mysql.sql},
 * {@code .ora.sql}, ...). Otherwise content indicators are checked in the
 * order PostgreSQL, PL/SQL, MySQL, SQLite, most specific first.</p>
 */
public final class DialectDetector {

    private static final List<Pattern> POSTGRESQL = compile(
            "::[a-zA-Z_][a-zA-Z0-9_]*", "\\$\\$", "\\$[0-9]+", "\\breturning\\b", "->>", "#>", "@>", "<@",
            "\\bjsonb?\\b", "\\bserial\\b", "\\bbigserial\\b", "\\bregclass\\b", "\\bregtype\\b",
            "\\bregproc\\b", "\\bregnamespace\\b", "\\btsvector\\b", "\\btsquery\\b", "\\bint4range\\b",
            "\\bint8range\\b", "\\bnumrange\\b", "\\btsrange\\b", "\\btstzrange\\b", "\\bdaterange\\b",
            "\\bgenerate_series\\b", "\\bunnest\\b", "\\barray_agg\\b", "\\bstring_agg\\b", "\\blateral\\b");

    private static final List<Pattern> PL_SQL = compile(
            "\\bbegin\\b[^;]*\\bexception\\b", "\\bbegin\\b.*?\\bend\\b\\s*;", "\\bexception\\b.*\\bwhen\\b",
            "\\bcreate\\b.*\\bprocedure\\b", "\\bcreate\\b.*\\bfunction\\b", "\\bcreate\\b.*\\bpackage\\b",
            "\\bcreate\\b.*\\btrigger\\b", "\\bpackage\\b.*\\bbody\\b", "\\braise\\b",
            "\\bexecute immediate\\b", "\\bopen\\b.*\\bfor\\b", "\\bfetch\\b.*\\binto\\b", "\\bclose\\b",
            "\\bref cursor\\b", "\\bsys_refcursor\\b", "\\bbulk collect\\b", "\\bforall\\b",
            "\\btype\\b.*\\bis\\b", "\\brecord\\b", "\\bvarray\\b", "\\bnested table\\b", "\\bindex by\\b",
            "\\bpls_integer\\b", "\\bbinary_integer\\b", "\\bnatural\\b", "\\bpositive\\b",
            "\\bsimple_integer\\b", "\\bboolean\\b", "\\btrue\\b", "\\bfalse\\b");

    private static final List<Pattern> MYSQL = compile(
            "`[^`]+`", "\\bon duplicate key update\\b", "\\binsert ignore\\b", "\\breplace into\\b",
            "\\blower\\([^)]+\\)", "\\bupper\\([^)]+\\)", "\\bgroup_concat\\b", "\\bfound_rows\\b",
            "\\brow_count\\b", "\\blast_insert_id\\b", "\\bauto_increment\\b", "\\bengine\\s*=\\s*[a-zA-Z_]+",
            "\\bcharset\\s*=\\s*[a-zA-Z_]+", "\\bcollate\\s*=\\s*[a-zA-Z_]+", "\\bstraight_join\\b",
            "\\bforce index\\b", "\\buse index\\b", "\\bignore index\\b", "\\block in share mode\\b",
            "\\bfor update\\b", "\\bjson_extract\\b", "\\bjson_unquote\\b", "\\bjson_type\\b");

    private static final List<Pattern> SQLITE = compile(
            "\\bpragma\\s+[a-zA-Z_][a-zA-Z0-9_]*\\b", "\\bwithout rowid\\b", "\\bautoincrement\\b",
            "\\battach\\b.*\\bdatabase\\b", "\\bdetach\\b.*\\bdatabase\\b", "\\breindex\\b", "\\bvacuum\\b",
            "\\banalyze\\b", "\\bexplain query plan\\b", "\\browid\\b", "\\b_oid\\b", "\\bforeign_keys\\b",
            "\\bjournal_mode\\b", "\\bsynchronous\\b", "\\bcache_size\\b", "\\btemp_store\\b",
            "\\btable_info\\b", "\\bindex_info\\b", "\\bindex_list\\b", "\\bdatabase_list\\b",
            "\\bforeign_key_list\\b", "\\bcollation_list\\b", "\\bfunction_list\\b", "\\bmodule_list\\b",
            "\\bpragma_list\\b", "\\bstatistics\\b", "\\bcompile_options\\b");

    private DialectDetector() {
    }

    public static Optional<Language> detect(Path file, String content) {
        Optional<Language> byName = fromFileName(file == null ? null : file.getFileName());
        if (byName.isPresent()) return byName;
        return fromContent(content);
    }

    static Optional<Language> fromFileName(Path fileName) {
        if (fileName == null) return Optional.empty();
        String base = fileName.toString().toLowerCase(Locale.ROOT);

        // compound extensions first
        if (base.endsWith(".mysql.sql") || base.endsWith(".my.sql")) return Optional.of(Language.MYSQL);
        if (base.endsWith(".psql.sql") || base.endsWith(".pgsql.sql")) return Optional.of(Language.POSTGRESQL);
        if (base.endsWith(".sqlite.sql") || base.endsWith(".db.sql")) return Optional.of(Language.SQLITE);
        if (base.endsWith(".plsql.sql") || base.endsWith(".ora.sql")) return Optional.of(Language.PL_SQL);

        if (base.endsWith(".psql") || base.endsWith(".pgsql")) return Optional.of(Language.POSTGRESQL);
        if (base.endsWith(".mysql")) return Optional.of(Language.MYSQL);
        if (base.endsWith(".sqlite")) return Optional.of(Language.SQLITE);
        if (base.endsWith(".plsql") || base.endsWith(".ora")) return Optional.of(Language.PL_SQL);

        // embedded: schema.mysql.v2.sql
        if (base.contains(".mysql.")) return Optional.of(Language.MYSQL);
        if (base.contains(".psql.") || base.contains(".pgsql.")) return Optional.of(Language.POSTGRESQL);
        if (base.contains(".sqlite.")) return Optional.of(Language.SQLITE);
        if (base.contains(".plsql.") || base.contains(".ora.")) return Optional.of(Language.PL_SQL);

        return Optional.empty();
    }

    static Optional<Language> fromContent(String content) {
        if (content == null || content.isBlank()) return Optional.empty();
        String lower = content.toLowerCase(Locale.ROOT);

        if (matchesAny(lower, POSTGRESQL)) return Optional.of(Language.POSTGRESQL);
        if (matchesAny(lower, PL_SQL)) return Optional.of(Language.PL_SQL);
        if (matchesAny(lower, MYSQL)) return Optional.of(Language.MYSQL);
        if (matchesAny(lower, SQLITE)) return Optional.of(Language.SQLITE);
        return Optional.empty();
    }

    private static boolean matchesAny(String content, List<Pattern> patterns) {
        for (Pattern p : patterns) {
            if (p.matcher(content).find()) return true;
        }
        return false;
    }

    private static List<Pattern> compile(String... regexes) {
        Pattern[] out = new Pattern[regexes.length];
        for (int i = 0; i < regexes.length; i++) out[i] = Pattern.compile(regexes[i]);
        return List.of(out);
    }
}
