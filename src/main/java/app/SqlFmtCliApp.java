package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import cli.CliProgressMonitor;
import cli.SqlFmtCli;
import domain.dialect.Dialect;
import domain.dialect.DialectDetector;
import domain.dialect.DialectRegistry;
import domain.dialect.Language;
import domain.format.FormatConfig;
import domain.format.SqlFormatter;
import domain.model.FormatResult;
import domain.model.FormatWarning;
import domain.model.FormatWarningSink;
import domain.model.ListFormatWarningSink;
import domain.model.WarningCode;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import domain.text.SqlSource;
import infra.config.ConfigFile;
import infra.config.IgnoreFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * CLI entry (invoked by {@link SqlFmtCli}).
 *
 * <p>{@code format} prints SQL on the output stream, so its diagnostics go to
 * the error stream. {@code batch} logs its progress on the output stream.</p>
 */
public final class SqlFmtCliApp {

    public static final int EXIT_OK = 0;
    public static final int EXIT_CHECK_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private SqlFmtCliApp() {}

    public static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Map<String, String> argv = CliArgParser.parseArgs(args);
        List<String> positionals = CliArgParser.positionals(args);

        if (CliArgParser.flag(argv, "help")) {
            printUsage(out);
            return EXIT_OK;
        }
        if (positionals.isEmpty()) {
            printUsage(err);
            return EXIT_USAGE;
        }

        String command = positionals.get(0).toLowerCase(Locale.ROOT);
        List<String> inputs = positionals.subList(1, positionals.size());
        SqlFmtComponentsFactory factory = new SqlFmtComponentsFactory();

        try {
            switch (command) {
                case "format":
                    return format(argv, inputs, factory, in, out, err);
                case "check":
                    return check(argv, inputs, factory, in, out, err);
                case "dialects":
                    return dialects(out);
                case "batch":
                    return batch(argv, factory, out);
                default:
                    err.println("[ERROR] unknown command: " + command);
                    printUsage(err);
                    return EXIT_USAGE;
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            // 설정/입력 오류: 메시지만 출력하고 usage 종료코드
            err.println("[ERROR] " + e.getMessage());
            if (e.getCause() != null) {
                err.println("        cause=" + e.getCause().getClass().getName() + ": " + safe(e.getCause().getMessage()));
            }
            return EXIT_USAGE;
        }
    }

    // ------------------------------------------------------------
    // format
    // ------------------------------------------------------------
    private static int format(Map<String, String> argv, List<String> inputs, SqlFmtComponentsFactory factory,
                              InputStream in, PrintStream out, PrintStream err) {
        Path baseDir = CliPathResolver.resolveBaseDir(argv);
        FormatConfig cfg = buildConfig(argv, baseDir, factory, err);
        boolean autoDetect = CliArgParser.flag(argv, "autoDetect") && !argv.containsKey("lang");
        boolean color = CliArgParser.flag(argv, "color");
        boolean write = CliArgParser.flag(argv, "write");

        if (inputs.isEmpty()) {
            String sql = readAll(in);
            out.println(formatText(sql, null, cfg, autoDetect, color));
            return EXIT_OK;
        }

        List<Path> files = selectFiles(baseDir, inputs, factory, err);
        int rewritten = 0;
        for (Path file : files) {
            SqlSource src = factory.loadFile(file);

            if (write) {
                // --write 는 색상을 쓰지 않는다 (파일에 ANSI 코드가 들어가면 안 됨)
                String formatted = formatText(src.getSqlText(), file, cfg, autoDetect, false);
                if (!isFormatted(src.getSqlText(), formatted)) {
                    writeFile(file, formatted);
                    rewritten++;
                    err.println("[WRITE] " + file);
                }
                continue;
            }

            String formatted = formatText(src.getSqlText(), file, cfg, autoDetect, color);
            if (files.size() > 1) out.println("-- " + file);
            out.println(formatted);
        }

        if (write) {
            err.println("[DONE] files=" + files.size() + ", rewritten=" + rewritten);
        }
        return EXIT_OK;
    }

    // ------------------------------------------------------------
    // check
    // ------------------------------------------------------------
    private static int check(Map<String, String> argv, List<String> inputs, SqlFmtComponentsFactory factory,
                             InputStream in, PrintStream out, PrintStream err) {
        Path baseDir = CliPathResolver.resolveBaseDir(argv);
        FormatConfig cfg = buildConfig(argv, baseDir, factory, err);
        boolean autoDetect = CliArgParser.flag(argv, "autoDetect") && !argv.containsKey("lang");

        if (inputs.isEmpty()) {
            String sql = readAll(in);
            if (isFormatted(sql, formatText(sql, null, cfg, autoDetect, false))) return EXIT_OK;
            out.println("[CHECK] <stdin> is not formatted");
            return EXIT_CHECK_FAILED;
        }

        List<Path> files = selectFiles(baseDir, inputs, factory, err);
        int unformatted = 0;
        for (Path file : files) {
            SqlSource src = factory.loadFile(file);
            String formatted = formatText(src.getSqlText(), file, cfg, autoDetect, false);
            if (!isFormatted(src.getSqlText(), formatted)) {
                unformatted++;
                out.println("[CHECK] " + file + " is not formatted");
            }
        }

        out.println("[STAT] checked=" + files.size() + ", unformatted=" + unformatted);
        return unformatted == 0 ? EXIT_OK : EXIT_CHECK_FAILED;
    }

    // ------------------------------------------------------------
    // dialects
    // ------------------------------------------------------------
    private static int dialects(PrintStream out) {
        for (Dialect d : DialectRegistry.all()) {
            Language l = d.getLanguage();
            out.printf("%-12s %-14s keywords=%s%n",
                    l.tag(), l.name(), l.prefersUppercaseKeywords() ? "upper" : "lower");
        }
        return EXIT_OK;
    }

    // ------------------------------------------------------------
    // batch
    // ------------------------------------------------------------
    private static int batch(Map<String, String> argv, SqlFmtComponentsFactory factory, PrintStream out) {
        long t0 = System.nanoTime();
        Path baseDir = CliPathResolver.resolveBaseDir(argv);

        String csvRaw = CliPathResolver.trimToNull(argv.get("csv"));
        if (csvRaw == null) {
            throw new IllegalArgumentException("batch requires --csv=<file>");
        }
        Path csvPath = CliPathResolver.resolvePath(baseDir, csvRaw);
        Path outDir = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("out", "output/sqlfmt"));
        Path resultXlsx = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("result", "output/sqlfmt-result.xlsx"));

        int max = CliArgParser.parseInt(argv.get("max"), -1);
        int logEvery = Math.max(1, CliArgParser.parseInt(argv.get("logEvery"), 100));
        long slowMs = CliArgParser.parseLong(argv.get("slowMs"), 500L);
        boolean failFast = CliArgParser.flag(argv, "failFast");
        boolean autoDetect = CliArgParser.flag(argv, "autoDetect") && !argv.containsKey("lang");

        // feature toggles (presence-style)
        boolean noSqlOut = CliArgParser.flag(argv, "noSqlOut");
        boolean noResult = CliArgParser.flag(argv, "noResult");

        out.println("==================================================");
        out.println("[START] SQL batch formatting");
        out.println("[CONF] baseDir      = " + baseDir);
        out.println("[CONF] csv          = " + csvPath);
        out.println("[CONF] out          = " + outDir);
        out.println("[CONF] result       = " + resultXlsx);
        out.println("[CONF] max          = " + max);
        out.println("[CONF] logEvery     = " + logEvery);
        out.println("[CONF] slowMs       = " + slowMs);
        out.println("[CONF] failFast     = " + failFast);
        out.println("[CONF] autoDetect   = " + autoDetect);
        out.println("[CONF] enableSqlOut = " + (!noSqlOut) + " (use --noSqlOut)");
        out.println("[CONF] enableResult = " + (!noResult) + " (use --noResult)");

        FormatConfig cfg = buildConfig(argv, baseDir, factory, out);
        out.println("[CONF] language     = " + cfg.getLanguage().tag());
        out.println("==================================================");

        CliPathResolver.validateFileExists(csvPath, "batch csv (--csv)");

        // warnings (collected even when result xlsx is disabled)
        List<FormatWarning> warnings = new ArrayList<>(128);
        FormatWarningSink warningSink = new ListFormatWarningSink(warnings);

        long tCsv0 = System.nanoTime();
        out.println("[STEP1] loading csv...");
        List<SqlSource> sources = factory.loadBatchSources(csvPath);
        out.println("[STEP1] csv loaded. size=" + sources.size() + ", elapsed=" + ms(tCsv0) + "ms");

        if (max > 0 && sources.size() > max) {
            sources = sources.subList(0, max);
            out.println("[STEP1] apply max => truncated to " + sources.size());
        }

        SqlOutputWriter sqlOutputWriter = factory.createSqlOutputWriter(!noSqlOut);
        ResultWriter resultWriter = factory.createResultWriter(!noResult);

        int total = sources.size();
        CliProgressMonitor.reset();
        Thread heartbeat = CliProgressMonitor.startHeartbeat(total, CliProgressMonitor.DEFAULT_HEARTBEAT_MS);

        long tLoop0 = System.nanoTime();
        out.println("[STEP2] formatting start. total=" + total);

        List<FormatResult> results = new ArrayList<>(Math.max(16, total));
        int success = 0;
        int skip = 0;
        boolean aborted = false;

        try {
            for (int i = 0; i < total; i++) {
                SqlSource src = sources.get(i);
                String id = src.getId();
                FormatConfig rowCfg = rowConfig(src, cfg, autoDetect, warningSink);
                String lang = rowCfg.getLanguage().tag();
                CliProgressMonitor.setCurrent(id, lang, i + 1);

                if (src.isBlank()) {
                    skip++;
                    results.add(FormatResult.skip(id, lang, WarningCode.SQL_TEXT_EMPTY.name()));
                    warningSink.warn(FormatWarning.of(WarningCode.SQL_TEXT_EMPTY, id, "SQL text empty"));
                } else {
                    long one0 = System.nanoTime();
                    try {
                        String formatted = SqlFormatter.format(src.getSqlText(), rowCfg);
                        sqlOutputWriter.write(outDir, id, formatted);

                        success++;
                        FormatResult ok = FormatResult.success(id, lang, src.getSqlText(), formatted, ms(one0));
                        CliProgressMonitor.recordFormatted(ok.getOutputLines(), ok.isChanged());
                        results.add(ok);
                    } catch (RuntimeException e) {
                        skip++;
                        results.add(FormatResult.error(id, lang, src.getSqlText(), ms(one0),
                                e.getClass().getSimpleName()));
                        warningSink.warn(new FormatWarning(WarningCode.FORMAT_ERROR, id,
                                e.getClass().getSimpleName(), safe(e.getMessage())));

                        out.println("[ERROR] format/write failed: " + id);
                        out.println("        ex=" + e.getClass().getName() + ": " + safe(e.getMessage()));

                        if (failFast) {
                            out.println("[FAILFAST] stop on first error.");
                            aborted = true;
                            break;
                        }
                    }

                    long oneMs = ms(one0);
                    if (oneMs >= slowMs) {
                        out.println("[SLOW] " + oneMs + "ms : " + id);
                        warningSink.warn(new FormatWarning(WarningCode.SLOW_SQL, id,
                                "slowMs=" + slowMs + ", actualMs=" + oneMs, ""));
                    }
                }

                if ((i + 1) % logEvery == 0 || (i + 1) == total) {
                    CliProgressMonitor.logProgress(i + 1, total, success, skip, tLoop0);
                }
            }
        } finally {
            heartbeat.interrupt();
        }

        out.println("[STEP2] formatting done. elapsed=" + ms(tLoop0) + "ms");
        out.println("[STAT] success=" + success + ", skip=" + skip);
        out.println("[STAT] warnings=" + warnings.size());

        if (!noResult) {
            long tXlsx0 = System.nanoTime();
            out.println("[STEP3] writing result xlsx... rows=" + results.size());
            resultWriter.write(resultXlsx, results, warnings);
            out.println("[STEP3] result xlsx written. elapsed=" + ms(tXlsx0) + "ms");
        } else {
            out.println("[STEP3] result xlsx skipped (--noResult). rows=" + results.size());
        }

        out.println("==================================================");
        out.println("[DONE] totalElapsed=" + ms(t0) + "ms");
        out.println("==================================================");
        return aborted ? EXIT_CHECK_FAILED : EXIT_OK;
    }

    /** 행 단위 언어: lang 컬럼 > (옵션) 내용 기반 감지 > 실행 기본값. */
    private static FormatConfig rowConfig(SqlSource src, FormatConfig cfg, boolean autoDetect, FormatWarningSink sink) {
        if (src.hasLanguageTag()) {
            try {
                return cfg.toBuilder().language(CliArgParser.parseLanguage(src.getLanguageTag())).build();
            } catch (IllegalArgumentException e) {
                sink.warn(new FormatWarning(WarningCode.LANGUAGE_UNKNOWN, src.getId(),
                        "unknown language: " + src.getLanguageTag(), "using " + cfg.getLanguage().tag()));
                return cfg;
            }
        }
        if (autoDetect) {
            Optional<Language> detected = DialectDetector.detect(null, src.getSqlText());
            if (detected.isPresent()) return cfg.toBuilder().language(detected.get()).build();
        }
        return cfg;
    }

    // ------------------------------------------------------------
    // config: CLI option > config file > defaults
    // ------------------------------------------------------------
    static FormatConfig buildConfig(Map<String, String> argv, Path baseDir, SqlFmtComponentsFactory factory,
                                    PrintStream log) {
        FormatConfig.Builder b = FormatConfig.builder();

        if (!CliArgParser.flag(argv, "noConfig")) {
            Path explicit = CliPathResolver.resolvePath(baseDir, argv.get("config"));
            Path home = Paths.get(System.getProperty("user.home"));
            Optional<ConfigFile> cf = factory.loadConfigFile(explicit, baseDir, home);
            if (cf.isPresent()) {
                log.println("[CONF] config       = " + cf.get().getSource());
                cf.get().applyTo(b);
            }
        }

        if (argv.containsKey("lang")) b.language(CliArgParser.parseLanguage(argv.get("lang")));
        if (argv.containsKey("indent")) b.indent(parseIndent(argv.get("indent")));
        if (argv.containsKey("keywordCase")) b.keywordCase(CliArgParser.parseKeywordCase(argv.get("keywordCase")));
        if (CliArgParser.flag(argv, "uppercase")) b.uppercase(true);
        if (argv.containsKey("linesBetween")) b.linesBetweenQueries(CliArgParser.requireInt(argv, "linesBetween"));
        if (argv.containsKey("maxLineLength")) b.maxLineLength(CliArgParser.requireInt(argv, "maxLineLength"));
        if (argv.containsKey("commentSpacing")) b.commentMinSpacing(CliArgParser.requireInt(argv, "commentSpacing"));
        if (argv.containsKey("alignColumns")) b.alignColumnNames(CliArgParser.flag(argv, "alignColumns"));
        if (argv.containsKey("alignAssignments")) b.alignAssignments(CliArgParser.flag(argv, "alignAssignments"));
        if (argv.containsKey("alignValues")) b.alignValues(CliArgParser.flag(argv, "alignValues"));

        return b.build();
    }

    /** 숫자면 공백 n개, "tab" 이면 탭 하나, 그 외는 그대로. */
    static String parseIndent(String raw) {
        if (raw == null || raw.isEmpty()) return FormatConfig.DEFAULT_INDENT;
        if ("tab".equalsIgnoreCase(raw.trim())) return "\t";
        if (raw.trim().matches("\\d+")) return " ".repeat(Integer.parseInt(raw.trim()));
        return raw;
    }

    static String formatText(String sql, Path file, FormatConfig cfg, boolean autoDetect, boolean color) {
        FormatConfig eff = cfg;
        if (autoDetect) {
            Optional<Language> detected = DialectDetector.detect(file, sql);
            if (detected.isPresent()) eff = cfg.toBuilder().language(detected.get()).build();
        }
        return color ? SqlFormatter.prettyFormat(sql, eff) : SqlFormatter.format(sql, eff);
    }

    /** 파일 끝의 개행 차이는 무시한다. */
    static boolean isFormatted(String content, String formatted) {
        String c = content == null ? "" : content.replace("\r\n", "\n");
        int end = c.length();
        while (end > 0 && (c.charAt(end - 1) == '\n' || c.charAt(end - 1) == ' ' || c.charAt(end - 1) == '\t')) {
            end--;
        }
        return c.substring(0, end).equals(formatted);
    }

    private static List<Path> selectFiles(Path baseDir, List<String> inputs, SqlFmtComponentsFactory factory,
                                          PrintStream log) {
        IgnoreFile ignore = factory.loadIgnoreFile(baseDir);
        List<Path> out = new ArrayList<>();
        for (Path p : CliPathResolver.expandSqlFiles(baseDir, inputs)) {
            if (ignore.isIgnored(p)) {
                log.println("[SKIP] ignored: " + p);
                continue;
            }
            out.add(p);
        }
        return out;
    }

    private static void writeFile(Path file, String formatted) {
        try {
            Files.writeString(file, formatted + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file, e);
        }
    }

    private static String readAll(InputStream in) {
        try {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read stdin", e);
        }
    }

    private static void printUsage(PrintStream ps) {
        ps.println("usage: sqlfmt <command> [--key=value | --flag] [files...]");
        ps.println("commands:");
        ps.println("  format [files...]   format files (stdin when none) to stdout, --write rewrites in place");
        ps.println("  check [files...]    exit 1 when a file is not formatted");
        ps.println("  dialects            list supported languages");
        ps.println("  batch --csv=<file>  format id,sql[,lang] rows into --out and report to --result");
        ps.println("options: --lang --indent --keywordCase --uppercase --linesBetween --maxLineLength");
        ps.println("         --alignColumns --alignAssignments --alignValues --commentSpacing");
        ps.println("         --color --autoDetect --config --noConfig --baseDir");
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String safe(String s) {
        return (s == null) ? "" : s;
    }
}
