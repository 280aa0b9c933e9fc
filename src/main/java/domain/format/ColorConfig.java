package domain.format;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * ANSI decoration per token class.
 *
 * <p>Each option wraps every non-empty line of a token's text with its code
 * and a reset. Options are applied in list order, so the first one ends up
 * innermost.</p>
 */
public final class ColorConfig {

    private static final Pattern ANSI_ESCAPE = Pattern.compile("\u001b\\[[0-9;]*m");

    private static final ColorConfig NONE = new ColorConfig(
            Collections.emptyList(), Collections.emptyList(), Collections.emptyList(),
            Collections.emptyList(), Collections.emptyList(), Collections.emptyList());

    private final List<AnsiFormat> reservedWord;
    private final List<AnsiFormat> string;
    private final List<AnsiFormat> number;
    private final List<AnsiFormat> bool;
    private final List<AnsiFormat> comment;
    private final List<AnsiFormat> functionCall;

    public ColorConfig(List<AnsiFormat> reservedWord,
                       List<AnsiFormat> string,
                       List<AnsiFormat> number,
                       List<AnsiFormat> bool,
                       List<AnsiFormat> comment,
                       List<AnsiFormat> functionCall) {
        this.reservedWord = copy(reservedWord);
        this.string = copy(string);
        this.number = copy(number);
        this.bool = copy(bool);
        this.comment = copy(comment);
        this.functionCall = copy(functionCall);
    }

    private static List<AnsiFormat> copy(List<AnsiFormat> src) {
        return src == null ? Collections.emptyList() : List.copyOf(src);
    }

    public static ColorConfig none() {
        return NONE;
    }

    public static ColorConfig defaults() {
        return new ColorConfig(
                Arrays.asList(AnsiFormat.CYAN, AnsiFormat.BOLD),
                Collections.singletonList(AnsiFormat.GREEN),
                Collections.singletonList(AnsiFormat.BRIGHT_BLUE),
                Arrays.asList(AnsiFormat.PURPLE, AnsiFormat.BOLD),
                Collections.singletonList(AnsiFormat.GRAY),
                Collections.singletonList(AnsiFormat.BRIGHT_CYAN)
        );
    }

    public boolean isEmpty() {
        return reservedWord.isEmpty() && string.isEmpty() && number.isEmpty()
                && bool.isEmpty() && comment.isEmpty() && functionCall.isEmpty();
    }

    public String reservedWord(String s) {
        return apply(reservedWord, s);
    }

    public String string(String s) {
        return apply(string, s);
    }

    public String number(String s) {
        return apply(number, s);
    }

    public String bool(String s) {
        return apply(bool, s);
    }

    public String comment(String s) {
        return apply(comment, s);
    }

    public String functionCall(String s) {
        return apply(functionCall, s);
    }

    static String apply(List<AnsiFormat> options, String s) {
        String out = s;
        for (AnsiFormat o : options) {
            if (o == null || o == AnsiFormat.RESET) continue;
            out = wrapLines(o, out);
        }
        return out;
    }

    private static String wrapLines(AnsiFormat option, String s) {
        String[] lines = s.split("\n", -1);
        StringBuilder sb = new StringBuilder(s.length() + lines.length * 10);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            if (lines[i].isEmpty()) continue;
            sb.append(option.code()).append(lines[i]).append(AnsiFormat.RESET.code());
        }
        return sb.toString();
    }

    /** Length of {@code s} as shown on a terminal, ignoring escape sequences. */
    public static int visibleLength(String s) {
        if (s == null || s.isEmpty()) return 0;
        if (s.indexOf('\u001b') < 0) return s.length();
        return ANSI_ESCAPE.matcher(s).replaceAll("").length();
    }

    public static String stripAnsi(String s) {
        if (s == null) return "";
        return ANSI_ESCAPE.matcher(s).replaceAll("");
    }
}
