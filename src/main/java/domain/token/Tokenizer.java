package domain.token;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits SQL text into typed tokens.
 *
 * <p>Total: every input produces a token list whose values concatenate back to
 * the input. At each offset the matchers are tried in a fixed priority order
 * (whitespace, comment, string, open paren, close paren, placeholder, number,
 * reserved word, boolean, word, operator) and the first one that matches wins.
 * Among the reserved word lists the longest phrase is taken, so a plain
 * {@code DO UPDATE} beats a top-level {@code DO}.
 * Unterminated strings and comments run to the end of the input.</p>
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 */
public final class Tokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NUMBER =
            Pattern.compile("(?:(?:-\\s*)?[0-9]+(?:\\.[0-9]+)?|0x[0-9a-fA-F]+|0b[01]+)\\b");
    private static final Pattern OPERATOR = Pattern.compile(
            "(?:!=|<>|<=>|==|<=|>=|=>|!<|!>|\\|\\||::|->>|->|#>>|#>|<<|>>|"
                    + "\\?\\||\\?&|\\?|@>|<@|~~\\*|~~|!~~\\*|!~~|~\\*|!~\\*|!~|.)",
            Pattern.DOTALL);
    private static final Pattern BOOLEAN = Pattern.compile("(?i)\\b(?:true|false)\\b");
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*(?s:.)*?(?:\\*/|\\z)");

    private static final Map<String, String> STRING_PATTERNS = new LinkedHashMap<>();

    static {
        STRING_PATTERNS.put("``", "(?:(?:`[^`]*(?:\\z|`))+)");
        STRING_PATTERNS.put("[]", "(?:(?:\\[[^\\]]*(?:\\z|\\]))(?:\\][^\\]]*(?:\\z|\\]))*)");
        STRING_PATTERNS.put("\"\"", "(?:(?:\"[^\"\\\\]*(?:\\\\.[^\"\\\\]*)*(?:\"|\\z))+)");
        STRING_PATTERNS.put("''", "(?:(?:'[^'\\\\]*(?:\\\\.[^'\\\\]*)*(?:'|\\z))+)");
        STRING_PATTERNS.put("N''", "(?:(?:N'[^N'\\\\]*(?:\\\\.[^N'\\\\]*)*(?:'|\\z))+)");
        STRING_PATTERNS.put("X''", "(?:(?:[Xx]'[0-9a-fA-F]*(?:\\z|'))+)");
        STRING_PATTERNS.put("B''", "(?:(?:[Bb]'[01]*(?:\\z|'))+)");
        STRING_PATTERNS.put("$$", "(?:(?:\\$\\$[^$]*(?:\\z|\\$\\$))+)");
    }

    private final Pattern lineComment;
    private final Pattern reservedTopLevel;
    private final Pattern reservedNewline;
    private final Pattern reservedTopLevelNoIndent;
    private final Pattern reservedPlain;
    private final Pattern word;
    private final Pattern string;
    private final Pattern openParen;
    private final Pattern closeParen;
    private final Pattern indexedPlaceholder;
    private final Pattern identNamedPlaceholder;
    private final Pattern stringNamedPlaceholder;
    private final boolean dollarQuoted;

    public Tokenizer(DialectConfig cfg) {
        if (cfg == null) throw new IllegalArgumentException("dialect config is null");
        this.lineComment = createLineCommentPattern(cfg.getLineCommentTypes());
        this.reservedTopLevel = createReservedWordPattern(cfg.getReservedTopLevelWords());
        this.reservedNewline = createReservedWordPattern(cfg.getReservedNewlineWords());
        this.reservedTopLevelNoIndent = createReservedWordPattern(cfg.getReservedTopLevelWordsNoIndent());
        this.reservedPlain = createReservedWordPattern(cfg.getReservedWords());
        this.word = createWordPattern(cfg.getSpecialWordChars());
        String stringPattern = createStringPattern(cfg.getStringTypes());
        this.string = stringPattern.isEmpty() ? null : Pattern.compile(stringPattern, Pattern.DOTALL);
        this.openParen = createParenPattern(cfg.getOpenParens());
        this.closeParen = createParenPattern(cfg.getCloseParens());
        this.indexedPlaceholder = createPlaceholderPattern(cfg.getIndexedPlaceholderTypes(), "[0-9]*");
        this.identNamedPlaceholder = createPlaceholderPattern(cfg.getNamedPlaceholderTypes(), "[a-zA-Z0-9._$]+");
        this.stringNamedPlaceholder = stringPattern.isEmpty()
                ? null
                : createPlaceholderPattern(cfg.getNamedPlaceholderTypes(), stringPattern);
        this.dollarQuoted = cfg.getStringTypes().contains("$$");
    }

    // ------------------------------------------------------------------
    // pattern construction
    // ------------------------------------------------------------------

    private static Pattern createLineCommentPattern(List<String> prefixes) {
        if (prefixes.isEmpty()) return null;
        List<String> quoted = new ArrayList<>(prefixes.size());
        for (String p : prefixes) quoted.add(Pattern.quote(p));
        return Pattern.compile("(?:" + String.join("|", quoted) + ")[^\\r\\n]*?(?:\\r\\n|\\r|\\n|\\z)");
    }

    private static Pattern createReservedWordPattern(List<String> words) {
        if (words.isEmpty()) return null;
        List<String> sorted = longestFirst(words);
        List<String> alternatives = new ArrayList<>(sorted.size());
        for (String w : sorted) alternatives.add(escapePhrase(w));
        return Pattern.compile("(?i)(?:" + String.join("|", alternatives) + ")\\b");
    }

    private static Pattern createWordPattern(List<String> specialChars) {
        StringBuilder extra = new StringBuilder();
        for (char c : "_@'\"[]$?`".toCharArray()) extra.append('\\').append(c);
        for (String s : specialChars) {
            for (char c : s.toCharArray()) {
                if (Character.isLetterOrDigit(c)) extra.append(c);
                else extra.append('\\').append(c);
            }
        }
        return Pattern.compile("[\\p{L}\\p{M}\\p{N}" + extra + "]+");
    }

    static String createStringPattern(List<String> stringTypes) {
        List<String> parts = new ArrayList<>(stringTypes.size());
        for (String t : stringTypes) {
            String p = STRING_PATTERNS.get(t);
            if (p != null) parts.add(p);
        }
        return String.join("|", parts);
    }

    private static Pattern createParenPattern(List<String> parens) {
        if (parens.isEmpty()) return null;
        List<String> sorted = longestFirst(parens);
        List<String> alternatives = new ArrayList<>(sorted.size());
        for (String p : sorted) {
            if (p.length() == 1) alternatives.add(Pattern.quote(p));
            else alternatives.add("\\b" + escapePhrase(p) + "\\b");
        }
        return Pattern.compile("(?i)(?:" + String.join("|", alternatives) + ")");
    }

    private static Pattern createPlaceholderPattern(List<String> prefixes, String body) {
        if (prefixes.isEmpty()) return null;
        List<String> quoted = new ArrayList<>(prefixes.size());
        for (String p : prefixes) quoted.add(Pattern.quote(p));
        return Pattern.compile("(?:" + String.join("|", quoted) + ")(?:" + body + ")");
    }

    private static List<String> longestFirst(List<String> words) {
        List<String> sorted = new ArrayList<>(words);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        return sorted;
    }

    /** Escapes regex metacharacters and lets each space match any whitespace run. */
    private static String escapePhrase(String phrase) {
        StringBuilder sb = new StringBuilder(phrase.length() + 8);
        for (String part : phrase.trim().split("\\s+")) {
            if (sb.length() > 0) sb.append("\\s+");
            for (char c : part.toCharArray()) {
                if (Character.isLetterOrDigit(c) || c == '_') sb.append(c);
                else sb.append('\\').append(c);
            }
        }
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // scanning
    // ------------------------------------------------------------------

    public List<Token> tokenize(String input) {
        List<Token> out = new ArrayList<>();
        if (input == null || input.isEmpty()) return out;

        Token prev = Token.EMPTY;
        int pos = 0;
        while (pos < input.length()) {
            Token tok = nextToken(input, pos, prev);
            out.add(tok);
            pos += tok.getValue().length();
            prev = tok;
        }
        return out;
    }

    private Token nextToken(String in, int pos, Token prev) {
        Token t;
        if ((t = match(in, pos, WHITESPACE, TokenType.WHITESPACE)) != null) return t;
        if ((t = commentToken(in, pos)) != null) return t;
        if ((t = stringToken(in, pos)) != null) return t;
        if ((t = match(in, pos, openParen, TokenType.OPEN_PAREN)) != null) return t;
        if ((t = match(in, pos, closeParen, TokenType.CLOSE_PAREN)) != null) return t;
        if ((t = placeholderToken(in, pos)) != null) return t;
        if ((t = match(in, pos, NUMBER, TokenType.NUMBER)) != null) return t;
        if ((t = reservedWordToken(in, pos, prev)) != null) return t;
        if ((t = match(in, pos, BOOLEAN, TokenType.BOOLEAN)) != null) return t;
        if ((t = wordToken(in, pos)) != null) return t;
        if ((t = match(in, pos, OPERATOR, TokenType.OPERATOR)) != null) return t;

        // unreachable with DOTALL, kept so the scanner can never stall
        int end = in.offsetByCodePoints(pos, 1);
        return new Token(TokenType.OPERATOR, in.substring(pos, end));
    }

    private Token commentToken(String in, int pos) {
        Token t = match(in, pos, lineComment, TokenType.LINE_COMMENT);
        if (t != null) return t;
        return match(in, pos, BLOCK_COMMENT, TokenType.BLOCK_COMMENT);
    }

    private Token stringToken(String in, int pos) {
        if (dollarQuoted) {
            Token t = dollarQuotedToken(in, pos);
            if (t != null) return t;
        }
        return match(in, pos, string, TokenType.STRING);
    }

    /** {@code $tag$ ... $tag$}; an unterminated body runs to the end of the input. */
    private static Token dollarQuotedToken(String in, int pos) {
        if (in.charAt(pos) != '$') return null;
        int i = pos + 1;
        while (i < in.length() && isTagChar(in.charAt(i))) i++;
        if (i >= in.length() || in.charAt(i) != '$') return null;

        String tag = in.substring(pos, i + 1);
        int close = in.indexOf(tag, i + 1);
        int end = close < 0 ? in.length() : close + tag.length();
        return new Token(TokenType.STRING, in.substring(pos, end));
    }

    private static boolean isTagChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }

    private Token placeholderToken(String in, int pos) {
        Token t = identNamedPlaceholderToken(in, pos);
        if (t != null) return t;
        t = stringNamedPlaceholderToken(in, pos);
        if (t != null) return t;
        return indexedPlaceholderToken(in, pos);
    }

    private Token identNamedPlaceholderToken(String in, int pos) {
        if (startsWith(in, pos, "@>") || startsWith(in, pos, "<@")) return null;
        String v = find(in, pos, identNamedPlaceholder);
        if (v == null) return null;
        return new Token(TokenType.PLACEHOLDER, v, v.substring(1));
    }

    private Token stringNamedPlaceholderToken(String in, int pos) {
        if (startsWith(in, pos, "@>") || startsWith(in, pos, "@<@")
                || startsWith(in, pos, "?|") || startsWith(in, pos, "?&")) {
            return null;
        }
        String v = find(in, pos, stringNamedPlaceholder);
        if (v == null || v.length() < 3) return null;
        String quote = v.substring(v.length() - 1);
        String key = v.substring(2, v.length() - 1).replace("\\" + quote, quote);
        return new Token(TokenType.PLACEHOLDER, v, key);
    }

    private Token indexedPlaceholderToken(String in, int pos) {
        if (startsWith(in, pos, "?|") || startsWith(in, pos, "?&")) return null;
        String v = find(in, pos, indexedPlaceholder);
        if (v == null) return null;
        return new Token(TokenType.PLACEHOLDER, v, v.substring(1));
    }

    private Token reservedWordToken(String in, int pos, Token prev) {
        // dot-qualified names are never keywords: t.from
        if (prev.valueIs(".")) return null;

        // Lists are tried top-level, newline, no-indent, plain, but the longest
        // phrase across all of them wins: DO is top-level while DO UPDATE is
        // plain, and DO UPDATE must stay one token. Ties go to the earlier list.
        Token best = null;
        best = longer(best, match(in, pos, reservedTopLevel, TokenType.RESERVED_TOP_LEVEL));
        best = longer(best, match(in, pos, reservedNewline, TokenType.RESERVED_NEWLINE));
        best = longer(best, match(in, pos, reservedTopLevelNoIndent, TokenType.RESERVED_TOP_LEVEL_NO_INDENT));
        best = longer(best, match(in, pos, reservedPlain, TokenType.RESERVED));
        return best;
    }

    private static Token longer(Token current, Token candidate) {
        if (candidate == null) return current;
        if (current == null || candidate.getValue().length() > current.getValue().length()) return candidate;
        return current;
    }

    private Token wordToken(String in, int pos) {
        if (startsWith(in, pos, "@>") || startsWith(in, pos, "?|") || startsWith(in, pos, "?&")) return null;
        return match(in, pos, word, TokenType.WORD);
    }

    private static boolean startsWith(String in, int pos, String prefix) {
        return in.startsWith(prefix, pos);
    }

    private static Token match(String in, int pos, Pattern p, TokenType type) {
        String v = find(in, pos, p);
        return v == null ? null : new Token(type, v);
    }

    private static String find(String in, int pos, Pattern p) {
        if (p == null) return null;
        Matcher m = p.matcher(in);
        m.region(pos, in.length());
        if (!m.lookingAt() || m.end() == pos) return null;
        return in.substring(pos, m.end());
    }
}
