package domain.format;

import domain.token.Token;
import domain.token.TokenOverride;
import domain.token.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single left-to-right pass that turns a token stream into formatted text.
 *
 * <p>One instance per {@link SqlFormatter} call. Dialect overrides are applied
 * once, up front, so the alignment pre-pass and the inline-block lookahead see
 * the same token kinds the dispatch sees.</p>
 */
final class SqlRenderer {

    private static final Pattern LIMIT = Pattern.compile("(?i)^LIMIT$");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern COMMENT_CONTINUATION = Pattern.compile("\n[ \t]*");

    private final FormatConfig cfg;
    private final ColorConfig colors;
    private final List<Token> tokens;
    private final Indentation indentation;
    private final InlineBlock inlineBlock = new InlineBlock();
    private final ProceduralBlockStack blocks = new ProceduralBlockStack();
    private final AlignmentState alignment;
    private final Params params;
    private final StringBuilder out = new StringBuilder();

    private Token previousReservedWord = Token.EMPTY;
    private int index;
    private int parenDepth;
    private int proceduralDepth;

    SqlRenderer(FormatConfig cfg, List<Token> rawTokens, TokenOverride override, Params params) {
        this.cfg = cfg;
        this.colors = cfg.getColorConfig() == null ? ColorConfig.none() : cfg.getColorConfig();
        this.tokens = applyOverrides(rawTokens, override == null ? TokenOverride.NONE : override);
        this.indentation = new Indentation(cfg.getIndent());
        this.params = params == null ? Params.none() : params;
        this.alignment = new AlignmentState(
                cfg.isAlignColumnNames() ? AlignmentAnalyzer.selectColumnWidths(tokens) : new ArrayList<>(),
                cfg.isAlignAssignments() ? AlignmentAnalyzer.updateAssignmentWidths(tokens) : new ArrayList<>(),
                cfg.isAlignValues() ? AlignmentAnalyzer.insertValuesMarkers(tokens) : new ArrayList<>());
    }

    private static List<Token> applyOverrides(List<Token> raw, TokenOverride override) {
        List<Token> result = new ArrayList<>(raw.size());
        Token previous = Token.EMPTY;
        for (Token t : raw) {
            Token replaced = override.apply(t, previous);
            if (replaced == null) replaced = t;
            if (replaced.getType() != null && replaced.getType().isReserved()) {
                previous = replaced;
            }
            result.add(replaced);
        }
        return result;
    }

    String render() {
        for (index = 0; index < tokens.size(); index++) {
            Token token = tokens.get(index);
            TokenType type = token.getType();
            if (type == null) continue;

            switch (type) {
                case WHITESPACE:
                    break;
                case LINE_COMMENT:
                case BLOCK_COMMENT:
                    formatComment(token);
                    break;
                case RESERVED_TOP_LEVEL:
                    formatTopLevelReservedWord(token, true);
                    previousReservedWord = token;
                    break;
                case RESERVED_TOP_LEVEL_NO_INDENT:
                    formatTopLevelReservedWord(token, false);
                    previousReservedWord = token;
                    break;
                case RESERVED_NEWLINE:
                    formatNewlineReservedWord(token);
                    previousReservedWord = token;
                    break;
                case RESERVED:
                    formatWithSpaces(token);
                    previousReservedWord = token;
                    break;
                case OPEN_PAREN:
                    formatOpeningParentheses(token);
                    break;
                case CLOSE_PAREN:
                    formatClosingParentheses(token);
                    break;
                case WORD:
                case PLACEHOLDER:
                    formatWordOrPlaceholder(token);
                    break;
                case STRING:
                    write(colors.string(token.getValue()) + " ");
                    break;
                case NUMBER:
                    write(colors.number(token.getValue()) + " ");
                    break;
                case BOOLEAN:
                    write(colors.bool(token.getValue()) + " ");
                    break;
                case SPECIAL_OPERATOR:
                    trimSpacesEnd();
                    write(token.getValue());
                    break;
                default:
                    formatSymbol(token);
                    break;
            }
        }
        return out.toString().trim();
    }

    // ------------------------------------------------------------------
    // reserved words

    private void formatTopLevelReservedWord(Token token, boolean indentBody) {
        String value = collapse(token.getValue());
        alignment.onClauseKeyword(value.toUpperCase(Locale.ROOT), parenDepth);

        indentation.decreaseTopLevel();
        addNewline();
        if (indentBody) indentation.increaseTopLevel();
        write(formatReservedWord(value));
        addNewline();
    }

    private void formatNewlineReservedWord(Token token) {
        addNewline();
        write(formatReservedWord(collapse(token.getValue())) + " ");
    }

    String formatReservedWord(String value) {
        return colors.reservedWord(applyKeywordCase(value));
    }

    private String applyKeywordCase(String value) {
        switch (cfg.getKeywordCase()) {
            case UPPERCASE:
                return value.toUpperCase(Locale.ROOT);
            case LOWERCASE:
                return value.toLowerCase(Locale.ROOT);
            case DIALECT:
                return cfg.getLanguage().prefersUppercaseKeywords()
                        ? value.toUpperCase(Locale.ROOT)
                        : value.toLowerCase(Locale.ROOT);
            default:
                return value;
        }
    }

    // ------------------------------------------------------------------
    // parens and procedural blocks

    private void formatOpeningParentheses(Token token) {
        String keyword = collapse(token.getValue()).toUpperCase(Locale.ROOT);
        boolean symbol = isSymbol(token.getValue());
        boolean procedural = !symbol && ProceduralBlockStack.isProceduralOpener(keyword);

        if (procedural && proceduralDepth > 0 && ProceduralBlockStack.isStatementOpener(keyword)
                && !inlineBlock.isActive()) {
            addNewline();
        }

        Token previous = previousToken();
        if (!previous.is(TokenType.WHITESPACE)
                && !previous.is(TokenType.OPEN_PAREN)
                && !previous.is(TokenType.LINE_COMMENT)) {
            trimSpacesEnd();
        }
        write(symbol ? token.getValue() : formatReservedWord(collapse(token.getValue())));

        parenDepth++;
        inlineBlock.beginIfPossible(tokens, index);
        if (procedural) blocks.push(keyword);

        if (inlineBlock.isActive()) return;
        if (symbol && alignment.isInValues() && parenDepth > alignment.valuesDepth()) return;

        if ("BEGIN".equals(keyword)) {
            indentation.increaseProcedural();
            proceduralDepth++;
        } else {
            indentation.increaseBlockLevel();
        }
        addNewline();
    }

    private void formatClosingParentheses(Token token) {
        boolean symbol = isSymbol(token.getValue());
        String value = symbol ? token.getValue() : formatReservedWord(collapse(token.getValue()));
        String opener = symbol ? "" : blocks.pop();

        int depthBefore = parenDepth;
        if (parenDepth > 0) parenDepth--;

        if (inlineBlock.isActive()) {
            inlineBlock.end();
            formatWithSpaceAfter(value);
            return;
        }
        if (symbol && alignment.isInValues() && depthBefore > alignment.valuesDepth()) {
            formatWithSpaceAfter(value);
            return;
        }

        if ("BEGIN".equals(opener)) {
            indentation.resetToProceduralBase();
            indentation.decreaseProcedural();
            if (proceduralDepth > 0) proceduralDepth--;
        } else if (proceduralDepth > 0 && ProceduralBlockStack.isStatementOpener(opener)) {
            indentation.resetToProceduralBase();
        } else {
            indentation.decreaseBlockLevel();
        }
        addNewline();
        writeWithSpaces(value, false);
    }

    // ------------------------------------------------------------------
    // words, placeholders, symbols

    private void formatWordOrPlaceholder(Token token) {
        if (nextToken().is(TokenType.PLACEHOLDER)) {
            write(token.getValue());
        } else if (token.is(TokenType.PLACEHOLDER)) {
            write(params.get(token.getKey(), token.getValue()) + " ");
        } else {
            formatWithSpaces(token);
        }
    }

    private void formatSymbol(Token token) {
        switch (token.getValue()) {
            case ",":
                formatComma();
                break;
            case ":":
                formatWithSpaceAfter(token.getValue());
                break;
            case ".":
                trimSpacesEnd();
                write(token.getValue());
                break;
            case ";":
                formatQuerySeparator();
                break;
            case "=":
                if (alignment.isInSet() && parenDepth == alignment.setDepth()) {
                    trimSpacesEnd();
                    pad(alignment.assignmentWidth() - itemWidth());
                    write(" = ");
                    break;
                }
                formatWithSpaces(token);
                break;
            default:
                formatWithSpaces(token);
                break;
        }
    }

    private void formatComma() {
        trimSpacesEnd();

        if (inlineBlock.isActive()) {
            write(", ");
            return;
        }
        if (alignment.isInValues() && parenDepth > alignment.valuesDepth()) {
            write(", ");
            return;
        }
        if (alignment.isInSelect() && parenDepth == alignment.selectDepth()) {
            pad(alignment.selectWidth() - itemWidth());
        }
        write(", ");

        if (LIMIT.matcher(previousReservedWord.getValue()).matches() && !isOverLineBudget()) {
            return;
        }
        if (nextNonWhitespaceToken().getType() != null && nextNonWhitespaceToken().getType().isComment()) {
            return;
        }
        addNewline();
    }

    private void formatQuerySeparator() {
        alignment.reset();
        trimSpacesEnd();
        write(";");
        if (proceduralDepth > 0) {
            indentation.resetToProceduralBase();
            addNewline();
            return;
        }
        indentation.reset();
        for (int i = 0; i < cfg.getLinesBetweenQueries(); i++) {
            write("\n");
        }
    }

    private void formatWithSpaces(Token token) {
        String value;
        if (token.getType() != null && token.getType().isReserved()) {
            value = formatReservedWord(token.getValue());
        } else if (token.is(TokenType.WORD) && nextToken().is(TokenType.OPEN_PAREN)
                && "(".equals(nextToken().getValue())) {
            value = colors.functionCall(token.getValue());
        } else {
            value = token.getValue();
        }
        boolean connective = token.valueIgnoreCaseIs("AND") || token.valueIgnoreCaseIs("OR");
        writeWithSpaces(value, connective);
    }

    private void writeWithSpaces(String value, boolean connective) {
        int max = cfg.getMaxLineLength();
        if (max > 0 && !inlineBlock.isActive() && !alignment.isActive()) {
            int line = lineLength();
            boolean exceeds = line + ColorConfig.visibleLength(value) + 1 > max;
            boolean lateConnective = connective && line > max * 3 / 4;
            if ((exceeds || lateConnective) && !atLineStart()) {
                addNewline();
            }
        }
        write(value + " ");
    }

    private void formatWithSpaceAfter(String value) {
        trimSpacesEnd();
        write(value + " ");
    }

    // ------------------------------------------------------------------
    // comments

    private void formatComment(Token token) {
        String comment = token.getValue();
        if (token.is(TokenType.LINE_COMMENT)) {
            comment = stripLineBreak(comment);
        }

        if (token.is(TokenType.BLOCK_COMMENT) && comment.indexOf('\n') >= 0) {
            comment = COMMENT_CONTINUATION.matcher(comment)
                    .replaceAll(Matcher.quoteReplacement("\n" + indentation.getIndent() + " "));
            addNewline();
            write(colors.comment(comment));
            addNewline();
            return;
        }

        if (atLineStart()) {
            addNewline();
            write(colors.comment(comment));
            addNewline();
            return;
        }

        trimSpacesEnd();
        int spacing = Math.max(cfg.getCommentMinSpacing(), 1);
        int max = cfg.getMaxLineLength();
        if (max <= 0 || lineLength() + spacing + ColorConfig.visibleLength(comment) <= max) {
            write(" ".repeat(spacing));
        } else {
            addNewline();
        }
        write(colors.comment(comment));
        addNewline();
    }

    private static String stripLineBreak(String s) {
        int end = s.length();
        while (end > 0 && (s.charAt(end - 1) == '\n' || s.charAt(end - 1) == '\r')) end--;
        return s.substring(0, end);
    }

    // ------------------------------------------------------------------
    // output buffer

    private void write(String s) {
        out.append(s);
    }

    private void addNewline() {
        trimSpacesEnd();
        if (out.length() == 0 || out.charAt(out.length() - 1) != '\n') {
            out.append('\n');
        }
        out.append(indentation.getIndent());
    }

    private void trimSpacesEnd() {
        int end = out.length();
        while (end > 0 && (out.charAt(end - 1) == ' ' || out.charAt(end - 1) == '\t')) end--;
        out.setLength(end);
    }

    private void pad(int n) {
        if (n > 0) out.append(" ".repeat(n));
    }

    private String currentLine() {
        return out.substring(out.lastIndexOf("\n") + 1);
    }

    /** Visible width of the line being written. */
    int lineLength() {
        return ColorConfig.visibleLength(currentLine());
    }

    private boolean atLineStart() {
        return currentLine().isBlank();
    }

    private boolean isOverLineBudget() {
        return cfg.getMaxLineLength() > 0 && lineLength() > cfg.getMaxLineLength();
    }

    /** Width of the current list item, which starts right after the indent. */
    private int itemWidth() {
        return lineLength() - indentation.getIndent().length();
    }

    // ------------------------------------------------------------------
    // lookaround

    private Token previousToken() {
        return index > 0 ? tokens.get(index - 1) : Token.EMPTY;
    }

    private Token nextToken() {
        return index + 1 < tokens.size() ? tokens.get(index + 1) : Token.EMPTY;
    }

    private Token nextNonWhitespaceToken() {
        for (int i = index + 1; i < tokens.size(); i++) {
            if (!tokens.get(i).is(TokenType.WHITESPACE)) return tokens.get(i);
        }
        return Token.EMPTY;
    }

    /** Bracket-like parens ({@code ( [ {}) as opposed to keyword parens such as CASE. */
    private static boolean isSymbol(String value) {
        return !value.isEmpty() && !Character.isLetter(value.charAt(0));
    }

    private static String collapse(String s) {
        return WHITESPACE_RUN.matcher(s.trim()).replaceAll(" ");
    }
}
