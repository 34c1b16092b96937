package com.tyron.ledgercst.lang.ledger.lexer;

import com.tyron.ledgercst.api.parse.ParseException;
import com.tyron.ledgercst.api.parse.ParseNode;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hand-written lexer for the ledger format.
 * <p>
 * Line-sensitive: leading whitespace of a content line is an {@code INDENT}, a line whose
 * first non-blank character is {@code ;} is a {@code BLOCK_COMMENT}, and consecutive comment
 * lines with the same indentation merge into one token. Concatenating the raw text of all
 * terminals reproduces the input.
 */
public final class LedgerLexer {

    private static final Pattern DATE = Pattern.compile("\\d{4}[-/]\\d{2}[-/]\\d{2}(?![0-9A-Za-z])");
    private static final Pattern NUMBER = Pattern.compile("[-+]?(?:\\d{1,3}(?:,\\d{3})+|\\d+)(?:\\.\\d*)?(?![0-9A-Za-z])");
    private static final Pattern ACCOUNT = Pattern.compile("[A-Z][A-Za-z0-9-]*(?::[A-Z0-9][A-Za-z0-9-]*)+(?![A-Za-z0-9:_-])");
    private static final Pattern META_KEY = Pattern.compile("[a-z][A-Za-z0-9_-]*:(?=[ \\t\\r\\n]|$)");
    private static final Pattern KEYWORD = Pattern.compile("(open|close|commodity)(?![A-Za-z0-9_:-])");
    private static final Pattern CURRENCY = Pattern.compile("[A-Z](?:[A-Z0-9'._-]{0,22}[A-Z0-9])?(?![A-Za-z0-9'._:-])");

    private static final Map<String, String> KEYWORDS = Map.of(
            "open", LedgerTokenTypes.OPEN,
            "close", LedgerTokenTypes.CLOSE,
            "commodity", LedgerTokenTypes.COMMODITY);

    private final String text;
    private final List<ParseNode.Terminal> out = new ArrayList<>();
    private int pos;
    private int line;
    private int column;

    private LedgerLexer(String text) {
        this.text = text;
    }

    /**
     * @throws ParseException on a character that starts no terminal
     */
    public static @NotNull List<ParseNode.Terminal> tokenize(@NotNull String text) {
        LedgerLexer lexer = new LedgerLexer(text);
        lexer.run();
        return lexer.out;
    }

    private void run() {
        boolean lineStart = true;
        while (pos < text.length()) {
            if (lineStart) {
                lineStart = false;
                if (lexLineStart()) {
                    continue;
                }
            }
            char c = text.charAt(pos);
            if (c == ' ' || c == '\t') {
                emit(LedgerTokenTypes.WHITESPACE, spanWhile(pos, " \t"));
            } else if (c == '\r' || c == '\n') {
                int end = newlineEnd(pos);
                if (end < 0) {
                    throw error("stray carriage return");
                }
                emit(LedgerTokenTypes.NEWLINE, end);
                lineStart = true;
            } else if (c == ';') {
                emit(LedgerTokenTypes.INLINE_COMMENT, lineEnd(pos));
            } else if (c == '"') {
                emit(LedgerTokenTypes.ESCAPED_STRING, stringEnd());
            } else if (c == ',') {
                emit(LedgerTokenTypes.COMMA, pos + 1);
            } else if (Character.isDigit(c) || c == '-' || c == '+') {
                int end = match(DATE);
                if (end > 0) {
                    emit(LedgerTokenTypes.DATE, end);
                } else if ((end = match(NUMBER)) > 0) {
                    emit(LedgerTokenTypes.NUMBER, end);
                } else {
                    throw error("unexpected character '" + c + "'");
                }
            } else if (Character.isLetter(c)) {
                lexWord(c);
            } else {
                throw error("unexpected character '" + c + "'");
            }
        }
    }

    /**
     * Handles indentation and full-line comments. Returns true if it emitted something.
     */
    private boolean lexLineStart() {
        int indentEnd = spanWhile(pos, " \t");
        if (indentEnd < text.length() && text.charAt(indentEnd) == ';') {
            emitBlockComment(indentEnd - pos);
            return true;
        }
        if (indentEnd == pos) {
            return false;
        }
        if (indentEnd >= text.length() || text.charAt(indentEnd) == '\r' || text.charAt(indentEnd) == '\n') {
            emit(LedgerTokenTypes.WHITESPACE, indentEnd);
        } else {
            emit(LedgerTokenTypes.INDENT, indentEnd);
        }
        return true;
    }

    private void emitBlockComment(int indentLength) {
        String indent = text.substring(pos, pos + indentLength);
        int end = lineEnd(pos + indentLength);
        while (true) {
            int next = newlineEnd(end);
            if (next < 0 || !text.startsWith(indent, next)) {
                break;
            }
            int commentStart = next + indent.length();
            if (commentStart >= text.length() || text.charAt(commentStart) != ';') {
                break;
            }
            end = lineEnd(commentStart);
        }
        emit(LedgerTokenTypes.BLOCK_COMMENT, end);
    }

    private void lexWord(char c) {
        int end = match(ACCOUNT);
        if (end > 0) {
            emit(LedgerTokenTypes.ACCOUNT, end);
            return;
        }
        if (Character.isLowerCase(c)) {
            if ((end = match(META_KEY)) > 0) {
                emit(LedgerTokenTypes.META_KEY, end);
                return;
            }
            if ((end = match(KEYWORD)) > 0) {
                emit(KEYWORDS.get(text.substring(pos, end)), end);
                return;
            }
        } else if ((end = match(CURRENCY)) > 0) {
            emit(LedgerTokenTypes.CURRENCY, end);
            return;
        }
        throw error("unexpected word starting with '" + c + "'");
    }

    private int match(Pattern pattern) {
        Matcher m = pattern.matcher(text);
        m.region(pos, text.length());
        m.useTransparentBounds(true);
        return m.lookingAt() ? m.end() : -1;
    }

    private int spanWhile(int from, String chars) {
        int i = from;
        while (i < text.length() && chars.indexOf(text.charAt(i)) >= 0) {
            i++;
        }
        return i;
    }

    /**
     * End of the line starting at or containing {@code from}, before any line break.
     */
    private int lineEnd(int from) {
        int i = from;
        while (i < text.length() && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
            i++;
        }
        return i;
    }

    /**
     * End of a {@code \r*\n} sequence at {@code from}, or -1 if there is none.
     */
    private int newlineEnd(int from) {
        int i = from;
        while (i < text.length() && text.charAt(i) == '\r') {
            i++;
        }
        return i < text.length() && text.charAt(i) == '\n' ? i + 1 : -1;
    }

    private int stringEnd() {
        int i = pos + 1;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '\\') {
                i += 2;
            } else if (ch == '"') {
                return i + 1;
            } else {
                i++;
            }
        }
        throw error("unterminated string");
    }

    private void emit(String type, int end) {
        String raw = text.substring(pos, end);
        out.add(new ParseNode.Terminal(type, raw, out.size(), line, column));
        for (int i = 0; i < raw.length(); i++) {
            if (raw.charAt(i) == '\n') {
                line++;
                column = 0;
            } else {
                column++;
            }
        }
        pos = end;
    }

    private ParseException error(String message) {
        return new ParseException(message, line, column);
    }
}
