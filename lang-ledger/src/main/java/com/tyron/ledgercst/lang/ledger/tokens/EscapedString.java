package com.tyron.ledgercst.lang.ledger.tokens;

import com.tyron.ledgercst.core.model.ValueToken;
import com.tyron.ledgercst.core.spacing.SpacingAccessors;
import com.tyron.ledgercst.lang.ledger.lexer.LedgerTokenTypes;
import org.jetbrains.annotations.NotNull;

/**
 * Double quoted string. The value is the unescaped content; {@code \"}, {@code \\},
 * {@code \n} and {@code \t} are recognized, any other escaped character stands for itself.
 */
public final class EscapedString extends ValueToken<String> implements MetaValue, SpacingAccessors {

    public static final String TYPE = LedgerTokenTypes.ESCAPED_STRING;

    public EscapedString(@NotNull String rawText) {
        super(rawText);
    }

    public static @NotNull EscapedString fromValue(@NotNull String value) {
        return new EscapedString(escape(value));
    }

    @Override
    protected @NotNull String parseValue(@NotNull String rawText) {
        if (rawText.length() < 2 || rawText.charAt(0) != '"' || rawText.charAt(rawText.length() - 1) != '"') {
            throw new IllegalArgumentException("not a quoted string: " + rawText);
        }
        StringBuilder sb = new StringBuilder();
        int last = rawText.length() - 1;
        for (int i = 1; i < last; i++) {
            char c = rawText.charAt(i);
            if (c == '"') {
                throw new IllegalArgumentException("unescaped quote in string: " + rawText);
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (++i >= last) {
                throw new IllegalArgumentException("dangling escape in string: " + rawText);
            }
            char escaped = rawText.charAt(i);
            switch (escaped) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                default -> sb.append(escaped);
            }
        }
        return sb.toString();
    }

    @Override
    protected @NotNull String formatValue(@NotNull String value) {
        return escape(value);
    }

    private static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public @NotNull EscapedString copy() {
        return new EscapedString(getRawText());
    }
}
