package com.tyron.ledgercst.lang.ledger.tokens;

import com.tyron.ledgercst.core.model.ValueToken;
import com.tyron.ledgercst.lang.ledger.lexer.LedgerTokenTypes;
import org.jetbrains.annotations.NotNull;

/**
 * Comment running from {@code ;} to the end of a content line. The value excludes the
 * marker and the blanks after it.
 */
public final class InlineComment extends ValueToken<String> {

    public static final String TYPE = LedgerTokenTypes.INLINE_COMMENT;

    public InlineComment(@NotNull String rawText) {
        super(rawText);
    }

    public static @NotNull InlineComment fromValue(@NotNull String value) {
        return new InlineComment("; " + value);
    }

    @Override
    protected @NotNull String parseValue(@NotNull String rawText) {
        if (!rawText.startsWith(";") || rawText.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("not an inline comment: " + rawText);
        }
        int i = 1;
        while (i < rawText.length() && (rawText.charAt(i) == ' ' || rawText.charAt(i) == '\t')) {
            i++;
        }
        return rawText.substring(i);
    }

    @Override
    protected @NotNull String formatValue(@NotNull String value) {
        if (value.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("inline comment cannot span lines: " + value);
        }
        return "; " + value;
    }

    @Override
    public @NotNull InlineComment copy() {
        return new InlineComment(getRawText());
    }
}
