package com.tyron.ledgercst.lang.ledger.tokens;

import com.tyron.ledgercst.core.model.ValueToken;
import com.tyron.ledgercst.lang.ledger.lexer.LedgerTokenTypes;
import org.jetbrains.annotations.NotNull;

import java.util.regex.Pattern;

/**
 * Metadata key including its trailing colon. The value is the bare key.
 */
public final class MetaKey extends ValueToken<String> {

    public static final String TYPE = LedgerTokenTypes.META_KEY;

    private static final Pattern KEY = Pattern.compile("[a-z][A-Za-z0-9_-]*");

    public MetaKey(@NotNull String rawText) {
        super(rawText);
    }

    public static @NotNull MetaKey fromValue(@NotNull String value) {
        return new MetaKey(value + ":");
    }

    @Override
    protected @NotNull String parseValue(@NotNull String rawText) {
        String key = rawText.endsWith(":") ? rawText.substring(0, rawText.length() - 1) : rawText;
        if (key.length() == rawText.length() || !KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("invalid metadata key: " + rawText);
        }
        return key;
    }

    @Override
    protected @NotNull String formatValue(@NotNull String value) {
        if (!KEY.matcher(value).matches()) {
            throw new IllegalArgumentException("invalid metadata key: " + value);
        }
        return value + ":";
    }

    @Override
    public @NotNull MetaKey copy() {
        return new MetaKey(getRawText());
    }
}
