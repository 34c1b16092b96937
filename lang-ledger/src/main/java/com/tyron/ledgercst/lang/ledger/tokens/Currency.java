package com.tyron.ledgercst.lang.ledger.tokens;

import com.tyron.ledgercst.core.model.ValueToken;
import com.tyron.ledgercst.core.spacing.SpacingAccessors;
import com.tyron.ledgercst.lang.ledger.lexer.LedgerTokenTypes;
import org.jetbrains.annotations.NotNull;

import java.util.regex.Pattern;

public final class Currency extends ValueToken<String> implements MetaValue, SpacingAccessors {

    public static final String TYPE = LedgerTokenTypes.CURRENCY;

    private static final Pattern PATTERN = Pattern.compile("[A-Z](?:[A-Z0-9'._-]{0,22}[A-Z0-9])?");

    public Currency(@NotNull String rawText) {
        super(rawText);
    }

    public static @NotNull Currency fromValue(@NotNull String value) {
        return new Currency(value);
    }

    @Override
    protected @NotNull String parseValue(@NotNull String rawText) {
        if (!PATTERN.matcher(rawText).matches()) {
            throw new IllegalArgumentException("invalid currency: " + rawText);
        }
        return rawText;
    }

    @Override
    protected @NotNull String formatValue(@NotNull String value) {
        return parseValue(value);
    }

    @Override
    public @NotNull Currency copy() {
        return new Currency(getRawText());
    }
}
