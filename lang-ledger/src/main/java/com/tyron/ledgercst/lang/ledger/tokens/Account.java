package com.tyron.ledgercst.lang.ledger.tokens;

import com.tyron.ledgercst.core.model.ValueToken;
import com.tyron.ledgercst.core.spacing.SpacingAccessors;
import com.tyron.ledgercst.lang.ledger.lexer.LedgerTokenTypes;
import org.jetbrains.annotations.NotNull;

import java.util.regex.Pattern;

/**
 * Colon separated account name such as {@code Assets:Bank:Checking}.
 */
public final class Account extends ValueToken<String> implements MetaValue, SpacingAccessors {

    public static final String TYPE = LedgerTokenTypes.ACCOUNT;

    private static final Pattern PATTERN = Pattern.compile("[A-Z][A-Za-z0-9-]*(?::[A-Z0-9][A-Za-z0-9-]*)+");

    public Account(@NotNull String rawText) {
        super(rawText);
    }

    public static @NotNull Account fromValue(@NotNull String value) {
        return new Account(value);
    }

    @Override
    protected @NotNull String parseValue(@NotNull String rawText) {
        if (!PATTERN.matcher(rawText).matches()) {
            throw new IllegalArgumentException("invalid account: " + rawText);
        }
        return rawText;
    }

    @Override
    protected @NotNull String formatValue(@NotNull String value) {
        return parseValue(value);
    }

    @Override
    public @NotNull Account copy() {
        return new Account(getRawText());
    }
}
