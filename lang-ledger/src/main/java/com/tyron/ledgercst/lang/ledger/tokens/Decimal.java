package com.tyron.ledgercst.lang.ledger.tokens;

import com.tyron.ledgercst.core.model.ValueToken;
import com.tyron.ledgercst.core.spacing.SpacingAccessors;
import com.tyron.ledgercst.lang.ledger.lexer.LedgerTokenTypes;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;

/**
 * Decimal number. Thousands separators are accepted when parsing and never written.
 */
public final class Decimal extends ValueToken<BigDecimal> implements MetaValue, SpacingAccessors {

    public static final String TYPE = LedgerTokenTypes.NUMBER;

    public Decimal(@NotNull String rawText) {
        super(rawText);
    }

    public static @NotNull Decimal fromValue(@NotNull BigDecimal value) {
        return new Decimal(value.toPlainString());
    }

    @Override
    protected @NotNull BigDecimal parseValue(@NotNull String rawText) {
        String plain = rawText.replace(",", "");
        if (plain.endsWith(".")) {
            plain = plain.substring(0, plain.length() - 1);
        }
        try {
            return new BigDecimal(plain);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid number: " + rawText, e);
        }
    }

    @Override
    protected @NotNull String formatValue(@NotNull BigDecimal value) {
        return value.toPlainString();
    }

    @Override
    public @NotNull Decimal copy() {
        return new Decimal(getRawText());
    }
}
