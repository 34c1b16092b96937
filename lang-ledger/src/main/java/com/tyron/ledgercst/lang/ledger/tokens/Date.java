package com.tyron.ledgercst.lang.ledger.tokens;

import com.tyron.ledgercst.core.model.ValueToken;
import com.tyron.ledgercst.core.spacing.SpacingAccessors;
import com.tyron.ledgercst.lang.ledger.lexer.LedgerTokenTypes;
import org.jetbrains.annotations.NotNull;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Calendar date, written {@code YYYY-MM-DD} or {@code YYYY/MM/DD}. New values are always
 * written with dashes.
 */
public final class Date extends ValueToken<LocalDate> implements MetaValue, SpacingAccessors {

    public static final String TYPE = LedgerTokenTypes.DATE;

    public Date(@NotNull String rawText) {
        super(rawText);
    }

    public static @NotNull Date fromValue(@NotNull LocalDate value) {
        return new Date(value.toString());
    }

    @Override
    protected @NotNull LocalDate parseValue(@NotNull String rawText) {
        try {
            return LocalDate.parse(rawText.replace('/', '-'));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid date: " + rawText, e);
        }
    }

    @Override
    protected @NotNull String formatValue(@NotNull LocalDate value) {
        return value.toString();
    }

    @Override
    public @NotNull Date copy() {
        return new Date(getRawText());
    }
}
