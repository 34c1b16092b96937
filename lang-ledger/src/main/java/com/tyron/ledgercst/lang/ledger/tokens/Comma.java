package com.tyron.ledgercst.lang.ledger.tokens;

import com.tyron.ledgercst.core.model.TokenNode;
import com.tyron.ledgercst.lang.ledger.lexer.LedgerTokenTypes;
import org.jetbrains.annotations.NotNull;

/**
 * Separator between list items.
 */
public final class Comma extends TokenNode {

    public static final String TYPE = LedgerTokenTypes.COMMA;

    public Comma(@NotNull String rawText) {
        super(rawText);
    }

    public static @NotNull Comma fromDefault() {
        return new Comma(",");
    }

    @Override
    public @NotNull Comma copy() {
        return new Comma(getRawText());
    }
}
