package com.tyron.ledgercst.lang.ledger.tokens;

import com.tyron.ledgercst.core.model.TokenNode;
import com.tyron.ledgercst.lang.ledger.lexer.LedgerTokenTypes;
import org.jetbrains.annotations.NotNull;

public final class OpenLabel extends TokenNode {

    public static final String TYPE = LedgerTokenTypes.OPEN;

    public OpenLabel(@NotNull String rawText) {
        super(rawText);
    }

    public static @NotNull OpenLabel fromDefault() {
        return new OpenLabel("open");
    }

    @Override
    public @NotNull OpenLabel copy() {
        return new OpenLabel(getRawText());
    }
}
