package com.tyron.ledgercst.lang.ledger.tokens;

import com.tyron.ledgercst.core.model.TokenNode;
import com.tyron.ledgercst.lang.ledger.lexer.LedgerTokenTypes;
import org.jetbrains.annotations.NotNull;

public final class CloseLabel extends TokenNode {

    public static final String TYPE = LedgerTokenTypes.CLOSE;

    public CloseLabel(@NotNull String rawText) {
        super(rawText);
    }

    public static @NotNull CloseLabel fromDefault() {
        return new CloseLabel("close");
    }

    @Override
    public @NotNull CloseLabel copy() {
        return new CloseLabel(getRawText());
    }
}
