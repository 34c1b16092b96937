package com.tyron.ledgercst.lang.ledger.tokens;

import com.tyron.ledgercst.core.model.TokenNode;
import com.tyron.ledgercst.lang.ledger.lexer.LedgerTokenTypes;
import org.jetbrains.annotations.NotNull;

public final class CommodityLabel extends TokenNode {

    public static final String TYPE = LedgerTokenTypes.COMMODITY;

    public CommodityLabel(@NotNull String rawText) {
        super(rawText);
    }

    public static @NotNull CommodityLabel fromDefault() {
        return new CommodityLabel("commodity");
    }

    @Override
    public @NotNull CommodityLabel copy() {
        return new CommodityLabel(getRawText());
    }
}
