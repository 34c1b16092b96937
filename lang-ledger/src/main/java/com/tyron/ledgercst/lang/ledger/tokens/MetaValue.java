package com.tyron.ledgercst.lang.ledger.tokens;

import com.tyron.ledgercst.core.model.CstNode;
import org.jetbrains.annotations.NotNull;

/**
 * Token that can appear as the value of a metadata entry.
 */
public interface MetaValue extends CstNode {

    @NotNull Object getValue();
}
