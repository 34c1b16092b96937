package com.tyron.ledgercst.lang.ledger.nodes;

import com.tyron.ledgercst.core.comments.BlockComment;
import com.tyron.ledgercst.core.comments.RepeatedWithComments;
import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.lang.ledger.tokens.Date;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;

/**
 * A dated top level entry of a ledger file.
 */
public sealed interface Directive extends CstNode permits Open, Close, Commodity {

    @NotNull Date getRawDate();

    @NotNull LocalDate getDate();

    void setDate(@NotNull LocalDate date);

    @Nullable String getInlineComment();

    void setInlineComment(@Nullable String comment);

    @Nullable BlockComment getRawLeadingComment();

    @Nullable String getLeadingComment();

    void setLeadingComment(@Nullable String comment);

    @Nullable BlockComment getRawTrailingComment();

    @Nullable String getTrailingComment();

    void setTrailingComment(@Nullable String comment);

    @NotNull RepeatedWithComments<MetaItem> getRawMeta();

    @NotNull Meta getMeta();
}
