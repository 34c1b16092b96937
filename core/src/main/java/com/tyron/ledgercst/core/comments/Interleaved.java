package com.tyron.ledgercst.core.comments;

import com.tyron.ledgercst.core.model.CstNode;
import org.jetbrains.annotations.NotNull;

/**
 * Entry of a list whose items may be interleaved with claimed comments.
 */
public sealed interface Interleaved<M extends CstNode> permits Interleaved.Item, Interleaved.Comment {

    @NotNull CstNode node();

    record Item<M extends CstNode>(@NotNull M node) implements Interleaved<M> {
    }

    record Comment<M extends CstNode>(@NotNull BlockComment node) implements Interleaved<M> {
    }
}
