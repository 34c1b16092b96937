package com.tyron.ledgercst.core.parser;

import com.tyron.ledgercst.core.fields.NodeLayout;
import com.tyron.ledgercst.core.model.TreeNode;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Binds a grammar rule to the tree node class built from it.
 */
public record NodeType<N extends TreeNode>(@NotNull Class<N> type, @NotNull NodeLayout layout, @NotNull Factory<N> factory) {

    public NodeType {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(factory, "factory");
    }

    public @NotNull String rule() {
        return layout.rule();
    }

    /**
     * Creates a node from children built over a shared store.
     */
    @FunctionalInterface
    public interface Factory<N extends TreeNode> {
        @NotNull N create(@NotNull TokenStore store, @NotNull ParsedChildren children);
    }
}
