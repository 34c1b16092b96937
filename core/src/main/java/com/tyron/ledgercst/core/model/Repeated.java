package com.tyron.ledgercst.core.model;

import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Ordered list of children anchored by a {@link Placeholder}. The placeholder always
 * precedes the first item, or stands alone while the list is empty.
 *
 * @param <X> item type
 */
public class Repeated<X extends CstNode> extends TreeNode {

    private Placeholder placeholder;
    private List<X> items;
    private final @Nullable String inferredIndent;

    public Repeated(@NotNull TokenStore tokenStore, @NotNull List<X> items, @NotNull Placeholder placeholder, @Nullable String inferredIndent) {
        super(tokenStore);
        this.items = new ArrayList<>(items);
        this.placeholder = Objects.requireNonNull(placeholder, "placeholder");
        this.inferredIndent = inferredIndent;
    }

    /**
     * Builds a standalone list. {@code separatorsBefore}, when given, supplies the separators
     * ahead of the first item; every other item is preceded by {@code separators}.
     */
    public static <X extends CstNode> @NotNull Repeated<X> fromChildren(
            @NotNull List<? extends X> items,
            @NotNull Supplier<List<Token>> separators,
            @Nullable Supplier<List<Token>> separatorsBefore,
            @Nullable String indent) {
        Placeholder placeholder = new Placeholder();
        List<Token> tokens = new ArrayList<>();
        tokens.add(placeholder);
        for (int i = 0; i < items.size(); i++) {
            if (i == 0 && separatorsBefore != null) {
                tokens.addAll(separatorsBefore.get());
            } else {
                tokens.addAll(separators.get());
            }
            tokens.addAll(items.get(i).detach());
        }
        TokenStore store = TokenStore.fromTokens(tokens);
        List<X> attached = new ArrayList<>(items.size());
        for (X item : items) {
            attached.add(reattachChild(item, store, TokenTransformer.identity()));
        }
        return new Repeated<>(store, attached, placeholder, indent);
    }

    public @NotNull Placeholder getPlaceholder() {
        return placeholder;
    }

    /**
     * Read-only view of the items, in store order.
     */
    public @NotNull List<X> getItems() {
        return Collections.unmodifiableList(items);
    }

    /**
     * Replaces the item list without touching the token stream. The caller guarantees that
     * {@code newItems} matches the store order after the placeholder.
     */
    public void replaceItems(@NotNull List<? extends X> newItems) {
        this.items = new ArrayList<>(newItems);
    }

    /**
     * Indentation observed on the parsed items, used when synthesizing new ones.
     */
    public @Nullable String getInferredIndent() {
        return inferredIndent;
    }

    @Override
    public @NotNull Token getFirstToken() {
        return placeholder;
    }

    @Override
    public @NotNull Token getLastToken() {
        return items.isEmpty() ? placeholder : items.get(items.size() - 1).getLastToken();
    }

    @Override
    protected @NotNull Repeated<X> cloneNode(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        List<X> cloned = new ArrayList<>(items.size());
        for (X item : items) {
            cloned.add(cloneChild(item, store, transformer));
        }
        return new Repeated<>(store, cloned, transformer.transform(placeholder), inferredIndent);
    }

    @Override
    protected void reattachChildren(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        List<X> reattached = new ArrayList<>(items.size());
        for (X item : items) {
            reattached.add(reattachChild(item, store, transformer));
        }
        items = reattached;
        placeholder = transformer.transform(placeholder);
    }

    @Override
    protected @NotNull List<?> getChildren() {
        List<Object> children = new ArrayList<>(items.size() + 1);
        children.add(placeholder);
        children.addAll(items);
        return children;
    }
}
