package com.tyron.ledgercst.core.model;

import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Optional child anchored by a {@link Placeholder}. While absent, the span collapses to the
 * placeholder; while present, the floating direction decides whether the value follows
 * ({@link MaybeLeft}) or precedes ({@link MaybeRight}) the placeholder.
 *
 * @param <X> type of the optional value
 */
public abstract class Maybe<X extends CstNode> extends TreeNode {

    protected Placeholder placeholder;
    protected @Nullable X inner;

    protected Maybe(@NotNull TokenStore tokenStore, @Nullable X inner, @NotNull Placeholder placeholder) {
        super(tokenStore);
        this.inner = inner;
        this.placeholder = Objects.requireNonNull(placeholder, "placeholder");
    }

    public @NotNull Placeholder getPlaceholder() {
        return placeholder;
    }

    public @Nullable X getInner() {
        return inner;
    }

    public boolean isPresent() {
        return inner != null;
    }

    /**
     * Inserts {@code value} together with {@code separators} next to the placeholder.
     * The separators must be fresh detached tokens.
     *
     * @throws IllegalStateException if a value is already present
     */
    public abstract void createInner(@NotNull X value, @NotNull List<? extends Token> separators);

    /**
     * Removes the present value and its separators, leaving only the placeholder.
     */
    public abstract void removeInner();

    /**
     * Replaces the present value with {@code value}, keeping the separators.
     */
    public void replaceInner(@NotNull X value) {
        X current = requirePresent();
        inner = NodeReplacer.replace(current, value);
    }

    /**
     * Takes ownership of {@code value} whose tokens (value plus separators) already sit in
     * the right place next to the placeholder. No token is moved.
     */
    public void adoptInner(@NotNull X value) {
        if (inner != null) {
            throw new IllegalStateException("value already present: " + inner);
        }
        this.inner = Objects.requireNonNull(value, "value");
    }

    /**
     * Forgets the present value without touching the token stream; its tokens end up
     * outside this node's span.
     */
    public @Nullable X releaseInner() {
        X released = inner;
        inner = null;
        return released;
    }

    protected @NotNull X requirePresent() {
        X current = inner;
        if (current == null) {
            throw new IllegalStateException("no value present");
        }
        return current;
    }

    protected void requireAbsent() {
        if (inner != null) {
            throw new IllegalStateException("value already present: " + inner);
        }
    }

    @Override
    protected void reattachChildren(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        inner = reattachNullable(inner, store, transformer);
        placeholder = transformer.transform(placeholder);
    }

    @Override
    protected @NotNull List<?> getChildren() {
        return Arrays.asList(placeholder, inner);
    }
}
