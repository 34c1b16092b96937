package com.tyron.ledgercst.core.fields;

import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.core.model.Maybe;
import org.jetbrains.annotations.NotNull;

/**
 * Custom formatting for an optional field. {@link #create} must leave the value present,
 * {@link #remove} must leave it absent.
 */
public interface MaybeHooks<X extends CstNode> {

    void create(@NotNull Maybe<X> maybe, @NotNull X value);

    void remove(@NotNull Maybe<X> maybe);

    /**
     * Hooks that insert and remove through the field's separators.
     */
    static <X extends CstNode> @NotNull MaybeHooks<X> standard(@NotNull FieldDescriptor field) {
        return new MaybeHooks<>() {
            @Override
            public void create(@NotNull Maybe<X> maybe, @NotNull X value) {
                maybe.createInner(value, field.newSeparators());
            }

            @Override
            public void remove(@NotNull Maybe<X> maybe) {
                maybe.removeInner();
            }
        };
    }
}
