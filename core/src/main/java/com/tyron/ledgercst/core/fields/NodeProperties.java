package com.tyron.ledgercst.core.fields;

import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.core.model.Maybe;
import com.tyron.ledgercst.core.model.NodeReplacer;
import com.tyron.ledgercst.core.model.ValueToken;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.Function;

/**
 * Shared setter logic behind the typed accessors of tree nodes.
 */
public final class NodeProperties {

    private NodeProperties() {
    }

    /**
     * Replaces a required child. Returns the node to store in the field.
     */
    public static <X extends CstNode> @NotNull X setRequired(@NotNull X current, @NotNull X value) {
        return NodeReplacer.replace(current, value);
    }

    public static <X extends CstNode> void setOptional(@NotNull Maybe<X> maybe, @Nullable X value, @NotNull FieldDescriptor field) {
        setOptional(maybe, value, MaybeHooks.standard(field));
    }

    /**
     * Absent and null is a no-op, absent and a value creates, present and null removes,
     * present and a value replaces.
     */
    public static <X extends CstNode> void setOptional(@NotNull Maybe<X> maybe, @Nullable X value, @NotNull MaybeHooks<X> hooks) {
        X current = maybe.getInner();
        if (current == null && value != null) {
            hooks.create(maybe, value);
        } else if (current != null && value == null) {
            hooks.remove(maybe);
        } else if (current != null) {
            maybe.replaceInner(value);
        }
    }

    public static <V, X extends ValueToken<V>> @Nullable V getOptionalValue(@NotNull Maybe<X> maybe) {
        X inner = maybe.getInner();
        return inner != null ? inner.getValue() : null;
    }

    /**
     * Updates the present token in place, otherwise creates or removes it through
     * {@code factory}.
     */
    public static <V, X extends ValueToken<V>> void setOptionalValue(
            @NotNull Maybe<X> maybe,
            @Nullable V value,
            @NotNull MaybeHooks<X> hooks,
            @NotNull Function<V, X> factory) {
        X current = maybe.getInner();
        if (current != null && value != null) {
            current.setValue(value);
        } else {
            setOptional(maybe, value != null ? factory.apply(value) : null, hooks);
        }
    }
}
