package com.tyron.ledgercst.core.fields;

import com.tyron.ledgercst.core.store.Token;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Static description of one field of a tree node.
 *
 * @param name             field name, used to look up parsed children
 * @param cardinality      required, optional or repeated
 * @param floating         layout side of an optional value; null for other cardinalities
 * @param separators       factories for the tokens separating the value (or each item)
 *                         from its neighbor
 * @param separatorsBefore factories for the separators ahead of the first item of a
 *                         repeated field, or null to use {@code separators}
 * @param defaultIndent    indentation for synthesized items, or null if items are not indented
 */
public record FieldDescriptor(
        @NotNull String name,
        @NotNull Cardinality cardinality,
        @Nullable Floating floating,
        @NotNull List<Supplier<? extends Token>> separators,
        @Nullable List<Supplier<? extends Token>> separatorsBefore,
        @Nullable Supplier<String> defaultIndent) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(cardinality, "cardinality");
        separators = List.copyOf(separators);
        separatorsBefore = separatorsBefore == null ? null : List.copyOf(separatorsBefore);
        if ((cardinality == Cardinality.OPTIONAL) != (floating != null)) {
            throw new IllegalArgumentException("floating direction must be set exactly for optional fields: " + name);
        }
    }

    public static @NotNull FieldDescriptor required(@NotNull String name) {
        return new FieldDescriptor(name, Cardinality.REQUIRED, null, List.of(), null, null);
    }

    @SafeVarargs
    public static @NotNull FieldDescriptor optional(@NotNull String name, @NotNull Floating floating, Supplier<? extends Token>... separators) {
        return new FieldDescriptor(name, Cardinality.OPTIONAL, floating, List.of(separators), null, null);
    }

    @SafeVarargs
    public static @NotNull FieldDescriptor repeated(@NotNull String name, Supplier<? extends Token>... separators) {
        return new FieldDescriptor(name, Cardinality.REPEATED, null, List.of(separators), null, null);
    }

    @SafeVarargs
    public final @NotNull FieldDescriptor withSeparatorsBefore(Supplier<? extends Token>... separatorsBefore) {
        return new FieldDescriptor(name, cardinality, floating, separators, List.of(separatorsBefore), defaultIndent);
    }

    public @NotNull FieldDescriptor withDefaultIndent(@NotNull Supplier<String> indent) {
        return new FieldDescriptor(name, cardinality, floating, separators, separatorsBefore, indent);
    }

    /**
     * Fresh separator tokens for one use.
     */
    public @NotNull List<Token> newSeparators() {
        return instantiate(separators);
    }

    /**
     * Fresh separator tokens for the first item of a repeated field.
     */
    public @NotNull List<Token> newSeparatorsBefore() {
        return instantiate(separatorsBefore != null ? separatorsBefore : separators);
    }

    public boolean hasSeparatorsBefore() {
        return separatorsBefore != null;
    }

    public @Nullable String getDefaultIndent() {
        return defaultIndent == null ? null : defaultIndent.get();
    }

    private static List<Token> instantiate(List<Supplier<? extends Token>> factories) {
        List<Token> tokens = new ArrayList<>(factories.size());
        for (Supplier<? extends Token> factory : factories) {
            tokens.add(factory.get());
        }
        return tokens;
    }
}
