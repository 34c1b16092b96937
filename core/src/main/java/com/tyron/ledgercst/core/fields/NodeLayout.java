package com.tyron.ledgercst.core.fields;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Ordered fields of one tree node type, matching the order of the children its grammar
 * rule produces.
 */
public record NodeLayout(@NotNull String rule, @NotNull List<FieldDescriptor> fields) {

    public NodeLayout {
        Objects.requireNonNull(rule, "rule");
        fields = List.copyOf(fields);
    }

    public static @NotNull NodeLayout of(@NotNull String rule, FieldDescriptor... fields) {
        return new NodeLayout(rule, List.of(fields));
    }

    public int indexOf(@NotNull String fieldName) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(fieldName)) {
                return i;
            }
        }
        throw new IllegalArgumentException("rule " + rule + " has no field " + fieldName);
    }

    public @NotNull FieldDescriptor field(@NotNull String fieldName) {
        return fields.get(indexOf(fieldName));
    }
}
