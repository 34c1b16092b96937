package com.tyron.ledgercst.core.model;

import org.jetbrains.annotations.Nullable;

/**
 * Node that starts with its own indentation, such as a metadata line.
 */
public interface Indentable {

    @Nullable String getIndent();
}
