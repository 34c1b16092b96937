package com.tyron.ledgercst.core.fields;

/**
 * Side of its placeholder an optional value is laid out on.
 */
public enum Floating {
    /** {@code placeholder, separators, value} */
    LEFT,
    /** {@code value, separators, placeholder} */
    RIGHT
}
