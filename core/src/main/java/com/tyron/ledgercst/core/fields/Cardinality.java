package com.tyron.ledgercst.core.fields;

public enum Cardinality {
    REQUIRED,
    OPTIONAL,
    REPEATED
}
