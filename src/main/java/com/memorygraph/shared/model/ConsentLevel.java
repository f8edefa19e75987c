package com.memorygraph.shared.model;

/**
 * Default visibility of a node for requesters other than its owner.
 * Declared from most to least restrictive.
 */
public enum ConsentLevel {
    PRIVATE,
    RESTRICTED,
    SHARED,
    PUBLIC;

    public static ConsentLevel mostRestrictive(ConsentLevel a, ConsentLevel b) {
        return a.ordinal() <= b.ordinal() ? a : b;
    }
}
