package com.czesl.vert.layer;

/** The three annotation layers, lowest first. */
public enum LayerName {
    W('w'),
    A('a'),
    B('b');

    private final char prefix;

    LayerName(char prefix) {
        this.prefix = prefix;
    }

    /** Character used as the layer prefix in ids and in {@code <prefix>#<id>} references. */
    public char getPrefix() {
        return prefix;
    }

    public LayerName lower() {
        return switch (this) {
            case W -> throw new IllegalStateException("W is the lowest layer");
            case A -> W;
            case B -> A;
        };
    }
}
