package com.czesl.vert;

/** Release of the converter, as reported by {@code --version}. */
public final class Version {
    public static final String FULL = "0.1.0-alpha";

    private Version() {}
}
