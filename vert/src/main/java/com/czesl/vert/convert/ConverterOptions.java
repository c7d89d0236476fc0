package com.czesl.vert.convert;

/** Switches of a conversion run. */
public final class ConverterOptions {
    private static final String GUESS_ERRORS_PROPERTY = "czesl.vert.guessErrors";
    /** Consulted only when the system property is not set. */
    private static final String GUESS_ERRORS_ENV = "CZESL_VERT_GUESS_ERRORS";

    private final boolean guessErrors;

    private ConverterOptions(boolean guessErrors) {
        this.guessErrors = guessErrors;
    }

    public static ConverterOptions defaults() {
        return new ConverterOptions(false);
    }

    /** Reads the system properties first, then the environment. */
    public static ConverterOptions fromEnvironment() {
        String value = System.getProperty(GUESS_ERRORS_PROPERTY);
        if (value == null) {
            value = System.getenv(GUESS_ERRORS_ENV);
        }
        return new ConverterOptions(Boolean.parseBoolean(value));
    }

    public ConverterOptions withGuessErrors(boolean guessErrors) {
        return new ConverterOptions(guessErrors);
    }

    /** Whether tokens without explicit error tags get one guessed from a spelling difference. */
    public boolean isGuessErrors() {
        return guessErrors;
    }
}
