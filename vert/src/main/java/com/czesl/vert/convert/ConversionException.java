package com.czesl.vert.convert;

/**
 * Checked exception signalling that a document could not be converted, either because its layers
 * do not line up or because the annotation contains a case the vertical format cannot represent.
 */
public final class ConversionException extends Exception {
    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
