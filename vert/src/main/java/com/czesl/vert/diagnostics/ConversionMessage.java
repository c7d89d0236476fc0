package com.czesl.vert.diagnostics;

/**
 * A diagnostic produced while converting a document set. Anomalies in the annotation are reported
 * this way instead of failing the conversion, so callers can inspect what was dropped or repaired.
 */
public final class ConversionMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String message;
    private final String documentId;
    private final String elementId;

    public ConversionMessage(Level level, String message, String documentId, String elementId) {
        this.level = level;
        this.message = message;
        this.documentId = documentId;
        this.elementId = elementId;
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    /** Id of the B-layer document being converted, or empty when not known. */
    public String getDocumentId() {
        return documentId;
    }

    /** Id of the token, paragraph or edge the message is about, or empty. */
    public String getElementId() {
        return elementId;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(level).append(": ").append(message);
        if (!documentId.isEmpty() || !elementId.isEmpty()) {
            builder.append(" (");
            builder.append(documentId);
            if (!documentId.isEmpty() && !elementId.isEmpty()) {
                builder.append('/');
            }
            builder.append(elementId);
            builder.append(')');
        }
        return builder.toString();
    }
}
