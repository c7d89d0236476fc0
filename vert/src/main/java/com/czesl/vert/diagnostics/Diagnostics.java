package com.czesl.vert.diagnostics;

import com.czesl.vert.diagnostics.ConversionMessage.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Collects the messages of one conversion run and mirrors each of them to {@code java.util.logging}.
 * The current document id is tracked here so the individual passes do not have to thread it through.
 */
public final class Diagnostics {
    private static final Logger LOGGER = Logger.getLogger(Diagnostics.class.getName());

    private final List<ConversionMessage> messages = new ArrayList<>();
    private String documentId = "";

    public void enterDocument(String documentId) {
        this.documentId = documentId == null ? "" : documentId;
    }

    public void leaveDocument() {
        this.documentId = "";
    }

    public void info(String elementId, String message) {
        report(Level.INFO, elementId, message);
    }

    public void warning(String elementId, String message) {
        report(Level.WARNING, elementId, message);
    }

    public void error(String elementId, String message) {
        report(Level.ERROR, elementId, message);
    }

    public void report(Level level, String elementId, String message) {
        Objects.requireNonNull(level, "level");
        ConversionMessage entry =
                new ConversionMessage(level, message, documentId, elementId == null ? "" : elementId);
        messages.add(entry);
        LOGGER.log(toLogLevel(level), "[czesl-vert] {0}", entry);
    }

    public List<ConversionMessage> getMessages() {
        return List.copyOf(messages);
    }

    public long count(Level level) {
        return messages.stream().filter(message -> message.getLevel() == level).count();
    }

    private static java.util.logging.Level toLogLevel(Level level) {
        return switch (level) {
            case INFO -> java.util.logging.Level.FINE;
            case WARNING -> java.util.logging.Level.WARNING;
            case ERROR -> java.util.logging.Level.SEVERE;
        };
    }
}
