package com.czesl.vert.convert;

import com.czesl.vert.diagnostics.ConversionMessage;
import java.util.List;

/** Vertical text of one document set together with the diagnostics raised while producing it. */
public final class ConversionResult {
    private final String output;
    private final List<ConversionMessage> messages;

    public ConversionResult(String output, List<ConversionMessage> messages) {
        this.output = output;
        this.messages = List.copyOf(messages);
    }

    public String getOutput() {
        return output;
    }

    public List<ConversionMessage> getMessages() {
        return messages;
    }
}
