package com.czesl.vert.tools;

import com.czesl.vert.diagnostics.ConversionMessage;
import java.util.List;

/** Outcome of converting a batch of document sets. */
public final class BatchResult {
    private final List<String> converted;
    private final List<String> failed;
    private final List<ConversionMessage> messages;

    public BatchResult(List<String> converted, List<String> failed, List<ConversionMessage> messages) {
        this.converted = List.copyOf(converted);
        this.failed = List.copyOf(failed);
        this.messages = List.copyOf(messages);
    }

    /** Names of the document sets that were written to the output. */
    public List<String> getConverted() {
        return converted;
    }

    /** Names of the document sets that were skipped because of an error. */
    public List<String> getFailed() {
        return failed;
    }

    public List<ConversionMessage> getMessages() {
        return messages;
    }

    public boolean isSuccessful() {
        return failed.isEmpty();
    }
}
