package com.czesl.vert.layer;

import java.util.List;
import java.util.Objects;

/** Stands in for the higher-layer counterpart of a token that the annotator deleted. */
public final class DeletionMarker {
    private final String fromId;
    private final List<ErrorData> errors;

    public DeletionMarker(String fromId, List<ErrorData> errors) {
        this.fromId = Objects.requireNonNull(fromId, "fromId");
        this.errors = List.copyOf(errors);
    }

    public String getFromId() {
        return fromId;
    }

    public List<ErrorData> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return "Deletion(from=" + fromId + ", errors=" + errors + ")";
    }
}
