package com.czesl.vert.layer;

import java.util.ArrayList;
import java.util.List;

/** Error tags attached to an edge, together with the ids of any related edges. */
public final class ErrorData {
    private final List<String> tags;
    private final List<String> links;

    public ErrorData(List<String> tags, List<String> links) {
        this.tags = List.copyOf(tags);
        this.links = List.copyOf(links);
    }

    public List<String> getTags() {
        return tags;
    }

    public List<String> getLinks() {
        return links;
    }

    /** Flattens several error sets into one, keeping tag and link order. */
    public static ErrorData combine(List<ErrorData> errors) {
        List<String> tags = new ArrayList<>();
        List<String> links = new ArrayList<>();
        for (ErrorData error : errors) {
            tags.addAll(error.getTags());
            links.addAll(error.getLinks());
        }
        return new ErrorData(tags, links);
    }

    @Override
    public String toString() {
        return "ErrorData(tags=" + tags + ", links=" + links + ")";
    }
}
