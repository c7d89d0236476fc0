package com.czesl.vert.layer;

import com.czesl.vert.diagnostics.Diagnostics;
import com.czesl.vert.xml.XmlElements;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.w3c.dom.Element;

/**
 * Alignment between a paragraph of some layer and the paragraph below it, as recorded by the
 * {@code edge} elements of the upper paragraph.
 *
 * <p>The forward map goes from a lower id to the upper ids it contributes to. An edge linking
 * several lower ids to several upper ids is flattened into the union of the simple links, so the
 * grouping of multi-edges is not recoverable from the map. The reverse map is the exact inversion of
 * the forward one. Edges placed directly under the paragraph and lacking any {@code to} target are
 * deletions and are kept apart from both maps.
 */
public final class EdgeMap {
    private final Map<String, List<String>> forward;
    private final Map<String, List<String>> reverse;
    private final Map<String, DeletionMarker> deletions;

    EdgeMap(
            Map<String, List<String>> forward,
            Map<String, List<String>> reverse,
            Map<String, DeletionMarker> deletions) {
        this.forward = forward;
        this.reverse = reverse;
        this.deletions = deletions;
    }

    /**
     * Reads the edges of an upper-layer paragraph.
     *
     * @param upperPara {@code para} element of the A or B layer
     * @param diagnostics collector for unexpected edges
     */
    public static EdgeMap fromParagraph(Element upperPara, Diagnostics diagnostics) {
        Map<String, List<String>> forward = new LinkedHashMap<>();
        for (Element token : XmlElements.descendants(upperPara, "w")) {
            String tokenId = token.getAttribute("id");
            for (Element edge : XmlElements.children(token, "edge")) {
                List<String> toIds = new ArrayList<>();
                toIds.add(tokenId);
                for (Element to : XmlElements.descendants(edge, "to")) {
                    toIds.add(XmlElements.stripReference(to.getTextContent()));
                }
                for (String fromId : fromIds(edge)) {
                    List<String> targets = forward.computeIfAbsent(fromId, key -> new ArrayList<>());
                    appendMissing(targets, toIds);
                }
            }
        }
        Map<String, DeletionMarker> deletions = findDeletions(upperPara, diagnostics);
        return new EdgeMap(
                unmodifiable(forward),
                unmodifiable(invert(forward)),
                Collections.unmodifiableMap(deletions));
    }

    /** Inverts a one-to-many id map, keeping first-seen order on both sides. */
    public static Map<String, List<String>> invert(Map<String, List<String>> mapping) {
        Map<String, List<String>> inverted = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : mapping.entrySet()) {
            for (String value : entry.getValue()) {
                List<String> keys = inverted.computeIfAbsent(value, key -> new ArrayList<>());
                if (!keys.contains(entry.getKey())) {
                    keys.add(entry.getKey());
                }
            }
        }
        return inverted;
    }

    /** Upper ids the lower id contributes to, empty when it has none. */
    public List<String> upperIds(String lowerId) {
        return forward.getOrDefault(lowerId, List.of());
    }

    /** Lower ids the upper id was produced from, empty when it has none. */
    public List<String> lowerIds(String upperId) {
        return reverse.getOrDefault(upperId, List.of());
    }

    public DeletionMarker deletion(String lowerId) {
        return deletions.get(lowerId);
    }

    public Map<String, List<String>> getForward() {
        return forward;
    }

    public Map<String, List<String>> getReverse() {
        return reverse;
    }

    public Map<String, DeletionMarker> getDeletions() {
        return deletions;
    }

    static List<ErrorData> readErrors(Element edge) {
        List<ErrorData> errors = new ArrayList<>();
        for (Element error : XmlElements.descendants(edge, "error")) {
            List<String> tags = new ArrayList<>();
            for (Element tag : XmlElements.descendants(error, "tag")) {
                tags.add(tag.getTextContent().trim());
            }
            List<String> links = new ArrayList<>();
            for (Element link : XmlElements.descendants(error, "link")) {
                links.add(link.getTextContent().trim());
            }
            errors.add(new ErrorData(tags, links));
        }
        return errors;
    }

    private static Map<String, DeletionMarker> findDeletions(Element upperPara, Diagnostics diagnostics) {
        Map<String, DeletionMarker> deletions = new LinkedHashMap<>();
        for (Element edge : XmlElements.children(upperPara, "edge")) {
            if (!XmlElements.descendants(edge, "to").isEmpty()) {
                diagnostics.warning(
                        edge.getAttribute("id"), "Unexpected non-deletion edge directly under <para>");
                continue;
            }
            List<ErrorData> errors = readErrors(edge);
            for (String fromId : fromIds(edge)) {
                deletions.put(fromId, new DeletionMarker(fromId, errors));
            }
        }
        return deletions;
    }

    private static List<String> fromIds(Element edge) {
        List<String> ids = new ArrayList<>();
        for (Element from : XmlElements.descendants(edge, "from")) {
            ids.add(XmlElements.stripReference(from.getTextContent()));
        }
        return ids;
    }

    private static void appendMissing(List<String> target, List<String> values) {
        for (String value : values) {
            if (!target.contains(value)) {
                target.add(value);
            }
        }
    }

    private static Map<String, List<String>> unmodifiable(Map<String, List<String>> mapping) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        mapping.forEach((key, values) -> copy.put(key, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }
}
