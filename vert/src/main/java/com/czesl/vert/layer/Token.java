package com.czesl.vert.layer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A token of one annotation layer together with its links to the adjacent layers. The layer decides
 * the shape of the morphological payload: W tokens carry none, A tokens one or more candidate
 * analyses, B tokens exactly one.
 *
 * <p>Tokens are created by {@link LayerBuilder} for a single paragraph. The resolved links and the
 * sentence id are filled in afterwards by {@link LayerLinker} and {@link SentenceIdPropagator}.
 */
public final class Token {
    private final String id;
    private final LayerName layer;
    private final String text;
    private final List<Morph> morphs;
    private final List<ErrorData> errors;
    private final List<String> linkIdsLower;
    private final List<String> linkIdsHigher;
    private final List<Link> linksLower = new ArrayList<>();
    private final List<Link> linksHigher = new ArrayList<>();
    private String sentenceId;

    private Token(
            String id,
            LayerName layer,
            String text,
            List<Morph> morphs,
            List<ErrorData> errors,
            List<String> linkIdsLower,
            List<String> linkIdsHigher,
            String sentenceId) {
        this.id = Objects.requireNonNull(id, "id");
        this.layer = Objects.requireNonNull(layer, "layer");
        this.text = text == null ? "" : text;
        this.morphs = List.copyOf(morphs);
        this.errors = new ArrayList<>(errors);
        this.linkIdsLower = List.copyOf(linkIdsLower);
        this.linkIdsHigher = List.copyOf(linkIdsHigher);
        this.sentenceId = sentenceId;
    }

    public static Token w(String id, String text, List<String> linkIdsHigher) {
        return new Token(id, LayerName.W, text, List.of(), List.of(), List.of(), linkIdsHigher, null);
    }

    public static Token a(
            String id,
            String text,
            List<Morph> candidates,
            List<ErrorData> errors,
            List<String> linkIdsLower,
            List<String> linkIdsHigher) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("A token " + id + " needs at least one morph");
        }
        return new Token(id, LayerName.A, text, candidates, errors, linkIdsLower, linkIdsHigher, null);
    }

    public static Token b(
            String id,
            String text,
            Morph morph,
            List<ErrorData> errors,
            List<String> linkIdsLower,
            String sentenceId) {
        return new Token(
                id,
                LayerName.B,
                text,
                List.of(Objects.requireNonNull(morph, "morph")),
                errors,
                linkIdsLower,
                List.of(),
                sentenceId);
    }

    public String getId() {
        return id;
    }

    public LayerName getLayer() {
        return layer;
    }

    public String getText() {
        return text;
    }

    /** Candidate analyses of an A token, the single analysis of a B token, nothing for W. */
    public List<Morph> getMorphs() {
        return morphs;
    }

    /** The analysis of a B token. */
    public Morph getMorph() {
        if (layer != LayerName.B) {
            throw new IllegalStateException("Only B tokens carry a single morph: " + id);
        }
        return morphs.get(0);
    }

    public List<ErrorData> getErrors() {
        return List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<String> getLinkIdsLower() {
        return linkIdsLower;
    }

    public List<String> getLinkIdsHigher() {
        return linkIdsHigher;
    }

    public List<Link> getLinksLower() {
        return List.copyOf(linksLower);
    }

    public List<Link> getLinksHigher() {
        return List.copyOf(linksHigher);
    }

    public String getSentenceId() {
        return sentenceId;
    }

    /** The higher link when there is exactly one, otherwise {@code null}. */
    public Link getSingleHigher() {
        return linksHigher.size() == 1 ? linksHigher.get(0) : null;
    }

    void addError(ErrorData error) {
        errors.add(error);
    }

    void addLinkLower(Link link) {
        linksLower.add(link);
    }

    void addLinkHigher(Link link) {
        linksHigher.add(link);
    }

    boolean hasResolvedLower() {
        return !linksLower.isEmpty();
    }

    boolean hasResolvedHigher() {
        return !linksHigher.isEmpty();
    }

    void setSentenceId(String sentenceId) {
        this.sentenceId = sentenceId;
    }

    @Override
    public String toString() {
        return "Token(layer=" + layer + ", id=" + id + ", text=" + text + ", morphs=" + morphs + ")";
    }
}
