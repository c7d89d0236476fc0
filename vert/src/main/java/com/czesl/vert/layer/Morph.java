package com.czesl.vert.layer;

import java.util.List;
import java.util.Objects;

/** One morphological analysis: a lemma and its ordered tags. */
public final class Morph {
    private final String lemma;
    private final List<String> tags;

    public Morph(String lemma, List<String> tags) {
        this.lemma = Objects.requireNonNull(lemma, "lemma");
        this.tags = List.copyOf(tags);
    }

    public String getLemma() {
        return lemma;
    }

    public List<String> getTags() {
        return tags;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Morph)) {
            return false;
        }
        Morph other = (Morph) obj;
        return lemma.equals(other.lemma) && tags.equals(other.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lemma, tags);
    }

    @Override
    public String toString() {
        return lemma + tags;
    }
}
