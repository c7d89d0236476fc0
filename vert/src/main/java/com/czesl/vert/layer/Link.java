package com.czesl.vert.layer;

import java.util.Objects;

/**
 * Entry of a resolved link list: either a token of the adjacent layer or a deletion marker. Callers
 * switch on {@link #getKind()} rather than probing the accessors.
 */
public final class Link {

    public enum Kind {
        TOKEN,
        DELETION
    }

    private final Kind kind;
    private final Token token;
    private final DeletionMarker deletion;

    private Link(Kind kind, Token token, DeletionMarker deletion) {
        this.kind = kind;
        this.token = token;
        this.deletion = deletion;
    }

    public static Link to(Token token) {
        return new Link(Kind.TOKEN, Objects.requireNonNull(token, "token"), null);
    }

    public static Link deletion(DeletionMarker deletion) {
        return new Link(Kind.DELETION, null, Objects.requireNonNull(deletion, "deletion"));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isToken() {
        return kind == Kind.TOKEN;
    }

    public boolean isDeletion() {
        return kind == Kind.DELETION;
    }

    public Token getToken() {
        if (kind != Kind.TOKEN) {
            throw new IllegalStateException("Link is a deletion: " + deletion);
        }
        return token;
    }

    public DeletionMarker getDeletion() {
        if (kind != Kind.DELETION) {
            throw new IllegalStateException("Link is a token: " + token.getId());
        }
        return deletion;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case TOKEN -> "Link(" + token.getLayer() + ":" + token.getId() + ")";
            case DELETION -> "Link(" + deletion + ")";
        };
    }
}
