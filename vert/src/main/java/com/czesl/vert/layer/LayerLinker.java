package com.czesl.vert.layer;

import com.czesl.vert.diagnostics.Diagnostics;
import java.util.Objects;

/** Resolves the pending link ids of built layers into token references. */
public final class LayerLinker {
    private final Diagnostics diagnostics;

    public LayerLinker(Diagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Links W up to A, A down to W and up to B, and B down to A. Lists already filled at build time
     * (deletions) are left alone. Ids missing from the target layer are reported and dropped.
     */
    public void link(Layer w, Layer a, Layer b) {
        for (Token token : w.getTokens()) {
            resolveHigher(token, a);
        }
        for (Token token : a.getTokens()) {
            resolveLower(token, w);
            resolveHigher(token, b);
        }
        for (Token token : b.getTokens()) {
            resolveLower(token, a);
        }
    }

    private void resolveHigher(Token token, Layer target) {
        if (token.hasResolvedHigher()) {
            return;
        }
        for (String id : token.getLinkIdsHigher()) {
            Token linked = target.get(id);
            if (linked == null) {
                reportDangling(token, id, target);
                continue;
            }
            token.addLinkHigher(Link.to(linked));
        }
    }

    private void resolveLower(Token token, Layer target) {
        if (token.hasResolvedLower()) {
            return;
        }
        for (String id : token.getLinkIdsLower()) {
            Token linked = target.get(id);
            if (linked == null) {
                reportDangling(token, id, target);
                continue;
            }
            token.addLinkLower(Link.to(linked));
        }
    }

    private void reportDangling(Token token, String id, Layer target) {
        diagnostics.warning(
                token.getId(), "Link to " + id + " not found in layer " + target.getName());
    }
}
