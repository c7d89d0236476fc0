package com.czesl.vert.layer;

import com.czesl.vert.diagnostics.Diagnostics;
import java.util.List;
import java.util.Objects;

/**
 * Gives every token a sentence id. Only the B layer has authored sentences; A tokens inherit from
 * their first B link and W tokens from their first A link, so A must be propagated before W.
 */
public final class SentenceIdPropagator {
    public static final String UNKNOWN_SENTENCE = "unknown";

    private final Diagnostics diagnostics;

    public SentenceIdPropagator(Diagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public void propagate(Layer w, Layer a, Layer b) {
        fillGaps(b);
        inheritFromHigher(a);
        inheritFromHigher(w);
    }

    /** Inherits ids from the first higher link of each token, then fills the gaps. */
    public void inheritFromHigher(Layer layer) {
        for (Token token : layer.getTokens()) {
            List<Link> higher = token.getLinksHigher();
            if (higher.isEmpty()) {
                continue;
            }
            Link first = higher.get(0);
            switch (first.getKind()) {
                case TOKEN -> token.setSentenceId(first.getToken().getSentenceId());
                case DELETION -> {
                    // left for the gap filling below
                }
            }
        }
        fillGaps(layer);
    }

    /**
     * Tokens before the first resolved one take its id; any later unresolved token takes the id of the
     * token before it. A layer where nothing resolved gets {@link #UNKNOWN_SENTENCE}.
     */
    public void fillGaps(Layer layer) {
        List<Token> tokens = layer.getTokens();
        if (tokens.isEmpty()) {
            return;
        }
        int firstResolved = -1;
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).getSentenceId() != null) {
                firstResolved = i;
                break;
            }
        }
        if (firstResolved < 0) {
            diagnostics.warning(
                    tokens.get(0).getId(),
                    "No sentence id resolved in layer "
                            + layer.getName()
                            + ", using '"
                            + UNKNOWN_SENTENCE
                            + "'");
            for (Token token : tokens) {
                token.setSentenceId(UNKNOWN_SENTENCE);
            }
            return;
        }
        String leading = tokens.get(firstResolved).getSentenceId();
        for (int i = 0; i < firstResolved; i++) {
            tokens.get(i).setSentenceId(leading);
        }
        for (int i = firstResolved + 1; i < tokens.size(); i++) {
            if (tokens.get(i).getSentenceId() == null) {
                tokens.get(i).setSentenceId(tokens.get(i - 1).getSentenceId());
            }
        }
    }
}
