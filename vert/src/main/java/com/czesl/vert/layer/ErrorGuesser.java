package com.czesl.vert.layer;

import java.util.List;

/**
 * Fallback for corpora without explicit error tags: a token whose only lower counterpart is spelled
 * differently is marked with a generic error.
 */
public final class ErrorGuesser {
    public static final String GUESSED_ERROR_TAG = "unspec";

    /** Applies the heuristic to A and B; returns the number of tokens that received an error. */
    public int guess(Layer a, Layer b) {
        return guessLayer(a) + guessLayer(b);
    }

    private int guessLayer(Layer layer) {
        int guessed = 0;
        for (Token token : layer.getTokens()) {
            if (token.hasErrors()) {
                continue;
            }
            List<Link> lower = token.getLinksLower();
            if (lower.size() != 1 || !lower.get(0).isToken()) {
                continue;
            }
            if (!lower.get(0).getToken().getText().equals(token.getText())) {
                token.addError(new ErrorData(List.of(GUESSED_ERROR_TAG), List.of()));
                guessed++;
            }
        }
        return guessed;
    }
}
