package com.czesl.vert.layer;

import com.czesl.vert.diagnostics.Diagnostics;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Ordered tokens of one layer of one paragraph, with lookup by id. */
public final class Layer {
    private final LayerName name;
    private final List<Token> tokens;
    private final Map<String, Token> idToToken;

    private Layer(LayerName name, List<Token> tokens, Map<String, Token> idToToken) {
        this.name = name;
        this.tokens = List.copyOf(tokens);
        this.idToToken = idToToken;
    }

    /**
     * Builds a layer from tokens in document order. A token whose id was already seen is reported and
     * dropped, so the first occurrence wins.
     */
    public static Layer of(LayerName name, List<Token> tokens, Diagnostics diagnostics) {
        Objects.requireNonNull(name, "name");
        List<Token> kept = new ArrayList<>(tokens.size());
        Map<String, Token> idToToken = new LinkedHashMap<>();
        for (Token token : tokens) {
            if (idToToken.containsKey(token.getId())) {
                diagnostics.warning(
                        token.getId(), "Duplicate token id in layer " + name + ", dropping later token");
                continue;
            }
            idToToken.put(token.getId(), token);
            kept.add(token);
        }
        return new Layer(name, kept, idToToken);
    }

    public LayerName getName() {
        return name;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public Token get(String id) {
        return idToToken.get(id);
    }

    public int size() {
        return tokens.size();
    }
}
