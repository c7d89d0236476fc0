package com.czesl.vert.layer;

import com.czesl.vert.convert.ConversionException;
import com.czesl.vert.diagnostics.Diagnostics;
import com.czesl.vert.xml.XmlElements;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Turns the {@code para} elements of the three layers into token sequences. Pending link ids come from
 * the edge maps; deletions are attached here already because a deletion always takes priority over
 * ordinary links, which {@link LayerLinker} resolves afterwards.
 */
public final class LayerBuilder {
    private final Diagnostics diagnostics;

    public LayerBuilder(Diagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public Layer buildW(Element wPara, EdgeMap edgesWA) {
        List<Token> tokens = new ArrayList<>();
        for (Element element : XmlElements.descendants(wPara, "w")) {
            String id = element.getAttribute("id");
            Token token = Token.w(id, tokenText(element), edgesWA.upperIds(id));
            attachDeletion(token, edgesWA.deletion(id));
            tokens.add(token);
        }
        return Layer.of(LayerName.W, tokens, diagnostics);
    }

    public Layer buildA(Element aPara, EdgeMap edgesWA, EdgeMap edgesAB) {
        List<Token> tokens = new ArrayList<>();
        for (Element element : XmlElements.descendants(aPara, "w")) {
            String id = element.getAttribute("id");
            List<Element> lexes = XmlElements.children(element, "lex");
            if (lexes.isEmpty()) {
                diagnostics.warning(id, "Skipping A token with no <lex>");
                continue;
            }
            List<Morph> candidates = new ArrayList<>(lexes.size());
            for (Element lex : lexes) {
                candidates.add(readMorph(id, lex));
            }
            Token token =
                    Token.a(
                            id,
                            tokenText(element),
                            candidates,
                            readTokenErrors(id, element),
                            edgesWA.lowerIds(id),
                            edgesAB.upperIds(id));
            attachDeletion(token, edgesAB.deletion(id));
            tokens.add(token);
        }
        return Layer.of(LayerName.A, tokens, diagnostics);
    }

    /**
     * Builds the B layer. Sentence ids are taken from the enclosing {@code s} elements.
     *
     * @throws ConversionException when a token carries more than one analysis
     */
    public Layer buildB(Element bPara, EdgeMap edgesAB) throws ConversionException {
        List<Token> tokens = new ArrayList<>();
        for (Element element : XmlElements.descendants(bPara, "w")) {
            String id = element.getAttribute("id");
            List<Element> lexes = XmlElements.children(element, "lex");
            if (lexes.isEmpty()) {
                diagnostics.warning(id, "Skipping B token with no <lex>");
                continue;
            }
            if (lexes.size() > 1) {
                throw new ConversionException(
                        "B token " + id + " contains " + lexes.size() + " <lex> elements, expected one");
            }
            String sentenceId = enclosingSentenceId(element, bPara);
            if (sentenceId == null) {
                diagnostics.warning(id, "B token outside of any <s>");
            }
            tokens.add(
                    Token.b(
                            id,
                            tokenText(element),
                            readMorph(id, lexes.get(0)),
                            readTokenErrors(id, element),
                            edgesAB.lowerIds(id),
                            sentenceId));
        }
        return Layer.of(LayerName.B, tokens, diagnostics);
    }

    private void attachDeletion(Token token, DeletionMarker deletion) {
        boolean linked = !token.getLinkIdsHigher().isEmpty();
        if (deletion != null) {
            if (linked) {
                diagnostics.warning(
                        token.getId(),
                        "Token is both deleted and linked to "
                                + token.getLinkIdsHigher()
                                + ", keeping the deletion");
            }
            token.addLinkHigher(Link.deletion(deletion));
        } else if (!linked) {
            diagnostics.warning(
                    token.getId(), "Token of layer " + token.getLayer() + " has no higher link");
        }
    }

    private List<ErrorData> readTokenErrors(String id, Element element) {
        List<Element> edges = XmlElements.children(element, "edge");
        if (edges.isEmpty()) {
            return List.of();
        }
        if (edges.size() == 1) {
            return EdgeMap.readErrors(edges.get(0));
        }
        diagnostics.warning(id, "Token contains " + edges.size() + " edges, combining their errors");
        List<ErrorData> all = new ArrayList<>();
        for (Element edge : edges) {
            all.addAll(EdgeMap.readErrors(edge));
        }
        return all.isEmpty() ? List.of() : List.of(ErrorData.combine(all));
    }

    private Morph readMorph(String id, Element lex) {
        List<Element> lemmas = XmlElements.children(lex, "lemma");
        if (lemmas.size() != 1) {
            diagnostics.warning(id, "Expected one <lemma> in <lex>, found " + lemmas.size());
        }
        String lemma = lemmas.isEmpty() ? "" : lemmas.get(0).getTextContent().trim();
        List<String> tags = new ArrayList<>();
        for (Element mtag : XmlElements.children(lex, "mtag")) {
            tags.add(mtag.getTextContent().trim());
        }
        return new Morph(lemma, tags);
    }

    private String tokenText(Element element) {
        String text = XmlElements.childText(element, "token");
        if (text == null) {
            diagnostics.warning(element.getAttribute("id"), "Token without <token> text");
            return "";
        }
        return text;
    }

    private static String enclosingSentenceId(Element token, Element para) {
        Node node = token.getParentNode();
        while (node != null && node != para) {
            if (XmlElements.isElement(node, "s")) {
                return XmlElements.attribute((Element) node, "id");
            }
            node = node.getParentNode();
        }
        return null;
    }
}
