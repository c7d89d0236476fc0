package com.czesl.vert.layer;

import com.czesl.vert.convert.ConversionException;
import com.czesl.vert.diagnostics.Diagnostics;
import org.w3c.dom.Element;

/** The W, A and B layers of one paragraph, linked to each other and carrying sentence ids. */
public final class LinkedLayers {
    private final Layer w;
    private final Layer a;
    private final Layer b;

    public LinkedLayers(Layer w, Layer a, Layer b) {
        this.w = w;
        this.a = a;
        this.b = b;
    }

    /**
     * Runs the per-paragraph pipeline: edge maps, layer building, link resolution, sentence id
     * propagation and, when requested, error guessing.
     */
    public static LinkedLayers build(
            Element wPara, Element aPara, Element bPara, boolean guessErrors, Diagnostics diagnostics)
            throws ConversionException {
        EdgeMap edgesWA = EdgeMap.fromParagraph(aPara, diagnostics);
        EdgeMap edgesAB = EdgeMap.fromParagraph(bPara, diagnostics);

        LayerBuilder builder = new LayerBuilder(diagnostics);
        Layer w = builder.buildW(wPara, edgesWA);
        Layer a = builder.buildA(aPara, edgesWA, edgesAB);
        Layer b = builder.buildB(bPara, edgesAB);

        new LayerLinker(diagnostics).link(w, a, b);
        new SentenceIdPropagator(diagnostics).propagate(w, a, b);
        if (guessErrors) {
            int guessed = new ErrorGuesser().guess(a, b);
            if (guessed > 0) {
                diagnostics.info(bPara.getAttribute("id"), "Guessed errors for " + guessed + " tokens");
            }
        }
        return new LinkedLayers(w, a, b);
    }

    public Layer getW() {
        return w;
    }

    public Layer getA() {
        return a;
    }

    public Layer getB() {
        return b;
    }
}
