package com.czesl.vert.layer;

import static com.czesl.vert.testing.Fixtures.element;
import static com.czesl.vert.testing.Fixtures.para;
import static com.czesl.vert.testing.Fixtures.sentence;
import static com.czesl.vert.testing.Fixtures.token;
import static com.czesl.vert.testing.Fixtures.w;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.czesl.vert.convert.ConversionException;
import com.czesl.vert.diagnostics.ConversionMessage;
import com.czesl.vert.diagnostics.Diagnostics;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

final class LayerBuilderTest {

    private final Diagnostics diagnostics = new Diagnostics();
    private final LayerBuilder builder = new LayerBuilder(diagnostics);

    @Test
    void buildsWTokensWithPendingLinks() {
        Element aPara = element(para("a-p1", "w#w-p1", token("a1", "run", "run", "k5", "w#w1")));
        Layer w = builder.buildW(element(para("w-p1", null, w("w1", "run"))), edges(aPara));

        Token token = w.get("w1");
        assertEquals("run", token.getText());
        assertEquals(LayerName.W, token.getLayer());
        assertEquals(List.of("a1"), token.getLinkIdsHigher());
        assertTrue(token.getLinksHigher().isEmpty());
        assertTrue(token.getErrors().isEmpty());
        assertEquals(0, diagnostics.count(ConversionMessage.Level.WARNING));
    }

    @Test
    void deletionIsAttachedAtBuildTime() {
        Element aPara = element(para("a-p1", null, "<edge><from>w#w1</from></edge>"));
        Layer w = builder.buildW(element(para("w-p1", null, w("w1", "the"))), edges(aPara));

        List<Link> higher = w.get("w1").getLinksHigher();
        assertEquals(1, higher.size());
        assertEquals(Link.Kind.DELETION, higher.get(0).getKind());
        assertEquals("w1", higher.get(0).getDeletion().getFromId());
    }

    @Test
    void deletionWinsOverOrdinaryLinkAndIsReported() {
        Element aPara =
                element(
                        para(
                                "a-p1",
                                null,
                                token("a1", "x", "x", "X", "w#w1"),
                                "<edge><from>w#w1</from></edge>"));
        Layer w = builder.buildW(element(para("w-p1", null, w("w1", "x"))), edges(aPara));

        Token token = w.get("w1");
        assertEquals(List.of("a1"), token.getLinkIdsHigher());
        assertEquals(1, token.getLinksHigher().size());
        assertTrue(token.getLinksHigher().get(0).isDeletion());
        assertEquals(1, diagnostics.count(ConversionMessage.Level.WARNING));
    }

    @Test
    void unlinkedWTokenIsReportedButKept() {
        Element aPara = element(para("a-p1", null));
        Layer w = builder.buildW(element(para("w-p1", null, w("w1", "x"))), edges(aPara));

        assertEquals(1, w.size());
        assertEquals(1, diagnostics.count(ConversionMessage.Level.WARNING));
        assertEquals("w1", diagnostics.getMessages().get(0).getElementId());
    }

    @Test
    void aTokenWithoutLexIsSkipped() {
        Element aPara =
                element(
                        para(
                                "a-p1",
                                null,
                                "<w id=\"a1\"><token>x</token><edge><from>w#w1</from></edge></w>",
                                token("a2", "y", "y", "Y", "w#w2")));
        Layer a = builder.buildA(aPara, edges(aPara), edges(element(para("b-p1", null))));

        assertNull(a.get("a1"));
        assertEquals(1, a.size());
        assertTrue(
                diagnostics.getMessages().stream()
                        .anyMatch(message -> message.getElementId().equals("a1")));
    }

    @Test
    void aTokenKeepsAllCandidatesInOrder() {
        Element aPara =
                element(
                        para(
                                "a-p1",
                                null,
                                "<w id=\"a1\"><token>has</token>"
                                        + "<lex><lemma>have</lemma><mtag>VBZ</mtag></lex>"
                                        + "<lex><lemma>has</lemma><mtag>NN</mtag><mtag>SG</mtag></lex>"
                                        + "<edge><from>w#w1</from></edge></w>"));
        Layer a = builder.buildA(aPara, edges(aPara), edges(element(para("b-p1", null))));

        List<Morph> morphs = a.get("a1").getMorphs();
        assertEquals(
                List.of(new Morph("have", List.of("VBZ")), new Morph("has", List.of("NN", "SG"))),
                morphs);
        assertEquals(List.of("w1"), a.get("a1").getLinkIdsLower());
    }

    @Test
    void multipleEdgesOnATokenAreCombinedIntoOneErrorSet() {
        Element aPara =
                element(
                        para(
                                "a-p1",
                                null,
                                "<w id=\"a1\"><token>x</token><lex><lemma>x</lemma></lex>"
                                        + "<edge><from>w#w1</from><error><tag>t1</tag></error></edge>"
                                        + "<edge><from>w#w2</from>"
                                        + "<error><tag>t2</tag><link>l2</link></error></edge>"
                                        + "</w>"));
        Layer a = builder.buildA(aPara, edges(aPara), edges(element(para("b-p1", null))));

        List<ErrorData> errors = a.get("a1").getErrors();
        assertEquals(1, errors.size());
        assertEquals(List.of("t1", "t2"), errors.get(0).getTags());
        assertEquals(List.of("l2"), errors.get(0).getLinks());
        assertTrue(diagnostics.count(ConversionMessage.Level.WARNING) >= 1);
    }

    @Test
    void bTokensTakeSentenceIdFromEnclosingSentence() throws Exception {
        Element bPara =
                element(
                        para(
                                "b-p1",
                                null,
                                sentence("s1", token("b1", "x", "x", "X", "a#a1")),
                                sentence("s2", token("b2", "y", "y", "Y", "a#a2"))));
        Layer b = builder.buildB(bPara, edges(bPara));

        assertEquals("s1", b.get("b1").getSentenceId());
        assertEquals("s2", b.get("b2").getSentenceId());
        assertEquals(new Morph("y", List.of("Y")), b.get("b2").getMorph());
        assertEquals(List.of("a2"), b.get("b2").getLinkIdsLower());
    }

    @Test
    void bTokenWithTwoAnalysesAbortsTheParagraph() {
        Element bPara =
                element(
                        para(
                                "b-p1",
                                null,
                                sentence(
                                        "s1",
                                        "<w id=\"b1\"><token>x</token>"
                                                + "<lex><lemma>x</lemma></lex>"
                                                + "<lex><lemma>y</lemma></lex></w>")));

        assertThrows(ConversionException.class, () -> builder.buildB(bPara, edges(bPara)));
    }

    @Test
    void duplicateIdsKeepTheFirstToken() {
        Element aPara = element(para("a-p1", null));
        Layer w =
                builder.buildW(
                        element(para("w-p1", null, w("w1", "first"), w("w1", "second"))),
                        edges(aPara));

        assertEquals(1, w.size());
        assertEquals("first", w.get("w1").getText());
    }

    private EdgeMap edges(Element upperPara) {
        return EdgeMap.fromParagraph(upperPara, diagnostics);
    }
}
