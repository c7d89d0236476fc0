package com.czesl.vert.vertical;

import com.czesl.vert.diagnostics.Diagnostics;
import com.czesl.vert.layer.DeletionMarker;
import com.czesl.vert.layer.ErrorData;
import com.czesl.vert.layer.Layer;
import com.czesl.vert.layer.Link;
import com.czesl.vert.layer.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Walks the W tokens of a linked paragraph and writes sentence blocks of plain records and nested
 * {@code err}/{@code corr} blocks. Level 1 blocks describe a W to A edit, level 2 blocks an A to B
 * edit; a level 2 pair may sit inside a level 1 correction.
 *
 * <p>A token whose alignment fits none of the handled shapes is reported and produces no output.
 */
public final class VerticalSerializer {
    private static final String ERR = "err";
    private static final String CORR = "corr";

    private final Diagnostics diagnostics;

    public VerticalSerializer(Diagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /** One {@code <s>} block per maximal run of W tokens sharing a sentence id. */
    public List<String> serialize(Layer w) {
        List<String> out = new ArrayList<>();
        List<Token> tokens = w.getTokens();
        int start = 0;
        while (start < tokens.size()) {
            String sentenceId = tokens.get(start).getSentenceId();
            int end = start + 1;
            while (end < tokens.size() && Objects.equals(sentenceId, tokens.get(end).getSentenceId())) {
                end++;
            }
            out.add(VerticalFormat.openStructure("s", sentenceId));
            List<Token> sentence = tokens.subList(start, end);
            int index = 0;
            while (index < sentence.size()) {
                index = writeToken(sentence, index, out);
            }
            out.add(VerticalFormat.close("s"));
            start = end;
        }
        return out;
    }

    /** Writes the token at {@code index} and returns the index of the next unwritten token. */
    private int writeToken(List<Token> sentence, int index, List<String> out) {
        Token w = sentence.get(index);
        List<Link> higher = w.getLinksHigher();
        if (higher.isEmpty()) {
            return unhandled(w, index, "no link to the A layer");
        }
        Link first = higher.get(0);
        return switch (first.getKind()) {
            case DELETION -> writeDeletionAtW(w, first.getDeletion(), index, out);
            case TOKEN -> writeLinkedToA(sentence, index, first.getToken(), out);
        };
    }

    private int writeDeletionAtW(Token w, DeletionMarker deletion, int index, List<String> out) {
        String type = VerticalFormat.errorType(deletion.getErrors(), VerticalFormat.DELETION_TYPE);
        out.add(VerticalFormat.openBlock(ERR, 1, type));
        out.add(wSide(w));
        out.add(VerticalFormat.close(ERR));
        out.add(VerticalFormat.openBlock(CORR, 1, type));
        out.add(VerticalFormat.deletionRecord());
        out.add(VerticalFormat.close(CORR));
        return index + 1;
    }

    private int writeLinkedToA(List<Token> sentence, int index, Token a, List<String> out) {
        Token w = sentence.get(index);
        if (a.hasErrors()) {
            return writeEditAtW(sentence, index, a, out);
        }
        if (w.getLinksHigher().size() != 1) {
            return unhandled(w, index, "several error-free A links");
        }
        Link aHigher = a.getSingleHigher();
        if (aHigher != null && aHigher.isToken() && !aHigher.getToken().hasErrors()) {
            Token b = aHigher.getToken();
            out.add(
                    VerticalFormat.record(
                            w.getText(),
                            w.getId(),
                            a.getId(),
                            b.getId(),
                            b.getMorph().getLemma(),
                            VerticalFormat.tags(b.getMorph())));
            return index + 1;
        }
        writeEditAtA(w, a, out);
        return index + 1;
    }

    /** Level 1 block for the run of consecutive W tokens whose first A link is {@code a}. */
    private int writeEditAtW(List<Token> sentence, int index, Token a, List<String> out) {
        int end = index;
        while (end < sentence.size() && firstLinkedToken(sentence.get(end)) == a) {
            end++;
        }
        List<Token> run = sentence.subList(index, end);
        List<Token> corrected = new ArrayList<>();
        for (Token w : run) {
            for (Link link : w.getLinksHigher()) {
                if (link.isToken() && !containsSame(corrected, link.getToken())) {
                    corrected.add(link.getToken());
                }
            }
        }

        String type = VerticalFormat.errorType(a.getErrors(), VerticalFormat.UNSPECIFIED_TYPE);
        out.add(VerticalFormat.openBlock(ERR, 1, type));
        for (Token w : run) {
            out.add(wSide(w));
        }
        out.add(VerticalFormat.close(ERR));
        out.add(VerticalFormat.openBlock(CORR, 1, type));
        for (Token correctedA : corrected) {
            writeCorrectionOfA(correctedA, out);
        }
        out.add(VerticalFormat.close(CORR));
        return end;
    }

    private void writeCorrectionOfA(Token a, List<String> out) {
        List<Link> bLinks = a.getLinksHigher();
        if (bLinks.size() == 1 && bLinks.get(0).isToken() && !bLinks.get(0).getToken().hasErrors()) {
            Token b = bLinks.get(0).getToken();
            out.add(
                    VerticalFormat.record(
                            a.getText(),
                            null,
                            a.getId(),
                            b.getId(),
                            b.getMorph().getLemma(),
                            VerticalFormat.tags(b.getMorph())));
            return;
        }
        List<Token> bTokens = linkedTokens(bLinks);
        if (bTokens.isEmpty()) {
            diagnostics.warning(
                    a.getId(), "A token of a W-level edit is deleted or unlinked at B, skipping");
            return;
        }
        writeLevelTwo(a, null, bTokens, out);
    }

    /** Level 2 block for a W token that maps cleanly to {@code a} while {@code a} differs from B. */
    private void writeEditAtA(Token w, Token a, List<String> out) {
        List<Link> bLinks = a.getLinksHigher();
        List<Token> bTokens = linkedTokens(bLinks);
        if (!bTokens.isEmpty()) {
            writeLevelTwo(a, w.getId(), bTokens, out);
            return;
        }
        DeletionMarker deletion = firstDeletion(bLinks);
        List<ErrorData> deletionErrors = deletion == null ? List.of() : deletion.getErrors();
        String type = VerticalFormat.errorType(deletionErrors, VerticalFormat.DELETION_TYPE);
        out.add(VerticalFormat.openBlock(ERR, 2, type));
        out.add(aSide(a, w.getId()));
        out.add(VerticalFormat.close(ERR));
        out.add(VerticalFormat.openBlock(CORR, 2, type));
        out.add(VerticalFormat.deletionRecord());
        out.add(VerticalFormat.close(CORR));
    }

    private void writeLevelTwo(Token a, String wId, List<Token> bTokens, List<String> out) {
        List<ErrorData> errors = new ArrayList<>();
        for (Token b : bTokens) {
            errors.addAll(b.getErrors());
        }
        String type = VerticalFormat.errorType(errors, VerticalFormat.UNSPECIFIED_TYPE);
        out.add(VerticalFormat.openBlock(ERR, 2, type));
        out.add(aSide(a, wId));
        out.add(VerticalFormat.close(ERR));
        out.add(VerticalFormat.openBlock(CORR, 2, type));
        for (Token b : bTokens) {
            out.add(
                    VerticalFormat.record(
                            b.getText(),
                            null,
                            a.getId(),
                            b.getId(),
                            b.getMorph().getLemma(),
                            VerticalFormat.tags(b.getMorph())));
        }
        out.add(VerticalFormat.close(CORR));
    }

    private int unhandled(Token w, int index, String reason) {
        diagnostics.warning(w.getId(), "Unhandled alignment case (" + reason + "), token skipped");
        return index + 1;
    }

    private static String wSide(Token w) {
        return VerticalFormat.record(w.getText(), w.getId(), null, null, null, null);
    }

    private static String aSide(Token a, String wId) {
        return VerticalFormat.record(
                a.getText(),
                wId,
                a.getId(),
                null,
                VerticalFormat.candidateLemmas(a.getMorphs()),
                VerticalFormat.candidateTags(a.getMorphs()));
    }

    /** Tokens of a link list that holds no deletion; empty when it is empty or a deletion. */
    private static List<Token> linkedTokens(List<Link> links) {
        List<Token> tokens = new ArrayList<>(links.size());
        for (Link link : links) {
            switch (link.getKind()) {
                case TOKEN -> tokens.add(link.getToken());
                case DELETION -> {
                    return List.of();
                }
            }
        }
        return tokens;
    }

    private static DeletionMarker firstDeletion(List<Link> links) {
        for (Link link : links) {
            if (link.isDeletion()) {
                return link.getDeletion();
            }
        }
        return null;
    }

    private static Token firstLinkedToken(Token w) {
        List<Link> higher = w.getLinksHigher();
        if (higher.isEmpty() || !higher.get(0).isToken()) {
            return null;
        }
        return higher.get(0).getToken();
    }

    private static boolean containsSame(List<Token> tokens, Token token) {
        for (Token candidate : tokens) {
            if (candidate == token) {
                return true;
            }
        }
        return false;
    }
}
