package com.czesl.vert.vertical;

import com.czesl.vert.layer.ErrorData;
import com.czesl.vert.layer.Morph;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Field layout and separators of the vertical output. */
public final class VerticalFormat {
    public static final String FIELD_SEPARATOR = "\t";
    public static final String TAG_SEPARATOR = "|";
    public static final String CANDIDATE_SEPARATOR = "||";
    public static final String EMPTY_FIELD = "-";

    public static final String DELETION_TYPE = "del";
    public static final String UNSPECIFIED_TYPE = "unspec";
    public static final String DELETION_TEXT = "[del]";
    public static final String DELETION_ID = "#del";

    private VerticalFormat() {}

    /** One token line: text, W id, A id, B id, lemma, tags. Null or empty slots become {@code -}. */
    public static String record(
            String text, String wId, String aId, String bId, String lemma, String tags) {
        return String.join(
                FIELD_SEPARATOR,
                field(text),
                field(wId),
                field(aId),
                field(bId),
                field(lemma),
                field(tags));
    }

    /** The line standing in for material removed by a deletion. */
    public static String deletionRecord() {
        return record(DELETION_TEXT, DELETION_ID, DELETION_ID, DELETION_ID, DELETION_TEXT, EMPTY_FIELD);
    }

    public static String tags(Morph morph) {
        return String.join(TAG_SEPARATOR, morph.getTags());
    }

    public static String candidateLemmas(List<Morph> candidates) {
        List<String> lemmas = new ArrayList<>(candidates.size());
        for (Morph morph : candidates) {
            lemmas.add(morph.getLemma());
        }
        return String.join(CANDIDATE_SEPARATOR, lemmas);
    }

    public static String candidateTags(List<Morph> candidates) {
        List<String> tagSets = new ArrayList<>(candidates.size());
        for (Morph morph : candidates) {
            tagSets.add(tags(morph));
        }
        return String.join(CANDIDATE_SEPARATOR, tagSets);
    }

    /**
     * Error type attribute: every tag of every error set, first occurrence kept, or {@code fallback}
     * when there are none.
     */
    public static String errorType(List<ErrorData> errors, String fallback) {
        Set<String> tags = new LinkedHashSet<>();
        for (ErrorData error : errors) {
            for (String tag : error.getTags()) {
                if (!tag.isEmpty()) {
                    tags.add(tag);
                }
            }
        }
        return tags.isEmpty() ? fallback : String.join(TAG_SEPARATOR, tags);
    }

    public static String openStructure(String name, String id) {
        return "<" + name + " id=\"" + escapeAttribute(id) + "\">";
    }

    public static String openBlock(String name, int level, String type) {
        return "<" + name + " level=\"" + level + "\" type=\"" + escapeAttribute(type) + "\">";
    }

    public static String close(String name) {
        return "</" + name + ">";
    }

    public static String escapeAttribute(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder builder = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> builder.append("&amp;");
                case '<' -> builder.append("&lt;");
                case '>' -> builder.append("&gt;");
                case '"' -> builder.append("&quot;");
                default -> builder.append(c);
            }
        }
        return builder.toString();
    }

    // Tabs and line breaks inside a value would break the column layout.
    private static String field(String value) {
        if (value == null || value.isEmpty()) {
            return EMPTY_FIELD;
        }
        return value.replace('\t', ' ').replace('\n', ' ').replace('\r', ' ');
    }
}
