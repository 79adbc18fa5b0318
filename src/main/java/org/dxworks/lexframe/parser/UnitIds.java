package org.dxworks.lexframe.parser;

import java.util.Set;

public class UnitIds {

    private UnitIds() {
    }

    /**
     * Returns {@code candidate} when unused, otherwise the first of
     * {@code candidate_1}, {@code candidate_2}, ... not in {@code existing}.
     */
    public static String uniqueId(Set<String> existing, String candidate) {
        if (!existing.contains(candidate)) {
            return candidate;
        }
        int suffix = 1;
        while (existing.contains(candidate + "_" + suffix)) {
            suffix++;
        }
        return candidate + "_" + suffix;
    }

    public static String article(String articleNumber) {
        return "art-" + articleNumber;
    }

    public static String paragraph(String articleId, String paragraphNumber) {
        return articleId + ".par-" + paragraphNumber;
    }

    public static String subparagraph(String paragraphId, int index) {
        return paragraphId + ".subpar-" + index;
    }

    /** Id segment prefix for list rows at a nesting depth: pt, sub, subsub, then n3, n4, ... */
    public static String pointPrefix(int depth) {
        return switch (depth) {
            case 0 -> "pt";
            case 1 -> "sub";
            case 2 -> "subsub";
            default -> "n" + depth;
        };
    }
}
