package org.dxworks.lexframe.citation;

import org.dxworks.lexframe.Numbers;
import org.dxworks.lexframe.model.Citation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One step of the extraction cascade: a pattern and the builder turning each
 * accepted match into citations.
 */
final class CitationRule {

    @FunctionalInterface
    interface Builder {
        /** Citations for one match, each spanning a disjoint slice of it; empty rejects the match. */
        List<Citation> build(Matcher match, String text);
    }

    private final String name;
    private final Pattern pattern;
    private final Builder builder;

    CitationRule(String name, Pattern pattern, Builder builder) {
        this.name = name;
        this.pattern = pattern;
        this.builder = builder;
    }

    /**
     * Tries matches longest first, then leftmost, and keeps those whose span is
     * still free. Matches holding a number too large for an int are dropped.
     * Accepted spans are added to {@code consumed}.
     */
    List<Citation> apply(String text, SpanSet consumed) {
        List<int[]> spans = new ArrayList<>();
        Matcher scan = pattern.matcher(text);
        while (scan.find()) {
            spans.add(new int[]{scan.start(), scan.end()});
        }
        if (spans.isEmpty()) {
            return List.of();
        }
        spans.sort(Comparator.<int[]>comparingInt(span -> span[0] - span[1]).thenComparingInt(span -> span[0]));

        List<Citation> built = new ArrayList<>();
        for (int[] span : spans) {
            if (consumed.overlaps(span[0], span[1]) || Numbers.hasOversized(text.subSequence(span[0], span[1]))) {
                continue;
            }
            Matcher match = pattern.matcher(text);
            if (!match.find(span[0]) || match.start() != span[0] || match.end() != span[1]) {
                continue;
            }
            List<Citation> citations = builder.build(match, text);
            if (citations.isEmpty()) {
                continue;
            }
            consumed.add(span[0], span[1]);
            built.addAll(citations);
        }
        return built;
    }

    @Override
    public String toString() {
        return name;
    }
}
