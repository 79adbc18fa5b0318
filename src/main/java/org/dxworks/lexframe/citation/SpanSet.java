package org.dxworks.lexframe.citation;

import java.util.Map;
import java.util.TreeMap;

/**
 * Half-open character intervals already claimed by accepted citations.
 * Stored intervals never overlap, so the entry with the greatest start below
 * a candidate's end is the only one that can collide with it.
 */
class SpanSet {

    private final TreeMap<Integer, Integer> spans = new TreeMap<>();

    boolean overlaps(int start, int end) {
        Map.Entry<Integer, Integer> before = spans.lowerEntry(end);
        return before != null && before.getValue() > start;
    }

    void add(int start, int end) {
        if (end <= start) {
            throw new IllegalArgumentException("Empty span [" + start + ", " + end + ")");
        }
        if (overlaps(start, end)) {
            throw new IllegalStateException("Span [" + start + ", " + end + ") overlaps a consumed span");
        }
        spans.put(start, end);
    }

    int size() {
        return spans.size();
    }
}
