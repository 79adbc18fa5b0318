package org.dxworks.lexframe.citation;

import java.util.List;
import java.util.Locale;

/**
 * Finds the legal connective ("referred to in", "pursuant to", ...) that most
 * closely precedes a citation. Purely an annotation; resolution never reads it.
 */
public class ConnectivePhrases {

    static final List<String> PHRASES = List.of(
            "as referred to in",
            "referred to in",
            "as laid down in",
            "laid down in",
            "as set out in",
            "set out in",
            "as provided for in",
            "provided for in",
            "as provided in",
            "provided in",
            "as defined in",
            "defined in",
            "as specified in",
            "specified in",
            "mentioned in",
            "in accordance with",
            "in compliance with",
            "in conformity with",
            "in application of",
            "within the meaning of",
            "on the basis of",
            "by way of derogation from",
            "without prejudice to",
            "adopted pursuant to",
            "pursuant to",
            "subject to",
            "established by",
            "as amended by",
            "under");

    private final int lookback;

    public ConnectivePhrases(int lookback) {
        this.lookback = lookback;
    }

    /** Lowercase phrase ending nearest to {@code spanStart} inside the lookback window, or null. */
    public String find(String text, int spanStart) {
        int windowStart = Math.max(0, spanStart - lookback);
        String window = text.substring(windowStart, spanStart).toLowerCase(Locale.ROOT);

        String best = null;
        int bestEnd = -1;
        for (String phrase : PHRASES) {
            int at = lastWordOccurrence(window, phrase);
            if (at < 0) {
                continue;
            }
            int end = at + phrase.length();
            if (end > bestEnd || (end == bestEnd && phrase.length() > best.length())) {
                best = phrase;
                bestEnd = end;
            }
        }
        return best;
    }

    private static int lastWordOccurrence(String window, String phrase) {
        int from = window.length();
        while (from >= 0) {
            int at = window.lastIndexOf(phrase, from);
            if (at < 0) {
                return -1;
            }
            int end = at + phrase.length();
            boolean startsWord = at == 0 || !Character.isLetter(window.charAt(at - 1));
            boolean endsWord = end == window.length() || !Character.isLetter(window.charAt(end));
            if (startsWord && endsWord) {
                return at;
            }
            from = at - 1;
        }
        return -1;
    }
}
