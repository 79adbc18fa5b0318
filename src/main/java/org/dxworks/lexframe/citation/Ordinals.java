package org.dxworks.lexframe.citation;

import java.util.List;
import java.util.Locale;

/** English ordinal words used for subparagraphs ("the second subparagraph"). */
public final class Ordinals {

    static final List<String> WORDS = List.of(
            "first", "second", "third", "fourth", "fifth", "sixth", "seventh", "eighth", "ninth", "tenth");

    static final String ALTERNATION = String.join("|", WORDS);

    private Ordinals() {
    }

    /** 1-based position of the word, or null when it is not an ordinal. */
    public static Integer toIndex(String word) {
        if (word == null) return null;
        int index = WORDS.indexOf(word.toLowerCase(Locale.ROOT));
        return index < 0 ? null : index + 1;
    }

    public static String toWord(int index) {
        return index >= 1 && index <= WORDS.size() ? WORDS.get(index - 1) : null;
    }
}
