package org.dxworks.lexframe.citation;

import org.dxworks.lexframe.Numbers;
import org.dxworks.lexframe.model.Citation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Article enumerations such as "Articles 10 and 14(1)", "Article 7(4)(b) and (5)",
 * "Article 2, point (10), and Article 22" or "Articles 10 to 14", split into one
 * reference per addressed article or paragraph.
 */
final class ArticleReferences {

    static final String LABEL = "\\d+[a-z]?(?![a-z0-9])";

    static final String ITEM = "(?<label>" + LABEL + ")"
            + "(?:\\s?\\((?<par>\\d+)\\))?"
            + "(?:\\s?\\((?<pt>[a-z0-9]+)\\))?"
            + "(?<more>(?:(?:\\s*,\\s*|\\s*,?\\s+(?:and|or)\\s+)\\(\\d+\\)(?!\\s?\\())*)"
            + "(?:\\s*,\\s*point\\s+\\(?(?<cpt>[a-z0-9]+)\\)?(?![a-z0-9]))?"
            + "(?:\\s*,\\s*(?:the\\s+)?(?<ord>" + Ordinals.ALTERNATION + ")\\s+(?<ordkind>(?:sub)?paragraph))?";

    /** One or more items; commas are only allowed inside a list closed by "and", "or" or "to". */
    static final String ITEM_LIST = unnamed(ITEM)
            + "(?:(?:\\s*,\\s*(?:Articles?\\s+)?" + unnamed(ITEM) + ")*"
            + "\\s*,?\\s+(?:and|or|to)\\s+(?:Articles?\\s+)?" + unnamed(ITEM) + ")?";

    private static final Pattern ITEM_PATTERN = Pattern.compile(ITEM, Pattern.CASE_INSENSITIVE);
    private static final Pattern FOLLOW_UP = Pattern.compile("\\((\\d+)\\)");
    private static final Pattern RANGE_SEPARATOR = Pattern.compile("\\bto\\b", Pattern.CASE_INSENSITIVE);

    record ArticleRef(int start, int end, String label, Integer paragraph, String point,
                      String subparagraphOrdinal, int[] range) {

        void applyTo(Citation citation) {
            if (range != null) {
                citation.articleRange = range;
                return;
            }
            citation.setArticleLabel(label);
            citation.paragraph = paragraph;
            citation.point = point;
            if (subparagraphOrdinal != null) {
                citation.subparagraphOrdinal = subparagraphOrdinal;
                citation.subparagraphIndex = Ordinals.toIndex(subparagraphOrdinal);
            }
        }
    }

    private ArticleReferences() {
    }

    static List<ArticleRef> parse(String text, int start, int end) {
        List<ArticleRef> refs = new ArrayList<>();
        Matcher matcher = ITEM_PATTERN.matcher(text);
        matcher.region(start, end);

        int previousEnd = -1;
        while (matcher.find()) {
            List<ArticleRef> itemRefs = itemRefs(text, matcher);
            ArticleRef from = refs.isEmpty() ? null : refs.get(refs.size() - 1);
            Integer first = from == null ? null : Numbers.leading(from.label());
            Integer last = Numbers.leading(itemRefs.get(0).label());
            if (previousEnd >= 0 && first != null && last != null
                    && RANGE_SEPARATOR.matcher(text.substring(previousEnd, matcher.start())).find()) {
                refs.set(refs.size() - 1, new ArticleRef(from.start(), matcher.end(), null, null, null, null,
                        new int[]{first, last}));
            } else {
                refs.addAll(itemRefs);
            }
            previousEnd = matcher.end();
        }
        return refs;
    }

    private static List<ArticleRef> itemRefs(String text, Matcher item) {
        String label = item.group("label").toLowerCase(Locale.ROOT);
        Integer paragraph = Numbers.parse(item.group("par"));
        String point = lower(item.group("cpt") != null ? item.group("cpt") : item.group("pt"));
        String ordinal = lower(item.group("ord"));
        String subparagraphOrdinal = null;
        if (ordinal != null) {
            if ("paragraph".equalsIgnoreCase(item.group("ordkind"))) {
                if (paragraph == null) {
                    paragraph = Ordinals.toIndex(ordinal);
                }
            } else {
                subparagraphOrdinal = ordinal;
            }
        }

        List<ArticleRef> refs = new ArrayList<>();
        String more = item.group("more");
        int mainEnd = more.isEmpty() ? item.end() : item.start("more");
        refs.add(new ArticleRef(item.start(), mainEnd, label, paragraph, point, subparagraphOrdinal, null));

        if (!more.isEmpty()) {
            Matcher followUp = FOLLOW_UP.matcher(text);
            followUp.region(item.start("more"), item.end("more"));
            List<int[]> spans = new ArrayList<>();
            List<Integer> paragraphs = new ArrayList<>();
            while (followUp.find()) {
                spans.add(new int[]{followUp.start(), followUp.end()});
                paragraphs.add(Numbers.parse(followUp.group(1)));
            }
            for (int i = 0; i < spans.size(); i++) {
                int spanEnd = i == spans.size() - 1 ? item.end() : spans.get(i)[1];
                refs.add(new ArticleRef(spans.get(i)[0], spanEnd, label, paragraphs.get(i), null, null, null));
            }
        }
        return refs;
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    /** Strips group names so a fragment can be repeated inside a larger expression. */
    static String unnamed(String regex) {
        return regex.replaceAll("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>", "(?:");
    }
}
