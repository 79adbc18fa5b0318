package org.dxworks.lexframe.citation;

import org.dxworks.lexframe.Numbers;
import org.dxworks.lexframe.citation.ActReferences.ActRef;
import org.dxworks.lexframe.citation.ArticleReferences.ArticleRef;
import org.dxworks.lexframe.model.ActType;
import org.dxworks.lexframe.model.Citation;
import org.dxworks.lexframe.model.CitationType;
import org.dxworks.lexframe.model.TreatyCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dxworks.lexframe.citation.ActReferences.ACT_NUMBER;
import static org.dxworks.lexframe.citation.ActReferences.ACT_PREFIX;
import static org.dxworks.lexframe.citation.ArticleReferences.ITEM_LIST;
import static org.dxworks.lexframe.citation.ArticleReferences.LABEL;

/**
 * The ordered extraction cascade. Earlier rules win: a later match overlapping
 * an accepted span is dropped, so specific phrasings ("Article 6 of Regulation
 * (EU) 2016/679") come before generic ones ("Article 6").
 */
final class CitationPatterns {

    private static final String ORD = Ordinals.ALTERNATION;
    private static final String NUMERAL = "(?:[IVXLC]+|\\d+)";
    private static final String ARTICLE_PAR_POINT = "Article\\s+(?<label>" + LABEL + ")"
            + "(?:\\s?\\((?<par>\\d+)\\))?(?:\\s?\\((?<pt>[a-z0-9]+)\\))?";

    static final String ACT_LIST = "(?:Council\\s+|Commission\\s+)?(?:Framework\\s+)?(?:Delegated\\s+|Implementing\\s+)?"
            + "(?<kind>Regulations?|Directives?|Decisions?)\\s+" + ACT_PREFIX + ACT_NUMBER
            + "(?:(?:\\s*,\\s*|\\s*,?\\s+(?:and|or)\\s+)" + ACT_PREFIX + ACT_NUMBER + ")*";

    private static final Pattern POINT_TOKEN = Pattern.compile("\\(([a-z0-9]+)\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER_TOKEN = Pattern.compile("\\d+");
    private static final Pattern WORD_TOKEN = Pattern.compile("\\S+");
    private static final Pattern NUMERAL_TOKEN = Pattern.compile("\\b" + NUMERAL + "\\b");

    static final List<CitationRule> RULES = List.of(
            // external acts; point-first before article-first so the point stays in the match
            rule("external-point-first",
                    "\\bpoint\\s+\\((?<pt>[a-z0-9]+)\\)\\s+of\\s+(?:the\\s+(?<ord>" + ORD + ")\\s+subparagraph\\s+of\\s+)?"
                            + "Article\\s+(?<label>" + LABEL + ")(?:\\s?\\((?<par>\\d+)\\))?(?:\\s?\\((?<ptin>[a-z0-9]+)\\))?"
                            + "\\s*,?\\s+of\\s+(?<acts>" + ACT_LIST + ")",
                    CitationPatterns::externalPointFirst),
            rule("external-article-first",
                    "\\bArticles?\\s+(?<arts>" + ITEM_LIST + ")\\s*,?\\s+of\\s+(?<acts>" + ACT_LIST + ")",
                    CitationPatterns::externalArticleFirst),
            rule("article-of-that-act",
                    "\\bArticles?\\s+(?<arts>" + ITEM_LIST + ")\\s*,?\\s+of\\s+that\\s+(?<kind>Regulation|Directive|Decision)\\b",
                    CitationPatterns::articleOfThatAct),
            rule("external-act", "\\b(?<acts>" + ACT_LIST + ")", CitationPatterns::externalAct),

            // treaties
            rule("treaty-short", "\\b" + ARTICLE_PAR_POINT + "\\s+(?<code>TFEU|TEU)\\b",
                    treatyArticle(m -> TreatyCode.valueOf(m.group("code").toUpperCase(Locale.ROOT)))),
            rule("treaty-long", "\\b" + ARTICLE_PAR_POINT + "\\s+of\\s+the\\s+Treaty\\s+on\\s+"
                            + "(?<long>the\\s+Functioning\\s+of\\s+the\\s+European\\s+Union|European\\s+Union)",
                    treatyArticle(m -> m.group("long").toLowerCase(Locale.ROOT).contains("functioning")
                            ? TreatyCode.TFEU : TreatyCode.TEU)),
            rule("charter-article", "\\b" + ARTICLE_PAR_POINT + "\\s+of\\s+the\\s+Charter"
                            + "(?:\\s+of\\s+Fundamental\\s+Rights(?:\\s+of\\s+the\\s+European\\s+Union)?)?\\b",
                    treatyArticle(m -> TreatyCode.CHARTER)),
            rule("charter", "\\bCharter\\s+of\\s+Fundamental\\s+Rights(?:\\s+of\\s+the\\s+European\\s+Union)?\\b",
                    treaty(TreatyCode.CHARTER)),
            rule("treaty-generic", "\\b" + ARTICLE_PAR_POINT + "\\s+of\\s+the\\s+(?:[A-Z][A-Za-z]*\\s+){0,2}Treaty\\b",
                    treatyArticle(m -> TreatyCode.TREATY_GENERIC)),
            rule("protocol", "\\bProtocol\\s+(?:No\\s+)?\\d+\\b", treaty(TreatyCode.PROTOCOL)),

            // internal subparagraph phrasings
            rule("point-of-subparagraph",
                    "\\bpoint\\s+\\((?<pt>[a-z0-9]+)\\)\\s+of\\s+the\\s+(?<ord>" + ORD + ")\\s+subparagraph"
                            + "(?:\\s+of\\s+(?:paragraph\\s+(?<par>\\d+)|Article\\s+(?<label>" + LABEL + ")(?:\\s?\\((?<apar>\\d+)\\))?"
                            + "|this\\s+(?:paragraph|Article)\\b))?",
                    (m, text) -> subparagraphReference(m, m.group("pt"))),
            rule("subparagraph-point",
                    "\\bthe\\s+(?<ord>" + ORD + ")\\s+subparagraph\\s*,\\s*point\\s+\\((?<pt>[a-z0-9]+)\\)",
                    CitationPatterns::subparagraphPoint),
            rule("subparagraph-of",
                    "\\bthe\\s+(?<ord>" + ORD + ")\\s+subparagraph\\s+of\\s+(?:paragraph\\s+(?<par>\\d+)"
                            + "|Article\\s+(?<label>" + LABEL + ")(?:\\s?\\((?<apar>\\d+)\\))?)",
                    (m, text) -> subparagraphReference(m, null)),

            // internal articles with points
            rule("article-point-range",
                    "\\bArticle\\s+(?<label>" + LABEL + ")(?:\\s?\\((?<par>\\d+)\\))?\\s*,\\s*points\\s+"
                            + "\\((?<from>[a-z0-9]+)\\)\\s+to\\s+\\((?<to>[a-z0-9]+)\\)",
                    CitationPatterns::articlePointRange),
            rule("article-point",
                    "\\bArticle\\s+(?<label>" + LABEL + ")(?:\\s?\\((?<par>\\d+)\\))?\\s*,\\s*point\\s+\\((?<pt>[a-z0-9]+)\\)(?!\\w)",
                    CitationPatterns::articlePoint),
            rule("point-of-article",
                    "\\bpoint\\s+\\((?<pt>[a-z0-9]+)\\)\\s+of\\s+Article\\s+(?<label>" + LABEL + ")(?:\\s?\\((?<par>\\d+)\\))?(?!\\w)",
                    CitationPatterns::articlePoint),

            // internal article lists
            rule("article-range", "\\bArticles\\s+(?<from>\\d+)\\s+to\\s+(?<to>\\d+)\\b",
                    CitationPatterns::articleRange),
            rule("article-list", "\\bArticles?\\s+(?<arts>" + ITEM_LIST + ")",
                    CitationPatterns::articleList),
            rule("paragraph-of-article",
                    "\\bparagraph\\s+(?<par>\\d+)\\s+of\\s+Article\\s+(?<label>" + LABEL + ")(?!\\w)",
                    CitationPatterns::paragraphOfArticle),

            rule("article", "\\b" + ARTICLE_PAR_POINT + "(?!\\w)", CitationPatterns::articlePoint),

            // internal points and paragraphs
            rule("point-list",
                    "\\bpoints\\s+\\([a-z0-9]+\\)(?:\\s*,\\s*\\([a-z0-9]+\\))*\\s*,?\\s+(?:and|or)\\s+\\([a-z0-9]+\\)",
                    CitationPatterns::pointList),
            rule("point-range", "\\bpoints\\s+\\((?<from>[a-z0-9]+)\\)\\s+to\\s+\\((?<to>[a-z0-9]+)\\)",
                    CitationPatterns::pointRange),
            rule("point", "\\bpoint\\s+\\((?<pt>[a-z0-9]+)\\)", CitationPatterns::point),
            rule("paragraph-list", "\\bparagraphs\\s+\\d+(?:\\s*,\\s*\\d+)*\\s*,?\\s+(?:and|or)\\s+\\d+\\b",
                    CitationPatterns::paragraphList),
            rule("paragraph-range", "\\bparagraphs\\s+(?<from>\\d+)\\s+to\\s+(?<to>\\d+)\\b",
                    CitationPatterns::paragraphRange),
            rule("paragraph", "\\bparagraph\\s+(?<par>\\d+)(?:\\s+of\\s+this\\s+Article)?\\b",
                    CitationPatterns::paragraph),

            // subparagraphs
            rule("subparagraph-pair",
                    "\\bthe\\s+(?<o1>" + ORD + ")\\s+(?:and|or)\\s+(?<o2>" + ORD + ")\\s+subparagraphs"
                            + "(?:\\s+of\\s+this\\s+(?:paragraph|Article))?\\b",
                    CitationPatterns::subparagraphPair),
            rule("subparagraph",
                    "\\bthe\\s+(?<ord>" + ORD + ")\\s+subparagraph(?:\\s+of\\s+this\\s+(?:paragraph|Article))?\\b",
                    CitationPatterns::subparagraph),

            // structural divisions, case-sensitive
            caseSensitive("chapter", "\\b(?:Chapter\\s+(?<num>" + NUMERAL + ")|[Tt]his\\s+Chapter)\\b",
                    division((c, value) -> c.chapter = value)),
            caseSensitive("section", "\\b(?:Section\\s+(?<num>" + NUMERAL + "|[A-Z])|[Tt]his\\s+Section)\\b(?!\\s+of\\s+Annex)",
                    division((c, value) -> c.section = value)),
            caseSensitive("title", "\\b(?:Title\\s+(?<num>" + NUMERAL + ")|[Tt]his\\s+Title)\\b",
                    division((c, value) -> c.titleRef = value)),

            // annexes, case-sensitive
            caseSensitive("annex-part", "\\bAnnex\\s+(?<annex>" + NUMERAL + ")\\s*,\\s*Part\\s+(?<part>[A-Z]|\\d+)\\b",
                    CitationPatterns::annexPart),
            caseSensitive("part-of-annex", "\\bPart\\s+(?<part>[A-Z]|\\d+)\\s+of\\s+Annex\\s+(?<annex>" + NUMERAL + ")\\b",
                    CitationPatterns::annexPart),
            caseSensitive("annex-section", "\\bAnnex\\s+(?<annex>" + NUMERAL + ")\\s*,\\s*Section\\s+(?<section>[A-Z]|" + NUMERAL + ")\\b",
                    CitationPatterns::annexSection),
            caseSensitive("section-of-annex", "\\bSection\\s+(?<section>[A-Z]|" + NUMERAL + ")\\s+of\\s+Annex\\s+(?<annex>" + NUMERAL + ")\\b",
                    CitationPatterns::annexSection),
            caseSensitive("annex-list",
                    "\\bAnnexes\\s+" + NUMERAL + "(?:\\s*,\\s*" + NUMERAL + ")*\\s*,?\\s+(?:and|or|to)\\s+" + NUMERAL + "\\b",
                    CitationPatterns::annexList),
            caseSensitive("annex", "\\b(?:Annex\\s+(?<annex>" + NUMERAL + ")|[Tt]his\\s+Annex)\\b",
                    CitationPatterns::annex),
            caseSensitive("part", "\\bPart\\s+(?<part>[A-Z])\\b", CitationPatterns::part),

            // relative references
            rule("relative",
                    "\\b(?<which>this|that)\\s+(?<what>Regulation|Directive|Decision|Article|paragraph|subparagraph)\\b",
                    CitationPatterns::relative),
            rule("thereof", "\\bthereof\\b", (m, text) -> {
                Citation citation = internal(m.start(), m.end());
                citation.form = Citation.Form.THEREOF;
                return List.of(citation);
            }));

    private CitationPatterns() {
    }

    private static CitationRule rule(String name, String regex, CitationRule.Builder builder) {
        return new CitationRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), builder);
    }

    private static CitationRule caseSensitive(String name, String regex, CitationRule.Builder builder) {
        return new CitationRule(name, Pattern.compile(regex), builder);
    }

    // ---- external acts ----

    private static List<Citation> externalArticleFirst(Matcher m, String text) {
        List<ArticleRef> refs = ArticleReferences.parse(text, m.start("arts"), m.end("arts"));
        List<ActRef> acts = ActReferences.parse(text, m.start("acts"), m.end("acts"), ActType.fromWord(m.group("kind")));
        return combine(text, m.start(), m.end(), refs, acts);
    }

    private static List<Citation> externalPointFirst(Matcher m, String text) {
        ArticleRef ref = new ArticleRef(m.start(), m.start("acts"), lower(m.group("label")), toInt(m.group("par")),
                lower(m.group("pt")), lower(m.group("ord")), null);
        List<ActRef> acts = ActReferences.parse(text, m.start("acts"), m.end("acts"), ActType.fromWord(m.group("kind")));
        return combine(text, m.start(), m.end(), List.of(ref), acts);
    }

    private static List<Citation> externalAct(Matcher m, String text) {
        List<ActRef> acts = ActReferences.parse(text, m.start("acts"), m.end("acts"), ActType.fromWord(m.group("kind")));
        List<int[]> spans = edgeSpans(actSpans(acts), m.start(), m.end());
        List<Citation> citations = new ArrayList<>();
        for (int i = 0; i < acts.size(); i++) {
            Citation citation = new Citation(spans.get(i)[0], spans.get(i)[1], CitationType.EU_LEGISLATION);
            acts.get(i).applyTo(citation);
            citations.add(citation);
        }
        return citations;
    }

    /**
     * One citation per (article, act) pair. With a single act the articles own
     * their slices of the match, with a single article the acts do; otherwise
     * every act slice is shared out between the articles.
     */
    private static List<Citation> combine(String text, int start, int end, List<ArticleRef> refs, List<ActRef> acts) {
        if (refs.isEmpty() || acts.isEmpty()) {
            return List.of();
        }
        List<Citation> citations = new ArrayList<>();
        if (acts.size() == 1) {
            List<int[]> spans = edgeSpans(refSpans(refs), start, end);
            for (int i = 0; i < refs.size(); i++) {
                citations.add(external(spans.get(i), refs.get(i), acts.get(0)));
            }
        } else if (refs.size() == 1) {
            List<int[]> spans = edgeSpans(actSpans(acts), start, end);
            for (int j = 0; j < acts.size(); j++) {
                citations.add(external(spans.get(j), refs.get(0), acts.get(j)));
            }
        } else {
            List<int[]> segments = edgeSpans(actSpans(acts), start, end);
            for (int j = 0; j < acts.size(); j++) {
                List<int[]> pieces = split(text, segments.get(j)[0], segments.get(j)[1], refs.size());
                for (int i = 0; i < refs.size(); i++) {
                    citations.add(external(pieces.get(i), refs.get(i), acts.get(j)));
                }
            }
        }
        return citations;
    }

    private static Citation external(int[] span, ArticleRef ref, ActRef act) {
        Citation citation = new Citation(span[0], span[1], CitationType.EU_LEGISLATION);
        ref.applyTo(citation);
        act.applyTo(citation);
        citation.targetNodeId = externalTarget(citation);
        return citation;
    }

    /** Node id inside the cited act, built from the address alone. */
    static String externalTarget(Citation citation) {
        if (citation.articleLabel == null) {
            return null;
        }
        StringBuilder id = new StringBuilder("art-").append(citation.articleLabel);
        if (citation.paragraph != null) id.append(".par-").append(citation.paragraph);
        if (citation.subparagraphIndex != null) id.append(".subpar-").append(citation.subparagraphIndex);
        if (citation.point != null) id.append(".pt-").append(citation.point);
        return id.toString();
    }

    private static List<Citation> articleOfThatAct(Matcher m, String text) {
        List<ArticleRef> refs = ArticleReferences.parse(text, m.start("arts"), m.end("arts"));
        ActType kind = ActType.fromWord(m.group("kind"));
        List<int[]> spans = edgeSpans(refSpans(refs), m.start(), m.end());
        List<Citation> citations = new ArrayList<>();
        for (int i = 0; i < refs.size(); i++) {
            Citation citation = internal(spans.get(i)[0], spans.get(i)[1]);
            refs.get(i).applyTo(citation);
            citation.form = Citation.Form.ARTICLE_OF_THAT_ACT;
            citation.referencedActType = kind;
            citations.add(citation);
        }
        return citations;
    }

    // ---- treaties ----

    private static CitationRule.Builder treatyArticle(Function<Matcher, TreatyCode> code) {
        return (m, text) -> {
            Citation citation = new Citation(m.start(), m.end(), CitationType.EU_LEGISLATION);
            citation.setArticleLabel(lower(m.group("label")));
            citation.paragraph = toInt(m.group("par"));
            citation.point = lower(m.group("pt"));
            citation.treatyCode = code.apply(m);
            return List.of(citation);
        };
    }

    private static CitationRule.Builder treaty(TreatyCode code) {
        return (m, text) -> {
            Citation citation = new Citation(m.start(), m.end(), CitationType.EU_LEGISLATION);
            citation.treatyCode = code;
            return List.of(citation);
        };
    }

    // ---- internal ----

    private static List<Citation> subparagraphReference(Matcher m, String point) {
        Citation citation = internal(m.start(), m.end());
        setOrdinal(citation, m.group("ord"));
        citation.point = lower(point);
        if (m.group("label") != null) {
            citation.setArticleLabel(lower(m.group("label")));
            citation.paragraph = toInt(m.group("apar"));
        } else {
            citation.paragraph = toInt(m.group("par"));
        }
        return List.of(citation);
    }

    private static List<Citation> subparagraphPoint(Matcher m, String text) {
        Citation citation = internal(m.start(), m.end());
        setOrdinal(citation, m.group("ord"));
        citation.point = lower(m.group("pt"));
        return List.of(citation);
    }

    private static List<Citation> articlePointRange(Matcher m, String text) {
        Citation citation = internal(m.start(), m.end());
        citation.setArticleLabel(lower(m.group("label")));
        citation.paragraph = toInt(m.group("par"));
        citation.pointRange = new String[]{lower(m.group("from")), lower(m.group("to"))};
        return List.of(citation);
    }

    private static List<Citation> articlePoint(Matcher m, String text) {
        Citation citation = internal(m.start(), m.end());
        citation.setArticleLabel(lower(m.group("label")));
        citation.paragraph = toInt(m.group("par"));
        citation.point = lower(m.group("pt"));
        return List.of(citation);
    }

    private static List<Citation> articleRange(Matcher m, String text) {
        Citation citation = internal(m.start(), m.end());
        Integer from = Numbers.parse(m.group("from"));
        Integer to = Numbers.parse(m.group("to"));
        if (from == null || to == null) {
            return List.of();
        }
        citation.articleRange = new int[]{from, to};
        return List.of(citation);
    }

    private static List<Citation> articleList(Matcher m, String text) {
        List<ArticleRef> refs = ArticleReferences.parse(text, m.start("arts"), m.end("arts"));
        if (refs.isEmpty() || (refs.size() == 1 && refs.get(0).range() == null)) {
            return List.of();
        }
        List<int[]> spans = edgeSpans(refSpans(refs), m.start(), m.end());
        List<Citation> citations = new ArrayList<>();
        for (int i = 0; i < refs.size(); i++) {
            Citation citation = internal(spans.get(i)[0], spans.get(i)[1]);
            refs.get(i).applyTo(citation);
            citations.add(citation);
        }
        return citations;
    }

    private static List<Citation> paragraphOfArticle(Matcher m, String text) {
        Citation citation = internal(m.start(), m.end());
        citation.setArticleLabel(lower(m.group("label")));
        citation.paragraph = toInt(m.group("par"));
        return List.of(citation);
    }

    private static List<Citation> pointList(Matcher m, String text) {
        List<int[]> tokens = tokens(POINT_TOKEN, text, m.start(), m.end());
        List<int[]> spans = edgeSpans(tokens, m.start(), m.end());
        List<Citation> citations = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Citation citation = internal(spans.get(i)[0], spans.get(i)[1]);
            int[] token = tokens.get(i);
            citation.point = lower(text.substring(token[0] + 1, token[1] - 1));
            citation.form = Citation.Form.POINT_LIST;
            citations.add(citation);
        }
        return citations;
    }

    private static List<Citation> pointRange(Matcher m, String text) {
        Citation citation = internal(m.start(), m.end());
        citation.pointRange = new String[]{lower(m.group("from")), lower(m.group("to"))};
        citation.form = Citation.Form.POINT_LIST;
        return List.of(citation);
    }

    private static List<Citation> point(Matcher m, String text) {
        Citation citation = internal(m.start(), m.end());
        citation.point = lower(m.group("pt"));
        citation.form = Citation.Form.POINT_LIST;
        return List.of(citation);
    }

    private static List<Citation> paragraphList(Matcher m, String text) {
        List<int[]> tokens = tokens(NUMBER_TOKEN, text, m.start(), m.end());
        List<int[]> spans = edgeSpans(tokens, m.start(), m.end());
        List<Citation> citations = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Citation citation = internal(spans.get(i)[0], spans.get(i)[1]);
            citation.paragraph = Numbers.parse(text.substring(tokens.get(i)[0], tokens.get(i)[1]));
            citations.add(citation);
        }
        return citations;
    }

    private static List<Citation> paragraphRange(Matcher m, String text) {
        Citation citation = internal(m.start(), m.end());
        Integer from = Numbers.parse(m.group("from"));
        Integer to = Numbers.parse(m.group("to"));
        if (from == null || to == null) {
            return List.of();
        }
        citation.paragraphRange = new int[]{from, to};
        return List.of(citation);
    }

    private static List<Citation> paragraph(Matcher m, String text) {
        Citation citation = internal(m.start(), m.end());
        citation.paragraph = toInt(m.group("par"));
        return List.of(citation);
    }

    private static List<Citation> subparagraphPair(Matcher m, String text) {
        Citation first = internal(m.start(), m.end("o1"));
        setOrdinal(first, m.group("o1"));
        Citation second = internal(m.start("o2"), m.end());
        setOrdinal(second, m.group("o2"));
        return List.of(first, second);
    }

    private static List<Citation> subparagraph(Matcher m, String text) {
        Citation citation = internal(m.start(), m.end());
        setOrdinal(citation, m.group("ord"));
        return List.of(citation);
    }

    private static CitationRule.Builder division(BiConsumer<Citation, String> setter) {
        return (m, text) -> {
            Citation citation = internal(m.start(), m.end());
            setter.accept(citation, m.group("num") != null ? m.group("num") : "THIS");
            return List.of(citation);
        };
    }

    private static List<Citation> annexPart(Matcher m, String text) {
        Citation citation = internal(m.start(), m.end());
        citation.annex = m.group("annex");
        citation.annexPart = m.group("part");
        return List.of(citation);
    }

    private static List<Citation> annexSection(Matcher m, String text) {
        Citation citation = internal(m.start(), m.end());
        citation.annex = m.group("annex");
        citation.section = m.group("section");
        return List.of(citation);
    }

    private static List<Citation> annexList(Matcher m, String text) {
        int numbersFrom = m.start() + "Annexes".length();
        List<int[]> tokens = tokens(NUMERAL_TOKEN, text, numbersFrom, m.end());
        List<int[]> spans = edgeSpans(tokens, m.start(), m.end());
        List<Citation> citations = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Citation citation = internal(spans.get(i)[0], spans.get(i)[1]);
            citation.annex = text.substring(tokens.get(i)[0], tokens.get(i)[1]);
            citations.add(citation);
        }
        return citations;
    }

    private static List<Citation> annex(Matcher m, String text) {
        Citation citation = internal(m.start(), m.end());
        if (m.group("annex") != null) {
            citation.annex = m.group("annex");
        } else {
            citation.form = Citation.Form.THIS_ANNEX;
        }
        return List.of(citation);
    }

    private static List<Citation> part(Matcher m, String text) {
        Citation citation = internal(m.start(), m.end());
        citation.annexPart = m.group("part");
        return List.of(citation);
    }

    private static List<Citation> relative(Matcher m, String text) {
        Citation citation = internal(m.start(), m.end());
        boolean self = "this".equalsIgnoreCase(m.group("which"));
        String what = m.group("what").toLowerCase(Locale.ROOT);
        switch (what) {
            case "article" -> citation.form = self ? Citation.Form.THIS_ARTICLE : Citation.Form.EXPLICIT;
            case "paragraph" -> citation.form = self ? Citation.Form.THIS_PARAGRAPH : Citation.Form.EXPLICIT;
            case "subparagraph" -> citation.form = self ? Citation.Form.THIS_SUBPARAGRAPH : Citation.Form.EXPLICIT;
            default -> {
                citation.form = self ? Citation.Form.THIS_ACT : Citation.Form.THAT_ACT;
                citation.referencedActType = ActType.fromWord(what);
            }
        }
        return List.of(citation);
    }

    // ---- spans ----

    private static List<int[]> refSpans(List<ArticleRef> refs) {
        List<int[]> spans = new ArrayList<>();
        for (ArticleRef ref : refs) {
            spans.add(new int[]{ref.start(), ref.end()});
        }
        return spans;
    }

    private static List<int[]> actSpans(List<ActRef> acts) {
        List<int[]> spans = new ArrayList<>();
        for (ActRef act : acts) {
            spans.add(new int[]{act.start(), act.end()});
        }
        return spans;
    }

    /** Copies the slices, stretching the first back to the match start and the last up to the match end. */
    private static List<int[]> edgeSpans(List<int[]> slices, int start, int end) {
        List<int[]> spans = new ArrayList<>();
        for (int[] slice : slices) {
            spans.add(slice.clone());
        }
        if (!spans.isEmpty()) {
            spans.get(0)[0] = start;
            spans.get(spans.size() - 1)[1] = end;
        }
        return spans;
    }

    /** Cuts [start, end) into {@code pieces} disjoint slices, at word boundaries when there are enough words. */
    static List<int[]> split(String text, int start, int end, int pieces) {
        List<int[]> words = tokens(WORD_TOKEN, text, start, end);
        List<int[]> slices = new ArrayList<>();
        if (words.size() >= pieces) {
            for (int k = 0; k < pieces; k++) {
                int first = k * words.size() / pieces;
                int last = (k + 1) * words.size() / pieces - 1;
                int sliceStart = k == 0 ? start : words.get(first)[0];
                int sliceEnd = k == pieces - 1 ? end : words.get(last)[1];
                slices.add(new int[]{sliceStart, sliceEnd});
            }
        } else {
            int length = end - start;
            for (int k = 0; k < pieces; k++) {
                slices.add(new int[]{start + k * length / pieces, start + (k + 1) * length / pieces});
            }
        }
        return slices;
    }

    private static List<int[]> tokens(Pattern token, String text, int start, int end) {
        List<int[]> found = new ArrayList<>();
        Matcher matcher = token.matcher(text);
        matcher.region(start, end);
        while (matcher.find()) {
            found.add(new int[]{matcher.start(), matcher.end()});
        }
        return found;
    }

    // ---- small helpers ----

    private static Citation internal(int start, int end) {
        return new Citation(start, end, CitationType.INTERNAL);
    }

    private static void setOrdinal(Citation citation, String ordinal) {
        citation.subparagraphOrdinal = lower(ordinal);
        citation.subparagraphIndex = Ordinals.toIndex(ordinal);
    }

    private static Integer toInt(String value) {
        return Numbers.parse(value);
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
