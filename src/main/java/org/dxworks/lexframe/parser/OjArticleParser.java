package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.Numbers;
import org.dxworks.lexframe.html.HtmlNode;
import org.dxworks.lexframe.model.Unit;
import org.dxworks.lexframe.model.UnitType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dxworks.lexframe.html.HtmlTreeHelper.childrenWithClass;
import static org.dxworks.lexframe.html.HtmlTreeHelper.normalizeText;
import static org.dxworks.lexframe.html.HtmlTreeHelper.text;

/**
 * Articles of Official Journal pages ({@code div.eli-subdivision[id^=art_]}).
 */
public class OjArticleParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(OjArticleParser.class);

    private static final Pattern PARAGRAPH_CONTAINER_ID = Pattern.compile("^\\d{3}\\.\\d{3}$");
    private static final Pattern CONTAINER_NUMBER = Pattern.compile("\\.(\\d+)");
    private static final Pattern AMENDING_HEADING =
            Pattern.compile("Amendments?\\s+to\\b|Amendment\\s+of\\b", Pattern.CASE_INSENSITIVE);
    private static final int AMENDING_LOOKAHEAD = 200;
    private static final int MIN_BARE_TEXT = 10;

    private final BuildContext context;
    private final PointTableParser pointTables;
    private final AmendingArticleWalker amendingWalker;

    public OjArticleParser(BuildContext context, PointTableParser pointTables) {
        this.context = context;
        this.pointTables = pointTables;
        this.amendingWalker = new AmendingArticleWalker(context, pointTables);
    }

    public void parse(HtmlNode document) {
        for (HtmlNode div : document.select("div.eli-subdivision[id^=art_]")) {
            parseArticle(div);
        }
    }

    private void parseArticle(HtmlNode div) {
        String sourceId = div.id();
        String articleNumber = sourceId.replace("art_", "");

        String heading = null;
        HtmlNode titleDiv = div.selectFirst("div.eli-title");
        if (titleDiv != null) {
            HtmlNode subtitle = titleDiv.selectFirst("p.oj-sti-art");
            if (subtitle != null) {
                heading = text(subtitle);
            }
        }

        Unit article = BuildContext.unit(UnitIds.article(articleNumber), UnitType.ARTICLE, null, "");
        article.ref = "Article " + articleNumber;
        article.sourceId = sourceId;
        article.articleNumber = articleNumber;
        article.heading = heading;
        String articleId = context.add(article);

        if (isAmending(div, heading)) {
            LOGGER.debug("Article {} is an amending article", articleNumber);
            amendingWalker.walk(div, articleId, articleNumber);
            return;
        }

        List<HtmlNode> containers = new ArrayList<>();
        for (HtmlNode child : div.childElements("div")) {
            if (PARAGRAPH_CONTAINER_ID.matcher(child.id()).matches()) {
                containers.add(child);
            }
        }

        if (containers.isEmpty()) {
            ParagraphWalk walk = new ParagraphWalk(articleId, articleNumber, null, 1);
            for (HtmlNode child : div.children()) {
                if (child.isElement() && isArticleTitle(child, titleDiv)) {
                    continue;
                }
                walk.accept(child);
            }
            walk.finish();
            return;
        }

        for (int i = 0; i < containers.size(); i++) {
            HtmlNode container = containers.get(i);
            ParagraphWalk walk = new ParagraphWalk(articleId, articleNumber, container, i + 1);
            for (HtmlNode child : container.children()) {
                walk.accept(child);
            }
            walk.finish();
        }
    }

    static boolean isAmending(HtmlNode articleDiv, String heading) {
        if (heading != null && AMENDING_HEADING.matcher(heading).find()) {
            return true;
        }
        HtmlNode firstParagraph = articleDiv.selectFirst("p.oj-normal");
        if (firstParagraph == null) {
            return false;
        }
        String start = text(firstParagraph);
        if (start.length() > AMENDING_LOOKAHEAD) {
            start = start.substring(0, AMENDING_LOOKAHEAD);
        }
        return start.contains("is amended as follows") || start.contains("are amended as follows");
    }

    private static boolean isArticleTitle(HtmlNode child, HtmlNode titleDiv) {
        if (child.equals(titleDiv)) {
            return true;
        }
        return child.is("p") && (child.hasClass("oj-ti-art") || child.hasClass("oj-sti-art"));
    }

    private static boolean isBodyParagraph(HtmlNode node) {
        return node.is("p")
                && (node.hasClass("oj-normal") || node.hasClass("oj-ti-tbl") || node.hasClass("oj-note"));
    }

    private static boolean isWrapperDiv(HtmlNode node) {
        return node.is("div")
                && node.id().isEmpty()
                && !node.hasClass("eli-subdivision")
                && !node.hasClass("eli-title");
    }

    /**
     * Paragraph state machine over one paragraph container, or over the article
     * itself when it has no numbered containers ({@code container == null}).
     * The first body paragraph opens the paragraph, later ones become its
     * subparagraphs, and tables wait until the next paragraph so that points
     * attach to the text that introduced them.
     */
    private class ParagraphWalk {
        private final String articleId;
        private final String articleNumber;
        private final HtmlNode container;
        private final int position;
        private final List<HtmlNode> pendingTables = new ArrayList<>();

        private String paragraphId;
        private String paragraphNumber;
        private String currentParent;
        private int subparagraphIndex;

        ParagraphWalk(String articleId, String articleNumber, HtmlNode container, int position) {
            this.articleId = articleId;
            this.articleNumber = articleNumber;
            this.container = container;
            this.position = position;
        }

        void accept(HtmlNode child) {
            if (child.isText()) {
                String bare = normalizeText(child.ownText());
                if (paragraphId != null && bare.length() >= MIN_BARE_TEXT) {
                    flushTables();
                    addSubparagraph(bare, "");
                }
            } else if (isBodyParagraph(child)) {
                onParagraph(child);
            } else if (child.is("table")) {
                pendingTables.add(child);
            } else if (isWrapperDiv(child)) {
                for (HtmlNode p : childrenWithClass(child, "p", "oj-normal")) {
                    onParagraph(p);
                }
            }
        }

        private void onParagraph(HtmlNode p) {
            flushTables();
            String t = text(p);
            if (paragraphId == null) {
                openParagraph(t, p);
            } else {
                addSubparagraph(t, p.id());
            }
        }

        private void openParagraph(String t, HtmlNode p) {
            Unit paragraph;
            if (container == null) {
                paragraph = BuildContext.unit(UnitIds.paragraph(articleId, "1"), UnitType.PARAGRAPH, articleId, t);
                paragraph.paragraphIndex = 1;
                paragraph.sourceId = p.id();
            } else {
                TextExtraction.LabeledText labeled = TextExtraction.stripLeadingLabel(t);
                paragraphNumber = labeled.label();
                String segment = paragraphNumber != null ? paragraphNumber : String.valueOf(position);
                paragraph = BuildContext.unit(UnitIds.paragraph(articleId, segment), UnitType.PARAGRAPH,
                        articleId, labeled.text());
                paragraph.ref = paragraphNumber != null ? paragraphNumber + "." : null;
                paragraph.paragraphNumber = paragraphNumber;
                paragraph.paragraphIndex = paragraphNumber == null ? position : null;
                paragraph.sourceId = container.id();
            }
            paragraph.articleNumber = articleNumber;
            paragraphId = context.add(paragraph);
            currentParent = paragraphId;
        }

        private void addSubparagraph(String t, String sourceId) {
            subparagraphIndex++;
            Unit subparagraph = BuildContext.unit(UnitIds.subparagraph(paragraphId, subparagraphIndex),
                    UnitType.SUBPARAGRAPH, paragraphId, t);
            subparagraph.sourceId = sourceId;
            subparagraph.articleNumber = articleNumber;
            subparagraph.paragraphNumber = paragraphNumber;
            subparagraph.subparagraphIndex = subparagraphIndex;
            currentParent = context.add(subparagraph);
        }

        private void flushTables() {
            if (!pendingTables.isEmpty() && currentParent != null) {
                pointTables.parse(List.copyOf(pendingTables), currentParent,
                        PointTableParser.Scope.article(articleNumber, paragraphNumber));
                pendingTables.clear();
            }
        }

        void finish() {
            if (pendingTables.isEmpty()) {
                return;
            }
            if (currentParent == null) {
                openEmptyParagraph();
            }
            flushTables();
        }

        /** Tables with no introducing text still need a paragraph to hang from. */
        private void openEmptyParagraph() {
            Unit paragraph;
            if (container == null) {
                paragraph = BuildContext.unit(UnitIds.paragraph(articleId, "1"), UnitType.PARAGRAPH, articleId, "");
                paragraph.paragraphIndex = 1;
            } else {
                Matcher m = CONTAINER_NUMBER.matcher(container.id());
                Integer number = m.find() ? Numbers.parse(m.group(1)) : null;
                paragraphNumber = String.valueOf(number != null ? number : position);
                paragraph = BuildContext.unit(UnitIds.paragraph(articleId, paragraphNumber), UnitType.PARAGRAPH,
                        articleId, "");
                paragraph.ref = paragraphNumber + ".";
                paragraph.paragraphNumber = paragraphNumber;
                paragraph.sourceId = container.id();
            }
            paragraph.articleNumber = articleNumber;
            paragraphId = context.add(paragraph);
            currentParent = paragraphId;
        }
    }
}
