package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.html.HtmlNode;
import org.dxworks.lexframe.model.Label;
import org.dxworks.lexframe.model.Unit;
import org.dxworks.lexframe.model.UnitType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.dxworks.lexframe.html.HtmlTreeHelper.childrenWithClass;
import static org.dxworks.lexframe.html.HtmlTreeHelper.firstChildWithClass;
import static org.dxworks.lexframe.html.HtmlTreeHelper.isNoteMarker;
import static org.dxworks.lexframe.html.HtmlTreeHelper.text;

/**
 * Articles of consolidated texts: {@code div.norm} paragraphs numbered by a
 * {@code span.no-parag}, and {@code div.grid-container} points laid out as a
 * label column and a content column.
 */
public class ConsolidatedArticleParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConsolidatedArticleParser.class);

    private final BuildContext context;
    private final int maxDepth;

    public ConsolidatedArticleParser(BuildContext context) {
        this.context = context;
        this.maxDepth = context.getConfig().getMaxDepth();
    }

    public void parse(HtmlNode document) {
        for (HtmlNode div : document.select("div.eli-subdivision[id^=art_]")) {
            String sourceId = div.id();
            String articleNumber = sourceId.replace("art_", "");

            HtmlNode subtitle = div.selectFirst("p.stitle-article-norm");

            Unit article = BuildContext.unit(UnitIds.article(articleNumber), UnitType.ARTICLE, null, "");
            article.ref = "Article " + articleNumber;
            article.sourceId = sourceId;
            article.articleNumber = articleNumber;
            article.heading = subtitle != null ? text(subtitle) : null;
            String articleId = context.add(article);

            parseContent(div, articleId, articleNumber);
        }
    }

    private void parseContent(HtmlNode articleDiv, String articleId, String articleNumber) {
        int introIndex = 0;
        for (HtmlNode child : articleDiv.childElements()) {
            if (child.hasClass("eli-title")
                    || child.hasClass("title-article-norm")
                    || child.hasClass("stitle-article-norm")) {
                continue;
            }
            if (child.is("div") && child.hasClass("norm")) {
                parseNumberedParagraph(child, articleId, articleNumber);
            } else if (child.is("div") && child.hasClass("grid-container")) {
                parseGridPoint(child, articleId, articleNumber, null, 0);
            } else if (child.is("p") && child.hasClass("norm")) {
                String t = text(child);
                if (!t.isEmpty()) {
                    introIndex++;
                    Unit intro = BuildContext.unit(articleId + ".intro-" + introIndex, UnitType.INTRO, articleId, t);
                    intro.sourceId = child.id();
                    intro.articleNumber = articleNumber;
                    context.add(intro);
                }
            }
        }
    }

    private void parseNumberedParagraph(HtmlNode norm, String articleId, String articleNumber) {
        HtmlNode numberSpan = firstChildWithClass(norm, "span", "no-parag");
        if (numberSpan == null) {
            LOGGER.debug("Skipping div.norm without paragraph number in {}", articleId);
            return;
        }
        String labelText = text(numberSpan);
        String number = labelText.replaceAll("[^\\d]", "");

        HtmlNode inline = firstChildWithClass(norm, "div", "inline-element");
        String paragraphText;
        if (inline != null) {
            paragraphText = consolidatedText(inline);
        } else {
            paragraphText = text(norm).replaceFirst(Pattern.quote(labelText), "").strip();
        }

        int position = context.nextOrdinal(articleId, "par");
        Unit paragraph;
        if (number.isEmpty()) {
            paragraph = BuildContext.unit(UnitIds.paragraph(articleId, String.valueOf(position)),
                    UnitType.PARAGRAPH, articleId, paragraphText);
            paragraph.paragraphIndex = position;
        } else {
            paragraph = BuildContext.unit(UnitIds.paragraph(articleId, number), UnitType.PARAGRAPH, articleId,
                    paragraphText);
            paragraph.ref = number + ".";
            paragraph.paragraphNumber = number;
        }
        paragraph.articleNumber = articleNumber;
        String paragraphId = context.add(paragraph);

        List<HtmlNode> grids = new ArrayList<>(childrenWithClass(norm, "div", "grid-container"));
        if (inline != null) {
            grids.addAll(childrenWithClass(inline, "div", "grid-container"));
        }
        for (HtmlNode grid : grids) {
            parseGridPoint(grid, paragraphId, articleNumber, paragraph.paragraphNumber, 0);
        }
    }

    private void parseGridPoint(HtmlNode grid, String parentId, String articleNumber, String paragraphNumber,
                                int depth) {
        if (depth >= maxDepth) {
            LOGGER.debug("Ignoring grid points nested deeper than {} under {}", maxDepth, parentId);
            return;
        }
        HtmlNode labelDiv = grid.selectFirst("div.grid-list-column-1");
        if (labelDiv == null) {
            labelDiv = grid.selectFirst("div.list");
        }
        String labelText = "";
        if (labelDiv != null) {
            HtmlNode span = labelDiv.selectFirst("span");
            labelText = text(span != null ? span : labelDiv);
        }
        HtmlNode contentDiv = grid.selectFirst("div.grid-list-column-2");
        String content = contentDiv != null ? consolidatedText(contentDiv) : "";

        Label label = LabelNormalizer.normalize(labelText);
        Unit point = BuildContext.unit(parentId + "." + UnitIds.pointPrefix(depth) + "-" + label.token(),
                UnitType.pointAtDepth(depth), parentId, content);
        point.ref = labelText;
        point.articleNumber = articleNumber;
        point.paragraphNumber = paragraphNumber;
        switch (depth) {
            case 0 -> point.pointLabel = label.token();
            case 1 -> point.subpointLabel = label.token();
            case 2 -> point.subsubpointLabel = label.token();
            default -> point.extraLabels = List.of(label.token());
        }
        point.isAmendmentText = label.quoted();
        String pointId = context.add(point);

        if (contentDiv != null) {
            for (HtmlNode nested : childrenWithClass(contentDiv, "div", "grid-container")) {
                parseGridPoint(nested, pointId, articleNumber, paragraphNumber, depth + 1);
            }
        }
    }

    /** Joined {@code p.norm} text outside nested grids, or the whole text when there is none. */
    private static String consolidatedText(HtmlNode element) {
        List<String> texts = new ArrayList<>();
        collectNormParagraphs(element, texts);
        if (!texts.isEmpty()) {
            return String.join(" ", texts);
        }
        return gridFreeText(element);
    }

    private static void collectNormParagraphs(HtmlNode node, List<String> texts) {
        for (HtmlNode child : node.childElements()) {
            if (child.is("div") && child.hasClass("grid-container")) {
                continue;
            }
            if (child.is("p") && child.hasClass("norm")) {
                String t = text(child);
                if (!t.isEmpty()) {
                    texts.add(t);
                }
            } else {
                collectNormParagraphs(child, texts);
            }
        }
    }

    private static String gridFreeText(HtmlNode element) {
        StringBuilder sb = new StringBuilder();
        for (HtmlNode child : element.children()) {
            if (child.isElement() && (isNoteMarker(child) || child.is("div") && child.hasClass("grid-container"))) {
                continue;
            }
            String t = child.isText() ? text(child) : gridFreeText(child);
            if (!t.isEmpty()) {
                if (sb.length() > 0) sb.append(' ');
                sb.append(t);
            }
        }
        return sb.toString();
    }
}
