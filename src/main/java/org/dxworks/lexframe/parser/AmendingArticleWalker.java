package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.html.HtmlNode;
import org.dxworks.lexframe.model.Unit;
import org.dxworks.lexframe.model.UnitType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import static org.dxworks.lexframe.html.HtmlTreeHelper.normalizeText;
import static org.dxworks.lexframe.html.HtmlTreeHelper.text;

/**
 * Walks an amending article in document order. All content hangs under one
 * synthetic paragraph and is flagged as amendment text; tables of any shape
 * become point sources.
 */
public class AmendingArticleWalker {

    private static final Set<String> SKIPPED_CLASSES = Set.of("oj-ti-art", "oj-sti-art", "oj-doc-ti", "oj-note");
    private static final int MIN_PARAGRAPH_TEXT = 3;
    private static final int MIN_LOOSE_TEXT = 10;

    private final BuildContext context;
    private final PointTableParser pointTables;

    public AmendingArticleWalker(BuildContext context, PointTableParser pointTables) {
        this.context = context;
        this.pointTables = pointTables;
    }

    public void walk(HtmlNode articleDiv, String articleId, String articleNumber) {
        new Walk(articleId, articleNumber).run(articleDiv);
    }

    private class Walk {
        private final String articleId;
        private final String articleNumber;
        private final String paragraphId;
        // the same quoted text is often reachable through a cell, its paragraph and a wrapper div
        private final Set<String> seenTexts = new HashSet<>();
        private final PointTableParser.Scope scope;

        private boolean paragraphCreated;
        private int childIndex;

        Walk(String articleId, String articleNumber) {
            this.articleId = articleId;
            this.articleNumber = articleNumber;
            this.paragraphId = UnitIds.paragraph(articleId, "1");
            this.scope = PointTableParser.Scope.article(articleNumber, null).asAmendment();
        }

        void run(HtmlNode articleDiv) {
            Deque<Iterator<HtmlNode>> stack = new ArrayDeque<>();
            stack.push(articleDiv.children().iterator());
            while (!stack.isEmpty()) {
                Iterator<HtmlNode> siblings = stack.peek();
                if (!siblings.hasNext()) {
                    stack.pop();
                    continue;
                }
                HtmlNode child = siblings.next();
                if (child.isText()) {
                    onLooseText(normalizeText(child.ownText()), "subpar", UnitType.SUBPARAGRAPH);
                } else if (child.is("p")) {
                    onParagraph(child);
                } else if (child.is("table")) {
                    onTable(child);
                } else if (child.is("div")) {
                    stack.push(child.children().iterator());
                } else if (!child.is("figure")) {
                    onLooseText(text(child), "unk", UnitType.UNKNOWN);
                }
            }
        }

        private void onParagraph(HtmlNode p) {
            if (p.classNames().stream().anyMatch(SKIPPED_CLASSES::contains)) {
                return;
            }
            String raw = text(p);
            if (raw.length() < MIN_PARAGRAPH_TEXT) {
                return;
            }
            TextExtraction.LabeledText labeled = TextExtraction.stripLeadingLabel(raw);
            String t = normalizeText(labeled.text());
            if (!seenTexts.add(t)) {
                return;
            }
            if (!paragraphCreated) {
                createParagraph(t, labeled.label());
            } else {
                addChild("subpar", UnitType.SUBPARAGRAPH, t);
            }
        }

        private void onTable(HtmlNode table) {
            ensureParagraph();
            if (context.isListTable(table)) {
                pointTables.parse(List.of(table), paragraphId, scope);
            } else {
                pointTables.extractDataTable(table, paragraphId, scope);
            }
        }

        private void onLooseText(String t, String prefix, UnitType type) {
            if (t.length() < MIN_LOOSE_TEXT || !seenTexts.add(t)) {
                return;
            }
            ensureParagraph();
            addChild(prefix, type, t);
        }

        private void ensureParagraph() {
            if (!paragraphCreated) {
                createParagraph("", null);
            }
        }

        private void createParagraph(String t, String label) {
            Unit paragraph = BuildContext.unit(paragraphId, UnitType.PARAGRAPH, articleId, t);
            paragraph.ref = label != null ? label + "." : null;
            paragraph.articleNumber = articleNumber;
            paragraph.paragraphIndex = 1;
            paragraph.isAmendmentText = true;
            context.add(paragraph);
            paragraphCreated = true;
        }

        private void addChild(String prefix, UnitType type, String t) {
            childIndex++;
            Unit unit = BuildContext.unit(paragraphId + "." + prefix + "-" + childIndex, type, paragraphId, t);
            unit.articleNumber = articleNumber;
            if (UnitType.SUBPARAGRAPH.equals(type)) {
                unit.subparagraphIndex = childIndex;
            }
            unit.isAmendmentText = true;
            context.add(unit);
        }
    }
}
