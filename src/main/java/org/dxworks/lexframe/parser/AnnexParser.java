package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.html.HtmlNode;
import org.dxworks.lexframe.model.Label;
import org.dxworks.lexframe.model.Unit;
import org.dxworks.lexframe.model.UnitType;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dxworks.lexframe.html.HtmlTreeHelper.rowCells;
import static org.dxworks.lexframe.html.HtmlTreeHelper.tableRows;
import static org.dxworks.lexframe.html.HtmlTreeHelper.text;

/**
 * Annexes ({@code div.eli-container[id^=anx_]}): lettered parts, list-table
 * items and loose paragraphs.
 */
public class AnnexParser {

    private static final Pattern PART_HEADING = Pattern.compile("^Part\\s+([A-Z])\\b", Pattern.CASE_INSENSITIVE);
    private static final Set<String> HEADING_CLASSES = Set.of("oj-doc-ti", "oj-ti-grseq-1");
    private static final Set<String> DATA_CELL_BLOCKS = Set.of("p", "figure", "table");
    private static final int MIN_ITEM_TEXT = 5;

    private final BuildContext context;
    private final PointTableParser pointTables;

    public AnnexParser(BuildContext context, PointTableParser pointTables) {
        this.context = context;
        this.pointTables = pointTables;
    }

    public void parse(HtmlNode document) {
        for (HtmlNode div : document.select("div.eli-container[id^=anx_]")) {
            String sourceId = div.id().strip();
            String number = sourceId.replace("anx_", "").strip();

            HtmlNode titleP = div.selectFirst("p.oj-doc-ti");
            String title = titleP != null ? text(titleP) : "ANNEX " + number;
            HtmlNode headingP = div.selectFirst("p.oj-ti-grseq-1");
            String heading = headingP != null ? text(headingP) : null;

            Unit annex = BuildContext.unit("annex-" + number, UnitType.ANNEX, null, "");
            annex.ref = "ANNEX " + number;
            annex.sourceId = sourceId;
            annex.annexNumber = number;
            annex.heading = heading != null && !heading.isEmpty() ? heading : title;
            String annexId = context.add(annex);

            AnnexWalk walk = new AnnexWalk(annexId, number);
            walk.visitChildren(div);
        }
    }

    private class AnnexWalk {
        private final String annexId;
        private final String annexNumber;
        private String currentPart;
        private String currentParent;

        AnnexWalk(String annexId, String annexNumber) {
            this.annexId = annexId;
            this.annexNumber = annexNumber;
            this.currentParent = annexId;
        }

        void visitChildren(HtmlNode container) {
            for (HtmlNode child : container.childElements()) {
                if (child.is("p") && child.hasClass("oj-ti-grseq-1")) {
                    onGroupHeading(child);
                } else if (child.is("table")) {
                    if (context.isListTable(child)) {
                        onListTable(child);
                    } else {
                        onDataTable(child);
                    }
                } else if (child.is("p")) {
                    if (child.classNames().stream().noneMatch(HEADING_CLASSES::contains)) {
                        addItem(text(child));
                    }
                } else if (child.is("div") && child.hasClass("oj-enumeration-spacing")) {
                    addItem(text(child));
                } else if (child.is("div") && child.classNames().isEmpty()) {
                    visitChildren(child);
                }
            }
        }

        private void onGroupHeading(HtmlNode p) {
            String heading = text(p);
            Matcher m = PART_HEADING.matcher(heading);
            if (!m.find()) {
                return;
            }
            currentPart = m.group(1).toUpperCase(Locale.ROOT);
            Unit part = BuildContext.unit(annexId + ".part-" + currentPart, UnitType.ANNEX_PART, annexId, heading);
            part.ref = "Part " + currentPart;
            part.annexNumber = annexNumber;
            part.annexPart = currentPart;
            currentParent = context.add(part);
        }

        private void onListTable(HtmlNode table) {
            for (HtmlNode row : tableRows(table)) {
                List<HtmlNode> cells = rowCells(row);
                if (cells.size() < 2) {
                    continue;
                }
                String labelText = text(cells.get(0));
                Label label = LabelNormalizer.normalize(labelText);
                HtmlNode content = cells.get(1);

                Unit item = BuildContext.unit(currentParent + ".item-" + label.token(), UnitType.ANNEX_ITEM,
                        currentParent, TextExtraction.cellText(content, true));
                item.ref = labelText;
                item.annexNumber = annexNumber;
                item.annexPart = currentPart;
                item.isAmendmentText = label.quoted();
                String itemId = context.add(item);

                List<HtmlNode> nested = content.childElements("table");
                if (!nested.isEmpty()) {
                    pointTables.parse(nested, itemId, PointTableParser.Scope.annex(annexNumber, currentPart), 1);
                }
            }
        }

        private void onDataTable(HtmlNode table) {
            for (HtmlNode row : tableRows(table)) {
                for (HtmlNode cell : rowCells(row)) {
                    for (HtmlNode p : cell.childElements("p")) {
                        addItem(text(p));
                    }
                    addItem(text(cell, DATA_CELL_BLOCKS));
                }
            }
        }

        private void addItem(String t) {
            if (t.length() < MIN_ITEM_TEXT) {
                return;
            }
            int index = context.nextOrdinal(currentParent, "item");
            Unit item = BuildContext.unit(currentParent + ".item-" + index, UnitType.ANNEX_ITEM, currentParent, t);
            item.annexNumber = annexNumber;
            item.annexPart = currentPart;
            context.add(item);
        }
    }
}
