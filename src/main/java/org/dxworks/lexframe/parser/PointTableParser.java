package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.html.HtmlNode;
import org.dxworks.lexframe.model.Label;
import org.dxworks.lexframe.model.Unit;
import org.dxworks.lexframe.model.UnitType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.dxworks.lexframe.html.HtmlTreeHelper.describe;
import static org.dxworks.lexframe.html.HtmlTreeHelper.hasChild;
import static org.dxworks.lexframe.html.HtmlTreeHelper.rowCells;
import static org.dxworks.lexframe.html.HtmlTreeHelper.tableRows;
import static org.dxworks.lexframe.html.HtmlTreeHelper.text;

/**
 * Turns list tables into point, subpoint, subsubpoint and nested_N units,
 * and splits data tables into per-cell text units.
 */
public class PointTableParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(PointTableParser.class);

    private static final Set<String> CELL_BLOCKS = Set.of("p", "figure", "table", "div");
    private static final Set<String> DATA_CELL_BLOCKS = Set.of("p", "figure", "table");
    private static final Set<String> TITLE_CLASSES = Set.of("oj-ti-art", "oj-sti-art", "oj-doc-ti");
    private static final int MIN_BARE_TEXT = 10;
    private static final int MIN_CONTINUATION_TEXT = 3;

    /** Addressing copied onto every unit created below one parent. */
    public record Scope(String articleNumber, String paragraphNumber, String annexNumber, String annexPart,
                        boolean amendment) {

        public static Scope article(String articleNumber, String paragraphNumber) {
            return new Scope(articleNumber, paragraphNumber, null, null, false);
        }

        public static Scope annex(String annexNumber, String annexPart) {
            return new Scope(null, null, annexNumber, annexPart, false);
        }

        public Scope asAmendment() {
            return new Scope(articleNumber, paragraphNumber, annexNumber, annexPart, true);
        }

        void applyTo(Unit unit) {
            unit.articleNumber = articleNumber;
            unit.paragraphNumber = paragraphNumber;
            unit.annexNumber = annexNumber;
            unit.annexPart = annexPart;
        }
    }

    private final BuildContext context;
    private final int maxDepth;

    public PointTableParser(BuildContext context) {
        this.context = context;
        this.maxDepth = context.getConfig().getMaxDepth();
    }

    public void parse(List<HtmlNode> tables, String parentId, Scope scope) {
        parse(tables, parentId, scope, 0);
    }

    public void parse(List<HtmlNode> tables, String parentId, Scope scope, int depth) {
        if (depth >= maxDepth) {
            LOGGER.debug("Ignoring tables nested deeper than {} under {}", maxDepth, parentId);
            return;
        }
        for (HtmlNode table : tables) {
            if (!context.isListTable(table)) {
                extractDataTable(table, parentId, scope);
                continue;
            }
            for (HtmlNode row : tableRows(table)) {
                List<HtmlNode> cells = row.childElements("td");
                if (cells.size() < 2) {
                    continue;
                }
                parseRow(cells.get(0), cells.get(1), parentId, scope, depth);
            }
        }
    }

    private void parseRow(HtmlNode labelCell, HtmlNode contentCell, String parentId, Scope scope, int depth) {
        String labelText = ListTableClassifier.labelText(labelCell);
        Label label = LabelNormalizer.normalize(labelText);
        String rowText = TextExtraction.cellText(contentCell, true);

        Unit unit = BuildContext.unit(
                parentId + "." + UnitIds.pointPrefix(depth) + "-" + label.token(),
                UnitType.pointAtDepth(depth), parentId, rowText);
        unit.ref = labelText;
        scope.applyTo(unit);
        switch (depth) {
            case 0 -> unit.pointLabel = label.token();
            case 1 -> unit.subpointLabel = label.token();
            case 2 -> unit.subsubpointLabel = label.token();
            default -> unit.extraLabels = List.of(label.token());
        }
        unit.isAmendmentText = scope.amendment() || label.quoted();
        String unitId = context.add(unit);

        List<HtmlNode> nested = contentCell.childElements("table");
        if (!nested.isEmpty()) {
            parse(nested, unitId, scope, depth + 1);
        }
        addContinuations(contentCell, unitId, rowText, scope, depth + 1);
    }

    /**
     * Content sharing a cell with the row text: paragraphs after the first one
     * when the cell also holds tables or wrapper divs, loose text, and
     * paragraphs of wrapper divs.
     */
    private void addContinuations(HtmlNode cell, String unitId, String rowText, Scope scope, int depth) {
        if (hasChild(cell, "table") || hasChild(cell, "div")) {
            int index = 0;
            boolean firstSeen = false;
            for (HtmlNode p : cell.childElements("p")) {
                if (p.hasClass("oj-note")) {
                    continue;
                }
                String t = text(p);
                if (!firstSeen) {
                    firstSeen = !t.isEmpty();
                    continue;
                }
                if (t.length() >= MIN_CONTINUATION_TEXT) {
                    index++;
                    addContinuation(unitId + ".cont-" + index, unitId, t, scope, depth);
                }
            }
        }

        String bare = text(cell, CELL_BLOCKS);
        if (bare.length() >= MIN_BARE_TEXT && !rowText.contains(bare)) {
            addContinuation(unitId + ".bare-1", unitId, bare, scope, depth);
        }

        int divIndex = 0;
        for (HtmlNode div : cell.childElements("div")) {
            for (HtmlNode p : div.childElements("p")) {
                if (p.classNames().stream().anyMatch(TITLE_CLASSES::contains)) {
                    continue;
                }
                String t = text(p);
                if (t.length() >= MIN_BARE_TEXT) {
                    divIndex++;
                    addContinuation(unitId + ".div-" + divIndex, unitId, t, scope, depth);
                }
            }
        }
    }

    private void addContinuation(String id, String parentId, String text, Scope scope, int depth) {
        Unit unit = BuildContext.unit(id, UnitType.pointAtDepth(depth), parentId, text);
        scope.applyTo(unit);
        unit.isAmendmentText = scope.amendment();
        context.add(unit);
    }

    /**
     * Splits a table that is not a label/content list into one unit per cell
     * paragraph and per block of loose cell text, typed one level below the parent.
     */
    public void extractDataTable(HtmlNode table, String parentId, Scope scope) {
        Unit parent = context.find(parentId);
        UnitType childType = parent == null ? UnitType.SUBPARAGRAPH : parent.type.childForTableContent();
        LOGGER.debug("Splitting data {} under {} into {} units", describe(table), parentId, childType);

        for (HtmlNode row : tableRows(table)) {
            for (HtmlNode cell : rowCells(row)) {
                for (String t : dataCellTexts(cell)) {
                    int index = context.nextOrdinal(parentId, "tbl");
                    Unit unit = BuildContext.unit(parentId + ".tbl-" + index, childType, parentId, t);
                    scope.applyTo(unit);
                    if (UnitType.SUBPARAGRAPH.equals(childType)) {
                        unit.subparagraphIndex = index;
                    }
                    unit.isAmendmentText = scope.amendment();
                    context.add(unit);
                }
            }
        }
    }

    private static List<String> dataCellTexts(HtmlNode cell) {
        List<String> texts = new ArrayList<>();
        for (HtmlNode p : cell.select("p")) {
            String t = text(p);
            if (t.length() >= MIN_BARE_TEXT) {
                texts.add(t);
            }
        }
        String bare = text(cell, DATA_CELL_BLOCKS);
        if (bare.length() >= MIN_BARE_TEXT) {
            texts.add(bare);
        }
        return texts;
    }
}
