package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.Numbers;
import org.dxworks.lexframe.html.HtmlNode;
import org.dxworks.lexframe.model.Unit;
import org.dxworks.lexframe.model.UnitType;
import org.dxworks.lexframe.model.ValidationReport;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Integrity checks over a built unit sequence. Findings are collected, never thrown.
 */
public class UnitValidator {

    private static final Map<UnitType, Set<UnitType>> ALLOWED_PARENTS = Map.of(
            UnitType.SUBPARAGRAPH, Set.of(UnitType.PARAGRAPH),
            UnitType.POINT, Set.of(UnitType.PARAGRAPH, UnitType.SUBPARAGRAPH, UnitType.ARTICLE),
            UnitType.SUBPOINT, Set.of(UnitType.POINT, UnitType.ANNEX_ITEM),
            UnitType.SUBSUBPOINT, Set.of(UnitType.SUBPOINT));

    /** Upper bound on the missing recital numbers listed in one report. */
    static final int MAX_REPORTED_GAPS = 1000;

    private static final Map<String, String> CONTAINER_QUERIES = orderedQueries();

    private UnitValidator() {
    }

    public static ValidationReport validate(HtmlNode document, List<Unit> units, String sourceFile) {
        ValidationReport report = new ValidationReport(sourceFile);
        if (document != null) {
            for (Map.Entry<String, String> query : CONTAINER_QUERIES.entrySet()) {
                report.countsExpected.put(query.getKey(), document.select(query.getValue()).size());
            }
            checkUnparsed(document, units, report);
        }
        for (Unit unit : units) {
            report.countsParsed.merge(unit.type.getName(), 1, Integer::sum);
        }
        checkParents(units, report);
        checkRecitalSequence(units, report);
        checkOrdering(units, report);
        return report;
    }

    static void checkParents(List<Unit> units, ValidationReport report) {
        Map<String, Unit> byId = new HashMap<>();
        for (Unit unit : units) {
            byId.put(unit.id, unit);
        }
        for (Unit unit : units) {
            if (unit.parentId != null) {
                Unit parent = byId.get(unit.parentId);
                if (parent == null) {
                    report.orphans.add(new ValidationReport.Orphan(unit.id, unit.parentId));
                } else {
                    Set<UnitType> allowed = ALLOWED_PARENTS.get(unit.type);
                    if (allowed != null && !allowed.contains(parent.type)) {
                        report.hierarchyIssues.add(new ValidationReport.Issue("wrong_parent_type", unit.id,
                                unit.type + " has parent type '" + parent.type + "'"));
                    }
                }
            }
            if (UnitType.PARAGRAPH.equals(unit.type) && unit.paragraphNumber != null
                    && !unit.id.contains(".par-" + unit.paragraphNumber)) {
                report.mismatchedLabels.add(new ValidationReport.Issue("id_mismatch", unit.id,
                        "paragraph_number=" + unit.paragraphNumber + " doesn't match id"));
            }
            if (UnitType.POINT.equals(unit.type) && unit.pointLabel != null
                    && !unit.id.contains(".pt-" + unit.pointLabel)) {
                report.mismatchedLabels.add(new ValidationReport.Issue("id_mismatch", unit.id,
                        "point_label=" + unit.pointLabel + " doesn't match id"));
            }
        }
    }

    /** Recital, article and annex containers of the markup that produced no unit. */
    static void checkUnparsed(HtmlNode document, List<Unit> units, ValidationReport report) {
        Set<String> parsedSources = new HashSet<>();
        for (Unit unit : units) {
            if (unit.sourceId != null) {
                parsedSources.add(unit.sourceId.strip());
            }
        }
        for (String query : CONTAINER_QUERIES.values()) {
            for (HtmlNode container : document.select(query)) {
                String sourceId = container.id().strip();
                if (!parsedSources.contains(sourceId)) {
                    report.unparsedNodes.add(new ValidationReport.UnparsedNode(sourceId, container.tagName(),
                            "no unit was built from this container"));
                }
            }
        }
    }

    /**
     * Numbers missing from 1 up to the highest recital. Only the gaps between
     * observed numbers are walked, and at most {@link #MAX_REPORTED_GAPS} are listed.
     */
    static void checkRecitalSequence(List<Unit> units, ValidationReport report) {
        TreeSet<Integer> numbers = new TreeSet<>();
        for (Unit unit : units) {
            if (UnitType.RECITAL.equals(unit.type)) {
                Integer number = Numbers.parse(unit.recitalNumber);
                if (number != null && number > 0) {
                    numbers.add(number);
                }
            }
        }
        List<Integer> missing = new ArrayList<>();
        int previous = 0;
        for (int number : numbers) {
            for (int n = previous + 1; n < number && missing.size() < MAX_REPORTED_GAPS; n++) {
                missing.add(n);
            }
            previous = number;
        }
        if (!missing.isEmpty()) {
            report.sequenceGaps.add(new ValidationReport.SequenceGap("recital", missing));
        }
    }

    /**
     * Under one parent, points introduced by the parent's text may be followed
     * by closing subparagraphs, but a point appearing after such a subparagraph
     * means the points were split around it and likely attached to the wrong parent.
     */
    static void checkOrdering(List<Unit> units, ValidationReport report) {
        Map<String, List<Unit>> children = new LinkedHashMap<>();
        for (Unit unit : units) {
            if (unit.parentId != null) {
                children.computeIfAbsent(unit.parentId, k -> new ArrayList<>()).add(unit);
            }
        }
        for (Map.Entry<String, List<Unit>> entry : children.entrySet()) {
            boolean seenPoint = false;
            Unit gap = null;
            for (Unit child : entry.getValue()) {
                if (UnitType.POINT.equals(child.type)) {
                    if (gap != null) {
                        report.orderingIssues.add(new ValidationReport.Issue("interleaved_points", child.id,
                                "point follows subparagraph " + gap.id + " after earlier points of " + entry.getKey()));
                        gap = null;
                    }
                    seenPoint = true;
                } else if (UnitType.SUBPARAGRAPH.equals(child.type) && seenPoint) {
                    gap = child;
                }
            }
        }
    }

    private static Map<String, String> orderedQueries() {
        Map<String, String> queries = new LinkedHashMap<>();
        queries.put("recitals", "div.eli-subdivision[id^=rct_]");
        queries.put("articles", "div.eli-subdivision[id^=art_]");
        queries.put("annexes", "div.eli-container[id^=anx_]");
        return queries;
    }
}
