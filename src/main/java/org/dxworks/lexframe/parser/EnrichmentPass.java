package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.model.DocumentMetadata;
import org.dxworks.lexframe.model.Unit;
import org.dxworks.lexframe.model.UnitType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derived, additive fields over the finished unit sequence, plus the
 * document-level aggregate.
 */
public class EnrichmentPass {

    private static final Set<UnitType> HEADING_RESETS = Set.of(
            UnitType.DOCUMENT_TITLE, UnitType.RECITAL, UnitType.ANNEX, UnitType.ANNEX_PART, UnitType.ANNEX_ITEM);
    private static final Pattern DEFINITIONS = Pattern.compile("\\bdefinitions?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WORDS = Pattern.compile("\\s+");

    private EnrichmentPass() {
    }

    public static DocumentMetadata enrich(List<Unit> units) {
        Map<String, List<Unit>> children = childrenByParent(units);

        String heading = null;
        for (Unit unit : units) {
            List<Unit> kids = children.getOrDefault(unit.id, List.of());
            unit.childrenCount = kids.size();
            unit.isLeaf = kids.isEmpty();
            String text = unit.text == null ? "" : unit.text;
            unit.isStem = !kids.isEmpty() && text.stripTrailing().endsWith(":");

            if (HEADING_RESETS.contains(unit.type)) {
                heading = null;
            }
            if (UnitType.ARTICLE.equals(unit.type)) {
                heading = unit.heading;
            }
            unit.articleHeading = heading;

            unit.targetPath = targetPath(unit);
            unit.wordCount = text.isBlank() ? 0 : WORDS.split(text.strip()).length;
            unit.charCount = text.length();
        }
        return metadata(units, children);
    }

    public static Map<String, List<Unit>> childrenByParent(List<Unit> units) {
        Map<String, List<Unit>> children = new HashMap<>();
        for (Unit unit : units) {
            if (unit.parentId != null) {
                children.computeIfAbsent(unit.parentId, k -> new ArrayList<>()).add(unit);
            }
        }
        return children;
    }

    /** "Recital 15", "Annex I, Part A" or "Art. 9(4)(a)(ii)"; null when the unit has no address. */
    public static String targetPath(Unit unit) {
        if (unit.recitalNumber != null && !unit.recitalNumber.isEmpty()) {
            return "Recital " + unit.recitalNumber;
        }
        if (unit.annexNumber != null && !unit.annexNumber.isEmpty()) {
            String path = "Annex " + unit.annexNumber;
            if (unit.annexPart != null && !unit.annexPart.isEmpty()) {
                path += ", Part " + unit.annexPart;
            }
            return path;
        }
        if (unit.articleNumber == null || unit.articleNumber.isEmpty()) {
            return null;
        }

        StringBuilder path = new StringBuilder("Art. ").append(unit.articleNumber);
        if (unit.paragraphNumber != null && !unit.paragraphNumber.isEmpty()) {
            path.append('(').append(unit.paragraphNumber).append(')');
        } else if (unit.paragraphIndex != null) {
            path.append('(').append(unit.paragraphIndex).append(')');
        }
        appendLabel(path, unit.pointLabel);
        appendLabel(path, unit.subpointLabel);
        appendLabel(path, unit.subsubpointLabel);
        return path.toString();
    }

    private static void appendLabel(StringBuilder path, String label) {
        if (label != null && !label.isEmpty()) {
            path.append('(').append(label).append(')');
        }
    }

    private static DocumentMetadata metadata(List<Unit> units, Map<String, List<Unit>> children) {
        DocumentMetadata metadata = new DocumentMetadata();
        metadata.totalUnits = units.size();

        Set<String> definitionArticles = new HashSet<>();
        Set<String> amendmentArticles = new LinkedHashSet<>();
        for (Unit unit : units) {
            if (UnitType.DOCUMENT_TITLE.equals(unit.type) && metadata.title == null) {
                metadata.title = unit.text;
            } else if (UnitType.ARTICLE.equals(unit.type)) {
                metadata.totalArticles++;
                if (unit.articleNumber != null) {
                    if (unit.heading != null && DEFINITIONS.matcher(unit.heading).find()) {
                        definitionArticles.add(unit.articleNumber);
                    }
                    if (isAmendmentArticle(unit, children)) {
                        amendmentArticles.add(unit.articleNumber);
                    }
                }
            } else if (UnitType.PARAGRAPH.equals(unit.type)) {
                metadata.totalParagraphs++;
            } else if (UnitType.POINT.equals(unit.type)) {
                metadata.totalPoints++;
            } else if (UnitType.ANNEX.equals(unit.type)) {
                metadata.hasAnnexes = true;
            }
        }
        for (Unit unit : units) {
            if (UnitType.POINT.equals(unit.type) && definitionArticles.contains(unit.articleNumber)) {
                metadata.totalDefinitions++;
            }
        }
        metadata.amendmentArticles = new ArrayList<>(amendmentArticles);
        return metadata;
    }

    private static boolean isAmendmentArticle(Unit article, Map<String, List<Unit>> children) {
        if (article.isAmendmentText) {
            return true;
        }
        for (Unit child : children.getOrDefault(article.id, List.of())) {
            if (child.isAmendmentText) {
                return true;
            }
        }
        return false;
    }
}
