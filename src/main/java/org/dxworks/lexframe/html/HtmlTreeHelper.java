package org.dxworks.lexframe.html;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Static traversal and text helpers shared by the dialect walkers.
 * Footnote markers are skipped whenever text is collected, so callers never
 * need to copy and prune a subtree first.
 */
public class HtmlTreeHelper {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u2007\\u202F]+");
    private static final Pattern NOTE_NUMBER = Pattern.compile("^\\*?\\d+$");

    /**
     * Collapse all whitespace (non-breaking spaces included) to single spaces and trim.
     */
    public static String normalizeText(String s) {
        if (s == null) return "";
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    /**
     * Footnote anchors ({@code #ntr}/{@code #ntc} links, note-classed links)
     * and numeric superscript note tags.
     */
    public static boolean isNoteMarker(HtmlNode node) {
        if (node == null || node.isText()) return false;
        if (node.is("a")) {
            String href = node.attr("href");
            if (href.contains("#ntr") || href.contains("#ntc")) {
                return true;
            }
            for (String cls : node.classNames()) {
                if (cls.contains("note")) return true;
            }
            return false;
        }
        if (node.is("span")) {
            if (node.hasClass("oj-note-tag")) return true;
            if (node.hasClass("oj-super")) {
                return NOTE_NUMBER.matcher(text(node)).matches();
            }
        }
        return false;
    }

    /** Visible text of a node, each text run trimmed and runs joined by one space. */
    public static String text(HtmlNode node) {
        return text(node, Set.of());
    }

    /** Like {@link #text(HtmlNode)} but without the subtrees of the given descendant tags. */
    public static String text(HtmlNode node, Set<String> skippedTags) {
        if (node == null) return "";
        if (node.isText()) {
            return normalizeText(node.ownText());
        }
        List<String> parts = new ArrayList<>();
        collectText(node, skippedTags, parts);
        return normalizeText(String.join(" ", parts));
    }

    private static void collectText(HtmlNode node, Set<String> skippedTags, List<String> parts) {
        for (HtmlNode child : node.children()) {
            if (child.isText()) {
                String t = normalizeText(child.ownText());
                if (!t.isEmpty()) {
                    parts.add(t);
                }
            } else if (!skippedTags.contains(child.tagName()) && !isNoteMarker(child)) {
                collectText(child, skippedTags, parts);
            }
        }
    }

    public static boolean hasChild(HtmlNode parent, String tag) {
        return parent.firstChild(tag) != null;
    }

    /** Direct child elements carrying the given class, in document order. */
    public static List<HtmlNode> childrenWithClass(HtmlNode parent, String tag, String className) {
        List<HtmlNode> result = new ArrayList<>();
        for (HtmlNode child : parent.childElements(tag)) {
            if (child.hasClass(className)) {
                result.add(child);
            }
        }
        return result;
    }

    public static HtmlNode firstChildWithClass(HtmlNode parent, String tag, String className) {
        for (HtmlNode child : parent.childElements(tag)) {
            if (child.hasClass(className)) {
                return child;
            }
        }
        return null;
    }

    /** Rows owned by a table (directly or through its sections), never rows of nested tables. */
    public static List<HtmlNode> tableRows(HtmlNode table) {
        List<HtmlNode> rows = new ArrayList<>();
        for (HtmlNode child : table.childElements()) {
            if (child.is("tr")) {
                rows.add(child);
            } else if (child.is("thead") || child.is("tbody") || child.is("tfoot")) {
                rows.addAll(child.childElements("tr"));
            }
        }
        return rows;
    }

    /** Direct {@code td} and {@code th} cells of a row. */
    public static List<HtmlNode> rowCells(HtmlNode row) {
        List<HtmlNode> cells = new ArrayList<>();
        for (HtmlNode child : row.childElements()) {
            if (child.is("td") || child.is("th")) {
                cells.add(child);
            }
        }
        return cells;
    }

    public static String describe(HtmlNode node) {
        if (node == null) return "null";
        String id = node.id();
        return node.tagName() + (id.isEmpty() ? "" : "#" + id);
    }
}
