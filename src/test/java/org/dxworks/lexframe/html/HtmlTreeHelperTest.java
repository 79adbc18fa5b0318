package org.dxworks.lexframe.html;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HtmlTreeHelperTest {

    private static HtmlNode first(String html, String cssQuery) {
        return HtmlDocuments.parse("<html><body>" + html + "</body></html>").selectFirst(cssQuery);
    }

    @Test
    void normalizeText_CollapsesNonBreakingSpaces() {
        assertEquals("1. For the purposes", HtmlTreeHelper.normalizeText("  1.   For\nthe purposes "));
        assertEquals("", HtmlTreeHelper.normalizeText(null));
    }

    @Test
    void isNoteMarker_FootnoteLinksAndSuperscripts() {
        assertTrue(HtmlTreeHelper.isNoteMarker(first("<a href=\"#ntr1-L_2024001EN.01000101-E0001\">(1)</a>", "a")));
        assertTrue(HtmlTreeHelper.isNoteMarker(first("<a class=\"footnoteRef\" href=\"#x\">2</a>", "a")));
        assertTrue(HtmlTreeHelper.isNoteMarker(first("<span class=\"oj-super\">12</span>", "span")));
        assertFalse(HtmlTreeHelper.isNoteMarker(first("<span class=\"oj-super\">th</span>", "span")));
        assertFalse(HtmlTreeHelper.isNoteMarker(first("<a href=\"./../../legal-content/EN/AUTO\">link</a>", "a")));
    }

    @Test
    void text_SkipsNotesAndRequestedTags() {
        HtmlNode cell = first("<table><tr><td><p>Supervision<a href=\"#ntr1\">(<span>1</span>)</a> applies</p>"
                + "<table><tr><td>nested</td></tr></table></td></tr></table>", "td");

        assertEquals("Supervision applies nested", HtmlTreeHelper.text(cell));
        assertEquals("Supervision applies", HtmlTreeHelper.text(cell, Set.of("table")));
    }

    @Test
    void tableRows_IgnoresNestedTables() {
        HtmlNode table = first("<table><thead><tr><th>Head</th></tr></thead><tbody>"
                + "<tr><td>(a)</td><td><table><tr><td>(i)</td></tr></table></td></tr></tbody></table>", "table");

        List<HtmlNode> rows = HtmlTreeHelper.tableRows(table);

        assertEquals(2, rows.size());
        assertEquals(List.of("th"), HtmlTreeHelper.rowCells(rows.get(0)).stream().map(HtmlNode::tagName).toList());
        assertEquals(2, HtmlTreeHelper.rowCells(rows.get(1)).size());
    }

    @Test
    void describe_TagAndId() {
        assertEquals("div#art_1", HtmlTreeHelper.describe(first("<div id=\"art_1\"></div>", "div")));
        assertEquals("p", HtmlTreeHelper.describe(first("<p>x</p>", "p")));
        assertEquals("null", HtmlTreeHelper.describe(null));
    }
}
