package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.html.HtmlDocuments;
import org.dxworks.lexframe.model.Unit;
import org.dxworks.lexframe.model.UnitType;
import org.dxworks.lexframe.model.ValidationReport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.lexframe.TestUtils.article;
import static org.dxworks.lexframe.TestUtils.paragraph;
import static org.dxworks.lexframe.TestUtils.unit;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class UnitValidatorTest {

    private static Unit recital(String number) {
        Unit unit = unit("recital-" + number, UnitType.RECITAL, null);
        unit.recitalNumber = number;
        return unit;
    }

    private static Unit point(String parentId, String label) {
        Unit unit = unit(parentId + ".pt-" + label, UnitType.POINT, parentId);
        unit.pointLabel = label;
        return unit;
    }

    @Test
    void validate_CleanSequence() {
        List<Unit> units = List.of(recital("1"), recital("2"), article("1"), paragraph("1", "1"),
                point("art-1.par-1", "a"));

        ValidationReport report = UnitValidator.validate(null, units, "clean.html");

        assertTrue(report.isValid());
        assertEquals("clean.html", report.sourceFile);
        assertEquals(2, report.countsParsed.get("recital"));
        assertEquals(1, report.countsParsed.get("point"));
        assertTrue(report.countsExpected.isEmpty());
    }

    @Test
    void validate_CountsExpectedFromMarkup() {
        String html = "<html><body>"
                + "<div class=\"eli-subdivision\" id=\"rct_1\"></div>"
                + "<div class=\"eli-subdivision\" id=\"art_1\"></div>"
                + "<div class=\"eli-subdivision\" id=\"art_2\"></div>"
                + "<div class=\"eli-container\" id=\"anx_I\"></div>"
                + "</body></html>";

        ValidationReport report = UnitValidator.validate(HtmlDocuments.parse(html), List.of(), "counts.html");

        assertEquals(1, report.countsExpected.get("recitals"));
        assertEquals(2, report.countsExpected.get("articles"));
        assertEquals(1, report.countsExpected.get("annexes"));
        assertEquals(4, report.unparsedNodes.size());
    }

    @Test
    void validate_UnparsedContainers() {
        String html = "<html><body>"
                + "<div class=\"eli-subdivision\" id=\"art_1\"></div>"
                + "<div class=\"eli-subdivision\" id=\"art_2\"></div>"
                + "</body></html>";
        Unit parsed = article("1");
        parsed.sourceId = "art_1";

        ValidationReport report = UnitValidator.validate(HtmlDocuments.parse(html), List.of(parsed), "unparsed.html");

        assertFalse(report.isValid());
        assertEquals(1, report.unparsedNodes.size());
        assertEquals("art_2", report.unparsedNodes.get(0).sourceId);
        assertEquals("div", report.unparsedNodes.get(0).tag);
    }

    @Test
    void validate_Orphans() {
        ValidationReport report = UnitValidator.validate(null,
                List.of(article("1"), point("art-1.par-9", "a")), "orphans.html");

        assertFalse(report.isValid());
        assertEquals(1, report.orphans.size());
        assertEquals("art-1.par-9.pt-a", report.orphans.get(0).id);
        assertEquals("art-1.par-9", report.orphans.get(0).parentId);
    }

    @Test
    void validate_WrongParentType() {
        Unit annex = unit("annex-I", UnitType.ANNEX, null);
        Unit subparagraph = unit("annex-I.subpar-1", UnitType.SUBPARAGRAPH, "annex-I");

        ValidationReport report = UnitValidator.validate(null, List.of(annex, subparagraph), "parents.html");

        assertEquals(1, report.hierarchyIssues.size());
        assertEquals("wrong_parent_type", report.hierarchyIssues.get(0).type);
        assertEquals("annex-I.subpar-1", report.hierarchyIssues.get(0).id);
    }

    @Test
    void validate_IdMismatch() {
        Unit paragraph = paragraph("2", "3");
        paragraph.paragraphNumber = "4";
        Unit point = point("art-2.par-3", "a");
        point.pointLabel = "b";

        ValidationReport report = UnitValidator.validate(null, List.of(article("2"), paragraph, point), "ids.html");

        assertFalse(report.isValid());
        assertTrue(report.hierarchyIssues.isEmpty());
        assertEquals(2, report.mismatchedLabels.size());
        for (ValidationReport.Issue issue : report.mismatchedLabels) {
            assertEquals("id_mismatch", issue.type);
        }
    }

    @Test
    void validate_RecitalGaps() {
        ValidationReport report = UnitValidator.validate(null,
                List.of(recital("1"), recital("2"), recital("5")), "gaps.html");

        assertEquals(1, report.sequenceGaps.size());
        assertEquals("recital", report.sequenceGaps.get(0).type);
        assertEquals(List.of(3, 4), report.sequenceGaps.get(0).missing);
    }

    @Test
    void validate_SparseLargeRecitalNumber() {
        ValidationReport report = UnitValidator.validate(null,
                List.of(recital("1"), recital("2000000000")), "sparse.html");

        assertEquals(1, report.sequenceGaps.size());
        List<Integer> missing = report.sequenceGaps.get(0).missing;
        assertEquals(UnitValidator.MAX_REPORTED_GAPS, missing.size());
        assertEquals(2, missing.get(0));
        assertEquals(UnitValidator.MAX_REPORTED_GAPS + 1, missing.get(missing.size() - 1));
    }

    @Test
    void validate_RecitalNumberTooLargeIsSkipped() {
        ValidationReport report = UnitValidator.validate(null,
                List.of(recital("1"), recital("99999999999"), recital("3")), "overflow.html");

        assertEquals(1, report.sequenceGaps.size());
        assertEquals(List.of(2), report.sequenceGaps.get(0).missing);
    }

    @Test
    void validate_PointsSplitAroundSubparagraph() {
        Unit paragraph = paragraph("3", "1");
        Unit subparagraph = unit("art-3.par-1.subpar-1", UnitType.SUBPARAGRAPH, "art-3.par-1");

        ValidationReport report = UnitValidator.validate(null, List.of(article("3"), paragraph,
                point("art-3.par-1", "a"), subparagraph, point("art-3.par-1", "b")), "order.html");

        assertEquals(1, report.orderingIssues.size());
        assertEquals("interleaved_points", report.orderingIssues.get(0).type);
        assertEquals("art-3.par-1.pt-b", report.orderingIssues.get(0).id);
    }

    @Test
    void validate_ClosingSubparagraphAfterPointsIsFine() {
        Unit paragraph = paragraph("3", "1");
        Unit subparagraph = unit("art-3.par-1.subpar-1", UnitType.SUBPARAGRAPH, "art-3.par-1");

        ValidationReport report = UnitValidator.validate(null, List.of(article("3"), paragraph,
                point("art-3.par-1", "a"), point("art-3.par-1", "b"), subparagraph), "order.html");

        assertTrue(report.orderingIssues.isEmpty());
    }
}
