package org.dxworks.lexframe.citation;

import org.dxworks.lexframe.LexframeConfig;
import org.dxworks.lexframe.model.Citation;
import org.dxworks.lexframe.model.CitationType;
import org.dxworks.lexframe.model.Unit;
import org.dxworks.lexframe.model.UnitType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.dxworks.lexframe.TestUtils.article;
import static org.dxworks.lexframe.TestUtils.paragraph;
import static org.dxworks.lexframe.TestUtils.unit;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class CitationResolverTest {

    private final CitationExtractor extractor = new CitationExtractor(LexframeConfig.defaults());
    private final CitationResolver resolver = new CitationResolver();

    private List<Citation> run(Unit citing, Unit... others) {
        List<Unit> units = new ArrayList<>(Arrays.asList(others));
        units.add(citing);
        extractor.extract(units);
        resolver.resolve(units);
        return citing.citations;
    }

    private static Unit subparagraph(String articleNumber, String paragraphNumber, int index) {
        String parentId = "art-" + articleNumber + ".par-" + paragraphNumber;
        Unit unit = unit(parentId + ".subpar-" + index, UnitType.SUBPARAGRAPH, parentId);
        unit.articleNumber = articleNumber;
        unit.paragraphNumber = paragraphNumber;
        unit.subparagraphIndex = index;
        return unit;
    }

    private static Unit point(Unit parent, String label) {
        Unit unit = unit(parent.id + ".pt-" + label, UnitType.POINT, parent.id);
        unit.articleNumber = parent.articleNumber;
        unit.paragraphNumber = parent.paragraphNumber;
        unit.pointLabel = label;
        return unit;
    }

    @Test
    void resolve_ThisArticle() {
        Unit citing = paragraph("5", "1");
        citing.text = "The requirements of this Article shall apply.";

        List<Citation> citations = run(citing, article("5"));

        assertEquals(1, citations.size());
        assertEquals("5", citations.get(0).articleLabel);
        assertNull(citations.get(0).paragraph);
        assertEquals("art-5", citations.get(0).targetNodeId);
    }

    @Test
    void resolve_ThisParagraphFromParagraphIndex() {
        Unit citing = unit("art-3.par-2", UnitType.PARAGRAPH, "art-3");
        citing.articleNumber = "3";
        citing.paragraphIndex = 2;
        citing.text = "The limits set out in this paragraph shall be reviewed.";

        Citation c = run(citing, article("3")).get(0);

        assertEquals(3, c.article);
        assertEquals(2, c.paragraph);
        assertEquals("art-3.par-2", c.targetNodeId);
    }

    @Test
    void resolve_FirstSubparagraphIsTheParagraphItself() {
        Unit citing = subparagraph("5", "2", 2);
        citing.text = "By way of derogation from the first subparagraph, Member States may act.";

        Citation c = run(citing, article("5"), paragraph("5", "2"), subparagraph("5", "2", 1)).get(0);

        assertEquals(5, c.article);
        assertEquals(2, c.paragraph);
        assertEquals("first", c.subparagraphOrdinal);
        assertEquals("art-5.par-2", c.targetNodeId);
        assertEquals("by way of derogation from", c.connectivePhrase);
    }

    @Test
    void resolve_SecondSubparagraphShiftsByOne() {
        Unit citing = paragraph("5", "3");
        citing.text = "The notification referred to in the second subparagraph shall be public.";

        Citation c = run(citing, article("5"), paragraph("5", "2"), subparagraph("5", "3", 1)).get(0);

        assertEquals(3, c.paragraph);
        assertEquals("art-5.par-3.subpar-1", c.targetNodeId);
    }

    @Test
    void resolve_ArticleAndParagraph() {
        Unit citing = paragraph("2", "1");
        citing.text = "Processing shall be lawful only as laid down in Article 6(1).";

        Citation c = run(citing, article("2"), article("6"), paragraph("6", "1")).get(0);

        assertEquals(CitationType.INTERNAL, c.citationType);
        assertEquals(6, c.article);
        assertEquals(1, c.paragraph);
        assertEquals("art-6.par-1", c.targetNodeId);
    }

    @Test
    void resolve_ArticleWithLetterSuffix() {
        Unit target = paragraph("6a", "1");
        Unit citing = paragraph("7", "1");
        citing.text = "as set out in Article 6a(1)";

        Citation c = run(citing, article("6a"), target, article("7")).get(0);

        assertEquals("6a", c.articleLabel);
        assertEquals("art-6a.par-1", c.targetNodeId);
    }

    @Test
    void resolve_LeavesExternalCitationsAlone() {
        Unit citing = paragraph("1", "1");
        citing.text = "as referred to in Article 6 of Regulation (EU) 2016/679";

        Citation c = run(citing, article("1"), article("6")).get(0);

        assertEquals(CitationType.EU_LEGISLATION, c.citationType);
        assertEquals("6", c.articleLabel);
        assertNull(c.paragraph);
        assertEquals("art-6", c.targetNodeId);
    }

    @Test
    void resolve_PointEnumerationInOwnParagraph() {
        Unit citing = paragraph("5", "1");
        citing.text = "Where the conditions in points (a) and (b) are met, the following applies:";

        List<Citation> citations = run(citing, article("5"), point(citing, "a"), point(citing, "b"));

        assertEquals(2, citations.size());
        assertEquals("art-5.par-1.pt-a", citations.get(0).targetNodeId);
        assertEquals("art-5.par-1.pt-b", citations.get(1).targetNodeId);
    }

    @Test
    void resolve_PointEnumerationAnchoredOnPrecedingArticle() {
        Unit citing = paragraph("1", "1");
        citing.text = "the data listed in Article 7(4), points (a) and (b)";
        Unit article7 = article("7");
        Unit paragraph74 = paragraph("7", "4");

        List<Citation> citations = run(citing, article("1"), article7, paragraph74,
                point(paragraph74, "a"), point(paragraph74, "b"));

        assertEquals(3, citations.size());
        assertEquals("art-7.par-4", citations.get(0).targetNodeId);
        assertEquals("7", citations.get(1).articleLabel);
        assertEquals(4, citations.get(1).paragraph);
        assertEquals("art-7.par-4.pt-a", citations.get(1).targetNodeId);
        assertEquals("art-7.par-4.pt-b", citations.get(2).targetNodeId);
    }

    @Test
    void resolve_PointAnchorStopsAtSentenceBreak() {
        Unit citing = paragraph("2", "1");
        citing.text = "Article 9 applies. The exemption in point (c) does not.";

        List<Citation> citations = run(citing, article("2"), article("9"), point(citing, "c"));

        assertEquals(2, citations.size());
        assertEquals("2", citations.get(1).articleLabel);
        assertEquals("art-2.par-1.pt-c", citations.get(1).targetNodeId);
    }

    @Test
    void resolve_PointFallsBackToEnclosingSubparagraph() {
        Unit subparagraph = subparagraph("2", "1", 2);
        Unit sibling = point(subparagraph, "a");
        Unit citing = point(subparagraph, "c");
        citing.text = "the information referred to in point (a);";

        Citation c = run(citing, article("2"), paragraph("2", "1"), subparagraph, sibling).get(0);

        assertEquals("2", c.articleLabel);
        assertEquals(1, c.paragraph);
        assertEquals(2, c.subparagraphIndex);
        assertEquals("second", c.subparagraphOrdinal);
        assertEquals("art-2.par-1.subpar-2.pt-a", c.targetNodeId);
    }

    @Test
    void resolve_ParagraphEnumeration() {
        Unit citing = paragraph("5", "3");
        citing.text = "The measures referred to in paragraphs 1 and 2 shall be notified.";

        List<Citation> citations = run(citing, article("5"), paragraph("5", "1"), paragraph("5", "2"));

        assertEquals("art-5.par-1", citations.get(0).targetNodeId);
        assertEquals("art-5.par-2", citations.get(1).targetNodeId);
    }

    @Test
    void resolve_NoTargetWithoutContext() {
        Unit citing = unit("recital-4", UnitType.RECITAL, null);
        citing.recitalNumber = "4";
        citing.text = "The entities listed in point (a) should be exempted.";

        Citation c = run(citing).get(0);

        assertNull(c.articleLabel);
        assertNull(c.targetNodeId);
    }

    @Test
    void resolve_AnnexPartFromContext() {
        Unit annex = unit("annex-I", UnitType.ANNEX, null);
        annex.annexNumber = "I";
        Unit part = unit("annex-I.part-A", UnitType.ANNEX_PART, "annex-I");
        part.annexNumber = "I";
        part.annexPart = "A";
        Unit citing = unit("annex-I.part-B.item-1", UnitType.ANNEX_ITEM, "annex-I");
        citing.annexNumber = "I";
        citing.text = "The items listed in Part A shall be reported.";

        Citation c = run(citing, annex, part).get(0);

        assertEquals("I", c.annex);
        assertEquals("A", c.annexPart);
        assertEquals("annex-I.part-A", c.targetNodeId);
    }

    @Test
    void resolve_ManuallyBuiltAnnexCitation() {
        Unit annex = unit("annex-II", UnitType.ANNEX, null);
        annex.annexNumber = "II";
        Unit citing = unit("annex-II.item-3", UnitType.ANNEX_ITEM, "annex-II");
        citing.annexNumber = "II";
        citing.text = "see this Annex";
        Citation manual = new Citation(4, 14, CitationType.INTERNAL);
        manual.form = Citation.Form.THIS_ANNEX;
        citing.citations = new ArrayList<>(List.of(manual));

        resolver.resolve(List.of(annex, citing));

        assertEquals("II", manual.annex);
        assertEquals("annex-II", manual.targetNodeId);
    }

    @Test
    void resolve_MissingAnnexHasNoTarget() {
        Unit annex = unit("annex-I", UnitType.ANNEX, null);
        Unit citing = paragraph("4", "1");
        citing.text = "the templates in Annex I and Annex V";

        List<Citation> citations = run(citing, article("4"), annex);

        assertEquals("annex-I", citations.get(0).targetNodeId);
        assertNull(citations.get(1).targetNodeId);
    }

    @Test
    void resolve_ThatDirectiveWithSingleAntecedent() {
        Unit citing = paragraph("1", "1");
        citing.text = "Directive 2014/65/EU shall apply. Competent authorities under that Directive shall cooperate.";

        List<Citation> citations = run(citing, article("1"));

        assertEquals(2, citations.size());
        Citation that = citations.get(1);
        assertEquals(CitationType.EU_LEGISLATION, that.citationType);
        assertEquals("2014/65", that.actNumber);
        assertEquals("32014L0065", that.celex);
        assertNull(that.targetNodeId);
    }

    @Test
    void resolve_ThatDirectiveWithSeveralAntecedents() {
        Unit citing = paragraph("1", "1");
        citing.text = "Directive 2014/65/EU and Directive 2013/36/EU apply; that Directive prevails.";

        Citation that = run(citing, article("1")).get(2);

        assertEquals(CitationType.INTERNAL, that.citationType);
        assertNull(that.actNumber);
        assertNull(that.targetNodeId);
    }

    @Test
    void resolve_ThatRegulationWithoutAntecedent() {
        Unit citing = paragraph("1", "1");
        citing.text = "The reports required by that Regulation shall be published.";

        Citation that = run(citing, article("1")).get(0);

        assertEquals(CitationType.INTERNAL, that.citationType);
        assertNull(that.targetNodeId);
    }

    @Test
    void resolve_ArticleOfThatDirective() {
        Unit citing = paragraph("1", "1");
        citing.text = "Member States shall apply Directive (EU) 2015/849. Article 4 of that Directive shall apply.";

        List<Citation> citations = run(citing, article("1"), article("4"));

        Citation c = citations.get(1);
        assertEquals(CitationType.EU_LEGISLATION, c.citationType);
        assertEquals("2015/849", c.actNumber);
        assertEquals("32015L0849", c.celex);
        assertEquals("art-4", c.targetNodeId);
    }

    @Test
    void resolve_PlainArticleNextToAnActStaysInternal() {
        Unit citing = paragraph("1", "1");
        citing.text = "Directive 2014/65/EU applies without prejudice to Article 60.";

        List<Citation> citations = run(citing, article("1"));

        assertEquals(2, citations.size());
        assertEquals(CitationType.INTERNAL, citations.get(1).citationType);
        assertEquals(60, citations.get(1).article);
        assertNull(citations.get(1).targetNodeId);
        assertEquals("without prejudice to", citations.get(1).connectivePhrase);
    }

    @Test
    void resolve_ParagraphNumberTooLargeLeavesParagraphOpen() {
        Unit citing = paragraph("3", "99999999999");
        citing.text = "The limits set out in this paragraph shall be reviewed.";

        List<Citation> citations = assertDoesNotThrow(() -> run(citing, article("3")));

        assertEquals(1, citations.size());
        assertEquals("3", citations.get(0).articleLabel);
        assertNull(citations.get(0).paragraph);
    }
}
