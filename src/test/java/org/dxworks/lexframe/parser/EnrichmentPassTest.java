package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.model.DocumentMetadata;
import org.dxworks.lexframe.model.Unit;
import org.dxworks.lexframe.model.UnitType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.lexframe.TestUtils.article;
import static org.dxworks.lexframe.TestUtils.paragraph;
import static org.dxworks.lexframe.TestUtils.unit;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EnrichmentPassTest {

    private static Unit point(Unit parent, String label, String text) {
        Unit unit = unit(parent.id + ".pt-" + label, UnitType.POINT, parent.id);
        unit.articleNumber = parent.articleNumber;
        unit.paragraphNumber = parent.paragraphNumber;
        unit.pointLabel = label;
        unit.text = text;
        return unit;
    }

    @Test
    void enrich_TreeShapeAndCounts() {
        Unit article = article("4");
        article.heading = "Definitions";
        Unit paragraph = paragraph("4", "1");
        paragraph.text = "For the purposes of this Regulation:  ";
        Unit a = point(paragraph, "a", "‘entity’ means a legal person;");
        Unit b = point(paragraph, "b", "");

        DocumentMetadata metadata = EnrichmentPass.enrich(List.of(article, paragraph, a, b));

        assertEquals(1, article.childrenCount);
        assertFalse(article.isLeaf);
        assertFalse(article.isStem);
        assertTrue(paragraph.isStem);
        assertEquals(2, paragraph.childrenCount);
        assertTrue(a.isLeaf);
        assertFalse(a.isStem);
        assertEquals(5, a.wordCount);
        assertEquals(30, a.charCount);
        assertEquals(0, b.wordCount);

        assertEquals(4, metadata.totalUnits);
        assertEquals(1, metadata.totalArticles);
        assertEquals(1, metadata.totalParagraphs);
        assertEquals(2, metadata.totalPoints);
        assertEquals(2, metadata.totalDefinitions);
        assertFalse(metadata.hasAnnexes);
    }

    @Test
    void enrich_ArticleHeadingCarriesUntilReset() {
        Unit article = article("1");
        article.heading = "Subject matter";
        Unit paragraph = paragraph("1", "1");
        Unit annex = unit("annex-I", UnitType.ANNEX, null);
        annex.annexNumber = "I";
        Unit item = unit("annex-I.item-1", UnitType.ANNEX_ITEM, "annex-I");
        item.annexNumber = "I";

        DocumentMetadata metadata = EnrichmentPass.enrich(List.of(article, paragraph, annex, item));

        assertEquals("Subject matter", article.articleHeading);
        assertEquals("Subject matter", paragraph.articleHeading);
        assertNull(annex.articleHeading);
        assertNull(item.articleHeading);
        assertTrue(metadata.hasAnnexes);
    }

    @Test
    void targetPath_Addresses() {
        Unit recital = unit("recital-15", UnitType.RECITAL, null);
        recital.recitalNumber = "15";
        assertEquals("Recital 15", EnrichmentPass.targetPath(recital));

        Unit part = unit("annex-I.part-A", UnitType.ANNEX_PART, "annex-I");
        part.annexNumber = "I";
        part.annexPart = "A";
        assertEquals("Annex I, Part A", EnrichmentPass.targetPath(part));

        Unit subpoint = unit("art-9.par-4.pt-a.sub-ii", UnitType.SUBPOINT, "art-9.par-4.pt-a");
        subpoint.articleNumber = "9";
        subpoint.paragraphNumber = "4";
        subpoint.pointLabel = "a";
        subpoint.subpointLabel = "ii";
        assertEquals("Art. 9(4)(a)(ii)", EnrichmentPass.targetPath(subpoint));

        Unit unnumbered = unit("art-3.par-1", UnitType.PARAGRAPH, "art-3");
        unnumbered.articleNumber = "3";
        unnumbered.paragraphIndex = 1;
        assertEquals("Art. 3(1)", EnrichmentPass.targetPath(unnumbered));

        assertNull(EnrichmentPass.targetPath(unit("document-title", UnitType.DOCUMENT_TITLE, null)));
    }

    @Test
    void enrich_TitleAndAmendingArticles() {
        Unit title = unit("document-title", UnitType.DOCUMENT_TITLE, null);
        title.text = "REGULATION (EU) 2024/1";
        Unit amending = article("2");
        Unit quoted = paragraph("2", "1");
        quoted.isAmendmentText = true;

        DocumentMetadata metadata = EnrichmentPass.enrich(List.of(title, amending, quoted));

        assertEquals("REGULATION (EU) 2024/1", metadata.title);
        assertEquals(List.of("2"), metadata.amendmentArticles);
    }
}
