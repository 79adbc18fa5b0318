package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.model.Label;
import org.dxworks.lexframe.model.LabelKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LabelNormalizerTest {

    private static void assertLabel(String raw, String token, LabelKind kind) {
        Label label = LabelNormalizer.normalize(raw);
        assertEquals(token, label.token(), raw);
        assertEquals(kind, label.kind(), raw);
    }

    @Test
    void normalize_Letters() {
        assertLabel("(a)", "a", LabelKind.POINT);
        assertLabel("(C)", "c", LabelKind.POINT);
        assertLabel("(aa)", "aa", LabelKind.POINT);
        assertLabel("b)", "b", LabelKind.POINT);
    }

    @Test
    void normalize_RomanNumeralsBeforeLetters() {
        assertLabel("(i)", "i", LabelKind.SUBPOINT);
        assertLabel("(iv)", "iv", LabelKind.SUBPOINT);
        assertLabel("(v)", "v", LabelKind.SUBPOINT);
        assertLabel("(xxiii)", "xxiii", LabelKind.SUBPOINT);
    }

    @Test
    void normalize_Numbers() {
        assertLabel("1.", "1", LabelKind.PARAGRAPH);
        assertLabel("12. ", "12", LabelKind.PARAGRAPH);
        assertLabel("(1)", "1", LabelKind.NUMERIC);
        assertLabel("3)", "3", LabelKind.NUMERIC);
    }

    @Test
    void normalize_Dashes() {
        assertLabel("—", "—", LabelKind.DASH);
        assertLabel("–", "—", LabelKind.DASH);
        assertLabel("-", "—", LabelKind.DASH);
    }

    @Test
    void normalize_QuotedLabelsMarkAmendingText() {
        Label label = LabelNormalizer.normalize("‘(a)");
        assertEquals("a", label.token());
        assertTrue(label.quoted());
        assertFalse(LabelNormalizer.normalize("(a)").quoted());
    }

    @Test
    void normalize_Unknown() {
        Label label = LabelNormalizer.normalize("Category");
        assertEquals(LabelKind.UNKNOWN, label.kind());
        assertFalse(label.isKnown());
        assertEquals("", LabelNormalizer.normalize(null).token());
    }
}
