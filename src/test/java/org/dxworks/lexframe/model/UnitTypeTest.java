package org.dxworks.lexframe.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class UnitTypeTest {

    @Test
    void fromName_FixedKinds() {
        for (UnitKind kind : UnitKind.values()) {
            if (kind != UnitKind.NESTED) {
                assertSame(UnitType.of(kind), UnitType.fromName(kind.getName()));
            }
        }
        assertSame(UnitType.UNKNOWN, UnitType.fromName("unknown_unit"));
    }

    @Test
    void fromName_NestedDepth() {
        UnitType type = UnitType.fromName("nested_4");
        assertEquals(UnitKind.NESTED, type.getKind());
        assertEquals(4, type.getDepth());
        assertEquals("nested_4", type.getName());
        assertEquals(UnitType.nested(4), type);
    }

    @Test
    void fromName_RejectsUnknownNames() {
        assertThrows(IllegalArgumentException.class, () -> UnitType.fromName("nested"));
        assertThrows(IllegalArgumentException.class, () -> UnitType.fromName("nested_2"));
        assertThrows(IllegalArgumentException.class, () -> UnitType.fromName("nested_99999999999"));
        assertThrows(IllegalArgumentException.class, () -> UnitType.fromName("chapter"));
    }

    @Test
    void pointAtDepth_NamesByDepth() {
        assertEquals(UnitType.POINT, UnitType.pointAtDepth(0));
        assertEquals(UnitType.SUBPOINT, UnitType.pointAtDepth(1));
        assertEquals(UnitType.SUBSUBPOINT, UnitType.pointAtDepth(2));
        assertEquals("nested_3", UnitType.pointAtDepth(3).getName());
        assertTrue(UnitType.pointAtDepth(5).isPointLike());
        assertFalse(UnitType.PARAGRAPH.isPointLike());
    }

    @Test
    void childForTableContent_OneLevelDown() {
        assertEquals(UnitType.SUBPARAGRAPH, UnitType.PARAGRAPH.childForTableContent());
        assertEquals(UnitType.POINT, UnitType.ARTICLE.childForTableContent());
        assertEquals(UnitType.SUBPOINT, UnitType.ANNEX_ITEM.childForTableContent());
        assertEquals(UnitType.nested(3), UnitType.SUBSUBPOINT.childForTableContent());
        assertEquals(UnitType.nested(5), UnitType.nested(4).childForTableContent());
        assertEquals(UnitType.SUBPARAGRAPH, UnitType.ANNEX.childForTableContent());
    }

    @Test
    void json_WritesAndReadsNames() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertEquals("\"nested_3\"", mapper.writeValueAsString(UnitType.nested(3)));
        assertEquals("\"annex_part\"", mapper.writeValueAsString(UnitType.ANNEX_PART));
        assertEquals(UnitType.nested(6), mapper.readValue("\"nested_6\"", UnitType.class));
    }
}
