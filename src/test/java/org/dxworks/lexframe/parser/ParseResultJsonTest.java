package org.dxworks.lexframe.parser;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.dxworks.lexframe.TestUtils.APPROVAL_MAPPER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ParseResultJsonTest {

    @Test
    void serialize_OjSampleInSnakeCase() throws Exception {
        String json = APPROVAL_MAPPER.writeValueAsString(
                new EuLexParser().parse(Paths.get("src/test/resources/samples/oj/regulation.html")));
        JsonNode root = APPROVAL_MAPPER.readTree(json);

        assertEquals("oj", root.get("format").asText());
        assertEquals(21, root.get("document_metadata").get("total_units").asInt());
        assertFalse(root.get("validation").has("valid"));
        assertTrue(root.get("validation").get("orphans").isEmpty());
        assertTrue(root.get("validation").get("unparsed_nodes").isArray());
        assertTrue(root.get("validation").get("unparsed_nodes").isEmpty());
        assertTrue(root.get("validation").get("mismatched_labels").isArray());
        assertTrue(root.get("validation").get("mismatched_labels").isEmpty());

        JsonNode title = root.get("units").get(0);
        assertEquals("document_title", title.get("type").asText());
        assertFalse(title.has("parent_id"));

        JsonNode point = root.get("units").get(5);
        assertEquals("art-1.par-1.pt-a", point.get("id").asText());
        assertEquals("Art. 1(1)(a)", point.get("target_path").asText());
        assertTrue(point.get("is_leaf").asBoolean());

        JsonNode citation = point.get("citations").get(0);
        assertEquals("internal", citation.get("citation_type").asText());
        assertEquals(2, citation.get("article").asInt());
        assertEquals("art-2", citation.get("target_node_id").asText());
        assertFalse(citation.has("form"));
        assertFalse(citation.has("internal"));
        assertFalse(citation.has("paragraph"));
    }
}
