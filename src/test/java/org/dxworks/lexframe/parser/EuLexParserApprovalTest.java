package org.dxworks.lexframe.parser;

import org.approvaltests.Approvals;
import org.dxworks.lexframe.model.Citation;
import org.dxworks.lexframe.model.ParseResult;
import org.dxworks.lexframe.model.Unit;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

public class EuLexParserApprovalTest {

    @Test
    void parse_ConsolidatedSample() {
        ParseResult result = new EuLexParser().parse(Paths.get("src/test/resources/samples/consolidated/regulation.html"));
        Approvals.verify(outline(result));
    }

    /** One line per unit with its address, then one indented line per citation and its target. */
    private static String outline(ParseResult result) {
        StringBuilder out = new StringBuilder("format: ").append(result.format.getName()).append('\n');
        for (Unit unit : result.units) {
            out.append(unit.id).append(' ').append(unit.type)
               .append(" parent=").append(unit.parentId)
               .append(" path=").append(unit.targetPath).append('\n');
            for (Citation citation : unit.citations) {
                out.append("    ").append(citation.rawText).append(" -> ").append(citation.targetNodeId).append('\n');
            }
        }
        return out.toString();
    }
}
