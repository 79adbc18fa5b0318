package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.DocumentFormat;
import org.dxworks.lexframe.LexframeConfig;
import org.dxworks.lexframe.html.HtmlNode;
import org.dxworks.lexframe.model.Unit;

import java.util.List;

/**
 * Builds the flat, document-ordered unit sequence: title, recitals, articles
 * of the detected dialect, then annexes.
 */
public class UnitTreeBuilder {

    private final LexframeConfig config;

    public UnitTreeBuilder(LexframeConfig config) {
        this.config = config;
    }

    public List<Unit> build(HtmlNode document, DocumentFormat format, String sourceFile) {
        BuildContext context = new BuildContext(sourceFile, config);
        PointTableParser pointTables = new PointTableParser(context);

        PreambleParser preamble = new PreambleParser(context);
        preamble.parseTitle(document);
        preamble.parseRecitals(document);

        if (format == DocumentFormat.CONSOLIDATED) {
            new ConsolidatedArticleParser(context).parse(document);
        } else {
            new OjArticleParser(context, pointTables).parse(document);
        }

        new AnnexParser(context, pointTables).parse(document);
        return List.copyOf(context.getUnits());
    }
}
