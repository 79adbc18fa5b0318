package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.DocumentFormat;
import org.dxworks.lexframe.FormatDetector;
import org.dxworks.lexframe.LexframeConfig;
import org.dxworks.lexframe.citation.CitationExtractor;
import org.dxworks.lexframe.citation.CitationResolver;
import org.dxworks.lexframe.html.HtmlDocuments;
import org.dxworks.lexframe.html.HtmlNode;
import org.dxworks.lexframe.model.ParseResult;
import org.dxworks.lexframe.model.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One document in, one {@link ParseResult} out: detect the dialect, build the
 * unit sequence, validate it, enrich it, then extract and resolve citations.
 * Holds only configuration, so a single instance may parse many documents.
 */
public class EuLexParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(EuLexParser.class);

    private final LexframeConfig config;

    public EuLexParser(LexframeConfig config) {
        this.config = config;
    }

    public EuLexParser() {
        this(LexframeConfig.defaults());
    }

    public ParseResult parse(Path file) {
        return parse(HtmlDocuments.parse(file), file.toString());
    }

    public ParseResult parse(String html, String sourceFile) {
        return parse(HtmlDocuments.parse(html), sourceFile);
    }

    public ParseResult parse(HtmlNode document, String sourceFile) {
        DocumentFormat format = FormatDetector.detect(document);
        List<Unit> units = new ArrayList<>(new UnitTreeBuilder(config).build(document, format, sourceFile));

        ParseResult result = new ParseResult();
        result.sourceFile = sourceFile;
        result.format = format;
        result.validation = UnitValidator.validate(document, units, sourceFile);
        result.documentMetadata = EnrichmentPass.enrich(units);

        if (config.isExtractCitations()) {
            new CitationExtractor(config).extract(units);
            new CitationResolver().resolve(units);
        }
        result.units = units;

        if (!result.validation.isValid()) {
            LOGGER.warn("{}: {} orphans, {} unparsed nodes, {} mismatched labels, {} hierarchy issues, "
                            + "{} ordering issues, {} recital gaps",
                    sourceFile,
                    result.validation.orphans.size(),
                    result.validation.unparsedNodes.size(),
                    result.validation.mismatchedLabels.size(),
                    result.validation.hierarchyIssues.size(),
                    result.validation.orderingIssues.size(),
                    result.validation.sequenceGaps.size());
        }
        LOGGER.info("Parsed {} ({}): {} units, {} articles",
                sourceFile, format.getName(), units.size(), result.documentMetadata.totalArticles);
        return result;
    }
}
