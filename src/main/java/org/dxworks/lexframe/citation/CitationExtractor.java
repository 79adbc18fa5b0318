package org.dxworks.lexframe.citation;

import org.dxworks.lexframe.LexframeConfig;
import org.dxworks.lexframe.model.Citation;
import org.dxworks.lexframe.model.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs the pattern cascade over each unit's text. Units are independent of
 * each other; text quoted from amended acts is never scanned.
 */
public class CitationExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(CitationExtractor.class);

    private final ConnectivePhrases connectives;

    public CitationExtractor(LexframeConfig config) {
        this.connectives = new ConnectivePhrases(config.getConnectiveLookback());
    }

    public void extract(List<Unit> units) {
        int total = 0;
        for (Unit unit : units) {
            if (unit.isAmendmentText || unit.text == null || unit.text.isEmpty()) {
                unit.citations = new ArrayList<>();
                continue;
            }
            unit.citations = extract(unit.text);
            total += unit.citations.size();
        }
        LOGGER.debug("Extracted {} citations from {} units", total, units.size());
    }

    /** Citations of one text, ordered by position, with raw text and connective filled in. */
    public List<Citation> extract(String text) {
        SpanSet consumed = new SpanSet();
        List<Citation> citations = new ArrayList<>();
        for (CitationRule rule : CitationPatterns.RULES) {
            citations.addAll(rule.apply(text, consumed));
        }
        citations.sort(Comparator.comparingInt(citation -> citation.spanStart));

        for (Citation citation : citations) {
            citation.rawText = text.substring(citation.spanStart, citation.spanEnd);
            citation.connectivePhrase = connectives.find(text, citation.spanStart);
        }
        return citations;
    }
}
