package org.dxworks.lexframe.citation;

import org.dxworks.lexframe.Numbers;
import org.dxworks.lexframe.model.Citation;
import org.dxworks.lexframe.model.CitationType;
import org.dxworks.lexframe.model.Unit;
import org.dxworks.lexframe.model.UnitType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Completes internal citations from the citing unit's position in the tree:
 * "this Article", "the first subparagraph", "points (a) and (b)" and the like
 * get their missing article, paragraph or annex, and a target node id when
 * such a unit exists. "that Directive" style references become external when
 * the unit names exactly one act of that kind before them.
 */
public class CitationResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(CitationResolver.class);

    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.;:]");
    private static final Pattern SUBPARAGRAPH_ID = Pattern.compile("subpar-(\\d+)$");

    /** Where the citing unit sits: article label, paragraph number and annex. */
    record Context(String articleLabel, Integer paragraph, String annex) {
    }

    private Map<String, Unit> byId = Map.of();

    public void resolve(List<Unit> units) {
        byId = new HashMap<>();
        for (Unit unit : units) {
            byId.putIfAbsent(unit.id, unit);
        }

        int targeted = 0;
        for (Unit unit : units) {
            if (unit.citations == null || unit.citations.isEmpty()) {
                continue;
            }
            Context context = contextOf(unit);
            List<Citation> earlier = new ArrayList<>();
            Set<Citation> shifted = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Citation citation : unit.citations) {
                resolve(citation, unit, context, earlier, shifted);
                if (citation.isInternal() && citation.targetNodeId != null) {
                    targeted++;
                }
                earlier.add(citation);
            }
        }
        LOGGER.debug("Resolved {} internal citation targets", targeted);
    }

    private void resolve(Citation citation, Unit unit, Context context, List<Citation> earlier, Set<Citation> shifted) {
        if (!citation.isInternal()) {
            return;
        }
        if (citation.form == Citation.Form.THAT_ACT || citation.form == Citation.Form.ARTICLE_OF_THAT_ACT) {
            resolveThatAct(citation, earlier);
            return;
        }

        boolean missingArticle = citation.articleLabel == null;
        boolean missingParagraph = citation.paragraph == null;
        boolean fromParentChain = false;

        if (citation.form == Citation.Form.POINT_LIST && missingArticle && missingParagraph) {
            Citation anchor = anchor(citation, earlier, unit.text);
            if (anchor != null) {
                citation.setArticleLabel(anchor.articleLabel);
                citation.paragraph = anchor.paragraph;
                if (anchor.subparagraphOrdinal != null) {
                    citation.subparagraphOrdinal = anchor.subparagraphOrdinal;
                    citation.subparagraphIndex = anchor.subparagraphIndex;
                }
                boolean anchorShifted = shifted.contains(anchor);
                if (anchorShifted) {
                    shifted.add(citation);
                }
                citation.targetNodeId = target(citation, anchorShifted, unit);
                return;
            }
            Integer position = enclosingSubparagraphPosition(unit);
            if (position != null) {
                citation.subparagraphIndex = position;
                citation.subparagraphOrdinal = Ordinals.toWord(position);
                fromParentChain = true;
            }
        }

        boolean hasPoint = citation.point != null || citation.pointRange != null;
        boolean wantsArticle = missingArticle && citation.articleRange == null
                && (citation.paragraph != null || hasPoint || citation.subparagraphOrdinal != null
                || citation.form == Citation.Form.THIS_ARTICLE
                || citation.form == Citation.Form.THIS_PARAGRAPH
                || citation.form == Citation.Form.THIS_SUBPARAGRAPH);
        boolean articleFromContext = false;
        if (wantsArticle && context.articleLabel() != null) {
            citation.setArticleLabel(context.articleLabel());
            articleFromContext = true;
        }

        boolean wantsParagraph = missingParagraph && missingArticle && citation.paragraphRange == null
                && (citation.subparagraphOrdinal != null || hasPoint
                || citation.form == Citation.Form.THIS_PARAGRAPH
                || citation.form == Citation.Form.THIS_SUBPARAGRAPH);
        boolean paragraphFromContext = false;
        if (wantsParagraph && context.paragraph() != null) {
            citation.paragraph = context.paragraph();
            paragraphFromContext = true;
        }

        if (citation.annex == null && (citation.annexPart != null || citation.form == Citation.Form.THIS_ANNEX)) {
            citation.annex = context.annex();
        }

        // the paragraph node holds the first subparagraph, so ordinals shift by one
        boolean shift = !fromParentChain && citation.subparagraphOrdinal != null
                && citation.articleLabel != null && citation.paragraph != null
                && (articleFromContext || paragraphFromContext);
        if (shift) {
            shifted.add(citation);
        }
        citation.targetNodeId = target(citation, shift, unit);
    }

    private static void resolveThatAct(Citation citation, List<Citation> earlier) {
        Set<String> acts = new LinkedHashSet<>();
        Citation antecedent = null;
        for (Citation previous : earlier) {
            if (previous.citationType == CitationType.EU_LEGISLATION
                    && previous.actType != null
                    && previous.actType == citation.referencedActType
                    && previous.spanStart < citation.spanStart) {
                acts.add(previous.actNumber);
                antecedent = previous;
            }
        }
        if (acts.size() != 1) {
            citation.targetNodeId = null;
            return;
        }
        citation.citationType = CitationType.EU_LEGISLATION;
        citation.copyActFrom(antecedent);
        citation.targetNodeId = citation.form == Citation.Form.ARTICLE_OF_THAT_ACT
                ? CitationPatterns.externalTarget(citation)
                : null;
    }

    /** Nearest earlier internal citation with an article, unless a sentence break separates them. */
    private static Citation anchor(Citation citation, List<Citation> earlier, String text) {
        for (int i = earlier.size() - 1; i >= 0; i--) {
            Citation previous = earlier.get(i);
            if (!previous.isInternal() || previous.articleLabel == null) {
                continue;
            }
            if (previous.spanEnd > citation.spanStart) {
                continue;
            }
            String between = text.substring(previous.spanEnd, citation.spanStart);
            return SENTENCE_BREAK.matcher(between).find() ? null : previous;
        }
        return null;
    }

    private Integer enclosingSubparagraphPosition(Unit unit) {
        if (!isPointLike(unit.type)) {
            return null;
        }
        Unit current = parentOf(unit);
        while (current != null) {
            if (UnitType.SUBPARAGRAPH.equals(current.type)) {
                if (current.subparagraphIndex != null) {
                    return current.subparagraphIndex;
                }
                Matcher matcher = SUBPARAGRAPH_ID.matcher(current.id);
                return matcher.find() ? Numbers.parse(matcher.group(1)) : null;
            }
            if (!isPointLike(current.type)) {
                return null;
            }
            current = parentOf(current);
        }
        return null;
    }

    private String target(Citation citation, boolean shifted, Unit unit) {
        List<String> candidates = new ArrayList<>();
        if (citation.form == Citation.Form.THIS_SUBPARAGRAPH && UnitType.SUBPARAGRAPH.equals(unit.type)) {
            candidates.add(unit.id);
        }

        String article = citation.articleLabel == null ? null : "art-" + citation.articleLabel;
        String paragraph = citation.paragraph == null ? null : "par-" + citation.paragraph;
        String subparagraph = subparagraphSegment(citation, shifted);
        String point = citation.point == null ? null : "pt-" + citation.point;

        if (point != null) {
            candidates.add(join(article, paragraph, subparagraph, point));
        }
        if (subparagraph != null) {
            candidates.add(join(article, paragraph, subparagraph));
        }
        candidates.add(join(article, paragraph));
        if (citation.annex != null) {
            if (citation.annexPart != null) {
                candidates.add("annex-" + citation.annex + ".part-" + citation.annexPart);
            }
            candidates.add("annex-" + citation.annex);
        }

        for (String candidate : candidates) {
            if (!candidate.isEmpty() && byId.containsKey(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static String subparagraphSegment(Citation citation, boolean shifted) {
        Integer index = citation.subparagraphIndex != null
                ? citation.subparagraphIndex
                : Ordinals.toIndex(citation.subparagraphOrdinal);
        if (index == null) {
            return null;
        }
        if (shifted) {
            return index == 1 ? null : "subpar-" + (index - 1);
        }
        return "subpar-" + index;
    }

    private static String join(String... parts) {
        StringBuilder id = new StringBuilder();
        for (String part : parts) {
            if (part == null) continue;
            if (id.length() > 0) id.append('.');
            id.append(part);
        }
        return id.toString();
    }

    private Context contextOf(Unit unit) {
        String article = unit.articleNumber;
        Integer paragraph = Numbers.parse(unit.paragraphNumber);
        if (paragraph == null) {
            paragraph = unit.paragraphIndex;
        }
        String annex = unit.annexNumber;

        Unit ancestor = parentOf(unit);
        while (ancestor != null && (article == null || paragraph == null || annex == null)) {
            if (article == null && UnitType.ARTICLE.equals(ancestor.type)) {
                article = ancestor.articleNumber;
            }
            if (paragraph == null && UnitType.PARAGRAPH.equals(ancestor.type)) {
                paragraph = Numbers.parse(ancestor.paragraphNumber);
                if (paragraph == null) {
                    paragraph = ancestor.paragraphIndex;
                }
            }
            if (annex == null && UnitType.ANNEX.equals(ancestor.type)) {
                annex = ancestor.annexNumber;
            }
            ancestor = parentOf(ancestor);
        }
        return new Context(blankToNull(article), paragraph, blankToNull(annex));
    }

    private Unit parentOf(Unit unit) {
        return unit.parentId == null ? null : byId.get(unit.parentId);
    }

    private static boolean isPointLike(UnitType type) {
        return type != null && type.isPointLike();
    }

    private static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
