package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.html.HtmlNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dxworks.lexframe.html.HtmlTreeHelper.hasChild;
import static org.dxworks.lexframe.html.HtmlTreeHelper.isNoteMarker;
import static org.dxworks.lexframe.html.HtmlTreeHelper.normalizeText;
import static org.dxworks.lexframe.html.HtmlTreeHelper.text;

public class TextExtraction {

    private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d+)\\.\\s+(.*)$", Pattern.DOTALL);
    private static final Set<String> TABLES = Set.of("table");

    private TextExtraction() {
    }

    /** Text split from its leading "N. " paragraph number; {@code label} is null when there is none. */
    public record LabeledText(String text, String label) {
    }

    public static LabeledText stripLeadingLabel(String text) {
        Matcher m = LEADING_NUMBER.matcher(text);
        if (m.matches()) {
            return new LabeledText(m.group(2).strip(), m.group(1));
        }
        return new LabeledText(text, null);
    }

    /**
     * Text of a table cell. With {@code excludeNested}, only the leading text
     * before any nested table is returned, and only the first paragraph when
     * nested tables or wrapper divs follow (those are parsed separately).
     */
    public static String cellText(HtmlNode cell, boolean excludeNested) {
        if (excludeNested) {
            boolean hasNested = hasChild(cell, "table") || hasChild(cell, "div");
            List<String> texts = new ArrayList<>();
            for (HtmlNode child : cell.children()) {
                if (child.isText()) {
                    String t = normalizeText(child.ownText());
                    if (!t.isEmpty()) {
                        texts.add(t);
                    }
                    continue;
                }
                if (isNoteMarker(child)) {
                    continue;
                }
                if (child.is("table")) {
                    break;
                }
                if (child.is("p")) {
                    if (child.hasClass("oj-note")) {
                        continue;
                    }
                    String t = text(child);
                    if (!t.isEmpty()) {
                        texts.add(t);
                        if (hasNested) {
                            break;
                        }
                    }
                }
            }
            if (!texts.isEmpty()) {
                return normalizeText(String.join(" ", texts));
            }
            return text(cell, TABLES);
        }

        List<HtmlNode> paragraphs = cell.childElements("p");
        if (!paragraphs.isEmpty()) {
            List<String> texts = new ArrayList<>();
            for (HtmlNode p : paragraphs) {
                String t = text(p);
                if (!t.isEmpty()) {
                    texts.add(t);
                }
            }
            return String.join(" ", texts);
        }
        return text(cell);
    }
}
