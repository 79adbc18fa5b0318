package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.html.HtmlNode;
import org.dxworks.lexframe.model.Unit;
import org.dxworks.lexframe.model.UnitType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dxworks.lexframe.html.HtmlTreeHelper.rowCells;
import static org.dxworks.lexframe.html.HtmlTreeHelper.tableRows;
import static org.dxworks.lexframe.html.HtmlTreeHelper.text;

/**
 * Document title and recitals.
 */
public class PreambleParser {

    private static final String TITLE_ID = "document-title";
    private static final Pattern RELEVANCE_NOTE =
            Pattern.compile("^\\(\\s*Text with .* relevance\\s*\\)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern RECITAL_LABEL = Pattern.compile("\\((\\d+)\\)");

    private final BuildContext context;

    public PreambleParser(BuildContext context) {
        this.context = context;
    }

    public void parseTitle(HtmlNode document) {
        HtmlNode titleDiv = document.selectFirst("div.eli-main-title");
        if (titleDiv == null) {
            titleDiv = document.selectFirst("div[id^=tit_]");
        }
        if (titleDiv == null) {
            return;
        }

        List<HtmlNode> paragraphs = titleDiv.select("p.oj-doc-ti");
        if (paragraphs.isEmpty()) {
            paragraphs = titleDiv.select("p");
        }
        List<String> parts = new ArrayList<>();
        for (HtmlNode p : paragraphs) {
            String t = text(p);
            if (!t.isEmpty() && !RELEVANCE_NOTE.matcher(t).matches()) {
                parts.add(t);
            }
        }
        if (parts.isEmpty()) {
            return;
        }

        Unit title = BuildContext.unit(TITLE_ID, UnitType.DOCUMENT_TITLE, null, String.join(" ", parts));
        title.sourceId = titleDiv.id();
        context.add(title);
    }

    public void parseRecitals(HtmlNode document) {
        for (HtmlNode div : document.select("div.eli-subdivision[id^=rct_]")) {
            String sourceId = div.id();
            String number = sourceId.replace("rct_", "");

            HtmlNode table = div.selectFirst("table");
            if (table != null && context.isListTable(table)) {
                for (HtmlNode row : tableRows(table)) {
                    List<HtmlNode> cells = rowCells(row);
                    if (cells.size() < 2) {
                        continue;
                    }
                    String label = text(cells.get(0));
                    Matcher m = RECITAL_LABEL.matcher(label);
                    if (m.find()) {
                        number = m.group(1);
                    }
                    addRecital(number, label, text(cells.get(1)), sourceId);
                }
                continue;
            }

            List<String> parts = new ArrayList<>();
            for (HtmlNode p : div.select("p.oj-normal")) {
                String t = TextExtraction.stripLeadingLabel(text(p)).text();
                if (!t.isEmpty()) {
                    parts.add(t);
                }
            }
            if (!parts.isEmpty()) {
                addRecital(number, "(" + number + ")", String.join(" ", parts), sourceId);
            }
        }
    }

    private void addRecital(String number, String ref, String t, String sourceId) {
        Unit recital = BuildContext.unit("recital-" + number, UnitType.RECITAL, null, t);
        recital.ref = ref;
        recital.sourceId = sourceId;
        recital.recitalNumber = number;
        context.add(recital);
    }
}
