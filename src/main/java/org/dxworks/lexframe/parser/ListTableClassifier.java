package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.LexframeConfig;
import org.dxworks.lexframe.Numbers;
import org.dxworks.lexframe.html.HtmlNode;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dxworks.lexframe.html.HtmlTreeHelper.tableRows;
import static org.dxworks.lexframe.html.HtmlTreeHelper.text;

/**
 * Tells "label | content" list tables apart from data tables.
 */
public class ListTableClassifier {

    private static final Pattern PERCENT_WIDTH = Pattern.compile("^\\s*(\\d+)\\s*%\\s*$");

    private final int maxLabelLength;
    private final int maxLabelColumnPercent;

    public ListTableClassifier(LexframeConfig config) {
        this.maxLabelLength = config.getListTableMaxLabelLength();
        this.maxLabelColumnPercent = config.getListTableMaxLabelColumnPercent();
    }

    public boolean isListTable(HtmlNode table) {
        List<HtmlNode> cols = table.childElements("col");
        if (cols.isEmpty()) {
            HtmlNode colgroup = table.firstChild("colgroup");
            if (colgroup != null) {
                cols = colgroup.childElements("col");
            }
        }
        boolean twoColumns = cols.size() == 2;
        if (twoColumns && labelColumnTooWide(cols.get(0))) {
            return false;
        }

        List<HtmlNode> rows = tableRows(table);
        if (rows.isEmpty()) {
            return false;
        }
        List<HtmlNode> cells = rows.get(0).childElements("td");
        if (!twoColumns && cells.size() != 2) {
            return false;
        }
        if (cells.isEmpty()) {
            return false;
        }
        String label = labelText(cells.get(0));
        return label.length() <= maxLabelLength && LabelNormalizer.normalize(label).isKnown();
    }

    /** Text of the label cell: its first direct paragraph when present, otherwise the whole cell. */
    public static String labelText(HtmlNode cell) {
        HtmlNode p = cell.firstChild("p");
        return text(p != null ? p : cell);
    }

    private boolean labelColumnTooWide(HtmlNode col) {
        Matcher m = PERCENT_WIDTH.matcher(col.attr("width"));
        if (!m.matches()) {
            return false;
        }
        Integer percent = Numbers.parse(m.group(1));
        return percent == null || percent > maxLabelColumnPercent;
    }
}
