package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.model.Label;
import org.dxworks.lexframe.model.LabelKind;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies enumeration labels such as "1.", "(a)", "(iii)" or "—".
 * Roman numerals are tried before letters, so "(i)" is always a subpoint.
 */
public class LabelNormalizer {

    private static final Pattern PARAGRAPH_NUMBER = Pattern.compile("^(\\d+)\\.\\s*");
    private static final Pattern NUMERIC = Pattern.compile("^\\(?(\\d+)\\)?[.)]?$");
    private static final Pattern ROMAN = Pattern.compile(
            "^\\(?("
                    + "i{1,3}|iv|v|vi{0,3}|ix|"
                    + "x{1,3}|xi{0,3}|xiv|xv|xvi{0,3}|xix|"
                    + "xxi{0,3}|xxiv|xxv|xxvi{0,3}|xxix|"
                    + "xxxi{0,3}|xxxiv|xxxv|xxxvi{0,3}|xxxix"
                    + ")\\)?$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LETTER = Pattern.compile("^\\(?([a-z]{1,2})\\)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DASH = Pattern.compile("^[—–-]$");
    private static final String QUOTES = "'\"‘’“«";

    private LabelNormalizer() {
    }

    public static Label normalize(String raw) {
        String label = raw == null ? "" : raw.strip();
        boolean quoted = false;
        if (!label.isEmpty() && QUOTES.indexOf(label.charAt(0)) >= 0) {
            quoted = true;
            label = label.substring(1).strip();
        }

        Matcher m = PARAGRAPH_NUMBER.matcher(label);
        if (m.find() && label.indexOf('(') < 0) {
            return new Label(m.group(1), LabelKind.PARAGRAPH, quoted);
        }
        m = NUMERIC.matcher(label);
        if (m.matches()) {
            return new Label(m.group(1), LabelKind.NUMERIC, quoted);
        }
        m = ROMAN.matcher(label);
        if (m.matches()) {
            return new Label(m.group(1).toLowerCase(Locale.ROOT), LabelKind.SUBPOINT, quoted);
        }
        m = LETTER.matcher(label);
        if (m.matches()) {
            return new Label(m.group(1).toLowerCase(Locale.ROOT), LabelKind.POINT, quoted);
        }
        if (DASH.matcher(label).matches()) {
            return new Label("—", LabelKind.DASH, quoted);
        }
        return new Label(label, LabelKind.UNKNOWN, quoted);
    }
}
