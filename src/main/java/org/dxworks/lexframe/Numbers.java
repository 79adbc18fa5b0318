package org.dxworks.lexframe;

import java.util.regex.Pattern;

/**
 * Integer parsing for numbers found in document text. Values that do not fit
 * an {@code int} come back as {@code null} instead of throwing.
 */
public final class Numbers {

    /** Nine significant digits always fit an int. */
    private static final int MAX_DIGITS = 9;
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern OVERSIZED = Pattern.compile("[1-9]\\d{" + MAX_DIGITS + ",}");

    private Numbers() {
    }

    /** A plain digit string as an int; null when absent, not all digits, or too large. */
    public static Integer parse(String digits) {
        if (digits == null || !DIGITS.matcher(digits).matches()) {
            return null;
        }
        String significant = stripLeadingZeros(digits);
        if (significant.length() > MAX_DIGITS) {
            return null;
        }
        return Integer.valueOf(significant);
    }

    /** The leading digit run of a label such as "6a"; null when there is none or it is too large. */
    public static Integer leading(String label) {
        if (label == null) return null;
        int end = 0;
        while (end < label.length() && Character.isDigit(label.charAt(end))) {
            end++;
        }
        return end == 0 ? null : parse(label.substring(0, end));
    }

    /** Whether the text holds a digit run that {@link #parse} would reject as too large. */
    public static boolean hasOversized(CharSequence text) {
        return OVERSIZED.matcher(text).find();
    }

    private static String stripLeadingZeros(String digits) {
        int start = 0;
        while (start < digits.length() - 1 && digits.charAt(start) == '0') {
            start++;
        }
        return digits.substring(start);
    }
}
