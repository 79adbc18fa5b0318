package org.dxworks.lexframe.citation;

import org.dxworks.lexframe.Numbers;
import org.dxworks.lexframe.model.ActType;
import org.dxworks.lexframe.model.Citation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Act numbers as written in EU texts ("(EU) No 1093/2010", "2014/65/EU",
 * "91/250/EEC") and their CELEX identifiers.
 */
public final class ActReferences {

    static final String ACT_PREFIX = "(?:\\((?:EU|EC|EEC|Euratom)(?:\\s*,\\s*Euratom)?\\)\\s+)?(?:No\\s+)?";
    static final String ACT_NUMBER = "\\d{1,4}/\\d+(?:/(?:EU|EC|EEC|JHA|CFSP|Euratom))?\\b";

    private static final Pattern ACT_ITEM = Pattern.compile(
            ACT_PREFIX + "(?<p1>\\d{1,4})/(?<p2>\\d+)(?:/(?<suffix>EU|EC|EEC|JHA|CFSP|Euratom))?\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Set<String> NO_CELEX_SUFFIXES = Set.of("JHA", "CFSP");

    /** One act number inside a citation match. */
    public record ActRef(int start, int end, ActType type, String number, Integer year, String celex) {

        void applyTo(Citation citation) {
            citation.actType = type;
            citation.actNumber = number;
            citation.actYear = year;
            citation.celex = celex;
        }
    }

    private ActReferences() {
    }

    /** Every act number between {@code start} and {@code end}, in text order. */
    public static List<ActRef> parse(String text, int start, int end, ActType type) {
        List<ActRef> acts = new ArrayList<>();
        Matcher matcher = ACT_ITEM.matcher(text);
        matcher.region(start, end);
        while (matcher.find()) {
            acts.add(toRef(matcher, type));
        }
        return acts;
    }

    private static ActRef toRef(Matcher matcher, ActType type) {
        String part1 = matcher.group("p1");
        String part2 = matcher.group("p2");
        String suffix = matcher.group("suffix");

        Integer value1 = Numbers.parse(part1);
        Integer value2 = Numbers.parse(part2);
        int[] yearNumber = value1 == null || value2 == null ? null : yearAndNumber(value1, value2);
        Integer year = yearNumber == null ? null : yearNumber[0];
        String celex = null;
        if (yearNumber != null && (suffix == null || !NO_CELEX_SUFFIXES.contains(suffix.toUpperCase(Locale.ROOT)))) {
            celex = celex(type, yearNumber[0], yearNumber[1]);
        }
        return new ActRef(matcher.start(), matcher.end(), type, part1 + "/" + part2, year, celex);
    }

    /**
     * Decides which half of "p1/p2" is the year. A value in 1900..2100 wins,
     * two-digit years are read as 19xx. Returns {year, number} or null.
     */
    public static int[] yearAndNumber(int p1, int p2) {
        if (p1 > 1900 && p1 <= 2100) {
            return new int[]{p1, p2};
        }
        if (p2 > 1900 && p2 <= 2100) {
            return new int[]{p2, p1};
        }
        if (p1 < 100 && p2 < 1000) {
            return new int[]{1900 + p1, p2};
        }
        if (p2 < 100 && p1 >= 100) {
            return new int[]{1900 + p2, p1};
        }
        if (p1 >= 1000 && p2 < 1000) {
            return new int[]{p1, p2};
        }
        return null;
    }

    public static String celex(ActType type, int year, int number) {
        return String.format("3%04d%c%04d", year, type.getCelexSector(), number);
    }
}
