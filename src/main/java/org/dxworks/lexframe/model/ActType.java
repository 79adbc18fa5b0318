package org.dxworks.lexframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActType {
    REGULATION("regulation", 'R'),
    DIRECTIVE("directive", 'L'),
    DECISION("decision", 'D');

    private final String name;
    private final char celexSector;

    ActType(String name, char celexSector) {
        this.name = name;
        this.celexSector = celexSector;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    /** Letter used for this act kind inside a CELEX number. */
    public char getCelexSector() {
        return celexSector;
    }

    /** Accepts "Regulation", "regulations", "DIRECTIVE" etc. */
    public static ActType fromWord(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (lower.startsWith("regulation")) return REGULATION;
        if (lower.startsWith("directive")) return DIRECTIVE;
        if (lower.startsWith("decision")) return DECISION;
        throw new IllegalArgumentException("Not an act kind: " + word);
    }
}
