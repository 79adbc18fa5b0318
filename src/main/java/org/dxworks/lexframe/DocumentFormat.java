package org.dxworks.lexframe;

import com.fasterxml.jackson.annotation.JsonValue;

/** The two supported markup dialects of EUR-Lex pages. */
public enum DocumentFormat {
    OJ("oj"),
    CONSOLIDATED("consolidated");

    private final String name;

    DocumentFormat(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
