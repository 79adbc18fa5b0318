package org.dxworks.lexframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CitationType {
    INTERNAL("internal"),
    EU_LEGISLATION("eu_legislation");

    private final String name;

    CitationType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
