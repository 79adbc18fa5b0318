package org.dxworks.lexframe.model;

/** The fixed kinds of legal unit. {@link #NESTED} covers every list-table depth from 3 down. */
public enum UnitKind {
    DOCUMENT_TITLE("document_title"),
    RECITAL("recital"),
    ARTICLE("article"),
    PARAGRAPH("paragraph"),
    SUBPARAGRAPH("subparagraph"),
    INTRO("intro"),
    POINT("point"),
    SUBPOINT("subpoint"),
    SUBSUBPOINT("subsubpoint"),
    NESTED("nested"),
    ANNEX("annex"),
    ANNEX_PART("annex_part"),
    ANNEX_ITEM("annex_item"),
    UNKNOWN("unknown_unit");

    private final String name;

    UnitKind(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
