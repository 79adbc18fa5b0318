package org.dxworks.lexframe.model;

public enum LabelKind {
    PARAGRAPH,
    NUMERIC,
    SUBPOINT,
    POINT,
    DASH,
    UNKNOWN
}
