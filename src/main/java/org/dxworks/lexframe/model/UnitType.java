package org.dxworks.lexframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.dxworks.lexframe.Numbers;

import java.util.Objects;

/**
 * Type of a legal unit: a {@link UnitKind} plus, for nested points, the
 * list-table depth they were found at. Serialized as the kind name, or as
 * {@code nested_N} for nested points.
 */
public final class UnitType {

    public static final UnitType DOCUMENT_TITLE = new UnitType(UnitKind.DOCUMENT_TITLE, 0);
    public static final UnitType RECITAL = new UnitType(UnitKind.RECITAL, 0);
    public static final UnitType ARTICLE = new UnitType(UnitKind.ARTICLE, 0);
    public static final UnitType PARAGRAPH = new UnitType(UnitKind.PARAGRAPH, 0);
    public static final UnitType SUBPARAGRAPH = new UnitType(UnitKind.SUBPARAGRAPH, 0);
    public static final UnitType INTRO = new UnitType(UnitKind.INTRO, 0);
    public static final UnitType POINT = new UnitType(UnitKind.POINT, 0);
    public static final UnitType SUBPOINT = new UnitType(UnitKind.SUBPOINT, 1);
    public static final UnitType SUBSUBPOINT = new UnitType(UnitKind.SUBSUBPOINT, 2);
    public static final UnitType ANNEX = new UnitType(UnitKind.ANNEX, 0);
    public static final UnitType ANNEX_PART = new UnitType(UnitKind.ANNEX_PART, 0);
    public static final UnitType ANNEX_ITEM = new UnitType(UnitKind.ANNEX_ITEM, 0);
    public static final UnitType UNKNOWN = new UnitType(UnitKind.UNKNOWN, 0);

    private static final int FIRST_NESTED_DEPTH = 3;
    private static final String NESTED_PREFIX = UnitKind.NESTED.getName() + "_";

    private final UnitKind kind;
    private final int depth;

    private UnitType(UnitKind kind, int depth) {
        this.kind = kind;
        this.depth = depth;
    }

    public static UnitType of(UnitKind kind) {
        return switch (kind) {
            case DOCUMENT_TITLE -> DOCUMENT_TITLE;
            case RECITAL -> RECITAL;
            case ARTICLE -> ARTICLE;
            case PARAGRAPH -> PARAGRAPH;
            case SUBPARAGRAPH -> SUBPARAGRAPH;
            case INTRO -> INTRO;
            case POINT -> POINT;
            case SUBPOINT -> SUBPOINT;
            case SUBSUBPOINT -> SUBSUBPOINT;
            case NESTED -> nested(FIRST_NESTED_DEPTH);
            case ANNEX -> ANNEX;
            case ANNEX_PART -> ANNEX_PART;
            case ANNEX_ITEM -> ANNEX_ITEM;
            case UNKNOWN -> UNKNOWN;
        };
    }

    public static UnitType nested(int depth) {
        if (depth < FIRST_NESTED_DEPTH) {
            throw new IllegalArgumentException("nested units start at depth " + FIRST_NESTED_DEPTH + ", got " + depth);
        }
        return new UnitType(UnitKind.NESTED, depth);
    }

    /** Point-like type for a list-table row at the given depth. */
    public static UnitType pointAtDepth(int depth) {
        return switch (depth) {
            case 0 -> POINT;
            case 1 -> SUBPOINT;
            case 2 -> SUBSUBPOINT;
            default -> nested(depth);
        };
    }

    @JsonCreator
    public static UnitType fromName(String name) {
        for (UnitKind kind : UnitKind.values()) {
            if (kind != UnitKind.NESTED && kind.getName().equals(name)) {
                return of(kind);
            }
        }
        if (name != null && name.startsWith(NESTED_PREFIX)) {
            Integer depth = Numbers.parse(name.substring(NESTED_PREFIX.length()));
            if (depth != null && depth >= FIRST_NESTED_DEPTH) {
                return nested(depth);
            }
        }
        throw new IllegalArgumentException("Unknown unit type: " + name);
    }

    @JsonValue
    public String getName() {
        return kind == UnitKind.NESTED ? NESTED_PREFIX + depth : kind.getName();
    }

    public UnitKind getKind() {
        return kind;
    }

    public boolean isNested() {
        return kind == UnitKind.NESTED;
    }

    public int getDepth() {
        return depth;
    }

    /** Whether the type is a point row of a list table at any depth. */
    public boolean isPointLike() {
        return switch (kind) {
            case POINT, SUBPOINT, SUBSUBPOINT, NESTED -> true;
            case DOCUMENT_TITLE, RECITAL, ARTICLE, PARAGRAPH, SUBPARAGRAPH, INTRO,
                    ANNEX, ANNEX_PART, ANNEX_ITEM, UNKNOWN -> false;
        };
    }

    /** Type a non-list table row takes when it is split under a unit of this type. */
    public UnitType childForTableContent() {
        return switch (kind) {
            case PARAGRAPH -> SUBPARAGRAPH;
            case SUBPARAGRAPH, ARTICLE -> POINT;
            case POINT, ANNEX_ITEM -> SUBPOINT;
            case SUBPOINT -> SUBSUBPOINT;
            case SUBSUBPOINT -> nested(FIRST_NESTED_DEPTH);
            case NESTED -> nested(depth + 1);
            case DOCUMENT_TITLE, RECITAL, INTRO, ANNEX, ANNEX_PART, UNKNOWN -> SUBPARAGRAPH;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnitType other)) return false;
        return kind == other.kind && depth == other.depth;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, depth);
    }

    @Override
    public String toString() {
        return getName();
    }
}
