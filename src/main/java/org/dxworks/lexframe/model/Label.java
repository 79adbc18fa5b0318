package org.dxworks.lexframe.model;

/**
 * Normalized enumeration label: {@code token} is the bare label ("a", "iv", "3", "—"),
 * {@code quoted} is set when the raw label opened with a quotation mark (amending text).
 */
public record Label(String token, LabelKind kind, boolean quoted) {

    public boolean isKnown() {
        return kind != LabelKind.UNKNOWN;
    }
}
