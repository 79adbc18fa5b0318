package org.dxworks.lexframe.model;

public enum TreatyCode {
    TFEU,
    TEU,
    CHARTER,
    TREATY_GENERIC,
    PROTOCOL
}
