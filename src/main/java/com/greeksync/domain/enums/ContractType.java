package com.greeksync.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Security type of a held position, as reported by the brokerage terminal's
 * {@code secType} field. Only {@link #OPT} positions carry Greeks.
 */
public enum ContractType {
    STK,
    OPT,
    FUT,
    CASH,
    OTHER;

    /** Maps a raw secType string to a contract type. Unknown or blank values map to OTHER. */
    @JsonCreator
    public static ContractType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return OTHER;
        }
        for (ContractType type : values()) {
            if (type.name().equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        return OTHER;
    }
}
