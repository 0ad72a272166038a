package com.greeksync.domain.enums;

/**
 * Call or put. The terminal reports rights as "C"/"P" (sometimes spelled out),
 * and the cache key stores the single-letter code.
 */
public enum OptionRight {
    CALL("C"),
    PUT("P");

    private final String code;

    OptionRight(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static OptionRight fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Option right is required");
        }
        String normalized = value.trim().toUpperCase();
        return switch (normalized) {
            case "C", "CALL" -> CALL;
            case "P", "PUT" -> PUT;
            default -> throw new IllegalArgumentException("Unknown option right: " + value);
        };
    }
}
