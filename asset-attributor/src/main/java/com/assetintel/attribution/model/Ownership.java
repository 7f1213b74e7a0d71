package com.assetintel.attribution.model;

/**
 * OWNEDBY domain of the asset tables: 1 is the operating utility, -2 is private.
 */
public enum Ownership {

    PRIMARY_OPERATOR, PRIVATE, OTHER;

    public static Ownership fromCode(Integer code) {
        if (code == null) return OTHER;
        return switch (code) {
            case 1 -> PRIMARY_OPERATOR;
            case -2 -> PRIVATE;
            default -> OTHER;
        };
    }
}
