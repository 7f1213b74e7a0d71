package com.assetintel.attribution.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum WaterType {

    SANITARY("SS"),
    COMBINED("CB"),
    STORM("SW"),
    UNKNOWN("");

    private final String code;

    public static WaterType fromCode(String code) {
        if (code == null) return UNKNOWN;
        String trimmed = code.trim().toUpperCase();
        for (WaterType type : values()) {
            if (type != UNKNOWN && type.code.equals(trimmed)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
