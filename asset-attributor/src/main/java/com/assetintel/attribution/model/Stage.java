package com.assetintel.attribution.model;

/**
 * Lifecycle stage. The store encodes as-built as 0; every other code is
 * treated as proposed or planned work.
 */
public enum Stage {

    AS_BUILT, PROPOSED;

    public static Stage fromCode(Integer code) {
        return code != null && code == 0 ? AS_BUILT : PROPOSED;
    }
}
