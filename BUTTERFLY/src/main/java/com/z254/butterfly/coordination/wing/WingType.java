package com.z254.butterfly.coordination.wing;

/**
 * The two reactive wings.
 */
public enum WingType {
    /** Network evolution wing */
    NETWORK("network"),
    /** Violation-pressure wing */
    PRESSURE("pressure");

    private final String tag;

    WingType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static WingType fromTag(String value) {
        for (WingType wing : values()) {
            if (wing.tag.equalsIgnoreCase(value) || wing.name().equalsIgnoreCase(value)) {
                return wing;
            }
        }
        throw new IllegalArgumentException("Unknown wing: " + value);
    }
}
