package com.interviewpilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coverage of one expected point inside a {@link Verdict}.
 *
 * EXPLAINED means the candidate not only named the point but justified it;
 * both PRESENT and EXPLAINED count as covered.
 */
public enum PointStatus {
    PRESENT,
    EXPLAINED,
    MISSING;

    public boolean covered() {
        return this != MISSING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient parse of the judge's lower-case labels; null for anything unknown. */
    @JsonCreator
    public static PointStatus fromWire(String value) {
        if (value == null) return null;
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "present"   -> PRESENT;
            case "explained" -> EXPLAINED;
            case "missing"   -> MISSING;
            default          -> null;
        };
    }
}
