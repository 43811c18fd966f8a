package com.example.calendarmcp.conflict;

public record DuplicateThresholds(double warning, double blocking) {
    public static final DuplicateThresholds DEFAULTS = new DuplicateThresholds(0.7, 0.95);

    public DuplicateThresholds {
        if (warning < 0 || warning > 1 || blocking < 0 || blocking > 1) {
            throw new IllegalArgumentException("Duplicate thresholds must be within [0, 1]");
        }
        if (blocking < warning) {
            throw new IllegalArgumentException("Blocking threshold must not be below the warning threshold");
        }
    }

    public boolean isBlocking(double similarity) {
        return similarity >= blocking;
    }
}
