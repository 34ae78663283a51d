package com.openforge.meetingmemory.chunk;

/**
 * Clamping rules shared by every score-carrying type.
 *
 * Scores never leave their range, whatever the extraction collaborator or an
 * evidence-strength input hands us. NaN collapses to the lower bound.
 */
public final class Scores {

    public static final double MIN_IMPORTANCE = 1.0;
    public static final double MAX_IMPORTANCE = 10.0;

    private Scores() {
    }

    public static double clampConfidence(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static double clampImportance(double value) {
        if (Double.isNaN(value)) return MIN_IMPORTANCE;
        return Math.max(MIN_IMPORTANCE, Math.min(MAX_IMPORTANCE, value));
    }
}
