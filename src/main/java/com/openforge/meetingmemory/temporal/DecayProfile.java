package com.openforge.meetingmemory.temporal;

/**
 * How fast belief in a fact fades without reinforcement.
 *
 * Explicit, dated facts decay ten times slower than inferred, vague ones.
 */
public enum DecayProfile {

    /** Implicit references and other inferred beliefs: λ = 0.1 per day. */
    GENERAL(0.1),

    /** Explicit temporal markers with an associated target date: λ = 0.01 per day. */
    DATED(0.01);

    private final double lambdaPerDay;

    DecayProfile(double lambdaPerDay) {
        this.lambdaPerDay = lambdaPerDay;
    }

    public double lambdaPerDay() {
        return lambdaPerDay;
    }
}
