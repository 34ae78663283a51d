package com.openforge.meetingmemory.temporal;

import com.openforge.meetingmemory.chunk.Scores;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Belief in a single fact or link that decays exponentially with time since it
 * was last reinforced.
 *
 *   current(now) = initial · e^(−λ · days(lastReinforced, now))
 *
 * Created when the fact is first asserted, reinforced whenever corroborating
 * evidence shows up, read at any time. Only {@link #reinforce} mutates it.
 * Values are always inside [0, 1].
 */
public final class TemporalConfidence {

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final DecayProfile profile;
    private double  initialConfidence;
    private Instant lastReinforced;
    private int     reinforcementCount;

    private TemporalConfidence(double initialConfidence, Instant assertedAt, DecayProfile profile) {
        this.initialConfidence = Scores.clampConfidence(initialConfidence);
        this.lastReinforced    = Objects.requireNonNull(assertedAt, "assertedAt");
        this.profile           = Objects.requireNonNull(profile, "profile");
    }

    public static TemporalConfidence assertedAt(double confidence, Instant at, DecayProfile profile) {
        return new TemporalConfidence(confidence, at, profile);
    }

    /**
     * Decayed confidence as of {@code now}. A {@code now} before the last
     * reinforcement counts as zero elapsed time, so belief never grows by itself.
     */
    public double currentConfidence(Instant now) {
        double days = Math.max(0.0, Duration.between(lastReinforced, now).toMillis() / MILLIS_PER_DAY);
        return Scores.clampConfidence(initialConfidence * Math.exp(-profile.lambdaPerDay() * days));
    }

    /**
     * Bumps the belief by {@code evidenceStrength} (capped at 1.0) and restarts the
     * decay clock at {@code now}.
     */
    public void reinforce(double evidenceStrength, Instant now) {
        double strength = Double.isNaN(evidenceStrength) ? 0.0 : evidenceStrength;
        this.initialConfidence = Scores.clampConfidence(Math.min(1.0, initialConfidence + strength));
        this.lastReinforced    = Objects.requireNonNull(now, "now");
        this.reinforcementCount++;
    }

    public void reinforce(double evidenceStrength) {
        reinforce(evidenceStrength, Instant.now());
    }

    public double initialConfidence() {
        return initialConfidence;
    }

    public Instant lastReinforced() {
        return lastReinforced;
    }

    public int reinforcementCount() {
        return reinforcementCount;
    }

    public DecayProfile profile() {
        return profile;
    }

    @Override
    public String toString() {
        return "TemporalConfidence[initial=%.3f, lastReinforced=%s, reinforcements=%d, %s]"
                .formatted(initialConfidence, lastReinforced, reinforcementCount, profile);
    }
}
