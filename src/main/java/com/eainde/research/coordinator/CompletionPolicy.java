package com.eainde.research.coordinator;

/**
 * Decides whether the Research stage produced enough sections to build a
 * report. At least one section must always succeed.
 */
public final class CompletionPolicy {

    private static final double EPSILON = 1e-9;

    private final double minSuccessFraction;

    private CompletionPolicy(double minSuccessFraction) {
        if (minSuccessFraction <= 0.0 || minSuccessFraction > 1.0) {
            throw new IllegalArgumentException("minSuccessFraction must be in (0, 1], was " + minSuccessFraction);
        }
        this.minSuccessFraction = minSuccessFraction;
    }

    /** Every planned section must succeed. */
    public static CompletionPolicy allSections() {
        return new CompletionPolicy(1.0);
    }

    public static CompletionPolicy atLeast(double minSuccessFraction) {
        return new CompletionPolicy(minSuccessFraction);
    }

    public double getMinSuccessFraction() {
        return minSuccessFraction;
    }

    public boolean accepts(int succeeded, int planned) {
        if (planned <= 0 || succeeded <= 0) {
            return false;
        }
        return (double) succeeded / planned + EPSILON >= minSuccessFraction;
    }

    @Override
    public String toString() {
        return minSuccessFraction >= 1.0 ? "all sections" : "at least " + minSuccessFraction + " of sections";
    }
}
