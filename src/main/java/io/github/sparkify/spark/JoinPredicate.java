package io.github.sparkify.spark;

import org.apache.spark.sql.Column;

import java.io.Serializable;

import static org.apache.spark.sql.functions.abs;

/**
 * How a played track length is matched against a catalog song duration.
 *
 * {@link #exact()} compares the two doubles for equality, which is what the songplays
 * join has always done. Durations come from two independent sources and are rounded
 * differently, so exact matching can miss most plays; {@link #tolerant(double)} accepts
 * an absolute difference up to epsilon seconds so the match rate can be measured.
 */
public final class JoinPredicate implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final JoinPredicate EXACT = new JoinPredicate(0.0, true);

    private final double epsilon;
    private final boolean exact;

    private JoinPredicate(double epsilon, boolean exact) {
        this.epsilon = epsilon;
        this.exact = exact;
    }

    public static JoinPredicate exact() {
        return EXACT;
    }

    public static JoinPredicate tolerant(double epsilon) {
        if (Double.isNaN(epsilon) || epsilon < 0) {
            throw new IllegalArgumentException("Epsilon must be a non-negative number: " + epsilon);
        }
        return new JoinPredicate(epsilon, false);
    }

    public boolean isExact() {
        return exact;
    }

    public double getEpsilon() {
        return epsilon;
    }

    /**
     * Build the duration half of the join condition.
     */
    public Column matches(Column playedLength, Column songDuration) {
        if (exact) {
            return playedLength.equalTo(songDuration);
        }
        return abs(playedLength.minus(songDuration)).leq(epsilon);
    }

    @Override
    public String toString() {
        return exact ? "exact" : "tolerant(" + epsilon + ")";
    }
}
