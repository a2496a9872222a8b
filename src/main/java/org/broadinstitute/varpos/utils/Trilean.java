package org.broadinstitute.varpos.utils;

/**
 * An enumeration to represent true, false, or unknown.
 */
public enum Trilean {
    TRUE, FALSE, UNKNOWN;

    public static Trilean of (final boolean booleanValue) {
        return booleanValue ? Trilean.TRUE : Trilean.FALSE;
    }

    /**
     * Three-valued conjunction: {@code FALSE} wins over {@code UNKNOWN}, which wins over {@code TRUE}.
     */
    public Trilean and(final Trilean other) {
        if (this == FALSE || other == FALSE) {
            return FALSE;
        }
        return this == UNKNOWN || other == UNKNOWN ? UNKNOWN : TRUE;
    }
}
