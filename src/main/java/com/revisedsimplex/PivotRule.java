package com.revisedsimplex;

/**
 * Entering-variable rule. Both rules break leaving-row ties by the lowest
 * basic-variable index.
 */
public enum PivotRule {
    /** Most negative reduced cost, lowest index on ties. */
    DANTZIG,
    /** Lowest-index column with a negative reduced cost. Cannot cycle. */
    BLAND
}
