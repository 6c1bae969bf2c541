package com.revisedsimplex;

public enum Sense {
    MAXIMIZE, MINIMIZE;

    /** Multiplier that turns this sense into maximization. */
    double sign() { return this == MAXIMIZE ? 1.0 : -1.0; }
}
