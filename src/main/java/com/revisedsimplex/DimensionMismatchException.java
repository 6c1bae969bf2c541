package com.revisedsimplex;

/** A column or vector does not have the number of entries the problem requires. */
public class DimensionMismatchException extends MalformedProblemException {
    private final int expected;
    private final int actual;

    public DimensionMismatchException(String what, int expected, int actual) {
        super(what + ": expected " + expected + " entries, got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() { return expected; }
    public int actual() { return actual; }
}
