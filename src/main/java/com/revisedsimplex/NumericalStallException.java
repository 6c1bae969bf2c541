package com.revisedsimplex;

/**
 * The current solve cannot be trusted: the iteration cap was hit, a basis turned
 * out singular, or the residual stayed above tolerance after re-factorization.
 */
public class NumericalStallException extends LpException {
    private final int iterations;

    public NumericalStallException(String message, int iterations) {
        super(message + " (after " + iterations + " iterations)");
        this.iterations = iterations;
    }

    public NumericalStallException(String message, int iterations, Throwable cause) {
        super(message + " (after " + iterations + " iterations)", cause);
        this.iterations = iterations;
    }

    public int iterations() { return iterations; }
}
