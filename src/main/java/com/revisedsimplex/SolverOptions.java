package com.revisedsimplex;

import java.util.Objects;

/** Immutable solver settings. */
public final class SolverOptions {
    public final PivotRule pivotRule;
    public final int maxIterations;          // pivots across both phases
    public final double pricingTolerance;    // r_j < -tol is improving
    public final double pivotTolerance;      // d_i > tol may block the ratio test
    public final double feasibilityTolerance;// Phase I residual and reported zeros
    public final double residualTolerance;   // ||B x_B - b|| bound, scaled by 1 + ||b||
    public final int refactorInterval;       // pivots between exact refactorizations, 0 = never
    public final int degeneratePivotLimit;   // consecutive degenerate pivots before switching to Bland, 0 = never
    public final int pricingThreads;         // > 1 prices columns in parallel

    private SolverOptions(Builder b) {
        this.pivotRule = b.pivotRule;
        this.maxIterations = b.maxIterations;
        this.pricingTolerance = b.pricingTolerance;
        this.pivotTolerance = b.pivotTolerance;
        this.feasibilityTolerance = b.feasibilityTolerance;
        this.residualTolerance = b.residualTolerance;
        this.refactorInterval = b.refactorInterval;
        this.degeneratePivotLimit = b.degeneratePivotLimit;
        this.pricingThreads = b.pricingThreads;
    }

    public static SolverOptions defaults() { return new Builder().build(); }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .pivotRule(pivotRule)
                .maxIterations(maxIterations)
                .pricingTolerance(pricingTolerance)
                .pivotTolerance(pivotTolerance)
                .feasibilityTolerance(feasibilityTolerance)
                .residualTolerance(residualTolerance)
                .refactorInterval(refactorInterval)
                .degeneratePivotLimit(degeneratePivotLimit)
                .pricingThreads(pricingThreads);
    }

    @Override
    public String toString() {
        return "SolverOptions{rule=" + pivotRule + " maxIterations=" + maxIterations
                + " pricingTol=" + pricingTolerance + " pivotTol=" + pivotTolerance
                + " feasTol=" + feasibilityTolerance + " residualTol=" + residualTolerance
                + " refactorInterval=" + refactorInterval + " degenerateLimit=" + degeneratePivotLimit
                + " threads=" + pricingThreads + "}";
    }

    public static final class Builder {
        private PivotRule pivotRule = PivotRule.DANTZIG;
        private int maxIterations = 50_000;
        private double pricingTolerance = 1e-9;
        private double pivotTolerance = 1e-9;
        private double feasibilityTolerance = 1e-7;
        private double residualTolerance = 1e-8;
        private int refactorInterval = 100;
        private int degeneratePivotLimit = 50;
        private int pricingThreads = 1;

        public Builder pivotRule(PivotRule r){ this.pivotRule = Objects.requireNonNull(r); return this; }
        public Builder maxIterations(int v){ this.maxIterations = positive("maxIterations", v); return this; }
        public Builder pricingTolerance(double v){ this.pricingTolerance = tolerance("pricingTolerance", v); return this; }
        public Builder pivotTolerance(double v){ this.pivotTolerance = tolerance("pivotTolerance", v); return this; }
        public Builder feasibilityTolerance(double v){ this.feasibilityTolerance = tolerance("feasibilityTolerance", v); return this; }
        public Builder residualTolerance(double v){ this.residualTolerance = tolerance("residualTolerance", v); return this; }
        public Builder refactorInterval(int v){ this.refactorInterval = nonNegative("refactorInterval", v); return this; }
        public Builder degeneratePivotLimit(int v){ this.degeneratePivotLimit = nonNegative("degeneratePivotLimit", v); return this; }
        public Builder pricingThreads(int v){ this.pricingThreads = positive("pricingThreads", v); return this; }
        public SolverOptions build(){ return new SolverOptions(this); }

        private static int positive(String name, int v) {
            if (v <= 0) throw new IllegalArgumentException(name + " must be positive: " + v);
            return v;
        }
        private static int nonNegative(String name, int v) {
            if (v < 0) throw new IllegalArgumentException(name + " must be >= 0: " + v);
            return v;
        }
        private static double tolerance(String name, double v) {
            if (!(v >= 0.0) || Double.isInfinite(v)) throw new IllegalArgumentException(name + " must be finite and >= 0: " + v);
            return v;
        }
    }
}
