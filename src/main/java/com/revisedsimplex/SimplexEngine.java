package com.revisedsimplex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Two-phase primal revised simplex over a {@link StandardForm}.
 *
 * <p>Each iteration prices the non-basic columns against {@code y = c_B^T B^-1},
 * picks the entering column by the configured {@link PivotRule}, runs the ratio
 * test on {@code d = B^-1 A_q} (ties to the lowest basic column index) and
 * updates the basis inverse in product form. After every pivot the residual
 * {@code ||B x_B - b||} is checked; if it drifts above tolerance the inverse is
 * recomputed, and if that does not help the solve fails with
 * {@link NumericalStallException}.
 */
final class SimplexEngine {
    private static final Logger LOG = LoggerFactory.getLogger(SimplexEngine.class);

    // relative rounding allowed on the Phase I artificial sum
    static final double ROUNDING_SCALE = 1e-12;

    private final SolverOptions opts;

    SimplexEngine(SolverOptions opts) { this.opts = opts; }

    /** Cold solve from the slack/artificial basis. */
    SolvedState solve(StandardForm sf) {
        BasisState basis;
        try {
            basis = BasisState.initial(sf);
        } catch (ArithmeticException e) {
            throw new NumericalStallException("Initial basis is singular", 0, e);
        }
        SolvedState st = new SolvedState(sf, basis, opts.feasibilityTolerance);

        try (Pricer pricer = new Pricer(opts.pricingThreads)) {
            Run run = new Run(st, pricer);
            if (sf.needsPhaseOne()) {
                LOG.debug("Phase I: {} rows, {} columns", sf.m(), sf.n());
                double[] phaseOneCost = phaseOneCosts(sf);
                run.iterate(PivotRecord.Phase.PHASE_ONE, phaseOneCost, -1);

                double w = 0.0;
                for (int i = 0; i < sf.m(); i++) {
                    if (sf.isArtificial(basis.basicAt(i))) w += Math.max(basis.basicValue(i), 0.0);
                }
                st.setInfeasibility(w, basis.priceVector(phaseOneCost));
                double limit = phaseOneLimit(run.bScale);
                if (w > limit) {
                    st.setStatus(LPStatus.INFEASIBLE);
                    LOG.debug("Phase I ended with artificial sum {} above {}: infeasible after {} pivots",
                            w, limit, run.iterations);
                    return st;
                }
                if (!run.driveOutArtificials(limit)) {
                    st.setStatus(LPStatus.INFEASIBLE);
                    return st;
                }
            }

            LOG.debug("Phase II from basis {}", Arrays.toString(basis.basicColumns()));
            st.setStatus(run.iterate(PivotRecord.Phase.PHASE_TWO, sf.costs(), -1));
            LOG.debug("Solve finished: {} objective={} {}", st.status(), st.internalObjective(), st.stats());
        }
        return st;
    }

    /**
     * Continues Phase II on an existing state, with {@code entering} forced into
     * the basis on the first pivot. Returns the number of pivots performed.
     */
    int resume(SolvedState st, int entering) {
        int before = st.stats().warmStartPivots;
        st.setStatus(LPStatus.RUNNING);
        try (Pricer pricer = new Pricer(opts.pricingThreads)) {
            Run run = new Run(st, pricer);
            st.setStatus(run.iterate(PivotRecord.Phase.WARM_START, st.form().costs(), entering));
        }
        int pivots = st.stats().warmStartPivots - before;
        LOG.debug("Warm start finished: {} objective={} after {} pivots", st.status(), st.internalObjective(), pivots);
        return pivots;
    }

    /**
     * Largest artificial sum still accepted as feasible: the absolute feasibility
     * tolerance plus a rounding allowance of {@link #ROUNDING_SCALE} per unit of
     * {@code 1 + ||b||}.
     */
    double phaseOneLimit(double bScale) {
        return opts.feasibilityTolerance + ROUNDING_SCALE * bScale;
    }

    static double[] phaseOneCosts(StandardForm sf) {
        double[] c = new double[sf.n()];
        for (int j = 0; j < c.length; j++) if (sf.isArtificial(j)) c[j] = -1.0;
        return c;
    }

    /** Mutable bookkeeping of one solve or resume call. */
    private final class Run {
        final SolvedState st;
        final StandardForm sf;
        final BasisState basis;
        final SolveStats stats;
        final Pricer pricer;
        final double bScale;
        int iterations;

        Run(SolvedState st, Pricer pricer) {
            this.st = st;
            this.sf = st.form();
            this.basis = st.basisState();
            this.stats = st.stats();
            this.pricer = pricer;
            this.bScale = 1.0 + DenseAlgebra.normInf(sf.rhsView());
            basis.ensureColumns(sf.n());
        }

        LPStatus iterate(PivotRecord.Phase phase, double[] cost, int forced) {
            PivotRule rule = opts.pivotRule;
            int degenerateStreak = 0;
            double objective = objectiveOf(cost);

            while (true) {
                double[] y = basis.priceVector(cost);

                int enter;
                double rc;
                if (forced >= 0) {
                    enter = forced;
                    rc = Pricer.reducedCost(y, sf.column(enter), cost[enter]);
                    forced = -1;
                } else {
                    enter = pricer.choose(sf, basis, y, cost, rule, opts.pricingTolerance);
                    rc = pricer.chosenReducedCost();
                }
                if (enter < 0) return LPStatus.OPTIMAL;

                double[] d = basis.direction(sf.column(enter));
                int row = ratioTest(phase, d);
                if (row < 0) {
                    double[] ray = new double[sf.n()];
                    ray[enter] = 1.0;
                    for (int i = 0; i < sf.m(); i++) ray[basis.basicAt(i)] = -d[i];
                    st.setUnbounded(enter, ray);
                    LOG.debug("{}: column {} has no blocking row, unbounded", phase, enter);
                    return LPStatus.UNBOUNDED;
                }

                if (iterations >= opts.maxIterations) {
                    throw new NumericalStallException("Iteration limit " + opts.maxIterations + " reached in " + phase,
                            iterations);
                }
                int leaving = basis.basicAt(row);
                if (basis.basicValue(row) < 0.0 || d[row] < 0.0) basis.clearBasicValue(row);
                double theta = basis.basicValue(row) / d[row];
                basis.pivot(row, enter, d);
                iterations++;
                count(phase);
                objective -= rc * theta;
                st.pivotLog().add(new PivotRecord(phase, enter, leaving, row, theta, rc));
                if (LOG.isTraceEnabled()) {
                    LOG.trace("{} #{}: enter={} leave={} row={} r={} theta={} z={}",
                            phase, iterations, enter, leaving, row, rc, theta, objective);
                }

                if (theta <= opts.feasibilityTolerance) {
                    stats.degeneratePivots++;
                    degenerateStreak++;
                    if (rule == PivotRule.DANTZIG && opts.degeneratePivotLimit > 0
                            && degenerateStreak >= opts.degeneratePivotLimit) {
                        rule = PivotRule.BLAND;
                        stats.ruleSwitches++;
                        LOG.warn("{} degenerate pivots in a row, switching to Bland's rule", degenerateStreak);
                    }
                } else {
                    degenerateStreak = 0;
                }
                checkNumerics();
            }
        }

        /**
         * Leaving row for direction {@code d}: minimum {@code x_B[i] / d[i]} over
         * {@code d[i] > 0}, ties to the lowest basic column index. Outside Phase I a
         * basic artificial sits at zero, so any nonzero {@code d[i]} blocks it at ratio 0.
         */
        int ratioTest(PivotRecord.Phase phase, double[] d) {
            int best = -1;
            double bestRatio = Double.POSITIVE_INFINITY;
            for (int i = 0; i < d.length; i++) {
                int col = basis.basicAt(i);
                double ratio;
                if (phase != PivotRecord.Phase.PHASE_ONE && sf.isArtificial(col)) {
                    if (Math.abs(d[i]) <= opts.pivotTolerance) continue;
                    ratio = 0.0;
                } else {
                    if (d[i] <= opts.pivotTolerance) continue;
                    ratio = Math.max(basis.basicValue(i), 0.0) / d[i];
                }
                double tie = opts.pivotTolerance * Math.max(1.0, Math.abs(bestRatio));
                if (best < 0 || ratio < bestRatio - tie
                        || (ratio <= bestRatio + tie && col < basis.basicAt(best))) {
                    best = i;
                    bestRatio = ratio;
                }
            }
            return best;
        }

        /**
         * Pivots zero-level artificials out of the basis on the lowest-index
         * non-artificial column with a nonzero entry in their row. Rows with no
         * such column are redundant and keep their artificial at zero.
         *
         * @return false if an artificial is above {@code limit} or a basic value
         *         ends up below {@code -limit}; the problem is then infeasible
         */
        boolean driveOutArtificials(double limit) {
            for (int row = 0; row < sf.m(); row++) {
                int art = basis.basicAt(row);
                if (!sf.isArtificial(art)) continue;
                if (basis.basicValue(row) > limit) {
                    LOG.debug("Artificial column {} is still at {} in row {}", art, basis.basicValue(row), row);
                    return false;
                }

                int enter = -1;
                for (int j = 0; j < sf.n(); j++) {
                    if (basis.isBasic(j) || sf.isArtificial(j)) continue;
                    if (Math.abs(basis.tableauEntry(row, sf.column(j))) > opts.pivotTolerance) {
                        enter = j;
                        break;
                    }
                }
                if (enter < 0) {
                    stats.redundantRows++;
                    LOG.debug("Row {} is redundant; artificial column {} stays basic at zero", row, art);
                    continue;
                }
                double[] d = basis.direction(sf.column(enter));
                basis.clearBasicValue(row);
                basis.pivot(row, enter, d);
                iterations++;
                stats.phaseOnePivots++;
                stats.artificialsDrivenOut++;
                st.pivotLog().add(new PivotRecord(PivotRecord.Phase.PHASE_ONE, enter, art, row, 0.0, 0.0));
                checkNumerics();
            }
            for (int row = 0; row < sf.m(); row++) {
                if (basis.basicValue(row) < -limit) {
                    LOG.debug("Basic column {} is at {} after removing artificials", basis.basicAt(row),
                            basis.basicValue(row));
                    return false;
                }
            }
            return true;
        }

        private void count(PivotRecord.Phase phase) {
            switch (phase) {
                case PHASE_ONE: stats.phaseOnePivots++; break;
                case PHASE_TWO: stats.phaseTwoPivots++; break;
                default: stats.warmStartPivots++; break;
            }
        }

        private double objectiveOf(double[] cost) {
            double z = 0.0;
            for (int i = 0; i < basis.size(); i++) z += cost[basis.basicAt(i)] * basis.basicValue(i);
            return z;
        }

        private void checkNumerics() {
            if (opts.refactorInterval > 0 && basis.pivotsSinceRefactor() >= opts.refactorInterval) {
                refactor();
            }
            double residual = basis.residual(sf);
            double limit = opts.residualTolerance * bScale;
            if (residual > limit) {
                LOG.warn("Residual {} above {} after {} pivots, recomputing basis inverse", residual, limit, iterations);
                refactor();
                stats.residualRefactorizations++;
                residual = basis.residual(sf);
                if (residual > limit) {
                    throw new NumericalStallException("Residual " + residual
                            + " still above tolerance after refactorization", iterations);
                }
            }
        }

        private void refactor() {
            try {
                basis.refactor(sf);
            } catch (ArithmeticException e) {
                throw new NumericalStallException("Basis " + Arrays.toString(basis.basicColumns()) + " is singular",
                        iterations, e);
            }
            stats.refactorizations++;
        }
    }
}
