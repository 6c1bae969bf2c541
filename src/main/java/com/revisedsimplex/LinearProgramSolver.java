package com.revisedsimplex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point of the library.
 *
 * <pre>
 *   LinearProgramSolver solver = new LinearProgramSolver();
 *   SolvedState st = solver.solve(problem);                 // cold solve
 *   WarmStartReport r = solver.addVariable(st, column, c);  // re-optimize from st's basis
 * </pre>
 *
 * Cold solves and warm starts are separate calls so their pivot counts can be
 * compared. A solver holds only its options and may be shared; a
 * {@link SolvedState} may not.
 */
public final class LinearProgramSolver {
    private static final Logger LOG = LoggerFactory.getLogger(LinearProgramSolver.class);

    private final SolverOptions options;
    private final SimplexEngine engine;

    public LinearProgramSolver() { this(SolverOptions.defaults()); }

    public LinearProgramSolver(SolverOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.engine = new SimplexEngine(options);
    }

    public SolverOptions options() { return options; }

    /**
     * Equality form of {@code problem}.
     *
     * @throws MalformedProblemException on an undefined variable reference or a non-finite coefficient
     */
    public StandardForm standardize(Problem problem) {
        return Standardizer.standardize(Objects.requireNonNull(problem, "problem"));
    }

    /**
     * Equality form of a dense problem {@code max|min c·x, A x (rel) b, x >= 0}.
     *
     * @throws MalformedProblemException if the dimensions of {@code A}, {@code b}, {@code c} disagree
     */
    public StandardForm standardize(double[][] A, Relation[] relations, double[] b, double[] c, Sense sense) {
        return Standardizer.standardize(A, relations, b, c, sense);
    }

    public SolvedState solve(Problem problem) { return solve(standardize(problem)); }

    /**
     * Solves from the slack/artificial basis. The returned state owns a private
     * copy of {@code form}.
     *
     * @throws NumericalStallException if the iteration cap is hit or the basis cannot be kept accurate
     */
    public SolvedState solve(StandardForm form) {
        return engine.solve(Objects.requireNonNull(form, "form").copy());
    }

    /**
     * Adds a variable to an optimal state. {@code column[i]} is its coefficient in
     * original constraint i and {@code objCoeff} its objective coefficient, both in
     * the problem's own orientation and sense.
     *
     * <p>The column is priced against the existing basis. When its reduced cost is
     * not negative the state is left untouched and the report says
     * {@code NOT_BENEFICIAL}. Otherwise the column is appended and simplex resumes
     * from the current basis with the new variable entering first.
     *
     * <p>If the resumed run throws {@link NumericalStallException}, {@code state}
     * keeps the appended column and is left {@code RUNNING}, so it is rejected by
     * further calls. Take a {@link SolvedState#copy()} first to be able to roll back.
     *
     * @throws InvalidStateException if {@code state} is not optimal
     * @throws DimensionMismatchException if {@code column} does not have one entry per original constraint
     * @throws NumericalStallException if the resumed run hits the iteration cap or loses accuracy
     */
    public WarmStartReport addVariable(SolvedState state, double[] column, double objCoeff) {
        requireOptimal(state, "addVariable");
        if (!Double.isFinite(objCoeff)) throw new MalformedProblemException("Non-finite objective coefficient");
        StandardForm sf = state.form();
        double[] a = sf.standardizeColumn(column);
        double cost = sf.standardizeCost(objCoeff);

        double r = Pricer.reducedCost(state.prices(), a, cost);
        if (r >= -options.pricingTolerance) {
            LOG.debug("New column has reduced cost {}; not entering", r);
            return new WarmStartReport(WarmStartReport.Outcome.NOT_BENEFICIAL, r, -1,
                    state.solution(), state.objective(), 0);
        }

        int j = sf.appendStructural(a, cost);
        int variable = sf.source(j);
        LOG.debug("New column {} (x{}) has reduced cost {}; resuming from basis", j, variable, r);
        int pivots = engine.resume(state, j);

        WarmStartReport.Outcome outcome = state.status() == LPStatus.OPTIMAL
                ? WarmStartReport.Outcome.OPTIMAL : WarmStartReport.Outcome.UNBOUNDED;
        return new WarmStartReport(outcome, r, variable, state.solution(), state.objective(), pivots);
    }

    /**
     * Reduced cost of standard-form column {@code column} at the state's basis,
     * maximization convention.
     */
    public double reducedCost(SolvedState state, int column) {
        requireOptimal(state, "reducedCost");
        return state.reducedCost(column);
    }

    /** Reduced cost a new column would have against the state's basis, without adding it. */
    public double reducedCost(SolvedState state, double[] column, double objCoeff) {
        requireOptimal(state, "reducedCost");
        StandardForm sf = state.form();
        return Pricer.reducedCost(state.prices(), sf.standardizeColumn(column), sf.standardizeCost(objCoeff));
    }

    private static void requireOptimal(SolvedState state, String op) {
        Objects.requireNonNull(state, "state");
        if (state.status() != LPStatus.OPTIMAL) {
            throw new InvalidStateException(op + " requires an OPTIMAL state, found " + state.status());
        }
    }
}
