package com.revisedsimplex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Terminal state of a solve: the standard form it ran on, the final basis, the
 * status, and the certificates. An {@link LPStatus#OPTIMAL} state is the entry
 * point for {@link LinearProgramSolver#addVariable}, which mutates it in place.
 *
 * <p>Not thread-safe. Concurrent solves need their own {@link #copy()}.
 */
public final class SolvedState {
    private final StandardForm sf;
    private final BasisState basis;
    private final double zeroTol;
    private LPStatus status = LPStatus.RUNNING;
    private final List<PivotRecord> pivots;
    private final SolveStats stats;

    private int unboundedColumn = -1;
    private double[] unboundedRay;          // per column
    private double infeasibility;
    private double[] phaseOneDuals;

    SolvedState(StandardForm sf, BasisState basis, double zeroTol) {
        this.sf = sf;
        this.basis = basis;
        this.zeroTol = zeroTol;
        this.pivots = new ArrayList<>();
        this.stats = new SolveStats();
    }

    private SolvedState(SolvedState o) {
        this.sf = o.sf.copy();
        this.basis = o.basis.copy();
        this.zeroTol = o.zeroTol;
        this.status = o.status;
        this.pivots = new ArrayList<>(o.pivots);
        this.stats = o.stats.copy();
        this.unboundedColumn = o.unboundedColumn;
        this.unboundedRay = o.unboundedRay == null ? null : o.unboundedRay.clone();
        this.infeasibility = o.infeasibility;
        this.phaseOneDuals = o.phaseOneDuals == null ? null : o.phaseOneDuals.clone();
    }

    /** Independent snapshot of this state, e.g. to roll back a warm start. */
    public SolvedState copy() { return new SolvedState(this); }

    // --- engine access
    StandardForm form() { return sf; }
    BasisState basisState() { return basis; }
    List<PivotRecord> pivotLog() { return pivots; }
    void setStatus(LPStatus s) { this.status = s; }
    void setUnbounded(int column, double[] ray) { this.unboundedColumn = column; this.unboundedRay = ray; }
    void setInfeasibility(double sum, double[] duals) { this.infeasibility = sum; this.phaseOneDuals = duals; }

    // --- results
    public LPStatus status() { return status; }
    public boolean isOptimal() { return status == LPStatus.OPTIMAL; }
    public SolveStats stats() { return stats; }
    public List<PivotRecord> pivots() { return Collections.unmodifiableList(new ArrayList<>(pivots)); }
    public int variableCount() { return sf.structuralCount(); }
    public int constraintCount() { return sf.originalConstraintCount(); }
    public Sense sense() { return sf.sense(); }

    /** Copy of the standard form this state is defined on, including appended columns. */
    public StandardForm standardForm() { return sf.copy(); }

    /** Basic column of each standardized row. */
    public int[] basis() { return basis.basicColumns(); }

    /**
     * Values of the structural variables at the final basis. Feasible for
     * {@code OPTIMAL} and {@code UNBOUNDED}; for {@code INFEASIBLE} this is the
     * Phase I end point with artificials dropped.
     */
    public double[] solution() {
        double[] x = new double[sf.structuralCount()];
        for (int v = 0; v < x.length; v++) x[v] = clean(basis.value(sf.structuralColumn(v)));
        return x;
    }

    /** Value of every standard-form column (slacks, surpluses and artificials included). */
    public double[] columnValues() {
        double[] x = new double[sf.n()];
        for (int j = 0; j < x.length; j++) x[j] = clean(basis.value(j));
        return x;
    }

    /** Objective value in the problem's own sense; NaN when infeasible. */
    public double objective() {
        if (status == LPStatus.INFEASIBLE) return Double.NaN;
        return sf.sense().sign() * internalObjective();
    }

    /** {@code c_B · x_B} in the maximization form. */
    double internalObjective() {
        double z = 0.0;
        for (int i = 0; i < basis.size(); i++) z += sf.cost(basis.basicAt(i)) * basis.basicValue(i);
        return z;
    }

    /** Simplex multipliers {@code y = c_B^T B^-1} of the maximization form, one per standardized row. */
    double[] prices() {
        return basis.priceVector(sf.costs());
    }

    /**
     * Reduced cost {@code y·A_j - c_j} of standard-form column {@code j}, in the
     * maximization convention: at an optimum it is {@code >= 0} for non-basic
     * columns and 0 for basic ones.
     */
    public double reducedCost(int column) {
        if (column < 0 || column >= sf.n()) {
            throw new InvalidStateException("Column " + column + " out of range [0, " + sf.n() + ")");
        }
        return Pricer.reducedCost(prices(), sf.column(column), sf.cost(column));
    }

    /** Reduced costs of the structural variables, maximization convention. */
    public double[] reducedCosts() {
        double[] y = prices();
        double[] r = new double[sf.structuralCount()];
        for (int v = 0; v < r.length; v++) {
            int j = sf.structuralColumn(v);
            r[v] = Pricer.reducedCost(y, sf.column(j), sf.cost(j));
        }
        return r;
    }

    /** Shadow price of each original constraint, in the problem's own sense. */
    public double[] duals() {
        double[] y = prices();
        double[] out = new double[sf.originalConstraintCount()];
        for (int i = 0; i < sf.m(); i++) {
            int k = sf.rowOrigin(i);
            if (k >= 0) out[k] = clean(sf.sense().sign() * sf.rowSign(i) * y[i]);
        }
        return out;
    }

    /**
     * Slack of each original constraint: {@code rhs - a·x} for {@code <=},
     * {@code a·x - rhs} for {@code >=}, 0 for {@code =}.
     */
    public double[] slacks() {
        double[] out = new double[sf.originalConstraintCount()];
        for (int j = 0; j < sf.n(); j++) {
            ColumnKind kind = sf.kind(j);
            if (kind != ColumnKind.SLACK && kind != ColumnKind.SURPLUS) continue;
            int row = sf.source(j);
            int k = sf.rowOrigin(row);
            if (k < 0) continue;
            // on a negated row the surplus holds the original slack, and vice versa
            out[k] = clean(basis.value(j));
        }
        return out;
    }

    /** Structural variable whose increase is unbounded, or -1 (also -1 if it was a slack). */
    public int unboundedVariable() {
        if (unboundedColumn < 0 || sf.kind(unboundedColumn) != ColumnKind.STRUCTURAL) return -1;
        return sf.source(unboundedColumn);
    }

    /** Standard-form column that certified unboundedness, or -1. */
    public int unboundedColumn() { return unboundedColumn; }

    /**
     * Direction {@code r} in structural space with {@code x + t r} feasible for all
     * {@code t >= 0} and the objective strictly improving; null unless unbounded.
     */
    public double[] unboundedDirection() {
        if (unboundedRay == null) return null;
        double[] r = new double[sf.structuralCount()];
        for (int v = 0; v < r.length; v++) r[v] = unboundedRay[sf.structuralColumn(v)];
        return r;
    }

    /** Sum of the artificial variables at the end of Phase I (0 when Phase I was not needed). */
    public double infeasibility() { return infeasibility; }

    /** Phase I multipliers, one per standardized row; null when Phase I did not run. */
    public double[] phaseOneDuals() { return phaseOneDuals == null ? null : phaseOneDuals.clone(); }

    private double clean(double v) { return Math.abs(v) <= zeroTol ? 0.0 : v; }

    @Override
    public String toString() {
        return "SolvedState{" + status + " objective=" + objective() + " basis=" + Arrays.toString(basis()) + "}";
    }
}
