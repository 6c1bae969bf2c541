package com.revisedsimplex;

import java.util.Arrays;

/**
 * The current basis of a standard-form problem, kept in flat arrays:
 * the basic column of each row, the row of each column (-1 when non-basic),
 * the dense inverse {@code B^-1} and the basic values {@code x_B = B^-1 b}.
 *
 * <p>Mutated in place, one pivot at a time. Not thread-safe; use {@link #copy()}
 * to keep a snapshot.
 */
final class BasisState {
    private final int m;
    private final int[] basic;      // basic[row] = column
    private int[] rowOf;            // rowOf[column] = row, or -1
    private double[][] Binv;        // m x m
    private double[] xB;            // length m
    private int pivotsSinceRefactor;

    private BasisState(int m, int[] basic, int n) {
        this.m = m;
        this.basic = basic;
        this.rowOf = new int[n];
        Arrays.fill(rowOf, -1);
        for (int i = 0; i < m; i++) {
            if (basic[i] < 0 || basic[i] >= n) {
                throw new MalformedProblemException("Basic column " + basic[i] + " out of range");
            }
            if (rowOf[basic[i]] != -1) {
                throw new MalformedProblemException("Column " + basic[i] + " is basic in two rows");
            }
            rowOf[basic[i]] = i;
        }
    }

    private BasisState(BasisState o) {
        this.m = o.m;
        this.basic = o.basic.clone();
        this.rowOf = o.rowOf.clone();
        this.Binv = DenseAlgebra.copy(o.Binv);
        this.xB = o.xB.clone();
        this.pivotsSinceRefactor = o.pivotsSinceRefactor;
    }

    /** Starting basis of a freshly standardized problem (slacks and artificials). */
    static BasisState initial(StandardForm sf) { return of(sf, sf.initialBasis()); }

    /**
     * Basis with the given basic column per row.
     *
     * @throws ArithmeticException if those columns are linearly dependent
     */
    static BasisState of(StandardForm sf, int[] basicColumns) {
        if (basicColumns.length != sf.m()) {
            throw new DimensionMismatchException("basis", sf.m(), basicColumns.length);
        }
        BasisState s = new BasisState(sf.m(), basicColumns.clone(), sf.n());
        s.refactor(sf);
        return s;
    }

    BasisState copy() { return new BasisState(this); }

    int size() { return m; }
    int basicAt(int row) { return basic[row]; }
    int[] basicColumns() { return basic.clone(); }
    int rowOf(int column) { return column < rowOf.length ? rowOf[column] : -1; }
    boolean isBasic(int column) { return rowOf(column) >= 0; }
    double basicValue(int row) { return xB[row]; }
    double[] basicValues() { return xB.clone(); }
    double[][] inverse() { return DenseAlgebra.copy(Binv); }
    int pivotsSinceRefactor() { return pivotsSinceRefactor; }

    /** Value of any column: its basic value, or 0 when non-basic. */
    double value(int column) {
        int r = rowOf(column);
        return r < 0 ? 0.0 : xB[r];
    }

    /** Grows the column index space after columns were appended to the problem. */
    void ensureColumns(int n) {
        if (n <= rowOf.length) return;
        int old = rowOf.length;
        rowOf = Arrays.copyOf(rowOf, n);
        Arrays.fill(rowOf, old, n, -1);
    }

    /**
     * Recomputes {@code B^-1} and {@code x_B} from scratch.
     *
     * @throws ArithmeticException if the basis matrix is singular
     */
    void refactor(StandardForm sf) {
        double[][] B = new double[m][m];
        for (int k = 0; k < m; k++) {
            double[] col = sf.column(basic[k]);
            for (int i = 0; i < m; i++) B[i][k] = col[i];
        }
        this.Binv = DenseAlgebra.invert(B);
        this.xB = DenseAlgebra.multiply(Binv, sf.rhsView());
        this.pivotsSinceRefactor = 0;
    }

    /** Simplex multipliers {@code y = c_B^T B^-1} for the given cost vector. */
    double[] priceVector(double[] cost) {
        double[] cB = new double[m];
        for (int k = 0; k < m; k++) cB[k] = cost[basic[k]];
        return DenseAlgebra.multiply(cB, Binv);
    }

    /** Entry {@code (B^-1 a)[row]} without forming the whole direction. */
    double tableauEntry(int row, double[] column) {
        return DenseAlgebra.dot(Binv[row], column);
    }

    /** Snaps a basic value within tolerance of zero to exactly zero before a degenerate pivot. */
    void clearBasicValue(int row) { xB[row] = 0.0; }

    /** {@code d = B^-1 a} for a column {@code a}. */
    double[] direction(double[] column) {
        return DenseAlgebra.multiply(Binv, column);
    }

    /**
     * Replaces the basic column of {@code row} by {@code entering}, given the
     * direction {@code d = B^-1 A_entering}. Updates {@code B^-1} with one
     * elementary row transformation and moves {@code x_B} by the step
     * {@code theta = x_B[row] / d[row]}.
     */
    void pivot(int row, int entering, double[] d) {
        double piv = d[row];
        if (piv == 0.0) throw new IllegalArgumentException("Pivot on zero element");
        ensureColumns(entering + 1);

        double[] pr = Binv[row];
        for (int j = 0; j < m; j++) pr[j] /= piv;
        double theta = xB[row] / piv;

        for (int i = 0; i < m; i++) {
            if (i == row) continue;
            double f = d[i];
            if (f == 0.0) continue;
            double[] ri = Binv[i];
            for (int j = 0; j < m; j++) ri[j] -= f * pr[j];
            xB[i] -= f * theta;
        }
        xB[row] = theta;

        int leaving = basic[row];
        rowOf[leaving] = -1;
        basic[row] = entering;
        rowOf[entering] = row;
        pivotsSinceRefactor++;
    }

    /** {@code ||B x_B - b||_inf}. */
    double residual(StandardForm sf) {
        double[] r = sf.rhsView().clone();
        for (int k = 0; k < m; k++) {
            double v = xB[k];
            if (v == 0.0) continue;
            double[] col = sf.column(basic[k]);
            for (int i = 0; i < m; i++) r[i] -= col[i] * v;
        }
        return DenseAlgebra.normInf(r);
    }

    @Override
    public String toString() {
        return "BasisState{basic=" + Arrays.toString(basic) + " xB=" + Arrays.toString(xB) + "}";
    }
}
