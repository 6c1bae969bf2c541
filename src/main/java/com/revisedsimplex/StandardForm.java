package com.revisedsimplex;

import java.util.Arrays;

/**
 * Equality form {@code A x = b, x >= 0} of a {@link Problem}, normalized to
 * maximization. Columns are the structural variables first, then one slack or
 * surplus per inequality row, then one artificial per row that needs Phase I.
 * Rows are the original constraints (each possibly negated so that
 * {@code b >= 0}) followed by one row per upper bound.
 *
 * <p>The only mutation is {@link #appendStructural}, used by warm-start column
 * addition.
 */
public final class StandardForm {
    private final Sense sense;
    private final Matrix A;
    private final double[] b;
    private double[] c;                 // maximization costs, one per column
    private ColumnKind[] kinds;
    private int[] source;               // structural: variable index; others: row index
    private int[] structuralColumn;     // variable index -> column
    private final double[] rowSign;     // +1 or -1 applied to each original row
    private final int[] rowOrigin;      // original constraint index, or -1 for a bound row
    private final int originalRows;
    private final int[] initialBasis;

    StandardForm(Sense sense, Matrix A, double[] b, double[] c, ColumnKind[] kinds, int[] source,
                 int[] structuralColumn, double[] rowSign, int[] rowOrigin, int originalRows,
                 int[] initialBasis) {
        if (b.length != A.rows()) throw new MalformedProblemException("b has " + b.length + " rows, A has " + A.rows());
        if (c.length != A.cols()) throw new MalformedProblemException("c has " + c.length + " entries, A has " + A.cols() + " columns");
        if (kinds.length != A.cols() || source.length != A.cols()) {
            throw new MalformedProblemException("column metadata does not match A");
        }
        if (initialBasis.length != A.rows()) {
            throw new MalformedProblemException("initial basis has " + initialBasis.length + " entries for " + A.rows() + " rows");
        }
        this.sense = sense;
        this.A = A;
        this.b = b;
        this.c = c;
        this.kinds = kinds;
        this.source = source;
        this.structuralColumn = structuralColumn;
        this.rowSign = rowSign;
        this.rowOrigin = rowOrigin;
        this.originalRows = originalRows;
        this.initialBasis = initialBasis;
    }

    public Sense sense() { return sense; }
    /** Number of rows (standardized constraints). */
    public int m() { return A.rows(); }
    /** Number of columns, artificials included. */
    public int n() { return A.cols(); }
    public Matrix a() { return A.copy(); }
    public double[] b() { return b.clone(); }
    /** Maximization cost of column {@code j}. */
    public double cost(int j) { return c[j]; }
    public double[] costs() { return Arrays.copyOf(c, n()); }
    public ColumnKind kind(int j) { return kinds[j]; }
    public boolean isArtificial(int j) { return kinds[j] == ColumnKind.ARTIFICIAL; }
    public int structuralCount() { return structuralColumn.length; }
    public int structuralColumn(int var) { return structuralColumn[var]; }
    /** Variable index of a structural column, or the row index of a slack/surplus/artificial. */
    public int source(int j) { return source[j]; }
    public int originalConstraintCount() { return originalRows; }
    public double rowSign(int i) { return rowSign[i]; }
    public int rowOrigin(int i) { return rowOrigin[i]; }
    public int[] initialBasis() { return initialBasis.clone(); }

    public boolean needsPhaseOne() {
        for (int j = 0; j < n(); j++) if (kinds[j] == ColumnKind.ARTIFICIAL) return true;
        return false;
    }

    double[] column(int j) { return A.columnView(j); }
    double[] rhsView() { return b; }

    /**
     * Maps a column given per original constraint (caller's orientation) to the
     * standardized rows.
     */
    double[] standardizeColumn(double[] column) {
        if (column.length != originalRows) {
            throw new DimensionMismatchException("new variable column", originalRows, column.length);
        }
        for (double v : column) {
            if (!Double.isFinite(v)) throw new MalformedProblemException("Non-finite coefficient in new column");
        }
        double[] out = new double[m()];
        for (int i = 0; i < m(); i++) {
            out[i] = rowOrigin[i] < 0 ? 0.0 : rowSign[i] * column[rowOrigin[i]];
        }
        return out;
    }

    /** Maximization cost of a new variable with caller-sense coefficient {@code objCoeff}. */
    double standardizeCost(double objCoeff) { return sense.sign() * objCoeff; }

    /** Appends a structural column already in standardized rows; returns its column index. */
    int appendStructural(double[] standardizedColumn, double maxCost) {
        int j = A.appendColumn(standardizedColumn);
        int var = structuralColumn.length;
        c = Arrays.copyOf(c, j + 1);
        c[j] = maxCost;
        kinds = Arrays.copyOf(kinds, j + 1);
        kinds[j] = ColumnKind.STRUCTURAL;
        source = Arrays.copyOf(source, j + 1);
        source[j] = var;
        structuralColumn = Arrays.copyOf(structuralColumn, var + 1);
        structuralColumn[var] = j;
        return j;
    }

    /** Deep copy; the matrix and cost vector are not shared. */
    StandardForm copy() {
        return new StandardForm(sense, A.copy(), b.clone(), c.clone(), kinds.clone(), source.clone(),
                structuralColumn.clone(), rowSign.clone(), rowOrigin.clone(), originalRows, initialBasis.clone());
    }
}
