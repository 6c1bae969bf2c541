package com.revisedsimplex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Full-tableau simplex used to cross-check the revised engine. Every pivot
 * rewrites the whole (m+1) x (n+1) tableau; row 0 holds the reduced costs and
 * column n the right-hand side. Only handles problems whose initial basis is
 * all slacks (every row {@code <=} with {@code b >= 0}).
 */
final class ReferenceTableau {
    private static final double TOL = 1e-9;

    private final int m, n;
    private final double[][] T;
    private final int[] basis;
    private final List<int[]> pivots = new ArrayList<>();   // {entering, leaving}

    ReferenceTableau(StandardForm sf) {
        if (sf.needsPhaseOne()) throw new IllegalArgumentException("Reference tableau needs a slack basis");
        this.m = sf.m();
        this.n = sf.n();
        this.T = new double[m + 1][n + 1];
        Matrix a = sf.a();
        for (int j = 0; j < n; j++) {
            T[0][j] = -sf.cost(j);
            for (int i = 0; i < m; i++) T[i + 1][j] = a.get(i, j);
        }
        double[] b = sf.b();
        for (int i = 0; i < m; i++) T[i + 1][n] = b[i];
        this.basis = sf.initialBasis();
    }

    LPStatus solve(PivotRule rule, int maxIters) {
        for (int it = 0; it < maxIters; it++) {
            int e = chooseEntering(rule);
            if (e == -1) return LPStatus.OPTIMAL;
            int r = chooseLeaving(e);
            if (r == -1) return LPStatus.UNBOUNDED;
            pivots.add(new int[]{ e, basis[r - 1] });
            pivot(r, e);
        }
        return LPStatus.RUNNING;
    }

    private int chooseEntering(PivotRule rule) {
        int best = -1;
        double bestR = -TOL;
        for (int c = 0; c < n; c++) {
            if (isBasic(c)) continue;
            if (T[0][c] < bestR) {
                best = c;
                bestR = T[0][c];
                if (rule == PivotRule.BLAND) break;
            }
        }
        return best;
    }

    private int chooseLeaving(int e) {
        int arg = -1;
        double best = Double.POSITIVE_INFINITY;
        for (int r = 1; r <= m; r++) {
            if (T[r][e] <= TOL) continue;
            double ratio = Math.max(T[r][n], 0.0) / T[r][e];
            double tie = TOL * Math.max(1.0, Math.abs(best));
            if (arg == -1 || ratio < best - tie || (ratio <= best + tie && basis[r - 1] < basis[arg - 1])) {
                best = ratio;
                arg = r;
            }
        }
        return arg;
    }

    private void pivot(int leaveRow, int enterCol) {
        double piv = T[leaveRow][enterCol];
        for (int c = 0; c <= n; c++) T[leaveRow][c] /= piv;
        for (int r = 0; r <= m; r++) {
            if (r == leaveRow) continue;
            double factor = T[r][enterCol];
            if (factor == 0.0) continue;
            for (int c = 0; c <= n; c++) {
                if (c == enterCol) T[r][c] = 0.0;
                else T[r][c] -= factor * T[leaveRow][c];
            }
        }
        basis[leaveRow - 1] = enterCol;
    }

    private boolean isBasic(int col) {
        for (int b : basis) if (b == col) return true;
        return false;
    }

    double objective() { return T[0][n]; }

    double[] columnValues() {
        double[] x = new double[n];
        for (int i = 0; i < m; i++) x[basis[i]] = T[i + 1][n];
        return x;
    }

    List<int[]> pivots() { return pivots; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (double[] row : T) sb.append(Arrays.toString(row)).append('\n');
        return sb.toString();
    }
}
