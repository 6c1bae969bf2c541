package com.revisedsimplex;

/** Dense vector and matrix helpers used by the basis and pricing code. */
final class DenseAlgebra {

    /** Pivots smaller than this in absolute value make a matrix singular. */
    static final double SINGULAR_EPS = 1e-12;

    private DenseAlgebra() {}

    static double dot(double[] a, double[] b) {
        double s = 0.0;
        for (int i = 0; i < a.length; i++) s += a[i] * b[i];
        return s;
    }

    /** M · v for a square or rectangular row-major M. */
    static double[] multiply(double[][] M, double[] v) {
        double[] out = new double[M.length];
        for (int i = 0; i < M.length; i++) out[i] = dot(M[i], v);
        return out;
    }

    /** yᵗ · M, returned as a plain vector. */
    static double[] multiply(double[] y, double[][] M) {
        int n = M.length == 0 ? 0 : M[0].length;
        double[] out = new double[n];
        for (int i = 0; i < M.length; i++) {
            double yi = y[i];
            if (yi == 0.0) continue;
            double[] row = M[i];
            for (int j = 0; j < n; j++) out[j] += yi * row[j];
        }
        return out;
    }

    static double normInf(double[] v) {
        double best = 0.0;
        for (double x : v) best = Math.max(best, Math.abs(x));
        return best;
    }

    static double[][] copy(double[][] a) {
        double[][] c = new double[a.length][];
        for (int i = 0; i < a.length; i++) c[i] = a[i].clone();
        return c;
    }

    static double[][] identity(int n) {
        double[][] I = new double[n][n];
        for (int i = 0; i < n; i++) I[i][i] = 1.0;
        return I;
    }

    /**
     * Gauss-Jordan inverse of a square matrix with partial pivoting.
     *
     * @throws ArithmeticException if the matrix is singular to working precision
     */
    static double[][] invert(double[][] B) {
        int n = B.length;

        // augmented [B | I]
        double[][] M = new double[n][2 * n];
        for (int i = 0; i < n; i++) {
            if (B[i].length != n) throw new IllegalArgumentException("Matrix is not square");
            System.arraycopy(B[i], 0, M[i], 0, n);
            M[i][n + i] = 1.0;
        }

        for (int k = 0; k < n; k++) {
            // largest entry in column k at or below the diagonal
            int pivRow = k;
            for (int i = k + 1; i < n; i++) {
                if (Math.abs(M[i][k]) > Math.abs(M[pivRow][k])) pivRow = i;
            }
            if (Math.abs(M[pivRow][k]) < SINGULAR_EPS) {
                throw new ArithmeticException("Singular matrix in invert()");
            }
            if (pivRow != k) {
                double[] tmp = M[pivRow]; M[pivRow] = M[k]; M[k] = tmp;
            }

            // normalize pivot row
            double diag = M[k][k];
            for (int j = k; j < 2 * n; j++) M[k][j] /= diag;

            // eliminate
            for (int i = 0; i < n; i++) if (i != k) {
                double f = M[i][k];
                if (f != 0.0) {
                    for (int j = k; j < 2 * n; j++) M[i][j] -= f * M[k][j];
                }
            }
        }

        double[][] inv = new double[n][n];
        for (int i = 0; i < n; i++) System.arraycopy(M[i], n, inv[i], 0, n);
        return inv;
    }
}
