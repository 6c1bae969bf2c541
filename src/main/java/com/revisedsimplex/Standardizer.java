package com.revisedsimplex;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the equality form of a {@link Problem}:
 *
 *   - rows with a negative right-hand side are negated and their relation flipped,
 *   - every {@code <=} row gets a slack column (+1, cost 0),
 *   - every {@code >=} row gets a surplus column (-1, cost 0) and an artificial (+1),
 *   - every {@code =} row gets an artificial,
 *   - every finite upper bound {@code x_j <= u} becomes one more row.
 *
 * The initial basis takes the slack of each {@code <=} row and the artificial of
 * every other row, so it is always the identity.
 */
final class Standardizer {

    private Standardizer() {}

    static StandardForm standardize(Problem p) {
        final int nVars = p.variableCount();
        for (int j = 0; j < nVars; j++) {
            if (!Double.isFinite(p.objectiveCoefficient(j))) {
                throw new MalformedProblemException("Non-finite objective coefficient for x" + j);
            }
            double u = p.upperBound(j);
            if (Double.isNaN(u) || u == Double.NEGATIVE_INFINITY) {
                throw new MalformedProblemException("Upper bound " + u + " for x" + j + " is not a number or +inf");
            }
        }

        // ---- collect rows: original constraints, then upper bounds ----
        List<double[]> rows = new ArrayList<>();
        List<Relation> rels = new ArrayList<>();
        List<Double> rhs = new ArrayList<>();
        List<Integer> origin = new ArrayList<>();

        for (int i = 0; i < p.constraintCount(); i++) {
            Constraint row = p.constraint(i);
            if (row.maxVariable() >= nVars) {
                throw new MalformedProblemException("Constraint " + i + " references undefined variable x"
                        + row.maxVariable() + " (problem has " + nVars + " variables)");
            }
            if (!Double.isFinite(row.rhs())) {
                throw new MalformedProblemException("Non-finite right-hand side in constraint " + i);
            }
            double[] dense = new double[nVars];
            for (int k = 0; k < row.termCount(); k++) {
                if (row.variable(k) < 0) {
                    throw new MalformedProblemException("Constraint " + i + " references negative variable index");
                }
                if (!Double.isFinite(row.coefficient(k))) {
                    throw new MalformedProblemException("Non-finite coefficient in constraint " + i);
                }
                dense[row.variable(k)] = row.coefficient(k);
            }
            rows.add(dense);
            rels.add(row.relation());
            rhs.add(row.rhs());
            origin.add(i);
        }
        for (int j = 0; j < nVars; j++) {
            if (!p.hasUpperBound(j)) continue;
            double[] dense = new double[nVars];
            dense[j] = 1.0;
            rows.add(dense);
            rels.add(Relation.LE);
            rhs.add(p.upperBound(j));
            origin.add(-1);
        }

        final int m = rows.size();
        double[] sign = new double[m];
        double[] b = new double[m];
        Relation[] rel = new Relation[m];
        int slackCols = 0, artificialCols = 0;
        for (int i = 0; i < m; i++) {
            boolean flip = rhs.get(i) < 0;
            sign[i] = flip ? -1.0 : 1.0;
            b[i] = flip ? -rhs.get(i) : rhs.get(i);
            rel[i] = flip ? rels.get(i).flip() : rels.get(i);
            if (rel[i] != Relation.EQ) slackCols++;
            if (rel[i] != Relation.LE) artificialCols++;
        }

        // ---- assemble columns ----
        final int n = nVars + slackCols + artificialCols;
        Matrix A = new Matrix(m, n);
        double[] c = new double[n];
        ColumnKind[] kinds = new ColumnKind[n];
        int[] source = new int[n];
        int[] structuralColumn = new int[nVars];
        int[] basis = new int[m];

        double objSign = p.sense().sign();
        for (int j = 0; j < nVars; j++) {
            for (int i = 0; i < m; i++) A.set(i, j, sign[i] * rows.get(i)[j]);
            c[j] = objSign * p.objectiveCoefficient(j);
            kinds[j] = ColumnKind.STRUCTURAL;
            source[j] = j;
            structuralColumn[j] = j;
        }

        int col = nVars;
        for (int i = 0; i < m; i++) {
            if (rel[i] == Relation.EQ) continue;
            boolean le = rel[i] == Relation.LE;
            A.set(i, col, le ? 1.0 : -1.0);
            kinds[col] = le ? ColumnKind.SLACK : ColumnKind.SURPLUS;
            source[col] = i;
            if (le) basis[i] = col;
            col++;
        }
        for (int i = 0; i < m; i++) {
            if (rel[i] == Relation.LE) continue;
            A.set(i, col, 1.0);
            kinds[col] = ColumnKind.ARTIFICIAL;
            source[col] = i;
            basis[i] = col;
            col++;
        }

        int[] rowOrigin = origin.stream().mapToInt(Integer::intValue).toArray();
        return new StandardForm(p.sense(), A, b, c, kinds, source, structuralColumn, sign, rowOrigin,
                p.constraintCount(), basis);
    }

    /**
     * Dense entry point: {@code A} is {@code m x n}, with one relation and right-hand
     * side per row and one objective coefficient per column.
     */
    static StandardForm standardize(double[][] A, Relation[] relations, double[] b, double[] c, Sense sense) {
        if (A.length != b.length) throw new MalformedProblemException("A has " + A.length + " rows but b has " + b.length);
        if (relations.length != b.length) {
            throw new MalformedProblemException(relations.length + " relations for " + b.length + " rows");
        }
        Problem.Builder builder = Problem.builder(sense).objective(c);
        for (int i = 0; i < A.length; i++) {
            if (A[i].length != c.length) {
                throw new MalformedProblemException("Row " + i + " of A has " + A[i].length
                        + " columns but c has " + c.length);
            }
            builder.constraint(A[i], relations[i], b[i]);
        }
        return standardize(builder.build());
    }
}
