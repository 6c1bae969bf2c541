package com.revisedsimplex;

import java.util.Arrays;
import java.util.Objects;

/**
 * One row {@code sum a_j x_j  (<=|>=|=)  rhs}. Coefficients are kept as parallel
 * index/value arrays sorted by variable index.
 */
public final class Constraint {
    private final int[] vars;
    private final double[] coefs;
    private final Relation relation;
    private final double rhs;

    private Constraint(int[] vars, double[] coefs, Relation relation, double rhs) {
        this.vars = vars;
        this.coefs = coefs;
        this.relation = Objects.requireNonNull(relation, "relation");
        this.rhs = rhs;
    }

    /** Dense row: {@code coefs[j]} is the coefficient of variable j. */
    public static Constraint of(double[] coefs, Relation relation, double rhs) {
        int[] vars = new int[coefs.length];
        for (int j = 0; j < vars.length; j++) vars[j] = j;
        return new Constraint(vars, coefs.clone(), relation, rhs);
    }

    /** Sparse row; a variable listed twice has its coefficients summed. */
    public static Constraint sparse(int[] vars, double[] coefs, Relation relation, double rhs) {
        if (vars.length != coefs.length) {
            throw new DimensionMismatchException("sparse constraint coefficients", vars.length, coefs.length);
        }
        Integer[] order = new Integer[vars.length];
        for (int k = 0; k < order.length; k++) order[k] = k;
        Arrays.sort(order, (a, b) -> Integer.compare(vars[a], vars[b]));

        int[] v = new int[vars.length];
        double[] c = new double[vars.length];
        int len = 0;
        for (int k : order) {
            if (len > 0 && v[len - 1] == vars[k]) {
                c[len - 1] += coefs[k];
            } else {
                v[len] = vars[k];
                c[len] = coefs[k];
                len++;
            }
        }
        return new Constraint(Arrays.copyOf(v, len), Arrays.copyOf(c, len), relation, rhs);
    }

    public Relation relation() { return relation; }
    public double rhs() { return rhs; }
    public int termCount() { return vars.length; }
    public int variable(int k) { return vars[k]; }
    public double coefficient(int k) { return coefs[k]; }

    /** Coefficient of variable {@code var}, 0 when absent. */
    public double coefficientOf(int var) {
        int k = Arrays.binarySearch(vars, var);
        return k >= 0 ? coefs[k] : 0.0;
    }

    /** Largest variable index referenced, or -1 for an empty row. */
    int maxVariable() { return vars.length == 0 ? -1 : vars[vars.length - 1]; }

    /** Row activity {@code a·x} for a structural solution. */
    public double activity(double[] x) {
        double s = 0.0;
        for (int k = 0; k < vars.length; k++) s += coefs[k] * x[vars[k]];
        return s;
    }

    /** This row with one more term for variable {@code var}. */
    Constraint withTerm(int var, double coef) {
        int[] v = Arrays.copyOf(vars, vars.length + 1);
        double[] c = Arrays.copyOf(coefs, coefs.length + 1);
        v[vars.length] = var;
        c[coefs.length] = coef;
        return sparse(v, c, relation, rhs);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int k = 0; k < vars.length; k++) {
            if (k > 0) sb.append(" + ");
            sb.append(coefs[k]).append("*x").append(vars[k]);
        }
        if (vars.length == 0) sb.append('0');
        return sb.append(' ').append(relation.symbol()).append(' ').append(rhs).toString();
    }
}
