package com.revisedsimplex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A linear program over non-negative variables {@code x_0 .. x_{n-1}}:
 * optimize {@code c·x} subject to an ordered list of {@link Constraint}s and
 * optional upper bounds. Instances are immutable; {@link #withVariable} returns
 * the augmented problem.
 */
public final class Problem {
    private final Sense sense;
    private final double[] objective;
    private final List<Constraint> constraints;
    private final double[] upperBounds;   // +inf when unbounded above

    private Problem(Sense sense, double[] objective, List<Constraint> constraints, double[] upperBounds) {
        this.sense = sense;
        this.objective = objective;
        this.constraints = Collections.unmodifiableList(constraints);
        this.upperBounds = upperBounds;
    }

    public static Builder builder(Sense sense) { return new Builder(sense); }

    public Sense sense() { return sense; }
    public int variableCount() { return objective.length; }
    public int constraintCount() { return constraints.size(); }
    public double objectiveCoefficient(int j) { return objective[j]; }
    public double[] objective() { return objective.clone(); }
    public List<Constraint> constraints() { return constraints; }
    public Constraint constraint(int i) { return constraints.get(i); }
    public double upperBound(int j) { return upperBounds[j]; }
    public boolean hasUpperBound(int j) { return upperBounds[j] != Double.POSITIVE_INFINITY; }

    /** Objective value of a structural solution, in this problem's sense. */
    public double evaluate(double[] x) {
        if (x.length != objective.length) {
            throw new DimensionMismatchException("solution", objective.length, x.length);
        }
        return DenseAlgebra.dot(objective, x);
    }

    /**
     * Returns this problem with one more variable appended, having objective
     * coefficient {@code objCoeff} and coefficient {@code column[i]} in constraint i.
     */
    public Problem withVariable(double objCoeff, double[] column) {
        if (column.length != constraints.size()) {
            throw new DimensionMismatchException("new variable column", constraints.size(), column.length);
        }
        int var = objective.length;
        double[] c = Arrays.copyOf(objective, var + 1);
        c[var] = objCoeff;
        double[] u = Arrays.copyOf(upperBounds, var + 1);
        u[var] = Double.POSITIVE_INFINITY;
        List<Constraint> rows = new ArrayList<>(constraints.size());
        for (int i = 0; i < constraints.size(); i++) {
            Constraint row = constraints.get(i);
            rows.add(column[i] == 0.0 ? row : row.withTerm(var, column[i]));
        }
        return new Problem(sense, c, rows, u);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(sense == Sense.MAXIMIZE ? "max " : "min ");
        sb.append(Arrays.toString(objective)).append(System.lineSeparator());
        for (Constraint row : constraints) sb.append("  ").append(row).append(System.lineSeparator());
        return sb.toString();
    }

    public static final class Builder {
        private final Sense sense;
        private double[] objective = new double[0];
        private final List<Constraint> constraints = new ArrayList<>();
        private final List<Integer> boundVars = new ArrayList<>();
        private final List<Double> boundValues = new ArrayList<>();

        private Builder(Sense sense) { this.sense = Objects.requireNonNull(sense, "sense"); }

        /** Sets the objective; its length fixes the number of variables. */
        public Builder objective(double... c) { this.objective = c.clone(); return this; }
        public Builder constraint(Constraint row) { constraints.add(Objects.requireNonNull(row)); return this; }
        public Builder constraint(double[] coefs, Relation relation, double rhs) {
            return constraint(Constraint.of(coefs, relation, rhs));
        }
        public Builder upperBound(int var, double bound) {
            boundVars.add(var);
            boundValues.add(bound);
            return this;
        }

        public Problem build() {
            double[] u = new double[objective.length];
            Arrays.fill(u, Double.POSITIVE_INFINITY);
            for (int k = 0; k < boundVars.size(); k++) {
                int var = boundVars.get(k);
                if (var < 0 || var >= objective.length) {
                    throw new MalformedProblemException("Upper bound on undefined variable x" + var);
                }
                u[var] = Math.min(u[var], boundValues.get(k));
            }
            return new Problem(sense, objective.clone(), new ArrayList<>(constraints), u);
        }
    }
}
