package com.revisedsimplex;

/** Result of adding one variable to an optimal problem. */
public final class WarmStartReport {
    public enum Outcome { NOT_BENEFICIAL, OPTIMAL, UNBOUNDED }

    private final Outcome outcome;
    private final double reducedCost;
    private final int variable;         // structural index of the new variable, -1 if not added
    private final double[] solution;
    private final double objective;
    private final int pivotCount;

    WarmStartReport(Outcome outcome, double reducedCost, int variable, double[] solution,
                    double objective, int pivotCount) {
        this.outcome = outcome;
        this.reducedCost = reducedCost;
        this.variable = variable;
        this.solution = solution;
        this.objective = objective;
        this.pivotCount = pivotCount;
    }

    public Outcome outcome() { return outcome; }
    /** Reduced cost of the new column against the basis it was priced on (maximization convention). */
    public double reducedCost() { return reducedCost; }
    public int variable() { return variable; }
    public boolean added() { return variable >= 0; }
    public double[] solution() { return solution.clone(); }
    public double objective() { return objective; }
    public int pivotCount() { return pivotCount; }

    @Override
    public String toString() {
        return "WarmStartReport{" + outcome + " r=" + reducedCost + " objective=" + objective
                + " pivots=" + pivotCount + "}";
    }
}
