package com.revisedsimplex;

public final class SolveStats {
    public int phaseOnePivots;
    public int phaseTwoPivots;
    public int warmStartPivots;
    public int degeneratePivots;
    public int refactorizations;
    public int residualRefactorizations;
    public int ruleSwitches;
    public int artificialsDrivenOut;
    public int redundantRows;

    public int totalPivots() { return phaseOnePivots + phaseTwoPivots + warmStartPivots; }

    SolveStats copy() {
        SolveStats s = new SolveStats();
        s.phaseOnePivots = phaseOnePivots;
        s.phaseTwoPivots = phaseTwoPivots;
        s.warmStartPivots = warmStartPivots;
        s.degeneratePivots = degeneratePivots;
        s.refactorizations = refactorizations;
        s.residualRefactorizations = residualRefactorizations;
        s.ruleSwitches = ruleSwitches;
        s.artificialsDrivenOut = artificialsDrivenOut;
        s.redundantRows = redundantRows;
        return s;
    }

    @Override
    public String toString() {
        return "*Totals: pivots=" + totalPivots() +
                " phase1=" + phaseOnePivots +
                " phase2=" + phaseTwoPivots +
                " warm=" + warmStartPivots +
                " degenerate=" + degeneratePivots +
                " refactorizations=" + refactorizations +
                " rule_switches=" + ruleSwitches +
                " redundant_rows=" + redundantRows;
    }
}
