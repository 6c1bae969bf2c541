package com.revisedsimplex;

import java.util.Objects;

/** One basis exchange, as recorded in a solve's pivot history. */
public final class PivotRecord {
    public enum Phase { PHASE_ONE, PHASE_TWO, WARM_START }

    private final Phase phase;
    private final int entering;     // column index
    private final int leaving;      // column index
    private final int row;
    private final double theta;     // step length of the entering variable
    private final double reducedCost;

    PivotRecord(Phase phase, int entering, int leaving, int row, double theta, double reducedCost) {
        this.phase = phase;
        this.entering = entering;
        this.leaving = leaving;
        this.row = row;
        this.theta = theta;
        this.reducedCost = reducedCost;
    }

    public Phase phase() { return phase; }
    public int entering() { return entering; }
    public int leaving() { return leaving; }
    public int row() { return row; }
    public double theta() { return theta; }
    public double reducedCost() { return reducedCost; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PivotRecord)) return false;
        PivotRecord o = (PivotRecord) obj;
        return phase == o.phase && entering == o.entering && leaving == o.leaving && row == o.row
                && Double.compare(theta, o.theta) == 0 && Double.compare(reducedCost, o.reducedCost) == 0;
    }

    @Override
    public int hashCode() { return Objects.hash(phase, entering, leaving, row, theta, reducedCost); }

    @Override
    public String toString() {
        return phase + ": enter=" + entering + " leave=" + leaving + " row=" + row
                + " theta=" + theta + " r=" + reducedCost;
    }
}
