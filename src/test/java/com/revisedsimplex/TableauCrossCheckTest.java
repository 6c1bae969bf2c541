package com.revisedsimplex;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

import java.util.List;

public class TableauCrossCheckTest {

    private static final double EPS = 1e-7;

    private static void assertSameRun(Problem p, SolverOptions opts) {
        LinearProgramSolver solver = new LinearProgramSolver(opts);
        StandardForm sf = solver.standardize(p);
        SolvedState st = solver.solve(sf);

        ReferenceTableau ref = new ReferenceTableau(sf);
        LPStatus refStatus = ref.solve(opts.pivotRule, 1000);
        assertEquals(refStatus, st.status(), ref::toString);

        List<PivotRecord> pivots = st.pivots();
        List<int[]> refPivots = ref.pivots();
        assertEquals(refPivots.size(), pivots.size(), "pivot count");
        for (int k = 0; k < pivots.size(); k++) {
            assertEquals(refPivots.get(k)[0], pivots.get(k).entering(), "entering at pivot " + k);
            assertEquals(refPivots.get(k)[1], pivots.get(k).leaving(), "leaving at pivot " + k);
        }
        if (refStatus == LPStatus.OPTIMAL) {
            assertEquals(ref.objective(), st.objective(), EPS);
            assertArrayEquals(ref.columnValues(), st.columnValues(), EPS);
        }
    }

    @Test
    public void testHospital() {
        assertSameRun(LpFixtures.hospital(), SolverOptions.defaults());
        assertSameRun(LpFixtures.hospital(), LpFixtures.bland());
    }

    @Test
    public void testThreeByThree() {
        assertSameRun(LpFixtures.threeByThree(), SolverOptions.defaults());
        assertSameRun(LpFixtures.threeByThree(), LpFixtures.bland());
    }

    @Test
    public void testDegenerateUnderBland() {
        assertSameRun(LpFixtures.cycling(), LpFixtures.bland());
    }

    @Test
    public void testWiderProblem() {
        Problem p = Problem.builder(Sense.MAXIMIZE)
                .objective(5, 4, 3, 7, 1)
                .constraint(new double[]{ 2, 3, 1, 4, 1 }, Relation.LE, 5)
                .constraint(new double[]{ 4, 1, 2, 1, 3 }, Relation.LE, 11)
                .constraint(new double[]{ 3, 4, 2, 2, 1 }, Relation.LE, 8)
                .constraint(new double[]{ 1, 1, 1, 1, 1 }, Relation.LE, 4)
                .upperBound(3, 1)
                .build();
        assertSameRun(p, SolverOptions.defaults());
        assertSameRun(p, LpFixtures.bland());
    }

    @Test
    public void testUnbounded() {
        Problem p = Problem.builder(Sense.MAXIMIZE)
                .objective(1, 1)
                .constraint(new double[]{ 1, -1 }, Relation.LE, 2)
                .build();
        assertSameRun(p, SolverOptions.defaults());
    }
}
