package com.revisedsimplex;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

public class PricerTest {

    private static final double TOL = 1e-9;

    @Test
    public void testDantzigPicksMostNegative() {
        StandardForm sf = Standardizer.standardize(LpFixtures.hospital());
        BasisState b = BasisState.initial(sf);
        double[] cost = sf.costs();
        try (Pricer pricer = new Pricer(1)) {
            int q = pricer.choose(sf, b, b.priceVector(cost), cost, PivotRule.DANTZIG, TOL);
            assertEquals(1, q);
            assertEquals(-200.0, pricer.chosenReducedCost(), 1e-12);
        }
    }

    @Test
    public void testBlandPicksLowestIndex() {
        StandardForm sf = Standardizer.standardize(LpFixtures.hospital());
        BasisState b = BasisState.initial(sf);
        double[] cost = sf.costs();
        try (Pricer pricer = new Pricer(1)) {
            assertEquals(0, pricer.choose(sf, b, b.priceVector(cost), cost, PivotRule.BLAND, TOL));
            assertEquals(-100.0, pricer.chosenReducedCost(), 1e-12);
        }
    }

    @Test
    public void testExactTieGoesToLowestIndex() {
        Problem p = Problem.builder(Sense.MAXIMIZE)
                .objective(0, 5, 5)
                .constraint(new double[]{ 1, 1, 1 }, Relation.LE, 1)
                .build();
        StandardForm sf = Standardizer.standardize(p);
        BasisState b = BasisState.initial(sf);
        double[] cost = sf.costs();
        try (Pricer pricer = new Pricer(1)) {
            assertEquals(1, pricer.choose(sf, b, b.priceVector(cost), cost, PivotRule.DANTZIG, TOL));
        }
    }

    @Test
    public void testOptimalBasisHasNoEnteringColumn() {
        StandardForm sf = Standardizer.standardize(LpFixtures.hospital());
        BasisState b = BasisState.of(sf, new int[]{ 0, 1 });
        double[] cost = sf.costs();
        try (Pricer pricer = new Pricer(1)) {
            assertEquals(-1, pricer.choose(sf, b, b.priceVector(cost), cost, PivotRule.DANTZIG, TOL));
        }
        // s1 prices at exactly zero at the (2, 2) vertex
        assertEquals(0.0, Pricer.reducedCost(b.priceVector(cost), sf.column(2), 0.0), 1e-12);
        assertEquals(100.0, Pricer.reducedCost(b.priceVector(cost), sf.column(3), 0.0), 1e-12);
    }

    @Test
    public void testArtificialsNeverEnter() {
        StandardForm sf = Standardizer.standardize(LpFixtures.diet());
        BasisState b = BasisState.initial(sf);
        double[] cost = new double[sf.n()];
        cost[4] = 5;    // would price attractively if artificials were candidates
        b.pivot(0, 0, b.direction(sf.column(0)));
        try (Pricer pricer = new Pricer(1)) {
            int q = pricer.choose(sf, b, b.priceVector(cost), cost, PivotRule.DANTZIG, TOL);
            assertTrue(q < 0 || !sf.isArtificial(q));
        }
    }

    @Test
    public void testParallelPricingMatchesSequential() {
        Problem p = LpFixtures.threeByThree();
        StandardForm sf = Standardizer.standardize(p);
        BasisState b = BasisState.initial(sf);
        double[] cost = sf.costs();
        double[] y = b.priceVector(cost);
        try (Pricer seq = new Pricer(1); Pricer par = new Pricer(4)) {
            for (PivotRule rule : PivotRule.values()) {
                assertEquals(seq.choose(sf, b, y, cost, rule, TOL), par.choose(sf, b, y, cost, rule, TOL));
                assertEquals(seq.chosenReducedCost(), par.chosenReducedCost());
            }
        }
    }
}
