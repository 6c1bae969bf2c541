package com.revisedsimplex;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

public class BasisStateTest {

    private static final double EPS = 1e-10;

    private static void assertSameInverse(double[][] expected, double[][] actual) {
        assertEquals(expected.length, actual.length);
        for (int i = 0; i < expected.length; i++) assertArrayEquals(expected[i], actual[i], EPS);
    }

    @Test
    public void testInitialBasisIsIdentity() {
        StandardForm sf = Standardizer.standardize(LpFixtures.hospital());
        BasisState b = BasisState.initial(sf);
        assertSameInverse(DenseAlgebra.identity(2), b.inverse());
        assertArrayEquals(new double[]{ 4, 6 }, b.basicValues(), EPS);
        assertEquals(-1, b.rowOf(0));
        assertEquals(0, b.rowOf(2));
        assertEquals(0.0, b.value(0));
        assertEquals(6.0, b.value(3));
    }

    @Test
    public void testProductFormUpdateMatchesRefactorization() {
        StandardForm sf = Standardizer.standardize(LpFixtures.hospital());
        BasisState b = BasisState.initial(sf);

        // x1 enters, s1 (row 0) leaves
        double[] d = b.direction(sf.column(0));
        b.pivot(0, 0, d);
        // x2 enters, s2 (row 1) leaves
        d = b.direction(sf.column(1));
        assertArrayEquals(new double[]{ 1, 1 }, d, EPS);
        b.pivot(1, 1, d);

        BasisState fresh = BasisState.of(sf, b.basicColumns());
        assertSameInverse(fresh.inverse(), b.inverse());
        assertSameInverse(new double[][]{ { 2, -1 }, { -1, 1 } }, b.inverse());
        assertArrayEquals(new double[]{ 2, 2 }, b.basicValues(), EPS);
        assertEquals(2, b.pivotsSinceRefactor());
        assertEquals(0.0, b.residual(sf), EPS);
    }

    @Test
    public void testPriceVectorAndTableauEntry() {
        StandardForm sf = Standardizer.standardize(LpFixtures.hospital());
        BasisState b = BasisState.of(sf, new int[]{ 0, 1 });
        assertArrayEquals(new double[]{ 0, 100 }, b.priceVector(sf.costs()), EPS);
        assertEquals(-1.0, b.tableauEntry(0, new double[]{ 0, 1 }), EPS);
        assertEquals(1.0, b.tableauEntry(1, new double[]{ 0, 1 }), EPS);
    }

    @Test
    public void testCopyIsIndependent() {
        StandardForm sf = Standardizer.standardize(LpFixtures.hospital());
        BasisState b = BasisState.initial(sf);
        BasisState snapshot = b.copy();
        b.pivot(1, 1, b.direction(sf.column(1)));
        assertArrayEquals(new int[]{ 2, 3 }, snapshot.basicColumns());
        assertArrayEquals(new double[]{ 4, 6 }, snapshot.basicValues(), EPS);
        assertArrayEquals(new int[]{ 2, 1 }, b.basicColumns());
    }

    @Test
    public void testEnsureColumnsAfterAppend() {
        StandardForm sf = Standardizer.standardize(LpFixtures.hospital());
        BasisState b = BasisState.initial(sf);
        int j = sf.appendStructural(new double[]{ 0, 1 }, 400);
        assertEquals(4, j);
        b.ensureColumns(sf.n());
        assertFalse(b.isBasic(j));
        b.pivot(1, j, b.direction(sf.column(j)));
        assertEquals(1, b.rowOf(j));
        assertEquals(6.0, b.value(j), EPS);
    }

    @Test
    public void testSingularAndInvalidBases() {
        Problem p = Problem.builder(Sense.MAXIMIZE)
                .objective(1, 1)
                .constraint(new double[]{ 1, 1 }, Relation.LE, 1)
                .constraint(new double[]{ 1, 1 }, Relation.LE, 2)
                .build();
        StandardForm sf = Standardizer.standardize(p);
        assertThrows(ArithmeticException.class, () -> BasisState.of(sf, new int[]{ 0, 1 }));
        assertThrows(MalformedProblemException.class, () -> BasisState.of(sf, new int[]{ 2, 2 }));
        assertThrows(MalformedProblemException.class, () -> BasisState.of(sf, new int[]{ 2, 9 }));
        assertThrows(DimensionMismatchException.class, () -> BasisState.of(sf, new int[]{ 2 }));
    }

    @Test
    public void testResidualDetectsCorruptedValues() {
        StandardForm sf = Standardizer.standardize(LpFixtures.hospital());
        BasisState b = BasisState.initial(sf);
        b.clearBasicValue(1);
        assertEquals(6.0, b.residual(sf), EPS);
        b.refactor(sf);
        assertEquals(0.0, b.residual(sf), EPS);
    }
}
