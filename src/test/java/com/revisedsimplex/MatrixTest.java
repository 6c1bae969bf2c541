package com.revisedsimplex;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

public class MatrixTest {

    @Test
    public void testOfRowsAndColumnAccess() {
        Matrix a = Matrix.ofRows(new double[][]{ { 1, 2, 3 }, { 4, 5, 6 } });
        assertEquals(2, a.rows());
        assertEquals(3, a.cols());
        assertEquals(6.0, a.get(1, 2));
        assertArrayEquals(new double[]{ 2, 5 }, a.column(1));
        assertArrayEquals(new double[][]{ { 1, 2, 3 }, { 4, 5, 6 } }, a.toArray());
    }

    @Test
    public void testAppendColumnGrowsAndCopiesInput() {
        Matrix a = new Matrix(2, 0);
        double[] col = { 7, 8 };
        for (int k = 0; k < 10; k++) assertEquals(k, a.appendColumn(col));
        col[0] = -1;
        assertEquals(10, a.cols());
        assertEquals(7.0, a.get(0, 9));
        assertThrows(IllegalArgumentException.class, () -> a.appendColumn(new double[]{ 1 }));
    }

    @Test
    public void testCopyIsDeep() {
        Matrix a = Matrix.ofRows(new double[][]{ { 1, 0 }, { 0, 1 } });
        Matrix b = a.copy();
        b.set(0, 0, 42);
        b.appendColumn(new double[]{ 1, 1 });
        assertEquals(1.0, a.get(0, 0));
        assertEquals(2, a.cols());
        assertEquals(3, b.cols());
    }

    @Test
    public void testRejectsBadShapes() {
        assertThrows(IllegalArgumentException.class, () -> new Matrix(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> Matrix.ofRows(new double[][]{ { 1, 2 }, { 3 } }));
    }
}
