package com.revisedsimplex;

import java.util.Arrays;

/**
 * A dense {@code rows × cols} matrix of doubles stored column by column, so that
 * a single column can be handed to the pricing loop without copying.  Columns can
 * be appended after construction; rows are fixed.
 */
public final class Matrix {
    private final int rows;
    private int cols;
    private double[][] columns;   // columns[j] has length rows

    /** Constructs a {@code rows × cols} matrix with all entries zero. */
    public Matrix(int rows, int cols) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Negative dimensions");
        }
        this.rows = rows;
        this.cols = cols;
        this.columns = new double[Math.max(cols, 4)][];
        for (int j = 0; j < cols; j++) columns[j] = new double[rows];
    }

    /** Builds a matrix from row-major data; every row must have the same length. */
    public static Matrix ofRows(double[][] data) {
        int m = data.length;
        int n = m == 0 ? 0 : data[0].length;
        Matrix a = new Matrix(m, n);
        for (int i = 0; i < m; i++) {
            if (data[i].length != n) throw new IllegalArgumentException("Ragged row " + i);
            for (int j = 0; j < n; j++) a.columns[j][i] = data[i][j];
        }
        return a;
    }

    public int rows() { return rows; }
    public int cols() { return cols; }

    public double get(int r, int c) { return columns[c][r]; }
    public void set(int r, int c, double value) { columns[c][r] = value; }

    /** Returns a copy of column {@code c}. */
    public double[] column(int c) { return columns[c].clone(); }

    /** Backing array of column {@code c}; callers must not modify it. */
    double[] columnView(int c) {
        if (c < 0 || c >= cols) throw new IndexOutOfBoundsException("column " + c + " of " + cols);
        return columns[c];
    }

    /** Appends a column and returns its index. */
    public int appendColumn(double[] column) {
        if (column.length != rows) {
            throw new IllegalArgumentException("Expected " + rows + " entries, got " + column.length);
        }
        if (cols == columns.length) columns = Arrays.copyOf(columns, cols * 2);
        columns[cols] = column.clone();
        return cols++;
    }

    /** Deep copy. */
    public Matrix copy() {
        Matrix c = new Matrix(rows, 0);
        c.columns = new double[columns.length][];
        for (int j = 0; j < cols; j++) c.columns[j] = columns[j].clone();
        c.cols = cols;
        return c;
    }

    /** Row-major copy of the contents. */
    public double[][] toArray() {
        double[][] out = new double[rows][cols];
        for (int j = 0; j < cols; j++)
            for (int i = 0; i < rows; i++) out[i][j] = columns[j][i];
        return out;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                if (j > 0) sb.append(' ');
                sb.append(columns[j][i]);
            }
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }
}
