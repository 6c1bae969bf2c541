package com.revisedsimplex;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

/**
 * Revised-simplex pricing. The multipliers {@code y = c_B^T B^-1} are computed
 * once per iteration; each candidate column then costs one dot product:
 * {@code r_j = y·A_j - c_j}.
 *
 * <p>With more than one pricing thread the reduced costs are computed in
 * parallel into an array, and the entering column is still picked by a single
 * scan in index order.
 */
final class Pricer implements AutoCloseable {
    private final int threads;
    private ForkJoinPool pool;          // created on first parallel use
    private double[] scratch = new double[0];
    private double chosenReducedCost;

    Pricer(int threads) { this.threads = threads; }

    static double reducedCost(double[] y, double[] column, double cost) {
        return DenseAlgebra.dot(y, column) - cost;
    }

    /** Reduced cost of the column picked by the last {@link #choose} call. */
    double chosenReducedCost() { return chosenReducedCost; }

    /**
     * Picks the entering column, or returns -1 when no non-basic, non-artificial
     * column has {@code r_j < -tol}.
     */
    int choose(StandardForm sf, BasisState basis, double[] y, double[] cost, PivotRule rule, double tol) {
        final int n = sf.n();
        if (threads > 1 && n > 1) {
            priceAll(sf, basis, y, cost);
        }
        int best = -1;
        double bestR = -tol;
        for (int j = 0; j < n; j++) {
            if (basis.isBasic(j) || sf.isArtificial(j)) continue;
            double r = threads > 1 && n > 1 ? scratch[j] : reducedCost(y, sf.column(j), cost[j]);
            if (r < bestR) {
                best = j;
                bestR = r;
                if (rule == PivotRule.BLAND) break;
            }
        }
        chosenReducedCost = best < 0 ? 0.0 : bestR;
        return best;
    }

    private void priceAll(StandardForm sf, BasisState basis, double[] y, double[] cost) {
        final int n = sf.n();
        if (scratch.length < n) scratch = new double[n];
        final double[] out = scratch;
        if (pool == null) pool = new ForkJoinPool(threads);
        try {
            pool.submit(() -> IntStream.range(0, n).parallel().forEach(j -> {
                out[j] = basis.isBasic(j) ? 0.0 : reducedCost(y, sf.column(j), cost[j]);
            })).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LpException("Interrupted while pricing", e);
        } catch (ExecutionException e) {
            throw new LpException("Parallel pricing failed", e.getCause());
        }
    }

    @Override
    public void close() {
        if (pool != null) {
            pool.shutdown();
            pool = null;
        }
    }
}
