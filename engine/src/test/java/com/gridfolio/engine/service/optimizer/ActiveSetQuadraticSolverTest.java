package com.gridfolio.engine.service.optimizer;

import com.gridfolio.engine.config.PortfolioProperties;
import com.gridfolio.engine.exception.ModelFitException;
import com.gridfolio.engine.model.PortfolioConstraints;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

class ActiveSetQuadraticSolverTest {

    private final PortfolioProperties properties = new PortfolioProperties();

    // min (x - 2)^2 + (y - 1)^2  s.t.  x + y = 1, 0 <= x <= 0.8, y >= 0
    private static QuadraticProgram boundedProjection() {
        return new QuadraticProgram(
                new double[][]{{2.0, 0.0}, {0.0, 2.0}},
                new double[]{-4.0, -2.0},
                new double[][]{{1.0, 1.0}},
                new double[]{1.0},
                new double[][]{{1.0, 0.0}, {-1.0, 0.0}, {0.0, 1.0}},
                new double[]{0.0, -0.8, 0.0});
    }

    @Test
    void activatesUpperBound() {
        QuadraticSolution solution = new ActiveSetQuadraticSolver(properties).solve(boundedProjection(), new double[]{0.5, 0.5});

        assertThat(solution.x()[0]).isCloseTo(0.8, offset(1e-10));
        assertThat(solution.x()[1]).isCloseTo(0.2, offset(1e-10));
        assertThat(solution.objective()).isCloseTo(-2.92, offset(1e-10));
    }

    @Test
    void convergesFromVertexStart() {
        QuadraticSolution solution = new ActiveSetQuadraticSolver(properties).solve(boundedProjection(), new double[]{0.0, 1.0});

        assertThat(solution.x()[0]).isCloseTo(0.8, offset(1e-10));
    }

    @Test
    void failsWhenIterationBudgetIsExhausted() {
        properties.getSolver().setMaxIterations(1);

        assertThatThrownBy(() -> new ActiveSetQuadraticSolver(properties).solve(boundedProjection(), new double[]{0.5, 0.5}))
                .isInstanceOf(ModelFitException.class);
    }

    @Test
    void matchesEnumeratedOptimumOnRandomLongOnlyProblems() {
        Random random = new Random(2024);
        ActiveSetQuadraticSolver solver = new ActiveSetQuadraticSolver(properties);
        FeasibilityService feasibility = new FeasibilityService();

        for (int trial = 0; trial < 200; trial++) {
            int n = 2 + random.nextInt(4);
            double upper = Math.max(0.6, 1.0 / n + 0.05);
            PortfolioConstraints constraints = PortfolioConstraints.uniform(n, 0.05, upper);
            double[][] covariance = randomCovariance(random, n);
            double[] returns = new double[n];
            for (int i = 0; i < n; i++) {
                returns[i] = 0.03 + 0.11 * random.nextDouble();
            }
            double[] maxReturn = feasibility.maxReturnWeights(returns, constraints);

            double[] minVariance = solver.solve(longOnly(covariance, null, 0.0, constraints), maxReturn).x();
            assertThat(variance(minVariance, covariance))
                    .as("minimum variance, trial %d", trial)
                    .isCloseTo(enumerated(covariance, null, 0.0, constraints), offset(1e-9));

            double low = dot(minVariance, returns);
            double high = dot(maxReturn, returns);
            for (double fraction : new double[]{0.25, 0.5, 0.75}) {
                double target = low + fraction * (high - low);
                double[] start = new double[n];
                for (int i = 0; i < n; i++) {
                    start[i] = (1.0 - fraction) * minVariance[i] + fraction * maxReturn[i];
                }
                double[] weights = solver.solve(longOnly(covariance, returns, target, constraints), start).x();
                assertThat(variance(weights, covariance))
                        .as("target %s, trial %d", target, trial)
                        .isCloseTo(enumerated(covariance, returns, target, constraints), offset(1e-9));
            }
        }
    }

    private static double[][] randomCovariance(Random random, int n) {
        double[][] factor = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                factor[i][j] = 0.5 * random.nextGaussian();
            }
        }
        double[][] covariance = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                covariance[i][j] = dot(factor[i], factor[j]) + (i == j ? 0.001 : 0.0);
            }
        }
        return covariance;
    }

    // min wᵀΣw s.t. sum w = 1, optionally rᵀw = target, box bounds
    private static QuadraticProgram longOnly(double[][] covariance, double[] returns, double target,
                                             PortfolioConstraints constraints) {
        int n = covariance.length;
        double[][] hessian = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                hessian[i][j] = 2.0 * covariance[i][j];
            }
        }
        double[] ones = new double[n];
        Arrays.fill(ones, 1.0);
        double[][] equality = returns == null ? new double[][]{ones} : new double[][]{ones, returns};
        double[] equalityValues = returns == null ? new double[]{1.0} : new double[]{1.0, target};
        double[][] box = new double[2 * n][n];
        double[] boxValues = new double[2 * n];
        for (int i = 0; i < n; i++) {
            box[2 * i][i] = 1.0;
            boxValues[2 * i] = constraints.lower(i);
            box[2 * i + 1][i] = -1.0;
            boxValues[2 * i + 1] = -constraints.upper(i);
        }
        return new QuadraticProgram(hessian, new double[n], equality, equalityValues, box, boxValues);
    }

    /**
     * Smallest variance over every assignment of assets to free, lower or upper bound.
     */
    private static double enumerated(double[][] covariance, double[] returns, double target,
                                     PortfolioConstraints constraints) {
        int n = covariance.length;
        double best = Double.POSITIVE_INFINITY;
        int assignments = (int) Math.pow(3, n);
        for (int code = 0; code < assignments; code++) {
            List<double[]> rows = new ArrayList<>();
            List<Double> values = new ArrayList<>();
            double[] ones = new double[n];
            Arrays.fill(ones, 1.0);
            rows.add(ones);
            values.add(1.0);
            if (returns != null) {
                rows.add(returns);
                values.add(target);
            }
            int remaining = code;
            for (int i = 0; i < n; i++) {
                int state = remaining % 3;
                remaining /= 3;
                if (state > 0) {
                    double[] unit = new double[n];
                    unit[i] = 1.0;
                    rows.add(unit);
                    values.add(state == 1 ? constraints.lower(i) : constraints.upper(i));
                }
            }
            if (rows.size() > n) {
                continue;
            }
            double[] weights = equalityConstrained(covariance, rows, values);
            if (weights != null && constraints.admits(weights, 1e-12)) {
                best = Math.min(best, variance(weights, covariance));
            }
        }
        return best;
    }

    private static double[] equalityConstrained(double[][] covariance, List<double[]> rows, List<Double> values) {
        int n = covariance.length;
        int m = rows.size();
        RealMatrix kkt = new Array2DRowRealMatrix(n + m, n + m);
        RealVector rhs = new ArrayRealVector(n + m);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                kkt.setEntry(i, j, 2.0 * covariance[i][j]);
            }
        }
        for (int k = 0; k < m; k++) {
            for (int j = 0; j < n; j++) {
                kkt.setEntry(n + k, j, rows.get(k)[j]);
                kkt.setEntry(j, n + k, rows.get(k)[j]);
            }
            rhs.setEntry(n + k, values.get(k));
        }
        LUDecomposition decomposition = new LUDecomposition(kkt);
        if (!decomposition.getSolver().isNonSingular()) {
            return null;
        }
        return Arrays.copyOf(decomposition.getSolver().solve(rhs).toArray(), n);
    }

    private static double variance(double[] weights, double[][] covariance) {
        double variance = 0.0;
        for (int i = 0; i < weights.length; i++) {
            variance += weights[i] * dot(covariance[i], weights);
        }
        return variance;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
