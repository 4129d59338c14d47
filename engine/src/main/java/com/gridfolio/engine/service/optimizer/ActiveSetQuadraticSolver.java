package com.gridfolio.engine.service.optimizer;

import com.gridfolio.engine.config.PortfolioProperties;
import com.gridfolio.engine.exception.ModelFitException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Primal active-set method for convex QPs. Equalities stay in the working set; an
 * inequality enters when it blocks a step and leaves when its multiplier turns negative.
 * The working set stays linearly independent, so each equality-constrained subproblem
 * has a nonsingular KKT system.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActiveSetQuadraticSolver implements QuadraticProgramSolver {

    private static final double STEP_TOLERANCE = 1e-12;
    private static final double MULTIPLIER_TOLERANCE = 1e-12;
    private static final double BASIS_TOLERANCE = 1e-12;
    private static final double SPAN_TOLERANCE = 1e-9;

    private final PortfolioProperties properties;

    @Override
    public QuadraticSolution solve(QuadraticProgram program, double[] feasibleStart) {
        int n = program.dimension();
        double[][] inequalities = program.inequalityMatrix();
        double[] bounds = program.inequalityValues();
        double tolerance = properties.getSolver().getTolerance();
        int maxIterations = properties.getSolver().getMaxIterations();

        double[] x = feasibleStart.clone();
        int equalities = program.equalityValues().length;
        List<Integer> working = new ArrayList<>();
        // set after an unblocked full step: x minimizes the current subproblem
        boolean minimized = false;
        boolean degenerate = false;

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            double[] gradient = gradient(program, x);
            double[][] active = activeRows(program, working);
            double[] kkt = solveKkt(program.hessian(), active, gradient, n);
            double[] step = new double[n];
            System.arraycopy(kkt, 0, step, 0, n);
            double stepNorm = norm(step);

            if (minimized || active.length >= n || stepNorm <= STEP_TOLERANCE * Math.max(1.0, norm(x))) {
                minimized = false;
                int leaving = leavingConstraint(kkt, n + equalities, working, degenerate);
                if (leaving < 0) {
                    return new QuadraticSolution(x, program.objective(x), iteration);
                }
                working.remove(leaving);
                continue;
            }

            double alpha = 1.0;
            int blocking = -1;
            for (int i = 0; i < inequalities.length; i++) {
                if (working.contains(i)) {
                    continue;
                }
                double slope = dot(inequalities[i], step);
                if (slope < -tolerance * norm(inequalities[i]) * stepNorm) {
                    double slack = dot(inequalities[i], x) - bounds[i];
                    double limit = Math.max(0.0, slack) / -slope;
                    // rows spanned by the working set only see round-off in the slope
                    if (limit < alpha && !inSpan(active, inequalities[i])) {
                        alpha = limit;
                        blocking = i;
                    }
                }
            }
            for (int j = 0; j < n; j++) {
                x[j] += alpha * step[j];
            }
            if (blocking >= 0) {
                working.add(blocking);
            }
            minimized = blocking < 0;
            degenerate = blocking >= 0 && alpha == 0.0;
        }
        throw new ModelFitException("Quadratic program did not converge within " + maxIterations + " iterations");
    }

    /**
     * Position in the working set of the constraint to release, or -1 when every
     * multiplier is non-negative. After a zero-length step the smallest constraint index
     * wins (Bland's rule) so degenerate vertices cannot cycle.
     */
    private static int leavingConstraint(double[] kkt, int offset, List<Integer> working, boolean degenerate) {
        int leaving = -1;
        double mostNegative = -MULTIPLIER_TOLERANCE;
        for (int k = 0; k < working.size(); k++) {
            double multiplier = kkt[offset + k];
            if (degenerate) {
                if (multiplier < -MULTIPLIER_TOLERANCE && (leaving < 0 || working.get(k) < working.get(leaving))) {
                    leaving = k;
                }
            } else if (multiplier < mostNegative) {
                mostNegative = multiplier;
                leaving = k;
            }
        }
        return leaving;
    }

    /**
     * Gram-Schmidt residual of {@code row} against the active rows.
     */
    private static boolean inSpan(double[][] active, double[] row) {
        List<double[]> basis = new ArrayList<>();
        for (double[] candidate : active) {
            double[] residual = residual(basis, candidate);
            double length = norm(residual);
            if (length > BASIS_TOLERANCE * Math.max(1.0, norm(candidate))) {
                for (int j = 0; j < residual.length; j++) {
                    residual[j] /= length;
                }
                basis.add(residual);
            }
        }
        return norm(residual(basis, row)) <= SPAN_TOLERANCE * norm(row);
    }

    private static double[] residual(List<double[]> basis, double[] row) {
        double[] residual = row.clone();
        for (double[] unit : basis) {
            double projection = dot(residual, unit);
            for (int j = 0; j < residual.length; j++) {
                residual[j] -= projection * unit[j];
            }
        }
        return residual;
    }

    private static double[] gradient(QuadraticProgram program, double[] x) {
        double[][] hessian = program.hessian();
        double[] linear = program.linear();
        double[] gradient = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double value = linear[i];
            for (int j = 0; j < x.length; j++) {
                value += hessian[i][j] * x[j];
            }
            gradient[i] = value;
        }
        return gradient;
    }

    private static double[][] activeRows(QuadraticProgram program, List<Integer> working) {
        double[][] equalities = program.equalityMatrix();
        double[][] rows = new double[equalities.length + working.size()][];
        System.arraycopy(equalities, 0, rows, 0, equalities.length);
        for (int k = 0; k < working.size(); k++) {
            rows[equalities.length + k] = program.inequalityMatrix()[working.get(k)];
        }
        return rows;
    }

    /**
     * Solves {@code [G -Aᵀ; A 0] [p; lambda] = [-g; 0]}.
     */
    private static double[] solveKkt(double[][] hessian, double[][] active, double[] gradient, int n) {
        int m = active.length;
        RealMatrix kkt = new Array2DRowRealMatrix(n + m, n + m);
        RealVector rhs = new ArrayRealVector(n + m);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                kkt.setEntry(i, j, hessian[i][j]);
            }
            rhs.setEntry(i, -gradient[i]);
        }
        for (int k = 0; k < m; k++) {
            for (int j = 0; j < n; j++) {
                kkt.setEntry(n + k, j, active[k][j]);
                kkt.setEntry(j, n + k, -active[k][j]);
            }
        }
        double[] solution = new SingularValueDecomposition(kkt).getSolver().solve(rhs).toArray();
        for (double value : solution) {
            if (!Double.isFinite(value)) {
                throw new ModelFitException("KKT system produced a non-finite step");
            }
        }
        return solution;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static double norm(double[] v) {
        return Math.sqrt(dot(v, v));
    }
}
