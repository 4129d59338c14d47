package com.gridfolio.engine.service.optimizer;

import com.gridfolio.engine.config.PortfolioProperties;
import com.gridfolio.engine.exception.InvalidConfigurationException;
import com.gridfolio.engine.exception.ModelFitException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.springframework.stereotype.Component;

/**
 * Validates a covariance matrix and adds diagonal loading when it is singular or
 * ill-conditioned.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CovarianceConditioner {

    private final PortfolioProperties properties;

    public Conditioned condition(double[][] covariance) {
        int n = covariance.length;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (!Double.isFinite(covariance[i][j])) {
                    throw new ModelFitException("Covariance[" + i + "][" + j + "] is not finite: " + covariance[i][j]);
                }
            }
        }
        double[] eigenvalues = new EigenDecomposition(new Array2DRowRealMatrix(covariance, true)).getRealEigenvalues();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : eigenvalues) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        PortfolioProperties.Tolerance tolerance = properties.getTolerance();
        if (min < -tolerance.getPsd()) {
            throw new InvalidConfigurationException("Covariance is not positive semi-definite (smallest eigenvalue " + min + ")");
        }
        if (!(max > 0.0)) {
            throw new ModelFitException("Covariance has no variance (largest eigenvalue " + max + ")");
        }
        if (min > tolerance.getConditioning() * max) {
            return new Conditioned(copy(covariance), false, 0.0, min, max);
        }

        double loading = tolerance.getDiagonalLoading() * max + Math.max(0.0, -min);
        double[][] loaded = copy(covariance);
        for (int i = 0; i < n; i++) {
            loaded[i][i] += loading;
        }
        log.warn("Covariance is singular or ill-conditioned (eigenvalues {} .. {}), added diagonal loading {}", min, max, loading);
        return new Conditioned(loaded, true, loading, min, max);
    }

    private static double[][] copy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }

    public record Conditioned(
            double[][] covariance,
            boolean regularized,
            double loading,
            double smallestEigenvalue,
            double largestEigenvalue
    ) {}
}
