package com.gridfolio.engine.service.simulation;

import com.gridfolio.engine.exception.InvalidConfigurationException;
import com.gridfolio.engine.model.AssetProfile;
import com.gridfolio.engine.model.TimeSeries;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class CorrelationService {

    static final double PSD_TOLERANCE = 1e-8;
    private static final double DIAGONAL_TOLERANCE = 1e-9;

    /**
     * Pearson correlation of two equally long samples; 0 when either side is constant.
     */
    public double calculateCorrelation(double[] series1, double[] series2) {
        if (series1.length != series2.length || series1.length == 0) {
            return 0;
        }

        double mean1 = 0;
        double mean2 = 0;
        for (int i = 0; i < series1.length; i++) {
            mean1 += series1[i];
            mean2 += series2[i];
        }
        mean1 /= series1.length;
        mean2 /= series2.length;

        double covariance = 0;
        double variance1 = 0;
        double variance2 = 0;
        for (int i = 0; i < series1.length; i++) {
            double diff1 = series1[i] - mean1;
            double diff2 = series2[i] - mean2;
            covariance += diff1 * diff2;
            variance1 += diff1 * diff1;
            variance2 += diff2 * diff2;
        }

        if (variance1 == 0 || variance2 == 0) {
            return 0;
        }
        return covariance / Math.sqrt(variance1 * variance2);
    }

    /**
     * Empirical correlation matrix of aligned series, keyed in map order.
     */
    public double[][] buildCorrelationMatrix(Map<String, TimeSeries> series) {
        List<double[]> columns = new ArrayList<>();
        series.values().forEach(s -> columns.add(s.getValues()));
        int size = columns.size();
        double[][] matrix = new double[size][size];
        for (int i = 0; i < size; i++) {
            matrix[i][i] = 1.0;
            for (int j = i + 1; j < size; j++) {
                double rho = calculateCorrelation(columns.get(i), columns.get(j));
                matrix[i][j] = rho;
                matrix[j][i] = rho;
            }
        }
        return matrix;
    }

    /**
     * Target driver correlation: the explicit matrix when given, otherwise the pairwise
     * average of the profiles' driver correlation coefficients.
     */
    public double[][] targetMatrix(List<AssetProfile> assets, double[][] explicit) {
        int n = assets.size();
        if (explicit != null) {
            if (explicit.length != n) {
                throw new InvalidConfigurationException(
                        "Correlation matrix has " + explicit.length + " rows for " + n + " assets");
            }
            double[][] copy = new double[n][];
            for (int i = 0; i < n; i++) {
                if (explicit[i] == null || explicit[i].length != n) {
                    throw new InvalidConfigurationException("Correlation matrix row " + i + " must have " + n + " entries");
                }
                copy[i] = explicit[i].clone();
            }
            return copy;
        }
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            matrix[i][i] = 1.0;
            for (int j = 0; j < n; j++) {
                if (i != j) {
                    matrix[i][j] = 0.5 * (assets.get(i).getDriverCorrelation() + assets.get(j).getDriverCorrelation());
                }
            }
        }
        return matrix;
    }

    /**
     * Symmetrizes and validates a correlation matrix, then returns a factor {@code L}
     * with {@code L Lᵀ = C}. Singular but PSD matrices fall back to {@code V sqrt(Λ)}.
     */
    public RealMatrix factor(double[][] correlation) {
        int n = correlation.length;
        double[][] symmetric = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double value = 0.5 * (correlation[i][j] + correlation[j][i]);
                if (!Double.isFinite(value)) {
                    throw new InvalidConfigurationException("Correlation entry (" + i + "," + j + ") is not finite");
                }
                if (Math.abs(value) > 1.0 + DIAGONAL_TOLERANCE) {
                    throw new InvalidConfigurationException(
                            "Correlation entry (" + i + "," + j + ") outside [-1, 1]: " + value);
                }
                symmetric[i][j] = value;
            }
            if (Math.abs(symmetric[i][i] - 1.0) > DIAGONAL_TOLERANCE) {
                throw new InvalidConfigurationException(
                        "Correlation diagonal entry " + i + " must be 1 but was " + symmetric[i][i]);
            }
        }

        RealMatrix matrix = new Array2DRowRealMatrix(symmetric, false);
        EigenDecomposition eigen = new EigenDecomposition(matrix);
        double[] eigenvalues = eigen.getRealEigenvalues();
        double minEigenvalue = Double.POSITIVE_INFINITY;
        for (double value : eigenvalues) {
            minEigenvalue = Math.min(minEigenvalue, value);
        }
        if (minEigenvalue < -PSD_TOLERANCE) {
            throw new InvalidConfigurationException(
                    "Correlation matrix is not positive semi-definite (smallest eigenvalue " + minEigenvalue + ")");
        }

        try {
            return new CholeskyDecomposition(matrix, 1e-12, 1e-12).getL();
        } catch (NonPositiveDefiniteMatrixException e) {
            log.debug("Correlation matrix is singular (smallest eigenvalue {}), using eigen factor", minEigenvalue);
            RealMatrix v = eigen.getV();
            RealMatrix scaled = v.copy();
            for (int j = 0; j < n; j++) {
                double root = Math.sqrt(Math.max(0.0, eigenvalues[j]));
                for (int i = 0; i < n; i++) {
                    scaled.setEntry(i, j, v.getEntry(i, j) * root);
                }
            }
            return scaled;
        }
    }
}
