package com.gridfolio.engine.service.risk;

import com.gridfolio.engine.config.RiskProperties;
import com.gridfolio.engine.exception.InsufficientDataException;
import com.gridfolio.engine.exception.InvalidConfigurationException;
import com.gridfolio.engine.exception.ModelFitException;
import com.gridfolio.engine.model.TimeSeries;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GARCH(p, q) with {@code p} ARCH lags and {@code q} GARCH lags:
 * {@code s2_t = omega + sum alpha_i e2_(t-i) + sum beta_j s2_(t-j)}.
 *
 * <p>Fitted by Gaussian quasi-maximum likelihood with variance targeting, so
 * {@code omega = (1 - persistence) * sampleVariance}. Nelder-Mead searches an
 * unconstrained space: a logistic transform for total persistence and a softmax split
 * of it across the alpha and beta terms, which keeps every candidate stationary.</p>
 */
@Slf4j
public class GarchVolatilityModel implements VolatilityModel {

    private static final int RESTARTS = 2;

    private final int p;
    private final int q;
    private final RiskProperties.Garch settings;

    public GarchVolatilityModel(RiskProperties.Garch settings) {
        if (settings.getP() < 1 || settings.getQ() < 1) {
            throw new InvalidConfigurationException(
                    "GARCH orders must be >= 1 but were (" + settings.getP() + ", " + settings.getQ() + ")");
        }
        this.p = settings.getP();
        this.q = settings.getQ();
        this.settings = settings;
    }

    @Override
    public String name() {
        return "GARCH(" + p + "," + q + ")";
    }

    @Override
    public FittedVolatilityModel fit(TimeSeries returns) {
        int n = returns.size();
        int required = 3 * (1 + p + q);
        if (n < required) {
            throw new InsufficientDataException("Too few returns to fit " + name(), required, n);
        }
        double[] raw = returns.getValues();
        double mean = returns.stream().average().orElse(0.0);
        double sampleVariance = 0.0;
        for (double value : raw) {
            sampleVariance += (value - mean) * (value - mean);
        }
        sampleVariance /= n;
        if (!(sampleVariance > 0.0) || !Double.isFinite(sampleVariance)) {
            throw new ModelFitException("Return variance is " + sampleVariance + ", cannot fit " + name());
        }
        double scale = Math.sqrt(sampleVariance);
        double[] standardized = new double[n];
        for (int t = 0; t < n; t++) {
            standardized[t] = (raw[t] - mean) / scale;
        }

        SimplexOptimizer optimizer = new SimplexOptimizer(settings.getRelativeTolerance(), settings.getAbsoluteTolerance());
        ObjectiveFunction objective = new ObjectiveFunction(theta -> negativeLogLikelihood(standardized, theta));
        double[] guess = initialGuess();
        PointValuePair best = null;
        try {
            for (int attempt = 0; attempt < RESTARTS; attempt++) {
                best = optimizer.optimize(
                        new MaxEval(settings.getMaxEvaluations()),
                        objective,
                        GoalType.MINIMIZE,
                        new InitialGuess(guess),
                        new NelderMeadSimplex(guess.length, 0.5));
                guess = best.getPoint();
            }
        } catch (TooManyEvaluationsException e) {
            throw new ModelFitException(name() + " did not converge within " + settings.getMaxEvaluations() + " evaluations", e);
        }

        double likelihood = best.getValue();
        if (!Double.isFinite(likelihood)) {
            throw new ModelFitException(name() + " likelihood is not finite: " + likelihood);
        }
        Coefficients coefficients = decode(best.getPoint());
        if (coefficients.persistence() >= 1.0 || coefficients.persistence() >= settings.getMaxPersistence() * (1.0 - 1e-6)) {
            throw new ModelFitException(name() + " persistence " + coefficients.persistence()
                    + " reached the stationarity bound");
        }

        double omega = (1.0 - coefficients.persistence()) * sampleVariance;
        double[] variance = filter(standardized, coefficients);
        double[] conditional = new double[n];
        for (int t = 0; t < n; t++) {
            conditional[t] = variance[t] * sampleVariance;
        }
        log.debug("{} fitted on {} returns: omega={}, persistence={}, nll={}",
                name(), n, omega, coefficients.persistence(), likelihood);
        return new FittedGarch(omega, coefficients.alphas(), coefficients.betas(), sampleVariance, raw, mean,
                conditional, returns.getEnd());
    }

    private double[] initialGuess() {
        double[] theta = new double[p + q];
        double persistence = Math.min(0.9, 0.95 * settings.getMaxPersistence());
        theta[0] = logit(persistence / settings.getMaxPersistence());
        // softmax logits relative to the last beta, which is pinned at zero
        double betaLogit = Math.log(0.9 / q);
        for (int i = 0; i < p; i++) {
            theta[1 + i] = Math.log(0.1 / p) - betaLogit;
        }
        return theta;
    }

    Coefficients decode(double[] theta) {
        double persistence = settings.getMaxPersistence() / (1.0 + Math.exp(-theta[0]));
        double[] logits = new double[p + q];
        System.arraycopy(theta, 1, logits, 0, p + q - 1);
        double max = Double.NEGATIVE_INFINITY;
        for (double logit : logits) {
            max = Math.max(max, logit);
        }
        double total = 0.0;
        double[] shares = new double[p + q];
        for (int k = 0; k < shares.length; k++) {
            shares[k] = Math.exp(logits[k] - max);
            total += shares[k];
        }
        double[] alphas = new double[p];
        double[] betas = new double[q];
        for (int i = 0; i < p; i++) {
            alphas[i] = persistence * shares[i] / total;
        }
        for (int j = 0; j < q; j++) {
            betas[j] = persistence * shares[p + j] / total;
        }
        return new Coefficients(alphas, betas, persistence);
    }

    private double negativeLogLikelihood(double[] standardized, double[] theta) {
        Coefficients coefficients = decode(theta);
        double[] variance = filter(standardized, coefficients);
        double nll = 0.0;
        for (int t = 0; t < standardized.length; t++) {
            double s2 = variance[t];
            if (!(s2 > 0.0) || !Double.isFinite(s2)) {
                return Double.POSITIVE_INFINITY;
            }
            nll += Math.log(s2) + standardized[t] * standardized[t] / s2;
        }
        return 0.5 * nll;
    }

    /**
     * Conditional variances of unit-variance shocks; pre-sample terms are backcast with 1.
     */
    private double[] filter(double[] shocks, Coefficients coefficients) {
        double omega = 1.0 - coefficients.persistence();
        double[] variance = new double[shocks.length];
        for (int t = 0; t < shocks.length; t++) {
            double s2 = omega;
            for (int i = 0; i < p; i++) {
                int lag = t - 1 - i;
                s2 += coefficients.alphas()[i] * (lag >= 0 ? shocks[lag] * shocks[lag] : 1.0);
            }
            for (int j = 0; j < q; j++) {
                int lag = t - 1 - j;
                s2 += coefficients.betas()[j] * (lag >= 0 ? variance[lag] : 1.0);
            }
            variance[t] = s2;
        }
        return variance;
    }

    private static double logit(double x) {
        return Math.log(x / (1.0 - x));
    }

    record Coefficients(double[] alphas, double[] betas, double persistence) {
    }

    private final class FittedGarch implements FittedVolatilityModel {

        private final double omega;
        private final double[] alphas;
        private final double[] betas;
        private final double unconditional;
        private final double[] lastSquaredShocks;
        private final double[] lastVariances;
        private final LocalDateTime lastTimestamp;

        private FittedGarch(double omega, double[] alphas, double[] betas, double unconditional,
                            double[] returns, double mean, double[] conditional, LocalDateTime lastTimestamp) {
            this.omega = omega;
            this.alphas = alphas;
            this.betas = betas;
            this.unconditional = unconditional;
            this.lastTimestamp = lastTimestamp;
            int n = returns.length;
            // index 0 is the most recent observation
            this.lastSquaredShocks = new double[p];
            for (int i = 0; i < p; i++) {
                double shock = returns[n - 1 - i] - mean;
                lastSquaredShocks[i] = shock * shock;
            }
            this.lastVariances = new double[q];
            for (int j = 0; j < q; j++) {
                lastVariances[j] = conditional[n - 1 - j];
            }
        }

        @Override
        public String name() {
            return GarchVolatilityModel.this.name();
        }

        @Override
        public TimeSeries forecast(int steps) {
            if (steps < 0) {
                throw new InvalidConfigurationException("Forecast steps must be non-negative but was " + steps);
            }
            double[] path = new double[steps];
            for (int h = 0; h < steps; h++) {
                double s2 = omega;
                for (int i = 0; i < p; i++) {
                    int back = h - 1 - i;
                    // future squared shocks are replaced by their expectation
                    s2 += alphas[i] * (back >= 0 ? path[back] : lastSquaredShocks[-back - 1]);
                }
                for (int j = 0; j < q; j++) {
                    int back = h - 1 - j;
                    s2 += betas[j] * (back >= 0 ? path[back] : lastVariances[-back - 1]);
                }
                if (!Double.isFinite(s2)) {
                    throw new ModelFitException(name() + " forecast diverged at step " + h);
                }
                path[h] = s2;
            }
            return new TimeSeries(lastTimestamp.plusHours(1), path);
        }

        @Override
        public double unconditionalVariance() {
            return unconditional;
        }

        @Override
        public Map<String, Double> parameters() {
            Map<String, Double> parameters = new LinkedHashMap<>();
            parameters.put("omega", omega);
            double persistence = 0.0;
            for (int i = 0; i < p; i++) {
                parameters.put("alpha" + (i + 1), alphas[i]);
                persistence += alphas[i];
            }
            for (int j = 0; j < q; j++) {
                parameters.put("beta" + (j + 1), betas[j]);
                persistence += betas[j];
            }
            parameters.put("persistence", persistence);
            return parameters;
        }
    }
}
