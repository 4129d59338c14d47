package com.gridfolio.engine.service.optimizer;

import com.gridfolio.engine.config.PortfolioProperties;
import com.gridfolio.engine.exception.InvalidConfigurationException;
import com.gridfolio.engine.exception.ModelFitException;
import com.gridfolio.engine.model.FrontierPoint;
import com.gridfolio.engine.model.OptimizationResult;
import com.gridfolio.engine.model.Portfolio;
import com.gridfolio.engine.model.PortfolioConstraints;
import com.gridfolio.engine.model.ReturnEstimate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Long-only mean-variance optimizer. Traces the efficient frontier between the
 * global-minimum-variance and maximum-return portfolios and solves the maximum-Sharpe
 * portfolio directly through the homogenized QP
 * {@code min yᵀΣy s.t. (r - rf)ᵀy = 1, sum y = kappa, lb kappa <= y <= ub kappa}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioOptimizer {

    static final String MAX_SHARPE = "max-sharpe";
    private static final double TIE_TOLERANCE = 1e-12;
    private static final double MONOTONICITY_TOLERANCE = 1e-9;

    private final PortfolioProperties properties;
    private final QuadraticProgramSolver solver;
    private final FeasibilityService feasibilityService;
    private final CovarianceConditioner covarianceConditioner;
    private final DeflatedSharpeCalculator deflatedSharpeCalculator;

    public PortfolioConstraints defaultConstraints(int assets) {
        return PortfolioConstraints.uniform(assets, properties.getMinWeight(), properties.getMaxWeight());
    }

    public OptimizationResult optimize(ReturnEstimate estimate) {
        return optimize(estimate, defaultConstraints(estimate.size()));
    }

    public OptimizationResult optimize(ReturnEstimate estimate, PortfolioConstraints constraints) {
        return optimize(estimate, constraints, 0);
    }

    /**
     * @param observations independent samples behind the estimate, used to deflate the
     *                     selected Sharpe ratio for the number of frontier candidates
     */
    public OptimizationResult optimize(ReturnEstimate estimate, PortfolioConstraints constraints, int observations) {
        Problem problem = prepare(estimate, constraints);
        double riskFreeRate = properties.getRiskFreeRate();
        List<FrontierPoint> frontier = frontier(problem);

        FrontierPoint best = null;
        for (FrontierPoint point : frontier) {
            best = better(best, point);
        }
        double[] direct = maxSharpeDirect(problem);
        if (direct != null) {
            best = better(best, point(problem, direct));
        } else {
            log.warn("No admissible portfolio beats the risk-free rate {}, selecting the best frontier point", riskFreeRate);
        }

        double[] weights = best.weights();
        double analytic = analyticSharpe(weights, problem, riskFreeRate);
        if (Math.abs(analytic - best.sharpe()) > properties.getTolerance().getSharpeConsistency()) {
            throw new ModelFitException("Reported Sharpe " + best.sharpe() + " disagrees with analytic Sharpe " + analytic);
        }
        if (Math.abs(analytic) >= properties.getMaxPlausibleSharpe()) {
            throw new InvalidConfigurationException(String.format(
                    "Sharpe ratio %.4f exceeds the plausibility bound %.1f; expected returns and covariance are probably"
                            + " annualized inconsistently (estimate reported %d periods per year)",
                    analytic, properties.getMaxPlausibleSharpe(), estimate.getPeriodsPerYear()));
        }

        Portfolio portfolio = new Portfolio(MAX_SHARPE, estimate.getAssets(), weights);
        double deflated = deflatedSharpeCalculator.calculate(analytic, observations, frontier.size() + 1);
        log.info("Max-Sharpe portfolio {} (return {}, volatility {}, Sharpe {}, deflated {})",
                portfolio.weightsByAsset(), best.expectedReturn(), best.volatility(), analytic, deflated);
        return new OptimizationResult(estimate.getAssets(), frontier, best, portfolio, riskFreeRate,
                problem.regularized(), problem.loading(), deflated);
    }

    public List<FrontierPoint> efficientFrontier(ReturnEstimate estimate, PortfolioConstraints constraints) {
        return frontier(prepare(estimate, constraints));
    }

    private Problem prepare(ReturnEstimate estimate, PortfolioConstraints constraints) {
        if (constraints.size() != estimate.size()) {
            throw new InvalidConfigurationException("Constraints cover " + constraints.size()
                    + " assets but the estimate has " + estimate.size());
        }
        feasibilityService.checkBounds(constraints);
        ReturnEstimate annual = estimate.annualized();
        CovarianceConditioner.Conditioned conditioned = covarianceConditioner.condition(annual.getCovariance());
        return new Problem(annual.getExpectedReturns(), conditioned.covariance(), constraints,
                conditioned.regularized(), conditioned.loading());
    }

    private List<FrontierPoint> frontier(Problem problem) {
        double[] r = problem.expectedReturns();
        PortfolioConstraints constraints = problem.constraints();
        double[] maxReturnWeights = feasibilityService.maxReturnWeights(r, constraints);
        double[] minVarianceWeights = minimumVariance(problem, maxReturnWeights);

        double lowReturn = PortfolioMath.expectedReturn(minVarianceWeights, r);
        double highReturn = PortfolioMath.expectedReturn(maxReturnWeights, r);
        int points = properties.getFrontierPoints();
        List<FrontierPoint> frontier = new ArrayList<>(points);
        if (highReturn - lowReturn <= TIE_TOLERANCE * Math.max(1.0, Math.abs(highReturn))) {
            frontier.add(point(problem, minVarianceWeights));
            return frontier;
        }

        for (int k = 0; k < points; k++) {
            double fraction = (double) k / (points - 1);
            double[] weights;
            if (k == 0) {
                weights = minVarianceWeights;
            } else {
                double target = lowReturn + fraction * (highReturn - lowReturn);
                // convex combination of the two anchors is feasible and hits the target exactly
                double[] start = new double[r.length];
                for (int i = 0; i < r.length; i++) {
                    start[i] = (1.0 - fraction) * minVarianceWeights[i] + fraction * maxReturnWeights[i];
                }
                weights = targetReturn(problem, target, start);
            }
            frontier.add(point(problem, weights));
        }

        for (int k = 1; k < frontier.size(); k++) {
            double previous = frontier.get(k - 1).volatility();
            double current = frontier.get(k).volatility();
            if (current < previous - MONOTONICITY_TOLERANCE) {
                throw new ModelFitException("Frontier volatility decreases from " + previous + " to " + current
                        + " at point " + k);
            }
        }
        log.debug("Efficient frontier with {} points from return {} to {}", frontier.size(), lowReturn, highReturn);
        return frontier;
    }

    private double[] minimumVariance(Problem problem, double[] start) {
        int n = start.length;
        double[][] equality = {ones(n)};
        QuadraticProgram program = new QuadraticProgram(twice(problem.covariance()), new double[n],
                equality, new double[]{1.0}, boxRows(n), boxValues(problem.constraints()));
        return clean(problem, solver.solve(program, start).x());
    }

    private double[] targetReturn(Problem problem, double target, double[] start) {
        int n = start.length;
        double[][] equality = {ones(n), problem.expectedReturns()};
        QuadraticProgram program = new QuadraticProgram(twice(problem.covariance()), new double[n],
                equality, new double[]{1.0, target}, boxRows(n), boxValues(problem.constraints()));
        return clean(problem, solver.solve(program, start).x());
    }

    /**
     * Homogenized max-Sharpe QP over {@code z = (y, kappa)}; returns null when no
     * admissible portfolio has positive excess return.
     */
    private double[] maxSharpeDirect(Problem problem) {
        double[] r = problem.expectedReturns();
        int n = r.length;
        double riskFreeRate = properties.getRiskFreeRate();
        double[] anchor = feasibilityService.maxReturnWeights(r, problem.constraints());
        double anchorExcess = PortfolioMath.expectedReturn(anchor, r) - riskFreeRate;
        if (anchorExcess <= 0.0) {
            return null;
        }

        double[][] hessian = new double[n + 1][n + 1];
        double[][] covariance = problem.covariance();
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                hessian[i][j] = 2.0 * covariance[i][j];
            }
        }
        double[] excessRow = new double[n + 1];
        double[] budgetRow = new double[n + 1];
        for (int i = 0; i < n; i++) {
            excessRow[i] = r[i] - riskFreeRate;
            budgetRow[i] = 1.0;
        }
        budgetRow[n] = -1.0;

        double[][] inequalities = new double[2 * n + 1][n + 1];
        double[] values = new double[2 * n + 1];
        for (int i = 0; i < n; i++) {
            inequalities[2 * i][i] = 1.0;
            inequalities[2 * i][n] = -problem.constraints().lower(i);
            inequalities[2 * i + 1][i] = -1.0;
            inequalities[2 * i + 1][n] = problem.constraints().upper(i);
        }
        inequalities[2 * n][n] = 1.0;

        double[] start = new double[n + 1];
        for (int i = 0; i < n; i++) {
            start[i] = anchor[i] / anchorExcess;
        }
        start[n] = 1.0 / anchorExcess;

        QuadraticProgram program = new QuadraticProgram(hessian, new double[n + 1],
                new double[][]{excessRow, budgetRow}, new double[]{1.0, 0.0}, inequalities, values);
        double[] z = solver.solve(program, start).x();
        double kappa = z[n];
        if (!(kappa > 0.0)) {
            throw new ModelFitException("Max-Sharpe solution has non-positive scale " + kappa);
        }
        double[] weights = new double[n];
        for (int i = 0; i < n; i++) {
            weights[i] = z[i] / kappa;
        }
        return clean(problem, weights);
    }

    private double[] clean(Problem problem, double[] weights) {
        double tolerance = properties.getTolerance().getWeightSum();
        double sum = Arrays.stream(weights).sum();
        if (Math.abs(sum - 1.0) > 1e-6 || !problem.constraints().admits(weights, 1e-6)) {
            throw new ModelFitException("Solver returned inadmissible weights " + Arrays.toString(weights));
        }
        double[] cleaned = feasibilityService.clampToPolytope(weights, problem.constraints());
        if (Math.abs(Arrays.stream(cleaned).sum() - 1.0) > tolerance) {
            throw new ModelFitException("Weights sum to " + Arrays.stream(cleaned).sum() + " after cleanup");
        }
        return cleaned;
    }

    private FrontierPoint point(Problem problem, double[] weights) {
        double volatility = PortfolioMath.volatility(weights, problem.covariance());
        double expected = PortfolioMath.expectedReturn(weights, problem.expectedReturns());
        double sharpe = PortfolioMath.sharpe(weights, problem.expectedReturns(), problem.covariance(), properties.getRiskFreeRate());
        return new FrontierPoint(volatility, expected, weights, sharpe);
    }

    /**
     * {@code (rᵀw - rf) / sqrt(wᵀΣw)} evaluated with matrix algebra, independent of the
     * frontier bookkeeping.
     */
    private static double analyticSharpe(double[] weights, Problem problem, double riskFreeRate) {
        RealVector w = new ArrayRealVector(weights);
        RealMatrix covariance = MatrixUtils.createRealMatrix(problem.covariance());
        double volatility = Math.sqrt(Math.max(0.0, w.dotProduct(covariance.operate(w))));
        double excess = w.dotProduct(new ArrayRealVector(problem.expectedReturns())) - riskFreeRate;
        return volatility == 0.0 ? 0.0 : excess / volatility;
    }

    private static FrontierPoint better(FrontierPoint current, FrontierPoint candidate) {
        if (current == null || candidate.sharpe() > current.sharpe() + TIE_TOLERANCE) {
            return candidate;
        }
        if (Math.abs(candidate.sharpe() - current.sharpe()) <= TIE_TOLERANCE && candidate.volatility() < current.volatility()) {
            return candidate;
        }
        return current;
    }

    private static double[][] twice(double[][] covariance) {
        double[][] hessian = new double[covariance.length][covariance.length];
        for (int i = 0; i < covariance.length; i++) {
            for (int j = 0; j < covariance.length; j++) {
                hessian[i][j] = 2.0 * covariance[i][j];
            }
        }
        return hessian;
    }

    private static double[] ones(int n) {
        double[] ones = new double[n];
        Arrays.fill(ones, 1.0);
        return ones;
    }

    // w_i >= lb_i and -w_i >= -ub_i
    private static double[][] boxRows(int n) {
        double[][] rows = new double[2 * n][n];
        for (int i = 0; i < n; i++) {
            rows[2 * i][i] = 1.0;
            rows[2 * i + 1][i] = -1.0;
        }
        return rows;
    }

    private static double[] boxValues(PortfolioConstraints constraints) {
        double[] values = new double[2 * constraints.size()];
        for (int i = 0; i < constraints.size(); i++) {
            values[2 * i] = constraints.lower(i);
            values[2 * i + 1] = -constraints.upper(i);
        }
        return values;
    }

    private record Problem(
            double[] expectedReturns,
            double[][] covariance,
            PortfolioConstraints constraints,
            boolean regularized,
            double loading
    ) {}
}
