package com.gridfolio.engine.service.backtest;

import com.gridfolio.engine.config.BacktestProperties;
import com.gridfolio.engine.config.PortfolioProperties;
import com.gridfolio.engine.exception.InvalidConfigurationException;
import com.gridfolio.engine.exception.SeriesMismatchException;
import com.gridfolio.engine.model.AssetProfile;
import com.gridfolio.engine.model.AssetReturnSeries;
import com.gridfolio.engine.model.BacktestResult;
import com.gridfolio.engine.model.BenchmarkComparison;
import com.gridfolio.engine.model.EnsembleBacktestResult;
import com.gridfolio.engine.model.MarketDataset;
import com.gridfolio.engine.model.PerformanceSummary;
import com.gridfolio.engine.model.Portfolio;
import com.gridfolio.engine.model.QuantileSummary;
import com.gridfolio.engine.model.Realization;
import com.gridfolio.engine.model.ScenarioSet;
import com.gridfolio.engine.model.TimeSeries;
import com.gridfolio.engine.service.estimation.RevenueReturnService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Replays a fixed allocation against realized asset returns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestEngine {

    private final BacktestProperties backtestProperties;
    private final PortfolioProperties portfolioProperties;
    private final PerformanceMetricsService metricsService;
    private final CvarService cvarService;
    private final RevenueReturnService revenueReturnService;

    public BacktestResult run(Portfolio portfolio, AssetReturnSeries returns) {
        TimeSeries portfolioReturns = portfolioReturns(portfolio, returns);
        TimeSeries equity = metricsService.equityCurve(portfolioReturns);
        TimeSeries drawdown = metricsService.drawdown(equity);
        PerformanceSummary summary = metricsService.summarize(portfolioReturns,
                backtestProperties.getPeriodsPerYear(),
                portfolioProperties.getRiskFreeRate(),
                backtestProperties.getVarConfidence());
        log.debug("Backtest {}: {} periods, total return {}, max drawdown {}",
                portfolio.getName(), summary.periods(), summary.totalReturn(), summary.maxDrawdown());
        return BacktestResult.builder()
                .portfolioName(portfolio.getName())
                .weights(portfolio.weightsByAsset())
                .returns(portfolioReturns)
                .equityCurve(equity)
                .drawdown(drawdown)
                .summary(summary)
                .build();
    }

    public BacktestResult run(Portfolio portfolio, List<AssetProfile> assets, MarketDataset dataset) {
        return run(portfolio, revenueReturnService.returns(assets, dataset));
    }

    /**
     * The selected portfolio next to every single-asset portfolio and the equal-weight mix.
     */
    public BenchmarkComparison compare(Portfolio selected, AssetReturnSeries returns) {
        BacktestResult selectedResult = run(selected, returns);
        List<BacktestResult> benchmarks = new ArrayList<>();
        for (Portfolio benchmark : Portfolio.benchmarks(selected.getAssets())) {
            benchmarks.add(run(benchmark, returns));
        }
        return new BenchmarkComparison(selectedResult, benchmarks);
    }

    /**
     * Replays the portfolio on every realization and summarizes the outcome distribution.
     */
    public EnsembleBacktestResult runEnsemble(Portfolio portfolio, ScenarioSet scenarios) {
        List<PerformanceSummary> summaries = new ArrayList<>(scenarios.size());
        List<double[]> paths = new ArrayList<>(scenarios.size());
        int pooledLength = 0;
        for (Realization realization : scenarios.realizations()) {
            AssetReturnSeries returns = revenueReturnService.returns(scenarios.assets(), MarketDataset.fromRealization(realization));
            BacktestResult result = run(portfolio, returns);
            summaries.add(result.summary());
            paths.add(result.returns().getValues());
            pooledLength += result.returns().size();
        }

        double[] pooled = new double[pooledLength];
        int offset = 0;
        for (double[] path : paths) {
            System.arraycopy(path, 0, pooled, offset, path.length);
            offset += path.length;
        }
        double confidence = backtestProperties.getVarConfidence();
        return new EnsembleBacktestResult(
                portfolio.getName(),
                summaries,
                QuantileSummary.of(summaries.stream().mapToDouble(PerformanceSummary::annualizedReturn).toArray()),
                QuantileSummary.of(summaries.stream().mapToDouble(PerformanceSummary::maxDrawdown).toArray()),
                cvarService.valueAtRisk(pooled, confidence),
                cvarService.calculate(pooled, confidence));
    }

    /**
     * Weighted asset returns. With a rebalance interval the holdings drift with their own
     * returns and are reset to the target weights every interval.
     */
    TimeSeries portfolioReturns(Portfolio portfolio, AssetReturnSeries returns) {
        validate(portfolio, returns);
        List<String> assets = portfolio.getAssets();
        double[] weights = portfolio.getWeights();
        double[][] columns = new double[assets.size()][];
        for (int i = 0; i < assets.size(); i++) {
            columns[i] = returns.series(assets.get(i)).getValues();
        }

        int periods = returns.size();
        int interval = backtestProperties.getRebalanceIntervalPeriods();
        double[] path = new double[periods];
        double[] holdings = weights.clone();
        for (int t = 0; t < periods; t++) {
            if (interval > 0 && t > 0 && t % interval == 0) {
                double total = sum(holdings);
                for (int i = 0; i < holdings.length; i++) {
                    holdings[i] = weights[i] * total;
                }
            }
            double value = interval > 0 ? sum(holdings) : 1.0;
            double gain = 0.0;
            for (int i = 0; i < columns.length; i++) {
                double exposure = interval > 0 ? holdings[i] : weights[i];
                gain += exposure * columns[i][t];
                if (interval > 0) {
                    holdings[i] *= 1.0 + columns[i][t];
                }
            }
            path[t] = value == 0.0 ? 0.0 : gain / value;
        }
        return new TimeSeries(returns.start(), path);
    }

    private void validate(Portfolio portfolio, AssetReturnSeries returns) {
        if (!new HashSet<>(portfolio.getAssets()).equals(new HashSet<>(returns.assets()))) {
            throw new SeriesMismatchException("Portfolio assets " + portfolio.getAssets()
                    + " do not match return series assets " + returns.assets());
        }
        if (returns.size() < 2) {
            throw new SeriesMismatchException("Backtest needs at least 2 observations but got " + returns.size());
        }
        if (backtestProperties.getRebalanceIntervalPeriods() < 0) {
            throw new InvalidConfigurationException("Rebalance interval must be non-negative");
        }
    }

    private static double sum(double[] values) {
        double total = 0.0;
        for (double value : values) {
            total += value;
        }
        return total;
    }
}
