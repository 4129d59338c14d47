package com.gridfolio.engine.service;

import com.gridfolio.engine.config.RiskProperties;
import com.gridfolio.engine.exception.PortfolioEngineException;
import com.gridfolio.engine.model.AnalysisReport;
import com.gridfolio.engine.model.AssetReturnSeries;
import com.gridfolio.engine.model.BacktestResult;
import com.gridfolio.engine.model.BenchmarkComparison;
import com.gridfolio.engine.model.EnsembleBacktestResult;
import com.gridfolio.engine.model.MarketDataset;
import com.gridfolio.engine.model.OptimizationResult;
import com.gridfolio.engine.model.PerformanceSummary;
import com.gridfolio.engine.model.Portfolio;
import com.gridfolio.engine.model.ReturnEstimate;
import com.gridfolio.engine.model.ScenarioRequest;
import com.gridfolio.engine.model.ScenarioSet;
import com.gridfolio.engine.model.StressTestResult;
import com.gridfolio.engine.model.VolatilityForecast;
import com.gridfolio.engine.service.backtest.BacktestEngine;
import com.gridfolio.engine.service.backtest.StressTestService;
import com.gridfolio.engine.service.estimation.ReturnEstimator;
import com.gridfolio.engine.service.estimation.RevenueReturnService;
import com.gridfolio.engine.service.optimizer.PortfolioOptimizer;
import com.gridfolio.engine.service.risk.RiskModelService;
import com.gridfolio.engine.service.simulation.ScenarioSimulator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * simulate, fit price volatility, estimate returns, optimize, then replay the selection
 * on a held-out realization, across the ensemble and under stress.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioAnalysisService {

    // decorrelates the held-out realization's seed from the ensemble seed
    private static final long HOLDOUT_SEED_SALT = 0x5DEECE66DL;

    private final ScenarioSimulator scenarioSimulator;
    private final RiskModelService riskModelService;
    private final ReturnEstimator returnEstimator;
    private final RevenueReturnService revenueReturnService;
    private final PortfolioOptimizer portfolioOptimizer;
    private final BacktestEngine backtestEngine;
    private final StressTestService stressTestService;
    private final RiskProperties riskProperties;
    private final MetricsService metricsService;

    public AnalysisReport run() {
        return run(scenarioSimulator.defaultRequest());
    }

    public AnalysisReport run(ScenarioRequest request) {
        String stage = "simulation";
        try {
            ScenarioSet ensemble = metricsService.time(stage, () -> scenarioSimulator.simulate(request));
            ScenarioSet holdout = metricsService.time(stage, () -> scenarioSimulator.simulate(
                    request.withSeed(request.seed() ^ HOLDOUT_SEED_SALT).withEnsembleSize(1)));
            MarketDataset history = MarketDataset.fromRealization(holdout.realizations().get(0));

            stage = "volatility";
            VolatilityForecast volatility = metricsService.time(stage, () -> riskModelService.forecast(history.getPrice()));
            if (volatility.fallback()) {
                metricsService.recordVolatilityFallback();
            }

            stage = "estimation";
            ReturnEstimate estimate = metricsService.time(stage, () -> {
                ReturnEstimate raw = returnEstimator.fromScenarioSet(ensemble);
                return riskProperties.isRegimeAdjustment() ? returnEstimator.withVolatilityRegime(raw, volatility) : raw;
            });

            stage = "optimization";
            OptimizationResult optimization = metricsService.time(stage, () -> portfolioOptimizer.optimize(
                    estimate, portfolioOptimizer.defaultConstraints(estimate.size()), ensemble.size()));
            if (optimization.covarianceRegularized()) {
                metricsService.recordCovarianceRegularization();
            }
            Portfolio selected = optimization.portfolio();
            metricsService.updateSelection(optimization.maxSharpePoint().sharpe(), optimization.maxSharpePoint().volatility());

            stage = "backtest";
            AssetReturnSeries heldOutReturns = revenueReturnService.returns(ensemble.assets(), history);
            BenchmarkComparison comparison = metricsService.time(stage, () -> backtestEngine.compare(selected, heldOutReturns));
            EnsembleBacktestResult ensembleReplay = metricsService.time(stage, () -> backtestEngine.runEnsemble(selected, ensemble));

            stage = "stress";
            List<StressTestResult> stress = metricsService.time(stage,
                    () -> stressTestService.run(selected, ensemble.assets(), history));

            log.info("Analysis complete: {} with Sharpe {} over {} realizations",
                    selected.weightsByAsset(), optimization.maxSharpePoint().sharpe(), ensemble.size());
            return report(request, ensemble, estimate, optimization, comparison, ensembleReplay, stress, volatility);
        } catch (PortfolioEngineException e) {
            metricsService.recordFailure(stage);
            log.error("Analysis failed during {}: {}", stage, e.getMessage());
            throw e;
        }
    }

    private AnalysisReport report(ScenarioRequest request, ScenarioSet ensemble, ReturnEstimate estimate,
                                  OptimizationResult optimization, BenchmarkComparison comparison,
                                  EnsembleBacktestResult ensembleReplay, List<StressTestResult> stress,
                                  VolatilityForecast volatility) {
        ReturnEstimate annual = estimate.annualized();
        Map<String, Double> expectedReturns = new LinkedHashMap<>();
        Map<String, Double> volatilities = new LinkedHashMap<>();
        double[] mean = annual.getExpectedReturns();
        for (int i = 0; i < annual.size(); i++) {
            expectedReturns.put(annual.getAssets().get(i), mean[i]);
            volatilities.put(annual.getAssets().get(i), annual.volatility(i));
        }
        Map<String, PerformanceSummary> outOfSample = new LinkedHashMap<>();
        outOfSample.put(comparison.selected().portfolioName(), comparison.selected().summary());
        for (BacktestResult benchmark : comparison.benchmarks()) {
            outOfSample.put(benchmark.portfolioName(), benchmark.summary());
        }
        return AnalysisReport.builder()
                .start(request.start())
                .horizonHours(request.horizonHours())
                .ensembleSize(ensemble.size())
                .seed(request.seed())
                .assets(ensemble.assetNames())
                .expectedReturns(expectedReturns)
                .volatilities(volatilities)
                .frontier(optimization.frontier())
                .selectedWeights(optimization.portfolio().weightsByAsset())
                .selectedExpectedReturn(optimization.maxSharpePoint().expectedReturn())
                .selectedVolatility(optimization.maxSharpePoint().volatility())
                .selectedSharpe(optimization.maxSharpePoint().sharpe())
                .deflatedSharpe(optimization.deflatedSharpe())
                .covarianceRegularized(optimization.covarianceRegularized())
                .outOfSample(outOfSample)
                .ensembleAnnualizedReturn(ensembleReplay.annualizedReturn())
                .ensembleMaxDrawdown(ensembleReplay.maxDrawdown())
                .ensembleValueAtRisk(ensembleReplay.pooledValueAtRisk())
                .ensembleConditionalValueAtRisk(ensembleReplay.pooledConditionalValueAtRisk())
                .stressTests(stress)
                .volatilityModel(volatility.model())
                .volatilityFallback(volatility.fallback())
                .unconditionalPriceVariance(volatility.unconditionalVariance())
                .meanForecastPriceVariance(volatility.meanVariance())
                .volatilityParameters(volatility.parameters())
                .build();
    }
}
