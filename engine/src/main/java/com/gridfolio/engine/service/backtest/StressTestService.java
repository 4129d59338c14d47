package com.gridfolio.engine.service.backtest;

import com.gridfolio.engine.config.BacktestProperties;
import com.gridfolio.engine.exception.InvalidConfigurationException;
import com.gridfolio.engine.model.AssetProfile;
import com.gridfolio.engine.model.BacktestResult;
import com.gridfolio.engine.model.MarketDataset;
import com.gridfolio.engine.model.Portfolio;
import com.gridfolio.engine.model.StressScenario;
import com.gridfolio.engine.model.StressTestResult;
import com.gridfolio.engine.model.TimeSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Replays a portfolio on perturbed market inputs through the regular backtest path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StressTestService {

    private final BacktestEngine backtestEngine;
    private final BacktestProperties properties;

    public List<StressTestResult> run(Portfolio portfolio, List<AssetProfile> assets, MarketDataset dataset) {
        return run(portfolio, assets, dataset, properties.scenarios());
    }

    public List<StressTestResult> run(Portfolio portfolio, List<AssetProfile> assets, MarketDataset dataset,
                                      List<StressScenario> scenarios) {
        BacktestResult baseline = backtestEngine.run(portfolio, assets, dataset);
        double baselineReturn = baseline.summary().annualizedReturn();
        List<StressTestResult> results = new ArrayList<>(scenarios.size());
        for (StressScenario scenario : scenarios) {
            BacktestResult stressed = backtestEngine.run(portfolio, assets, apply(dataset, scenario));
            double delta = stressed.summary().annualizedReturn() - baselineReturn;
            log.info("Stress scenario {}: annualized return {} ({} vs baseline)",
                    scenario.name(), stressed.summary().annualizedReturn(), delta);
            results.add(new StressTestResult(scenario, stressed.summary(), delta));
        }
        return results;
    }

    /**
     * {@code price * priceMultiplier + priceShift} and {@code generation * generationMultiplier}.
     */
    public MarketDataset apply(MarketDataset dataset, StressScenario scenario) {
        if (scenario.priceMultiplier() < 0.0 || scenario.generationMultiplier() < 0.0) {
            throw new InvalidConfigurationException("Stress scenario " + scenario.name() + " has a negative multiplier");
        }
        TimeSeries price = dataset.getPrice().map(value -> value * scenario.priceMultiplier() + scenario.priceShift());
        return dataset.withPrice(price).mapGeneration(value -> value * scenario.generationMultiplier());
    }
}
