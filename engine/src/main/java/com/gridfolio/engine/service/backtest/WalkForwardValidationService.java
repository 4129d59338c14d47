package com.gridfolio.engine.service.backtest;

import com.gridfolio.engine.config.BacktestProperties;
import com.gridfolio.engine.exception.InsufficientDataException;
import com.gridfolio.engine.model.AssetProfile;
import com.gridfolio.engine.model.AssetReturnSeries;
import com.gridfolio.engine.model.BacktestResult;
import com.gridfolio.engine.model.MarketDataset;
import com.gridfolio.engine.model.OptimizationResult;
import com.gridfolio.engine.model.WalkForwardResult;
import com.gridfolio.engine.model.WalkForwardWindow;
import com.gridfolio.engine.service.estimation.ReturnEstimator;
import com.gridfolio.engine.service.estimation.RevenueReturnService;
import com.gridfolio.engine.service.optimizer.PortfolioOptimizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Rolling estimate, optimize and replay: each window fits on its in-sample hours and is
 * scored on the following out-of-sample hours. Windows advance by the out-of-sample length.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WalkForwardValidationService {

    private final BacktestProperties properties;
    private final RevenueReturnService revenueReturnService;
    private final ReturnEstimator returnEstimator;
    private final PortfolioOptimizer portfolioOptimizer;
    private final BacktestEngine backtestEngine;

    public WalkForwardResult validate(List<AssetProfile> assets, MarketDataset dataset) {
        int inSample = properties.getWalkForward().getInSampleHours();
        int outSample = properties.getWalkForward().getOutSampleHours();
        if (dataset.size() < inSample + outSample) {
            throw new InsufficientDataException("Dataset too short for one walk-forward window",
                    inSample + outSample, dataset.size());
        }
        AssetReturnSeries returns = revenueReturnService.returns(assets, dataset);
        List<WalkForwardWindow> windows = new ArrayList<>();

        for (int start = 0; start + inSample + outSample <= returns.size(); start += outSample) {
            AssetReturnSeries inSampleData = returns.slice(start, start + inSample);
            AssetReturnSeries outSampleData = returns.slice(start + inSample, start + inSample + outSample);
            OptimizationResult optimization = portfolioOptimizer.optimize(returnEstimator.fromHistorical(inSampleData));
            BacktestResult replay = backtestEngine.run(optimization.portfolio(), outSampleData);
            windows.add(new WalkForwardWindow(
                    windows.size(),
                    inSampleData.start(),
                    outSampleData.start(),
                    outSampleData.start().plusHours(outSample - 1L),
                    optimization.portfolio().weightsByAsset(),
                    optimization.maxSharpePoint().sharpe(),
                    replay.summary()));
        }

        List<Double> sharpe = windows.stream().map(window -> window.outOfSample().sharpe()).toList();
        double mean = sharpe.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        boolean decay = detectDecay(sharpe);
        log.info("Walk-forward over {} windows: mean out-of-sample Sharpe {}, decay {}", windows.size(), mean, decay);
        return new WalkForwardResult(windows, mean, decay);
    }

    boolean detectDecay(List<Double> outOfSampleSharpe) {
        if (outOfSampleSharpe.size() < 3) {
            return false;
        }
        int lookback = properties.getWalkForward().getDecayLookbackWindows();
        int start = Math.max(0, outOfSampleSharpe.size() - lookback);
        double first = outOfSampleSharpe.get(start);
        double last = outOfSampleSharpe.get(outOfSampleSharpe.size() - 1);
        double threshold = properties.getWalkForward().getDecayThreshold();
        return last < first - Math.abs(first) * (1.0 - threshold);
    }
}
