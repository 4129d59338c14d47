package com.gridfolio.engine.service.estimation;

import com.gridfolio.engine.config.PortfolioProperties;
import com.gridfolio.engine.exception.InsufficientDataException;
import com.gridfolio.engine.exception.ModelFitException;
import com.gridfolio.engine.model.AssetProfile;
import com.gridfolio.engine.model.AssetReturnSeries;
import com.gridfolio.engine.model.MarketDataset;
import com.gridfolio.engine.model.Realization;
import com.gridfolio.engine.model.ReturnEstimate;
import com.gridfolio.engine.model.ScenarioSet;
import com.gridfolio.engine.model.TimeSeries;
import com.gridfolio.engine.model.VolatilityForecast;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReturnEstimator {

    private final RevenueReturnService revenueReturnService;
    private final PortfolioProperties properties;

    /**
     * One annualized return per asset and realization; mean and sample covariance are
     * taken across realizations, so the estimate is already annual.
     */
    public ReturnEstimate fromScenarioSet(ScenarioSet scenarios) {
        if (scenarios.size() < 2) {
            throw new InsufficientDataException("Return estimate needs several realizations", 2, scenarios.size());
        }
        List<AssetProfile> assets = scenarios.assets();
        double[][] outcomes = new double[scenarios.size()][assets.size()];
        for (int r = 0; r < scenarios.size(); r++) {
            Realization realization = scenarios.realizations().get(r);
            for (int a = 0; a < assets.size(); a++) {
                AssetProfile profile = assets.get(a);
                TimeSeries hourly = revenueReturnService.hourlyReturns(
                        profile, realization.generation(profile.getName()), realization.price());
                outcomes[r][a] = revenueReturnService.annualizedHorizonReturn(hourly);
            }
        }
        ReturnEstimate estimate = estimate(scenarios.assetNames(), outcomes, 1);
        log.info("Ensemble return estimate over {} realizations: mean {}", scenarios.size(),
                Arrays.toString(estimate.getExpectedReturns()));
        return estimate;
    }

    public ReturnEstimate fromHistorical(List<AssetProfile> assets, MarketDataset dataset) {
        return fromHistorical(revenueReturnService.returns(assets, dataset));
    }

    /**
     * Mean and sample covariance of returns summed over blocks of
     * {@code historical-block-hours}. Hourly revenue returns are strongly autocorrelated,
     * so hour-level moments scaled by 8760 understate annual risk. A trailing partial
     * block is dropped.
     */
    public ReturnEstimate fromHistorical(AssetReturnSeries returns) {
        int blockHours = properties.getHistoricalBlockHours();
        int blocks = returns.size() / blockHours;
        if (blocks < 2) {
            throw new InsufficientDataException("Return estimate needs at least two blocks of " + blockHours + " hours",
                    2 * blockHours, returns.size());
        }
        List<String> assets = returns.assets();
        double[][] observations = new double[blocks][assets.size()];
        for (int a = 0; a < assets.size(); a++) {
            TimeSeries series = returns.series(assets.get(a));
            for (int t = 0; t < blocks * blockHours; t++) {
                observations[t / blockHours][a] += series.get(t);
            }
        }
        int periodsPerYear = Math.max(1, (int) Math.round((double) properties.getPeriodsPerYear() / blockHours));
        return estimate(assets, observations, periodsPerYear);
    }

    /**
     * Scales the covariance by mean forecast variance over unconditional variance, so a
     * calm or stressed price regime widens or narrows every asset's risk alike.
     */
    public ReturnEstimate withVolatilityRegime(ReturnEstimate estimate, VolatilityForecast forecast) {
        double unconditional = forecast.unconditionalVariance();
        if (!(unconditional > 0.0) || !Double.isFinite(unconditional)) {
            throw new ModelFitException("Unconditional variance must be positive but was " + unconditional);
        }
        double ratio = forecast.meanVariance() / unconditional;
        if (!Double.isFinite(ratio)) {
            throw new ModelFitException("Volatility regime ratio is not finite");
        }
        double[][] covariance = estimate.getCovariance();
        for (double[] row : covariance) {
            for (int j = 0; j < row.length; j++) {
                row[j] *= ratio;
            }
        }
        log.info("Scaled covariance by volatility regime ratio {} ({})", ratio, forecast.model());
        return estimate.withCovariance(covariance);
    }

    private ReturnEstimate estimate(List<String> assets, double[][] observations, int periodsPerYear) {
        int n = assets.size();
        double[] mean = new double[n];
        for (double[] row : observations) {
            for (int a = 0; a < n; a++) {
                mean[a] += row[a];
            }
        }
        for (int a = 0; a < n; a++) {
            mean[a] /= observations.length;
        }
        double[][] covariance = new Covariance(observations).getCovarianceMatrix().getData();
        return new ReturnEstimate(assets, mean, covariance, periodsPerYear);
    }
}
