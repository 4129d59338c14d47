package com.gridfolio.engine.service.estimation;

import com.gridfolio.engine.config.PortfolioProperties;
import com.gridfolio.engine.config.SimulationProperties;
import com.gridfolio.engine.exception.InsufficientDataException;
import com.gridfolio.engine.exception.ModelFitException;
import com.gridfolio.engine.model.AssetReturnSeries;
import com.gridfolio.engine.model.ReturnEstimate;
import com.gridfolio.engine.model.ScenarioRequest;
import com.gridfolio.engine.model.ScenarioSet;
import com.gridfolio.engine.model.TimeSeries;
import com.gridfolio.engine.model.VolatilityForecast;
import com.gridfolio.engine.util.TestSeriesFactory;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

class ReturnEstimatorTest {

    private final PortfolioProperties properties = new PortfolioProperties();
    private final ReturnEstimator estimator = new ReturnEstimator(new RevenueReturnService(), properties);

    @Test
    void historicalEstimateUsesMonthlyBlocks() {
        Map<String, TimeSeries> series = new LinkedHashMap<>();
        series.put("wind", TimeSeries.constant(TestSeriesFactory.START, 3 * 730 + 100, 1e-5));
        series.put("solar", TestSeriesFactory.gaussian(3 * 730 + 100, 2e-5, 1e-4, 5L));
        AssetReturnSeries returns = TestSeriesFactory.returns(series);

        ReturnEstimate estimate = estimator.fromHistorical(returns);

        assertThat(estimate.getPeriodsPerYear()).isEqualTo(12);
        assertThat(estimate.getExpectedReturns()[0]).isCloseTo(730 * 1e-5, offset(1e-12));
        assertThat(estimate.getCovariance()[0][0]).isCloseTo(0.0, offset(1e-20));
        assertThat(estimate.getCovariance()[1][1]).isPositive();
        assertThat(estimate.annualized().getExpectedReturns()[0]).isCloseTo(12 * 730 * 1e-5, offset(1e-12));
    }

    @Test
    void historicalEstimateNeedsTwoBlocks() {
        AssetReturnSeries returns = TestSeriesFactory.returns(Map.of("wind", TestSeriesFactory.gaussian(1000, 0.0, 1e-4, 1L)));

        assertThatThrownBy(() -> estimator.fromHistorical(returns))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("1460");
    }

    @Test
    void ensembleEstimateIsAnnualAcrossRealizations() {
        SimulationProperties simulation = new SimulationProperties();
        ScenarioSet scenarios = TestSeriesFactory.simulator(simulation, Runnable::run).simulate(new ScenarioRequest(
                List.of(TestSeriesFactory.wind("wind"), TestSeriesFactory.solar("solar")),
                TestSeriesFactory.START, 24 * 14, 6, 21L, null));

        ReturnEstimate estimate = estimator.fromScenarioSet(scenarios);

        assertThat(estimate.getAssets()).containsExactly("wind", "solar");
        assertThat(estimate.getPeriodsPerYear()).isEqualTo(1);
        assertThat(estimate.getCovariance()[0][0]).isPositive();
        assertThat(estimate.getCovariance()[0][1]).isEqualTo(estimate.getCovariance()[1][0]);
    }

    @Test
    void ensembleEstimateNeedsSeveralRealizations() {
        ScenarioSet single = TestSeriesFactory.simulator(new SimulationProperties(), Runnable::run).simulate(new ScenarioRequest(
                List.of(TestSeriesFactory.wind("wind")), TestSeriesFactory.START, 48, 1, 1L, null));

        assertThatThrownBy(() -> estimator.fromScenarioSet(single)).isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void volatilityRegimeScalesCovariance() {
        ReturnEstimate estimate = new ReturnEstimate(List.of("wind", "solar"),
                new double[]{0.09, 0.07}, new double[][]{{0.02, 0.005}, {0.005, 0.03}}, 1);
        VolatilityForecast stressed = new VolatilityForecast("GARCH(1,1)",
                TimeSeries.constant(TestSeriesFactory.START, 10, 2.0), 1.0, Map.of(), false);

        ReturnEstimate scaled = estimator.withVolatilityRegime(estimate, stressed);

        assertThat(scaled.getCovariance()[0][0]).isCloseTo(0.04, offset(1e-15));
        assertThat(scaled.getCovariance()[0][1]).isCloseTo(0.01, offset(1e-15));
        assertThat(scaled.getExpectedReturns()).containsExactly(0.09, 0.07);
    }

    @Test
    void volatilityRegimeRejectsDegenerateForecast() {
        ReturnEstimate estimate = new ReturnEstimate(List.of("wind"), new double[]{0.09}, new double[][]{{0.02}}, 1);
        VolatilityForecast degenerate = new VolatilityForecast("sample-variance",
                TimeSeries.constant(TestSeriesFactory.START, 10, 0.0), 0.0, Map.of(), true);

        assertThatThrownBy(() -> estimator.withVolatilityRegime(estimate, degenerate))
                .isInstanceOf(ModelFitException.class);
    }
}
