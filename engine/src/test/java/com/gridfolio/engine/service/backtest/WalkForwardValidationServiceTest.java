package com.gridfolio.engine.service.backtest;

import com.gridfolio.engine.config.BacktestProperties;
import com.gridfolio.engine.config.PortfolioProperties;
import com.gridfolio.engine.exception.InsufficientDataException;
import com.gridfolio.engine.model.AssetProfile;
import com.gridfolio.engine.model.FrontierPoint;
import com.gridfolio.engine.model.MarketDataset;
import com.gridfolio.engine.model.OptimizationResult;
import com.gridfolio.engine.model.Portfolio;
import com.gridfolio.engine.model.ReturnEstimate;
import com.gridfolio.engine.model.TimeSeries;
import com.gridfolio.engine.model.WalkForwardResult;
import com.gridfolio.engine.service.estimation.ReturnEstimator;
import com.gridfolio.engine.service.estimation.RevenueReturnService;
import com.gridfolio.engine.service.optimizer.PortfolioOptimizer;
import com.gridfolio.engine.util.TestSeriesFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WalkForwardValidationServiceTest {

    private final BacktestProperties properties = new BacktestProperties();
    private final ReturnEstimator estimator = mock(ReturnEstimator.class);
    private final PortfolioOptimizer optimizer = mock(PortfolioOptimizer.class);
    private final List<AssetProfile> assets = List.of(TestSeriesFactory.wind("wind"), TestSeriesFactory.solar("solar"));
    private WalkForwardValidationService service;

    @BeforeEach
    void setUp() {
        properties.getWalkForward().setInSampleHours(100);
        properties.getWalkForward().setOutSampleHours(50);
        List<String> names = List.of("wind", "solar");
        ReturnEstimate estimate = new ReturnEstimate(names, new double[]{0.08, 0.07},
                new double[][]{{0.02, 0.0}, {0.0, 0.03}}, 1);
        Portfolio portfolio = new Portfolio("max-sharpe", names, new double[]{0.6, 0.4});
        FrontierPoint point = new FrontierPoint(0.12, 0.076, portfolio.getWeights(), 0.47);
        when(estimator.fromHistorical(any(com.gridfolio.engine.model.AssetReturnSeries.class))).thenReturn(estimate);
        when(optimizer.optimize(any(ReturnEstimate.class))).thenReturn(new OptimizationResult(
                names, List.of(point), point, portfolio, 0.02, false, 0.0, 0.4));
        service = new WalkForwardValidationService(properties, new RevenueReturnService(), estimator, optimizer,
                TestSeriesFactory.backtestEngine(properties, new PortfolioProperties()));
    }

    private static MarketDataset dataset(int hours) {
        Map<String, TimeSeries> generation = new LinkedHashMap<>();
        generation.put("wind", TestSeriesFactory.gaussian(hours, 40.0, 10.0, 1L).map(v -> Math.max(0.0, v)));
        generation.put("solar", TestSeriesFactory.gaussian(hours, 15.0, 5.0, 2L).map(v -> Math.max(0.0, v)));
        return new MarketDataset(TestSeriesFactory.gaussian(hours, 45.0, 6.0, 3L),
                TimeSeries.constant(TestSeriesFactory.START, hours, 50_000.0), generation, Map.of());
    }

    @Test
    void rollsWindowsForwardByOutOfSampleLength() {
        WalkForwardResult result = service.validate(assets, dataset(320));

        assertThat(result.windows()).hasSize(4);
        assertThat(result.windows().get(1).inSampleStart()).isEqualTo(TestSeriesFactory.START.plusHours(50));
        assertThat(result.windows().get(0).outOfSampleStart()).isEqualTo(TestSeriesFactory.START.plusHours(100));
        assertThat(result.windows().get(0).outOfSampleEnd()).isEqualTo(TestSeriesFactory.START.plusHours(149));
        assertThat(result.windows().get(3).weights()).containsEntry("wind", 0.6);
        assertThat(result.windows()).allSatisfy(window -> assertThat(window.outOfSample().periods()).isEqualTo(50));
        assertThat(result.outOfSampleSharpe()).hasSize(4);
        verify(optimizer, times(4)).optimize(any(ReturnEstimate.class));
    }

    @Test
    void rejectsDatasetShorterThanOneWindow() {
        assertThatThrownBy(() -> service.validate(assets, dataset(120)))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void detectsDecayOnlyWhenRecentSharpeFallsBeyondThreshold() {
        assertThat(service.detectDecay(List.of(1.0, 0.9, 0.2))).isTrue();
        assertThat(service.detectDecay(List.of(1.0, 0.9, 0.8))).isFalse();
        assertThat(service.detectDecay(List.of(1.0, 0.1))).isFalse();
        // only the last six windows count
        assertThat(service.detectDecay(List.of(5.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 0.9))).isFalse();
    }
}
