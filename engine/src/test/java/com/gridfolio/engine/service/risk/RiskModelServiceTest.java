package com.gridfolio.engine.service.risk;

import com.gridfolio.engine.config.RiskProperties;
import com.gridfolio.engine.exception.InsufficientDataException;
import com.gridfolio.engine.exception.ModelFitException;
import com.gridfolio.engine.model.TimeSeries;
import com.gridfolio.engine.model.VolatilityForecast;
import com.gridfolio.engine.util.TestSeriesFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RiskModelServiceTest {

    private final RiskProperties properties = new RiskProperties();
    private final VolatilityModel primary = mock(VolatilityModel.class);
    private final VolatilityModel fallback = new SampleVarianceModel();
    private RiskModelService service;

    @BeforeEach
    void setUp() {
        when(primary.name()).thenReturn("GARCH(1,1)");
        service = new RiskModelService(properties, new ReturnCalculator(), primary, fallback);
    }

    @Test
    void fallsBackToSampleVarianceWhenFitFails() {
        when(primary.fit(any())).thenThrow(new ModelFitException("persistence reached the stationarity bound"));
        TimeSeries prices = TestSeriesFactory.gaussian(200, 40.0, 5.0, 3L);

        VolatilityForecast forecast = service.forecast(prices, 24);

        assertThat(forecast.fallback()).isTrue();
        assertThat(forecast.model()).isEqualTo("sample-variance");
        assertThat(forecast.variance().size()).isEqualTo(24);
        assertThat(forecast.meanVariance()).isCloseTo(forecast.unconditionalVariance(),
                offset(1e-12));
        // differences of iid N(0, 25) have variance 50
        assertThat(forecast.unconditionalVariance()).isBetween(35.0, 65.0);
    }

    @Test
    void rethrowsWhenFallbackIsDisabled() {
        properties.setFallbackEnabled(false);
        when(primary.fit(any())).thenThrow(new ModelFitException("did not converge"));

        assertThatThrownBy(() -> service.forecast(TestSeriesFactory.gaussian(200, 40.0, 5.0, 3L)))
                .isInstanceOf(ModelFitException.class)
                .hasMessageContaining("did not converge");
    }

    @Test
    void rejectsShortHistoryBeforeFitting() {
        TimeSeries prices = TestSeriesFactory.gaussian(10, 40.0, 5.0, 3L);

        assertThatThrownBy(() -> service.forecast(prices))
                .isInstanceOf(InsufficientDataException.class);
        verify(primary, never()).fit(any());
    }

    @Test
    void usesPrimaryModelWhenItFits() {
        RiskModelService real = new RiskModelService(properties, new ReturnCalculator(),
                new GarchVolatilityModel(properties.getGarch()), fallback);
        TimeSeries prices = TestSeriesFactory.pricesFrom(TestSeriesFactory.garch(3000, 0.05, 0.08, 0.90, 11L), 40.0);

        VolatilityForecast forecast = real.forecast(prices, 48);

        assertThat(forecast.fallback()).isFalse();
        assertThat(forecast.model()).isEqualTo("GARCH(1,1)");
        assertThat(forecast.parameters()).containsKeys("omega", "alpha1", "beta1", "persistence");
        assertThat(forecast.variance().size()).isEqualTo(48);
        assertThat(forecast.variance().getStart()).isEqualTo(prices.getEnd().plusHours(1));
        assertThat(forecast.unconditionalVariance()).isPositive();
    }

    // quiet stretch followed by a thousandfold jump in scale: the likelihood wants integrated variance
    private static TimeSeries pricesWithVarianceBreak() {
        double[] quiet = TestSeriesFactory.gaussian(1000, 0.0, 0.001, 5L).getValues();
        double[] loud = TestSeriesFactory.gaussian(500, 0.0, 1.0, 6L).getValues();
        double[] differences = new double[quiet.length + loud.length];
        System.arraycopy(quiet, 0, differences, 0, quiet.length);
        System.arraycopy(loud, 0, differences, quiet.length, loud.length);
        return TestSeriesFactory.pricesFrom(new TimeSeries(TestSeriesFactory.START, differences), 40.0);
    }

    private RiskModelService withRealGarch() {
        return new RiskModelService(properties, new ReturnCalculator(),
                new GarchVolatilityModel(properties.getGarch()), fallback);
    }

    @Test
    void garchAtStationarityBoundFallsBackToSampleVariance() {
        TimeSeries prices = pricesWithVarianceBreak();
        TimeSeries returns = new ReturnCalculator().returns(prices, properties.getReturnType());

        assertThatThrownBy(() -> new GarchVolatilityModel(properties.getGarch()).fit(returns))
                .isInstanceOf(ModelFitException.class)
                .hasMessageContaining("stationarity bound");

        VolatilityForecast forecast = withRealGarch().forecast(prices, 24);

        double sampleVariance = fallback.fit(returns).unconditionalVariance();
        assertThat(forecast.fallback()).isTrue();
        assertThat(forecast.model()).isEqualTo("sample-variance");
        assertThat(forecast.unconditionalVariance()).isCloseTo(sampleVariance, offset(1e-15));
        assertThat(forecast.variance().getValues()).containsOnly(sampleVariance);
    }

    @Test
    void garchOptimizerFailureFallsBackToSampleVariance() {
        properties.getGarch().setMaxEvaluations(20);
        TimeSeries prices = TestSeriesFactory.pricesFrom(TestSeriesFactory.garch(600, 0.05, 0.08, 0.90, 13L), 40.0);

        VolatilityForecast forecast = withRealGarch().forecast(prices, 12);

        assertThat(forecast.fallback()).isTrue();
        assertThat(forecast.model()).isEqualTo("sample-variance");
        assertThat(forecast.variance().size()).isEqualTo(12);
    }

    @Test
    void tooFewReturnsForGarchNeverFallsBack() {
        properties.setMinObservations(5);
        TimeSeries prices = TestSeriesFactory.gaussian(8, 40.0, 5.0, 3L);

        assertThatThrownBy(() -> withRealGarch().forecast(prices, 12))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("GARCH(1,1)");
    }
}
