package com.gridfolio.engine.service.backtest;

import com.gridfolio.engine.model.PerformanceSummary;
import com.gridfolio.engine.model.TimeSeries;
import com.gridfolio.engine.util.TestSeriesFactory;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.data.Offset.offset;

class PerformanceMetricsServiceTest {

    private final PerformanceMetricsService service = new PerformanceMetricsService(new CvarService());

    @Test
    void drawdownCountsInitialCapitalAsPeak() {
        TimeSeries equity = service.equityCurve(TimeSeries.of(TestSeriesFactory.START, -0.1, 0.05, 0.1));

        TimeSeries drawdown = service.drawdown(equity);

        assertThat(drawdown.get(0)).isCloseTo(-0.1, offset(1e-12));
        assertThat(drawdown.get(1)).isCloseTo(0.945 - 1.0, offset(1e-12));
        assertThat(drawdown.get(2)).isCloseTo(0.0, offset(1e-12));
    }

    @Test
    void summarizesAnnualizedRiskAndReturn() {
        double[] values = {0.02, -0.01, 0.03, -0.02, 0.01, 0.00};
        TimeSeries returns = new TimeSeries(TestSeriesFactory.START, values);
        int periodsPerYear = 12;
        double riskFree = 0.024;

        PerformanceSummary summary = service.summarize(returns, periodsPerYear, riskFree, 0.95);

        double mean = 0.005;
        double volatility = new StandardDeviation(true).evaluate(values) * Math.sqrt(periodsPerYear);
        assertThat(summary.annualizedReturn()).isCloseTo(mean * periodsPerYear, offset(1e-12));
        assertThat(summary.annualizedVolatility()).isCloseTo(volatility, offset(1e-12));
        assertThat(summary.sharpe()).isCloseTo((mean - riskFree / periodsPerYear) * periodsPerYear / volatility, offset(1e-12));
        // target 0.002 per period; shortfalls -0.012, -0.022, -0.002
        double downside = Math.sqrt((0.012 * 0.012 + 0.022 * 0.022 + 0.002 * 0.002) / 3.0) * Math.sqrt(periodsPerYear);
        assertThat(summary.sortino()).isCloseTo((mean - 0.002) * periodsPerYear / downside, offset(1e-9));
        assertThat(summary.maxDrawdown()).isNegative();
        assertThat(summary.calmar()).isCloseTo(summary.annualizedReturn() / -summary.maxDrawdown(), offset(1e-12));
        assertThat(summary.conditionalValueAtRisk()).isLessThanOrEqualTo(summary.valueAtRisk());
        assertThat(summary.periods()).isEqualTo(6);
    }

    @Test
    void flatReturnsHaveZeroRatios() {
        PerformanceSummary summary = service.summarize(TimeSeries.constant(TestSeriesFactory.START, 10, 0.0), 8760, 0.0, 0.95);

        assertThat(summary.sharpe()).isZero();
        assertThat(summary.sortino()).isZero();
        assertThat(summary.calmar()).isZero();
        assertThat(summary.maxDrawdown()).isZero();
    }
}
