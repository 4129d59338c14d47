package com.gridfolio.engine.service.backtest;

import com.gridfolio.engine.model.PerformanceSummary;
import com.gridfolio.engine.model.TimeSeries;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PerformanceMetricsService {

    private final CvarService cvarService;

    /**
     * Equity compounded from 1.0, one value per return.
     */
    public TimeSeries equityCurve(TimeSeries returns) {
        double[] equity = new double[returns.size()];
        double value = 1.0;
        for (int t = 0; t < equity.length; t++) {
            value *= 1.0 + returns.get(t);
            equity[t] = value;
        }
        return new TimeSeries(returns.getStart(), equity);
    }

    /**
     * {@code equity / runningPeak - 1}; the initial capital of 1.0 counts as the first peak.
     */
    public TimeSeries drawdown(TimeSeries equity) {
        double[] drawdown = new double[equity.size()];
        double peak = 1.0;
        for (int t = 0; t < drawdown.length; t++) {
            peak = Math.max(peak, equity.get(t));
            drawdown[t] = equity.get(t) / peak - 1.0;
        }
        return new TimeSeries(equity.getStart(), drawdown);
    }

    public PerformanceSummary summarize(TimeSeries returns, int periodsPerYear, double riskFreeRate, double varConfidence) {
        double[] values = returns.getValues();
        TimeSeries equity = equityCurve(returns);
        double maxDrawdown = drawdown(equity).stream().min().orElse(0.0);
        double totalReturn = equity.isEmpty() ? 0.0 : equity.get(equity.size() - 1) - 1.0;

        double mean = returns.stream().average().orElse(0.0);
        double periodRiskFree = riskFreeRate / periodsPerYear;
        double annualizedReturn = mean * periodsPerYear;
        double annualizedExcess = (mean - periodRiskFree) * periodsPerYear;
        double volatility = values.length < 2 ? 0.0 : new StandardDeviation(true).evaluate(values) * Math.sqrt(periodsPerYear);
        double downsideDeviation = downsideDeviation(values, periodRiskFree) * Math.sqrt(periodsPerYear);

        return PerformanceSummary.builder()
                .periods(values.length)
                .totalReturn(totalReturn)
                .annualizedReturn(annualizedReturn)
                .annualizedVolatility(volatility)
                .sharpe(volatility == 0 ? 0 : annualizedExcess / volatility)
                .sortino(downsideDeviation == 0 ? 0 : annualizedExcess / downsideDeviation)
                .calmar(maxDrawdown == 0 ? 0 : annualizedReturn / Math.abs(maxDrawdown))
                .maxDrawdown(maxDrawdown)
                .valueAtRisk(cvarService.valueAtRisk(values, varConfidence))
                .conditionalValueAtRisk(cvarService.calculate(values, varConfidence))
                .varConfidence(varConfidence)
                .build();
    }

    // root mean square shortfall over the periods that miss the target
    private static double downsideDeviation(double[] returns, double target) {
        double sum = 0.0;
        int count = 0;
        for (double value : returns) {
            if (value < target) {
                double shortfall = value - target;
                sum += shortfall * shortfall;
                count++;
            }
        }
        return count == 0 ? 0.0 : Math.sqrt(sum / count);
    }
}
