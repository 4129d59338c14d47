package com.gridfolio.engine.service.risk;

import com.gridfolio.engine.exception.InvalidConfigurationException;
import com.gridfolio.engine.model.TimeSeries;
import org.springframework.stereotype.Component;

@Component
public class ReturnCalculator {

    /**
     * Period-over-period changes, stamped at the later observation.
     */
    public TimeSeries returns(TimeSeries prices, ReturnType type) {
        if (prices.size() < 2) {
            return new TimeSeries(prices.getStart().plusHours(1), new double[0]);
        }
        double[] values = new double[prices.size() - 1];
        for (int t = 1; t < prices.size(); t++) {
            double previous = prices.get(t - 1);
            double current = prices.get(t);
            values[t - 1] = switch (type) {
                case LOG -> {
                    if (previous <= 0.0 || current <= 0.0) {
                        throw new InvalidConfigurationException(
                                "Log returns need strictly positive prices, found " + Math.min(previous, current)
                                        + " at " + prices.timestampAt(previous <= 0.0 ? t - 1 : t));
                    }
                    yield Math.log(current / previous);
                }
                case SIMPLE -> {
                    if (previous == 0.0) {
                        throw new InvalidConfigurationException(
                                "Simple returns are undefined after a zero price at " + prices.timestampAt(t - 1));
                    }
                    yield current / previous - 1.0;
                }
                case DIFFERENCE -> current - previous;
            };
        }
        return new TimeSeries(prices.getStart().plusHours(1), values);
    }
}
