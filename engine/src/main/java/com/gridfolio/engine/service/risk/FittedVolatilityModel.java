package com.gridfolio.engine.service.risk;

import com.gridfolio.engine.model.TimeSeries;

import java.util.Map;

public interface FittedVolatilityModel {

    String name();

    /**
     * Variance path for the next {@code steps} hours, starting one hour after the
     * last fitted observation.
     */
    TimeSeries forecast(int steps);

    double unconditionalVariance();

    Map<String, Double> parameters();
}
