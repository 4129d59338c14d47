package com.gridfolio.engine.service.risk;

import com.gridfolio.engine.model.TimeSeries;

/**
 * Fits a conditional-variance model to a return series.
 */
public interface VolatilityModel {

    String name();

    FittedVolatilityModel fit(TimeSeries returns);
}
