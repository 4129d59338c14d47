package com.gridfolio.engine.service.risk;

import com.gridfolio.engine.config.RiskProperties;
import com.gridfolio.engine.exception.InsufficientDataException;
import com.gridfolio.engine.exception.ModelFitException;
import com.gridfolio.engine.model.TimeSeries;
import com.gridfolio.engine.model.VolatilityForecast;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Fits the primary volatility model to a price history and falls back to the
 * sample-variance model when the fit fails.
 */
@Slf4j
@Service
public class RiskModelService {

    private final RiskProperties properties;
    private final ReturnCalculator returnCalculator;
    private final VolatilityModel primaryModel;
    private final VolatilityModel fallbackModel;

    public RiskModelService(RiskProperties properties,
                            ReturnCalculator returnCalculator,
                            @Qualifier("primaryVolatilityModel") VolatilityModel primaryModel,
                            @Qualifier("fallbackVolatilityModel") VolatilityModel fallbackModel) {
        this.properties = properties;
        this.returnCalculator = returnCalculator;
        this.primaryModel = primaryModel;
        this.fallbackModel = fallbackModel;
    }

    public VolatilityForecast forecast(TimeSeries prices) {
        return forecast(prices, properties.getForecastSteps());
    }

    public VolatilityForecast forecast(TimeSeries prices, int steps) {
        if (prices.size() < properties.getMinObservations()) {
            throw new InsufficientDataException("Price history too short for volatility fit",
                    properties.getMinObservations(), prices.size());
        }
        TimeSeries returns = returnCalculator.returns(prices, properties.getReturnType());
        try {
            FittedVolatilityModel fitted = primaryModel.fit(returns);
            return toForecast(fitted, steps, false);
        } catch (ModelFitException e) {
            if (!properties.isFallbackEnabled()) {
                throw e;
            }
            log.warn("{} fit failed, falling back to {}: {}", primaryModel.name(), fallbackModel.name(), e.getMessage());
            return toForecast(fallbackModel.fit(returns), steps, true);
        }
    }

    private VolatilityForecast toForecast(FittedVolatilityModel fitted, int steps, boolean fallback) {
        TimeSeries variance = fitted.forecast(steps);
        log.info("{} forecast: unconditional variance {}, {} steps", fitted.name(), fitted.unconditionalVariance(), steps);
        return new VolatilityForecast(fitted.name(), variance, fitted.unconditionalVariance(), fitted.parameters(), fallback);
    }
}
