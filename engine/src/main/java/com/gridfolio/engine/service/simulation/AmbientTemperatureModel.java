package com.gridfolio.engine.service.simulation;

import com.gridfolio.engine.config.SimulationProperties;
import com.gridfolio.engine.model.TimeSeries;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Ambient air temperature in Celsius; warmest mid-July and mid-afternoon.
 */
@Component
@RequiredArgsConstructor
public class AmbientTemperatureModel {

    private final SimulationProperties properties;

    public TimeSeries simulate(LocalDateTime start, int hours, RandomGenerator random) {
        SimulationProperties.Temperature temperature = properties.getTemperature();
        double[] values = new double[hours];
        for (int t = 0; t < hours; t++) {
            LocalDateTime timestamp = start.plusHours(t);
            double seasonal = temperature.getSeasonalAmplitude()
                    * Math.sin(2.0 * Math.PI * (timestamp.getDayOfYear() - 105) / 365.0);
            double diurnal = temperature.getDiurnalAmplitude()
                    * Math.sin(2.0 * Math.PI * (timestamp.getHour() - 9) / 24.0);
            values[t] = temperature.getMeanCelsius() + seasonal + diurnal
                    + temperature.getNoiseSigma() * random.nextGaussian();
        }
        return new TimeSeries(start, values);
    }
}
