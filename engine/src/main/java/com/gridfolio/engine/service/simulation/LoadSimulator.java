package com.gridfolio.engine.service.simulation;

import com.gridfolio.engine.config.SimulationProperties;
import com.gridfolio.engine.model.TimeSeries;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

@Component
@RequiredArgsConstructor
public class LoadSimulator {

    private final SimulationProperties properties;

    public TimeSeries simulate(LocalDateTime start, int hours, RandomGenerator random) {
        SimulationProperties.Load load = properties.getLoad();
        double[] values = new double[hours];
        for (int t = 0; t < hours; t++) {
            LocalDateTime timestamp = start.plusHours(t);
            double seasonal = load.getSeasonalAmplitudeMw()
                    * Math.abs(Math.sin(2.0 * Math.PI * timestamp.getDayOfYear() / 365.0));
            double diurnal = load.getDiurnalAmplitudeMw() * Math.sin(2.0 * Math.PI * (timestamp.getHour() - 6) / 24.0);
            double level = load.getBaseMw() + seasonal + diurnal;
            if (PriceSimulator.isWeekend(timestamp)) {
                level *= load.getWeekendFactor();
            }
            values[t] = Math.max(0.0, level + load.getNoiseSigmaMw() * random.nextGaussian());
        }
        return new TimeSeries(start, values);
    }
}
