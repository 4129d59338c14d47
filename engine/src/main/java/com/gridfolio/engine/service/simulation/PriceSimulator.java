package com.gridfolio.engine.service.simulation;

import com.gridfolio.engine.config.SimulationProperties;
import com.gridfolio.engine.model.TimeSeries;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.distribution.ParetoDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDateTime;

/**
 * Hourly price: seasonal, diurnal and weekend mean level plus AR(1) noise, with rare
 * Pareto-sized multiplicative spikes. Floored at zero.
 */
@Component
@RequiredArgsConstructor
public class PriceSimulator {

    private final SimulationProperties properties;

    public double meanLevel(LocalDateTime timestamp) {
        SimulationProperties.Price price = properties.getPrice();
        double seasonal = price.getSeasonalAmplitude() * Math.sin(2.0 * Math.PI * timestamp.getDayOfYear() / 365.0);
        double diurnal = price.getDiurnalAmplitude() * Math.sin(2.0 * Math.PI * (timestamp.getHour() - 6) / 24.0);
        double weekend = isWeekend(timestamp) ? price.getWeekendDiscount() : 0.0;
        return price.getBaseLevel() + seasonal + diurnal - weekend;
    }

    public TimeSeries simulate(LocalDateTime start, int hours, RandomGenerator random, double levelFactor) {
        SimulationProperties.Price price = properties.getPrice();
        ParetoDistribution spike = new ParetoDistribution(null, price.getSpikeParetoScale(), price.getSpikeParetoShape());
        double[] values = new double[hours];
        double noise = 0.0;
        for (int t = 0; t < hours; t++) {
            LocalDateTime timestamp = start.plusHours(t);
            noise = price.getArCoefficient() * noise + price.getNoiseSigma() * random.nextGaussian();
            double value = (meanLevel(timestamp) + noise) * levelFactor;
            if (random.nextDouble() < price.getSpikeProbability()) {
                value *= spike.inverseCumulativeProbability(random.nextDouble());
            }
            values[t] = Math.max(0.0, value);
        }
        return new TimeSeries(start, values);
    }

    static boolean isWeekend(LocalDateTime timestamp) {
        DayOfWeek day = timestamp.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
