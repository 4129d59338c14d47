package com.gridfolio.engine.service.simulation;

import com.gridfolio.engine.model.AssetProfile;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Clear-sky irradiance bell between 06:00 and 18:00, derated by cloud cover and
 * cell temperature.
 */
@Component
public class SolarGenerationModel {

    static final double SUNRISE_HOUR = 6.0;
    static final double SUNSET_HOUR = 18.0;
    private static final double STC_IRRADIANCE = 1000.0;
    private static final double STC_TEMPERATURE = 25.0;
    // NOCT 45 C at 800 W/m2
    private static final double CELL_HEATING_PER_IRRADIANCE = 25.0 / 800.0;

    public boolean isDaylight(LocalDateTime timestamp) {
        int hour = timestamp.getHour();
        return hour > SUNRISE_HOUR && hour < SUNSET_HOUR;
    }

    /**
     * Clear-sky plane irradiance in W/m2, exactly 0 outside daylight.
     */
    public double clearSkyIrradiance(AssetProfile profile, LocalDateTime timestamp, double resourceFactor) {
        if (!isDaylight(timestamp)) {
            return 0.0;
        }
        double bell = Math.sin(Math.PI * (timestamp.getHour() - SUNRISE_HOUR) / (SUNSET_HOUR - SUNRISE_HOUR));
        double seasonal = 1.0 + profile.getSeasonalAmplitude()
                * Math.sin(2.0 * Math.PI * (timestamp.getDayOfYear() - 80) / 365.0);
        return Math.max(0.0, profile.getPeakIrradiance() * bell * seasonal * resourceFactor);
    }

    public double power(AssetProfile profile, double irradiance, double cloudCover, double ambientTemperature) {
        if (irradiance <= 0.0) {
            return 0.0;
        }
        double effective = irradiance * (1.0 - profile.getCloudImpact() * cloudCover);
        double cellTemperature = ambientTemperature + CELL_HEATING_PER_IRRADIANCE * effective;
        double temperatureFactor = 1.0 + profile.getTemperatureCoefficient() * (cellTemperature - STC_TEMPERATURE);
        double output = profile.getCapacityMw() * effective / STC_IRRADIANCE * temperatureFactor;
        return Math.min(profile.getCapacityMw(), Math.max(0.0, output));
    }
}
