package com.gridfolio.engine.service.simulation;

import com.gridfolio.engine.model.AssetProfile;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Weibull hub-height wind speed modulated by season and hour of day, converted to
 * output through a cut-in / cubic ramp / rated / cut-out power curve.
 */
@Component
public class WindGenerationModel {

    /**
     * Weibull scale at a timestamp; peaks in mid-January and mid-afternoon.
     */
    public double scaleAt(AssetProfile profile, LocalDateTime timestamp, double resourceFactor) {
        double seasonal = 1.0 + profile.getSeasonalAmplitude()
                * Math.cos(2.0 * Math.PI * (timestamp.getDayOfYear() - 15) / 365.0);
        double diurnal = 1.0 + profile.getDiurnalAmplitude()
                * Math.cos(2.0 * Math.PI * (timestamp.getHour() - 15) / 24.0);
        return profile.getWeibullScale() * resourceFactor * seasonal * diurnal;
    }

    /**
     * Inverse Weibull CDF at {@code u}.
     */
    public double speed(double u, double shape, double scale) {
        return scale * Math.pow(-Math.log1p(-u), 1.0 / shape);
    }

    public double power(AssetProfile profile, double speed) {
        double cutIn = profile.getCutInSpeed();
        double rated = profile.getRatedSpeed();
        if (speed < cutIn || speed >= profile.getCutOutSpeed()) {
            return 0.0;
        }
        if (speed >= rated) {
            return profile.getCapacityMw();
        }
        double cutInCubed = cutIn * cutIn * cutIn;
        double fraction = (speed * speed * speed - cutInCubed) / (rated * rated * rated - cutInCubed);
        return profile.getCapacityMw() * Math.min(1.0, Math.max(0.0, fraction));
    }
}
