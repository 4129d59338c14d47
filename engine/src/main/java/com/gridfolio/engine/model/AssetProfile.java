package com.gridfolio.engine.model;

import lombok.Builder;
import lombok.Value;

/**
 * Generation, uncertainty and cost characteristics of one site.
 * Wind fields are ignored for solar sites and vice versa.
 */
@Value
@Builder(toBuilder = true)
public class AssetProfile {

    String name;
    AssetType type;
    double capacityMw;

    // wind
    @Builder.Default
    double weibullShape = 2.0;
    @Builder.Default
    double weibullScale = 8.0;
    @Builder.Default
    double seasonalAmplitude = 0.15;
    @Builder.Default
    double diurnalAmplitude = 0.10;
    @Builder.Default
    double cutInSpeed = 3.0;
    @Builder.Default
    double ratedSpeed = 12.0;
    @Builder.Default
    double cutOutSpeed = 25.0;

    // solar
    @Builder.Default
    double peakIrradiance = 1000.0;
    @Builder.Default
    double cloudAlpha = 2.0;
    @Builder.Default
    double cloudBeta = 3.0;
    @Builder.Default
    double cloudImpact = 0.75;
    @Builder.Default
    double temperatureCoefficient = -0.004;

    /** Correlation of this site's weather driver with the other sites' drivers. */
    @Builder.Default
    double driverCorrelation = 0.0;

    /** Std-dev of the per-realization resource multiplier (parametric uncertainty). */
    @Builder.Default
    double resourceSigma = 0.08;

    @Builder.Default
    double capexPerMw = 1_300_000.0;
    @Builder.Default
    double fixedOpexPerMwYear = 40_000.0;
    @Builder.Default
    double variableOpexPerMwh = 0.0;

    public double investedCapital() {
        return capacityMw * capexPerMw;
    }
}
