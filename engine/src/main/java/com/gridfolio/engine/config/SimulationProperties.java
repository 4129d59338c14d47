package com.gridfolio.engine.config;

import com.gridfolio.engine.model.AssetProfile;
import com.gridfolio.engine.model.AssetType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "simulation")
@Data
@Validated
public class SimulationProperties {

    @Min(1)
    private int ensembleSize = 1000;

    private long seed = 42L;

    @Min(1)
    private int horizonHours = 8760;

    /** Realizations queued on the scenario executor at any one time. */
    @Min(1)
    private int maxInFlight = 256;

    @NotBlank
    private String start = "2023-01-01T00:00";

    /** AR(1) coefficient of the latent weather shocks. */
    @DecimalMin("0.0")
    @DecimalMax("0.999")
    private double weatherPersistence = 0.8;

    /** Optional explicit driver correlation matrix, ordered like {@link #assets}. */
    private List<List<Double>> correlationMatrix = new ArrayList<>();

    @Valid
    private Price price = new Price();

    @Valid
    private Load load = new Load();

    @Valid
    private Temperature temperature = new Temperature();

    @Valid
    private List<Asset> assets = new ArrayList<>(List.of(Asset.defaultWind(), Asset.defaultSolar()));

    public LocalDateTime startTime() {
        return LocalDateTime.parse(start);
    }

    public List<AssetProfile> assetProfiles() {
        return assets.stream().map(Asset::toProfile).toList();
    }

    public double[][] correlationMatrixOrNull() {
        if (correlationMatrix == null || correlationMatrix.isEmpty()) {
            return null;
        }
        double[][] matrix = new double[correlationMatrix.size()][];
        for (int i = 0; i < matrix.length; i++) {
            matrix[i] = correlationMatrix.get(i).stream().mapToDouble(Double::doubleValue).toArray();
        }
        return matrix;
    }

    @Data
    public static class Price {
        @PositiveOrZero
        private double baseLevel = 30.0;
        private double seasonalAmplitude = 10.0;
        private double diurnalAmplitude = 15.0;
        @PositiveOrZero
        private double weekendDiscount = 5.0;
        @PositiveOrZero
        private double noiseSigma = 5.0;
        @DecimalMin("0.0")
        @DecimalMax("0.999")
        private double arCoefficient = 0.7;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double spikeProbability = 0.01;
        @Positive
        private double spikeParetoScale = 2.0;
        @Positive
        private double spikeParetoShape = 3.0;
        /** Std-dev of the log price level drawn once per realization. */
        @PositiveOrZero
        private double levelSigma = 0.15;
    }

    @Data
    public static class Load {
        @PositiveOrZero
        private double baseMw = 50_000.0;
        private double seasonalAmplitudeMw = 15_000.0;
        private double diurnalAmplitudeMw = 10_000.0;
        @Positive
        private double weekendFactor = 0.9;
        @PositiveOrZero
        private double noiseSigmaMw = 2_000.0;
    }

    @Data
    public static class Temperature {
        private double meanCelsius = 20.0;
        private double seasonalAmplitude = 10.0;
        private double diurnalAmplitude = 5.0;
        @PositiveOrZero
        private double noiseSigma = 1.5;
    }

    @Data
    public static class Asset {
        @NotBlank
        private String name;
        @NotNull
        private AssetType type;
        private double capacityMw;
        private double weibullShape = 2.0;
        private double weibullScale = 8.0;
        private double seasonalAmplitude = 0.15;
        private double diurnalAmplitude = 0.10;
        private double cutInSpeed = 3.0;
        private double ratedSpeed = 12.0;
        private double cutOutSpeed = 25.0;
        private double peakIrradiance = 1000.0;
        private double cloudAlpha = 2.0;
        private double cloudBeta = 3.0;
        private double cloudImpact = 0.75;
        private double temperatureCoefficient = -0.004;
        private double driverCorrelation = 0.0;
        private double resourceSigma = 0.08;
        private double capexPerMw = 1_300_000.0;
        private double fixedOpexPerMwYear = 40_000.0;
        private double variableOpexPerMwh = 0.0;

        static Asset defaultWind() {
            Asset wind = new Asset();
            wind.setName("wind");
            wind.setType(AssetType.WIND);
            wind.setCapacityMw(100.0);
            wind.setDriverCorrelation(-0.3);
            return wind;
        }

        static Asset defaultSolar() {
            Asset solar = new Asset();
            solar.setName("solar");
            solar.setType(AssetType.SOLAR);
            solar.setCapacityMw(100.0);
            solar.setDriverCorrelation(-0.3);
            solar.setCapexPerMw(1_000_000.0);
            solar.setFixedOpexPerMwYear(20_000.0);
            solar.setResourceSigma(0.06);
            return solar;
        }

        public AssetProfile toProfile() {
            return AssetProfile.builder()
                    .name(name)
                    .type(type)
                    .capacityMw(capacityMw)
                    .weibullShape(weibullShape)
                    .weibullScale(weibullScale)
                    .seasonalAmplitude(seasonalAmplitude)
                    .diurnalAmplitude(diurnalAmplitude)
                    .cutInSpeed(cutInSpeed)
                    .ratedSpeed(ratedSpeed)
                    .cutOutSpeed(cutOutSpeed)
                    .peakIrradiance(peakIrradiance)
                    .cloudAlpha(cloudAlpha)
                    .cloudBeta(cloudBeta)
                    .cloudImpact(cloudImpact)
                    .temperatureCoefficient(temperatureCoefficient)
                    .driverCorrelation(driverCorrelation)
                    .resourceSigma(resourceSigma)
                    .capexPerMw(capexPerMw)
                    .fixedOpexPerMwYear(fixedOpexPerMwYear)
                    .variableOpexPerMwh(variableOpexPerMwh)
                    .build();
        }
    }
}
