package com.gridfolio.engine.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "portfolio")
@Data
@Validated
public class PortfolioProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minWeight = 0.2;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double maxWeight = 1.0;

    private double riskFreeRate = 0.02;

    @Min(2)
    private int frontierPoints = 100;

    /** Periods per year of historical (non-ensemble) return estimates. */
    @Min(1)
    private int periodsPerYear = 8760;

    /**
     * Historical hourly returns are summed into blocks of this many hours before the
     * mean and covariance are taken; 730 gives monthly periods.
     */
    @Min(1)
    private int historicalBlockHours = 730;

    @Positive
    private double maxPlausibleSharpe = 10.0;

    private Tolerance tolerance = new Tolerance();

    private Solver solver = new Solver();

    @Data
    public static class Tolerance {
        @Positive
        private double weightSum = 1e-9;
        /** Smallest eigenvalue allowed before a covariance is rejected as not PSD. */
        @Positive
        private double psd = 1e-8;
        /** Smallest/largest eigenvalue ratio below which diagonal loading is applied. */
        @Positive
        private double conditioning = 1e-10;
        @Positive
        private double diagonalLoading = 1e-8;
        @Positive
        private double sharpeConsistency = 1e-9;
    }

    @Data
    public static class Solver {
        @Min(10)
        private int maxIterations = 500;
        @Positive
        private double tolerance = 1e-12;
    }
}
