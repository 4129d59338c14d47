package com.gridfolio.engine.config;

import com.gridfolio.engine.service.risk.ReturnType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    @NotNull
    private ReturnType returnType = ReturnType.DIFFERENCE;

    @Min(3)
    private int minObservations = 50;

    @Min(1)
    private int forecastSteps = 168;

    private boolean fallbackEnabled = true;

    /** Rescale estimated covariance by the forecast/unconditional price variance ratio. */
    private boolean regimeAdjustment = false;

    private Garch garch = new Garch();

    @Data
    public static class Garch {
        @Min(1)
        private int p = 1;
        @Min(1)
        private int q = 1;
        @Min(100)
        private int maxEvaluations = 20_000;
        @Positive
        private double relativeTolerance = 1e-10;
        @Positive
        private double absoluteTolerance = 1e-12;
        @DecimalMin("0.5")
        @DecimalMax("0.999999")
        private double maxPersistence = 0.9999;
    }
}
