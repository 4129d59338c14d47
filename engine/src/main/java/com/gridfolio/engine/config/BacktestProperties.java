package com.gridfolio.engine.config;

import com.gridfolio.engine.model.StressScenario;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "backtest")
@Data
@Validated
public class BacktestProperties {

    @DecimalMin("0.5")
    @DecimalMax("0.9999")
    private double varConfidence = 0.95;

    @Min(1)
    private int periodsPerYear = 8760;

    /** 0 keeps weights fixed every period; otherwise holdings drift and are reset every N periods. */
    @PositiveOrZero
    private int rebalanceIntervalPeriods = 0;

    @Valid
    private List<Stress> stressScenarios = new ArrayList<>(List.of(
            Stress.of("price-down-20pct", 0.8, 0.0, 1.0),
            Stress.of("low-resource-15pct", 1.0, 0.0, 0.85),
            Stress.of("combined-downside", 0.8, -5.0, 0.85)
    ));

    private WalkForward walkForward = new WalkForward();

    public List<StressScenario> scenarios() {
        return stressScenarios.stream()
                .map(s -> new StressScenario(s.getName(), s.getPriceMultiplier(), s.getPriceShift(), s.getGenerationMultiplier()))
                .toList();
    }

    @Data
    public static class Stress {
        @NotBlank
        private String name;
        @PositiveOrZero
        private double priceMultiplier = 1.0;
        private double priceShift = 0.0;
        @PositiveOrZero
        private double generationMultiplier = 1.0;

        static Stress of(String name, double priceMultiplier, double priceShift, double generationMultiplier) {
            Stress stress = new Stress();
            stress.setName(name);
            stress.setPriceMultiplier(priceMultiplier);
            stress.setPriceShift(priceShift);
            stress.setGenerationMultiplier(generationMultiplier);
            return stress;
        }
    }

    @Data
    public static class WalkForward {
        @Min(24)
        private int inSampleHours = 4380;
        @Min(24)
        private int outSampleHours = 720;
        @Min(2)
        private int decayLookbackWindows = 6;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double decayThreshold = 0.7;
    }
}
