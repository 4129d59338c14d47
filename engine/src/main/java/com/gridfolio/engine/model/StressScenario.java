package com.gridfolio.engine.model;

/**
 * Perturbation applied to market inputs before replay:
 * {@code price' = price * priceMultiplier + priceShift}, {@code gen' = gen * generationMultiplier}.
 */
public record StressScenario(String name, double priceMultiplier, double priceShift, double generationMultiplier) {

    public static StressScenario baseline() {
        return new StressScenario("baseline", 1.0, 0.0, 1.0);
    }
}
