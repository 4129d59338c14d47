package com.gridfolio.engine.model;

public record StressTestResult(StressScenario scenario, PerformanceSummary summary, double annualizedReturnDelta) {
}
