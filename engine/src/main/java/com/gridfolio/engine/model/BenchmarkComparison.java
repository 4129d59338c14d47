package com.gridfolio.engine.model;

import java.util.List;

public record BenchmarkComparison(BacktestResult selected, List<BacktestResult> benchmarks) {

    public BenchmarkComparison {
        benchmarks = List.copyOf(benchmarks);
    }

    public BacktestResult benchmark(String name) {
        return benchmarks.stream()
                .filter(result -> result.portfolioName().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown benchmark " + name));
    }
}
