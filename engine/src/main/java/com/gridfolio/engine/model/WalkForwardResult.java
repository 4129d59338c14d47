package com.gridfolio.engine.model;

import java.util.List;

public record WalkForwardResult(
        List<WalkForwardWindow> windows,
        double meanOutOfSampleSharpe,
        boolean performanceDecay
) {

    public WalkForwardResult {
        windows = List.copyOf(windows);
    }

    public List<Double> outOfSampleSharpe() {
        return windows.stream().map(window -> window.outOfSample().sharpe()).toList();
    }
}
