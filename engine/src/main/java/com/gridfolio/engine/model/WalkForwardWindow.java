package com.gridfolio.engine.model;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One in-sample fit followed by its out-of-sample replay.
 */
public record WalkForwardWindow(
        int index,
        LocalDateTime inSampleStart,
        LocalDateTime outOfSampleStart,
        LocalDateTime outOfSampleEnd,
        Map<String, Double> weights,
        double inSampleSharpe,
        PerformanceSummary outOfSample
) {

    public WalkForwardWindow {
        weights = Map.copyOf(weights);
    }
}
