package com.gridfolio.engine.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Inputs of one ensemble run. {@code correlation} may be null, in which case the
 * target matrix is built from the profiles' driver correlation coefficients.
 */
public record ScenarioRequest(
        List<AssetProfile> assets,
        LocalDateTime start,
        int horizonHours,
        int ensembleSize,
        long seed,
        double[][] correlation
) {

    public ScenarioRequest {
        assets = assets == null ? List.of() : List.copyOf(assets);
    }

    public ScenarioRequest withSeed(long newSeed) {
        return new ScenarioRequest(assets, start, horizonHours, ensembleSize, newSeed, correlation);
    }

    public ScenarioRequest withEnsembleSize(int size) {
        return new ScenarioRequest(assets, start, horizonHours, size, seed, correlation);
    }
}
