package com.gridfolio.engine.model;

import com.gridfolio.engine.exception.SeriesMismatchException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * N realizations sharing one start, horizon and correlation structure. Every series of
 * every realization starts at {@code start} and runs {@code horizonHours} hours.
 */
public record ScenarioSet(
        List<AssetProfile> assets,
        LocalDateTime start,
        int horizonHours,
        long seed,
        List<Realization> realizations
) {

    public ScenarioSet {
        assets = List.copyOf(assets);
        realizations = List.copyOf(realizations);
        List<String> names = assets.stream().map(AssetProfile::getName).toList();
        Set<String> expected = Set.copyOf(names);
        for (Realization realization : realizations) {
            int index = realization.index();
            requireOnClock(start, horizonHours, index, "price", realization.price());
            requireOnClock(start, horizonHours, index, "load", realization.load());
            requireOnClock(start, horizonHours, index, "temperature", realization.temperature());
            if (!realization.generation().keySet().equals(expected)) {
                throw new SeriesMismatchException("Realization " + index + " covers assets "
                        + realization.generation().keySet() + " but the set has " + names);
            }
            for (Map.Entry<String, TimeSeries> entry : realization.generation().entrySet()) {
                requireOnClock(start, horizonHours, index, "generation of " + entry.getKey(), entry.getValue());
            }
            for (Map.Entry<String, TimeSeries> entry : realization.weatherDrivers().entrySet()) {
                requireOnClock(start, horizonHours, index, "weather driver of " + entry.getKey(), entry.getValue());
            }
        }
    }

    private static void requireOnClock(LocalDateTime start, int hours, int index, String column, TimeSeries series) {
        if (series == null || !series.getStart().equals(start) || series.size() != hours) {
            throw new SeriesMismatchException("Realization " + index + " " + column
                    + (series == null ? " is missing" : " starts " + series.getStart() + " with " + series.size() + " hours")
                    + ", expected " + start + " with " + hours + " hours");
        }
    }

    public int size() {
        return realizations.size();
    }

    public List<String> assetNames() {
        return assets.stream().map(AssetProfile::getName).toList();
    }

    public AssetProfile asset(String name) {
        return assets.stream()
                .filter(profile -> profile.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown asset " + name));
    }

    public EnsembleBand generationBand(String asset) {
        return EnsembleBand.across(realizations.stream().map(r -> r.generation(asset)).toList());
    }

    public EnsembleBand priceBand() {
        return EnsembleBand.across(realizations.stream().map(Realization::price).toList());
    }

    public EnsembleBand loadBand() {
        return EnsembleBand.across(realizations.stream().map(Realization::load).toList());
    }
}
