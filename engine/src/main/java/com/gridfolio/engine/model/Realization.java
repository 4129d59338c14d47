package com.gridfolio.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One Monte Carlo draw: aligned generation per asset, price, load and weather drivers.
 */
public record Realization(
        int index,
        Map<String, TimeSeries> generation,
        TimeSeries price,
        TimeSeries load,
        TimeSeries temperature,
        Map<String, TimeSeries> weatherDrivers
) {

    public Realization {
        generation = Collections.unmodifiableMap(new LinkedHashMap<>(generation));
        weatherDrivers = Collections.unmodifiableMap(new LinkedHashMap<>(weatherDrivers));
    }

    public TimeSeries generation(String asset) {
        TimeSeries series = generation.get(asset);
        if (series == null) {
            throw new IllegalArgumentException("Unknown asset " + asset);
        }
        return series;
    }

    public int length() {
        return price.size();
    }
}
