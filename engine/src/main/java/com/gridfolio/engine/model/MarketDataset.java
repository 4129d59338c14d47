package com.gridfolio.engine.model;

import com.gridfolio.engine.exception.SeriesMismatchException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Hourly market table: price, load, generation per asset and weather covariates,
 * all on one contiguous clock.
 */
public final class MarketDataset {

    public static final String TEMPERATURE = "temperature";
    private static final String DRIVER_PREFIX = "driver.";

    private final TimeSeries price;
    private final TimeSeries load;
    private final Map<String, TimeSeries> generation;
    private final Map<String, TimeSeries> covariates;

    public MarketDataset(TimeSeries price, TimeSeries load, Map<String, TimeSeries> generation,
                         Map<String, TimeSeries> covariates) {
        requireAligned("load", price, load);
        generation.forEach((asset, series) -> requireAligned("generation of " + asset, price, series));
        covariates.forEach((name, series) -> requireAligned("covariate " + name, price, series));
        this.price = price;
        this.load = load;
        this.generation = Collections.unmodifiableMap(new LinkedHashMap<>(generation));
        this.covariates = Collections.unmodifiableMap(new LinkedHashMap<>(covariates));
    }

    public static MarketDataset fromRealization(Realization realization) {
        Map<String, TimeSeries> covariates = new LinkedHashMap<>();
        covariates.put(TEMPERATURE, realization.temperature());
        realization.weatherDrivers().forEach((asset, series) -> covariates.put(driverKey(asset), series));
        return new MarketDataset(realization.price(), realization.load(), realization.generation(), covariates);
    }

    /**
     * Covariate key of an asset's latent weather driver, distinct from the shared covariate names.
     */
    public static String driverKey(String asset) {
        return DRIVER_PREFIX + asset;
    }

    private static void requireAligned(String column, TimeSeries price, TimeSeries other) {
        if (!price.isAlignedWith(other)) {
            throw new SeriesMismatchException("Column " + column + " (start " + other.getStart() + ", " + other.size()
                    + " rows) is not aligned with price (start " + price.getStart() + ", " + price.size() + " rows)");
        }
    }

    public TimeSeries getPrice() {
        return price;
    }

    public TimeSeries getLoad() {
        return load;
    }

    public Map<String, TimeSeries> getGeneration() {
        return generation;
    }

    public Map<String, TimeSeries> getCovariates() {
        return covariates;
    }

    public List<String> assets() {
        return new ArrayList<>(generation.keySet());
    }

    public TimeSeries generation(String asset) {
        TimeSeries series = generation.get(asset);
        if (series == null) {
            throw new SeriesMismatchException("Dataset has no generation column for asset " + asset);
        }
        return series;
    }

    public int size() {
        return price.size();
    }

    public LocalDateTime start() {
        return price.getStart();
    }

    public TimeSeries totalGeneration() {
        double[] total = new double[size()];
        for (TimeSeries series : generation.values()) {
            for (int i = 0; i < total.length; i++) {
                total[i] += series.get(i);
            }
        }
        return new TimeSeries(start(), total);
    }

    public MarketDataset slice(int fromIndex, int toIndex) {
        Map<String, TimeSeries> slicedGeneration = new LinkedHashMap<>();
        generation.forEach((asset, series) -> slicedGeneration.put(asset, series.slice(fromIndex, toIndex)));
        Map<String, TimeSeries> slicedCovariates = new LinkedHashMap<>();
        covariates.forEach((name, series) -> slicedCovariates.put(name, series.slice(fromIndex, toIndex)));
        return new MarketDataset(price.slice(fromIndex, toIndex), load.slice(fromIndex, toIndex), slicedGeneration, slicedCovariates);
    }

    public MarketDataset withPrice(TimeSeries newPrice) {
        return new MarketDataset(newPrice, load, generation, covariates);
    }

    public MarketDataset mapGeneration(DoubleUnaryOperator operator) {
        Map<String, TimeSeries> mapped = new LinkedHashMap<>();
        generation.forEach((asset, series) -> mapped.put(asset, series.map(operator)));
        return new MarketDataset(price, load, mapped, covariates);
    }
}
