package com.gridfolio.engine.model;

import com.gridfolio.engine.exception.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Long-only weight vector summing to one.
 */
public final class Portfolio {

    public static final double WEIGHT_TOLERANCE = 1e-9;

    private final String name;
    private final List<String> assets;
    private final double[] weights;

    public Portfolio(String name, List<String> assets, double[] weights) {
        if (assets.size() != weights.length) {
            throw new InvalidConfigurationException("Portfolio '" + name + "' has " + assets.size()
                    + " assets but " + weights.length + " weights");
        }
        double sum = 0.0;
        for (int i = 0; i < weights.length; i++) {
            if (!Double.isFinite(weights[i]) || weights[i] < -WEIGHT_TOLERANCE) {
                throw new InvalidConfigurationException("Weight of " + assets.get(i) + " in portfolio '" + name
                        + "' must be finite and non-negative but was " + weights[i]);
            }
            sum += weights[i];
        }
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new InvalidConfigurationException("Weights of portfolio '" + name + "' must sum to 1 but sum to " + sum);
        }
        this.name = name;
        this.assets = List.copyOf(assets);
        this.weights = weights.clone();
    }

    public static Portfolio equalWeight(List<String> assets) {
        double[] weights = new double[assets.size()];
        Arrays.fill(weights, 1.0 / assets.size());
        return new Portfolio("equal-weight", assets, weights);
    }

    public static Portfolio singleAsset(List<String> assets, String asset) {
        int index = assets.indexOf(asset);
        if (index < 0) {
            throw new InvalidConfigurationException("Unknown asset " + asset);
        }
        double[] weights = new double[assets.size()];
        weights[index] = 1.0;
        return new Portfolio(asset + "-only", assets, weights);
    }

    public static List<Portfolio> benchmarks(List<String> assets) {
        List<Portfolio> benchmarks = new ArrayList<>();
        for (String asset : assets) {
            benchmarks.add(singleAsset(assets, asset));
        }
        benchmarks.add(equalWeight(assets));
        return benchmarks;
    }

    public Portfolio renamed(String newName) {
        return new Portfolio(newName, assets, weights);
    }

    public String getName() {
        return name;
    }

    public List<String> getAssets() {
        return assets;
    }

    public double[] getWeights() {
        return weights.clone();
    }

    public double weight(String asset) {
        int index = assets.indexOf(asset);
        return index < 0 ? 0.0 : weights[index];
    }

    public Map<String, Double> weightsByAsset() {
        Map<String, Double> byAsset = new LinkedHashMap<>();
        for (int i = 0; i < assets.size(); i++) {
            byAsset.put(assets.get(i), weights[i]);
        }
        return Collections.unmodifiableMap(byAsset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Portfolio other)) {
            return false;
        }
        return name.equals(other.name) && assets.equals(other.assets) && Arrays.equals(weights, other.weights);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * name.hashCode() + assets.hashCode()) + Arrays.hashCode(weights);
    }

    @Override
    public String toString() {
        return "Portfolio{" + name + ", " + weightsByAsset() + "}";
    }
}
