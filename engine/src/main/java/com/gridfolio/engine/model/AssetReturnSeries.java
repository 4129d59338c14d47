package com.gridfolio.engine.model;

import com.gridfolio.engine.exception.SeriesMismatchException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aligned per-period returns, one series per asset.
 */
public final class AssetReturnSeries {

    private final Map<String, TimeSeries> returns;

    public AssetReturnSeries(Map<String, TimeSeries> returns) {
        if (returns.isEmpty()) {
            throw new SeriesMismatchException("Return series must contain at least one asset");
        }
        TimeSeries reference = null;
        String referenceAsset = null;
        for (Map.Entry<String, TimeSeries> entry : returns.entrySet()) {
            if (reference == null) {
                reference = entry.getValue();
                referenceAsset = entry.getKey();
            } else if (!reference.isAlignedWith(entry.getValue())) {
                throw new SeriesMismatchException("Returns of " + entry.getKey() + " (start " + entry.getValue().getStart()
                        + ", " + entry.getValue().size() + " periods) do not align with " + referenceAsset
                        + " (start " + reference.getStart() + ", " + reference.size() + " periods)");
            }
        }
        this.returns = Collections.unmodifiableMap(new LinkedHashMap<>(returns));
    }

    public List<String> assets() {
        return new ArrayList<>(returns.keySet());
    }

    public TimeSeries series(String asset) {
        TimeSeries series = returns.get(asset);
        if (series == null) {
            throw new SeriesMismatchException("No return series for asset " + asset);
        }
        return series;
    }

    public Map<String, TimeSeries> asMap() {
        return returns;
    }

    public int size() {
        return returns.values().iterator().next().size();
    }

    public LocalDateTime start() {
        return returns.values().iterator().next().getStart();
    }

    public AssetReturnSeries slice(int fromIndex, int toIndex) {
        Map<String, TimeSeries> sliced = new LinkedHashMap<>();
        returns.forEach((asset, series) -> sliced.put(asset, series.slice(fromIndex, toIndex)));
        return new AssetReturnSeries(sliced);
    }
}
