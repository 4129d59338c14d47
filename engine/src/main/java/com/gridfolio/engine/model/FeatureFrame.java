package com.gridfolio.engine.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engineered hourly features. Rows start once every lag and rolling window is defined.
 */
public record FeatureFrame(LocalDateTime start, Map<String, TimeSeries> columns) {

    public static final String HOUR = "hour";
    public static final String DAY_OF_WEEK = "day_of_week";
    public static final String MONTH = "month";
    public static final String IS_WEEKEND = "is_weekend";
    public static final String PRICE_LAG_1H = "price_lag_1h";
    public static final String PRICE_LAG_24H = "price_lag_24h";
    public static final String PRICE_LAG_168H = "price_lag_168h";
    public static final String PRICE_MA_24H = "price_ma_24h";
    public static final String PRICE_STD_24H = "price_std_24h";
    public static final String RENEWABLE_PENETRATION = "renewable_penetration";

    public FeatureFrame {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public TimeSeries column(String name) {
        TimeSeries series = columns.get(name);
        if (series == null) {
            throw new IllegalArgumentException("Unknown feature " + name);
        }
        return series;
    }

    public List<String> names() {
        return List.copyOf(columns.keySet());
    }

    public int size() {
        return columns.isEmpty() ? 0 : columns.values().iterator().next().size();
    }
}
