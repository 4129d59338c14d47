package com.gridfolio.engine.service.data;

import com.gridfolio.engine.exception.InsufficientDataException;
import com.gridfolio.engine.model.CorrelationTable;
import com.gridfolio.engine.model.FeatureFrame;
import com.gridfolio.engine.model.MarketDataset;
import com.gridfolio.engine.model.ProfileStatistics;
import com.gridfolio.engine.model.TimeSeries;
import com.gridfolio.engine.service.simulation.CorrelationService;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;

@Service
@RequiredArgsConstructor
public class FeatureEngineeringService {

    static final int LONGEST_LAG = 168;
    private static final int ROLLING_WINDOW = 24;

    private final CorrelationService correlationService;

    /**
     * Calendar, price-lag, rolling and penetration features. The first 168 hours are
     * dropped so every lag is defined.
     */
    public FeatureFrame features(MarketDataset dataset) {
        int size = dataset.size();
        if (size <= LONGEST_LAG) {
            throw new InsufficientDataException("Feature frame needs more than a week of hours", LONGEST_LAG + 1, size);
        }
        TimeSeries price = dataset.getPrice();
        TimeSeries load = dataset.getLoad();
        TimeSeries renewable = dataset.totalGeneration();
        int rows = size - LONGEST_LAG;
        LocalDateTime start = dataset.start().plusHours(LONGEST_LAG);

        double[] hour = new double[rows];
        double[] dayOfWeek = new double[rows];
        double[] month = new double[rows];
        double[] weekend = new double[rows];
        double[] lag1 = new double[rows];
        double[] lag24 = new double[rows];
        double[] lag168 = new double[rows];
        double[] mean24 = new double[rows];
        double[] std24 = new double[rows];
        double[] penetration = new double[rows];

        for (int row = 0; row < rows; row++) {
            int t = row + LONGEST_LAG;
            LocalDateTime timestamp = price.timestampAt(t);
            hour[row] = timestamp.getHour();
            dayOfWeek[row] = timestamp.getDayOfWeek().getValue() - 1;
            month[row] = timestamp.getMonthValue();
            DayOfWeek day = timestamp.getDayOfWeek();
            weekend[row] = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY ? 1.0 : 0.0;
            lag1[row] = price.get(t - 1);
            lag24[row] = price.get(t - 24);
            lag168[row] = price.get(t - LONGEST_LAG);

            // trailing window including the current hour
            SummaryStatistics window = new SummaryStatistics();
            for (int k = t - ROLLING_WINDOW + 1; k <= t; k++) {
                window.addValue(price.get(k));
            }
            mean24[row] = window.getMean();
            std24[row] = window.getStandardDeviation();
            penetration[row] = load.get(t) > 0.0 ? renewable.get(t) / load.get(t) : 0.0;
        }

        Map<String, TimeSeries> columns = new LinkedHashMap<>();
        columns.put(FeatureFrame.HOUR, new TimeSeries(start, hour));
        columns.put(FeatureFrame.DAY_OF_WEEK, new TimeSeries(start, dayOfWeek));
        columns.put(FeatureFrame.MONTH, new TimeSeries(start, month));
        columns.put(FeatureFrame.IS_WEEKEND, new TimeSeries(start, weekend));
        columns.put(FeatureFrame.PRICE_LAG_1H, new TimeSeries(start, lag1));
        columns.put(FeatureFrame.PRICE_LAG_24H, new TimeSeries(start, lag24));
        columns.put(FeatureFrame.PRICE_LAG_168H, new TimeSeries(start, lag168));
        columns.put(FeatureFrame.PRICE_MA_24H, new TimeSeries(start, mean24));
        columns.put(FeatureFrame.PRICE_STD_24H, new TimeSeries(start, std24));
        columns.put(FeatureFrame.RENEWABLE_PENETRATION, new TimeSeries(start, penetration));
        return new FeatureFrame(start, columns);
    }

    public List<ProfileStatistics> hourlyProfile(TimeSeries series) {
        return profile(series, 24, LocalDateTime::getHour, 0);
    }

    public List<ProfileStatistics> monthlyProfile(TimeSeries series) {
        return profile(series, 12, LocalDateTime::getMonthValue, 1);
    }

    /**
     * Pairwise correlation of price, load and every generation column.
     */
    public CorrelationTable correlations(MarketDataset dataset) {
        Map<String, TimeSeries> columns = new LinkedHashMap<>();
        columns.put("price", dataset.getPrice());
        columns.put("load", dataset.getLoad());
        dataset.getGeneration().forEach(columns::put);
        return new CorrelationTable(new ArrayList<>(columns.keySet()), correlationService.buildCorrelationMatrix(columns));
    }

    private static List<ProfileStatistics> profile(TimeSeries series, int buckets, ToIntFunction<LocalDateTime> key, int firstKey) {
        List<SummaryStatistics> statistics = new ArrayList<>(buckets);
        for (int b = 0; b < buckets; b++) {
            statistics.add(new SummaryStatistics());
        }
        for (int t = 0; t < series.size(); t++) {
            statistics.get(key.applyAsInt(series.timestampAt(t)) - firstKey).addValue(series.get(t));
        }
        List<ProfileStatistics> profile = new ArrayList<>();
        for (int b = 0; b < buckets; b++) {
            SummaryStatistics bucket = statistics.get(b);
            if (bucket.getN() == 0) {
                continue;
            }
            profile.add(new ProfileStatistics(b + firstKey, (int) bucket.getN(), bucket.getMean(),
                    bucket.getN() > 1 ? bucket.getStandardDeviation() : 0.0, bucket.getMin(), bucket.getMax()));
        }
        return profile;
    }
}
