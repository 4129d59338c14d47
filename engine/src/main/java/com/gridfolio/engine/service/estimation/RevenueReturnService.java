package com.gridfolio.engine.service.estimation;

import com.gridfolio.engine.exception.SeriesMismatchException;
import com.gridfolio.engine.model.AssetProfile;
import com.gridfolio.engine.model.AssetReturnSeries;
import com.gridfolio.engine.model.MarketDataset;
import com.gridfolio.engine.model.TimeSeries;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts generation and price into hourly return on invested capital:
 * {@code (gen * price - varOpex * gen - fixedOpex * capacity / 8760) / (capacity * capex)}.
 */
@Service
public class RevenueReturnService {

    public static final double HOURS_PER_YEAR = 8760.0;

    public TimeSeries hourlyReturns(AssetProfile profile, TimeSeries generation, TimeSeries price) {
        if (!generation.isAlignedWith(price)) {
            throw new SeriesMismatchException("Generation of " + profile.getName() + " (start " + generation.getStart()
                    + ", " + generation.size() + " rows) is not aligned with price (start " + price.getStart()
                    + ", " + price.size() + " rows)");
        }
        double capital = profile.investedCapital();
        double fixedCostPerHour = profile.getFixedOpexPerMwYear() * profile.getCapacityMw() / HOURS_PER_YEAR;
        double[] returns = new double[generation.size()];
        for (int t = 0; t < returns.length; t++) {
            double energy = generation.get(t);
            double revenue = energy * price.get(t) - profile.getVariableOpexPerMwh() * energy - fixedCostPerHour;
            returns[t] = revenue / capital;
        }
        return new TimeSeries(generation.getStart(), returns);
    }

    public AssetReturnSeries returns(List<AssetProfile> assets, MarketDataset dataset) {
        Map<String, TimeSeries> returns = new LinkedHashMap<>();
        for (AssetProfile profile : assets) {
            returns.put(profile.getName(), hourlyReturns(profile, dataset.generation(profile.getName()), dataset.getPrice()));
        }
        return new AssetReturnSeries(returns);
    }

    /**
     * Sum of hourly returns scaled to a full year.
     */
    public double annualizedHorizonReturn(TimeSeries hourlyReturns) {
        if (hourlyReturns.isEmpty()) {
            return 0.0;
        }
        return hourlyReturns.stream().sum() * HOURS_PER_YEAR / hourlyReturns.size();
    }
}
