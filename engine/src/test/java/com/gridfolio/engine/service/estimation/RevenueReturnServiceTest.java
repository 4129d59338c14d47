package com.gridfolio.engine.service.estimation;

import com.gridfolio.engine.exception.SeriesMismatchException;
import com.gridfolio.engine.model.AssetProfile;
import com.gridfolio.engine.model.AssetReturnSeries;
import com.gridfolio.engine.model.MarketDataset;
import com.gridfolio.engine.model.TimeSeries;
import com.gridfolio.engine.util.TestSeriesFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

class RevenueReturnServiceTest {

    private final RevenueReturnService service = new RevenueReturnService();

    @Test
    void netsFixedCostAgainstRevenueOnInvestedCapital() {
        AssetProfile wind = TestSeriesFactory.wind("wind").toBuilder().variableOpexPerMwh(2.0).build();
        TimeSeries generation = TimeSeries.of(TestSeriesFactory.START, 50.0, 0.0);
        TimeSeries price = TimeSeries.of(TestSeriesFactory.START, 40.0, 40.0);

        TimeSeries returns = service.hourlyReturns(wind, generation, price);

        double fixedPerHour = 40_000.0 * 100.0 / 8760.0;
        double capital = 100.0 * 1_300_000.0;
        assertThat(returns.get(0)).isCloseTo((50.0 * 40.0 - 2.0 * 50.0 - fixedPerHour) / capital, offset(1e-15));
        assertThat(returns.get(1)).isCloseTo(-fixedPerHour / capital, offset(1e-15));
    }

    @Test
    void rejectsMisalignedInputs() {
        TimeSeries generation = TimeSeries.of(TestSeriesFactory.START, 1.0, 2.0);
        TimeSeries price = TimeSeries.of(TestSeriesFactory.START.plusHours(1), 1.0, 2.0);

        assertThatThrownBy(() -> service.hourlyReturns(TestSeriesFactory.wind("wind"), generation, price))
                .isInstanceOf(SeriesMismatchException.class)
                .hasMessageContaining("not aligned");
    }

    @Test
    void buildsOneSeriesPerAssetInProfileOrder() {
        TimeSeries price = TimeSeries.constant(TestSeriesFactory.START, 24, 30.0);
        MarketDataset dataset = new MarketDataset(price, price, Map.of(
                "solar", TimeSeries.constant(TestSeriesFactory.START, 24, 10.0),
                "wind", TimeSeries.constant(TestSeriesFactory.START, 24, 20.0)), Map.of());

        AssetReturnSeries returns = service.returns(
                List.of(TestSeriesFactory.wind("wind"), TestSeriesFactory.solar("solar")), dataset);

        assertThat(returns.assets()).containsExactly("wind", "solar");
        assertThat(returns.size()).isEqualTo(24);
    }

    @Test
    void annualizesHorizonSum() {
        TimeSeries hourly = TimeSeries.constant(TestSeriesFactory.START, 720, 1e-5);

        assertThat(service.annualizedHorizonReturn(hourly)).isCloseTo(0.0876, offset(1e-12));
        assertThat(service.annualizedHorizonReturn(TimeSeries.of(TestSeriesFactory.START))).isZero();
    }
}
