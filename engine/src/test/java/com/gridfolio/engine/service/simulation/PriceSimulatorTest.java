package com.gridfolio.engine.service.simulation;

import com.gridfolio.engine.config.SimulationProperties;
import com.gridfolio.engine.model.TimeSeries;
import com.gridfolio.engine.util.TestSeriesFactory;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.data.Offset.offset;

class PriceSimulatorTest {

    private final SimulationProperties properties = new SimulationProperties();

    @Test
    void weekendsTradeAtDiscount() {
        PriceSimulator simulator = new PriceSimulator(properties);
        LocalDateTime friday = LocalDateTime.of(2023, 1, 6, 12, 0);
        LocalDateTime saturday = friday.plusDays(1);

        assertThat(PriceSimulator.isWeekend(saturday)).isTrue();
        assertThat(PriceSimulator.isWeekend(friday)).isFalse();
        assertThat(simulator.meanLevel(friday) - simulator.meanLevel(saturday))
                .isCloseTo(5.0, offset(0.5));
    }

    @Test
    void pricesAreFlooredAtZero() {
        properties.getPrice().setBaseLevel(0.0);
        properties.getPrice().setNoiseSigma(20.0);

        TimeSeries prices = new PriceSimulator(properties).simulate(TestSeriesFactory.START, 2000, new Well19937c(3L), 1.0);

        assertThat(prices.stream().min().orElseThrow()).isEqualTo(0.0);
    }

    @Test
    void spikesLiftUpperTail() {
        properties.getPrice().setSpikeProbability(0.0);
        TimeSeries calm = new PriceSimulator(properties).simulate(TestSeriesFactory.START, 5000, new Well19937c(8L), 1.0);
        properties.getPrice().setSpikeProbability(0.05);
        TimeSeries spiky = new PriceSimulator(properties).simulate(TestSeriesFactory.START, 5000, new Well19937c(8L), 1.0);

        assertThat(spiky.stream().max().orElseThrow()).isGreaterThan(calm.stream().max().orElseThrow());
    }

    @Test
    void streamsAreIndependentOfEachOther() {
        assertThat(RandomStreams.streamSeed(42L, 0, RandomStreams.PRICE))
                .isNotEqualTo(RandomStreams.streamSeed(42L, 0, RandomStreams.LOAD))
                .isNotEqualTo(RandomStreams.streamSeed(42L, 1, RandomStreams.PRICE));
        assertThat(RandomStreams.generator(42L, 3, RandomStreams.WEATHER).nextLong())
                .isEqualTo(RandomStreams.generator(42L, 3, RandomStreams.WEATHER).nextLong());
    }
}
