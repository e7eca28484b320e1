package com.botcore.toolgate.application.tuning;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ParameterBoundsTest {

    @Test
    void parametersAreGroupedByTier() {
        Map<TuningTier, List<ParameterBound>> grouped = ParameterBounds.byTier();

        assertThat(grouped).containsOnlyKeys(TuningTier.GREEN, TuningTier.YELLOW, TuningTier.RED);
        assertThat(grouped.get(TuningTier.GREEN)).hasSize(9);
        assertThat(grouped.get(TuningTier.YELLOW)).extracting(ParameterBound::key)
                .containsExactly("position_size_percent", "max_positions", "leverage");
        assertThat(grouped.get(TuningTier.RED)).extracting(ParameterBound::name)
                .containsExactly("Max Daily Loss %", "Paper Trading Engine On/Off");
    }

    @Test
    void numberBoundsAreConsistent() {
        for (ParameterBound b : ParameterBounds.all()) {
            if (b.type() != ParameterType.NUMBER) continue;

            assertThat(b.min()).as(b.key()).isNotNull().isLessThan(b.max());
            assertThat(b.step()).as(b.key()).isNotNull();
            double d = ((Number) b.defaultValue()).doubleValue();
            assertThat(d).as(b.key()).isBetween(b.min(), b.max());

            double steps = (b.max() - b.min()) / b.step();
            assertThat(steps).as(b.key()).isCloseTo(Math.rint(steps), within(1e-9));
        }
    }

    @Test
    void cooldownsAreBetweenOneMinuteAndOneDay() {
        for (ParameterBound b : ParameterBounds.all()) {
            assertThat(b.cooldownMs()).as(b.key()).isBetween(60_000L, 24 * ParameterBounds.ONE_HOUR);
        }
    }

    @Test
    void lookupIsByKey() {
        assertThat(ParameterBounds.find("leverage")).map(ParameterBound::tier).contains(TuningTier.YELLOW);
        assertThat(ParameterBounds.find("Leverage")).isEmpty();
        assertThat(ParameterBounds.find(null)).isEmpty();
    }
}
