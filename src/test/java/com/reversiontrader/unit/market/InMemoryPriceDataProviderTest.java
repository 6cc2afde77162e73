package com.reversiontrader.unit.market;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.reversiontrader.exception.DataUnavailableException;
import com.reversiontrader.market.InMemoryPriceDataProvider;
import com.reversiontrader.unit.support.TestBars;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryPriceDataProviderTest {

    @Test
    @DisplayName("Oldest bars are evicted beyond maxHistory")
    void evictsOldest() {
        InMemoryPriceDataProvider provider = new InMemoryPriceDataProvider(3);

        provider.addBars(TestBars.of(1, 2, 3, 4, 5));

        assertThat(provider.getPriceHistory()).extracting(b -> b.getClose().intValue()).containsExactly(3, 4, 5);
        assertThat(provider.getCurrentPrice()).isEqualByComparingTo("5");
    }

    @Test
    @DisplayName("Out-of-order bar is rejected")
    void rejectsOlderBar() {
        InMemoryPriceDataProvider provider = new InMemoryPriceDataProvider();
        provider.addBar(TestBars.bar(10, BigDecimal.ONE));

        assertThatThrownBy(() -> provider.addBar(TestBars.bar(5, BigDecimal.TEN)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("No current price before the first bar")
    void emptyHasNoPrice() {
        assertThatThrownBy(() -> new InMemoryPriceDataProvider().getCurrentPrice())
                .isInstanceOf(DataUnavailableException.class);
    }

    @Test
    @DisplayName("Returned history is a snapshot")
    void snapshot() {
        InMemoryPriceDataProvider provider = new InMemoryPriceDataProvider();
        provider.addBar(TestBars.bar(0, BigDecimal.ONE));

        var history = provider.getPriceHistory();
        provider.addBar(TestBars.bar(1, BigDecimal.TEN));

        assertThat(history).hasSize(1);
    }
}
