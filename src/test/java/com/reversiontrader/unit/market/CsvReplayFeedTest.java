package com.reversiontrader.unit.market;

import static org.assertj.core.api.Assertions.assertThat;

import com.reversiontrader.market.CsvPriceDataProvider;
import com.reversiontrader.market.CsvReplayFeed;
import com.reversiontrader.market.InMemoryPriceDataProvider;
import com.reversiontrader.unit.support.TestBars;
import java.math.BigDecimal;
import java.net.URISyntaxException;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CsvReplayFeedTest {

    private InMemoryPriceDataProvider source;
    private InMemoryPriceDataProvider target;
    private CsvReplayFeed feed;

    @BeforeEach
    void setUp() {
        source = new InMemoryPriceDataProvider();
        source.addBars(TestBars.of(100, 101, 99));
        target = new InMemoryPriceDataProvider();
        feed = new CsvReplayFeed(source, target);
    }

    @Test
    @DisplayName("Each call publishes the next bar in source order")
    void publishesInOrder() {
        assertThat(feed.publishNext()).isTrue();
        assertThat(feed.publishNext()).isTrue();

        assertThat(target.getPriceHistory()).hasSize(2);
        assertThat(target.getCurrentPrice()).isEqualByComparingTo("101");
        assertThat(feed.getPublished()).isEqualTo(2);
    }

    @Test
    @DisplayName("Exhausted source publishes nothing more")
    void stopsWhenExhausted() {
        for (int i = 0; i < 3; i++) {
            feed.publishNext();
        }

        assertThat(feed.publishNext()).isFalse();
        assertThat(feed.publishNext()).isFalse();
        assertThat(target.getPriceHistory()).hasSize(3);
        assertThat(target.getCurrentPrice()).isEqualByComparingTo(BigDecimal.valueOf(99));
    }

    @Test
    @DisplayName("Replays the CSV fixture into a bounded history")
    void replaysCsvFixture() throws URISyntaxException {
        Path csv = Path.of(getClass().getResource("/data/oscillating-prices.csv").toURI());
        InMemoryPriceDataProvider bounded = new InMemoryPriceDataProvider(50);
        CsvReplayFeed csvFeed = new CsvReplayFeed(new CsvPriceDataProvider(csv), bounded);

        while (csvFeed.publishNext()) {
            // drain
        }

        assertThat(csvFeed.getPublished()).isEqualTo(129);
        assertThat(bounded.getPriceHistory()).hasSize(50);
    }
}
