package com.reversiontrader.market;

import com.reversiontrader.domain.model.PriceBar;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pushes historical bars into the in-memory feed one at a time, in source
 * order. Paper mode uses it to run live cycles off a recorded CSV instead of a
 * market connection.
 */
public class CsvReplayFeed {

    private static final Logger log = LoggerFactory.getLogger(CsvReplayFeed.class);

    private final PriceDataProvider source;
    private final InMemoryPriceDataProvider target;
    private int published;
    private boolean exhausted;

    public CsvReplayFeed(PriceDataProvider source, InMemoryPriceDataProvider target) {
        this.source = source;
        this.target = target;
    }

    /**
     * Appends the next source bar to the in-memory feed.
     *
     * @return false once every source bar has been published
     */
    public synchronized boolean publishNext() {
        List<PriceBar> bars = source.getPriceHistory();
        if (published >= bars.size()) {
            if (!exhausted) {
                log.info("Price replay finished after {} bars", published);
                exhausted = true;
            }
            return false;
        }
        PriceBar bar = bars.get(published++);
        target.addBar(bar);
        log.debug("Replayed bar {} at {}: close={}", published, bar.getTimestamp(), bar.getClose());
        return true;
    }

    public synchronized int getPublished() {
        return published;
    }
}
