package com.reversiontrader.engine;

import com.reversiontrader.exception.DataUnavailableException;
import com.reversiontrader.market.CsvReplayFeed;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers live trading cycles with a fixed delay between the end of one cycle
 * and the start of the next. When a CSV replay feed is configured, each tick
 * first publishes the next recorded bar. Active only when
 * {@code trading.enabled=true} in PAPER mode.
 */
@Component
@ConditionalOnExpression("${trading.enabled:false} and '${trading.mode:PAPER}' == 'PAPER'")
public class TradingScheduler {

    private static final Logger log = LoggerFactory.getLogger(TradingScheduler.class);

    private final TradingCycleService tradingCycleService;
    private final Optional<CsvReplayFeed> csvReplayFeed;

    public TradingScheduler(TradingCycleService tradingCycleService, Optional<CsvReplayFeed> csvReplayFeed) {
        this.tradingCycleService = tradingCycleService;
        this.csvReplayFeed = csvReplayFeed;
        log.info("Trading scheduler active (csv replay: {})", csvReplayFeed.isPresent());
    }

    @Scheduled(fixedDelayString = "${trading.cycle-interval:PT1M}", initialDelayString = "${trading.cycle-interval:PT1M}")
    public void tick() {
        csvReplayFeed.ifPresent(this::publishNextBar);
        tradingCycleService.runCycle();
    }

    private void publishNextBar(CsvReplayFeed feed) {
        try {
            feed.publishNext();
        } catch (DataUnavailableException e) {
            log.error("Price replay unavailable: {}", e.getMessage());
        }
    }
}
