package com.reversiontrader.unit.engine;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.reversiontrader.engine.TradingCycleService;
import com.reversiontrader.engine.TradingScheduler;
import com.reversiontrader.exception.DataUnavailableException;
import com.reversiontrader.market.CsvReplayFeed;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TradingSchedulerTest {

    @Mock
    private TradingCycleService tradingCycleService;

    @Mock
    private CsvReplayFeed csvReplayFeed;

    @Test
    @DisplayName("Tick without a replay feed runs one cycle")
    void tickRunsOneCycle() {
        new TradingScheduler(tradingCycleService, Optional.empty()).tick();

        verify(tradingCycleService).runCycle();
    }

    @Test
    @DisplayName("Tick publishes the next replayed bar before the cycle")
    void tickFeedsBeforeCycle() {
        new TradingScheduler(tradingCycleService, Optional.of(csvReplayFeed)).tick();

        InOrder order = inOrder(csvReplayFeed, tradingCycleService);
        order.verify(csvReplayFeed).publishNext();
        order.verify(tradingCycleService).runCycle();
    }

    @Test
    @DisplayName("Unreadable replay source does not stop the cycle")
    void replayFailureStillRunsCycle() {
        when(csvReplayFeed.publishNext()).thenThrow(new DataUnavailableException("Price file not readable"));

        new TradingScheduler(tradingCycleService, Optional.of(csvReplayFeed)).tick();

        verify(tradingCycleService).runCycle();
    }
}
