package com.reversiontrader.execution;

import com.reversiontrader.domain.model.Position;
import com.reversiontrader.domain.model.Trade;
import com.reversiontrader.domain.model.TradingSignal;
import java.math.BigDecimal;
import java.util.List;

/**
 * Execution sink for live cycles. Implementations decide how an order reaches
 * a market; the trading cycle only decides whether, how large and when to exit.
 *
 * <p>Failures are reported as FAILED trades with an error message, or by
 * throwing {@link com.reversiontrader.exception.TradeExecutionException}; the
 * cycle hands thrown failures back through {@link #recordFailure}, so the
 * trade log holds every attempt.
 */
public interface TradeExecutor {

    /**
     * Executes a BUY (opens a position of {@code size}) or a SELL (closes the
     * first OPEN position).
     */
    Trade executeTrade(TradingSignal signal, BigDecimal size);

    /** Closes a specific OPEN position, used when a risk rule fires. */
    Trade closePosition(String positionId, TradingSignal exitSignal);

    /**
     * Records an attempt that failed before reaching the sink (for example an
     * exception from {@link #executeTrade}) in the trade log.
     *
     * @return the FAILED trade as appended
     */
    Trade recordFailure(TradingSignal signal, BigDecimal size, String error);

    List<Position> getOpenPositions();

    List<Position> getAllPositions();

    /** Most recent {@code limit} trades, oldest first; all trades when limit is 0 or less. */
    List<Trade> getTradeHistory(int limit);

    /** Cash available for new positions. */
    BigDecimal getAccountBalance();

    /** Cash plus market value of open positions. */
    BigDecimal getAccountEquity();
}
