package com.reversiontrader.market;

import com.reversiontrader.domain.model.PriceBar;
import com.reversiontrader.exception.DataUnavailableException;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded rolling history fed by {@link #addBar}. Oldest bars are evicted once
 * {@code maxHistory} is reached. Bars older than the latest one are rejected so
 * the history stays ordered.
 *
 * <p>Nothing is fetched here: bars arrive from a {@link CsvReplayFeed} in paper
 * mode, or from whatever host code owns the market connection.
 */
public class InMemoryPriceDataProvider implements PriceDataProvider {

    public static final int DEFAULT_MAX_HISTORY = 1000;

    private final int maxHistory;
    private final Deque<PriceBar> history = new ArrayDeque<>();

    public InMemoryPriceDataProvider() {
        this(DEFAULT_MAX_HISTORY);
    }

    public InMemoryPriceDataProvider(int maxHistory) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be positive");
        }
        this.maxHistory = maxHistory;
    }

    public synchronized void addBar(PriceBar bar) {
        PriceBar last = history.peekLast();
        if (last != null && bar.getTimestamp().isBefore(last.getTimestamp())) {
            throw new IllegalArgumentException(
                    "Bar at " + bar.getTimestamp() + " is older than latest bar at " + last.getTimestamp());
        }
        history.addLast(bar);
        while (history.size() > maxHistory) {
            history.removeFirst();
        }
    }

    public synchronized void addBars(List<PriceBar> bars) {
        bars.forEach(this::addBar);
    }

    @Override
    public synchronized List<PriceBar> getPriceHistory() {
        return List.copyOf(new ArrayList<>(history));
    }

    @Override
    public synchronized BigDecimal getCurrentPrice() {
        PriceBar last = history.peekLast();
        if (last == null) {
            throw new DataUnavailableException("No price data received yet");
        }
        return last.getClose();
    }
}
