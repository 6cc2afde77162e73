package com.reversiontrader.market;

import com.reversiontrader.domain.model.PriceBar;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Read-only, pull-based source of price bars for one instrument.
 *
 * <p>Histories are ordered by ascending timestamp.
 */
public interface PriceDataProvider {

    List<PriceBar> getPriceHistory();

    /** Latest known price. */
    BigDecimal getCurrentPrice();

    /** Bars with {@code from <= timestamp <= to}; a null bound is open. */
    default List<PriceBar> getPriceHistory(LocalDateTime from, LocalDateTime to) {
        return getPriceHistory().stream()
                .filter(bar -> from == null || !bar.getTimestamp().isBefore(from))
                .filter(bar -> to == null || !bar.getTimestamp().isAfter(to))
                .toList();
    }
}
