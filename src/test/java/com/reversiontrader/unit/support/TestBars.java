package com.reversiontrader.unit.support;

import com.reversiontrader.domain.model.PriceBar;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/** Bar series builders shared by unit tests. One bar per minute from {@link #START}. */
public final class TestBars {

    public static final LocalDateTime START = LocalDateTime.of(2024, 3, 1, 9, 0);
    public static final BigDecimal VOLUME = new BigDecimal("20000");

    private TestBars() {}

    public static List<PriceBar> flat(int count, String price) {
        List<PriceBar> bars = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            bars.add(bar(i, new BigDecimal(price)));
        }
        return bars;
    }

    /** {@code count} flat bars at {@code base}, followed by one bar at {@code last}. */
    public static List<PriceBar> flatThen(int count, String base, String last) {
        List<PriceBar> bars = flat(count, base);
        bars.add(bar(count, new BigDecimal(last)));
        return bars;
    }

    public static List<PriceBar> of(double... closes) {
        List<PriceBar> bars = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            bars.add(bar(i, BigDecimal.valueOf(closes[i])));
        }
        return bars;
    }

    /**
     * Oscillating series: a calm stretch around 100, then repeated dips to 80 and
     * recoveries, so a mean-reversion strategy has entries and exits to take.
     */
    public static List<PriceBar> oscillating(int cycles) {
        List<PriceBar> bars = new ArrayList<>();
        int index = 0;
        for (int i = 0; i < 25; i++) {
            bars.add(bar(index++, BigDecimal.valueOf(100 + (i % 2))));
        }
        for (int c = 0; c < cycles; c++) {
            bars.add(bar(index++, BigDecimal.valueOf(80)));
            for (int i = 0; i < 4; i++) {
                bars.add(bar(index++, BigDecimal.valueOf(90 + i * 5)));
            }
            bars.add(bar(index++, BigDecimal.valueOf(118)));
            for (int i = 0; i < 20; i++) {
                bars.add(bar(index++, BigDecimal.valueOf(100 + (i % 2))));
            }
        }
        return bars;
    }

    public static PriceBar bar(int minute, BigDecimal close) {
        return PriceBar.ofClose(START.plusMinutes(minute), close, VOLUME);
    }

    public static List<BigDecimal> closes(int... values) {
        List<BigDecimal> closes = new ArrayList<>();
        for (int value : values) {
            closes.add(BigDecimal.valueOf(value));
        }
        return closes;
    }
}
