package com.reversiontrader.config;

import com.reversiontrader.domain.enums.TradingMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the trading engine, loaded from application.yml.
 *
 * <p>Properties prefix: {@code trading.*}. These mutable holders are converted
 * into immutable parameter values by {@link TradingConfig}; components never
 * read them directly.
 *
 * <p>{@code risk.max-daily-loss} defaults to 10% of {@code risk.max-position-size}
 * when left unset.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "trading")
public class TradingProperties {

    @NotNull
    private TradingMode mode = TradingMode.PAPER;

    /** Whether the live scheduler runs cycles at all. */
    private boolean enabled = false;

    /** Fixed delay between the end of one live cycle and the start of the next. */
    @NotNull
    private Duration cycleInterval = Duration.ofMinutes(1);

    /** A signal repeating the last accepted type within this window is ignored. */
    @NotNull
    private Duration signalDedupWindow = Duration.ofMinutes(5);

    @Valid
    private Strategy strategy = new Strategy();

    @Valid
    private Risk risk = new Risk();

    @Valid
    private Paper paper = new Paper();

    @Valid
    private Backtest backtest = new Backtest();

    @Valid
    private MarketData data = new MarketData();

    @Data
    public static class Strategy {

        @Min(2)
        private int maPeriod = 20;

        @Positive
        private BigDecimal stdDevMultiplier = new BigDecimal("2");

        @PositiveOrZero
        private BigDecimal entryThreshold = new BigDecimal("0.5");

        @PositiveOrZero
        private BigDecimal exitThreshold = new BigDecimal("0.1");

        @Positive
        @DecimalMax(value = "1", inclusive = false)
        private BigDecimal stopLossPercent = new BigDecimal("0.05");

        @Positive
        private BigDecimal takeProfitPercent = new BigDecimal("0.10");

        @PositiveOrZero
        private BigDecimal minVolume = new BigDecimal("10000");

        @Min(2)
        private int rsiPeriod = 14;

        @Min(2)
        private int emaPeriod = 20;
    }

    @Data
    public static class Risk {

        @Positive
        private BigDecimal maxPositionSize = new BigDecimal("1000");

        @Min(1)
        private int maxOpenPositions = 3;

        @Positive
        @DecimalMax("0.1")
        private BigDecimal riskPerTrade = new BigDecimal("0.02");

        /** Absolute cap; null means 10% of maxPositionSize. */
        @Positive
        private BigDecimal maxDailyLoss;

        @Positive
        @DecimalMax("1")
        private BigDecimal maxDrawdown = new BigDecimal("0.2");
    }

    @Data
    public static class Paper {

        @PositiveOrZero
        private BigDecimal initialBalance = new BigDecimal("1000");

        @DecimalMin("0")
        private BigDecimal feeRate = new BigDecimal("0.0025");

        /** Bars kept by the in-memory price feed. */
        @Min(1)
        private int maxHistory = 1000;

        /** Feed the in-memory history from {@code trading.data.csv-path}, one bar per cycle. */
        private boolean replayCsv = true;
    }

    @Data
    public static class Backtest {

        @PositiveOrZero
        private BigDecimal initialBalance = new BigDecimal("10000");

        @DecimalMin("0")
        private BigDecimal feeRate = new BigDecimal("0.0025");

        private String outputDirectory = "backtest-results";

        private LocalDateTime from;

        private LocalDateTime to;

        /** Also run the maPeriod x stdDevMultiplier sweep after the main run. */
        private boolean optimize = false;
    }

    @Data
    public static class MarketData {

        /** CSV file with timestamp,open,high,low,close,volume rows. */
        private String csvPath = "data/prices.csv";
    }
}
