package com.reversiontrader.reporting;

import com.reversiontrader.simulator.BacktestResult;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link BacktestResult} as a plain-text report for logs and
 * consoles.
 */
public class BacktestReportFormatter {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("EEE MMM dd yyyy", Locale.US);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final String RULE = "=================================================";

    public String format(BacktestResult result) {
        long days = Duration.between(result.getStartDate(), result.getEndDate()).toDays();
        StringBuilder sb = new StringBuilder();
        sb.append('\n').append(RULE).append('\n');
        sb.append("           BACKTEST RESULTS REPORT\n");
        sb.append(RULE).append("\n\n");
        sb.append("Period: ")
                .append(DATE.format(result.getStartDate()))
                .append(" to ")
                .append(DATE.format(result.getEndDate()))
                .append(" (")
                .append(days)
                .append(" days, ")
                .append(result.getBarsProcessed())
                .append(" bars)\n");
        sb.append("Strategy: Mean Reversion (MA ")
                .append(result.getStrategyParameters().getMaPeriod())
                .append(", ")
                .append(result.getStrategyParameters().getStdDevMultiplier().toPlainString())
                .append("x std dev)\n\n");

        sb.append("PERFORMANCE SUMMARY:\n");
        line(sb, "├─", "Initial Balance:", "$" + scale(result.getInitialBalance(), 2));
        line(sb, "├─", "Final Balance:", "$" + scale(result.getFinalBalance(), 2));
        line(sb, "├─", "Total Return:", "$" + scale(result.getTotalReturn(), 2));
        line(sb, "├─", "Return %:", scale(result.getTotalReturnPercent(), 2) + "%");
        line(sb, "├─", "Total Fees:", "$" + scale(result.getTotalFees(), 2));
        line(sb, "├─", "Max Drawdown:", percent(result.getMaxDrawdown()));
        line(sb, "└─", "Sharpe Ratio:", scale(result.getSharpeRatio(), 2));
        sb.append('\n');

        sb.append("TRADING STATISTICS:\n");
        line(sb, "├─", "Total Trades:", String.valueOf(result.getTotalTrades()));
        line(sb, "├─", "Winning Trades:", String.valueOf(result.getWinningTrades()));
        line(sb, "├─", "Losing Trades:", String.valueOf(result.getLosingTrades()));
        line(sb, "├─", "Win Rate:", scale(result.getWinRate(), 1) + "%");
        line(sb, "├─", "Average Win:", "$" + scale(result.getAverageWin(), 2));
        line(sb, "├─", "Average Loss:", "$" + scale(result.getAverageLoss(), 2));
        line(sb, "└─", "Profit Factor:", scale(result.getProfitFactor(), 2));
        sb.append('\n').append(RULE).append('\n');
        return sb.toString();
    }

    /** Tabular view of the top rankings of a parameter sweep. */
    public String format(OptimizationReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("\nOPTIMIZATION RESULTS (")
                .append(report.getTotalCombinations())
                .append(" combinations, ")
                .append(report.getBarCount())
                .append(" bars)\n");
        table(sb, "TOP BY TOTAL RETURN:", report.getTopByReturn());
        table(sb, "TOP BY SHARPE RATIO:", report.getTopBySharpe());
        report.getRecommended()
                .ifPresentOrElse(
                        best -> sb.append("\nRecommended parameters: MA=")
                                .append(best.getMaPeriod())
                                .append(", StdDev=")
                                .append(best.getStdDevMultiplier().toPlainString())
                                .append("x\n"),
                        () -> sb.append("\nNo profitable low-risk combinations found\n"));
        return sb.toString();
    }

    private static void table(StringBuilder sb, String title, List<OptimizationResult> rows) {
        sb.append('\n').append(title).append('\n');
        sb.append("Rank | MA | StdDev | Return% | WinRate% | Sharpe | MaxDD% | Trades\n");
        sb.append("-".repeat(70)).append('\n');
        int rank = 1;
        for (OptimizationResult r : rows.subList(0, Math.min(5, rows.size()))) {
            sb.append(String.format(
                    Locale.ROOT,
                    "%4d | %2d | %6s | %7s | %8s | %6s | %6s | %6d%n",
                    rank++,
                    r.getMaPeriod(),
                    scale(r.getStdDevMultiplier(), 1),
                    scale(r.getTotalReturn(), 2),
                    scale(r.getWinRate(), 1),
                    scale(r.getSharpeRatio(), 2),
                    scale(r.getMaxDrawdown().multiply(HUNDRED), 1),
                    r.getTotalTrades()));
        }
    }

    private static void line(StringBuilder sb, String branch, String label, String value) {
        sb.append(branch).append(' ').append(String.format("%-20s", label)).append(value).append('\n');
    }

    private static String scale(BigDecimal value, int digits) {
        return value.setScale(digits, RoundingMode.HALF_UP).toPlainString();
    }

    private static String percent(BigDecimal fraction) {
        return scale(fraction.multiply(HUNDRED), 2) + "%";
    }
}
