package com.reversiontrader.unit.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.reversiontrader.domain.enums.OrderSide;
import com.reversiontrader.domain.enums.TradeStatus;
import com.reversiontrader.domain.model.Position;
import com.reversiontrader.domain.model.Trade;
import com.reversiontrader.execution.SimulatedLedger;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SimulatedLedgerTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 1, 10, 0);
    private static final BigDecimal FEE_RATE = new BigDecimal("0.0025");

    private SimulatedLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new SimulatedLedger(new BigDecimal("1000"), FEE_RATE, "test");
    }

    @Test
    @DisplayName("Buy debits notional plus fee and opens a LONG position")
    void buyDebitsCash() {
        Trade trade = ledger.buy(new BigDecimal("2"), new BigDecimal("100"), T0, new BigDecimal("95"), null);

        assertThat(trade.isSuccessful()).isTrue();
        assertThat(trade.getSide()).isEqualTo(OrderSide.BUY);
        assertThat(trade.getFee()).isEqualByComparingTo("0.5");
        assertThat(trade.getPositionId()).isEqualTo("test-pos-1");
        assertThat(ledger.getCash()).isEqualByComparingTo("799.5");
        assertThat(ledger.getOpenPositions()).singleElement()
                .satisfies(p -> assertThat(p.getStopLoss()).isEqualByComparingTo("95"));
    }

    @Test
    @DisplayName("Sell credits proceeds minus fee and closes the position")
    void sellCreditsCash() {
        ledger.buy(new BigDecimal("2"), new BigDecimal("100"), T0, null, null);
        Position position = ledger.getOpenPositions().get(0);

        Trade trade = ledger.sell(position, new BigDecimal("110"), T0.plusMinutes(5), "target");

        assertThat(trade.isSuccessful()).isTrue();
        assertThat(trade.getFee()).isEqualByComparingTo("0.55");
        assertThat(ledger.getCash()).isEqualByComparingTo("1018.95");
        assertThat(position.isClosed()).isTrue();
        assertThat(position.getPnl()).isEqualByComparingTo("20");
        assertThat(position.getCloseReason()).isEqualTo("target");
    }

    @Test
    @DisplayName("Unaffordable buy is logged as FAILED and leaves cash untouched")
    void insufficientCash() {
        Trade trade = ledger.buy(new BigDecimal("10"), new BigDecimal("100"), T0, null, null);

        assertThat(trade.getStatus()).isEqualTo(TradeStatus.FAILED);
        assertThat(trade.getError()).startsWith("Insufficient balance");
        assertThat(ledger.getCash()).isEqualByComparingTo("1000");
        assertThat(ledger.getPositions()).isEmpty();
        assertThat(ledger.getTrades()).containsExactly(trade);
        assertThat(ledger.canAfford(new BigDecimal("9.9"), new BigDecimal("100"))).isTrue();
        assertThat(ledger.canAfford(new BigDecimal("10"), new BigDecimal("100"))).isFalse();
    }

    @Test
    @DisplayName("Selling a closed position records a failure")
    void sellClosedPosition() {
        ledger.buy(BigDecimal.ONE, new BigDecimal("100"), T0, null, null);
        Position position = ledger.getOpenPositions().get(0);
        ledger.sell(position, new BigDecimal("100"), T0, "first");

        Trade second = ledger.sell(position, new BigDecimal("120"), T0, "second");

        assertThat(second.isSuccessful()).isFalse();
        assertThat(position.getPnl()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Equity includes open positions at their marked price")
    void equity() {
        ledger.buy(new BigDecimal("2"), new BigDecimal("100"), T0, null, null);

        ledger.markToMarket(new BigDecimal("105"));

        assertThat(ledger.getEquity()).isEqualByComparingTo("1009.5");
        assertThat(ledger.getOpenPositions().get(0).getPnl()).isEqualByComparingTo("10");
    }

    @Test
    @DisplayName("After many round trips cash equals initial balance plus P&L minus fees")
    void roundTripsReconcile() {
        SimulatedLedger big = new SimulatedLedger(new BigDecimal("1000000"), FEE_RATE, "rt");
        Random random = new Random(42);

        for (int i = 0; i < 1000; i++) {
            BigDecimal size = BigDecimal.valueOf(1 + random.nextInt(1000), 2);
            BigDecimal entry = BigDecimal.valueOf(5000 + random.nextInt(10000), 2);
            BigDecimal exit = BigDecimal.valueOf(5000 + random.nextInt(10000), 2);
            big.buy(size, entry, T0.plusMinutes(i), null, null);
            Position position = big.getOpenPositions().get(0);
            big.sell(position, exit, T0.plusMinutes(i).plusSeconds(30), "rt");
        }

        BigDecimal totalPnl = big.getClosedPositions().stream()
                .map(Position::getPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalFees = big.getTrades().stream()
                .filter(Trade::isSuccessful)
                .map(Trade::getFee)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        assertThat(big.getClosedPositions()).hasSize(1000);
        assertThat(big.getTrades()).hasSize(2000);
        assertThat(big.getCash()).isEqualByComparingTo(new BigDecimal("1000000").add(totalPnl).subtract(totalFees));
    }

    @Test
    @DisplayName("Negative balance or fee rate is rejected")
    void invalidConstruction() {
        assertThatThrownBy(() -> new SimulatedLedger(new BigDecimal("-1"), FEE_RATE, "x"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SimulatedLedger(BigDecimal.TEN, new BigDecimal("-0.01"), "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
