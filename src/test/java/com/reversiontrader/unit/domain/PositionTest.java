package com.reversiontrader.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.reversiontrader.domain.enums.PositionSide;
import com.reversiontrader.domain.enums.PositionStatus;
import com.reversiontrader.domain.model.Position;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PositionTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 1, 10, 0);

    private static Position open(PositionSide side) {
        return Position.open("p1", side, new BigDecimal("100"), new BigDecimal("2"), T0, null, null);
    }

    @Nested
    @DisplayName("P&L")
    class Pnl {

        @Test
        @DisplayName("LONG gains when price rises")
        void longPnl() {
            Position position = open(PositionSide.LONG);

            position.markToMarket(new BigDecimal("110"));

            assertThat(position.getPnl()).isEqualByComparingTo("20");
            assertThat(position.getPnlPercent()).isEqualByComparingTo("10");
            assertThat(position.getMarketValue()).isEqualByComparingTo("220");
        }

        @Test
        @DisplayName("SHORT gains when price falls")
        void shortPnl() {
            Position position = open(PositionSide.SHORT);

            position.markToMarket(new BigDecimal("90"));

            assertThat(position.getPnl()).isEqualByComparingTo("20");
            assertThat(position.getPnlPercent()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("P&L is undefined before the first mark")
        void undefinedBeforeMark() {
            Position position = open(PositionSide.LONG);

            assertThat(position.getPnl()).isNull();
            assertThat(position.getMarketValue()).isEqualByComparingTo("200");
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Close fixes P&L at the exit price")
        void closeFixesPnl() {
            Position position = open(PositionSide.LONG);
            position.markToMarket(new BigDecimal("105"));

            position.close(new BigDecimal("95"), T0.plusHours(1), "Stop loss triggered");

            assertThat(position.getStatus()).isEqualTo(PositionStatus.CLOSED);
            assertThat(position.getPnl()).isEqualByComparingTo("-10");
            assertThat(position.getExitTime()).isEqualTo(T0.plusHours(1));
            assertThat(position.getCloseReason()).isEqualTo("Stop loss triggered");
        }

        @Test
        @DisplayName("A closed position cannot be marked or closed again")
        void closedIsImmutable() {
            Position position = open(PositionSide.LONG);
            position.close(new BigDecimal("100"), T0, "done");

            assertThatThrownBy(() -> position.markToMarket(new BigDecimal("120")))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> position.close(new BigDecimal("120"), T0, "again"))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(position.getPnl()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("A position built without a status is PENDING and cannot be marked or closed")
        void pendingPosition() {
            Position pending = Position.builder()
                    .id("p2")
                    .side(PositionSide.LONG)
                    .entryPrice(BigDecimal.TEN)
                    .size(BigDecimal.ONE)
                    .entryTime(T0)
                    .build();

            assertThat(pending.getStatus()).isEqualTo(PositionStatus.PENDING);
            assertThat(pending.isOpen()).isFalse();
            assertThatThrownBy(() -> pending.markToMarket(BigDecimal.ONE)).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> pending.close(BigDecimal.ONE, T0, "x")).isInstanceOf(IllegalStateException.class);
        }
    }
}
