package com.reversiontrader.strategy;

import java.math.BigDecimal;

/** Stop-loss and take-profit prices for a new position. */
public record RiskLevels(BigDecimal stopLoss, BigDecimal takeProfit) {}
