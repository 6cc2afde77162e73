package com.reversiontrader.domain.enums;

/**
 * Direction of a position. LONG profits when price rises, SHORT when it falls.
 */
public enum PositionSide {
    LONG,
    SHORT
}
