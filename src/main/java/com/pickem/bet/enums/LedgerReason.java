package com.pickem.bet.enums;

/**
 * Audit tag attached to every balance delta. Never affects behaviour.
 */
public enum LedgerReason {
    ACCOUNT_OPENED,
    WAGER_PLACED,
    WAGER_CANCELLED,
    WAGER_WON,
    WAGER_PUSH,
    EVENT_CANCELLED_REFUND,
    ADJUSTMENT
}
