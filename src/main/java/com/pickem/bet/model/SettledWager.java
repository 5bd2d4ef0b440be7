package com.pickem.bet.model;

import com.pickem.bet.enums.WagerStatus;

import java.math.BigDecimal;

/**
 * A wager this process moved out of PENDING, with the amount credited for it.
 */
public record SettledWager(String wagerId, String userId, WagerStatus status, BigDecimal credited) {
}
