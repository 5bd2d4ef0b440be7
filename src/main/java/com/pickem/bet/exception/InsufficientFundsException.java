package com.pickem.bet.exception;

import com.pickem.bet.enums.ErrorCode;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientFundsException extends BettingException {

    private final BigDecimal available;
    private final BigDecimal required;

    public InsufficientFundsException(String userId, BigDecimal available, BigDecimal required) {
        super(ErrorCode.INSUFFICIENT_FUNDS,
                "Insufficient balance for user " + userId + ": available=" + available + ", required=" + required);
        this.available = available;
        this.required = required;
    }
}
