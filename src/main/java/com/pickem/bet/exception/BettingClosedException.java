package com.pickem.bet.exception;

import com.pickem.bet.enums.ErrorCode;

public class BettingClosedException extends BettingException {

    public BettingClosedException(String message) {
        super(ErrorCode.BETTING_CLOSED, message);
    }
}
