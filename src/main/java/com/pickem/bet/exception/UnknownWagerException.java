package com.pickem.bet.exception;

import com.pickem.bet.enums.ErrorCode;

public class UnknownWagerException extends BettingException {

    public UnknownWagerException(String message) {
        super(ErrorCode.UNKNOWN_WAGER, message);
    }
}
