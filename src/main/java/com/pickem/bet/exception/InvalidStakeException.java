package com.pickem.bet.exception;

import com.pickem.bet.enums.ErrorCode;

public class InvalidStakeException extends BettingException {

    public InvalidStakeException(String message) {
        super(ErrorCode.INVALID_STAKE, message);
    }
}
