package com.pickem.bet.exception;

import com.pickem.bet.enums.ErrorCode;

public class UnknownUserException extends BettingException {

    public UnknownUserException(String message) {
        super(ErrorCode.UNKNOWN_USER, message);
    }
}
