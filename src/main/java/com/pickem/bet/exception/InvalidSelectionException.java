package com.pickem.bet.exception;

import com.pickem.bet.enums.ErrorCode;

public class InvalidSelectionException extends BettingException {

    public InvalidSelectionException(String message) {
        super(ErrorCode.INVALID_SELECTION, message);
    }
}
