package com.marketterminal.market_terminal.exception;

public class DuplicateMembershipException extends RuntimeException {
    public DuplicateMembershipException(String message) {
        super(message);
    }

    public DuplicateMembershipException(String message, Throwable cause) {
        super(message, cause);
    }
}
