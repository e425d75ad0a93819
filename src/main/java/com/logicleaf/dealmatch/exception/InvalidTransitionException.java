package com.logicleaf.dealmatch.exception;

import lombok.Getter;

@Getter
public class InvalidTransitionException extends RuntimeException {

    private final String from;
    private final String to;

    public InvalidTransitionException(String from, String to, String message) {
        super(message);
        this.from = from;
        this.to = to;
    }
}
