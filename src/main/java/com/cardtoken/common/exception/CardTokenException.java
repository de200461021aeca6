package com.cardtoken.common.exception;

/**
 * Base exception for all card token service exceptions.
 */
public class CardTokenException extends RuntimeException {

    public CardTokenException(String message) {
        super(message);
    }

    public CardTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
