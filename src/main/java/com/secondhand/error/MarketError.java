package com.secondhand.error;

import lombok.Value;

@Value
public class MarketError {

    ErrorKind kind;

    /**
     * User-facing explanation.
     */
    String message;

    public static MarketError validation(String message) {
        return new MarketError(ErrorKind.VALIDATION, message);
    }

    public static MarketError funds(String message) {
        return new MarketError(ErrorKind.FUNDS, message);
    }

    public static MarketError race(String message) {
        return new MarketError(ErrorKind.RACE, message);
    }
}
