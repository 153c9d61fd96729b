package com.fxhedge.exception;

import java.util.Map;

/**
 * Raised at the pricing boundary (market parameters, strategy resolution) for inputs no
 * pricer can work with: non-positive spot, strike, barrier, maturity or volatility, a double
 * barrier whose lower level is not below the upper one, or a template missing a strike.
 *
 * <p>The pricers themselves never throw this; they return 0 and log, so a sweep over many
 * spot levels survives one degenerate point.
 */
public class InvalidInputException extends BaseException {

    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }

    public InvalidInputException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_INPUT, message, details);
    }

    public InvalidInputException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.INVALID_INPUT, message, details, cause);
    }
}
