package com.fxhedge.domain.enums;

/**
 * Catalog of hedging strategy templates understood by
 * {@link com.fxhedge.strategy.StrategyResolver}. CUSTOM takes the legs as supplied.
 * Templates are written from the point of view of a buyer of the foreign currency.
 */
public enum NamedStrategy {
    FORWARD,
    CALL,
    PUT,
    COLLAR,
    COLLAR_PUT_FIXED,
    COLLAR_CALL_FIXED,
    STRANGLE,
    STRADDLE,
    SEAGULL,
    CALL_KO,
    PUT_KI,
    CALL_KO_PUT_KI,
    CUSTOM
}
