package com.fxhedge.domain.enums;

/**
 * Barrier feature of an option leg. Combined with the leg's reverse flag this fully
 * describes when the barrier event fires (see {@link com.fxhedge.core.engine.BarrierMonitor}).
 *
 * <p>Single barriers take one level, entered as either the upper or the lower barrier of the
 * leg. Double barriers need both.
 */
public enum BarrierType {
    NONE,
    KNOCK_OUT,
    KNOCK_IN,
    DOUBLE_KNOCK_OUT,
    DOUBLE_KNOCK_IN;

    public boolean isBarrier() {
        return this != NONE;
    }

    public boolean isDouble() {
        return this == DOUBLE_KNOCK_OUT || this == DOUBLE_KNOCK_IN;
    }

    /** True when the option only pays if the barrier event has NOT happened. */
    public boolean isKnockOut() {
        return this == KNOCK_OUT || this == DOUBLE_KNOCK_OUT;
    }

    /** True when the option only pays if the barrier event HAS happened. */
    public boolean isKnockIn() {
        return this == KNOCK_IN || this == DOUBLE_KNOCK_IN;
    }
}
