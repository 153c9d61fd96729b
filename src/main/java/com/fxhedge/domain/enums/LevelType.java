package com.fxhedge.domain.enums;

/**
 * How a strike or barrier value is expressed. PERCENT_OF_SPOT values are scaled by the
 * initial spot (105 = 105% of spot), ABSOLUTE values are used as-is.
 */
public enum LevelType {
    PERCENT_OF_SPOT,
    ABSOLUTE
}
