package com.fxhedge.domain.model;

import com.fxhedge.domain.enums.LevelType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A strike or barrier as entered by the user: either a percentage of the initial spot
 * (105 = 105%) or an absolute rate.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Level {

    private double value;
    private LevelType type;

    public static Level percent(double value) {
        return new Level(value, LevelType.PERCENT_OF_SPOT);
    }

    public static Level absolute(double value) {
        return new Level(value, LevelType.ABSOLUTE);
    }

    /** Absolute level for the given initial spot. A missing type is read as ABSOLUTE. */
    public double resolve(double initialSpot) {
        return type == LevelType.PERCENT_OF_SPOT ? initialSpot * value / 100.0 : value;
    }
}
