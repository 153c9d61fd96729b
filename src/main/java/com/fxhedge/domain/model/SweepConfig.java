package com.fxhedge.domain.model;

import com.fxhedge.exception.InvalidInputException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Spot range of a payoff curve: {@code steps} points across initial spot +/- widthPct%. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SweepConfig {

    private double widthPct;
    private int steps;

    /**
     * @throws InvalidInputException unless 0 &lt; widthPct &lt; 100 and steps &gt;= 2
     */
    public SweepConfig validate() {
        Map<String, Object> violations = new LinkedHashMap<>();
        if (!(widthPct > 0) || !(widthPct < 100)) {
            violations.put("widthPct", "must be between 0 and 100 (exclusive), got " + widthPct);
        }
        if (steps < 2) {
            violations.put("steps", "must be at least 2, got " + steps);
        }
        if (!violations.isEmpty()) {
            throw new InvalidInputException("Invalid payoff sweep", violations);
        }
        return this;
    }
}
