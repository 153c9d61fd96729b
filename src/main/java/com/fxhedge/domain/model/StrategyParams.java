package com.fxhedge.domain.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * User-facing inputs for a named strategy template. Which fields are required depends on
 * the template (a collar needs both strikes, a forward needs none).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyParams {

    private Level strikeUpper;
    private Level strikeLower;
    private Level strikeMid;
    private Level barrierUpper;
    private Level barrierLower;

    /** Percentage of notional applied to every template leg. Null = 100. */
    private Double quantity;

    /** Legs of a CUSTOM strategy. */
    private List<OptionLeg> customLegs;
}
