package com.fxhedge.domain.model;

import com.fxhedge.domain.enums.NamedStrategy;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A hedging structure: an ordered list of legs. Leg order only matters for display
 * (reference labels on the payoff curve), never for pricing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Strategy {

    /** Template the legs were expanded from. CUSTOM for user-built strategies. */
    private NamedStrategy name;

    private List<OptionLeg> legs;
}
