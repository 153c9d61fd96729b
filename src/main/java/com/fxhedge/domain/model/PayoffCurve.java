package com.fxhedge.domain.model;

import com.fxhedge.domain.enums.HedgeSide;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Hedged-rate curve over a spot sweep. Transient: recomputed whenever the market inputs or
 * the strategy change.
 */
@Value
@Builder
public class PayoffCurve {

    double initialSpot;
    double totalPremium;
    HedgeSide side;
    List<PayoffPoint> points;
}
