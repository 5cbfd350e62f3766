package com.ironcondor.domain.model;

import com.ironcondor.domain.enums.LegRole;
import com.ironcondor.domain.enums.OptionType;
import com.ironcondor.domain.enums.PositionType;
import lombok.Value;

/**
 * One leg of the condor: a strike plus the role it plays in the combination.
 */
@Value
public class OptionLeg {

    LegRole role;
    double strike;

    public static OptionLeg of(LegRole role, double strike) {
        return new OptionLeg(role, strike);
    }

    public OptionType getOptionType() {
        return role.getOptionType();
    }

    public PositionType getPositionType() {
        return role.getPositionType();
    }
}
