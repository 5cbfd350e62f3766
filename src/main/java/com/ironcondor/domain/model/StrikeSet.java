package com.ironcondor.domain.model;

import com.ironcondor.domain.enums.LegRole;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * The four strikes of a condor, wings outside the shorts:
 * longCall &gt; shortCall &gt;= shortPut &gt; longPut.
 */
@Value
@Builder
public class StrikeSet {

    double longCall;
    double shortCall;
    double shortPut;
    double longPut;

    public double callSpreadWidth() {
        return longCall - shortCall;
    }

    public double putSpreadWidth() {
        return shortPut - longPut;
    }

    public double maxSpreadWidth() {
        return Math.max(callSpreadWidth(), putSpreadWidth());
    }

    public boolean hasWingsOutsideShorts() {
        return longCall > shortCall && shortCall >= shortPut && shortPut > longPut;
    }

    public double strikeOf(LegRole role) {
        switch (role) {
            case LONG_CALL:
                return longCall;
            case SHORT_CALL:
                return shortCall;
            case SHORT_PUT:
                return shortPut;
            case LONG_PUT:
                return longPut;
            default:
                throw new IllegalArgumentException("Unknown leg role: " + role);
        }
    }

    public List<OptionLeg> legs() {
        return List.of(
                OptionLeg.of(LegRole.LONG_CALL, longCall),
                OptionLeg.of(LegRole.SHORT_CALL, shortCall),
                OptionLeg.of(LegRole.SHORT_PUT, shortPut),
                OptionLeg.of(LegRole.LONG_PUT, longPut));
    }
}
