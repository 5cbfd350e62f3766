package com.ironcondor.domain.enums;

/**
 * Direction of a leg within the condor. Short legs collect premium, long legs are
 * the protective wings.
 */
public enum PositionType {
    LONG,
    SHORT;

    /** Sign applied when aggregating per-share Greeks: short = +1, long = -1. */
    public int greeksSign() {
        return this == SHORT ? 1 : -1;
    }
}
