package com.ironcondor.domain.enums;

/**
 * The four positions of an iron condor. A leg has no identity beyond its role,
 * so the role fixes both the option type and the direction.
 */
public enum LegRole {
    LONG_CALL(OptionType.CALL, PositionType.LONG),
    SHORT_CALL(OptionType.CALL, PositionType.SHORT),
    SHORT_PUT(OptionType.PUT, PositionType.SHORT),
    LONG_PUT(OptionType.PUT, PositionType.LONG);

    private final OptionType optionType;
    private final PositionType positionType;

    LegRole(OptionType optionType, PositionType positionType) {
        this.optionType = optionType;
        this.positionType = positionType;
    }

    public OptionType getOptionType() {
        return optionType;
    }

    public PositionType getPositionType() {
        return positionType;
    }
}
