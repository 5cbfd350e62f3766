package com.ironcondor.domain.enums;

/**
 * Right conveyed by an option leg. CALL pays off above the strike, PUT below it.
 */
public enum OptionType {
    CALL,
    PUT
}
