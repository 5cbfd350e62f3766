package com.ironcondor.domain.enums;

public enum AlertType {
    PROFIT_TARGET,
    LOSS_THRESHOLD,
    EXPIRATION_WARNING
}
