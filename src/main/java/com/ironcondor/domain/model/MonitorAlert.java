package com.ironcondor.domain.model;

import com.ironcondor.domain.enums.AlertSeverity;
import com.ironcondor.domain.enums.AlertType;
import lombok.Value;

@Value
public class MonitorAlert {

    AlertType type;
    String message;
    AlertSeverity severity;
}
