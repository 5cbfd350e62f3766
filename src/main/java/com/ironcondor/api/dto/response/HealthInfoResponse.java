package com.ironcondor.api.dto.response;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Returned by GET /api/health/info. */
@Getter
@Builder
public class HealthInfoResponse {

    private final String status;
    private final String service;
    private final String version;

    /** Analytics the service exposes. */
    private final List<String> features;
}
