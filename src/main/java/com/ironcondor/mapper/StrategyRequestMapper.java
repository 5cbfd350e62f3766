package com.ironcondor.mapper;

import com.ironcondor.api.dto.request.BatchUpdateRequest;
import com.ironcondor.api.dto.request.IronCondorAnalysisRequest;
import com.ironcondor.api.dto.request.IronCondorGreeksRequest;
import com.ironcondor.api.dto.request.IronCondorOptimizationRequest;
import com.ironcondor.api.dto.request.PositionMonitorRequest;
import com.ironcondor.config.AnalyticsProperties;
import com.ironcondor.domain.enums.LegRole;
import com.ironcondor.domain.model.Greeks;
import com.ironcondor.domain.model.MonitoredPosition;
import com.ironcondor.domain.model.OptimizationCriteria;
import com.ironcondor.domain.model.PositionQuote;
import com.ironcondor.domain.model.StrategyParameters;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.mapstruct.Context;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from REST request DTOs to the analytics' domain inputs.
 *
 * <p>Optional request fields fall back to the {@code iron-condor.defaults} values
 * passed in as context.
 */
@Mapper(componentModel = "spring")
public interface StrategyRequestMapper {

    @Mapping(
            target = "impliedVolatility",
            source = "impliedVolatility",
            defaultExpression = "java(defaults.getImpliedVolatility())")
    @Mapping(
            target = "riskFreeRate",
            source = "riskFreeRate",
            defaultExpression = "java(defaults.getRiskFreeRate())")
    @Mapping(target = "contracts", source = "contracts", defaultValue = "1")
    StrategyParameters toStrategyParameters(
            IronCondorAnalysisRequest request, @Context AnalyticsProperties.Defaults defaults);

    @Mapping(
            target = "targetProbability",
            source = "targetProbability",
            defaultExpression = "java(defaults.getTargetProbability())")
    @Mapping(target = "wingWidth", source = "wingWidth", defaultExpression = "java(defaults.getWingWidth())")
    @Mapping(target = "riskFreeRate", expression = "java(defaults.getRiskFreeRate())")
    @Mapping(target = "contracts", source = "contracts", defaultValue = "1")
    OptimizationCriteria toOptimizationCriteria(
            IronCondorOptimizationRequest request, @Context AnalyticsProperties.Defaults defaults);

    MonitoredPosition toMonitoredPosition(PositionMonitorRequest request);

    @Mapping(source = "id", target = "positionId")
    PositionQuote toPositionQuote(BatchUpdateRequest.PositionRef position);

    List<PositionQuote> toPositionQuotes(List<BatchUpdateRequest.PositionRef> positions);

    default Map<LegRole, Greeks> toLegGreeks(IronCondorGreeksRequest request) {
        Map<LegRole, Greeks> legGreeks = new EnumMap<>(LegRole.class);
        legGreeks.put(LegRole.LONG_CALL, Greeks.fromMap(request.getLongCall()));
        legGreeks.put(LegRole.SHORT_CALL, Greeks.fromMap(request.getShortCall()));
        legGreeks.put(LegRole.SHORT_PUT, Greeks.fromMap(request.getShortPut()));
        legGreeks.put(LegRole.LONG_PUT, Greeks.fromMap(request.getLongPut()));
        return legGreeks;
    }
}
