package com.ironcondor.api.controller;

import com.ironcondor.analysis.GreeksAggregator;
import com.ironcondor.analysis.IronCondorAnalyzer;
import com.ironcondor.analysis.PositionMonitor;
import com.ironcondor.api.dto.request.BatchUpdateRequest;
import com.ironcondor.api.dto.request.IronCondorAnalysisRequest;
import com.ironcondor.api.dto.request.IronCondorGreeksRequest;
import com.ironcondor.api.dto.request.IronCondorOptimizationRequest;
import com.ironcondor.api.dto.request.PositionMonitorRequest;
import com.ironcondor.config.AnalyticsProperties;
import com.ironcondor.domain.model.BatchUpdateResult;
import com.ironcondor.domain.model.IronCondorAnalysis;
import com.ironcondor.domain.model.OptimizationResult;
import com.ironcondor.domain.model.PortfolioGreeks;
import com.ironcondor.domain.model.PositionStatus;
import com.ironcondor.mapper.StrategyRequestMapper;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for iron condor analytics.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/iron-condor/analyze -- full risk/reward, probability and scoring report</li>
 *   <li>POST /api/iron-condor/greeks -- aggregate caller-supplied leg Greeks to position level</li>
 *   <li>POST /api/iron-condor/greeks/strategy -- price the legs and aggregate their Greeks</li>
 *   <li>POST /api/iron-condor/optimize -- derive strikes for a target probability, then analyze them</li>
 *   <li>POST /api/iron-condor/monitor -- current P&L and alerts for an open position</li>
 *   <li>POST /api/iron-condor/batch-update -- refresh current prices for many positions</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/iron-condor")
public class IronCondorController {

    private static final Logger log = LoggerFactory.getLogger(IronCondorController.class);

    private final IronCondorAnalyzer ironCondorAnalyzer;
    private final GreeksAggregator greeksAggregator;
    private final PositionMonitor positionMonitor;
    private final StrategyRequestMapper strategyRequestMapper;
    private final AnalyticsProperties analyticsProperties;

    public IronCondorController(
            IronCondorAnalyzer ironCondorAnalyzer,
            GreeksAggregator greeksAggregator,
            PositionMonitor positionMonitor,
            StrategyRequestMapper strategyRequestMapper,
            AnalyticsProperties analyticsProperties) {
        this.ironCondorAnalyzer = ironCondorAnalyzer;
        this.greeksAggregator = greeksAggregator;
        this.positionMonitor = positionMonitor;
        this.strategyRequestMapper = strategyRequestMapper;
        this.analyticsProperties = analyticsProperties;
    }

    @PostMapping("/analyze")
    public ResponseEntity<IronCondorAnalysis> analyze(@RequestBody @Valid IronCondorAnalysisRequest request) {
        log.info("Analyze request for {} expiring {}", request.getSymbol(), request.getExpirationDate());
        IronCondorAnalysis analysis = ironCondorAnalyzer.analyze(
                strategyRequestMapper.toStrategyParameters(request, analyticsProperties.getDefaults()));
        return ResponseEntity.ok(analysis);
    }

    @PostMapping("/greeks")
    public ResponseEntity<PortfolioGreeks> greeks(@RequestBody @Valid IronCondorGreeksRequest request) {
        PortfolioGreeks greeks =
                greeksAggregator.aggregate(strategyRequestMapper.toLegGreeks(request), request.getContracts());
        log.info(
                "Aggregated Greeks for {} contracts: delta={}, theta={}",
                request.getContracts(),
                greeks.getPortfolio().getDelta(),
                greeks.getPortfolio().getTheta());
        return ResponseEntity.ok(greeks);
    }

    /**
     * Same aggregation as {@code /greeks}, with the per-share leg Greeks computed by
     * Black-Scholes from the strategy definition.
     */
    @PostMapping("/greeks/strategy")
    public ResponseEntity<PortfolioGreeks> strategyGreeks(@RequestBody @Valid IronCondorAnalysisRequest request) {
        log.info("Greeks request for {} expiring {}", request.getSymbol(), request.getExpirationDate());
        return ResponseEntity.ok(greeksAggregator.aggregateFromParameters(
                strategyRequestMapper.toStrategyParameters(request, analyticsProperties.getDefaults())));
    }

    @PostMapping("/optimize")
    public ResponseEntity<OptimizationResult> optimize(@RequestBody @Valid IronCondorOptimizationRequest request) {
        log.info("Optimize request for {} at {}", request.getSymbol(), request.getCurrentPrice());
        OptimizationResult result = ironCondorAnalyzer.optimizeAndAnalyze(
                strategyRequestMapper.toOptimizationCriteria(request, analyticsProperties.getDefaults()));
        return ResponseEntity.ok(result);
    }

    @PostMapping("/monitor")
    public ResponseEntity<PositionStatus> monitor(@RequestBody @Valid PositionMonitorRequest request) {
        return ResponseEntity.ok(positionMonitor.monitor(strategyRequestMapper.toMonitoredPosition(request)));
    }

    @PostMapping("/batch-update")
    public ResponseEntity<BatchUpdateResult> batchUpdate(@RequestBody @Valid BatchUpdateRequest request) {
        BatchUpdateResult result = positionMonitor.batchUpdate(
                strategyRequestMapper.toPositionQuotes(request.getPositions()), request.getMarketData());
        return ResponseEntity.ok(result);
    }
}
