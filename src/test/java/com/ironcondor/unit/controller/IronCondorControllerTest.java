package com.ironcondor.unit.controller;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ironcondor.analysis.GreeksAggregator;
import com.ironcondor.analysis.IronCondorAnalyzer;
import com.ironcondor.analysis.PayoffEvaluator;
import com.ironcondor.analysis.PositionMonitor;
import com.ironcondor.analysis.StrategyScorer;
import com.ironcondor.analysis.StrikeOptimizer;
import com.ironcondor.api.controller.IronCondorController;
import com.ironcondor.calendar.ExpiryCalendarService;
import com.ironcondor.config.AnalyticsProperties;
import com.ironcondor.config.ApiResponseAdvice;
import com.ironcondor.core.processor.BlackScholesPricer;
import com.ironcondor.core.processor.ProbabilityCalculator;
import com.ironcondor.exception.GlobalExceptionHandler;
import com.ironcondor.mapper.StrategyRequestMapper;
import com.ironcondor.marketdata.MarketPriceProvider;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for IronCondorController wired to the real analytics,
 * with "now" fixed at 2026-01-05 10:00 UTC. Only the market price source is mocked.
 */
@ExtendWith(MockitoExtension.class)
class IronCondorControllerTest {

    private static final String ANALYZE_BODY =
            """
            {
              "symbol": "SPX",
              "expirationDate": "2026-02-05",
              "longCallStrike": 4600,
              "shortCallStrike": 4550,
              "shortPutStrike": 4450,
              "longPutStrike": 4400,
              "contracts": 1,
              "currentPrice": 4500,
              "impliedVolatility": 0.20,
              "riskFreeRate": 0.05
            }
            """;

    private MockMvc mockMvc;

    @Mock
    private MarketPriceProvider marketPriceProvider;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-05T10:00:00Z"), ZoneOffset.UTC);
        AnalyticsProperties properties = new AnalyticsProperties();
        ExpiryCalendarService expiryCalendarService = new ExpiryCalendarService(clock);
        BlackScholesPricer pricer = new BlackScholesPricer();
        PayoffEvaluator payoffEvaluator = new PayoffEvaluator();

        IronCondorAnalyzer analyzer = new IronCondorAnalyzer(
                pricer,
                new ProbabilityCalculator(),
                payoffEvaluator,
                new StrikeOptimizer(),
                new StrategyScorer(),
                expiryCalendarService);
        GreeksAggregator greeksAggregator = new GreeksAggregator(pricer, expiryCalendarService);
        PositionMonitor positionMonitor =
                new PositionMonitor(payoffEvaluator, expiryCalendarService, marketPriceProvider, properties, clock);

        IronCondorController controller = new IronCondorController(
                analyzer,
                greeksAggregator,
                positionMonitor,
                Mappers.getMapper(StrategyRequestMapper.class),
                properties);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Nested
    @DisplayName("POST /api/iron-condor/analyze")
    class Analyze {

        @Test
        @DisplayName("Returns the full report in the success envelope")
        void analyzes() throws Exception {
            mockMvc.perform(post("/api/iron-condor/analyze")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(ANALYZE_BODY))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.timestamp").exists())
                    .andExpect(jsonPath("$.data.riskReward.netCredit").value(closeTo(3843.46, 0.02)))
                    .andExpect(jsonPath("$.data.breakevens.upper").value(closeTo(4588.43, 0.02)))
                    .andExpect(jsonPath("$.data.probability.method").value("black_scholes_normal_distribution"))
                    .andExpect(jsonPath("$.data.sensitivity.daysToExpiration").value(30))
                    .andExpect(jsonPath("$.data.recommendations.optimalStrikes.shortCall").value(4765.0))
                    .andExpect(jsonPath("$.data.qualityMetrics.rating").value("Excellent"))
                    .andExpect(jsonPath("$.data.qualityMetrics.factors.timeToExpiration").value("Optimal"))
                    .andExpect(jsonPath("$.data.payoffProfile", hasSize(20)));
        }

        @Test
        @DisplayName("Defaults volatility and rate when omitted")
        void defaultsApplied() throws Exception {
            String body =
                    """
                    {
                      "symbol": "SPX",
                      "expirationDate": "2026-02-05",
                      "longCallStrike": 4600,
                      "shortCallStrike": 4550,
                      "shortPutStrike": 4450,
                      "longPutStrike": 4400
                    }
                    """;

            mockMvc.perform(post("/api/iron-condor/analyze")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.sensitivity.impliedVolatility").value(0.20))
                    .andExpect(jsonPath("$.data.sensitivity.currentPrice").value(4500.0));
        }

        @Test
        @DisplayName("Past expiration is a 400 INVALID_EXPIRATION")
        void pastExpiration() throws Exception {
            mockMvc.perform(post("/api/iron-condor/analyze")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(ANALYZE_BODY.replace("2026-02-05", "2025-12-19")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("INVALID_EXPIRATION"))
                    .andExpect(jsonPath("$.error.path").value("/api/iron-condor/analyze"))
                    .andExpect(jsonPath("$.error.timestamp").exists())
                    .andExpect(jsonPath("$.data").doesNotExist());
        }

        @Test
        @DisplayName("Out-of-range volatility fails bean validation")
        void volatilityOutOfRange() throws Exception {
            mockMvc.perform(post("/api/iron-condor/analyze")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(ANALYZE_BODY.replace("\"impliedVolatility\": 0.20", "\"impliedVolatility\": 2.5")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.error.details.impliedVolatility").exists());
        }

        @Test
        @DisplayName("Unparseable date is a 400 BAD_REQUEST")
        void badDate() throws Exception {
            mockMvc.perform(post("/api/iron-condor/analyze")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(ANALYZE_BODY.replace("2026-02-05", "02/05/2026")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
        }

        @Test
        @DisplayName("Misordered strikes are a 400 VALIDATION_ERROR")
        void misorderedStrikes() throws Exception {
            mockMvc.perform(post("/api/iron-condor/analyze")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(ANALYZE_BODY.replace("\"longCallStrike\": 4600", "\"longCallStrike\": 4500")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.error.details.longCallStrike").value(4500.0));
        }
    }

    @Nested
    @DisplayName("POST /api/iron-condor/greeks")
    class GreeksEndpoints {

        @Test
        @DisplayName("Aggregates supplied leg Greeks")
        void aggregatesSupplied() throws Exception {
            String body =
                    """
                    {
                      "longCall": {"delta": 0.25, "gamma": 0.001, "theta": -0.5, "vega": 1.0},
                      "shortCall": {"delta": 0.40, "gamma": 0.002, "theta": -0.75, "vega": 1.5},
                      "shortPut": {"delta": -0.40, "gamma": 0.002, "theta": -0.75, "vega": 1.5},
                      "longPut": {"delta": -0.25, "gamma": 0.001, "theta": -0.5},
                      "contracts": 2
                    }
                    """;

            mockMvc.perform(post("/api/iron-condor/greeks")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.portfolio.theta").value(-100.0))
                    .andExpect(jsonPath("$.data.portfolio.vega").value(400.0))
                    .andExpect(jsonPath("$.data.legsBreakdown.LONG_CALL.delta").value(-50.0))
                    .andExpect(jsonPath("$.data.riskProfile.deltaNeutral").value(true))
                    .andExpect(jsonPath("$.data.riskProfile.gammaRisk").value("moderate"))
                    .andExpect(jsonPath("$.data.interpretation.gamma").value("Gamma risk is moderate"));
        }

        @Test
        @DisplayName("Prices leg Greeks from a strategy definition")
        void fromStrategy() throws Exception {
            mockMvc.perform(post("/api/iron-condor/greeks/strategy")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(ANALYZE_BODY))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.legsBreakdown.SHORT_PUT.delta").isNumber())
                    .andExpect(jsonPath("$.data.riskProfile.gammaRisk").exists());
        }
    }

    @Nested
    @DisplayName("POST /api/iron-condor/optimize")
    class Optimize {

        @Test
        @DisplayName("Returns optimized strikes with their expected performance")
        void optimizes() throws Exception {
            String body =
                    """
                    {
                      "symbol": "XYZ",
                      "expirationDate": "2026-02-05",
                      "currentPrice": 100,
                      "impliedVolatility": 0.20,
                      "targetProbability": 0.70,
                      "wingWidth": 5
                    }
                    """;

            mockMvc.perform(post("/api/iron-condor/optimize")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.optimalStrikes.longCall").value(110.0))
                    .andExpect(jsonPath("$.data.optimalStrikes.shortPut").value(95.0))
                    .andExpect(jsonPath("$.data.optimizationParameters.daysToExpiration").value(30))
                    .andExpect(jsonPath("$.data.expectedPerformance.riskReward.netCredit").isNumber());
        }

        @Test
        @DisplayName("Target probability above 0.95 is rejected")
        void targetOutOfRange() throws Exception {
            String body =
                    """
                    {
                      "symbol": "XYZ",
                      "expirationDate": "2026-02-05",
                      "currentPrice": 100,
                      "impliedVolatility": 0.20,
                      "targetProbability": 0.99
                    }
                    """;

            mockMvc.perform(post("/api/iron-condor/optimize")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.details.targetProbability").exists());
        }
    }

    @Nested
    @DisplayName("Position monitoring")
    class Monitoring {

        @Test
        @DisplayName("POST /monitor prices the position from the market source when no price is given")
        void monitor() throws Exception {
            when(marketPriceProvider.currentPrice("SPX")).thenReturn(4600.0);
            String body =
                    """
                    {
                      "strategyId": 9,
                      "symbol": "SPX",
                      "expirationDate": "2026-01-09",
                      "strikes": {"longCall": 4600, "shortCall": 4550, "shortPut": 4450, "longPut": 4400},
                      "contracts": 1,
                      "entryCredit": 300
                    }
                    """;

            mockMvc.perform(post("/api/iron-condor/monitor")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.strategyId").value(9))
                    .andExpect(jsonPath("$.data.currentPnl").value(-4700.0))
                    .andExpect(jsonPath("$.data.daysToExpiration").value(3))
                    .andExpect(jsonPath("$.data.alerts", hasSize(2)))
                    .andExpect(jsonPath("$.data.alerts[0].type").value("LOSS_THRESHOLD"))
                    .andExpect(jsonPath("$.data.alerts[0].severity").value("WARNING"))
                    .andExpect(jsonPath("$.data.alerts[1].type").value("EXPIRATION_WARNING"));
        }

        @Test
        @DisplayName("POST /monitor without strikes fails validation")
        void monitorMissingStrikes() throws Exception {
            String body =
                    """
                    {"strategyId": 9, "symbol": "SPX", "expirationDate": "2026-01-09", "contracts": 1, "entryCredit": 300}
                    """;

            mockMvc.perform(post("/api/iron-condor/monitor")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.details.strikes").exists());
        }

        @Test
        @DisplayName("POST /batch-update resolves a price per position")
        void batchUpdate() throws Exception {
            String body =
                    """
                    {
                      "positions": [
                        {"id": "p1", "symbol": "SPX"},
                        {"id": "p2", "symbol": "AAPL", "entryPrice": 170.5}
                      ],
                      "marketData": {"SPX": 4512.25}
                    }
                    """;

            mockMvc.perform(post("/api/iron-condor/batch-update")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.totalUpdated").value(2))
                    .andExpect(jsonPath("$.data.updates[0].positionId").value("p1"))
                    .andExpect(jsonPath("$.data.updates[0].currentPrice").value(4512.25))
                    .andExpect(jsonPath("$.data.updates[1].currentPrice").value(170.5));
        }
    }
}
