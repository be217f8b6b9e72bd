package com.fintech.signals.api;

import com.fintech.signals.domain.Interval;
import com.fintech.signals.payment.RequestContext;
import com.fintech.signals.service.CurrentPricesResponse;
import com.fintech.signals.service.DivergenceResponse;
import com.fintech.signals.service.OhlcDataResponse;
import com.fintech.signals.service.OhlcStatsResponse;
import com.fintech.signals.service.PortfolioSignalsResponse;
import com.fintech.signals.service.RsiAnalysisResponse;
import com.fintech.signals.service.SignalOperations;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * REST surface for the six metered operations. Every call passes the payment gate once
 * inside {@link SignalOperations}.
 */
@RestController
@RequestMapping("/api/v1")
@Validated
@Tag(name = "Signals", description = "Real-time prices, OHLC candles and RSI trading signals")
public class SignalController {

    private final SignalOperations operations;

    public SignalController(SignalOperations operations) {
        this.operations = operations;
    }

    @Operation(
        summary = "Get current prices",
        description = "Current prices for every tracked asset, optionally one category (wrapped-btc, rwa-stocks, gold)."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Prices retrieved"),
        @ApiResponse(responseCode = "402", description = "Payment required",
            content = @Content(schema = @Schema(implementation = PaymentRequiredResponse.class))),
        @ApiResponse(responseCode = "502", description = "Price feed unavailable",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/prices")
    public ResponseEntity<CurrentPricesResponse> getCurrentPrices(
            @Parameter(description = "Asset category filter", example = "rwa-stocks")
            @RequestParam(required = false) String category,
            HttpServletRequest request) {
        return ResponseEntity.ok(operations.getCurrentPrices(category, contextOf(request)));
    }

    @Operation(
        summary = "Get OHLC candles",
        description = """
            Candles built in real time from polled prices, oldest first, with window statistics.
            History accumulates while the service runs, so fewer candles than requested may be returned.

            **Supported Intervals:** 1s, 1m, 5m, 1h, 1w, 1M
            """
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Candles retrieved"),
        @ApiResponse(responseCode = "400", description = "Invalid parameters",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "404", description = "Unknown asset",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "422", description = "No candles collected yet",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/ohlc")
    public ResponseEntity<OhlcDataResponse> getOhlcData(
            @Parameter(description = "Symbol or mint address", example = "WBTC", required = true)
            @RequestParam @NotBlank(message = "Asset is required and cannot be blank") String asset,

            @Parameter(description = "Candle interval", example = "5m", required = true)
            @RequestParam @NotBlank(message = "Interval is required and cannot be blank") String interval,

            @Parameter(description = "Number of candles (1-1000)", example = "100")
            @RequestParam(defaultValue = "100")
            @Min(value = 1, message = "count must be at least 1")
            @Max(value = SignalOperations.MAX_OHLC_COUNT, message = "count must be at most 1000")
            int count,

            HttpServletRequest request) {
        return ResponseEntity.ok(operations.getOhlcData(asset, Interval.fromCode(interval), count, contextOf(request)));
    }

    @Operation(summary = "Get candle statistics", description = "Accumulated candle counts per asset and interval.")
    @GetMapping("/ohlc/stats")
    public ResponseEntity<OhlcStatsResponse> getOhlcStats(HttpServletRequest request) {
        return ResponseEntity.ok(operations.getOhlcStats(contextOf(request)));
    }

    @Operation(
        summary = "Get RSI analysis",
        description = """
            RSI, buy/sell/hold signal, divergence, momentum and multi-timeframe RSI.
            Analyses one asset, one category or every tracked asset.
            """
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Analysis computed"),
        @ApiResponse(responseCode = "402", description = "Payment required",
            content = @Content(schema = @Schema(implementation = PaymentRequiredResponse.class))),
        @ApiResponse(responseCode = "422", description = "Not enough history for RSI",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/rsi")
    public ResponseEntity<RsiAnalysisResponse> getRsiAnalysis(
            @Parameter(description = "Symbol or mint address", example = "TSLAx")
            @RequestParam(required = false) String asset,

            @Parameter(description = "Asset category, ignored when asset is given", example = "gold")
            @RequestParam(required = false) String category,

            @Parameter(description = "Candle interval, defaults to each category's timeframe", example = "1h")
            @RequestParam(required = false) String interval,

            HttpServletRequest request) {
        return ResponseEntity.ok(operations.getRsiAnalysis(asset, category, parseOptional(interval), contextOf(request)));
    }

    @Operation(summary = "Get RSI divergence", description = "Bullish or bearish RSI/price divergence over a lookback window.")
    @GetMapping("/rsi/divergence")
    public ResponseEntity<DivergenceResponse> getRsiDivergence(
            @Parameter(description = "Symbol or mint address", example = "WBTC", required = true)
            @RequestParam @NotBlank(message = "Asset is required and cannot be blank") String asset,

            @Parameter(description = "Candle interval, defaults to the category's timeframe", example = "1h")
            @RequestParam(required = false) String interval,

            @Parameter(description = "Lookback window in candles (5-50)", example = "10")
            @RequestParam(defaultValue = "10")
            @Min(value = SignalOperations.MIN_DIVERGENCE_LOOKBACK, message = "lookback must be at least 5")
            @Max(value = SignalOperations.MAX_DIVERGENCE_LOOKBACK, message = "lookback must be at most 50")
            int lookback,

            HttpServletRequest request) {
        return ResponseEntity.ok(operations.getRsiDivergence(asset, parseOptional(interval), lookback, contextOf(request)));
    }

    @Operation(
        summary = "Get portfolio signals",
        description = "Signals across every tracked asset; keeps HOLDs and signals at or above the confidence floor."
    )
    @GetMapping("/signals/portfolio")
    public ResponseEntity<PortfolioSignalsResponse> getPortfolioSignals(
            @Parameter(description = "Minimum confidence (0.0-1.0), defaults to 0.6", example = "0.6")
            @RequestParam(required = false)
            @DecimalMin(value = "0.0", message = "minConfidence must be at least 0")
            @DecimalMax(value = "1.0", message = "minConfidence must be at most 1")
            Double minConfidence,

            HttpServletRequest request) {
        return ResponseEntity.ok(operations.getPortfolioSignals(minConfidence, contextOf(request)));
    }

    private static Interval parseOptional(String interval) {
        return interval == null || interval.isBlank() ? null : Interval.fromCode(interval);
    }

    private static RequestContext contextOf(HttpServletRequest request) {
        Map<String, String> headers = new HashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, request.getHeader(name));
        }
        return new RequestContext(request.getRequestURI(), headers);
    }
}
