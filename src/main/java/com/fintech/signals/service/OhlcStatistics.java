package com.fintech.signals.service;

import com.fintech.signals.domain.Candle;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Summary statistics over a window of candles.
 */
@Schema(description = "Statistics over the returned candles")
public record OhlcStatistics(
    @Schema(description = "Highest high", example = "97450.12")
    double highestPrice,

    @Schema(description = "Lowest low", example = "96010.40")
    double lowestPrice,

    @Schema(description = "Mean close", example = "96800.77")
    double avgClose,

    @Schema(description = "Last close against first open in percent, 0 for a single candle", example = "1.25")
    double priceChangePercent,

    @Schema(description = "Annualized volatility of close-to-close log returns", example = "0.42")
    double volatility,

    @Schema(description = "Close-price trend", example = "bullish")
    Trend trend
) {

    static final double TRADING_DAYS_PER_YEAR = 252;

    /**
     * @param candles non-empty window, oldest first
     */
    public static OhlcStatistics of(List<Candle> candles) {
        if (candles.isEmpty()) {
            throw new IllegalArgumentException("Statistics need at least one candle");
        }
        List<Double> closes = candles.stream().map(Candle::close).toList();
        Candle first = candles.get(0);
        Candle last = candles.get(candles.size() - 1);

        double change = candles.size() > 1 ? (last.close() - first.open()) / first.open() * 100.0 : 0.0;

        return new OhlcStatistics(
            candles.stream().mapToDouble(Candle::high).max().orElseThrow(),
            candles.stream().mapToDouble(Candle::low).min().orElseThrow(),
            closes.stream().mapToDouble(Double::doubleValue).average().orElseThrow(),
            change,
            annualizedVolatility(closes),
            Trend.of(closes));
    }

    /**
     * Population standard deviation of log returns scaled by sqrt(252); 0 with fewer than two prices.
     */
    static double annualizedVolatility(List<Double> prices) {
        if (prices.size() < 2) {
            return 0.0;
        }
        double[] returns = new double[prices.size() - 1];
        double sum = 0;
        for (int i = 1; i < prices.size(); i++) {
            returns[i - 1] = Math.log(prices.get(i) / prices.get(i - 1));
            sum += returns[i - 1];
        }
        double mean = sum / returns.length;
        double variance = 0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        variance /= returns.length;
        return Math.sqrt(variance) * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }
}
