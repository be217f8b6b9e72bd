package com.fintech.signals.signal;

import com.fintech.signals.domain.AssetCategory;
import com.fintech.signals.domain.Candle;
import com.fintech.signals.error.InsufficientDataException;
import com.fintech.signals.indicator.MovingAverages;
import com.fintech.signals.indicator.RsiSeries;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Category-specific entry and exit rules over an RSI series and its candles.
 *
 * <p>Stateless: no position is held between calls. Entry rules compare the two newest
 * RSI values against the category's oversold level:
 * <ul>
 *   <li>wrapped BTC: crossover and a higher close than the previous candle</li>
 *   <li>tokenized stocks: crossover and close above the 50-period EMA</li>
 *   <li>gold: crossover and three strictly rising closes</li>
 * </ul>
 */
public class SignalDetector {

    static final double BASE_CONFIDENCE = 0.5;
    static final double MOMENTUM_BONUS = 0.1;
    static final double DIVERGENCE_BONUS = 0.2;
    static final double STRONG_MOVE = 1.005;
    static final int STOCK_EMA_PERIOD = 50;

    private final ThresholdPolicy thresholds;

    public SignalDetector(ThresholdPolicy thresholds) {
        this.thresholds = thresholds;
    }

    public BuySignal detectBuySignal(AssetCategory category, RsiSeries rsi, List<Candle> candles) {
        return detectBuySignal(category, rsi, candles, DivergenceResult.none());
    }

    /**
     * @param divergence confirming divergence, or {@link DivergenceResult#none()}
     */
    public BuySignal detectBuySignal(
            AssetCategory category, RsiSeries rsi, List<Candle> candles, DivergenceResult divergence) {
        CategoryPolicy policy = thresholds.forCategory(category);
        OptionalDouble current = rsi.latest();
        OptionalDouble previous = rsi.previous();
        if (current.isEmpty() || previous.isEmpty() || candles.size() < 2) {
            return BuySignal.none("RSI values not yet available");
        }

        double currentRsi = current.getAsDouble();
        double previousRsi = previous.getAsDouble();
        int n = candles.size();
        double currentClose = candles.get(n - 1).close();
        double previousClose = candles.get(n - 2).close();

        boolean crossover = previousRsi < policy.oversold() && currentRsi > policy.oversold();
        if (!crossover) {
            return BuySignal.none(describeZone(currentRsi, policy));
        }

        List<String> reasons = new ArrayList<>();
        switch (category) {
            case WRAPPED_BTC -> {
                if (currentClose > previousClose) {
                    reasons.add("RSI oversold reversal");
                }
            }
            case TOKENIZED_STOCK -> {
                List<Double> closes = candles.stream().map(Candle::close).collect(Collectors.toList());
                double ema = MovingAverages.latestEma(closes, STOCK_EMA_PERIOD);
                if (!Double.isNaN(ema) && currentClose > ema) {
                    reasons.add("RSI oversold reversal above EMA50");
                }
            }
            case GOLD_TOKEN -> {
                if (n >= 3
                        && candles.get(n - 1).close() > candles.get(n - 2).close()
                        && candles.get(n - 2).close() > candles.get(n - 3).close()) {
                    reasons.add("RSI oversold reversal with consecutive higher closes");
                }
            }
        }

        if (reasons.isEmpty()) {
            return BuySignal.none(String.format(Locale.ROOT,
                "RSI crossed above oversold (%.2f > %.0f) without price confirmation",
                currentRsi, policy.oversold()));
        }

        double confidence = BASE_CONFIDENCE;
        if (currentClose > previousClose * STRONG_MOVE) {
            confidence += MOMENTUM_BONUS;
            reasons.add("strong upward price movement");
        }
        String reason = String.join(", ", reasons);
        if (divergence != null && divergence.bullish()) {
            confidence += DIVERGENCE_BONUS;
            reason += " with bullish divergence confirmation";
        }
        return new BuySignal(true, Math.min(confidence, 1.0), reason);
    }

    /**
     * Evaluates stop-loss, then take-profit, then overbought RSI against the newest close.
     *
     * @throws InsufficientDataException when {@code candles} is empty
     */
    public ExitSignal detectExitSignal(
            AssetCategory category, RsiSeries rsi, List<Candle> candles, double entryPrice) {
        if (!Double.isFinite(entryPrice) || entryPrice <= 0) {
            throw new IllegalArgumentException("Entry price must be positive, got " + entryPrice);
        }
        if (candles.isEmpty()) {
            throw new InsufficientDataException("Exit detection needs at least one candle");
        }
        CategoryPolicy policy = thresholds.forCategory(category);
        double currentPrice = candles.get(candles.size() - 1).close();
        double stopLoss = policy.stopLossPrice(entryPrice);
        double takeProfit = policy.takeProfitPrice(entryPrice);

        if (currentPrice <= stopLoss) {
            return new ExitSignal(true, ExitTrigger.STOP_LOSS,
                String.format(Locale.ROOT, "Stop loss triggered at %.2f (entry: %.2f)", currentPrice, entryPrice),
                stopLoss, stopLoss, takeProfit);
        }
        if (currentPrice >= takeProfit) {
            return new ExitSignal(true, ExitTrigger.TAKE_PROFIT,
                String.format(Locale.ROOT, "Take profit target reached at %.2f (entry: %.2f)", currentPrice, entryPrice),
                takeProfit, stopLoss, takeProfit);
        }
        OptionalDouble currentRsi = rsi.latest();
        if (currentRsi.isPresent() && currentRsi.getAsDouble() > policy.overbought()) {
            return new ExitSignal(true, ExitTrigger.RSI_OVERBOUGHT,
                String.format(Locale.ROOT, "RSI overbought (%.2f > %.0f)", currentRsi.getAsDouble(), policy.overbought()),
                policy.overbought(), stopLoss, takeProfit);
        }
        return new ExitSignal(false, ExitTrigger.NONE, "No exit signal", null, stopLoss, takeProfit);
    }

    static String describeZone(double rsi, CategoryPolicy policy) {
        if (rsi < policy.oversold()) {
            return String.format(Locale.ROOT, "RSI below oversold (%.2f < %.0f), awaiting reversal",
                rsi, policy.oversold());
        }
        if (rsi > policy.overbought()) {
            return String.format(Locale.ROOT, "RSI above overbought (%.2f > %.0f)", rsi, policy.overbought());
        }
        return String.format(Locale.ROOT, "RSI in neutral zone (%.2f)", rsi);
    }
}
