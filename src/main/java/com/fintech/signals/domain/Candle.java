package com.fintech.signals.domain;

/**
 * Immutable OHLC candle aggregating price observations over one interval bucket.
 * Updates produce a new instance; the series swaps it in under its write lock.
 *
 * @param bucketStart Bucket start timestamp (epoch-aligned millis)
 * @param open First price in bucket, never changed after creation
 * @param high Maximum price (must be >= open, close, low)
 * @param low Minimum price (must be <= open, close, high)
 * @param close Last price in bucket
 * @param volume Number of observations folded into the candle
 */
public record Candle(
    long bucketStart,
    double open,
    double high,
    double low,
    double close,
    long volume
) {

    /**
     * Creates a single-price candle (first observation in bucket).
     *
     * @param bucketStart Bucket start timestamp
     * @param price Initial OHLC value
     * @return Candle with all OHLC = price, volume = 1
     */
    public static Candle of(long bucketStart, double price) {
        return new Candle(bucketStart, price, price, price, price, 1);
    }

    /**
     * Validates OHLC invariants: high >= {open,close,low}, low <= {open,close,high}.
     */
    public Candle {
        if (high < low) {
            throw new IllegalArgumentException(
                "High price (" + high + ") cannot be less than low price (" + low + ")"
            );
        }
        if (high < open || high < close) {
            throw new IllegalArgumentException(
                "High price (" + high + ") must be >= open (" + open + ") and close (" + close + ")"
            );
        }
        if (low > open || low > close) {
            throw new IllegalArgumentException(
                "Low price (" + low + ") must be <= open (" + open + ") and close (" + close + ")"
            );
        }
    }

    /**
     * Returns a copy with the price folded in: high/low widened, close replaced, open kept.
     */
    public Candle withPrice(double price) {
        return new Candle(
            bucketStart,
            open,
            Math.max(high, price),
            Math.min(low, price),
            price,
            volume + 1
        );
    }
}
