package com.fintech.signals;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * RWA Signal Engine
 *
 * Polls a public price feed for tokenized real-world assets, aggregates the prices into
 * multi-interval OHLC candles and derives RSI-based trading signals.
 *
 * Key Features:
 * - LMAX Disruptor single-writer ingestion into per-series candle buffers
 * - Wilder RSI, divergence and multi-timeframe analysis per asset category
 * - Resilience4j circuit breaker around the price feed
 * - x402 payment gate in front of every exposed operation
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableScheduling
public class SignalEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalEngineApplication.class, args);
    }
}
