package com.fintech.signals.config;

import com.fintech.signals.domain.AssetCategory;
import com.fintech.signals.domain.Interval;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized configuration for the signal engine.
 * Maps to 'signals.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "signals")
public class SignalProperties {

    private List<InstrumentConfig> instruments = new ArrayList<>();
    private Quote quote = new Quote();
    private Aggregation aggregation = new Aggregation();
    private Polling polling = new Polling();
    private Analysis analysis = new Analysis();
    private Thresholds thresholds = new Thresholds();
    private Payment payment = new Payment();

    @Data
    public static class InstrumentConfig {
        private String id;
        private String symbol;
        private String name;
        private AssetCategory category;
        private String description;
    }

    @Data
    public static class Quote {
        private String baseUrl = "https://lite-api.jup.ag/price/v3";
        private Duration cacheTtl = Duration.ofSeconds(5);
        private int cacheMaxEntries = 100;
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Aggregation {
        private int maxCandlesPerSeries = 1000;
        private DisruptorConfig disruptor = new DisruptorConfig();

        @Data
        public static class DisruptorConfig {
            private int bufferSize = 1024;
            private String waitStrategy = "BLOCKING";
        }
    }

    @Data
    public static class Polling {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(5);
        private Duration initialDelay = Duration.ofSeconds(1);
    }

    @Data
    public static class Analysis {
        private int maxConcurrency = 8;
        private Duration timeout = Duration.ofSeconds(10);
        private int candleWindow = 100;
        private List<Interval> multiTimeframeIntervals = new ArrayList<>(List.of(Interval.M5, Interval.H1, Interval.W1));
        private double defaultMinConfidence = 0.6;
    }

    /**
     * Per-category RSI policy. Defaults are the documented table; gold uses period 14.
     */
    @Data
    public static class Thresholds {
        private CategoryThresholds wrappedBtc = new CategoryThresholds(14, 30, 70, 0.03, 0.05, Interval.H1);
        private CategoryThresholds tokenizedStock = new CategoryThresholds(14, 35, 65, 0.025, 0.04, Interval.M5);
        private CategoryThresholds goldToken = new CategoryThresholds(14, 25, 75, 0.015, 0.03, Interval.H1);
    }

    @Data
    @NoArgsConstructor
    public static class CategoryThresholds {
        private int period;
        private double oversold;
        private double overbought;
        private double stopLoss;
        private double takeProfit;
        private Interval timeframe;

        public CategoryThresholds(int period, double oversold, double overbought,
                                  double stopLoss, double takeProfit, Interval timeframe) {
            this.period = period;
            this.oversold = oversold;
            this.overbought = overbought;
            this.stopLoss = stopLoss;
            this.takeProfit = takeProfit;
            this.timeframe = timeframe;
        }
    }

    @Data
    public static class Payment {
        private boolean enabled = false;
        private String facilitatorUrl = "https://facilitator.payai.network";
        private String network = "solana";
        private String payTo = "";
        private String asset = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";
        private Duration verifyTimeout = Duration.ofSeconds(5);
        // keyed by operation name, e.g. get-rsi-analysis
        private Map<String, Pricing> pricing = new HashMap<>();

        @Data
        public static class Pricing {
            private Long amount;
            private String description;
        }
    }
}
