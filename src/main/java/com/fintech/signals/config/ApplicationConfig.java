package com.fintech.signals.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.signals.aggregation.CandleAggregator;
import com.fintech.signals.analysis.AssetAnalyzer;
import com.fintech.signals.analysis.MultiTimeframeAnalyzer;
import com.fintech.signals.analysis.PortfolioAggregator;
import com.fintech.signals.concurrent.BatchExecutor;
import com.fintech.signals.domain.PriceQuote;
import com.fintech.signals.ingestion.DisruptorEventPublisher;
import com.fintech.signals.ingestion.PricePoller;
import com.fintech.signals.payment.FacilitatorPaymentGate;
import com.fintech.signals.payment.OpenPaymentGate;
import com.fintech.signals.payment.OperationGuard;
import com.fintech.signals.payment.OperationPricing;
import com.fintech.signals.payment.PaymentAuthorizationGate;
import com.fintech.signals.quote.JupiterPriceFeedClient;
import com.fintech.signals.quote.PriceFeedClient;
import com.fintech.signals.quote.QuoteCache;
import com.fintech.signals.quote.QuoteService;
import com.fintech.signals.registry.InstrumentRegistry;
import com.fintech.signals.service.SignalOperations;
import com.fintech.signals.signal.DivergenceDetector;
import com.fintech.signals.signal.SignalDetector;
import com.fintech.signals.signal.ThresholdPolicy;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for core application beans. Components are plain classes
 * wired here so tests can build them by hand.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InstrumentRegistry instrumentRegistry(SignalProperties properties) {
        return InstrumentRegistry.fromProperties(properties);
    }

    @Bean
    public ThresholdPolicy thresholdPolicy(SignalProperties properties) {
        return ThresholdPolicy.fromProperties(properties);
    }

    // Ingestion and aggregation

    @Bean
    public CandleAggregator candleAggregator(SignalProperties properties, MeterRegistry meterRegistry) {
        return new CandleAggregator(properties.getAggregation().getMaxCandlesPerSeries(), meterRegistry);
    }

    @Bean
    public DisruptorEventPublisher disruptorEventPublisher(
            CandleAggregator aggregator, SignalProperties properties, MeterRegistry meterRegistry) {
        return new DisruptorEventPublisher(aggregator, properties, meterRegistry);
    }

    // Price feed

    @Bean
    public RestClient priceFeedRestClient(SignalProperties properties) {
        SignalProperties.Quote quote = properties.getQuote();
        return RestClient.builder()
            .baseUrl(quote.getBaseUrl())
            .requestFactory(requestFactory(quote.getConnectTimeout(), quote.getReadTimeout()))
            .build();
    }

    @Bean
    public PriceFeedClient priceFeedClient(RestClient priceFeedRestClient, ObjectMapper objectMapper, Clock clock) {
        return new JupiterPriceFeedClient(priceFeedRestClient, objectMapper, clock);
    }

    @Bean
    public QuoteCache<PriceQuote> quoteCache(SignalProperties properties, Clock clock, MeterRegistry meterRegistry) {
        SignalProperties.Quote quote = properties.getQuote();
        QuoteCache<PriceQuote> cache = new QuoteCache<>(quote.getCacheTtl(), quote.getCacheMaxEntries(), clock);
        meterRegistry.gauge("quote.cache.size", cache, QuoteCache::size);
        meterRegistry.gauge("quote.cache.hits", cache, QuoteCache::hits);
        meterRegistry.gauge("quote.cache.misses", cache, QuoteCache::misses);
        meterRegistry.gauge("quote.cache.evictions", cache, QuoteCache::evictions);
        return cache;
    }

    @Bean
    public QuoteService quoteService(
            InstrumentRegistry registry,
            PriceFeedClient priceFeedClient,
            QuoteCache<PriceQuote> quoteCache,
            DisruptorEventPublisher publisher,
            CandleAggregator aggregator,
            BatchExecutor batchExecutor,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        return new QuoteService(registry, priceFeedClient, quoteCache, publisher, aggregator,
            batchExecutor, circuitBreakerRegistry, meterRegistry);
    }

    @Bean
    public TaskScheduler pricePollerScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("price-poller-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    @ConditionalOnProperty(prefix = "signals.polling", name = "enabled", havingValue = "true", matchIfMissing = true)
    public PricePoller pricePoller(
            InstrumentRegistry registry,
            QuoteService quoteService,
            TaskScheduler pricePollerScheduler,
            SignalProperties properties,
            MeterRegistry meterRegistry) {
        SignalProperties.Polling polling = properties.getPolling();
        return new PricePoller(registry, quoteService, pricePollerScheduler,
            polling.getInterval(), polling.getInitialDelay(), meterRegistry);
    }

    // Analysis

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService analysisExecutor(SignalProperties properties) {
        AtomicInteger threadCount = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "analysis-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(properties.getAnalysis().getMaxConcurrency(), threadFactory);
    }

    @Bean
    public BatchExecutor batchExecutor(ExecutorService analysisExecutor, SignalProperties properties) {
        return new BatchExecutor(analysisExecutor, properties.getAnalysis().getTimeout());
    }

    @Bean
    public SignalDetector signalDetector(ThresholdPolicy thresholdPolicy) {
        return new SignalDetector(thresholdPolicy);
    }

    @Bean
    public DivergenceDetector divergenceDetector() {
        return new DivergenceDetector();
    }

    @Bean
    public MultiTimeframeAnalyzer multiTimeframeAnalyzer(CandleAggregator aggregator, ThresholdPolicy thresholdPolicy) {
        return new MultiTimeframeAnalyzer(aggregator, thresholdPolicy);
    }

    @Bean
    public AssetAnalyzer assetAnalyzer(
            CandleAggregator aggregator,
            ThresholdPolicy thresholdPolicy,
            SignalDetector signalDetector,
            DivergenceDetector divergenceDetector,
            MultiTimeframeAnalyzer multiTimeframeAnalyzer,
            SignalProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        SignalProperties.Analysis analysis = properties.getAnalysis();
        return new AssetAnalyzer(aggregator, thresholdPolicy, signalDetector, divergenceDetector,
            multiTimeframeAnalyzer, analysis.getMultiTimeframeIntervals(), analysis.getCandleWindow(),
            clock, meterRegistry);
    }

    @Bean
    public PortfolioAggregator portfolioAggregator(AssetAnalyzer assetAnalyzer, BatchExecutor batchExecutor, Clock clock) {
        return new PortfolioAggregator(assetAnalyzer, batchExecutor, clock);
    }

    // Payment gate

    @Bean
    public OperationPricing operationPricing(SignalProperties properties) {
        return new OperationPricing(properties);
    }

    @Bean
    public RestClient facilitatorRestClient(SignalProperties properties) {
        SignalProperties.Payment payment = properties.getPayment();
        return RestClient.builder()
            .baseUrl(payment.getFacilitatorUrl())
            .requestFactory(requestFactory(payment.getVerifyTimeout(), payment.getVerifyTimeout()))
            .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "signals.payment", name = "enabled", havingValue = "true")
    public PaymentAuthorizationGate facilitatorPaymentGate(
            RestClient facilitatorRestClient,
            ObjectMapper objectMapper,
            OperationPricing operationPricing,
            SignalProperties properties) {
        return new FacilitatorPaymentGate(facilitatorRestClient, objectMapper, operationPricing, properties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "signals.payment", name = "enabled", havingValue = "false", matchIfMissing = true)
    public PaymentAuthorizationGate openPaymentGate() {
        return new OpenPaymentGate();
    }

    @Bean
    public OperationGuard operationGuard(
            PaymentAuthorizationGate gate, OperationPricing operationPricing, MeterRegistry meterRegistry) {
        return new OperationGuard(gate, operationPricing, meterRegistry);
    }

    @Bean
    public SignalOperations signalOperations(
            InstrumentRegistry registry,
            QuoteService quoteService,
            CandleAggregator aggregator,
            AssetAnalyzer assetAnalyzer,
            PortfolioAggregator portfolioAggregator,
            DivergenceDetector divergenceDetector,
            ThresholdPolicy thresholdPolicy,
            OperationGuard operationGuard,
            SignalProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        return new SignalOperations(registry, quoteService, aggregator, assetAnalyzer, portfolioAggregator,
            divergenceDetector, thresholdPolicy, operationGuard,
            properties.getAnalysis().getDefaultMinConfidence(), clock, meterRegistry);
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        return factory;
    }
}
