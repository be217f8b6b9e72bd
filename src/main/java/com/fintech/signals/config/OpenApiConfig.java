package com.fintech.signals.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * Access the interactive API documentation at:
 * - Swagger UI: http://localhost:8080/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI signalEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("RWA Signal Engine API")
                        .description("""
                                Real-time prices, OHLC candles and RSI trading signals for tokenized
                                real-world assets: wrapped BTC, tokenized stocks and gold tokens.

                                **Features:**
                                - Multi-interval candles (1s, 1m, 5m, 1h, 1w, 1M) built from polled prices
                                - Wilder RSI with per-category thresholds
                                - Buy/sell/hold signals, divergence and multi-timeframe RSI
                                - Per-operation x402 payment gate

                                Metered operations answer **402 Payment Required** without a valid
                                `X-PAYMENT` header when the gate is enabled.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
