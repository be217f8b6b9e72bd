package com.fintech.signals.quote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.signals.domain.Instrument;
import com.fintech.signals.domain.PriceQuote;
import com.fintech.signals.error.UpstreamFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;

/**
 * Jupiter price API v3 client. Response shape:
 * <pre>{ "&lt;mint&gt;": { "usdPrice": 97000.12, "priceChange24h": -1.2, ... } }</pre>
 */
public class JupiterPriceFeedClient implements PriceFeedClient {

    private static final Logger log = LoggerFactory.getLogger(JupiterPriceFeedClient.class);

    static final String SOURCE = "jupiter";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JupiterPriceFeedClient(RestClient priceFeedRestClient, ObjectMapper objectMapper, Clock clock) {
        this.restClient = priceFeedRestClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public PriceQuote fetchPrice(Instrument instrument) {
        String json;
        try {
            json = restClient.get()
                .uri(uriBuilder -> uriBuilder.queryParam("ids", instrument.id()).build())
                .retrieve()
                .body(String.class);
        } catch (RestClientResponseException e) {
            throw new UpstreamFetchException(
                "Price feed returned HTTP " + e.getStatusCode().value() + " for " + instrument.symbol(), e);
        } catch (RestClientException e) {
            throw new UpstreamFetchException(
                "Price feed unreachable for " + instrument.symbol() + ": " + e.getMessage(), e);
        }

        PriceQuote quote = parseQuote(instrument, json);
        log.debug("Price fetched: symbol={}, price={}, change24h={}",
                instrument.symbol(), quote.price(), quote.priceChange24h());
        return quote;
    }

    @Override
    public String sourceName() {
        return SOURCE;
    }

    PriceQuote parseQuote(Instrument instrument, String json) {
        if (json == null || json.isBlank()) {
            throw new UpstreamFetchException("Empty price feed response for " + instrument.symbol());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UpstreamFetchException("Malformed price feed response for " + instrument.symbol(), e);
        }
        JsonNode entry = root.path(instrument.id());
        JsonNode usdPrice = entry.path("usdPrice");
        if (!usdPrice.isNumber() && !usdPrice.isTextual()) {
            throw new UpstreamFetchException("No price data available for " + instrument.symbol());
        }
        double price = usdPrice.asDouble(Double.NaN);
        if (!Double.isFinite(price) || price <= 0) {
            throw new UpstreamFetchException(
                "Unusable price " + usdPrice.asText() + " for " + instrument.symbol());
        }
        return new PriceQuote(instrument, price, clock.millis(), SOURCE, parseChange(entry.path("priceChange24h")));
    }

    private static Double parseChange(JsonNode change) {
        if (!change.isNumber() && !change.isTextual()) {
            return null;
        }
        double value = change.asDouble(Double.NaN);
        return Double.isFinite(value) ? value : null;
    }
}
