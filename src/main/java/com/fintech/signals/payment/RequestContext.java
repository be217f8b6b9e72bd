package com.fintech.signals.payment;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Caller-supplied request data the gate may inspect. Header names are case-insensitive.
 *
 * @param resource Requested resource, e.g. the request path
 * @param headers Request headers
 */
public record RequestContext(String resource, Map<String, String> headers) {

    public static final String PAYMENT_HEADER = "X-PAYMENT";

    public RequestContext {
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = copy;
        resource = resource != null ? resource : "";
    }

    public static RequestContext empty() {
        return new RequestContext("", Map.of());
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name)).filter(value -> !value.isBlank());
    }

    public Optional<String> paymentHeader() {
        return header(PAYMENT_HEADER);
    }
}
