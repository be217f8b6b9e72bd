package com.fintech.signals.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fintech.signals.config.SignalProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Verifies the caller's {@code X-PAYMENT} proof with an x402 facilitator.
 * Fails closed: a missing header, an undecodable proof, a transport error or a
 * negative verdict all deny the request.
 */
public class FacilitatorPaymentGate implements PaymentAuthorizationGate {

    private static final Logger log = LoggerFactory.getLogger(FacilitatorPaymentGate.class);

    static final String PAYMENT_REQUIRED = "Payment Required";
    static final String VERIFICATION_FAILED = "Payment verification failed";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final OperationPricing pricing;
    private final SignalProperties.Payment config;

    public FacilitatorPaymentGate(
            RestClient restClient,
            ObjectMapper objectMapper,
            OperationPricing pricing,
            SignalProperties properties) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.pricing = pricing;
        this.config = properties.getPayment();
    }

    @Override
    public AuthorizationDecision authorize(MeteredOperation operation, RequestContext context) {
        Optional<String> header = context.paymentHeader();
        if (header.isEmpty()) {
            log.debug("No payment header: operation={}, resource={}", operation.operationName(), context.resource());
            return AuthorizationDecision.deny(PAYMENT_REQUIRED);
        }

        JsonNode payload;
        try {
            byte[] decoded = Base64.getDecoder().decode(header.get().trim());
            payload = objectMapper.readTree(new String(decoded, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException | IOException e) {
            log.warn("Undecodable payment header: operation={}, error={}", operation.operationName(), e.getMessage());
            return AuthorizationDecision.deny(VERIFICATION_FAILED);
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("x402Version", payload.path("x402Version").asInt(1));
        body.set("paymentPayload", payload);
        body.set("paymentRequirements", requirementsNode(pricing.requirementFor(operation), context.resource()));

        try {
            String response = restClient.post()
                .uri("/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .body(objectMapper.writeValueAsString(body))
                .retrieve()
                .body(String.class);

            JsonNode verdict = objectMapper.readTree(response == null ? "{}" : response);
            if (verdict.path("isValid").asBoolean(false)) {
                log.info("Payment verified: operation={}, resource={}", operation.operationName(), context.resource());
                return AuthorizationDecision.grant();
            }
            String reason = verdict.path("invalidReason").asText("");
            log.warn("Payment rejected by facilitator: operation={}, reason={}", operation.operationName(), reason);
            return AuthorizationDecision.deny(reason.isBlank() ? VERIFICATION_FAILED : VERIFICATION_FAILED + ": " + reason);
        } catch (RestClientException | IOException e) {
            log.error("Facilitator call failed: operation={}, url={}", operation.operationName(), config.getFacilitatorUrl(), e);
            return AuthorizationDecision.deny(VERIFICATION_FAILED);
        }
    }

    private ObjectNode requirementsNode(PaymentRequirement requirement, String resource) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("scheme", "exact");
        node.put("network", config.getNetwork());
        node.put("maxAmountRequired", String.valueOf(requirement.amount()));
        node.put("resource", resource);
        node.put("description", requirement.description());
        node.put("mimeType", "application/json");
        node.put("payTo", config.getPayTo());
        node.put("asset", config.getAsset());
        node.put("maxTimeoutSeconds", config.getVerifyTimeout().toSeconds());
        return node;
    }
}
