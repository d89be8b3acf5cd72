package com.whereq.herald.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.herald.config.HeraldProperties;
import com.whereq.herald.exception.DispatchFailureException;
import com.whereq.herald.model.NotificationPayload;
import com.whereq.herald.model.Priority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Delivers notifications as JSON POSTs to a webhook.
 * The destination is an absolute URL or a path relative to {@code herald.dispatch.webhook-base-url}.
 */
@Slf4j
@Component
public class WebhookDispatcher implements Dispatcher {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public WebhookDispatcher(WebClient webhookWebClient, ObjectMapper objectMapper, HeraldProperties properties) {
        this.webClient = webhookWebClient;
        this.objectMapper = objectMapper;
        this.timeout = properties.getDispatch().getTimeout();
    }

    @Override
    public Mono<String> deliver(NotificationPayload payload) {
        String destination = payload.getDestination();
        if (destination == null || destination.isBlank()) {
            return Mono.error(new DispatchFailureException("Notification has no destination"));
        }

        return webClient.post()
            .uri(destination)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(buildBody(payload))
            .retrieve()
            .toEntity(String.class)
            .timeout(timeout)
            .flatMap(response -> Mono.justOrEmpty(deliveryId(response.getBody())))
            .doOnSuccess(deliveryId -> log.info("Webhook delivered \"{}\" to {} (delivery id {})",
                payload.getTitle(), destination, deliveryId))
            .onErrorMap(e -> !(e instanceof DispatchFailureException), e -> toFailure(destination, e));
    }

    private Map<String, Object> buildBody(NotificationPayload payload) {
        Map<String, Object> body = new HashMap<>();
        body.put("title", payload.getTitle());
        body.put("message", payload.getMessage());
        body.put("priority", payload.getPriority() != null ? payload.getPriority().name() : Priority.MEDIUM.name());
        body.put("metadata", payload.getMetadata());
        body.put("timestamp", System.currentTimeMillis());
        return body;
    }

    /**
     * Any 2xx counts as delivered; the id is taken from a JSON object reply when there is one
     */
    private String deliveryId(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode id = objectMapper.readTree(body).get("id");
            return id != null && !id.isNull() ? id.asText() : null;
        } catch (JsonProcessingException e) {
            log.debug("Webhook reply is not JSON, no delivery id: {}", body);
            return null;
        }
    }

    private DispatchFailureException toFailure(String destination, Throwable error) {
        if (error instanceof WebClientResponseException response) {
            return new DispatchFailureException(
                "Webhook " + destination + " answered " + response.getStatusCode().value(), error);
        }
        if (error instanceof TimeoutException) {
            return new DispatchFailureException(
                "Webhook " + destination + " timed out after " + timeout, error);
        }
        return new DispatchFailureException(
            "Webhook " + destination + " failed: " + error.getMessage(), error);
    }
}
