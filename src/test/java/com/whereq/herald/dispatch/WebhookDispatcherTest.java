package com.whereq.herald.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.herald.config.HeraldProperties;
import com.whereq.herald.exception.DispatchFailureException;
import com.whereq.herald.model.NotificationPayload;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookDispatcherTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void deliver_postsJsonAndReturnsDeliveryId() {
        WebhookDispatcher dispatcher = dispatcher(respondWith(HttpStatus.OK, "{\"id\":\"msg-42\"}"));

        StepVerifier.create(dispatcher.deliver(payload("https://hooks.example.com/team")))
            .expectNext("msg-42")
            .verifyComplete();

        assertThat(requests).hasSize(1);
        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString()).isEqualTo("https://hooks.example.com/team");
        assertThat(request.headers().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
    }

    @Test
    void deliver_withoutIdInResponse_completesEmpty() {
        WebhookDispatcher dispatcher = dispatcher(respondWith(HttpStatus.OK, "{\"ok\":true}"));

        StepVerifier.create(dispatcher.deliver(payload("https://hooks.example.com/team")))
            .verifyComplete();
    }

    @Test
    void deliver_plainTextReply_countsAsDelivered() {
        WebhookDispatcher dispatcher = dispatcher(respondWith(HttpStatus.OK, MediaType.TEXT_PLAIN_VALUE, "1"));

        StepVerifier.create(dispatcher.deliver(payload("https://hooks.example.com/team")))
            .verifyComplete();
    }

    @Test
    void deliver_emptyReplyWithoutContentType_countsAsDelivered() {
        WebhookDispatcher dispatcher = dispatcher(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(HttpStatus.NO_CONTENT).build());
        });

        StepVerifier.create(dispatcher.deliver(payload("https://hooks.example.com/team")))
            .verifyComplete();
        assertThat(requests).hasSize(1);
    }

    @Test
    void deliver_numericIdIsReturnedAsText() {
        WebhookDispatcher dispatcher = dispatcher(respondWith(HttpStatus.CREATED, "{\"id\":1234}"));

        StepVerifier.create(dispatcher.deliver(payload("https://hooks.example.com/team")))
            .expectNext("1234")
            .verifyComplete();
    }

    @Test
    void deliver_errorStatus_failsWithStatusCode() {
        WebhookDispatcher dispatcher = dispatcher(respondWith(HttpStatus.SERVICE_UNAVAILABLE, "{}"));

        StepVerifier.create(dispatcher.deliver(payload("https://hooks.example.com/team")))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(DispatchFailureException.class)
                .hasMessageContaining("answered 503"))
            .verify();
    }

    @Test
    void deliver_slowWebhook_timesOut() {
        HeraldProperties properties = new HeraldProperties();
        properties.getDispatch().setTimeout(Duration.ofMillis(50));
        WebClient webClient = WebClient.builder().exchangeFunction(request -> Mono.never()).build();
        WebhookDispatcher dispatcher = new WebhookDispatcher(webClient, objectMapper, properties);

        StepVerifier.create(dispatcher.deliver(payload("https://hooks.example.com/team")))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(DispatchFailureException.class)
                .hasMessageContaining("timed out"))
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void deliver_blankDestination_failsWithoutCallingWebhook() {
        WebhookDispatcher dispatcher = dispatcher(respondWith(HttpStatus.OK, "{}"));

        StepVerifier.create(dispatcher.deliver(payload(" ")))
            .expectError(DispatchFailureException.class)
            .verify();

        assertThat(requests).isEmpty();
    }

    private WebhookDispatcher dispatcher(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder().exchangeFunction(exchange).build();
        return new WebhookDispatcher(webClient, objectMapper, new HeraldProperties());
    }

    private ExchangeFunction respondWith(HttpStatus status, String body) {
        return respondWith(status, MediaType.APPLICATION_JSON_VALUE, body);
    }

    private ExchangeFunction respondWith(HttpStatus status, String contentType, String body) {
        return request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, contentType)
                .body(body)
                .build());
        };
    }

    private static NotificationPayload payload(String destination) {
        return NotificationPayload.builder()
            .title("Deploy finished")
            .message("Release 1.4.2 is live")
            .destination(destination)
            .build();
    }
}
