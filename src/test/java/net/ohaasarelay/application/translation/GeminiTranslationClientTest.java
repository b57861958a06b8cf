package net.ohaasarelay.application.translation;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import net.ohaasarelay.config.OhaasaProperties;
import net.ohaasarelay.domain.horoscope.RankedItem;
import net.ohaasarelay.exception.DailyContentException;
import net.ohaasarelay.exception.DailyContentException.ErrorCode;
import net.ohaasarelay.testutil.HoroscopeTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import tools.jackson.databind.ObjectMapper;

import static org.assertj.core.api.Assertions.assertThat;

class GeminiTranslationClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicInteger calls = new AtomicInteger();
    private final List<URI> requestedUris = new CopyOnWriteArrayList<>();
    private final Deque<Supplier<Mono<ClientResponse>>> scriptedResponses = new ArrayDeque<>();
    private SimpleMeterRegistry meterRegistry;
    private GeminiTranslationClient client;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ExchangeFunction exchangeFunction = request -> {
            calls.incrementAndGet();
            requestedUris.add(request.url());
            assertThat(request.method()).isEqualTo(HttpMethod.POST);
            Supplier<Mono<ClientResponse>> next = scriptedResponses.poll();
            return next != null ? next.get() : Mono.just(response(HttpStatus.INTERNAL_SERVER_ERROR, "{}"));
        };
        client = new GeminiTranslationClient(
            WebClient.builder().exchangeFunction(exchangeFunction),
            objectMapper,
            HoroscopeTestData.fastProperties(),
            meterRegistry);
    }

    @Test
    void should_SucceedOnSecondAttempt_When_FirstAttemptReturnsServerError() {
        respondWith(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"boom\"}");
        respondWith(HttpStatus.OK, successBody(12));

        StepVerifier.create(client.translate(HoroscopeTestData.rawItems(12), "test-key"))
            .assertNext(items -> {
                assertThat(items).hasSize(12);
                assertThat(items.get(0).rank()).isEqualTo("1위");
                assertThat(items.get(0).sign()).isEqualTo("양자리");
                assertThat(items.get(0).sourceSign()).isEqualTo("牡羊座");
            })
            .expectComplete()
            .verify(Duration.ofSeconds(5));

        assertThat(calls.get()).isEqualTo(2);
        assertThat(meterRegistry.counter("ohaasa.translation.attempts").count()).isEqualTo(2.0);
    }

    @Test
    void should_FailAfterThreeAttempts_When_EveryAttemptReturnsServerError() {
        respondWith(HttpStatus.INTERNAL_SERVER_ERROR, "{}");
        respondWith(HttpStatus.BAD_GATEWAY, "{}");
        respondWith(HttpStatus.SERVICE_UNAVAILABLE, "{}");
        respondWith(HttpStatus.OK, successBody(12));

        StepVerifier.create(client.translate(HoroscopeTestData.rawItems(12), "test-key"))
            .expectErrorSatisfies(error -> assertErrorCode(error, ErrorCode.TRANSLATION_UNAVAILABLE))
            .verify(Duration.ofSeconds(5));

        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void should_WaitOneStepThenTwoSteps_When_RetryingServerErrors() {
        OhaasaProperties properties = HoroscopeTestData.fastProperties();
        properties.getTranslation().setBackoffStep(Duration.ofSeconds(1));
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction alwaysFailing = request -> {
            attempts.incrementAndGet();
            return Mono.just(response(HttpStatus.SERVICE_UNAVAILABLE, "{}"));
        };
        GeminiTranslationClient slowClient = new GeminiTranslationClient(
            WebClient.builder().exchangeFunction(alwaysFailing),
            objectMapper,
            properties,
            new SimpleMeterRegistry());

        StepVerifier.withVirtualTime(() -> slowClient.translate(HoroscopeTestData.rawItems(12), "test-key"))
            .expectSubscription()
            .then(() -> assertThat(attempts.get()).isEqualTo(1))
            .thenAwait(Duration.ofMillis(900))
            .then(() -> assertThat(attempts.get()).isEqualTo(1))
            .thenAwait(Duration.ofMillis(100))
            .then(() -> assertThat(attempts.get()).isEqualTo(2))
            .thenAwait(Duration.ofMillis(1900))
            .then(() -> assertThat(attempts.get()).isEqualTo(2))
            .thenAwait(Duration.ofMillis(100))
            .then(() -> assertThat(attempts.get()).isEqualTo(3))
            .expectErrorSatisfies(error -> assertErrorCode(error, ErrorCode.TRANSLATION_UNAVAILABLE))
            .verify(Duration.ofSeconds(5));

        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void should_StopImmediately_When_StatusIsClientError() {
        respondWith(HttpStatus.BAD_REQUEST, "{\"error\":\"API key not valid\"}");
        respondWith(HttpStatus.OK, successBody(12));

        StepVerifier.create(client.translate(HoroscopeTestData.rawItems(12), "test-key"))
            .expectErrorSatisfies(error -> assertErrorCode(error, ErrorCode.TRANSLATION_UNAVAILABLE))
            .verify(Duration.ofSeconds(5));

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void should_FailWithoutHttpCall_When_ApiKeyIsBlank() {
        StepVerifier.create(client.translate(HoroscopeTestData.rawItems(12), "   "))
            .expectErrorSatisfies(error -> assertErrorCode(error, ErrorCode.CREDENTIAL_MISSING))
            .verify(Duration.ofSeconds(5));

        assertThat(calls.get()).isZero();
    }

    @Test
    void should_Retry_When_SuccessfulStatusCarriesMalformedPayload() {
        respondWith(HttpStatus.OK, HoroscopeTestData.generateContentResponse(objectMapper, "not json at all"));
        respondWith(HttpStatus.OK, successBody(12));

        StepVerifier.create(client.translate(HoroscopeTestData.rawItems(12), "test-key"))
            .assertNext(items -> assertThat(items).hasSize(12))
            .expectComplete()
            .verify(Duration.ofSeconds(5));

        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void should_Retry_When_TransportFails() {
        scriptedResponses.add(() -> Mono.error(new IOException("connection reset")));
        respondWith(HttpStatus.OK, successBody(12));

        StepVerifier.create(client.translate(HoroscopeTestData.rawItems(12), "test-key"))
            .assertNext(items -> assertThat(items).hasSize(12))
            .expectComplete()
            .verify(Duration.ofSeconds(5));

        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void should_SendKeyAsQueryParameter_When_CallingModelEndpoint() {
        respondWith(HttpStatus.OK, successBody(12));

        StepVerifier.create(client.translate(HoroscopeTestData.rawItems(12), "  test-key  "))
            .expectNextCount(1)
            .expectComplete()
            .verify(Duration.ofSeconds(5));

        URI uri = requestedUris.get(0);
        assertThat(uri.getHost()).isEqualTo("gemini.test");
        assertThat(uri.getPath()).isEqualTo("/v1beta/models/gemini-2.5-flash-preview-09-2025:generateContent");
        assertThat(uri.getQuery()).isEqualTo("key=test-key");
    }

    @Test
    void should_LeaveSourceSignNull_When_TranslationReturnsMoreItemsThanSource() {
        respondWith(HttpStatus.OK, successBody(12));

        List<RankedItem> items = client.translate(HoroscopeTestData.rawItems(11), "test-key")
            .block(Duration.ofSeconds(5));

        assertThat(items).hasSize(12);
        assertThat(items.get(10).sourceSign()).isEqualTo("水瓶座");
        assertThat(items.get(11).sourceSign()).isNull();
    }

    private void respondWith(HttpStatus status, String body) {
        scriptedResponses.add(() -> Mono.just(response(status, body)));
    }

    private String successBody(int count) {
        return HoroscopeTestData.generateContentResponse(objectMapper,
            HoroscopeTestData.translatedArrayJson(objectMapper, count));
    }

    private static ClientResponse response(HttpStatus status, String body) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }

    private static void assertErrorCode(Throwable error, ErrorCode expected) {
        assertThat(error).isInstanceOf(DailyContentException.class);
        assertThat(((DailyContentException) error).errorCode()).isEqualTo(expected);
    }
}
