package net.ohaasarelay.application.translation;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.ohaasarelay.config.OhaasaProperties;
import net.ohaasarelay.domain.horoscope.RankedItem;
import net.ohaasarelay.domain.horoscope.RawHoroscopeItem;
import net.ohaasarelay.exception.DailyContentException;
import net.ohaasarelay.exception.DailyContentException.ErrorCode;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Translates the Japanese ranking into Korean through Gemini {@code generateContent}.
 *
 * <p>Each call makes at most {@code ohaasa.translation.max-attempts} requests. Server
 * errors, transport failures and unreadable 2xx bodies are retried after a linear
 * delay ({@code n * backoff-step} before retry {@code n}); any other status ends the
 * call at once. The guild's key travels as the {@code key} query parameter and never
 * reaches the logs.</p>
 */
@Slf4j
@Service
public class GeminiTranslationClient {

    static final String SYSTEM_PROMPT = """
        You are an expert translator specializing in Japanese-to-Korean horoscopes. \
        The input is a JSON string containing horoscope rankings and descriptions in Japanese. \
        Translate ALL Japanese text into natural, easy-to-read Korean. \
        Keep the structure (rank, sign, description) and output a JSON array of objects with \
        fields: rank, sign_ko, description_ko. \
        Return ONLY the raw JSON array.""";

    private static final String GENERATE_CONTENT_PATH = "/models/{model}:generateContent";
    private static final int ERROR_BODY_LOG_LIMIT = 300;

    private static final Map<String, Object> RESPONSE_SCHEMA = Map.of(
        "type", "ARRAY",
        "items", Map.of(
            "type", "OBJECT",
            "properties", Map.of(
                "rank", Map.of("type", "STRING", "description", "Ranking in Korean, e.g. '1위'"),
                "sign_ko", Map.of("type", "STRING", "description", "Korean name of the zodiac sign, e.g. '양자리'"),
                "description_ko", Map.of("type", "STRING", "description", "Full horoscope description in Korean")
            ),
            "required", List.of("rank", "sign_ko", "description_ko")
        )
    );

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final TranslationResponseParser responseParser;
    private final String model;
    private final int maxAttempts;
    private final Duration backoffStep;
    private final Duration requestTimeout;
    private final Counter attemptCounter;

    public GeminiTranslationClient(WebClient.Builder webClientBuilder,
                                   ObjectMapper objectMapper,
                                   OhaasaProperties properties,
                                   MeterRegistry meterRegistry) {
        OhaasaProperties.Translation translation = properties.getTranslation();
        this.webClient = webClientBuilder.clone().baseUrl(translation.getBaseUrl()).build();
        this.objectMapper = objectMapper;
        this.responseParser = new TranslationResponseParser(objectMapper);
        this.model = translation.getModel();
        this.maxAttempts = translation.getMaxAttempts();
        this.backoffStep = translation.getBackoffStep();
        this.requestTimeout = translation.getRequestTimeout();
        this.attemptCounter = Counter.builder("ohaasa.translation.attempts")
            .description("Requests sent to the translation endpoint, retries included")
            .register(meterRegistry);
    }

    /**
     * Translates the given items with the guild's credential.
     *
     * @param rawItems today's ranking in broadcast order
     * @param apiKey the guild's Gemini key
     * @return translated items, or an error signal carrying {@link DailyContentException}
     *         ({@code CREDENTIAL_MISSING} or {@code TRANSLATION_UNAVAILABLE})
     */
    public Mono<List<RankedItem>> translate(List<RawHoroscopeItem> rawItems, String apiKey) {
        if (!StringUtils.hasText(apiKey)) {
            return Mono.error(new DailyContentException(ErrorCode.CREDENTIAL_MISSING,
                "Gemini API key is not configured"));
        }
        if (rawItems == null || rawItems.isEmpty()) {
            return Mono.error(new DailyContentException(ErrorCode.TRANSLATION_UNAVAILABLE,
                "Nothing to translate"));
        }

        String requestBody;
        try {
            requestBody = buildRequestBody(rawItems);
        } catch (JacksonException ex) {
            return Mono.error(new DailyContentException(ErrorCode.TRANSLATION_UNAVAILABLE,
                "Translation request could not be serialized", ex));
        }

        String key = apiKey.trim();
        return Mono.defer(() -> sendOnce(requestBody, key))
            .map(responseBody -> parseResponse(responseBody, rawItems))
            .retryWhen(linearBackoff())
            .onErrorMap(ex -> !(ex instanceof DailyContentException),
                ex -> new DailyContentException(ErrorCode.TRANSLATION_UNAVAILABLE,
                    "Translation failed after " + maxAttempts + " attempt(s): " + describe(ex), ex))
            .doOnSuccess(items -> log.info("Translated {} horoscope item(s)", items == null ? 0 : items.size()))
            .doOnError(ex -> log.error("Translation unavailable: {}", ex.getMessage()));
    }

    private Mono<String> sendOnce(String requestBody, String apiKey) {
        attemptCounter.increment();
        return webClient.post()
            .uri(uriBuilder -> uriBuilder
                .path(GENERATE_CONTENT_PATH)
                .queryParam("key", "{key}")
                .build(model, apiKey))
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .bodyValue(requestBody)
            .exchangeToMono(this::readResponse)
            .timeout(requestTimeout);
    }

    private Mono<String> readResponse(ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        if (status.is2xxSuccessful()) {
            return response.bodyToMono(String.class).defaultIfEmpty("");
        }
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .flatMap(errorBody -> {
                String clipped = clip(errorBody);
                if (status.is5xxServerError()) {
                    log.warn("Translation endpoint server error (status {}): {}", status.value(), clipped);
                    return Mono.error(new TransientTranslationException("Translation endpoint returned " + status.value()));
                }
                log.error("Translation endpoint rejected the request (status {}): {}", status.value(), clipped);
                return Mono.error(new DailyContentException(ErrorCode.TRANSLATION_UNAVAILABLE,
                    "Translation endpoint returned " + status.value()));
            });
    }

    private List<RankedItem> parseResponse(String responseBody, List<RawHoroscopeItem> rawItems) {
        List<RankedItem> items;
        try {
            items = responseParser.parse(responseBody, rawItems);
        } catch (IllegalStateException ex) {
            throw new TransientTranslationException("Malformed translation payload: " + ex.getMessage(), ex);
        }
        if (items.isEmpty()) {
            throw new TransientTranslationException("Translation payload contained no usable items");
        }
        return items;
    }

    private Retry linearBackoff() {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long retryNumber = signal.totalRetries() + 1;
            if (failure instanceof DailyContentException || retryNumber >= maxAttempts) {
                return Mono.error(failure);
            }
            Duration delay = backoffStep.multipliedBy(retryNumber);
            log.warn("Translation attempt {}/{} failed ({}); retrying in {} ms",
                retryNumber, maxAttempts, describe(failure), delay.toMillis());
            return Mono.delay(delay);
        }));
    }

    private String buildRequestBody(List<RawHoroscopeItem> rawItems) {
        String sourceJson = objectMapper.writeValueAsString(rawItems);
        Map<String, Object> payload = Map.of(
            "contents", List.of(Map.of("parts", List.of(Map.of("text", sourceJson)))),
            "systemInstruction", Map.of("parts", List.of(Map.of("text", SYSTEM_PROMPT))),
            "generationConfig", Map.of(
                "responseMimeType", "application/json",
                "responseSchema", RESPONSE_SCHEMA
            )
        );
        return objectMapper.writeValueAsString(payload);
    }

    private static String clip(String text) {
        if (text.length() <= ERROR_BODY_LOG_LIMIT) {
            return text;
        }
        return text.substring(0, ERROR_BODY_LOG_LIMIT) + "...";
    }

    private static String describe(Throwable ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    /**
     * Failure worth another attempt: a 5xx status or a 2xx body that could not be read.
     */
    static final class TransientTranslationException extends RuntimeException {

        TransientTranslationException(String message) {
            super(message);
        }

        TransientTranslationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
