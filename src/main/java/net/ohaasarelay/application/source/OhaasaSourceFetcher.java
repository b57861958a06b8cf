package net.ohaasarelay.application.source;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.ohaasarelay.config.OhaasaProperties;
import net.ohaasarelay.domain.horoscope.RawHoroscopeItem;
import net.ohaasarelay.exception.DailyContentException;
import net.ohaasarelay.exception.DailyContentException.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Reads today's ranking from the broadcaster's JSON feed.
 *
 * <p>The feed is a one-element array whose {@code detail} list carries
 * {@code ranking_no}, a two-digit sign code in {@code horoscope_st} and the fortune
 * text in {@code horoscope_text}. Incomplete entries are skipped; a feed without a
 * single usable entry is a {@code SOURCE_UNAVAILABLE} failure.</p>
 */
@Service
public class OhaasaSourceFetcher implements HoroscopeSourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(OhaasaSourceFetcher.class);

    static final int EXPECTED_ITEM_COUNT = 12;
    private static final String FEED_ACCEPT = "application/json,text/javascript,*/*;q=0.01";
    private static final String RANK_SUFFIX = "位";

    private static final Map<String, String> SIGN_CODE_TO_JP = Map.ofEntries(
        Map.entry("01", "牡羊座"),
        Map.entry("02", "牡牛座"),
        Map.entry("03", "双子座"),
        Map.entry("04", "蟹座"),
        Map.entry("05", "獅子座"),
        Map.entry("06", "乙女座"),
        Map.entry("07", "天秤座"),
        Map.entry("08", "蠍座"),
        Map.entry("09", "射手座"),
        Map.entry("10", "山羊座"),
        Map.entry("11", "水瓶座"),
        Map.entry("12", "魚座")
    );

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final String feedUrl;
    private final String refererUrl;
    private final Duration timeout;

    public OhaasaSourceFetcher(WebClient.Builder webClientBuilder,
                               ObjectMapper objectMapper,
                               @Qualifier("horoscopeSourceRateLimiter") RateLimiter rateLimiter,
                               OhaasaProperties properties) {
        this.webClient = webClientBuilder.clone().build();
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.feedUrl = properties.getSource().getUrl();
        this.refererUrl = properties.getSource().getPageUrl();
        this.timeout = properties.getSource().getTimeout();
    }

    @Override
    public Mono<List<RawHoroscopeItem>> fetchToday() {
        return Mono.defer(() -> {
                log.info("Fetching horoscope feed from {}", feedUrl);
                return webClient.get()
                    .uri(feedUrl)
                    .header(HttpHeaders.ACCEPT, FEED_ACCEPT)
                    .header(HttpHeaders.REFERER, refererUrl)
                    .retrieve()
                    .bodyToMono(String.class);
            })
            .transformDeferred(RateLimiterOperator.of(rateLimiter))
            .timeout(timeout)
            .map(this::parseFeed)
            .switchIfEmpty(Mono.error(() -> new DailyContentException(ErrorCode.SOURCE_UNAVAILABLE,
                "Horoscope feed returned an empty body")))
            .onErrorMap(ex -> !(ex instanceof DailyContentException),
                ex -> new DailyContentException(ErrorCode.SOURCE_UNAVAILABLE,
                    "Horoscope feed request failed: " + describe(ex), ex))
            .doOnError(ex -> log.error("Horoscope feed unavailable: {}", ex.getMessage()));
    }

    List<RawHoroscopeItem> parseFeed(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JacksonException ex) {
            throw new DailyContentException(ErrorCode.SOURCE_UNAVAILABLE, "Horoscope feed was not valid JSON", ex);
        }
        if (root == null || !root.isArray() || root.size() == 0) {
            throw new DailyContentException(ErrorCode.SOURCE_UNAVAILABLE,
                "Horoscope feed top level was not a non-empty array");
        }

        JsonNode details = root.get(0).path("detail");
        if (!details.isArray()) {
            throw new DailyContentException(ErrorCode.SOURCE_UNAVAILABLE, "Horoscope feed has no detail array");
        }
        if (details.size() != EXPECTED_ITEM_COUNT) {
            log.warn("Horoscope feed detail count is {} instead of {}", details.size(), EXPECTED_ITEM_COUNT);
        }

        List<RawHoroscopeItem> items = new ArrayList<>();
        int index = 0;
        for (JsonNode detail : details) {
            String rank = textOrNull(detail, "ranking_no");
            String signCode = textOrNull(detail, "horoscope_st");
            String text = textOrNull(detail, "horoscope_text");
            if (rank == null || signCode == null || text == null) {
                log.warn("Skipping horoscope detail #{} with missing fields", index);
                index++;
                continue;
            }
            String sign = SIGN_CODE_TO_JP.getOrDefault(signCode, "不明な星座(" + signCode + ")");
            items.add(new RawHoroscopeItem(rank + RANK_SUFFIX, sign, text.replace('\t', ' ').strip()));
            index++;
        }

        if (items.isEmpty()) {
            throw new DailyContentException(ErrorCode.SOURCE_UNAVAILABLE,
                "Horoscope feed contained no usable entries");
        }
        if (items.size() != EXPECTED_ITEM_COUNT) {
            log.warn("Collected {} horoscope entries instead of {}", items.size(), EXPECTED_ITEM_COUNT);
        }
        return List.copyOf(items);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asString(null);
        return StringUtils.hasText(text) ? text.trim() : null;
    }

    private static String describe(Throwable ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
