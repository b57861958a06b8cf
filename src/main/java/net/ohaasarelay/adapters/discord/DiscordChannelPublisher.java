package net.ohaasarelay.adapters.discord;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.ohaasarelay.application.dispatch.HoroscopePublisher;
import net.ohaasarelay.config.OhaasaProperties;
import net.ohaasarelay.domain.horoscope.RankedItem;
import net.ohaasarelay.exception.DailyContentException;
import net.ohaasarelay.exception.DailyContentException.ErrorCode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Posts the daily ranking through the Discord REST API.
 *
 * <p>The summary embed lists ranks 1-6 and 7-12 side by side. Detailed fortunes follow in
 * a thread opened on the summary message, or in the channel itself when the thread cannot
 * be created.</p>
 */
@Slf4j
@Component
public class DiscordChannelPublisher implements HoroscopePublisher {

    static final int MESSAGE_CONTENT_LIMIT = 2000;
    static final int EMBED_FIELD_LIMIT = 1024;
    static final int EMBED_COLOR = 0x4E72B7;
    static final int THREAD_AUTO_ARCHIVE_MINUTES = 60;
    private static final int TOP_HALF_SIZE = 6;
    private static final String EMPTY_FIELD = "데이터 없음";
    private static final DateTimeFormatter TITLE_DATE = DateTimeFormatter.ofPattern("yyyy년 MM월 dd일");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String botToken;
    private final String sourcePageUrl;
    private final Duration requestTimeout;

    public DiscordChannelPublisher(WebClient.Builder webClientBuilder,
                                   ObjectMapper objectMapper,
                                   Clock clock,
                                   OhaasaProperties properties) {
        this.webClient = webClientBuilder.clone().baseUrl(properties.getDiscord().getApiBaseUrl()).build();
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.botToken = properties.getDiscord().getBotToken();
        this.sourcePageUrl = properties.getSource().getPageUrl();
        this.requestTimeout = properties.getDiscord().getRequestTimeout();
    }

    @Override
    public Mono<Void> publish(long channelId, List<RankedItem> items, Optional<String> announcement) {
        if (!StringUtils.hasText(botToken)) {
            return Mono.error(missingToken());
        }
        String dateLabel = LocalDate.now(clock).format(TITLE_DATE);
        List<RankedItem> topHalf = items.subList(0, Math.min(TOP_HALF_SIZE, items.size()));
        List<RankedItem> bottomHalf = items.size() > TOP_HALF_SIZE ? items.subList(TOP_HALF_SIZE, items.size()) : List.of();

        return postMessage(channelId, summaryMessage(dateLabel, topHalf, bottomHalf, announcement))
            .flatMap(messageId -> openDetailThread(channelId, messageId, dateLabel))
            .flatMap(targetId -> postMessage(targetId, plainMessage(details("**🥇 1위 ~ 6위 상세 운세**\n", topHalf)))
                .then(postMessage(targetId, plainMessage(details("**⬇️ 7위 ~ 12위 상세 운세**\n", bottomHalf)))))
            .doOnSuccess(ignored -> log.info("Posted daily horoscope to channel {}", channelId))
            .then();
    }

    @Override
    public Mono<Void> publishFailureNotice(long channelId, String message) {
        if (!StringUtils.hasText(botToken)) {
            return Mono.error(missingToken());
        }
        return postMessage(channelId, plainMessage(message)).then();
    }

    private Mono<Long> openDetailThread(long channelId, long messageId, String dateLabel) {
        Map<String, Object> body = Map.of(
            "name", dateLabel + " 별자리 운세 상세 내용",
            "auto_archive_duration", THREAD_AUTO_ARCHIVE_MINUTES
        );
        return exchange("/channels/{channelId}/messages/{messageId}/threads", body, channelId, messageId)
            .onErrorResume(ex -> {
                log.warn("Thread creation on channel {} failed ({}); posting details to the channel", channelId, ex.getMessage());
                return Mono.just(channelId);
            });
    }

    private Mono<Long> postMessage(long channelId, Map<String, Object> body) {
        return exchange("/channels/{channelId}/messages", body, channelId);
    }

    private Mono<Long> exchange(String path, Map<String, Object> body, Object... uriVariables) {
        return webClient.post()
            .uri(path, uriVariables)
            .header(HttpHeaders.AUTHORIZATION, "Bot " + botToken)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .exchangeToMono(this::readCreatedId)
            .timeout(requestTimeout);
    }

    private Mono<Long> readCreatedId(ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        if (status.is2xxSuccessful()) {
            return response.bodyToMono(String.class).map(this::idOf);
        }
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .flatMap(errorBody -> {
                if (status.value() == HttpStatus.NOT_FOUND.value() || status.value() == HttpStatus.FORBIDDEN.value()) {
                    return Mono.error(new DailyContentException(ErrorCode.DESTINATION_UNRESOLVABLE,
                        "Discord rejected the channel (status " + status.value() + ")"));
                }
                return Mono.error(new IllegalStateException("Discord API returned status " + status.value()));
            });
    }

    private long idOf(String responseBody) {
        try {
            String id = objectMapper.readTree(responseBody).path("id").asString(null);
            if (!StringUtils.hasText(id)) {
                throw new IllegalStateException("Discord response carried no id");
            }
            return Long.parseLong(id);
        } catch (JacksonException | NumberFormatException ex) {
            throw new IllegalStateException("Discord response could not be read", ex);
        }
    }

    private Map<String, Object> summaryMessage(String dateLabel,
                                               List<RankedItem> topHalf,
                                               List<RankedItem> bottomHalf,
                                               Optional<String> announcement) {
        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title", "📅 " + dateLabel + " 오늘의 오하아사 별자리 랭킹");
        embed.put("description", "[원문 출처: 아사히 방송 오하아사](<" + sourcePageUrl + ">)");
        embed.put("color", EMBED_COLOR);
        embed.put("fields", List.of(
            field("🥇 상위 랭킹 (1위 ~ 6위)", rankingLines(topHalf)),
            field("⬇️ 하위 랭킹 (7위 ~ 12위)", rankingLines(bottomHalf))
        ));

        Map<String, Object> message = new LinkedHashMap<>();
        announcement.ifPresent(text -> message.put("content", clip(text, MESSAGE_CONTENT_LIMIT)));
        message.put("embeds", List.of(embed));
        message.put("allowed_mentions", Map.of("parse", announcement.isPresent() ? List.of("everyone", "roles") : List.of()));
        return message;
    }

    private static Map<String, Object> field(String name, String lines) {
        String value = StringUtils.hasText(lines) ? clip(lines, EMBED_FIELD_LIMIT) : EMPTY_FIELD;
        return Map.of("name", name, "value", value, "inline", true);
    }

    private static String rankingLines(List<RankedItem> items) {
        StringBuilder lines = new StringBuilder();
        for (RankedItem item : items) {
            if (lines.length() > 0) {
                lines.append('\n');
            }
            lines.append("**").append(item.rank()).append("** - ").append(item.sign());
        }
        return lines.toString();
    }

    static String details(String header, List<RankedItem> items) {
        StringBuilder text = new StringBuilder(header);
        for (RankedItem item : items) {
            text.append("\n**").append(item.rank()).append(' ').append(item.sign()).append("**\n")
                .append("> ").append(item.description()).append('\n');
        }
        return text.toString();
    }

    private static Map<String, Object> plainMessage(String content) {
        return Map.of(
            "content", clip(content, MESSAGE_CONTENT_LIMIT),
            "allowed_mentions", Map.of("parse", List.of())
        );
    }

    static String clip(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }
        int end = limit - 1;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end) + "…";
    }

    private static DailyContentException missingToken() {
        return new DailyContentException(ErrorCode.DESTINATION_UNRESOLVABLE, "Discord bot token is not configured");
    }
}
