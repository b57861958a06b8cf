package net.ohaasarelay.application.pipeline;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.ohaasarelay.application.guild.GuildScheduleRegistry;
import net.ohaasarelay.application.source.HoroscopeSourceFetcher;
import net.ohaasarelay.application.translation.GeminiTranslationClient;
import net.ohaasarelay.domain.guild.GuildSchedule;
import net.ohaasarelay.domain.horoscope.RankedItem;
import net.ohaasarelay.exception.DailyContentException;
import net.ohaasarelay.exception.DailyContentException.ErrorCode;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Produces one guild's translated ranking for today: source fetch, then translation
 * with the guild's own key.
 *
 * <p>Nothing runs until the returned {@link Mono} is subscribed. The source fetch is not
 * retried here; the translation client owns its own retries.</p>
 */
@Slf4j
@Service
public class DailyHoroscopePipeline {

    static final int EXPECTED_ITEM_COUNT = 12;

    private final GuildScheduleRegistry registry;
    private final HoroscopeSourceFetcher sourceFetcher;
    private final GeminiTranslationClient translationClient;

    public DailyHoroscopePipeline(GuildScheduleRegistry registry,
                                  HoroscopeSourceFetcher sourceFetcher,
                                  GeminiTranslationClient translationClient) {
        this.registry = registry;
        this.sourceFetcher = sourceFetcher;
        this.translationClient = translationClient;
    }

    /**
     * Runs the full pipeline for {@code guildId}.
     *
     * @return the translated ranking, or an error signal carrying {@link DailyContentException}
     */
    public Mono<List<RankedItem>> produce(long guildId) {
        return Mono.defer(() -> {
            String apiKey = registry.find(guildId)
                .filter(GuildSchedule::hasApiKey)
                .map(GuildSchedule::geminiApiKey)
                .orElse(null);
            if (apiKey == null) {
                return Mono.error(new DailyContentException(ErrorCode.CREDENTIAL_MISSING,
                    "Guild " + guildId + " has no Gemini API key"));
            }

            log.info("Producing today's horoscope for guild {}", guildId);
            return sourceFetcher.fetchToday()
                .switchIfEmpty(Mono.error(() -> new DailyContentException(ErrorCode.SOURCE_UNAVAILABLE,
                    "Horoscope source returned nothing")))
                .flatMap(rawItems -> {
                    if (rawItems.isEmpty()) {
                        return Mono.error(new DailyContentException(ErrorCode.SOURCE_UNAVAILABLE,
                            "Horoscope source returned no items"));
                    }
                    return translationClient.translate(rawItems, apiKey);
                })
                .flatMap(items -> checkCompleteness(guildId, items));
        });
    }

    private Mono<List<RankedItem>> checkCompleteness(long guildId, List<RankedItem> items) {
        if (items == null || items.isEmpty()) {
            return Mono.error(new DailyContentException(ErrorCode.TRANSLATION_UNAVAILABLE,
                "Translation produced no items for guild " + guildId));
        }
        if (items.size() < EXPECTED_ITEM_COUNT) {
            log.warn("Guild {} received {} of {} horoscope items", guildId, items.size(), EXPECTED_ITEM_COUNT);
        }
        return Mono.just(List.copyOf(items));
    }
}
