package net.ohaasarelay.support.cache;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import net.ohaasarelay.application.pipeline.DailyHoroscopePipeline;
import net.ohaasarelay.domain.horoscope.RankedItem;
import net.ohaasarelay.exception.DailyContentException;
import net.ohaasarelay.exception.DailyContentException.ErrorCode;
import net.ohaasarelay.util.DayKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Per-guild memo of today's translated ranking.
 *
 * <p>Each guild holds at most one entry, valid only for the day it was stamped with.
 * Pipeline runs live in a separate Caffeine {@link AsyncCache} keyed by guild and day,
 * so concurrent callers join the same run and a failed run is evicted as soon as it
 * completes. Failures never reach the entry store.</p>
 */
@Component
public class DailyHoroscopeCache {

    private static final Logger log = LoggerFactory.getLogger(DailyHoroscopeCache.class);

    private static final Duration COMPLETED_RUN_RETENTION = Duration.ofMinutes(10);

    private final DailyHoroscopePipeline pipeline;
    private final Cache<Long, CacheEntry> entries;
    private final AsyncCache<RunKey, List<RankedItem>> runs;

    public DailyHoroscopeCache(DailyHoroscopePipeline pipeline) {
        this.pipeline = pipeline;
        this.entries = Caffeine.newBuilder()
            .recordStats()
            .build();
        // Pending futures do not expire; retention starts once a run completes.
        this.runs = Caffeine.newBuilder()
            .expireAfterWrite(COMPLETED_RUN_RETENTION)
            .buildAsync();
    }

    /**
     * Returns the guild's ranking for {@code day}, running the pipeline on a miss.
     *
     * <p>Cancelling the returned {@link Mono} detaches only that subscriber; a shared
     * run keeps going for everyone else.</p>
     */
    public Mono<List<RankedItem>> getOrCompute(long guildId, LocalDate day) {
        Objects.requireNonNull(day, "day");
        return Mono.defer(() -> {
            CacheEntry entry = entries.getIfPresent(guildId);
            if (entry != null && entry.day().equals(day)) {
                log.debug("Cache hit for guild {} on {}", guildId, DayKeys.format(day));
                return Mono.just(entry.items());
            }
            CompletableFuture<List<RankedItem>> run = runs.get(new RunKey(guildId, day), (key, executor) -> startRun(key));
            return Mono.fromFuture(run, true);
        });
    }

    /**
     * Returns the stored ranking only if it is stamped with {@code day}.
     */
    public Optional<List<RankedItem>> peek(long guildId, LocalDate day) {
        return Optional.ofNullable(entries.getIfPresent(guildId))
            .filter(entry -> entry.day().equals(day))
            .map(CacheEntry::items);
    }

    private CompletableFuture<List<RankedItem>> startRun(RunKey key) {
        log.info("Cache miss for guild {} on {}; running pipeline", key.guildId(), DayKeys.format(key.day()));
        return Mono.defer(() -> pipeline.produce(key.guildId()))
            .switchIfEmpty(Mono.error(() -> new DailyContentException(ErrorCode.TRANSLATION_UNAVAILABLE,
                "Pipeline completed without a result for guild " + key.guildId())))
            .<List<RankedItem>>map(List::copyOf)
            .doOnNext(items -> store(key, items))
            .doOnError(error -> log.warn("Pipeline run failed for guild {} on {}: {}",
                key.guildId(), DayKeys.format(key.day()), error.getMessage()))
            .toFuture();
    }

    private void store(RunKey key, List<RankedItem> items) {
        CacheEntry stored = entries.asMap().compute(key.guildId(), (guildId, existing) ->
            existing == null || !existing.day().isAfter(key.day()) ? new CacheEntry(key.day(), items) : existing);
        if (!stored.day().equals(key.day())) {
            log.info("Discarding late result for guild {} on {}; entry for {} is newer",
                key.guildId(), DayKeys.format(key.day()), DayKeys.format(stored.day()));
        }
    }

    /**
     * One guild's stored ranking and the day it belongs to.
     */
    record CacheEntry(LocalDate day, List<RankedItem> items) {
    }

    private record RunKey(long guildId, LocalDate day) {
    }
}
