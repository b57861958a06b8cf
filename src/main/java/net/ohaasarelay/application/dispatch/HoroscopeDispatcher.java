package net.ohaasarelay.application.dispatch;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import net.ohaasarelay.config.OhaasaProperties;
import net.ohaasarelay.domain.guild.GuildSchedule;
import net.ohaasarelay.domain.horoscope.RankedItem;
import net.ohaasarelay.exception.DailyContentException;
import net.ohaasarelay.exception.DailyContentException.ErrorCode;
import net.ohaasarelay.support.cache.DailyHoroscopeCache;
import net.ohaasarelay.util.DayKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one guild's fetch-and-publish on the bounded dispatch executor.
 *
 * <p>Scheduled and manual dispatches take the same path. The day marker is the
 * scheduler's concern and is never read or written here.</p>
 */
@Service
public class HoroscopeDispatcher {

    private static final Logger log = LoggerFactory.getLogger(HoroscopeDispatcher.class);

    static final String EVERYONE_ANNOUNCEMENT = "@everyone";
    static final String FAILURE_NOTICE_PREFIX = "❌ 오늘자 운세 데이터를 불러오지 못했습니다. ";

    private final DailyHoroscopeCache cache;
    private final HoroscopePublisher publisher;
    private final Clock clock;
    private final Executor dispatchExecutor;
    private final MeterRegistry meterRegistry;
    private final Duration contentTimeout;

    public HoroscopeDispatcher(DailyHoroscopeCache cache,
                               HoroscopePublisher publisher,
                               Clock clock,
                               @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                               OhaasaProperties properties,
                               MeterRegistry meterRegistry) {
        this.cache = cache;
        this.publisher = publisher;
        this.clock = clock;
        this.dispatchExecutor = dispatchExecutor;
        this.meterRegistry = meterRegistry;
        this.contentTimeout = properties.getDispatch().getContentTimeout();
    }

    /**
     * Queues a dispatch for today's ranking, as seen by the configured clock.
     */
    public CompletableFuture<DispatchOutcome> submit(GuildSchedule schedule, DispatchTrigger trigger) {
        return submit(schedule, trigger, LocalDate.now(clock));
    }

    /**
     * Queues a dispatch for {@code day} and returns immediately.
     *
     * <p>The future never completes exceptionally. A full queue resolves at once to a
     * {@link DispatchOutcome.Status#REJECTED rejected} outcome; an unexpected error
     * resolves to a failed one.</p>
     */
    public CompletableFuture<DispatchOutcome> submit(GuildSchedule schedule, DispatchTrigger trigger, LocalDate day) {
        long guildId = schedule.guildId();
        try {
            return CompletableFuture.supplyAsync(() -> dispatch(schedule, trigger, day), dispatchExecutor)
                .exceptionally(ex -> {
                    log.error("Dispatch for guild {} ({}) failed unexpectedly", guildId, trigger, ex);
                    return record(DispatchOutcome.failed(guildId, trigger, null, describe(ex)));
                });
        } catch (RejectedExecutionException ex) {
            log.warn("Dispatch queue is full; rejecting {} dispatch for guild {}", trigger, guildId);
            return CompletableFuture.completedFuture(
                record(DispatchOutcome.rejected(guildId, trigger, "Dispatch queue is full")));
        }
    }

    public DispatchOutcome dispatch(GuildSchedule schedule, DispatchTrigger trigger) {
        return dispatch(schedule, trigger, LocalDate.now(clock));
    }

    /**
     * Dispatch body; blocks the calling worker until the ranking for {@code day} is
     * published or has failed.
     */
    public DispatchOutcome dispatch(GuildSchedule schedule, DispatchTrigger trigger, LocalDate day) {
        long guildId = schedule.guildId();
        if (!schedule.hasChannel()) {
            log.warn("Guild {} has no channel; nothing to publish to", guildId);
            return record(DispatchOutcome.failed(guildId, trigger, ErrorCode.DESTINATION_UNRESOLVABLE,
                "No channel configured"));
        }
        long channelId = schedule.channelId();
        Optional<String> announcement = announcementFor(schedule);
        log.info("Dispatching horoscope for guild {} to channel {} ({}, {})",
            guildId, channelId, trigger, DayKeys.format(day));

        List<RankedItem> items;
        try {
            items = cache.getOrCompute(guildId, day).block(contentTimeout);
        } catch (DailyContentException ex) {
            log.error("Guild {} has no content for today [{}]: {}", guildId, ex.errorCode(), ex.getMessage());
            sendFailureNotice(guildId, channelId, ex.userFacingReason());
            return record(DispatchOutcome.failed(guildId, trigger, ex.errorCode(), ex.getMessage()));
        } catch (RuntimeException ex) {
            log.error("Guild {} content retrieval failed: {}", guildId, describe(ex));
            sendFailureNotice(guildId, channelId, "잠시 후 다시 시도해 주세요.");
            return record(DispatchOutcome.failed(guildId, trigger, null, describe(ex)));
        }
        if (items == null || items.isEmpty()) {
            sendFailureNotice(guildId, channelId, "번역 결과가 비어 있습니다.");
            return record(DispatchOutcome.failed(guildId, trigger, ErrorCode.TRANSLATION_UNAVAILABLE,
                "No items for today"));
        }

        try {
            publisher.publish(channelId, items, announcement).block(contentTimeout);
        } catch (DailyContentException ex) {
            log.error("Publishing to channel {} of guild {} failed [{}]: {}",
                channelId, guildId, ex.errorCode(), ex.getMessage());
            if (ex.errorCode() != ErrorCode.DESTINATION_UNRESOLVABLE) {
                sendFailureNotice(guildId, channelId, ex.userFacingReason());
            }
            return record(DispatchOutcome.failed(guildId, trigger, ex.errorCode(), ex.getMessage()));
        } catch (RuntimeException ex) {
            log.error("Publishing to channel {} of guild {} failed: {}", channelId, guildId, describe(ex));
            sendFailureNotice(guildId, channelId, "게시 중 오류가 발생했습니다.");
            return record(DispatchOutcome.failed(guildId, trigger, null, describe(ex)));
        }

        log.info("Published {} horoscope item(s) for guild {}", items.size(), guildId);
        return record(DispatchOutcome.published(guildId, trigger));
    }

    /**
     * Resolves the mention text that opens the post.
     */
    public static Optional<String> announcementFor(GuildSchedule schedule) {
        return switch (schedule.mentionMode()) {
            case EVERYONE -> Optional.of(EVERYONE_ANNOUNCEMENT);
            case ROLE -> Optional.ofNullable(schedule.mentionRoleId()).map(roleId -> "<@&" + roleId + ">");
            case NONE -> Optional.empty();
        };
    }

    private void sendFailureNotice(long guildId, long channelId, String reason) {
        try {
            publisher.publishFailureNotice(channelId, FAILURE_NOTICE_PREFIX + "(" + reason + ")").block(contentTimeout);
        } catch (RuntimeException ex) {
            log.warn("Failure notice for guild {} could not be delivered to channel {}: {}",
                guildId, channelId, describe(ex));
        }
    }

    private DispatchOutcome record(DispatchOutcome outcome) {
        meterRegistry.counter("ohaasa.dispatch",
            "outcome", outcome.status().name().toLowerCase(Locale.ROOT),
            "trigger", outcome.trigger().name().toLowerCase(Locale.ROOT)).increment();
        return outcome;
    }

    private static String describe(Throwable ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
