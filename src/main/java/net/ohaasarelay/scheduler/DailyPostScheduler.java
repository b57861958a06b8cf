package net.ohaasarelay.scheduler;

import jakarta.annotation.Nullable;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.ohaasarelay.application.dispatch.DispatchOutcome;
import net.ohaasarelay.application.dispatch.DispatchTrigger;
import net.ohaasarelay.application.dispatch.HoroscopeDispatcher;
import net.ohaasarelay.application.guild.GuildScheduleRegistry;
import net.ohaasarelay.config.OhaasaProperties;
import net.ohaasarelay.domain.guild.GuildSchedule;
import net.ohaasarelay.exception.DailyContentException;
import net.ohaasarelay.util.DayKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic tick that starts each guild's scheduled post at most once per day.
 *
 * <p>A guild is dispatched when it has a channel and a key, has not been marked for
 * today, and its post time equals the current hour and minute. The day marker is
 * persisted before the dispatch is queued; if that write fails, or the dispatch queue
 * refuses the task, the guild is skipped and a later tick in the same minute may try
 * again.</p>
 */
@Component
public class DailyPostScheduler {

    private static final Logger log = LoggerFactory.getLogger(DailyPostScheduler.class);

    private final GuildScheduleRegistry registry;
    private final HoroscopeDispatcher dispatcher;
    private final Clock clock;
    private final boolean schedulerEnabled;

    public DailyPostScheduler(GuildScheduleRegistry registry,
                              HoroscopeDispatcher dispatcher,
                              Clock clock,
                              OhaasaProperties properties) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.schedulerEnabled = properties.getScheduler().isEnabled();
    }

    @Scheduled(fixedDelayString = "${ohaasa.scheduler.tick-interval:PT30S}",
               initialDelayString = "${ohaasa.scheduler.tick-interval:PT30S}")
    public void tick() {
        if (!schedulerEnabled) {
            log.debug("Daily post scheduler is disabled via configuration.");
            return;
        }
        TickSummary summary = evaluate(LocalDateTime.now(clock));
        if (!summary.dispatched().isEmpty() || !summary.failures().isEmpty()) {
            log.info("Daily post tick finished (dispatched={}, failures={})",
                summary.dispatched().size(), summary.failures().size());
        }
    }

    /**
     * Evaluates every registered guild against {@code now}.
     */
    public TickSummary evaluate(LocalDateTime now) {
        LocalDate today = now.toLocalDate();
        List<Long> dispatched = new ArrayList<>();
        List<String> failures = new ArrayList<>();

        for (GuildSchedule schedule : registry.snapshot()) {
            long guildId = schedule.guildId();
            try {
                if (!schedule.isDispatchReady() || schedule.wasPostedOn(today) || !schedule.isDueAt(now)) {
                    continue;
                }
                Optional<GuildSchedule> marked = registry.markDispatched(guildId, today);
                if (marked.isEmpty()) {
                    log.debug("Guild {} was already marked for {}", guildId, DayKeys.format(today));
                    continue;
                }
                DispatchOutcome queued = dispatcher.submit(marked.get(), DispatchTrigger.SCHEDULED, today).getNow(null);
                if (queued != null && queued.isRejected()) {
                    releaseMarker(guildId, today, schedule.lastPostDate());
                    failures.add(guildId + ": " + queued.detail());
                    continue;
                }
                dispatched.add(guildId);
                log.info("Queued scheduled post for guild {} at {}", guildId, now.toLocalTime().withSecond(0).withNano(0));
            } catch (DailyContentException exception) {
                log.error("Scheduled post for guild {} skipped [{}]: {}",
                    guildId, exception.errorCode(), exception.getMessage());
                failures.add(guildId + ": " + exception.errorCode());
            } catch (RuntimeException exception) {
                log.error("Scheduled post evaluation failed for guild {}", guildId, exception);
                failures.add(guildId + ": " + resolveFailureMessage(exception));
            }
        }
        return new TickSummary(List.copyOf(dispatched), List.copyOf(failures));
    }

    private void releaseMarker(long guildId, LocalDate today, @Nullable LocalDate previous) {
        registry.mutate(guildId, current -> current.wasPostedOn(today) ? current.withLastPostDate(previous) : current);
        log.warn("Dispatch queue refused guild {}; day marker for {} released for the next tick",
            guildId, DayKeys.format(today));
    }

    private static String resolveFailureMessage(RuntimeException exception) {
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName();
    }

    /**
     * Guilds queued by one tick and the per-guild failures it logged.
     */
    public record TickSummary(List<Long> dispatched, List<String> failures) {
    }
}
