package net.ohaasarelay.scheduler;

import java.time.Clock;
import java.time.LocalDate;
import net.ohaasarelay.application.guild.GuildScheduleRegistry;
import net.ohaasarelay.config.OhaasaProperties;
import net.ohaasarelay.domain.guild.GuildSchedule;
import net.ohaasarelay.support.cache.DailyHoroscopeCache;
import net.ohaasarelay.util.DayKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Fills today's cache entry for every guild with a key once the application is ready,
 * so the first scheduled post does not wait on the feed and the translation endpoint.
 */
@Component
public class HoroscopeCacheWarmupRunner {

    private static final Logger log = LoggerFactory.getLogger(HoroscopeCacheWarmupRunner.class);

    private final GuildScheduleRegistry registry;
    private final DailyHoroscopeCache cache;
    private final Clock clock;
    private final boolean warmupEnabled;

    public HoroscopeCacheWarmupRunner(GuildScheduleRegistry registry,
                                      DailyHoroscopeCache cache,
                                      Clock clock,
                                      OhaasaProperties properties) {
        this.registry = registry;
        this.cache = cache;
        this.clock = clock;
        this.warmupEnabled = properties.getScheduler().isWarmupOnStartup();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmOnStartup() {
        if (!warmupEnabled) {
            log.info("Horoscope cache warm-up is disabled via configuration.");
            return;
        }
        warm();
    }

    /**
     * Starts a background computation per guild with a key.
     *
     * @return number of guilds whose computation was started
     */
    public int warm() {
        LocalDate today = LocalDate.now(clock);
        int started = 0;
        for (GuildSchedule schedule : registry.snapshot()) {
            if (!schedule.hasApiKey()) {
                continue;
            }
            long guildId = schedule.guildId();
            cache.getOrCompute(guildId, today).subscribe(
                items -> log.info("Warmed {} horoscope item(s) for guild {} on {}", items.size(), guildId, DayKeys.format(today)),
                error -> log.warn("Cache warm-up failed for guild {}: {}", guildId, error.getMessage()));
            started++;
        }
        log.info("Horoscope cache warm-up started for {} guild(s)", started);
        return started;
    }
}
