package net.ohaasarelay.application.guild;

import jakarta.annotation.PostConstruct;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import net.ohaasarelay.adapters.persistence.GuildConfigStore;
import net.ohaasarelay.domain.guild.GuildSchedule;
import net.ohaasarelay.exception.DailyContentException;
import net.ohaasarelay.exception.DailyContentException.ErrorCode;
import net.ohaasarelay.util.DayKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * In-memory view of every guild's schedule, kept in step with the {@link GuildConfigStore}.
 *
 * <p>A mutation is committed only once the store accepted the full snapshot. When the
 * save fails the previous in-memory value is restored and a {@code PERSISTENCE_FAILURE}
 * is thrown, so memory never runs ahead of disk.</p>
 */
@Service
public class GuildScheduleRegistry {

    private static final Logger log = LoggerFactory.getLogger(GuildScheduleRegistry.class);

    private final GuildConfigStore store;
    private final Object lock = new Object();
    private final Map<Long, GuildSchedule> schedules = new HashMap<>();

    public GuildScheduleRegistry(GuildConfigStore store) {
        this.store = store;
    }

    /**
     * Replaces the in-memory view with everything the store holds.
     */
    @PostConstruct
    public void loadAll() {
        Map<Long, GuildSchedule> loaded = store.loadAll();
        synchronized (lock) {
            schedules.clear();
            schedules.putAll(loaded);
        }
        log.info("Guild schedule registry holds {} guild(s)", loaded.size());
    }

    public Optional<GuildSchedule> find(long guildId) {
        synchronized (lock) {
            return Optional.ofNullable(schedules.get(guildId));
        }
    }

    /**
     * Returns the guild's schedule, or unsaved defaults when the guild was never configured.
     */
    public GuildSchedule getOrDefault(long guildId) {
        synchronized (lock) {
            return schedules.getOrDefault(guildId, GuildSchedule.defaults(guildId));
        }
    }

    /**
     * Returns the guild's schedule, creating and persisting defaults on first sight.
     */
    public GuildSchedule getOrCreateDefault(long guildId) {
        synchronized (lock) {
            GuildSchedule existing = schedules.get(guildId);
            if (existing != null) {
                return existing;
            }
            return commit(guildId, null, GuildSchedule.defaults(guildId));
        }
    }

    /**
     * Point-in-time copy of all schedules; safe to iterate while others mutate.
     */
    public List<GuildSchedule> snapshot() {
        synchronized (lock) {
            return List.copyOf(schedules.values());
        }
    }

    /**
     * Applies {@code mutation} to the guild's schedule (defaults when absent) and persists it.
     *
     * @return the committed schedule
     * @throws DailyContentException with {@code PERSISTENCE_FAILURE} when the store rejects the write
     */
    public GuildSchedule mutate(long guildId, UnaryOperator<GuildSchedule> mutation) {
        Objects.requireNonNull(mutation, "mutation");
        synchronized (lock) {
            GuildSchedule previous = schedules.get(guildId);
            GuildSchedule base = previous != null ? previous : GuildSchedule.defaults(guildId);
            GuildSchedule next = Objects.requireNonNull(mutation.apply(base), "mutation returned null");
            if (next.guildId() != guildId) {
                throw new IllegalArgumentException("mutation must not change the guild id");
            }
            return commit(guildId, previous, next);
        }
    }

    /**
     * Sets the day marker unless it already equals {@code day}, persisting before returning.
     *
     * @return the marked schedule, or empty when another trigger already marked this day
     * @throws DailyContentException with {@code PERSISTENCE_FAILURE} when the marker could not be persisted
     */
    public Optional<GuildSchedule> markDispatched(long guildId, LocalDate day) {
        synchronized (lock) {
            GuildSchedule previous = schedules.get(guildId);
            if (previous == null) {
                return Optional.empty();
            }
            if (previous.wasPostedOn(day)) {
                return Optional.empty();
            }
            GuildSchedule marked = commit(guildId, previous, previous.withLastPostDate(day));
            log.debug("Guild {} marked as dispatched for {}", guildId, DayKeys.format(day));
            return Optional.of(marked);
        }
    }

    private GuildSchedule commit(long guildId, GuildSchedule previous, GuildSchedule next) {
        schedules.put(guildId, next);
        try {
            store.saveAll(List.copyOf(schedules.values()));
            return next;
        } catch (RuntimeException ex) {
            if (previous != null) {
                schedules.put(guildId, previous);
            } else {
                schedules.remove(guildId);
            }
            if (ex instanceof DailyContentException dailyContentException
                    && dailyContentException.errorCode() == ErrorCode.PERSISTENCE_FAILURE) {
                throw dailyContentException;
            }
            throw new DailyContentException(ErrorCode.PERSISTENCE_FAILURE,
                "Guild " + guildId + " schedule could not be persisted", ex);
        }
    }
}
