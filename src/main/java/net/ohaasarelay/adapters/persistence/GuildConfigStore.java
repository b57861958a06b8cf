package net.ohaasarelay.adapters.persistence;

import java.util.Collection;
import java.util.Map;
import net.ohaasarelay.domain.guild.GuildSchedule;

/**
 * Durable home of every guild's schedule. A save that returns normally is the commit point.
 */
public interface GuildConfigStore {

    /**
     * Loads every persisted guild schedule keyed by guild id.
     *
     * @throws net.ohaasarelay.exception.DailyContentException with {@code PERSISTENCE_FAILURE} when stored state is unreadable
     */
    Map<Long, GuildSchedule> loadAll();

    /**
     * Replaces the persisted state with the given schedules.
     *
     * @throws net.ohaasarelay.exception.DailyContentException with {@code PERSISTENCE_FAILURE} when the write fails
     */
    void saveAll(Collection<GuildSchedule> schedules);
}
