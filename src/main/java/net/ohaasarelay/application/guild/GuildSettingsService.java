package net.ohaasarelay.application.guild;

import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import net.ohaasarelay.application.dispatch.DispatchOutcome;
import net.ohaasarelay.application.dispatch.DispatchTrigger;
import net.ohaasarelay.application.dispatch.HoroscopeDispatcher;
import net.ohaasarelay.domain.guild.GuildSchedule;
import net.ohaasarelay.domain.guild.MentionMode;
import net.ohaasarelay.exception.DailyContentException;
import net.ohaasarelay.exception.DailyContentException.ErrorCode;
import net.ohaasarelay.util.DayKeys;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Configuration operations a guild owner can perform.
 *
 * <p>Every write goes through {@link GuildScheduleRegistry#mutate} and is persisted before
 * returning. None of them touch the day marker.</p>
 */
@Slf4j
@Service
public class GuildSettingsService {

    private final GuildScheduleRegistry registry;
    private final HoroscopeDispatcher dispatcher;

    public GuildSettingsService(GuildScheduleRegistry registry, HoroscopeDispatcher dispatcher) {
        this.registry = registry;
        this.dispatcher = dispatcher;
    }

    public GuildSchedule assignChannel(long guildId, long channelId) {
        GuildSchedule updated = registry.mutate(guildId, schedule -> schedule.withChannelId(channelId));
        log.info("Guild {} will post to channel {}", guildId, channelId);
        return updated;
    }

    /**
     * Stores the guild's Gemini key after trimming it.
     *
     * @throws IllegalArgumentException if the key is blank
     */
    public GuildSchedule assignApiKey(long guildId, String apiKey) {
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalArgumentException("API key must not be blank");
        }
        String trimmed = apiKey.trim();
        GuildSchedule updated = registry.mutate(guildId, schedule -> schedule.withGeminiApiKey(trimmed));
        log.info("Guild {} API key updated", guildId);
        return updated;
    }

    /**
     * @throws IllegalArgumentException if hour is outside 0-23 or minute outside 0-59
     */
    public GuildSchedule assignPostTime(long guildId, int hour, int minute) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be between 0 and 23");
        }
        if (minute < 0 || minute > 59) {
            throw new IllegalArgumentException("minute must be between 0 and 59");
        }
        GuildSchedule updated = registry.mutate(guildId, schedule -> schedule.withPostTime(hour, minute));
        log.info("Guild {} post time set to {}", guildId, formatTime(updated));
        return updated;
    }

    /**
     * Sets who is pinged with the daily post. {@link MentionMode#ROLE} needs a role id;
     * the other modes drop any stored role.
     */
    public GuildSchedule assignMention(long guildId, MentionMode mode, Long roleId) {
        if (mode == null) {
            throw new IllegalArgumentException("mention mode is required");
        }
        if (mode == MentionMode.ROLE && roleId == null) {
            throw new IllegalArgumentException("role mention requires a role id");
        }
        Long storedRole = mode == MentionMode.ROLE ? roleId : null;
        GuildSchedule updated = registry.mutate(guildId, schedule -> schedule.withMention(mode, storedRole));
        log.info("Guild {} mention set to {}", guildId, mode.configValue());
        return updated;
    }

    public GuildSettingsView describe(long guildId) {
        GuildSchedule schedule = registry.getOrDefault(guildId);
        return new GuildSettingsView(
            guildId,
            schedule.channelId(),
            formatTime(schedule),
            schedule.hasApiKey(),
            mentionLabel(schedule),
            schedule.lastPostDate() == null ? null : DayKeys.format(schedule.lastPostDate())
        );
    }

    /**
     * Publishes today's ranking right away, outside the schedule.
     *
     * @throws DailyContentException with {@code DESTINATION_UNRESOLVABLE} without a channel,
     *         or {@code CREDENTIAL_MISSING} without a key
     */
    public CompletableFuture<DispatchOutcome> triggerTestDispatch(long guildId) {
        GuildSchedule schedule = registry.getOrDefault(guildId);
        if (!schedule.hasChannel()) {
            throw new DailyContentException(ErrorCode.DESTINATION_UNRESOLVABLE,
                "Guild " + guildId + " has no channel configured");
        }
        if (!schedule.hasApiKey()) {
            throw new DailyContentException(ErrorCode.CREDENTIAL_MISSING,
                "Guild " + guildId + " has no Gemini API key");
        }
        log.info("Manual dispatch requested for guild {}", guildId);
        return dispatcher.submit(schedule, DispatchTrigger.MANUAL);
    }

    private static String formatTime(GuildSchedule schedule) {
        return String.format("%02d:%02d", schedule.postHour(), schedule.postMinute());
    }

    private static String mentionLabel(GuildSchedule schedule) {
        return switch (schedule.mentionMode()) {
            case EVERYONE -> "@everyone";
            case ROLE -> schedule.mentionRoleId() == null ? "역할 (미지정)" : "<@&" + schedule.mentionRoleId() + ">";
            case NONE -> "멘션 없음";
        };
    }
}
