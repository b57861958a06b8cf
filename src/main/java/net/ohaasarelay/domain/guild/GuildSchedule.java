package net.ohaasarelay.domain.guild;

import jakarta.annotation.Nullable;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Immutable per-guild posting configuration plus the scheduled-dispatch day marker.
 *
 * <p>{@code lastPostDate} is the last day the scheduler dispatched for this guild.
 * Manual test posts never move it.</p>
 */
public record GuildSchedule(
    long guildId,
    @Nullable Long channelId,
    int postHour,
    int postMinute,
    @Nullable String geminiApiKey,
    @Nullable LocalDate lastPostDate,
    MentionMode mentionMode,
    @Nullable Long mentionRoleId
) {

    public static final int DEFAULT_POST_HOUR = 8;
    public static final int DEFAULT_POST_MINUTE = 0;

    public GuildSchedule {
        if (postHour < 0 || postHour > 23) {
            throw new IllegalArgumentException("postHour must be between 0 and 23: " + postHour);
        }
        if (postMinute < 0 || postMinute > 59) {
            throw new IllegalArgumentException("postMinute must be between 0 and 59: " + postMinute);
        }
        mentionMode = Objects.requireNonNullElse(mentionMode, MentionMode.NONE);
    }

    /**
     * Defaults for a guild seen for the first time: no channel, 08:00, no key, no mention.
     */
    public static GuildSchedule defaults(long guildId) {
        return new GuildSchedule(guildId, null, DEFAULT_POST_HOUR, DEFAULT_POST_MINUTE, null, null, MentionMode.NONE, null);
    }

    public boolean hasChannel() {
        return channelId != null;
    }

    public boolean hasApiKey() {
        return geminiApiKey != null && !geminiApiKey.isBlank();
    }

    /**
     * Whether the scheduler may consider this guild at all.
     */
    public boolean isDispatchReady() {
        return hasChannel() && hasApiKey();
    }

    public boolean wasPostedOn(LocalDate day) {
        return day.equals(lastPostDate);
    }

    /**
     * Exact hour and minute equality; the guild is due for a single minute per day.
     */
    public boolean isDueAt(LocalDateTime now) {
        return postHour == now.getHour() && postMinute == now.getMinute();
    }

    public GuildSchedule withChannelId(@Nullable Long newChannelId) {
        return new GuildSchedule(guildId, newChannelId, postHour, postMinute, geminiApiKey, lastPostDate, mentionMode, mentionRoleId);
    }

    public GuildSchedule withPostTime(int hour, int minute) {
        return new GuildSchedule(guildId, channelId, hour, minute, geminiApiKey, lastPostDate, mentionMode, mentionRoleId);
    }

    public GuildSchedule withGeminiApiKey(@Nullable String apiKey) {
        return new GuildSchedule(guildId, channelId, postHour, postMinute, apiKey, lastPostDate, mentionMode, mentionRoleId);
    }

    public GuildSchedule withLastPostDate(@Nullable LocalDate day) {
        return new GuildSchedule(guildId, channelId, postHour, postMinute, geminiApiKey, day, mentionMode, mentionRoleId);
    }

    public GuildSchedule withMention(MentionMode mode, @Nullable Long roleId) {
        return new GuildSchedule(guildId, channelId, postHour, postMinute, geminiApiKey, lastPostDate, mode, roleId);
    }

    @Override
    public String toString() {
        return "GuildSchedule[guildId=" + guildId
            + ", channelId=" + channelId
            + ", postTime=" + String.format("%02d:%02d", postHour, postMinute)
            + ", apiKey=" + (hasApiKey() ? "****" : "none")
            + ", lastPostDate=" + lastPostDate
            + ", mentionMode=" + mentionMode
            + ", mentionRoleId=" + mentionRoleId + "]";
    }
}
