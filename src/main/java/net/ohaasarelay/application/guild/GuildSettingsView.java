package net.ohaasarelay.application.guild;

import jakarta.annotation.Nullable;

/**
 * Read-only summary of a guild's settings; the API key itself is never exposed.
 *
 * @param postTime {@code HH:mm}
 * @param mention human-readable mention setting
 * @param lastPostDay last scheduled dispatch day as {@code yyyyMMdd}, null if never
 */
public record GuildSettingsView(
    long guildId,
    @Nullable Long channelId,
    String postTime,
    boolean apiKeyConfigured,
    String mention,
    @Nullable String lastPostDay
) {
}
