package net.ohaasarelay.adapters.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import net.ohaasarelay.config.OhaasaProperties;
import net.ohaasarelay.domain.guild.GuildSchedule;
import net.ohaasarelay.domain.guild.MentionMode;
import net.ohaasarelay.exception.DailyContentException;
import net.ohaasarelay.exception.DailyContentException.ErrorCode;
import net.ohaasarelay.util.DayKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * File adapter for guild schedules, stored as one JSON object keyed by guild id.
 *
 * <p>Writes go to a sibling temp file that is then moved over the target, so a crash
 * mid-write leaves either the previous or the new document, never a torn one.</p>
 */
@Repository
public class JsonFileGuildConfigStore implements GuildConfigStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileGuildConfigStore.class);
    private static final TypeReference<LinkedHashMap<String, StoredGuildConfig>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Path configPath;

    public JsonFileGuildConfigStore(ObjectMapper objectMapper, OhaasaProperties properties) {
        this.objectMapper = objectMapper;
        this.configPath = Path.of(properties.getGuildConfigPath()).toAbsolutePath();
    }

    @Override
    public synchronized Map<Long, GuildSchedule> loadAll() {
        if (!Files.exists(configPath)) {
            log.info("Guild config {} does not exist yet; starting with no guilds", configPath);
            return Map.of();
        }

        Map<String, StoredGuildConfig> document;
        try {
            String json = Files.readString(configPath, StandardCharsets.UTF_8);
            document = json.isBlank() ? Map.of() : objectMapper.readValue(json, DOCUMENT_TYPE);
        } catch (IOException | JacksonException ex) {
            throw new DailyContentException(ErrorCode.PERSISTENCE_FAILURE,
                "Guild config " + configPath + " could not be read", ex);
        }

        Map<Long, GuildSchedule> schedules = new LinkedHashMap<>();
        for (Map.Entry<String, StoredGuildConfig> entry : document.entrySet()) {
            long guildId;
            try {
                guildId = Long.parseLong(entry.getKey().trim());
            } catch (NumberFormatException ex) {
                log.warn("Skipping guild config entry with non-numeric id '{}'", entry.getKey());
                continue;
            }
            if (entry.getValue() == null) {
                continue;
            }
            schedules.put(guildId, toSchedule(guildId, entry.getValue()));
        }
        log.info("Loaded {} guild configuration(s) from {}", schedules.size(), configPath);
        return schedules;
    }

    @Override
    public synchronized void saveAll(Collection<GuildSchedule> schedules) {
        Map<String, StoredGuildConfig> document = new LinkedHashMap<>();
        schedules.stream()
            .sorted(Comparator.comparingLong(GuildSchedule::guildId))
            .forEach(schedule -> document.put(Long.toString(schedule.guildId()), fromSchedule(schedule)));

        Path tempFile = configPath.resolveSibling(configPath.getFileName() + ".tmp");
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
            Path parent = configPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(tempFile, json, StandardCharsets.UTF_8);
            moveIntoPlace(tempFile);
        } catch (IOException | JacksonException ex) {
            throw new DailyContentException(ErrorCode.PERSISTENCE_FAILURE,
                "Guild config " + configPath + " could not be written", ex);
        }
        log.debug("Persisted {} guild configuration(s) to {}", document.size(), configPath);
    }

    private void moveIntoPlace(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, configPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            log.warn("Atomic move unsupported for {}; falling back to plain replace", configPath);
            Files.move(tempFile, configPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static GuildSchedule toSchedule(long guildId, StoredGuildConfig stored) {
        int hour = Objects.requireNonNullElse(stored.postHour(), GuildSchedule.DEFAULT_POST_HOUR);
        int minute = Objects.requireNonNullElse(stored.postMinute(), GuildSchedule.DEFAULT_POST_MINUTE);
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            log.warn("Guild {} has out-of-range post time {}:{}; using default", guildId, hour, minute);
            hour = GuildSchedule.DEFAULT_POST_HOUR;
            minute = GuildSchedule.DEFAULT_POST_MINUTE;
        }
        LocalDate lastPostDate = DayKeys.parse(stored.lastPostDate()).orElse(null);
        if (lastPostDate == null && stored.lastPostDate() != null && !stored.lastPostDate().isBlank()) {
            log.warn("Guild {} has unreadable last_post_date '{}'; treating as never posted", guildId, stored.lastPostDate());
        }
        String apiKey = stored.geminiApiKey() != null && !stored.geminiApiKey().isBlank()
            ? stored.geminiApiKey().trim()
            : null;
        return new GuildSchedule(
            guildId,
            stored.channelId(),
            hour,
            minute,
            apiKey,
            lastPostDate,
            MentionMode.fromConfigValue(stored.mentionMode()),
            stored.mentionRoleId()
        );
    }

    private static StoredGuildConfig fromSchedule(GuildSchedule schedule) {
        return new StoredGuildConfig(
            schedule.channelId(),
            schedule.postHour(),
            schedule.postMinute(),
            schedule.hasApiKey() ? schedule.geminiApiKey() : "",
            schedule.lastPostDate() != null ? DayKeys.format(schedule.lastPostDate()) : null,
            schedule.mentionMode().configValue(),
            schedule.mentionRoleId()
        );
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoredGuildConfig(
        @JsonProperty("channel_id") Long channelId,
        @JsonProperty("post_hour") Integer postHour,
        @JsonProperty("post_minute") Integer postMinute,
        @JsonProperty("gemini_api_key") String geminiApiKey,
        @JsonProperty("last_post_date") String lastPostDate,
        @JsonProperty("mention_mode") String mentionMode,
        @JsonProperty("mention_role_id") Long mentionRoleId
    ) {
    }
}
