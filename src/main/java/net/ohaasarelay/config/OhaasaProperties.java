package net.ohaasarelay.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Strongly typed configuration for the daily horoscope relay.
 */
@Component
@ConfigurationProperties(prefix = "ohaasa")
public class OhaasaProperties {

    /**
     * Zone used for the day key and for comparing guild post times. Blank means the JVM default zone.
     */
    private String zoneId = "";

    /**
     * Location of the persisted guild configuration document.
     */
    private String guildConfigPath = "guild_config.json";

    private final Scheduler scheduler = new Scheduler();
    private final Dispatch dispatch = new Dispatch();
    private final Source source = new Source();
    private final Translation translation = new Translation();
    private final Discord discord = new Discord();

    @PostConstruct
    void validate() {
        Assert.hasText(guildConfigPath, "ohaasa.guild-config-path must not be blank");
        Assert.isTrue(scheduler.getTickInterval().toMillis() > 0, "ohaasa.scheduler.tick-interval must be positive");
        Assert.isTrue(dispatch.getMaxParallel() > 0, "ohaasa.dispatch.max-parallel must be positive");
        Assert.isTrue(dispatch.getQueueCapacity() >= 0, "ohaasa.dispatch.queue-capacity must be non-negative");
        Assert.isTrue(dispatch.getContentTimeout().toMillis() > 0, "ohaasa.dispatch.content-timeout must be positive");
        Assert.isTrue(translation.getMaxAttempts() >= 1, "ohaasa.translation.max-attempts must be at least 1");
        Assert.isTrue(!translation.getBackoffStep().isNegative(), "ohaasa.translation.backoff-step must be non-negative");
        Assert.isTrue(source.getRequestsPerMinute() > 0, "ohaasa.source.requests-per-minute must be positive");
        resolveZone();
    }

    /**
     * Resolves the configured zone, falling back to the JVM default.
     */
    public ZoneId resolveZone() {
        return StringUtils.hasText(zoneId) ? ZoneId.of(zoneId.trim()) : ZoneId.systemDefault();
    }

    public String getZoneId() {
        return zoneId;
    }

    public void setZoneId(String zoneId) {
        this.zoneId = zoneId;
    }

    public String getGuildConfigPath() {
        return guildConfigPath;
    }

    public void setGuildConfigPath(String guildConfigPath) {
        this.guildConfigPath = guildConfigPath;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public Source getSource() {
        return source;
    }

    public Translation getTranslation() {
        return translation;
    }

    public Discord getDiscord() {
        return discord;
    }

    public static class Scheduler {

        /**
         * Whether the daily post tick evaluates guilds at all.
         */
        private boolean enabled = true;

        /**
         * Delay between two scheduler ticks.
         */
        private Duration tickInterval = Duration.ofSeconds(30);

        /**
         * Whether today's content is computed for every configured guild once the application is ready.
         */
        private boolean warmupOnStartup = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public boolean isWarmupOnStartup() {
            return warmupOnStartup;
        }

        public void setWarmupOnStartup(boolean warmupOnStartup) {
            this.warmupOnStartup = warmupOnStartup;
        }
    }

    public static class Dispatch {

        /**
         * Number of guild dispatches that may run at the same time.
         */
        private int maxParallel = 4;

        /**
         * Dispatches waiting for a worker before new submissions are rejected.
         */
        private int queueCapacity = 100;

        /**
         * Upper bound a dispatch waits for today's content (fetch, translation and retries).
         */
        private Duration contentTimeout = Duration.ofMinutes(3);

        public int getMaxParallel() {
            return maxParallel;
        }

        public void setMaxParallel(int maxParallel) {
            this.maxParallel = maxParallel;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public Duration getContentTimeout() {
            return contentTimeout;
        }

        public void setContentTimeout(Duration contentTimeout) {
            this.contentTimeout = contentTimeout;
        }
    }

    public static class Source {

        /**
         * Asahi JSON feed with today's ranking.
         */
        private String url = "https://www.asahi.co.jp/data/ohaasa2020/horoscope.json";

        /**
         * Public ranking page, sent as Referer and linked from published posts.
         */
        private String pageUrl = "https://www.asahi.co.jp/ohaasa/week/horoscope/";

        private Duration timeout = Duration.ofSeconds(15);

        /**
         * Shared budget for feed requests; every guild's cache miss hits the same feed.
         */
        private int requestsPerMinute = 30;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getPageUrl() {
            return pageUrl;
        }

        public void setPageUrl(String pageUrl) {
            this.pageUrl = pageUrl;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getRequestsPerMinute() {
            return requestsPerMinute;
        }

        public void setRequestsPerMinute(int requestsPerMinute) {
            this.requestsPerMinute = requestsPerMinute;
        }
    }

    public static class Translation {

        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";

        private String model = "gemini-2.5-flash-preview-09-2025";

        /**
         * Total attempts per translation, the first call included.
         */
        private int maxAttempts = 3;

        /**
         * Retry n waits n times this step.
         */
        private Duration backoffStep = Duration.ofSeconds(1);

        private Duration requestTimeout = Duration.ofSeconds(60);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBackoffStep() {
            return backoffStep;
        }

        public void setBackoffStep(Duration backoffStep) {
            this.backoffStep = backoffStep;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class Discord {

        private String apiBaseUrl = "https://discord.com/api/v10";

        /**
         * Bot token; publishing is disabled while blank.
         */
        private String botToken = "";

        private Duration requestTimeout = Duration.ofSeconds(15);

        public String getApiBaseUrl() {
            return apiBaseUrl;
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
        }

        public String getBotToken() {
            return botToken;
        }

        public void setBotToken(String botToken) {
            this.botToken = botToken;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }
}
