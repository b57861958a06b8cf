package net.ohaasarelay;

import java.time.Clock;
import net.ohaasarelay.application.dispatch.HoroscopePublisher;
import net.ohaasarelay.application.guild.GuildScheduleRegistry;
import net.ohaasarelay.adapters.discord.DiscordChannelPublisher;
import net.ohaasarelay.scheduler.DailyPostScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Context smoke test: every collaborator wires up and the scheduler stays idle.
 */
@SpringBootTest(properties = {
    "ohaasa.guild-config-path=${java.io.tmpdir}/ohaasa-relay-context-test/guild_config.json",
    "ohaasa.scheduler.enabled=false",
    "ohaasa.scheduler.warmup-on-startup=false",
    "ohaasa.zone-id=Asia/Seoul",
    "ohaasa.dispatch.max-parallel=2"
})
class OhaasaRelayApplicationTests {

    @Autowired
    private TaskScheduler taskScheduler;

    @Autowired
    @Qualifier("dispatchExecutor")
    private ThreadPoolTaskExecutor dispatchExecutor;

    @Autowired
    private Clock clock;

    @Autowired
    private HoroscopePublisher publisher;

    @Autowired
    private GuildScheduleRegistry registry;

    @Autowired
    private DailyPostScheduler scheduler;

    @Test
    void should_WireApplicationBeans_When_ContextLoads() {
        assertThat(taskScheduler).isInstanceOf(ThreadPoolTaskScheduler.class);
        assertThat(((ThreadPoolTaskScheduler) taskScheduler).getThreadNamePrefix()).isEqualTo("AppScheduler-");
        assertThat(dispatchExecutor.getMaxPoolSize()).isEqualTo(2);
        assertThat(clock.getZone().getId()).isEqualTo("Asia/Seoul");
        assertThat(publisher).isInstanceOf(DiscordChannelPublisher.class);
        assertThat(registry.snapshot()).isNotNull();
        assertThat(scheduler).isNotNull();
    }
}
