package net.ohaasarelay.domain.guild;

import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GuildScheduleTest {

    @Test
    void should_UseSafeDefaults_When_GuildIsNew() {
        GuildSchedule schedule = GuildSchedule.defaults(1L);

        assertThat(schedule.hasChannel()).isFalse();
        assertThat(schedule.hasApiKey()).isFalse();
        assertThat(schedule.postHour()).isEqualTo(8);
        assertThat(schedule.postMinute()).isZero();
        assertThat(schedule.mentionMode()).isEqualTo(MentionMode.NONE);
        assertThat(schedule.isDispatchReady()).isFalse();
    }

    @Test
    void should_MatchOnlyExactMinute_When_CheckingDueTime() {
        GuildSchedule schedule = GuildSchedule.defaults(1L).withPostTime(8, 0);

        assertThat(schedule.isDueAt(LocalDateTime.of(2024, 5, 1, 8, 0, 59))).isTrue();
        assertThat(schedule.isDueAt(LocalDateTime.of(2024, 5, 1, 8, 1))).isFalse();
        assertThat(schedule.isDueAt(LocalDateTime.of(2024, 5, 1, 20, 0))).isFalse();
    }

    @Test
    void should_TreatBlankKeyAsMissing_When_CheckingReadiness() {
        GuildSchedule schedule = GuildSchedule.defaults(1L).withChannelId(5L).withGeminiApiKey("  ");

        assertThat(schedule.isDispatchReady()).isFalse();
    }

    @Test
    void should_RejectOutOfRangeTime_When_Constructing() {
        assertThatThrownBy(() -> GuildSchedule.defaults(1L).withPostTime(24, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GuildSchedule.defaults(1L).withPostTime(0, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void should_MaskKey_When_Printed() {
        GuildSchedule schedule = GuildSchedule.defaults(1L).withGeminiApiKey("super-secret");

        assertThat(schedule.toString()).doesNotContain("super-secret").contains("****");
    }

    @Test
    void should_CompareDayMarker_When_CheckingPostedDay() {
        LocalDate day = LocalDate.of(2024, 5, 1);
        GuildSchedule schedule = GuildSchedule.defaults(1L).withLastPostDate(day);

        assertThat(schedule.wasPostedOn(day)).isTrue();
        assertThat(schedule.wasPostedOn(day.plusDays(1))).isFalse();
        assertThat(GuildSchedule.defaults(1L).wasPostedOn(day)).isFalse();
    }
}
