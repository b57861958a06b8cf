package net.ohaasarelay.support.cache;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import net.ohaasarelay.application.pipeline.DailyHoroscopePipeline;
import net.ohaasarelay.domain.horoscope.RankedItem;
import net.ohaasarelay.exception.DailyContentException;
import net.ohaasarelay.exception.DailyContentException.ErrorCode;
import net.ohaasarelay.testutil.HoroscopeTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DailyHoroscopeCacheTest {

    private static final long GUILD_ID = 7L;
    private static final LocalDate TODAY = LocalDate.of(2024, 5, 1);
    private static final Duration WAIT = Duration.ofSeconds(5);

    @Mock
    private DailyHoroscopePipeline pipeline;

    private DailyHoroscopeCache cache;

    @BeforeEach
    void setUp() {
        cache = new DailyHoroscopeCache(pipeline);
    }

    @Test
    void should_ServeSecondCallFromCache_When_SameGuildAndDay() {
        List<RankedItem> ranking = HoroscopeTestData.rankedItems(12);
        when(pipeline.produce(GUILD_ID)).thenReturn(Mono.just(ranking));

        List<RankedItem> first = cache.getOrCompute(GUILD_ID, TODAY).block(WAIT);
        List<RankedItem> second = cache.getOrCompute(GUILD_ID, TODAY).block(WAIT);

        assertThat(first).isEqualTo(ranking);
        assertThat(second).isEqualTo(ranking);
        verify(pipeline, times(1)).produce(GUILD_ID);
        assertThat(cache.peek(GUILD_ID, TODAY)).contains(ranking);
    }

    @Test
    void should_RunPipelineAgain_When_PreviousRunFailed() {
        AtomicInteger runs = new AtomicInteger();
        when(pipeline.produce(GUILD_ID)).thenAnswer(invocation -> runs.incrementAndGet() == 1
            ? Mono.error(new DailyContentException(ErrorCode.TRANSLATION_UNAVAILABLE, "down"))
            : Mono.just(HoroscopeTestData.rankedItems(12)));

        StepVerifier.create(cache.getOrCompute(GUILD_ID, TODAY))
            .expectErrorSatisfies(error -> assertThat(((DailyContentException) error).errorCode())
                .isEqualTo(ErrorCode.TRANSLATION_UNAVAILABLE))
            .verify(WAIT);
        assertThat(cache.peek(GUILD_ID, TODAY)).isEmpty();

        StepVerifier.create(cache.getOrCompute(GUILD_ID, TODAY))
            .assertNext(items -> assertThat(items).hasSize(12))
            .expectComplete()
            .verify(WAIT);

        verify(pipeline, times(2)).produce(GUILD_ID);
    }

    @Test
    void should_ShareOneRun_When_CallersOverlap() {
        Sinks.One<List<RankedItem>> pending = Sinks.one();
        when(pipeline.produce(GUILD_ID)).thenReturn(pending.asMono());

        Mono<List<RankedItem>> first = cache.getOrCompute(GUILD_ID, TODAY);
        Mono<List<RankedItem>> second = cache.getOrCompute(GUILD_ID, TODAY);

        StepVerifier.create(Mono.zip(first, second))
            .then(() -> pending.tryEmitValue(HoroscopeTestData.rankedItems(12)))
            .assertNext(pair -> assertThat(pair.getT1()).isSameAs(pair.getT2()))
            .expectComplete()
            .verify(WAIT);

        verify(pipeline, times(1)).produce(GUILD_ID);
    }

    @Test
    void should_FailEveryJoinedCallerThenRunFresh_When_SharedRunFails() {
        Sinks.One<List<RankedItem>> failing = Sinks.one();
        when(pipeline.produce(GUILD_ID)).thenReturn(failing.asMono(), Mono.just(HoroscopeTestData.rankedItems(12)));

        Mono<List<RankedItem>> first = cache.getOrCompute(GUILD_ID, TODAY);
        Mono<List<RankedItem>> second = cache.getOrCompute(GUILD_ID, TODAY);

        StepVerifier.create(Mono.zipDelayError(first.onErrorReturn(List.of()), second.onErrorReturn(List.of())))
            .then(() -> failing.tryEmitError(new DailyContentException(ErrorCode.SOURCE_UNAVAILABLE, "feed down")))
            .assertNext(pair -> {
                assertThat(pair.getT1()).isEmpty();
                assertThat(pair.getT2()).isEmpty();
            })
            .expectComplete()
            .verify(WAIT);

        assertThat(cache.getOrCompute(GUILD_ID, TODAY).block(WAIT)).hasSize(12);
        verify(pipeline, times(2)).produce(GUILD_ID);
    }

    @Test
    void should_KeepSharedRunAlive_When_OneCallerCancels() {
        Sinks.One<List<RankedItem>> pending = Sinks.one();
        when(pipeline.produce(GUILD_ID)).thenReturn(pending.asMono());

        Disposable cancelled = cache.getOrCompute(GUILD_ID, TODAY).subscribe();
        Mono<List<RankedItem>> survivor = cache.getOrCompute(GUILD_ID, TODAY);
        cancelled.dispose();

        StepVerifier.create(survivor)
            .then(() -> pending.tryEmitValue(HoroscopeTestData.rankedItems(12)))
            .assertNext(items -> assertThat(items).hasSize(12))
            .expectComplete()
            .verify(WAIT);

        assertThat(cache.peek(GUILD_ID, TODAY)).isPresent();
        verify(pipeline, times(1)).produce(GUILD_ID);
    }

    @Test
    void should_ReplaceEntry_When_NewDayIsRequested() {
        List<RankedItem> yesterdayRanking = HoroscopeTestData.rankedItems(12);
        List<RankedItem> todayRanking = HoroscopeTestData.rankedItems(11);
        when(pipeline.produce(GUILD_ID)).thenReturn(Mono.just(yesterdayRanking), Mono.just(todayRanking));

        cache.getOrCompute(GUILD_ID, TODAY.minusDays(1)).block(WAIT);
        List<RankedItem> result = cache.getOrCompute(GUILD_ID, TODAY).block(WAIT);

        assertThat(result).hasSize(11);
        assertThat(cache.peek(GUILD_ID, TODAY.minusDays(1))).isEmpty();
        assertThat(cache.peek(GUILD_ID, TODAY)).contains(todayRanking);
    }

    @Test
    void should_KeepNewerEntry_When_OlderDayCompletesLate() {
        Sinks.One<List<RankedItem>> yesterdayRun = Sinks.one();
        List<RankedItem> todayRanking = HoroscopeTestData.rankedItems(12);
        when(pipeline.produce(GUILD_ID)).thenReturn(yesterdayRun.asMono(), Mono.just(todayRanking));

        Mono<List<RankedItem>> late = cache.getOrCompute(GUILD_ID, TODAY.minusDays(1));
        StepVerifier.create(late)
            .then(() -> {
                cache.getOrCompute(GUILD_ID, TODAY).block(WAIT);
                yesterdayRun.tryEmitValue(HoroscopeTestData.rankedItems(3));
            })
            .assertNext(items -> assertThat(items).hasSize(3))
            .expectComplete()
            .verify(WAIT);

        assertThat(cache.peek(GUILD_ID, TODAY)).contains(todayRanking);
        assertThat(cache.peek(GUILD_ID, TODAY.minusDays(1))).isEmpty();
    }

    @Test
    void should_KeepGuildsIndependent_When_DifferentGuildsAsk() {
        when(pipeline.produce(GUILD_ID)).thenReturn(Mono.just(HoroscopeTestData.rankedItems(12)));
        when(pipeline.produce(GUILD_ID + 1)).thenReturn(Mono.just(HoroscopeTestData.rankedItems(10)));

        assertThat(cache.getOrCompute(GUILD_ID, TODAY).block(WAIT)).hasSize(12);
        assertThat(cache.getOrCompute(GUILD_ID + 1, TODAY).block(WAIT)).hasSize(10);
    }
}
