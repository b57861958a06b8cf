package net.ohaasarelay.application.source;

import java.util.List;
import net.ohaasarelay.domain.horoscope.RawHoroscopeItem;
import reactor.core.publisher.Mono;

/**
 * Supplies today's untranslated ranking.
 */
public interface HoroscopeSourceFetcher {

    /**
     * Fetches today's ranking in broadcast order.
     *
     * @return a non-empty list, or an error signal carrying a
     *         {@link net.ohaasarelay.exception.DailyContentException} with {@code SOURCE_UNAVAILABLE}
     */
    Mono<List<RawHoroscopeItem>> fetchToday();
}
