package net.ohaasarelay.application.dispatch;

import java.util.List;
import java.util.Optional;
import net.ohaasarelay.domain.horoscope.RankedItem;
import reactor.core.publisher.Mono;

/**
 * Delivers a finished ranking to a guild's channel.
 *
 * <p>Implementations signal {@link net.ohaasarelay.exception.DailyContentException} with
 * {@code DESTINATION_UNRESOLVABLE} when the channel does not exist or cannot be written.</p>
 */
public interface HoroscopePublisher {

    /**
     * Publishes today's ranking, prefixed by {@code announcement} when present.
     */
    Mono<Void> publish(long channelId, List<RankedItem> items, Optional<String> announcement);

    /**
     * Tells the channel that today's ranking could not be produced.
     */
    Mono<Void> publishFailureNotice(long channelId, String message);
}
