package net.ohaasarelay.domain.horoscope;

import jakarta.annotation.Nullable;

/**
 * One translated ranking entry handed to the publisher.
 *
 * <p>{@code sourceSign} is the untranslated sign at the same position in the feed and is
 * null when the translation returned more entries than the feed had.</p>
 */
public record RankedItem(
    String rank,
    @Nullable String sourceSign,
    String sign,
    String description
) {
}
