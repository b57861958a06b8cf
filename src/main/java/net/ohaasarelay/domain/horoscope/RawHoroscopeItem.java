package net.ohaasarelay.domain.horoscope;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One untranslated ranking entry as published by the broadcaster.
 *
 * @param rank ordinal label such as {@code 1位}
 * @param signJp Japanese zodiac sign name
 * @param descriptionJp Japanese fortune text
 */
public record RawHoroscopeItem(
    @JsonProperty("rank") String rank,
    @JsonProperty("sign_jp") String signJp,
    @JsonProperty("description_jp") String descriptionJp
) {
}
