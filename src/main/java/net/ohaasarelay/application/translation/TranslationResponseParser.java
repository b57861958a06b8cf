package net.ohaasarelay.application.translation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.ohaasarelay.domain.horoscope.RankedItem;
import net.ohaasarelay.domain.horoscope.RawHoroscopeItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Turns a {@code generateContent} response body into translated {@link RankedItem}s.
 *
 * <p>The model text lives in {@code candidates[0].content.parts[0].text}. It may be wrapped
 * in markdown fences or surrounded by prose, so the parser strips fences and falls back
 * to the outermost {@code [...]} when the first parse fails.</p>
 */
class TranslationResponseParser {

    private static final Logger log = LoggerFactory.getLogger(TranslationResponseParser.class);

    private final ObjectMapper objectMapper;

    TranslationResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses the response body and pairs each translated item with the source sign at the same position.
     *
     * @param responseBody raw HTTP body returned by the translation endpoint
     * @param sourceItems the items that were sent for translation, in order
     * @return translated items, possibly fewer than the source
     * @throws IllegalStateException if the body carries no usable JSON array
     */
    List<RankedItem> parse(String responseBody, List<RawHoroscopeItem> sourceItems) {
        String modelText = extractModelText(responseBody);
        JsonNode payload = parseJsonArray(modelText);

        List<RankedItem> items = new ArrayList<>();
        int position = 0;
        for (JsonNode element : payload) {
            if (element == null || !element.isObject()) {
                log.warn("Skipping non-object translation element at position {}", position);
                position++;
                continue;
            }
            Optional<String> rank = optionalText(element, "rank");
            Optional<String> sign = optionalText(element, "sign_ko", "sign", "signKo");
            Optional<String> description = optionalText(element, "description_ko", "description", "descriptionKo");
            if (rank.isEmpty() || sign.isEmpty() || description.isEmpty()) {
                log.warn("Skipping translation element at position {} with missing fields", position);
                position++;
                continue;
            }
            String sourceSign = position < sourceItems.size() ? sourceItems.get(position).signJp() : null;
            items.add(new RankedItem(rank.get(), sourceSign, sign.get(), description.get()));
            position++;
        }
        return List.copyOf(items);
    }

    private String extractModelText(String responseBody) {
        if (!StringUtils.hasText(responseBody)) {
            throw new IllegalStateException("Translation response was empty");
        }
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(responseBody);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Translation response envelope was not JSON", ex);
        }
        String text = envelope.path("candidates").path(0).path("content").path("parts").path(0).path("text").asString(null);
        if (!StringUtils.hasText(text)) {
            throw new IllegalStateException("Translation response carried no candidate text");
        }
        return text;
    }

    private JsonNode parseJsonArray(String modelText) {
        String cleaned = modelText.replace("```json", "").replace("```", "").trim();
        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(cleaned);
        } catch (JacksonException initialParseException) {
            int openBracket = cleaned.indexOf('[');
            int closeBracket = cleaned.lastIndexOf(']');
            if (openBracket < 0 || closeBracket <= openBracket) {
                throw new IllegalStateException("Translation text did not include a JSON array");
            }
            log.warn("Translation text required bracket extraction fallback (initial parse failed: {})",
                initialParseException.getMessage());
            try {
                parsed = objectMapper.readTree(cleaned.substring(openBracket, closeBracket + 1));
            } catch (JacksonException exception) {
                throw new IllegalStateException("Translation JSON parsing failed", exception);
            }
        }
        if (parsed == null || !parsed.isArray()) {
            throw new IllegalStateException("Translation text was JSON but not an array");
        }
        return parsed;
    }

    private Optional<String> optionalText(JsonNode payload, String field, String... aliases) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            for (String alias : aliases) {
                JsonNode aliasNode = payload.get(alias);
                if (aliasNode != null && !aliasNode.isNull()) {
                    node = aliasNode;
                    break;
                }
            }
        }
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        return Optional.ofNullable(node.asString(null))
            .filter(StringUtils::hasText)
            .map(String::trim);
    }
}
