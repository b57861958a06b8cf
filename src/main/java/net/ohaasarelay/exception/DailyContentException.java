package net.ohaasarelay.exception;

import java.util.Objects;

/**
 * Thrown (or signalled through a {@code Mono}) when a guild's daily content cannot be
 * produced, persisted or delivered.
 *
 * <p>Every failure path of the fetch, translate, cache and publish chain resolves to
 * this type so callers branch on {@link #errorCode()} rather than on raw client
 * exceptions.</p>
 */
public class DailyContentException extends RuntimeException {

    /**
     * Canonical failure categories of the daily pipeline.
     */
    public enum ErrorCode {
        CREDENTIAL_MISSING,
        SOURCE_UNAVAILABLE,
        TRANSLATION_UNAVAILABLE,
        DESTINATION_UNRESOLVABLE,
        PERSISTENCE_FAILURE
    }

    private final ErrorCode errorCode;

    public DailyContentException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public DailyContentException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    /**
     * Returns the canonical classification for this failure.
     */
    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Short reason suitable for a channel notice; never includes secrets.
     */
    public String userFacingReason() {
        return switch (errorCode) {
            case CREDENTIAL_MISSING -> "Gemini API 키가 설정되어 있지 않습니다.";
            case SOURCE_UNAVAILABLE -> "운세 원본 데이터를 불러오지 못했습니다.";
            case TRANSLATION_UNAVAILABLE -> "번역 서비스가 응답하지 않습니다.";
            case DESTINATION_UNRESOLVABLE -> "게시 채널을 찾을 수 없습니다.";
            case PERSISTENCE_FAILURE -> "설정을 저장하지 못했습니다.";
        };
    }
}
