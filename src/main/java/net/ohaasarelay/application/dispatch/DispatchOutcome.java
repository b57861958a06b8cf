package net.ohaasarelay.application.dispatch;

import jakarta.annotation.Nullable;
import net.ohaasarelay.exception.DailyContentException.ErrorCode;

/**
 * Result of one guild dispatch.
 *
 * @param errorCode failure category, null when published or when the failure was unclassified
 * @param detail short human-readable reason for failures
 */
public record DispatchOutcome(
    long guildId,
    DispatchTrigger trigger,
    Status status,
    @Nullable ErrorCode errorCode,
    @Nullable String detail
) {

    public enum Status {
        PUBLISHED,
        FAILED,
        REJECTED
    }

    public static DispatchOutcome published(long guildId, DispatchTrigger trigger) {
        return new DispatchOutcome(guildId, trigger, Status.PUBLISHED, null, null);
    }

    public static DispatchOutcome failed(long guildId, DispatchTrigger trigger, @Nullable ErrorCode errorCode, String detail) {
        return new DispatchOutcome(guildId, trigger, Status.FAILED, errorCode, detail);
    }

    public static DispatchOutcome rejected(long guildId, DispatchTrigger trigger, String detail) {
        return new DispatchOutcome(guildId, trigger, Status.REJECTED, null, detail);
    }

    public boolean isPublished() {
        return status == Status.PUBLISHED;
    }

    /**
     * True when the dispatch never started because the executor refused it.
     */
    public boolean isRejected() {
        return status == Status.REJECTED;
    }
}
