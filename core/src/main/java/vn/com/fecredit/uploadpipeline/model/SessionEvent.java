package vn.com.fecredit.uploadpipeline.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable entry of a session's append-only event log.
 *
 * <p>
 * Every status transition appends exactly one event in the same atomic unit as the
 * status change. {@link SessionMetadataView} folds the log back into the metadata
 * view callers see.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SessionEvent {

    private final String sessionId;
    private final SessionEventType type;
    /** Status observed before the transition; {@code null} for events without a status change. */
    private final UploadStatus fromStatus;
    /** Status committed by the transition; {@code null} for events without a status change. */
    private final UploadStatus toStatus;
    private final Map<String, Object> attributes;
    /** Error message carried by failure transitions. */
    private final String message;
    private final LocalDateTime occurredAt;

    public SessionEvent(String sessionId, SessionEventType type, UploadStatus fromStatus, UploadStatus toStatus,
                        Map<String, Object> attributes, String message, LocalDateTime occurredAt) {
        if (sessionId == null || type == null || occurredAt == null) {
            throw new IllegalArgumentException("sessionId, type and occurredAt are required");
        }
        this.sessionId = sessionId;
        this.type = type;
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
        this.attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.message = message;
        this.occurredAt = occurredAt;
    }

    public static SessionEvent of(String sessionId, SessionEventType type, UploadStatus toStatus,
                                  Map<String, Object> attributes, String message, LocalDateTime occurredAt) {
        return new SessionEvent(sessionId, type, null, toStatus, attributes, message, occurredAt);
    }

    /**
     * Copy of this event stamped with the status the transition moved away from.
     */
    public SessionEvent withFromStatus(UploadStatus from) {
        return new SessionEvent(sessionId, type, from, toStatus, attributes, message, occurredAt);
    }
}
