package vn.com.fecredit.uploadpipeline.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row of the append-only session event log.
 */
@Entity
@Table(name = "upload_session_event", indexes = @Index(name = "idx_session_event_session", columnList = "session_id"))
@Data
@NoArgsConstructor
public class SessionEventRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, length = 36)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 32)
    private SessionEventType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", length = 32)
    private UploadStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", length = 32)
    private UploadStatus toStatus;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 8192)
    private Map<String, Object> attributes = new LinkedHashMap<>();

    @Column(length = 2048)
    private String message;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;

    public static SessionEventRecord fromEvent(SessionEvent event) {
        SessionEventRecord record = new SessionEventRecord();
        record.setSessionId(event.getSessionId());
        record.setType(event.getType());
        record.setFromStatus(event.getFromStatus());
        record.setToStatus(event.getToStatus());
        record.setAttributes(new LinkedHashMap<>(event.getAttributes()));
        record.setMessage(truncate(event.getMessage()));
        record.setOccurredAt(event.getOccurredAt());
        return record;
    }

    public SessionEvent toEvent() {
        return new SessionEvent(sessionId, type, fromStatus, toStatus, attributes, message, occurredAt);
    }

    private static String truncate(String message) {
        return message != null && message.length() > 2048 ? message.substring(0, 2048) : message;
    }
}
