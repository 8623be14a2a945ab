package vn.com.fecredit.uploadpipeline.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadata view of a session rebuilt by folding its event log in order.
 *
 * <p>
 * The view starts from the client metadata supplied at creation and layers on:
 * <ul>
 * <li>{@code virus_scan}: attributes of the latest {@link SessionEventType#VIRUS_SCAN} event</li>
 * <li>{@code finalization}: attributes of the latest {@link SessionEventType#FINALIZATION} event</li>
 * <li>{@code error_message}: message of the latest transition into a failure state</li>
 * </ul>
 */
public final class SessionMetadataView {

    public static final String VIRUS_SCAN = "virus_scan";
    public static final String FINALIZATION = "finalization";
    public static final String ERROR_MESSAGE = "error_message";

    private final Map<String, Object> values;

    private SessionMetadataView(Map<String, Object> values) {
        this.values = values;
    }

    public static SessionMetadataView fold(Map<String, Object> creationMetadata, List<SessionEvent> events) {
        Map<String, Object> view = new LinkedHashMap<>();
        if (creationMetadata != null) {
            view.putAll(creationMetadata);
        }
        for (SessionEvent event : events) {
            switch (event.getType()) {
                case VIRUS_SCAN:
                    view.put(VIRUS_SCAN, event.getAttributes());
                    break;
                case FINALIZATION:
                    view.put(FINALIZATION, event.getAttributes());
                    break;
                default:
                    break;
            }
            if (event.getMessage() != null && event.getToStatus() != null && event.getToStatus().isFailure()) {
                view.put(ERROR_MESSAGE, event.getMessage());
            }
        }
        return new SessionMetadataView(Collections.unmodifiableMap(view));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getVirusScan() {
        Object scan = values.get(VIRUS_SCAN);
        return scan instanceof Map ? (Map<String, Object>) scan : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getFinalization() {
        Object finalization = values.get(FINALIZATION);
        return finalization instanceof Map ? (Map<String, Object>) finalization : null;
    }

    public String getErrorMessage() {
        Object message = values.get(ERROR_MESSAGE);
        return message != null ? message.toString() : null;
    }
}
