package vn.com.fecredit.uploadpipeline.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle states of an upload session together with the single table of legal transitions.
 *
 * <p>
 * Happy path:
 * <pre>
 * PENDING → UPLOADING → ASSEMBLING → VIRUS_SCANNING → FINALIZING → COMPLETED
 * </pre>
 * {@code FAILED}, {@code VIRUS_SCAN_FAILED}, {@code FINALIZATION_FAILED}, {@code CANCELLED}
 * and {@code COMPLETED} are terminal.
 */
public enum UploadStatus {
    PENDING,
    UPLOADING,
    ASSEMBLING,
    VIRUS_SCANNING,
    FINALIZING,
    COMPLETED,
    FAILED,
    VIRUS_SCAN_FAILED,
    FINALIZATION_FAILED,
    CANCELLED;

    private static final Map<UploadStatus, Set<UploadStatus>> TRANSITIONS = new EnumMap<>(UploadStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(UPLOADING, ASSEMBLING, FAILED, CANCELLED));
        TRANSITIONS.put(UPLOADING, EnumSet.of(ASSEMBLING, FAILED, CANCELLED));
        TRANSITIONS.put(ASSEMBLING, EnumSet.of(VIRUS_SCANNING, FAILED, CANCELLED));
        TRANSITIONS.put(VIRUS_SCANNING, EnumSet.of(FINALIZING, VIRUS_SCAN_FAILED, CANCELLED));
        TRANSITIONS.put(FINALIZING, EnumSet.of(COMPLETED, FINALIZATION_FAILED));
        for (UploadStatus status : values()) {
            TRANSITIONS.putIfAbsent(status, EnumSet.noneOf(UploadStatus.class));
        }
    }

    /**
     * @return {@code true} if moving from this state to {@code target} is a legal transition
     */
    public boolean canTransitionTo(UploadStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    public Set<UploadStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * Non-terminal sessions keep their (workspace, container, filename) slot reserved.
     */
    public boolean holdsFilenameSlot() {
        return !isTerminal();
    }

    public boolean acceptsChunks() {
        return this == PENDING || this == UPLOADING;
    }

    public boolean isFailure() {
        return this == FAILED || this == VIRUS_SCAN_FAILED || this == FINALIZATION_FAILED;
    }

    /**
     * Lower-case wire value, e.g. {@code virus_scanning}.
     */
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static UploadStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Upload status must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
