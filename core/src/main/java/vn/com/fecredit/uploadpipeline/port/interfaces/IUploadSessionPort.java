package vn.com.fecredit.uploadpipeline.port.interfaces;

import vn.com.fecredit.uploadpipeline.exception.DuplicateUploadException;
import vn.com.fecredit.uploadpipeline.model.SessionEvent;
import vn.com.fecredit.uploadpipeline.model.UploadStatus;
import vn.com.fecredit.uploadpipeline.model.interfaces.IUploadSession;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Port interface for persisting upload sessions.
 * This defines the contract that the core needs for session state,
 * regardless of the underlying storage technology.
 */
public interface IUploadSessionPort<T extends IUploadSession> {

    /**
     * Inserts a new session and appends its creation event.
     *
     * @param session      The new session, holding its slot key.
     * @param createdEvent The {@code CREATED} event to append.
     * @return The stored session, with its surrogate id assigned.
     * @throws DuplicateUploadException if another session holds the same slot key.
     */
    T create(T session, SessionEvent createdEvent);

    Optional<T> findBySessionId(String sessionId);

    /**
     * Compare-and-swap on the session status.
     *
     * <p>
     * Atomically: if the current status is in {@code expected}, set it to {@code target},
     * apply {@code changes} and append {@code event} (stamped with the observed status).
     * Nothing is written otherwise.
     *
     * @return {@code true} if this call committed the transition.
     */
    boolean transition(String sessionId, Set<UploadStatus> expected, UploadStatus target,
                       Consumer<T> changes, SessionEvent event);

    /**
     * Bumps {@code updatedAt} without changing the status, if the status is still in {@code expected}.
     *
     * @return {@code true} if the session was touched
     */
    boolean touch(String sessionId, Set<UploadStatus> expected, LocalDateTime at);

    /**
     * Keyset page of sessions in {@code statuses} created before {@code cutoff}, ordered by id.
     */
    List<T> findCreatedBefore(Set<UploadStatus> statuses, LocalDateTime cutoff, long afterId, int limit);

    /**
     * Keyset page of sessions in {@code statuses} last updated before {@code cutoff}, ordered by id.
     */
    List<T> findUpdatedBefore(Set<UploadStatus> statuses, LocalDateTime cutoff, long afterId, int limit);

    void delete(T session);
}
