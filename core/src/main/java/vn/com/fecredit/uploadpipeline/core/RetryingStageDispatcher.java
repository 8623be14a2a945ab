package vn.com.fecredit.uploadpipeline.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs stages on a scheduled executor, retrying transient failures with backoff.
 */
public class RetryingStageDispatcher implements StageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RetryingStageDispatcher.class);

    private final ScheduledExecutorService executor;
    private final RetryPolicy retryPolicy;

    public RetryingStageDispatcher(ScheduledExecutorService executor, RetryPolicy retryPolicy) {
        this.executor = executor;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public void dispatch(StageTask task) {
        log.debug("Dispatching {} for session {}", task.name(), task.sessionId());
        schedule(task, 1, Duration.ZERO);
    }

    private void schedule(StageTask task, int attempt, Duration delay) {
        executor.schedule(() -> runAttempt(task, attempt), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    void runAttempt(StageTask task, int attempt) {
        try {
            task.execute();
            log.debug("{} for session {} succeeded on attempt {}", task.name(), task.sessionId(), attempt);
        } catch (RuntimeException e) {
            if (retryPolicy.shouldRetry(e, attempt)) {
                Duration delay = retryPolicy.backoff(attempt);
                log.warn("{} for session {} failed on attempt {}/{}, retrying in {} ms: {}", task.name(),
                        task.sessionId(), attempt, retryPolicy.getMaxAttempts(), delay.toMillis(), e.getMessage());
                schedule(task, attempt + 1, delay);
            } else {
                log.error("{} for session {} failed after {} attempt(s): {}", task.name(), task.sessionId(),
                        attempt, e.getMessage(), e);
                fail(task, e);
            }
        }
    }

    static void fail(StageTask task, RuntimeException lastError) {
        try {
            task.onFailure(lastError);
        } catch (RuntimeException e) {
            log.error("Failure handling of {} for session {} failed", task.name(), task.sessionId(), e);
        }
    }
}
