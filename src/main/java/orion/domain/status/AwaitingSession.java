package orion.domain.status;

/**
 * Readiness barrier installed by a session reset.
 * Resolves once the device reports an active job with metadata and its thumbnail is settled, or after a timeout.
 *
 * @author Orion team
 * @since 15/10/2026
 */
public class AwaitingSession {

    public enum EResolution {
        READY,
        TIMED_OUT
    }

    private final long startedAtMs;
    private final long timeoutMs;

    public AwaitingSession(long startedAtMs, long timeoutMs) {
        this.startedAtMs = startedAtMs;
        this.timeoutMs = timeoutMs;
    }

    public long getStartedAtMs() {
        return startedAtMs;
    }

    public long deadlineMs() {
        return startedAtMs + timeoutMs;
    }

    public boolean isTimedOut(long nowMs) {
        return nowMs - startedAtMs >= timeoutMs;
    }

    /**
     * @return how the barrier resolved, or null while it still holds
     */
    public EResolution evaluate(DeviceSnapshot snapshot, boolean thumbnailReady, long nowMs) {
        if (snapshot != null && snapshot.isActive() && snapshot.hasJob() && thumbnailReady) {
            return EResolution.READY;
        }
        if (isTimedOut(nowMs)) {
            return EResolution.TIMED_OUT;
        }
        return null;
    }

    @Override
    public String toString() {
        return "AwaitingSession{startedAt=" + startedAtMs + ", timeout=" + timeoutMs + "ms}";
    }
}
