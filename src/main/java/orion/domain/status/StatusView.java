package orion.domain.status;

/**
 * Read-only view published to observers after each reconciliation
 * @author Orion team
 * @since 15/10/2026
 */
public final class StatusView {
    private final DeviceSnapshot snapshot;
    private final ConnectionState connectionState;
    private final boolean pausing;
    private final boolean canceling;
    private final boolean awaitingNewSession;
    private final byte[] thumbnail;
    private final boolean thumbnailReady;
    private final JobInfo hintedJob;
    private final String lastError;
    private final boolean loading;
    private final boolean initialAttemptInProgress;
    private final boolean everConnected;
    private final int consecutivePollErrors;
    private final Long nextPollRetryAtMs;
    private final Long nextStreamRetryAtMs;
    private final boolean minSpinnerActive;

    private StatusView(Builder b) {
        this.snapshot = b.snapshot;
        this.connectionState = b.connectionState;
        this.pausing = b.pausing;
        this.canceling = b.canceling;
        this.awaitingNewSession = b.awaitingNewSession;
        this.thumbnail = b.thumbnail;
        this.thumbnailReady = b.thumbnailReady;
        this.hintedJob = b.hintedJob;
        this.lastError = b.lastError;
        this.loading = b.loading;
        this.initialAttemptInProgress = b.initialAttemptInProgress;
        this.everConnected = b.everConnected;
        this.consecutivePollErrors = b.consecutivePollErrors;
        this.nextPollRetryAtMs = b.nextPollRetryAtMs;
        this.nextStreamRetryAtMs = b.nextStreamRetryAtMs;
        this.minSpinnerActive = b.minSpinnerActive;
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * Latest accepted snapshot, null before the first one of a session
     */
    public DeviceSnapshot getSnapshot() {
        return snapshot;
    }

    public ConnectionState getConnectionState() {
        return connectionState;
    }

    public boolean isPausing() {
        return pausing;
    }

    public boolean isCanceling() {
        return canceling;
    }

    public boolean isAwaitingNewSession() {
        return awaitingNewSession;
    }

    /**
     * Device reports an active job with metadata and its thumbnail attempt has settled
     */
    public boolean isNewSessionReady() {
        return snapshot != null && snapshot.isActive() && snapshot.hasJob() && thumbnailReady;
    }

    public byte[] getThumbnail() {
        return thumbnail != null ? thumbnail.clone() : null;
    }

    public boolean hasThumbnail() {
        return thumbnail != null;
    }

    public boolean isThumbnailReady() {
        return thumbnailReady;
    }

    public JobInfo getHintedJob() {
        return hintedJob;
    }

    /**
     * Job reported by the device, or the hinted one until the device reports any
     */
    public JobInfo getEffectiveJob() {
        if (snapshot != null && snapshot.hasJob()) {
            return snapshot.getJob();
        }
        return hintedJob;
    }

    public String getLastError() {
        return lastError;
    }

    public boolean hasError() {
        return lastError != null;
    }

    public boolean isLoading() {
        return loading;
    }

    public boolean isInitialAttemptInProgress() {
        return initialAttemptInProgress;
    }

    public boolean hasEverConnected() {
        return everConnected;
    }

    public int getConsecutivePollErrors() {
        return consecutivePollErrors;
    }

    public Long getNextPollRetryAtMs() {
        return nextPollRetryAtMs;
    }

    public Long getNextStreamRetryAtMs() {
        return nextStreamRetryAtMs;
    }

    public boolean isMinSpinnerActive() {
        return minSpinnerActive;
    }

    /**
     * Status text for the job screen; transitional flags win over the reported status
     */
    public String displayLabel() {
        if (snapshot == null) {
            return loading || awaitingNewSession ? "Loading" : "Unknown";
        }
        if (canceling && !snapshot.isCanceled()) return "Canceling";
        if (snapshot.isCanceled()) return "Canceled";
        if (pausing && !snapshot.isPaused()) return "Pausing";
        if (snapshot.isPaused()) return "Paused";
        if (snapshot.isFinished()) return "Finished";
        if (snapshot.isCuring()) return "Curing";
        return snapshot.getStatus().getLabel();
    }

    @Override
    public String toString() {
        return "StatusView{" +
                "label=" + displayLabel() +
                ", connection=" + connectionState +
                ", pausing=" + pausing +
                ", canceling=" + canceling +
                ", awaiting=" + awaitingNewSession +
                ", thumbnailReady=" + thumbnailReady +
                ", error=" + lastError +
                ", snapshot=" + snapshot +
                '}';
    }

    static final class Builder {
        private DeviceSnapshot snapshot;
        private ConnectionState connectionState = ConnectionState.DISCONNECTED;
        private boolean pausing;
        private boolean canceling;
        private boolean awaitingNewSession;
        private byte[] thumbnail;
        private boolean thumbnailReady;
        private JobInfo hintedJob;
        private String lastError;
        private boolean loading;
        private boolean initialAttemptInProgress;
        private boolean everConnected;
        private int consecutivePollErrors;
        private Long nextPollRetryAtMs;
        private Long nextStreamRetryAtMs;
        private boolean minSpinnerActive;

        Builder snapshot(DeviceSnapshot snapshot) {
            this.snapshot = snapshot;
            return this;
        }

        Builder connectionState(ConnectionState connectionState) {
            this.connectionState = connectionState;
            return this;
        }

        Builder transitional(boolean pausing, boolean canceling) {
            this.pausing = pausing;
            this.canceling = canceling;
            return this;
        }

        Builder awaitingNewSession(boolean awaitingNewSession) {
            this.awaitingNewSession = awaitingNewSession;
            return this;
        }

        Builder thumbnail(ThumbnailHandle handle) {
            this.thumbnail = handle.getBytes();
            this.thumbnailReady = handle.isReady();
            return this;
        }

        Builder hintedJob(JobInfo hintedJob) {
            this.hintedJob = hintedJob;
            return this;
        }

        Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        Builder loading(boolean loading, boolean initialAttemptInProgress) {
            this.loading = loading;
            this.initialAttemptInProgress = initialAttemptInProgress;
            return this;
        }

        Builder everConnected(boolean everConnected) {
            this.everConnected = everConnected;
            return this;
        }

        Builder pollErrors(int consecutivePollErrors, Long nextPollRetryAtMs) {
            this.consecutivePollErrors = consecutivePollErrors;
            this.nextPollRetryAtMs = nextPollRetryAtMs;
            return this;
        }

        Builder nextStreamRetryAtMs(Long nextStreamRetryAtMs) {
            this.nextStreamRetryAtMs = nextStreamRetryAtMs;
            return this;
        }

        Builder minSpinnerActive(boolean minSpinnerActive) {
            this.minSpinnerActive = minSpinnerActive;
            return this;
        }

        StatusView build() {
            return new StatusView(this);
        }
    }
}
