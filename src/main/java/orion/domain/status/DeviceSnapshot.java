package orion.domain.status;

import java.util.Objects;

/**
 * One immutable observation of the remote printer state.
 * Derived status booleans are computed once, here, from {@link #getStatus()}.
 * @author Orion team
 * @since 15/10/2026
 */
public final class DeviceSnapshot {
    private final DeviceStatus status;
    private final double progress;
    private final Integer layerIndex;
    private final Integer layerCount;
    private final long elapsedSeconds;
    private final double zPosition;
    private final double usedMaterialMl;
    private final JobInfo job;

    private final boolean curing;
    private final boolean pauseLatched;
    private final boolean cancelLatched;
    private final boolean finishedHint;
    private final String deviceStatusMessage;
    private final Double prevLayerSeconds;
    private final Integer resinTemperature;
    private final Double cpuTemperature;

    private final boolean printing;
    private final boolean paused;
    private final boolean canceled;
    private final boolean idle;

    private DeviceSnapshot(Builder b) {
        this.status = Objects.requireNonNull(b.status, "status");
        this.progress = clampProgress(b.progress);
        this.layerIndex = b.layerIndex;
        this.layerCount = b.layerCount;
        this.elapsedSeconds = Math.max(0, b.elapsedSeconds);
        this.zPosition = b.zPosition;
        this.usedMaterialMl = b.usedMaterialMl;
        this.job = b.job;
        this.curing = b.curing;
        this.pauseLatched = b.pauseLatched;
        this.cancelLatched = b.cancelLatched;
        this.finishedHint = b.finishedHint;
        this.deviceStatusMessage = b.deviceStatusMessage;
        this.prevLayerSeconds = b.prevLayerSeconds;
        this.resinTemperature = b.resinTemperature;
        this.cpuTemperature = b.cpuTemperature;

        this.printing = status == DeviceStatus.PRINTING;
        this.paused = status == DeviceStatus.PAUSED;
        this.canceled = status == DeviceStatus.CANCELED;
        this.idle = status == DeviceStatus.IDLE;
    }

    public static Builder builder(DeviceStatus status) {
        return new Builder(status);
    }

    static double clampProgress(double raw) {
        if (Double.isNaN(raw) || raw < 0.0) {
            return 0.0;
        }
        return Math.min(raw, 1.0);
    }

    public DeviceStatus getStatus() {
        return status;
    }

    /**
     * Job progress, always within [0.0, 1.0]
     */
    public double getProgress() {
        return progress;
    }

    public Integer getLayerIndex() {
        return layerIndex;
    }

    public Integer getLayerCount() {
        return layerCount;
    }

    public long getElapsedSeconds() {
        return elapsedSeconds;
    }

    public double getZPosition() {
        return zPosition;
    }

    public double getUsedMaterialMl() {
        return usedMaterialMl;
    }

    public JobInfo getJob() {
        return job;
    }

    public boolean hasJob() {
        return job != null;
    }

    public boolean isCuring() {
        return curing;
    }

    public boolean isPauseLatched() {
        return pauseLatched;
    }

    public boolean isCancelLatched() {
        return cancelLatched;
    }

    public String getDeviceStatusMessage() {
        return deviceStatusMessage;
    }

    public Double getPrevLayerSeconds() {
        return prevLayerSeconds;
    }

    public Integer getResinTemperature() {
        return resinTemperature;
    }

    public Double getCpuTemperature() {
        return cpuTemperature;
    }

    public boolean isPrinting() {
        return printing;
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isCanceled() {
        return canceled;
    }

    public boolean isIdle() {
        return idle;
    }

    /**
     * Printing or paused
     */
    public boolean isActive() {
        return printing || paused;
    }

    /**
     * Idle snapshot still carrying layer data of the last job, or an explicit finished hint
     */
    public boolean isFinished() {
        return (idle && layerIndex != null) || finishedHint;
    }

    public String formattedElapsedTime() {
        long hours = elapsedSeconds / 3600;
        long minutes = (elapsedSeconds % 3600) / 60;
        long seconds = elapsedSeconds % 60;
        return String.format("%02d:%02d:%02d", hours, minutes, seconds);
    }

    @Override
    public String toString() {
        return String.format("DeviceSnapshot{status=%s, layer=%s/%s, progress=%.3f, z=%.3f, job=%s}",
                status, layerIndex, layerCount, progress, zPosition, job != null ? job.path() : null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeviceSnapshot that = (DeviceSnapshot) o;
        return Double.compare(that.progress, progress) == 0 &&
                elapsedSeconds == that.elapsedSeconds &&
                Double.compare(that.zPosition, zPosition) == 0 &&
                Double.compare(that.usedMaterialMl, usedMaterialMl) == 0 &&
                curing == that.curing &&
                pauseLatched == that.pauseLatched &&
                cancelLatched == that.cancelLatched &&
                finishedHint == that.finishedHint &&
                status == that.status &&
                Objects.equals(layerIndex, that.layerIndex) &&
                Objects.equals(layerCount, that.layerCount) &&
                Objects.equals(job, that.job) &&
                Objects.equals(deviceStatusMessage, that.deviceStatusMessage) &&
                Objects.equals(prevLayerSeconds, that.prevLayerSeconds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, progress, layerIndex, layerCount, elapsedSeconds, zPosition, usedMaterialMl, job,
                curing, pauseLatched, cancelLatched, finishedHint, deviceStatusMessage, prevLayerSeconds);
    }

    public static final class Builder {
        private final DeviceStatus status;
        private double progress;
        private Integer layerIndex;
        private Integer layerCount;
        private long elapsedSeconds;
        private double zPosition;
        private double usedMaterialMl;
        private JobInfo job;
        private boolean curing;
        private boolean pauseLatched;
        private boolean cancelLatched;
        private boolean finishedHint;
        private String deviceStatusMessage;
        private Double prevLayerSeconds;
        private Integer resinTemperature;
        private Double cpuTemperature;

        private Builder(DeviceStatus status) {
            this.status = status;
        }

        public Builder progress(double progress) {
            this.progress = progress;
            return this;
        }

        public Builder layer(Integer layerIndex, Integer layerCount) {
            this.layerIndex = layerIndex;
            this.layerCount = layerCount;
            return this;
        }

        public Builder elapsedSeconds(long elapsedSeconds) {
            this.elapsedSeconds = elapsedSeconds;
            return this;
        }

        public Builder zPosition(double zPosition) {
            this.zPosition = zPosition;
            return this;
        }

        public Builder usedMaterialMl(double usedMaterialMl) {
            this.usedMaterialMl = usedMaterialMl;
            return this;
        }

        public Builder job(JobInfo job) {
            this.job = job;
            return this;
        }

        public Builder curing(boolean curing) {
            this.curing = curing;
            return this;
        }

        public Builder pauseLatched(boolean pauseLatched) {
            this.pauseLatched = pauseLatched;
            return this;
        }

        public Builder cancelLatched(boolean cancelLatched) {
            this.cancelLatched = cancelLatched;
            return this;
        }

        public Builder finishedHint(boolean finishedHint) {
            this.finishedHint = finishedHint;
            return this;
        }

        public Builder deviceStatusMessage(String deviceStatusMessage) {
            this.deviceStatusMessage = deviceStatusMessage;
            return this;
        }

        public Builder prevLayerSeconds(Double prevLayerSeconds) {
            this.prevLayerSeconds = prevLayerSeconds;
            return this;
        }

        public Builder resinTemperature(Integer resinTemperature) {
            this.resinTemperature = resinTemperature;
            return this;
        }

        public Builder cpuTemperature(Double cpuTemperature) {
            this.cpuTemperature = cpuTemperature;
            return this;
        }

        public DeviceSnapshot build() {
            return new DeviceSnapshot(this);
        }
    }
}
