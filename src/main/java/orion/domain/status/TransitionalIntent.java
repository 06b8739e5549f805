package orion.domain.status;

/**
 * Optimistic pause/cancel flags asserted by the client between issuing a command and the device confirming it.
 * Flags are only ever cleared by a confirming snapshot, a failed pause/resume command or a session reset.
 *
 * @author Orion team
 * @since 15/10/2026
 */
public class TransitionalIntent {

    public enum EPauseTarget {
        PAUSE,
        RESUME
    }

    private EPauseTarget pauseTarget;
    private boolean canceling;

    public boolean isPausing() {
        return pauseTarget != null;
    }

    public EPauseTarget getPauseTarget() {
        return pauseTarget;
    }

    public boolean isCanceling() {
        return canceling;
    }

    public void beginPause(EPauseTarget target) {
        this.pauseTarget = target;
    }

    /**
     * Pause or resume command failed
     */
    public void revertPause() {
        this.pauseTarget = null;
    }

    public void beginCancel() {
        this.canceling = true;
    }

    public void clear() {
        this.pauseTarget = null;
        this.canceling = false;
    }

    /**
     * Merge an incoming snapshot. Device-side latches raise the flags, confirming statuses clear them.
     * @return true when a flag changed
     */
    public boolean merge(DeviceSnapshot snapshot) {
        boolean wasPausing = isPausing();
        boolean wasCanceling = canceling;

        if (snapshot.isCancelLatched() && !snapshot.isIdle() && !snapshot.isCanceled()) {
            canceling = true;
        } else if (canceling && (snapshot.isCanceled() || snapshot.isIdle() || snapshot.isFinished())) {
            canceling = false;
        }

        if (snapshot.isPauseLatched()) {
            if (pauseTarget == null) {
                pauseTarget = EPauseTarget.PAUSE;
            }
        } else if (pauseTarget == EPauseTarget.PAUSE && (snapshot.isPaused() || !snapshot.isActive())) {
            pauseTarget = null;
        } else if (pauseTarget == EPauseTarget.RESUME && !snapshot.isPaused()) {
            pauseTarget = null;
        }

        return wasPausing != isPausing() || wasCanceling != canceling;
    }

    @Override
    public String toString() {
        return "TransitionalIntent{pausing=" + pauseTarget + ", canceling=" + canceling + "}";
    }
}
