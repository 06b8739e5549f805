package orion.domain.status;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable state of the job preview image for the current session
 * @author Orion team
 * @since 15/10/2026
 */
public final class ThumbnailHandle {

    public enum EState {
        UNRESOLVED,
        RESOLVING,
        READY
    }

    private static final ThumbnailHandle UNRESOLVED = new ThumbnailHandle(EState.UNRESOLVED, null, null);

    private final EState state;
    private final String jobKey;
    private final byte[] bytes;

    private ThumbnailHandle(EState state, String jobKey, byte[] bytes) {
        this.state = state;
        this.jobKey = jobKey;
        this.bytes = bytes;
    }

    public static ThumbnailHandle unresolved() {
        return UNRESOLVED;
    }

    public static ThumbnailHandle resolving(String jobKey) {
        return new ThumbnailHandle(EState.RESOLVING, jobKey, null);
    }

    /**
     * @param bytes image data; null or empty means the job has no preview
     */
    public static ThumbnailHandle ready(String jobKey, byte[] bytes) {
        byte[] image = bytes != null && bytes.length > 0 ? bytes.clone() : null;
        return new ThumbnailHandle(EState.READY, jobKey, image);
    }

    public EState getState() {
        return state;
    }

    public boolean isUnresolved() {
        return state == EState.UNRESOLVED;
    }

    public boolean isReady() {
        return state == EState.READY;
    }

    /**
     * Job the handle belongs to, null when seeded without a job hint
     */
    public String getJobKey() {
        return jobKey;
    }

    public boolean hasImage() {
        return bytes != null;
    }

    public byte[] getBytes() {
        return bytes != null ? bytes.clone() : null;
    }

    @Override
    public String toString() {
        return "ThumbnailHandle{" + state + ", job=" + jobKey + ", bytes=" + (bytes != null ? bytes.length : 0) + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ThumbnailHandle that = (ThumbnailHandle) o;
        return state == that.state && Objects.equals(jobKey, that.jobKey) && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(state, jobKey);
        return 31 * result + Arrays.hashCode(bytes);
    }
}
