package orion.domain.status;

/**
 * Caller supplied data shown while a fresh session waits for its first snapshot
 *
 * @param thumbnail preview image of the job being started, may be null
 * @param job       job being started, may be null
 * @author Orion team
 * @since 15/10/2026
 */
public record SessionHints(byte[] thumbnail, JobInfo job) {

    public static final SessionHints NONE = new SessionHints(null, null);

    public static SessionHints of(JobInfo job, byte[] thumbnail) {
        return new SessionHints(thumbnail != null ? thumbnail.clone() : null, job);
    }

    public boolean hasThumbnail() {
        return thumbnail != null && thumbnail.length > 0;
    }
}
