package orion;

import com.google.common.eventbus.Subscribe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import orion.domain.status.ConnectionStateEvent;
import orion.domain.status.DeviceSnapshot;
import orion.domain.status.IStatusObserver;
import orion.domain.status.JobInfo;
import orion.domain.status.StatusView;

import java.util.Locale;

/**
 * Headless stand-in for the job screen: logs status changes and channel transitions
 * @author Orion team
 * @since 16/10/2026
 */
public class StatusConsoleReporter implements IStatusObserver {
    private static final Logger logger = LoggerFactory.getLogger(StatusConsoleReporter.class);

    private String lastLine;

    @Override
    public void onUpdate(StatusView view) {
        String line = describe(view);
        if (!line.equals(lastLine)) {
            lastLine = line;
            logger.info(line);
        }
        if (view.hasError()) {
            logger.debug("Last error: {}", view.getLastError());
        }
    }

    @Subscribe
    public void onConnectionStateChanged(ConnectionStateEvent event) {
        if (event.getNextStreamRetryAtMs() != null) {
            logger.info("Connection {} -> {} (stream retry at {})",
                    event.getPrevious(), event.getCurrent(), event.getNextStreamRetryAtMs());
        } else {
            logger.info("Connection {} -> {}", event.getPrevious(), event.getCurrent());
        }
    }

    static String describe(StatusView view) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(view.getConnectionState()).append("] ").append(view.displayLabel());

        DeviceSnapshot snapshot = view.getSnapshot();
        if (snapshot != null && snapshot.isActive()) {
            sb.append(String.format(Locale.ROOT, " %.1f%%", snapshot.getProgress() * 100));
            if (snapshot.getLayerIndex() != null && snapshot.getLayerCount() != null) {
                sb.append(" layer ").append(snapshot.getLayerIndex()).append('/').append(snapshot.getLayerCount());
            }
            sb.append(" elapsed ").append(snapshot.formattedElapsedTime());
        }
        JobInfo job = view.getEffectiveJob();
        if (job != null) {
            sb.append(" job=").append(job.name());
        }
        if (view.isAwaitingNewSession()) {
            sb.append(" (waiting for new session)");
        } else if (view.hasThumbnail()) {
            sb.append(" (thumbnail)");
        }
        return sb.toString();
    }
}
