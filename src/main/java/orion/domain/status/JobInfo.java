package orion.domain.status;

import orion.common.SyncConstants;

/**
 * Metadata of the active job file
 *
 * @param name             file name shown to the user
 * @param path             path on the device, relative to the location root
 * @param locationCategory storage location (Local, Usb, ...), may be null
 * @author Orion team
 * @since 15/10/2026
 */
public record JobInfo(String name, String path, String locationCategory) {

    /**
     * Location used for side-channel requests, defaults to Local
     */
    public String effectiveLocation() {
        return locationCategory == null || locationCategory.isBlank()
                ? SyncConstants.DEFAULT_LOCATION_CATEGORY
                : locationCategory;
    }

    /**
     * Identity of the job for thumbnail bookkeeping
     */
    public String key() {
        return effectiveLocation() + ":" + path;
    }
}
