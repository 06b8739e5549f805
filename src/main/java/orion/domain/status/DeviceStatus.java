package orion.domain.status;

/**
 * Canonical job status reported by the device
 * @author Orion team
 * @since 15/10/2026
 */
public enum DeviceStatus {
    IDLE("Idle"),
    PRINTING("Printing"),
    PAUSED("Paused"),
    CANCELED("Canceled");

    private final String label;

    DeviceStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
