package orion.domain.status;

/**
 * Result of a single refresh attempt
 * @author Orion team
 * @since 15/10/2026
 */
public enum RefreshOutcome {
    APPLIED,    // Snapshot fetched, parsed and reconciled
    FAILED,     // Fetch failed, previous snapshot retained
    DISCARDED,  // Device answered with an undecodable payload, update dropped
    SKIPPED     // Dropped by the re-entrancy guard or because the engine is disposed
}
